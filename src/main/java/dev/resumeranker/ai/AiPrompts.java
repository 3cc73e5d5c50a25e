package dev.resumeranker.ai;

import dev.resumeranker.config.AiConfig;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;

import java.util.TreeSet;

/**
 * Prompts shared by the chat-style providers.
 */
final class AiPrompts {

    static final String SYSTEM = "You are an expert technical recruiter. "
            + "You evaluate how well a resume matches a job description and answer only with JSON.";

    private AiPrompts() {
    }

    static String matchPrompt(ResumeRecord resume, JobDescriptionRecord job, AiConfig aiConfig) {
        return String.format("""
                Evaluate the resume below against the job description.

                Job description:
                %s

                Resume:
                %s

                Respond strictly with a JSON object in this format:
                {"score": <number between 0 and 1>, "rationale": "<two sentences>", \
                "strengths": ["..."], "concerns": ["..."]}
                """,
                truncate(job.getRawText(), aiConfig.getMaxJobChars()),
                truncate(resume.getRawText(), aiConfig.getMaxResumeChars()));
    }

    static String detailedPrompt(ResumeRecord resume, JobDescriptionRecord job, AiConfig aiConfig) {
        String skills = resume.getSkills() == null || resume.getSkills().isEmpty()
                ? "Not specified"
                : String.join(", ", new TreeSet<>(resume.getSkills()));
        return String.format("""
                Job description:
                %s

                Candidate: %s
                Skills: %s

                Resume:
                %s

                Give a detailed analysis of this candidate for the role: an overall match score, \
                key strengths, concerns or gaps, recommended interview focus areas and an assessment \
                of growth potential.

                Respond strictly with a JSON object in this format:
                {"score": <number between 0 and 1>, "summary": "<two sentences>", \
                "strengths": ["..."], "concerns": ["..."], "interview_focus": ["..."], \
                "growth_potential": "<one or two sentences>"}
                """,
                truncate(job.getRawText(), aiConfig.getMaxJobChars()),
                resume.getDisplayName(),
                skills,
                truncate(resume.getRawText(), aiConfig.getMaxResumeChars()));
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
