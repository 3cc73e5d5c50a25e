package dev.resumeranker.ai;

import java.util.List;

/**
 * In-depth AI review of a single candidate, requested on demand rather than for every resume of a batch.
 *
 * @param score           match score in [0,1]
 * @param summary         short overall verdict
 * @param strengths       points in the candidate's favour
 * @param concerns        gaps or red flags
 * @param interviewFocus  topics to dig into during an interview
 * @param growthPotential free-text assessment of how the candidate could grow into the role
 */
public record DetailedAnalysis(
        double score,
        String summary,
        List<String> strengths,
        List<String> concerns,
        List<String> interviewFocus,
        String growthPotential) {

    public DetailedAnalysis {
        summary = summary == null ? "" : summary;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        interviewFocus = interviewFocus == null ? List.of() : List.copyOf(interviewFocus);
        growthPotential = growthPotential == null ? "" : growthPotential;
    }
}
