package dev.resumeranker.ai;

import java.util.List;

/**
 * Judgment returned by an AI provider for one resume against one job.
 *
 * @param score      sub-score in [0,1]
 * @param rationale  free-text explanation
 * @param strengths  points in the candidate's favour
 * @param concerns   gaps or red flags
 */
public record AiAssessment(double score, String rationale, List<String> strengths, List<String> concerns) {

    public AiAssessment {
        rationale = rationale == null ? "" : rationale;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
    }
}
