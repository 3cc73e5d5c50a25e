package dev.resumeranker.model;

/**
 * Outcome of the scoring phase for one resume, before duplicate detection.
 */
public record ScoredCandidate(ResumeRecord resume, MatchResult result, ResultStatus status, String error) {

    public static ScoredCandidate of(ResumeRecord resume, MatchResult result, ResultStatus status) {
        return new ScoredCandidate(resume, result, status, null);
    }

    public static ScoredCandidate failed(ResumeRecord resume, String error) {
        return new ScoredCandidate(resume, null, ResultStatus.FAILED, error);
    }

    public double compositeScore() {
        return result != null ? result.getCompositeScore() : -1.0;
    }
}
