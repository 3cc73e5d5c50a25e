package dev.resumeranker.model;

/**
 * Read-only view of one candidate in a ranking, as consumed by export and presentation layers.
 *
 * @param rank        1-based rank among non-suppressed candidates, null when suppressed or failed
 * @param resume      the resume record
 * @param result      the match result, null when scoring failed
 * @param status      per-resume outcome
 * @param suppressed  true when another resume of the same duplicate cluster survived
 * @param duplicateOf submission id of the survivor when suppressed
 * @param error       failure message when status is FAILED
 */
public record RankedCandidate(
        Integer rank,
        ResumeRecord resume,
        MatchResult result,
        ResultStatus status,
        boolean suppressed,
        String duplicateOf,
        String error) {

    public double compositeScore() {
        return result != null ? result.getCompositeScore() : 0.0;
    }
}
