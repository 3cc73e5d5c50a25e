package dev.resumeranker.model;

public enum ResultStatus {
    /** Freshly computed with every enabled signal. */
    SCORED,
    /** Locked result from an earlier run, returned unchanged. */
    REUSED,
    /** Freshly computed but semantic or AI signal was missing. */
    DEGRADED,
    /** Scoring failed for this resume; the rest of the batch is unaffected. */
    FAILED
}
