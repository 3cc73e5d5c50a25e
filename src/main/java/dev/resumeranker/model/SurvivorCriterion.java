package dev.resumeranker.model;

/**
 * Ordered tie-break criteria used to pick the survivor of a duplicate cluster.
 */
public enum SurvivorCriterion {
    /** Highest composite score wins. */
    SCORE,
    /** Most populated contact fields win. */
    CONTACT_COMPLETENESS,
    /** Earliest upload wins. */
    UPLOAD_TIME
}
