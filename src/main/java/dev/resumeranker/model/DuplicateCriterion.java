package dev.resumeranker.model;

/**
 * Which signal decided the overall similarity of a resume pair.
 */
public enum DuplicateCriterion {
    CONTENT,
    CONTACT,
    BLEND
}
