package dev.resumeranker.model;

/**
 * Non-fatal extraction problems surfaced on a {@link ResumeRecord}.
 */
public enum ExtractionWarning {
    EMPTY_TEXT,
    NAME_NOT_FOUND,
    EMAIL_NOT_FOUND,
    PHONE_NOT_FOUND,
    NO_SKILLS_FOUND,
    CONTACT_EXTRACTION_FAILED,
    SKILL_EXTRACTION_FAILED
}
