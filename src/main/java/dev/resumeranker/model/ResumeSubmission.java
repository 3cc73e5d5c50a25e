package dev.resumeranker.model;

/**
 * Plain extracted text of an uploaded resume, as delivered by the ingestion layer.
 */
public record ResumeSubmission(String submissionId, String rawText, FileMetadata metadata) {
}
