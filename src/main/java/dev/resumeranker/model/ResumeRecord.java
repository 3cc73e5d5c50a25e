package dev.resumeranker.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

@Data
@Builder
public class ResumeRecord {
    private String submissionId;
    private String fingerprint; // SHA-256 of normalized text
    private String rawText;
    private String normalizedText;

    // Extracted features
    private ContactInfo contact;
    private Set<String> skills;         // exact and stemmed vocabulary matches
    private Set<String> partialSkills;  // matched only through stemming
    private List<ExtractionWarning> warnings;

    private FileMetadata metadata;

    // Duplicate suppression, set by DuplicateDetectionService
    private boolean suppressed;
    private String duplicateOf;

    public boolean isExtractionDegraded() {
        return warnings != null && !warnings.isEmpty();
    }

    public String getDisplayName() {
        if (contact != null && contact.hasName()) {
            return contact.name();
        }
        if (metadata != null && metadata.fileName() != null) {
            return metadata.fileName();
        }
        return submissionId;
    }
}
