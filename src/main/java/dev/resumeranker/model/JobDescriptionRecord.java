package dev.resumeranker.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class JobDescriptionRecord {
    String jobId; // SHA-256 of normalized text
    String title;
    String rawText;
    String normalizedText;

    Set<String> requirementTerms; // every vocabulary term found in the description
    Set<String> requiredTerms;    // subset flagged as mandatory
    Set<String> preferredTerms;   // subset flagged as nice-to-have
}
