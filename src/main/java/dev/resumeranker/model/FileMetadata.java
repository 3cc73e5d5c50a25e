package dev.resumeranker.model;

import java.time.Instant;

/**
 * Metadata of an uploaded resume file, as handed over by the ingestion layer.
 */
public record FileMetadata(String fileName, long sizeBytes, Instant uploadedAt) {

    public static FileMetadata of(String fileName, Instant uploadedAt) {
        return new FileMetadata(fileName, 0L, uploadedAt);
    }
}
