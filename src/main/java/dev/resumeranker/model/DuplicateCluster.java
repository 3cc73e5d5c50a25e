package dev.resumeranker.model;

import java.util.List;

/**
 * Resumes judged mutually similar, with exactly one survivor.
 * Singleton clusters carry no pairs.
 */
public record DuplicateCluster(
        String jobId,
        List<String> memberIds,
        List<String> memberFingerprints,
        String survivorId,
        List<PairSimilarity> pairs,
        String survivorRationale) {

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }

    public int size() {
        return memberIds.size();
    }
}
