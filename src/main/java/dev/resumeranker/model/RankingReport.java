package dev.resumeranker.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one ranking batch.
 *
 * @param candidates every candidate, ranked ones first in rank order
 * @param shortlist  ranked candidates that pass the configured top-N and minimum score cut
 */
public record RankingReport(
        String jobId,
        List<RankedCandidate> candidates,
        List<RankedCandidate> shortlist,
        List<DuplicateCluster> clusters,
        Instant startedAt,
        Instant completedAt) {

    public List<RankedCandidate> survivors() {
        return candidates.stream()
                .filter(c -> !c.suppressed() && c.status() != ResultStatus.FAILED)
                .toList();
    }

    public List<RankedCandidate> suppressed() {
        return candidates.stream().filter(RankedCandidate::suppressed).toList();
    }

    public long duplicateClusterCount() {
        return clusters.stream().filter(c -> !c.isSingleton()).count();
    }
}
