package dev.resumeranker.store;

import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of match results, content-addressed by {@link ResultKey}.
 * Results are never updated in place: every change is a new revision.
 */
public interface ResultStore {

    /**
     * Latest revision for a key.
     */
    Optional<MatchResult> findLatest(ResultKey key);

    /**
     * All revisions for a key, oldest first.
     */
    List<MatchResult> history(ResultKey key);

    /**
     * Append a result as the next revision of its key.
     *
     * @return the stored result, carrying its assigned revision (starting at 1)
     */
    MatchResult append(MatchResult result);

    /**
     * Replace the duplicate clusters recorded for a job description.
     */
    void saveClusters(String jobId, List<DuplicateCluster> clusters);

    List<DuplicateCluster> findClusters(String jobId);
}
