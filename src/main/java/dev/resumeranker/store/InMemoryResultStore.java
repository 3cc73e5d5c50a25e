package dev.resumeranker.store;

import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local result store, for tests and throwaway sessions.
 */
@Component
@ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
public class InMemoryResultStore implements ResultStore {

    private final Map<ResultKey, List<MatchResult>> results = new ConcurrentHashMap<>();
    private final Map<String, List<DuplicateCluster>> clusters = new ConcurrentHashMap<>();

    @Override
    public Optional<MatchResult> findLatest(ResultKey key) {
        List<MatchResult> revisions = results.get(key);
        if (revisions == null) {
            return Optional.empty();
        }
        synchronized (revisions) {
            return revisions.isEmpty() ? Optional.empty() : Optional.of(revisions.get(revisions.size() - 1));
        }
    }

    @Override
    public List<MatchResult> history(ResultKey key) {
        List<MatchResult> revisions = results.get(key);
        if (revisions == null) {
            return List.of();
        }
        synchronized (revisions) {
            return List.copyOf(revisions);
        }
    }

    @Override
    public MatchResult append(MatchResult result) {
        List<MatchResult> revisions = results.computeIfAbsent(result.getKey(), k -> new ArrayList<>());
        synchronized (revisions) {
            MatchResult stored = result.toBuilder().revision(revisions.size() + 1).build();
            revisions.add(stored);
            return stored;
        }
    }

    @Override
    public void saveClusters(String jobId, List<DuplicateCluster> jobClusters) {
        clusters.put(jobId, List.copyOf(jobClusters));
    }

    @Override
    public List<DuplicateCluster> findClusters(String jobId) {
        return clusters.getOrDefault(jobId, List.of());
    }
}
