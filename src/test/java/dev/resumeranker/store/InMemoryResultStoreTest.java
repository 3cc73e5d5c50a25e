package dev.resumeranker.store;

import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryResultStoreTest {

    private static final ResultKey KEY = new ResultKey("fp1", "job1");

    private InMemoryResultStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryResultStore();
    }

    private static MatchResult result(double composite) {
        return MatchResult.builder()
                .key(KEY)
                .compositeScore(composite)
                .strengths(List.of())
                .concerns(List.of())
                .computedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should return nothing for an unknown key")
    void shouldReturnEmptyForUnknownKey() {
        assertThat(store.findLatest(KEY)).isEmpty();
        assertThat(store.history(KEY)).isEmpty();
    }

    @Test
    @DisplayName("Should assign increasing revisions starting at one")
    void shouldAssignRevisions() {
        MatchResult first = store.append(result(0.5));
        MatchResult second = store.append(result(0.6));

        assertThat(first.getRevision()).isEqualTo(1);
        assertThat(second.getRevision()).isEqualTo(2);
        assertThat(store.findLatest(KEY)).contains(second);
        assertThat(store.history(KEY)).containsExactly(first, second);
    }

    @Test
    @DisplayName("Should keep revisions gap-free under concurrent appends")
    void shouldAppendConcurrently() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 50; i++) {
            executor.submit(() -> store.append(result(0.5)));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(store.history(KEY)).extracting(MatchResult::getRevision)
                .containsExactlyElementsOf(java.util.stream.IntStream.rangeClosed(1, 50).boxed().toList());
    }

    @Test
    @DisplayName("Should replace the clusters of a job")
    void shouldReplaceClusters() {
        DuplicateCluster old = new DuplicateCluster("job1", List.of("a"), List.of("fa"), "a", List.of(), "Unique submission");
        DuplicateCluster fresh = new DuplicateCluster("job1", List.of("b"), List.of("fb"), "b", List.of(), "Unique submission");

        store.saveClusters("job1", List.of(old));
        store.saveClusters("job1", List.of(fresh));

        assertThat(store.findClusters("job1")).containsExactly(fresh);
        assertThat(store.findClusters("other")).isEmpty();
    }
}
