package dev.resumeranker.service;

import dev.resumeranker.TestFixtures;
import dev.resumeranker.config.ScoringConfig;
import dev.resumeranker.error.InconsistentScoreRequestException;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.model.ResultStatus;
import dev.resumeranker.model.ResumeRecord;
import dev.resumeranker.store.InMemoryResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsistencyGuardTest {

    @Mock
    private CandidateScoringService scoringService;

    private InMemoryResultStore store;
    private ScoringConfig scoringConfig;
    private ConsistencyGuard guard;

    private final ResumeRecord resume = TestFixtures.resume("r1", "fp1", Set.of("java"));
    private final JobDescriptionRecord job = TestFixtures.job(Set.of("java"), Set.of());
    private final ResultKey key = ResultKey.of(resume, job);
    private final AtomicInteger computations = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryResultStore();
        scoringConfig = new ScoringConfig();
        guard = new ConsistencyGuard(scoringService, store, scoringConfig);
    }

    private MatchResult fresh(boolean degraded) {
        // each computation gets a distinct score so reuse is observable
        double score = 0.5 + computations.incrementAndGet() / 100.0;
        return MatchResult.builder()
                .key(key)
                .lexicalScore(score)
                .semanticScore(degraded ? null : score)
                .compositeScore(score)
                .rationale("test")
                .strengths(List.of())
                .concerns(List.of())
                .computedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .degraded(degraded)
                .algorithmVersion(1)
                .build();
    }

    private AtomicInteger slowComputeTrackingOverlap() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        when(scoringService.compute(any(), any())).thenAnswer(inv -> Mono.fromSupplier(() -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    return fresh(false);
                })
                .delayElement(Duration.ofMillis(300))
                .doFinally(signal -> active.decrementAndGet()));
        return maxActive;
    }

    private void computeReturns(boolean degraded) {
        when(scoringService.compute(any(), any())).thenAnswer(inv -> Mono.fromSupplier(() -> fresh(degraded)));
    }

    @Nested
    @DisplayName("Locking and reuse")
    class LockingTests {

        @Test
        @DisplayName("Should lock a complete result and reuse it verbatim on the next request")
        void shouldReuseLockedResult() {
            computeReturns(false);

            MatchResult first = guard.resolve(resume, job, new AtomicBoolean()).block().result();

            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean()))
                    .assertNext(outcome -> {
                        assertThat(outcome.status()).isEqualTo(ResultStatus.REUSED);
                        assertThat(outcome.result()).isEqualTo(first);
                    })
                    .verifyComplete();

            assertThat(first.isLocked()).isTrue();
            assertThat(first.getRevision()).isEqualTo(1);
            verify(scoringService, times(1)).compute(any(), any());
        }

        @Test
        @DisplayName("Should keep a degraded result unlocked so it is retried")
        void shouldRetryDegradedResult() {
            computeReturns(true);

            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean()))
                    .assertNext(outcome -> {
                        assertThat(outcome.status()).isEqualTo(ResultStatus.DEGRADED);
                        assertThat(outcome.result().isLocked()).isFalse();
                    })
                    .verifyComplete();
            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean()))
                    .assertNext(outcome -> assertThat(outcome.result().getRevision()).isEqualTo(2))
                    .verifyComplete();

            verify(scoringService, times(2)).compute(any(), any());
            assertThat(store.history(key)).hasSize(2);
        }

        @Test
        @DisplayName("Should lock degraded results too under the ALWAYS policy")
        void shouldLockAlways() {
            scoringConfig.setLockPolicy(ScoringConfig.LockPolicy.ALWAYS);
            computeReturns(true);

            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean()))
                    .assertNext(outcome -> assertThat(outcome.result().isLocked()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should share one computation between concurrent requests for the same key")
        void shouldShareInFlightComputation() {
            when(scoringService.compute(any(), any()))
                    .thenAnswer(inv -> Mono.fromSupplier(() -> fresh(false)).delayElement(Duration.ofMillis(100)));
            ResumeRecord sameContent = TestFixtures.resume("r1-copy", "fp1", Set.of("java"));

            StepVerifier.create(Mono.zip(
                            guard.resolve(resume, job, new AtomicBoolean()),
                            guard.resolve(sameContent, job, new AtomicBoolean())))
                    .assertNext(pair -> {
                        assertThat(pair.getT1().result()).isEqualTo(pair.getT2().result());
                        assertThat(pair.getT1().resume()).isSameAs(resume);
                        assertThat(pair.getT2().resume()).isSameAs(sameContent);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            verify(scoringService, times(1)).compute(any(), any());
            assertThat(store.history(key)).hasSize(1);
        }

        @Test
        @DisplayName("Should discard a result computed for a cancelled batch")
        void shouldDiscardCancelledResult() {
            computeReturns(false);

            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean(true)))
                    .verifyComplete();

            assertThat(store.history(key)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Recompute and markFinal")
    class RevisionTests {

        @Test
        @DisplayName("Should refuse to recompute a locked result without override")
        void shouldRefuseRecomputeWithoutOverride() {
            computeReturns(false);
            guard.resolve(resume, job, new AtomicBoolean()).block();

            StepVerifier.create(guard.recompute(resume, job, false))
                    .expectError(InconsistentScoreRequestException.class)
                    .verify();

            assertThat(store.history(key)).hasSize(1);
        }

        @Test
        @DisplayName("Should append a new revision when overriding a locked result")
        void shouldAppendRevisionOnOverride() {
            computeReturns(false);
            guard.resolve(resume, job, new AtomicBoolean()).block();

            StepVerifier.create(guard.recompute(resume, job, true))
                    .assertNext(outcome -> assertThat(outcome.result().getRevision()).isEqualTo(2))
                    .verifyComplete();

            assertThat(store.history(key)).extracting(MatchResult::getRevision).containsExactly(1, 2);
        }

        @Test
        @DisplayName("Should refuse a concurrent recompute once the running resolve has locked the key")
        void shouldSerializeRecomputeBehindResolve() {
            AtomicInteger maxActive = slowComputeTrackingOverlap();

            StepVerifier.create(Mono.zip(
                            guard.resolve(resume, job, new AtomicBoolean()),
                            guard.recompute(resume, job, false)))
                    .expectError(InconsistentScoreRequestException.class)
                    .verify(Duration.ofSeconds(5));

            assertThat(maxActive.get()).isEqualTo(1);
            assertThat(store.history(key)).hasSize(1);
            assertThat(store.history(key).get(0).isLocked()).isTrue();
            verify(scoringService, times(1)).compute(any(), any());
        }

        @Test
        @DisplayName("Should run an overriding recompute after the running resolve, never alongside it")
        void shouldNeverOverlapComputationsOfOneKey() {
            AtomicInteger maxActive = slowComputeTrackingOverlap();

            StepVerifier.create(Mono.zip(
                            guard.resolve(resume, job, new AtomicBoolean()),
                            guard.recompute(resume, job, true)))
                    .assertNext(pair -> {
                        assertThat(pair.getT1().result().getRevision()).isEqualTo(1);
                        assertThat(pair.getT2().result().getRevision()).isEqualTo(2);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(maxActive.get()).isEqualTo(1);
            assertThat(store.history(key)).extracting(MatchResult::getRevision).containsExactly(1, 2);
        }

        @Test
        @DisplayName("Should mark final only after the running computation has stored its result")
        void shouldSerializeMarkFinalBehindResolve() {
            scoringConfig.setLockPolicy(ScoringConfig.LockPolicy.EXPLICIT);
            slowComputeTrackingOverlap();

            StepVerifier.create(Mono.zip(
                            guard.resolve(resume, job, new AtomicBoolean()),
                            guard.markFinal(key)))
                    .assertNext(pair -> {
                        assertThat(pair.getT2().isLocked()).isTrue();
                        assertThat(pair.getT2().getCompositeScore())
                                .isEqualTo(pair.getT1().result().getCompositeScore());
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(store.history(key)).extracting(MatchResult::isLocked).containsExactly(false, true);
        }

        @Test
        @DisplayName("Should lock the latest result when marked final")
        void shouldMarkFinal() {
            scoringConfig.setLockPolicy(ScoringConfig.LockPolicy.EXPLICIT);
            computeReturns(false);
            MatchResult unlocked = guard.resolve(resume, job, new AtomicBoolean()).block().result();
            assertThat(unlocked.isLocked()).isFalse();

            StepVerifier.create(guard.markFinal(key))
                    .assertNext(locked -> {
                        assertThat(locked.isLocked()).isTrue();
                        assertThat(locked.getRevision()).isEqualTo(2);
                        assertThat(locked.getCompositeScore()).isEqualTo(unlocked.getCompositeScore());
                    })
                    .verifyComplete();

            StepVerifier.create(guard.resolve(resume, job, new AtomicBoolean()))
                    .assertNext(outcome -> assertThat(outcome.status()).isEqualTo(ResultStatus.REUSED))
                    .verifyComplete();
            verify(scoringService, times(1)).compute(any(), any());
        }

        @Test
        @DisplayName("Should return an already locked result unchanged from markFinal")
        void shouldKeepLockedResultOnMarkFinal() {
            computeReturns(false);
            guard.resolve(resume, job, new AtomicBoolean()).block();

            StepVerifier.create(guard.markFinal(key))
                    .assertNext(locked -> assertThat(locked.getRevision()).isEqualTo(1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should complete empty when marking an unknown key final")
        void shouldIgnoreUnknownKey() {
            StepVerifier.create(guard.markFinal(new ResultKey("unknown", "job")))
                    .verifyComplete();

            verify(scoringService, never()).compute(any(), any());
        }
    }
}
