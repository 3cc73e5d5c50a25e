package dev.resumeranker.service;

import dev.resumeranker.config.ScoringConfig;
import dev.resumeranker.error.InconsistentScoreRequestException;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.model.ResultStatus;
import dev.resumeranker.model.ResumeRecord;
import dev.resumeranker.model.ScoredCandidate;
import dev.resumeranker.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Write-once guard around result computation.
 * A locked result is returned verbatim on every later request for the same key.
 * Resolve, recompute and markFinal on one key run one after another, so at most one
 * computation per key is in flight at any time and each sees the revision the previous wrote.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyGuard {

    private final CandidateScoringService scoringService;
    private final ResultStore resultStore;
    private final ScoringConfig scoringConfig;

    private final Map<ResultKey, Mono<ScoredCandidate>> inFlight = new ConcurrentHashMap<>();
    private final Map<ResultKey, Mono<Void>> lanes = new ConcurrentHashMap<>();

    /**
     * Return the locked result for this resume and job, or compute, lock per policy and store a new one.
     *
     * @param cancelled batch cancellation flag; once set, fresh results are discarded instead of stored
     * @return Mono with the outcome, empty when the computation was discarded
     */
    public Mono<ScoredCandidate> resolve(ResumeRecord resume, JobDescriptionRecord job, AtomicBoolean cancelled) {
        ResultKey key = ResultKey.of(resume, job);
        return Mono.defer(() -> shared(resume, job, key, cancelled))
                // the shared computation belonged to a batch that was cancelled meanwhile
                .switchIfEmpty(Mono.defer(() -> cancelled.get() ? Mono.empty() : resolve(resume, job, cancelled)))
                .map(outcome -> outcome.resume() == resume ? outcome
                        : new ScoredCandidate(resume, outcome.result(), outcome.status(), outcome.error()));
    }

    /**
     * Compute a new revision for a key.
     *
     * @param override required when the current result is locked
     * @throws InconsistentScoreRequestException when the current result is locked and override is false
     */
    public Mono<ScoredCandidate> recompute(ResumeRecord resume, JobDescriptionRecord job, boolean override) {
        ResultKey key = ResultKey.of(resume, job);
        return serialized(key, () -> findLatest(key)
                .flatMap(prior -> {
                    if (prior.isPresent() && prior.get().isLocked() && !override) {
                        return Mono.error(new InconsistentScoreRequestException(key));
                    }
                    if (prior.isPresent() && prior.get().isLocked()) {
                        log.warn("Overriding locked result {} (revision {})", key, prior.get().getRevision());
                    }
                    return computeAndStore(resume, job, new AtomicBoolean(false));
                }));
    }

    /**
     * Lock the latest result of a key by appending a locked copy of it.
     *
     * @return Mono with the locked result, empty when nothing was ever computed for the key
     */
    public Mono<MatchResult> markFinal(ResultKey key) {
        return serialized(key, () -> findLatest(key)
                .flatMap(latest -> {
                    if (latest.isEmpty()) {
                        return Mono.empty();
                    }
                    if (latest.get().isLocked()) {
                        return Mono.just(latest.get());
                    }
                    MatchResult locked = latest.get().toBuilder().locked(true).build();
                    return Mono.fromCallable(() -> resultStore.append(locked))
                            .subscribeOn(Schedulers.boundedElastic())
                            .doOnNext(stored -> log.info("Result {} marked final at revision {}",
                                    key, stored.getRevision()));
                }));
    }

    private Mono<ScoredCandidate> shared(ResumeRecord resume, JobDescriptionRecord job, ResultKey key,
                                         AtomicBoolean cancelled) {
        return inFlight.computeIfAbsent(key, k -> {
            AtomicReference<Mono<ScoredCandidate>> self = new AtomicReference<>();
            Mono<ScoredCandidate> computation = serialized(k, () -> resolveOnce(resume, job, k, cancelled))
                    .doOnTerminate(() -> inFlight.remove(k, self.get()))
                    .doOnCancel(() -> inFlight.remove(k, self.get()))
                    .cache();
            self.set(computation);
            return computation;
        });
    }

    /**
     * Run an operation once every operation queued earlier on the same key has finished.
     * The lane tail of a key completes when its last queued operation terminates.
     */
    private <T> Mono<T> serialized(ResultKey key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            AtomicReference<Mono<Void>> previous = new AtomicReference<>(Mono.empty());
            Mono<Void> turn = lanes.compute(key, (k, tail) -> {
                if (tail != null) {
                    previous.set(tail);
                }
                return previous.get().then(done.asMono());
            });
            AtomicBoolean started = new AtomicBoolean();
            return previous.get()
                    .then(Mono.defer(() -> {
                        started.set(true);
                        return operation.get();
                    }))
                    .doFinally(signal -> {
                        // a turn cancelled while waiting stays queued until its predecessor ends
                        if (started.get()) {
                            lanes.remove(key, turn);
                        }
                        done.tryEmitEmpty();
                    });
        });
    }

    private Mono<ScoredCandidate> resolveOnce(ResumeRecord resume, JobDescriptionRecord job, ResultKey key,
                                              AtomicBoolean cancelled) {
        return findLatest(key)
                .flatMap(prior -> {
                    if (prior.isPresent() && prior.get().isLocked()) {
                        log.debug("Reusing locked result {} revision {}", key, prior.get().getRevision());
                        return Mono.just(ScoredCandidate.of(resume, prior.get(), ResultStatus.REUSED));
                    }
                    return computeAndStore(resume, job, cancelled);
                });
    }

    private Mono<ScoredCandidate> computeAndStore(ResumeRecord resume, JobDescriptionRecord job,
                                                  AtomicBoolean cancelled) {
        return scoringService.compute(resume, job)
                .filter(result -> {
                    if (cancelled.get()) {
                        log.debug("Discarding result {} of cancelled batch", result.getKey());
                        return false;
                    }
                    return true;
                })
                .map(result -> result.toBuilder().locked(shouldLock(result)).build())
                .flatMap(result -> Mono.fromCallable(() -> resultStore.append(result))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(stored -> ScoredCandidate.of(resume, stored,
                        stored.isDegraded() ? ResultStatus.DEGRADED : ResultStatus.SCORED));
    }

    private boolean shouldLock(MatchResult result) {
        return switch (scoringConfig.getLockPolicy()) {
            case ALWAYS -> true;
            case NON_DEGRADED -> !result.isDegraded();
            case EXPLICIT -> false;
        };
    }

    private Mono<Optional<MatchResult>> findLatest(ResultKey key) {
        return Mono.fromCallable(() -> resultStore.findLatest(key))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
