package dev.resumeranker.service;

import dev.resumeranker.config.ScoringConfig;
import dev.resumeranker.metrics.MatchingMetrics;
import dev.resumeranker.model.DuplicateCluster;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.RankedCandidate;
import dev.resumeranker.model.RankingReport;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.model.ResultStatus;
import dev.resumeranker.model.ResumeRecord;
import dev.resumeranker.model.ResumeSubmission;
import dev.resumeranker.model.ScoredCandidate;
import dev.resumeranker.store.ResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Main orchestration service for ranking a batch of resumes against a job description.
 * Scoring runs per resume in parallel; duplicate detection runs once the whole batch is scored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeRankingService {

    private final ResumeIngestionService ingestionService;
    private final ConsistencyGuard consistencyGuard;
    private final DuplicateDetectionService duplicateDetectionService;
    private final ResultStore resultStore;
    private final ScoringConfig scoringConfig;
    private final MatchingMetrics metrics;
    private final Clock clock;

    /**
     * Ingest the job description and the submissions, then rank them.
     */
    public Mono<RankingReport> rank(String jobText, List<ResumeSubmission> submissions) {
        return Mono.fromCallable(() -> {
                    JobDescriptionRecord job = ingestionService.describeJob(jobText);
                    List<ResumeRecord> resumes = submissions.stream().map(ingestionService::ingest).toList();
                    metrics.recordResumesIngested(resumes.size());
                    return new IngestedBatch(job, resumes);
                })
                .flatMap(batch -> rank(batch.job(), batch.resumes()));
    }

    /**
     * Rank already ingested resumes. Cancelling the subscription discards computations that
     * are not stored yet; results already stored stay valid.
     */
    public Mono<RankingReport> rank(JobDescriptionRecord job, List<ResumeRecord> resumes) {
        return Mono.defer(() -> {
            Instant startedAt = Instant.now(clock);
            AtomicBoolean cancelled = new AtomicBoolean(false);
            log.info("Starting ranking of {} resumes against '{}'", resumes.size(), job.getTitle());

            return Flux.fromIterable(resumes)
                    .flatMap(resume -> scoreOne(resume, job, cancelled), scoringConfig.getMaxParallelResumes())
                    .collectList()
                    .flatMap(scored -> Mono.fromCallable(() -> finish(job, scored, startedAt))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .doOnCancel(() -> {
                        cancelled.set(true);
                        log.warn("Ranking against '{}' cancelled; unsaved results discarded", job.getTitle());
                    });
        });
    }

    /**
     * Recompute one result. Locked results require {@code override}.
     */
    public Mono<ScoredCandidate> recompute(ResumeRecord resume, JobDescriptionRecord job, boolean override) {
        return consistencyGuard.recompute(resume, job, override);
    }

    public Mono<MatchResult> markFinal(ResultKey key) {
        return consistencyGuard.markFinal(key);
    }

    private Mono<ScoredCandidate> scoreOne(ResumeRecord resume, JobDescriptionRecord job, AtomicBoolean cancelled) {
        return consistencyGuard.resolve(resume, job, cancelled)
                .doOnNext(candidate -> metrics.recordResult(candidate.status()))
                .onErrorResume(e -> {
                    log.error("Scoring failed for '{}': {}", resume.getDisplayName(), e.getMessage());
                    metrics.recordResult(ResultStatus.FAILED);
                    return Mono.just(ScoredCandidate.failed(resume, e.getMessage()));
                });
    }

    private RankingReport finish(JobDescriptionRecord job, List<ScoredCandidate> scored, Instant startedAt) {
        List<DuplicateCluster> clusters = duplicateDetectionService.detect(scored, job.getJobId());
        resultStore.saveClusters(job.getJobId(), clusters);

        List<ScoredCandidate> ordered = new ArrayList<>(scored);
        ordered.sort(Comparator
                .comparing((ScoredCandidate c) -> c.status() == ResultStatus.FAILED)
                .thenComparing(Comparator.comparingDouble(ScoredCandidate::compositeScore).reversed())
                .thenComparing(c -> c.resume().getSubmissionId(), Comparator.nullsLast(Comparator.naturalOrder())));

        List<RankedCandidate> candidates = new ArrayList<>();
        int rank = 0;
        for (ScoredCandidate candidate : ordered) {
            ResumeRecord resume = candidate.resume();
            boolean ranked = !resume.isSuppressed() && candidate.status() != ResultStatus.FAILED;
            candidates.add(new RankedCandidate(
                    ranked ? ++rank : null,
                    resume,
                    candidate.result(),
                    candidate.status(),
                    resume.isSuppressed(),
                    resume.getDuplicateOf(),
                    candidate.error()));
        }

        Instant completedAt = Instant.now(clock);
        RankingReport report = new RankingReport(job.getJobId(), List.copyOf(candidates), shortlist(candidates),
                clusters, startedAt, completedAt);

        int suppressed = report.suppressed().size();
        metrics.recordDuplicatesSuppressed(suppressed);
        metrics.updateLastBatchStats(scored.size(), (int) report.duplicateClusterCount(), suppressed);
        metrics.recordBatchDuration(Duration.between(startedAt, completedAt));

        log.info("Ranking complete: {} resumes, {} ranked, {} shortlisted, {} suppressed, {} failed",
                scored.size(), rank, report.shortlist().size(), suppressed,
                scored.stream().filter(c -> c.status() == ResultStatus.FAILED).count());
        return report;
    }

    /**
     * Ranked candidates at or above the minimum composite score, limited to the top N.
     * Ranks are not renumbered; the cut only narrows what is presented.
     */
    List<RankedCandidate> shortlist(List<RankedCandidate> candidates) {
        ScoringConfig.Shortlist cut = scoringConfig.getShortlist();
        Stream<RankedCandidate> passing = candidates.stream()
                .filter(c -> c.rank() != null)
                .filter(c -> c.compositeScore() >= cut.getMinCompositeScore());
        if (cut.getTopCandidates() > 0) {
            passing = passing.limit(cut.getTopCandidates());
        }
        return passing.toList();
    }

    private record IngestedBatch(JobDescriptionRecord job, List<ResumeRecord> resumes) {
    }
}
