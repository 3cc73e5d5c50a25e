package dev.resumeranker.metrics;

import dev.resumeranker.model.ResultStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for resume matching operations.
 */
@Component
public class MatchingMetrics {

    private static final String TAG_STATUS = "status";
    private static final String TAG_BACKEND = "backend";
    private final MeterRegistry registry;

    // Counters
    private final Counter resumesIngestedCounter;
    private final Counter duplicatesSuppressedCounter;
    private final Counter aiRetriesCounter;

    // Timers
    private final Timer batchTimer;

    // Gauges
    private final AtomicInteger lastBatchResumes = new AtomicInteger(0);
    private final AtomicInteger lastBatchClusters = new AtomicInteger(0);
    private final AtomicInteger lastBatchSuppressed = new AtomicInteger(0);

    public MatchingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.resumesIngestedCounter = Counter.builder("resume_ranker_resumes_ingested_total")
                .description("Total resumes ingested")
                .register(registry);

        this.duplicatesSuppressedCounter = Counter.builder("resume_ranker_duplicates_suppressed_total")
                .description("Total resumes suppressed as duplicates")
                .register(registry);

        this.aiRetriesCounter = Counter.builder("resume_ranker_ai_retries_total")
                .description("Total retried AI provider calls")
                .register(registry);

        this.batchTimer = Timer.builder("resume_ranker_batch_duration")
                .description("Time to rank one batch of resumes")
                .register(registry);

        Gauge.builder("resume_ranker_last_batch_resumes", lastBatchResumes, AtomicInteger::get)
                .description("Resumes in last batch")
                .register(registry);

        Gauge.builder("resume_ranker_last_batch_clusters", lastBatchClusters, AtomicInteger::get)
                .description("Duplicate clusters (size > 1) in last batch")
                .register(registry);

        Gauge.builder("resume_ranker_last_batch_suppressed", lastBatchSuppressed, AtomicInteger::get)
                .description("Suppressed duplicates in last batch")
                .register(registry);
    }

    public void recordResumesIngested(int count) {
        resumesIngestedCounter.increment(count);
    }

    /**
     * Record the outcome of scoring one resume.
     */
    public void recordResult(ResultStatus status) {
        Counter.builder("resume_ranker_results_total")
                .description("Scoring outcomes by status")
                .tag(TAG_STATUS, status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordEmbeddingFailure(String backend) {
        Counter.builder("resume_ranker_embedding_failures_total")
                .tag(TAG_BACKEND, backend)
                .register(registry)
                .increment();
    }

    public void recordAiFailure(String provider) {
        Counter.builder("resume_ranker_ai_failures_total")
                .tag(TAG_BACKEND, provider)
                .register(registry)
                .increment();
    }

    public void recordAiRetry() {
        aiRetriesCounter.increment();
    }

    public void recordDuplicatesSuppressed(int count) {
        duplicatesSuppressedCounter.increment(count);
    }

    public void recordBatchDuration(Duration duration) {
        batchTimer.record(duration);
    }

    /**
     * Update last batch statistics.
     */
    public void updateLastBatchStats(int resumes, int clusters, int suppressed) {
        lastBatchResumes.set(resumes);
        lastBatchClusters.set(clusters);
        lastBatchSuppressed.set(suppressed);
    }
}
