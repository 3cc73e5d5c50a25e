package dev.resumeranker.ai;

import dev.resumeranker.config.AiConfig;
import dev.resumeranker.error.AiProviderException;
import dev.resumeranker.metrics.MatchingMetrics;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the configured {@link AiScorer} with a bounded number of outstanding requests,
 * a per-call timeout and exponential backoff on transient failures.
 * Any persistent failure yields an empty Mono: the AI sub-score is omitted, never zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiAssessmentService {

    private final AiScorer scorer;
    private final AiRequestGate gate;
    private final AiConfig aiConfig;
    private final MatchingMetrics metrics;

    /**
     * True when AI scoring is switched on and the provider is usable.
     */
    public boolean isActive() {
        return aiConfig.isEnabled() && scorer.isEnabled();
    }

    public Mono<AiAssessment> assess(ResumeRecord resume, JobDescriptionRecord job) {
        if (!isActive()) {
            return Mono.empty();
        }
        return resilient(resume, "scoring", () -> scorer.assess(resume, job))
                .doOnNext(assessment -> log.debug("AI score for '{}': {}", resume.getDisplayName(), assessment.score()));
    }

    /**
     * Detailed review of a single candidate, with the same gate, timeout and retries as scoring.
     * Empty when AI is inactive or the provider keeps failing.
     */
    public Mono<DetailedAnalysis> analyze(ResumeRecord resume, JobDescriptionRecord job) {
        if (!isActive()) {
            log.info("Detailed analysis of '{}' skipped: AI is not active", resume.getDisplayName());
            return Mono.empty();
        }
        return resilient(resume, "analysis", () -> scorer.analyze(resume, job))
                .doOnNext(analysis -> log.info("Detailed analysis of '{}' ready (score {})",
                        resume.getDisplayName(), analysis.score()));
    }

    private <T> Mono<T> resilient(ResumeRecord resume, String operation, Supplier<Mono<T>> call) {
        return gate.guard(() -> call.get().timeout(aiConfig.getTimeout()))
                .retryWhen(Retry.backoff(aiConfig.getMaxRetries(), aiConfig.getInitialBackoff())
                        .filter(this::isRetryableError)
                        .doBeforeRetry(retrySignal -> {
                            metrics.recordAiRetry();
                            log.info("Retrying AI {} for '{}' (Attempt {}): {}",
                                    operation, resume.getDisplayName(), retrySignal.totalRetries() + 1,
                                    retrySignal.failure().getMessage());
                        }))
                .onErrorResume(e -> {
                    log.warn("AI {} permanent failure for '{}' via {}: {}",
                            operation, resume.getDisplayName(), scorer.name(), e.getMessage());
                    metrics.recordAiFailure(scorer.name());
                    return Mono.empty();
                });
    }

    boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            // Rate limits (429) or server errors (5xx)
            return status == 429 || status >= 500;
        }
        return e instanceof WebClientRequestException
                || e instanceof TimeoutException
                || e instanceof AiProviderException;
    }
}
