package dev.resumeranker.ai;

import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import reactor.core.publisher.Mono;

/**
 * Interface for AI judgment providers.
 * Can be implemented by LLM-backed or no-op implementations.
 */
public interface AiScorer {

    /**
     * Ask the provider to judge a resume against a job description.
     * A single call, without retries; {@link AiAssessmentService} adds timeout, retry and the request gate.
     *
     * @param resume the resume
     * @param job    the job description
     * @return Mono with the assessment, or empty when the provider has nothing to say
     */
    Mono<AiAssessment> assess(ResumeRecord resume, JobDescriptionRecord job);

    /**
     * Ask the provider for an in-depth review of one candidate, including interview focus
     * and growth potential. A single call, without retries.
     *
     * @return Mono with the analysis, or empty when the provider has nothing to say
     */
    Mono<DetailedAnalysis> analyze(ResumeRecord resume, JobDescriptionRecord job);

    /**
     * Check if the provider is available.
     *
     * @return true if the provider is configured and can be called
     */
    boolean isEnabled();

    /**
     * Provider name used in logs and metrics.
     */
    String name();
}
