package dev.resumeranker.ai;

import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of AiScorer.
 * Used when no AI provider is configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpAiScorer implements AiScorer {

    public NoOpAiScorer() {
        log.info("AI scoring disabled - using no-op scorer");
    }

    @Override
    public Mono<AiAssessment> assess(ResumeRecord resume, JobDescriptionRecord job) {
        return Mono.empty();
    }

    @Override
    public Mono<DetailedAnalysis> analyze(ResumeRecord resume, JobDescriptionRecord job) {
        return Mono.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String name() {
        return "none";
    }
}
