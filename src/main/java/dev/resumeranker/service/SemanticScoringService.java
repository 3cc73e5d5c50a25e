package dev.resumeranker.service;

import dev.resumeranker.config.EmbeddingConfig;
import dev.resumeranker.embedding.EmbeddingBackend;
import dev.resumeranker.embedding.VectorMath;
import dev.resumeranker.metrics.MatchingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Embedding-based similarity between resume and job text, rescaled to [0,1].
 * Depends only on the {@link EmbeddingBackend} capability.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticScoringService {

    private final EmbeddingBackend backend;
    private final EmbeddingConfig embeddingConfig;
    private final MatchingMetrics metrics;

    /**
     * Score the semantic similarity of two normalized texts.
     *
     * @return Mono with the score, 0 for empty input, or empty when the backend is unavailable
     */
    public Mono<Double> score(String resumeText, String jobText) {
        if (resumeText == null || resumeText.isBlank() || jobText == null || jobText.isBlank()) {
            return Mono.just(0.0);
        }

        return Mono.zip(backend.embed(resumeText), backend.embed(jobText))
                .map(vectors -> rescale(VectorMath.cosine(vectors.getT1(), vectors.getT2())))
                .doOnNext(score -> log.debug("Semantic similarity via {}: {}", backend.name(), score))
                .onErrorResume(e -> {
                    log.warn("Embedding backend '{}' unavailable: {}", backend.name(), e.getMessage());
                    metrics.recordEmbeddingFailure(backend.name());
                    return Mono.empty();
                });
    }

    double rescale(double cosine) {
        double value = embeddingConfig.getRescale() == EmbeddingConfig.Rescale.SHIFT
                ? (cosine + 1.0) / 2.0
                : Math.max(0.0, cosine);
        return Math.min(1.0, value);
    }
}
