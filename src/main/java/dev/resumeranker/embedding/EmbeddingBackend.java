package dev.resumeranker.embedding;

import reactor.core.publisher.Mono;

/**
 * Capability that turns text into a dense vector.
 * Implementations signal {@link dev.resumeranker.error.EmbeddingUnavailableException} on failure.
 */
public interface EmbeddingBackend {

    /**
     * Embed a text.
     *
     * @param text normalized text, never null
     * @return Mono with the vector
     */
    Mono<double[]> embed(String text);

    /**
     * Backend name used in logs and metrics.
     */
    String name();
}
