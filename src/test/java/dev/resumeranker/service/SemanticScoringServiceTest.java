package dev.resumeranker.service;

import dev.resumeranker.config.EmbeddingConfig;
import dev.resumeranker.embedding.EmbeddingBackend;
import dev.resumeranker.error.EmbeddingUnavailableException;
import dev.resumeranker.metrics.MatchingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SemanticScoringServiceTest {

    private SimpleMeterRegistry registry;
    private EmbeddingConfig embeddingConfig;

    /**
     * Deterministic backend returning fixed vectors per text.
     */
    private static EmbeddingBackend stub(Map<String, double[]> vectors) {
        return new EmbeddingBackend() {
            @Override
            public Mono<double[]> embed(String text) {
                double[] vector = vectors.get(text);
                return vector != null ? Mono.just(vector) : Mono.error(new EmbeddingUnavailableException("no vector"));
            }

            @Override
            public String name() {
                return "stub";
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        embeddingConfig = new EmbeddingConfig();
    }

    private SemanticScoringService service(EmbeddingBackend backend) {
        return new SemanticScoringService(backend, embeddingConfig, new MatchingMetrics(registry));
    }

    @Test
    @DisplayName("Should return cosine similarity of the two embeddings")
    void shouldReturnCosine() {
        SemanticScoringService service = service(stub(Map.of(
                "resume", new double[]{1, 1},
                "job", new double[]{1, 0})));

        StepVerifier.create(service.score("resume", "job"))
                .assertNext(score -> assertThat(score).isCloseTo(Math.sqrt(0.5), within(1e-9)))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should clamp negative similarity to 0 by default")
    void shouldClampNegative() {
        SemanticScoringService service = service(stub(Map.of(
                "resume", new double[]{-1, 0},
                "job", new double[]{1, 0})));

        StepVerifier.create(service.score("resume", "job"))
                .expectNext(0.0)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should shift cosine into [0,1] when configured")
    void shouldShiftWhenConfigured() {
        embeddingConfig.setRescale(EmbeddingConfig.Rescale.SHIFT);
        SemanticScoringService service = service(stub(Map.of(
                "resume", new double[]{0, 1},
                "job", new double[]{1, 0})));

        StepVerifier.create(service.score("resume", "job"))
                .expectNext(0.5)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should score empty text as 0 without calling the backend")
    void shouldScoreEmptyTextAsZero() {
        SemanticScoringService service = service(stub(Map.of()));

        StepVerifier.create(service.score("", "job")).expectNext(0.0).verifyComplete();
        StepVerifier.create(service.score("resume", null)).expectNext(0.0).verifyComplete();
    }

    @Test
    @DisplayName("Should complete empty and count the failure when the backend is unavailable")
    void shouldOmitScoreWhenBackendFails() {
        SemanticScoringService service = service(stub(Map.of("job", new double[]{1, 0})));

        StepVerifier.create(service.score("resume", "job")).verifyComplete();

        assertThat(registry.counter("resume_ranker_embedding_failures_total", "backend", "stub").count())
                .isEqualTo(1.0);
    }
}
