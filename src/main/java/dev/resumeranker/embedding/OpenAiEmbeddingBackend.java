package dev.resumeranker.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.resumeranker.config.EmbeddingConfig;
import dev.resumeranker.error.EmbeddingUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Embedding backend calling an OpenAI-compatible {@code /embeddings} endpoint.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "embedding.provider", havingValue = "openai")
public class OpenAiEmbeddingBackend implements EmbeddingBackend {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public OpenAiEmbeddingBackend(
            @Value("${embedding.openai.api-key:}") String apiKey,
            @Value("${embedding.openai.model:text-embedding-3-small}") String model,
            @Value("${embedding.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            EmbeddingConfig embeddingConfig) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = embeddingConfig.getTimeout();
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI embedding API key is missing! Semantic scores will be omitted.");
        } else {
            log.info("OpenAI embedding backend enabled with model: {}", model);
        }
    }

    @Override
    public Mono<double[]> embed(String text) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new EmbeddingUnavailableException("OpenAI embedding API key not configured"));
        }
        return webClient.post()
                .uri("/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbeddingRequest(model, text))
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .timeout(timeout)
                .map(this::extractVector)
                .onErrorMap(e -> !(e instanceof EmbeddingUnavailableException),
                        e -> new EmbeddingUnavailableException("OpenAI embedding call failed: " + e.getMessage(), e));
    }

    @Override
    public String name() {
        return "openai";
    }

    private double[] extractVector(EmbeddingResponse response) {
        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            throw new EmbeddingUnavailableException("OpenAI returned no embedding");
        }
        List<Double> values = response.data().get(0).embedding();
        double[] vector = new double[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        return vector;
    }

    record EmbeddingRequest(String model, String input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<Data> data) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Data(List<Double> embedding) {
        }
    }
}
