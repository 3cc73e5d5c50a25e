package dev.resumeranker.embedding;

import dev.resumeranker.config.EmbeddingConfig;
import dev.resumeranker.extraction.TextAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.MurmurHash3;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local embedding backend using signed feature hashing of stemmed unigrams and bigrams.
 * Deterministic and offline, so the default for reproducible scoring.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "embedding.provider", havingValue = "hashing", matchIfMissing = true)
public class HashingEmbeddingBackend implements EmbeddingBackend {

    private static final int SEED = 104729;

    private final TextAnalyzer analyzer;
    private final int dimensions;

    public HashingEmbeddingBackend(TextAnalyzer analyzer, EmbeddingConfig embeddingConfig) {
        if (embeddingConfig.getDimensions() < 1) {
            throw new IllegalStateException("embedding.dimensions must be positive");
        }
        this.analyzer = analyzer;
        this.dimensions = embeddingConfig.getDimensions();
        log.info("Hashing embedding backend enabled with {} dimensions", dimensions);
    }

    @Override
    public Mono<double[]> embed(String text) {
        return Mono.fromCallable(() -> vectorize(text));
    }

    @Override
    public String name() {
        return "hashing";
    }

    double[] vectorize(String text) {
        double[] vector = new double[dimensions];
        List<String> stems = analyzer.stems(text);
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < stems.size(); i++) {
            counts.merge(stems.get(i), 1, Integer::sum);
            if (i > 0) {
                counts.merge(stems.get(i - 1) + "_" + stems.get(i), 1, Integer::sum);
            }
        }

        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            byte[] bytes = entry.getKey().getBytes(StandardCharsets.UTF_8);
            int hash = MurmurHash3.hash32x86(bytes, 0, bytes.length, SEED);
            int index = Math.floorMod(hash, dimensions);
            double sign = (hash >>> 31) == 0 ? 1.0 : -1.0;
            vector[index] += sign * (1.0 + Math.log(entry.getValue()));
        }
        return VectorMath.normalizeL2(vector);
    }
}
