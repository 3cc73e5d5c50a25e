package dev.resumeranker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the semantic similarity scorer.
 * Loaded from application.yml under 'embedding' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingConfig {

    private String provider = "hashing";
    private int dimensions = 512;
    private Rescale rescale = Rescale.CLAMP;
    private Duration timeout = Duration.ofSeconds(20);

    /**
     * How cosine similarity in [-1,1] is mapped onto [0,1].
     */
    public enum Rescale {
        /** Negative similarity becomes 0. */
        CLAMP,
        /** (cos + 1) / 2 */
        SHIFT
    }
}
