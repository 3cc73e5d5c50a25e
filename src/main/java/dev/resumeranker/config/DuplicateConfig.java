package dev.resumeranker.config;

import dev.resumeranker.error.DuplicateThresholdInvalidException;
import dev.resumeranker.model.SurvivorCriterion;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for duplicate detection.
 * Loaded from application.yml under 'duplicates' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "duplicates")
public class DuplicateConfig implements InitializingBean {

    private double threshold = 0.85;
    private double strongSignal = 0.95;
    private double contentWeight = 0.6;
    private double skillWeight = 0.4;
    private int shingleSize = 3;
    private List<SurvivorCriterion> survivorOrder = new ArrayList<>(List.of(
            SurvivorCriterion.SCORE,
            SurvivorCriterion.CONTACT_COMPLETENESS,
            SurvivorCriterion.UPLOAD_TIME));

    @Override
    public void afterPropertiesSet() {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new DuplicateThresholdInvalidException(threshold);
        }
        if (strongSignal < 0.0 || strongSignal > 1.0) {
            throw new IllegalStateException("duplicates.strong-signal must be within [0,1]");
        }
        if (shingleSize < 1) {
            throw new IllegalStateException("duplicates.shingle-size must be positive");
        }
    }
}
