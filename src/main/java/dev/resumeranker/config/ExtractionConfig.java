package dev.resumeranker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for text normalization and feature extraction.
 * Loaded from skills.yml under 'extraction' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "extraction")
public class ExtractionConfig {

    private List<String> skillVocabulary = new ArrayList<>();
    private List<String> boilerplatePatterns = new ArrayList<>();
    private List<String> requiredMarkers = new ArrayList<>(List.of(
            "required", "requirements", "must have", "must-have", "mandatory", "essential"));
    private List<String> preferredMarkers = new ArrayList<>(List.of(
            "nice to have", "nice-to-have", "preferred", "bonus", "a plus"));
    private String defaultCountryCode = "1";
}
