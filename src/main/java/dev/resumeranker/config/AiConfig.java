package dev.resumeranker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared settings for the AI enhancement adapter. Provider credentials are injected
 * into each provider directly.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ai")
public class AiConfig {

    private boolean enabled = false;
    private String provider = "none";
    private String model = "gpt-4o-mini";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxRetries = 3;
    private Duration initialBackoff = Duration.ofSeconds(2);
    private int maxConcurrentRequests = 4;
    private int maxResumeChars = 3000;
    private int maxJobChars = 2000;
}
