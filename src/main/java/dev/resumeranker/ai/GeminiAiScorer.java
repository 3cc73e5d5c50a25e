package dev.resumeranker.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumeranker.config.AiConfig;
import dev.resumeranker.error.AiProviderException;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Implementation of AiScorer that uses Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication - no service account required.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiAiScorer implements AiScorer {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;
    private final AiConfig aiConfig;
    private final AiResponseParser parser;

    public GeminiAiScorer(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            AiConfig aiConfig,
            AiResponseParser parser) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.aiConfig = aiConfig;
        this.parser = parser;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! AI scoring will be skipped.");
        } else {
            log.info("Gemini AI scoring enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<AiAssessment> assess(ResumeRecord resume, JobDescriptionRecord job) {
        return generate(AiPrompts.matchPrompt(resume, job, aiConfig))
                .map(parser::parse);
    }

    @Override
    public Mono<DetailedAnalysis> analyze(ResumeRecord resume, JobDescriptionRecord job) {
        return generate(AiPrompts.detailedPrompt(resume, job, aiConfig))
                .map(parser::parseDetailed);
    }

    private Mono<String> generate(String userPrompt) {
        GeminiRequest request = buildRequest(AiPrompts.SYSTEM + "\n\n" + userPrompt);
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .map(this::extractContent);
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String name() {
        return "gemini";
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.3, 1024, "application/json"));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new AiProviderException("Gemini returned no candidates");
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new AiProviderException("Gemini candidate has no content parts. Finish reason: "
                    + candidate.finishReason());
        }

        return candidate.content().parts().get(0).text();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens, String responseMimeType) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
