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
 * Implementation of AiScorer that uses an OpenAI-compatible chat completions API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiScorer implements AiScorer {

    private static final double TEMPERATURE = 0.3;

    private final WebClient webClient;
    private final String apiKey;
    private final AiConfig aiConfig;
    private final AiResponseParser parser;

    public OpenAiScorer(
            @Value("${app.ai.openai.api-key:}") String apiKey,
            @Value("${app.ai.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            AiConfig aiConfig,
            AiResponseParser parser) {
        this.apiKey = apiKey;
        this.aiConfig = aiConfig;
        this.parser = parser;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API Key is missing! AI scoring will be skipped.");
        } else {
            log.info("OpenAI scoring enabled with model: {}", aiConfig.getModel());
        }
    }

    @Override
    public Mono<AiAssessment> assess(ResumeRecord resume, JobDescriptionRecord job) {
        return complete(AiPrompts.matchPrompt(resume, job, aiConfig))
                .map(parser::parse);
    }

    @Override
    public Mono<DetailedAnalysis> analyze(ResumeRecord resume, JobDescriptionRecord job) {
        return complete(AiPrompts.detailedPrompt(resume, job, aiConfig))
                .map(parser::parseDetailed);
    }

    private Mono<String> complete(String userPrompt) {
        ChatRequest request = new ChatRequest(
                aiConfig.getModel(),
                List.of(new Message("system", AiPrompts.SYSTEM),
                        new Message("user", userPrompt)),
                TEMPERATURE,
                new ResponseFormat("json_object"));

        return webClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .map(this::extractContent);
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String name() {
        return "openai";
    }

    private String extractContent(ChatResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new AiProviderException("OpenAI returned no choices");
        }
        return response.choices().get(0).message().content();
    }

    // Request DTOs
    record ChatRequest(
            String model,
            List<Message> messages,
            double temperature,
            @JsonProperty("response_format") ResponseFormat responseFormat) {
    }

    record ResponseFormat(String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
        }
    }
}
