package dev.resumeranker.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumeranker.error.AiProviderException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON answer of an AI provider into an {@link AiAssessment}.
 */
@Component
public class AiResponseParser {

    private static final Pattern FENCE = Pattern.compile("(?s)```(?:json)?\\s*(.*?)\\s*```");

    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse provider content. Code fences and text around the JSON object are ignored.
     * Scores above 1 are read as percentages.
     *
     * @throws AiProviderException when the content holds no usable score
     */
    public AiAssessment parse(String content) {
        JsonNode root = readRoot(content);
        String rationale = root.hasNonNull("rationale")
                ? root.get("rationale").asText()
                : root.path("explanation").asText("");

        return new AiAssessment(score(root), rationale, textList(root.get("strengths")), textList(root.get("concerns")));
    }

    /**
     * Parse a detailed single-candidate analysis. Accepts snake_case and camelCase field names.
     *
     * @throws AiProviderException when the content holds no usable score
     */
    public DetailedAnalysis parseDetailed(String content) {
        JsonNode root = readRoot(content);
        String summary = root.hasNonNull("summary")
                ? root.get("summary").asText()
                : root.path("rationale").asText("");

        return new DetailedAnalysis(
                score(root),
                summary,
                textList(root.get("strengths")),
                textList(root.get("concerns")),
                textList(field(root, "interview_focus", "interviewFocus")),
                text(field(root, "growth_potential", "growthPotential")));
    }

    private JsonNode readRoot(String content) {
        if (content == null || content.isBlank()) {
            throw new AiProviderException("AI provider returned empty content");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(content));
        } catch (JsonProcessingException e) {
            throw new AiProviderException("AI provider returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new AiProviderException("AI response is not a JSON object");
        }
        return root;
    }

    private double score(JsonNode root) {
        JsonNode scoreNode = root.get("score");
        if (scoreNode == null || !(scoreNode.isNumber() || scoreNode.isTextual())) {
            throw new AiProviderException("AI response has no score");
        }
        double score;
        try {
            score = scoreNode.isNumber() ? scoreNode.asDouble() : Double.parseDouble(scoreNode.asText().trim());
        } catch (NumberFormatException e) {
            throw new AiProviderException("AI response score is not a number: " + scoreNode.asText(), e);
        }
        if (Double.isNaN(score) || score < 0 || score > 100) {
            throw new AiProviderException("AI response score out of range: " + score);
        }
        return score > 1.0 ? score / 100.0 : score;
    }

    private static JsonNode field(JsonNode root, String name, String alias) {
        return root.hasNonNull(name) ? root.get(name) : root.get(alias);
    }

    // growth potential sometimes comes back as a list of sentences
    private String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isArray() ? String.join(" ", textList(node)) : node.asText().trim();
    }

    private String extractJson(String content) {
        Matcher fence = FENCE.matcher(content);
        String body = fence.find() ? fence.group(1) : content.trim();
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return body.substring(start, end + 1);
        }
        return body;
    }

    private List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(item -> {
                if (!item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            });
        } else if (!node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }
}
