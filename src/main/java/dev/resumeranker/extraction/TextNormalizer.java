package dev.resumeranker.extraction;

import dev.resumeranker.config.ExtractionConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns raw extracted text into its comparable form: lowercased, boilerplate-stripped,
 * whitespace-collapsed. The fingerprint of a resume is the SHA-256 of this form.
 */
@Slf4j
@Component
public class TextNormalizer {

    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B-\\u200D\\uFEFF]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<String> DEFAULT_BOILERPLATE = List.of(
            "^page \\d+(?: of \\d+)?$",
            "^-?\\s*\\d+\\s*-?$",
            "curriculum vitae",
            "references (?:are )?available (?:up)?on request",
            "^(?:resume|résumé|cv)$",
            "^(?:private (?:and|&) )?confidential$");

    private final List<Pattern> boilerplate;

    public TextNormalizer(ExtractionConfig extractionConfig) {
        List<String> configured = extractionConfig.getBoilerplatePatterns();
        List<String> sources = (configured != null && !configured.isEmpty()) ? configured : DEFAULT_BOILERPLATE;
        this.boilerplate = sources.stream()
                .map(TextNormalizer::compileOrNull)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Normalize raw text. Never fails; null becomes the empty string.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        text = ZERO_WIDTH.matcher(text).replaceAll("");

        StringBuilder sb = new StringBuilder(text.length());
        for (String line : LINE_BREAK.split(text)) {
            String cleaned = stripBoilerplate(line.toLowerCase(Locale.ROOT).strip());
            if (!cleaned.isBlank()) {
                sb.append(cleaned).append(' ');
            }
        }
        return WHITESPACE.matcher(sb).replaceAll(" ").trim();
    }

    /**
     * Content hash of already-normalized text.
     */
    public String fingerprint(String normalizedText) {
        return DigestUtils.sha256Hex((normalizedText == null ? "" : normalizedText).getBytes(StandardCharsets.UTF_8));
    }

    private String stripBoilerplate(String line) {
        String result = line;
        for (Pattern pattern : boilerplate) {
            result = pattern.matcher(result).replaceAll("");
        }
        return result;
    }

    private static Pattern compileOrNull(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid boilerplate pattern '{}': {}", regex, e.getDescription());
            return null;
        }
    }
}
