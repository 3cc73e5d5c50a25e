package dev.resumeranker.extraction;

import dev.resumeranker.config.ExtractionConfig;
import dev.resumeranker.model.ContactInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts name, email and phone number from raw resume text.
 */
@Component
@RequiredArgsConstructor
public class ContactExtractor {

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");
    private static final Pattern NAME_LABEL = Pattern.compile("(?im)^\\s*(?:full\\s+)?name\\s*[:\\-]\\s*(.+)$");
    private static final Pattern NAME_SHAPE = Pattern.compile("^\\p{L}[\\p{L}.'\\-]*(?:\\s+\\p{L}[\\p{L}.'\\-]*){0,4}$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern YEAR_GROUP = Pattern.compile("(?:19|20)\\d{2}");

    private static final Set<String> HEADING_WORDS = Set.of(
            "resume", "résumé", "curriculum vitae", "cv", "profile", "summary", "contact", "personal details");

    private static final int NAME_LOOKAHEAD_LINES = 3;
    private static final int MIN_NATIONAL_DIGITS = 9;
    private static final int MAX_NATIONAL_DIGITS = 12;
    private static final int MIN_INTERNATIONAL_DIGITS = 9;
    private static final int MAX_INTERNATIONAL_DIGITS = 15;
    private static final int MIN_DIGITS_BEFORE_YEAR = 10;

    private final ExtractionConfig extractionConfig;

    /**
     * Phone patterns in priority order. International forms carry their own country code;
     * the others are national numbers that get the default one.
     */
    enum PhoneRule {
        INTERNATIONAL("(?<![\\w+])(?:\\+|00)\\d{1,3}(?:[ .\\-]?\\(?\\d{1,5}\\)?){1,6}", true),
        PARENTHESIZED_AREA("(?<![\\w(])\\(\\d{2,5}\\)[ .\\-]?\\d{2,5}(?:[ .\\-]?\\d{2,5}){0,2}", false),
        SEPARATED("(?<![\\w+])\\d{2,5}(?:[ .\\-]\\d{2,5}){2,4}(?![\\w])", false),
        CONTIGUOUS("(?<![\\w+])\\d{7,15}(?![\\w])", false);

        private final Pattern pattern;
        private final boolean international;

        PhoneRule(String regex, boolean international) {
            this.pattern = Pattern.compile(regex);
            this.international = international;
        }
    }

    record PhoneCandidate(String canonical, int digits, PhoneRule rule, int position) {
    }

    public ContactInfo extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return ContactInfo.EMPTY;
        }
        return new ContactInfo(
                extractName(rawText),
                extractEmail(rawText).orElse(""),
                extractPhone(rawText).orElse(""));
    }

    public Optional<String> extractEmail(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = EMAIL.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().toLowerCase(Locale.ROOT)) : Optional.empty();
    }

    /**
     * Find the longest fully matched phone number in canonical {@code +<digits>} form.
     * Each rule match is tried with trailing digit groups dropped until it is a valid length,
     * so a match that swallows a neighbouring number still yields the phone number.
     */
    public Optional<String> extractPhone(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        List<PhoneCandidate> candidates = new ArrayList<>();
        for (PhoneRule rule : PhoneRule.values()) {
            Matcher matcher = rule.pattern.matcher(text);
            while (matcher.find()) {
                canonicalize(matcher.group(), rule).ifPresent(canonical ->
                        candidates.add(new PhoneCandidate(canonical, canonical.length() - 1, rule, matcher.start())));
            }
        }

        return candidates.stream()
                .min(Comparator.comparingInt(PhoneCandidate::digits).reversed()
                        .thenComparing(PhoneCandidate::rule)
                        .thenComparingInt(PhoneCandidate::position))
                .map(PhoneCandidate::canonical);
    }

    /**
     * Canonical form of a matched phone string, or empty when no prefix of it is valid.
     */
    Optional<String> canonicalize(String matched, PhoneRule rule) {
        String body = matched.strip();
        if (rule.international && body.startsWith("00")) {
            body = body.substring(2);
        }
        List<String> groups = Arrays.stream(NON_DIGIT.split(body))
                .filter(g -> !g.isEmpty())
                .toList();

        int size = groups.size();
        // a year after an already complete number is a date, not more digits
        while (size > 1 && YEAR_GROUP.matcher(groups.get(size - 1)).matches()
                && digitCount(groups.subList(0, size - 1)) >= MIN_DIGITS_BEFORE_YEAR) {
            size--;
        }

        for (; size >= 1; size--) {
            String digits = String.join("", groups.subList(0, size));
            Optional<String> canonical = rule.international ? international(digits) : national(digits);
            if (canonical.isPresent()) {
                return canonical;
            }
        }
        return Optional.empty();
    }

    private static int digitCount(List<String> groups) {
        return groups.stream().mapToInt(String::length).sum();
    }

    private Optional<String> international(String digits) {
        if (digits.length() < MIN_INTERNATIONAL_DIGITS || digits.length() > MAX_INTERNATIONAL_DIGITS) {
            return Optional.empty();
        }
        return Optional.of("+" + digits);
    }

    private Optional<String> national(String digits) {
        String countryCode = extractionConfig.getDefaultCountryCode();
        String national = digits;
        if (national.startsWith("0")) {
            national = national.substring(1); // trunk prefix
        }
        if (national.length() > 10 && countryCode != null && national.startsWith(countryCode)) {
            return international(national);
        }
        if (national.length() < MIN_NATIONAL_DIGITS || national.length() > MAX_NATIONAL_DIGITS) {
            return Optional.empty();
        }
        return international((countryCode == null ? "" : countryCode) + national);
    }

    /**
     * Name from a "Name:" label, else from the first lines when they look like a personal name.
     * Returns an empty string when nothing plausible is found.
     */
    public String extractName(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }

        Matcher labeled = NAME_LABEL.matcher(rawText);
        if (labeled.find()) {
            String candidate = labeled.group(1).strip();
            if (NAME_SHAPE.matcher(candidate).matches()) {
                return candidate;
            }
        }

        int inspected = 0;
        for (String line : LINE_BREAK.split(rawText)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || HEADING_WORDS.contains(trimmed.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (NAME_SHAPE.matcher(trimmed).matches()) {
                return trimmed;
            }
            if (++inspected >= NAME_LOOKAHEAD_LINES) {
                break;
            }
        }
        return "";
    }
}
