package dev.resumeranker.extraction;

import dev.resumeranker.config.ExtractionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Matches the configured skill vocabulary against text, in exact and stemmed form.
 * Terms outside the vocabulary are never reported.
 */
@Slf4j
@Component
public class SkillExtractor {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    // terms with symbols (c++, c#, .net) lose them in tokenization and match exactly only
    private static final Pattern STEMMABLE = Pattern.compile("[\\p{L}\\p{N} \\-]+");

    private final TextNormalizer normalizer;
    private final TextAnalyzer analyzer;
    private final ExtractionConfig extractionConfig;

    private final Map<String, Pattern> exactPatterns = new LinkedHashMap<>();
    private final Map<String, List<String>> termStems = new LinkedHashMap<>();

    /**
     * Vocabulary matches found in a text.
     *
     * @param exact   terms present verbatim
     * @param partial terms present only through their stemmed form
     */
    public record SkillMatches(Set<String> exact, Set<String> partial) {

        public static final SkillMatches NONE = new SkillMatches(Set.of(), Set.of());

        public Set<String> all() {
            Set<String> all = new LinkedHashSet<>(exact);
            all.addAll(partial);
            return all;
        }

        public boolean isEmpty() {
            return exact.isEmpty() && partial.isEmpty();
        }
    }

    /**
     * Requirement terms of a job description.
     */
    public record JobRequirements(Set<String> all, Set<String> required, Set<String> preferred) {
    }

    private enum Section {
        NONE, REQUIRED, PREFERRED
    }

    public SkillExtractor(TextNormalizer normalizer, TextAnalyzer analyzer, ExtractionConfig extractionConfig) {
        this.normalizer = normalizer;
        this.analyzer = analyzer;
        this.extractionConfig = extractionConfig;

        for (String rawTerm : extractionConfig.getSkillVocabulary()) {
            String term = rawTerm == null ? "" : rawTerm.trim().toLowerCase(Locale.ROOT);
            if (term.isEmpty() || exactPatterns.containsKey(term)) {
                continue;
            }
            exactPatterns.put(term, Pattern.compile("(?<![a-z0-9+#])" + Pattern.quote(term) + "(?![a-z0-9+#])"));
            termStems.put(term, STEMMABLE.matcher(term).matches() ? analyzer.stems(term) : List.of());
        }
        log.info("Skill vocabulary loaded with {} terms", exactPatterns.size());
    }

    /**
     * Find vocabulary terms in normalized text.
     */
    public SkillMatches extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank() || exactPatterns.isEmpty()) {
            return SkillMatches.NONE;
        }

        List<String> stems = analyzer.stems(normalizedText);
        Set<String> stemSet = new HashSet<>(stems);

        Set<String> exact = new LinkedHashSet<>();
        Set<String> partial = new LinkedHashSet<>();

        for (Map.Entry<String, Pattern> entry : exactPatterns.entrySet()) {
            String term = entry.getKey();
            if (entry.getValue().matcher(normalizedText).find()) {
                exact.add(term);
            } else if (matchesStems(termStems.get(term), stems, stemSet)) {
                partial.add(term);
            }
        }
        return new SkillMatches(Collections.unmodifiableSet(exact), Collections.unmodifiableSet(partial));
    }

    /**
     * Extract the requirement terms of a raw job description, flagging the ones listed under
     * a mandatory marker ("required", "must have", ...) or a nice-to-have marker.
     * A heading line ending with ':' opens a section that lasts until the next heading.
     */
    public JobRequirements extractRequirements(String rawJobText) {
        if (rawJobText == null || rawJobText.isBlank()) {
            return new JobRequirements(Set.of(), Set.of(), Set.of());
        }

        Set<String> all = new LinkedHashSet<>();
        Set<String> required = new LinkedHashSet<>();
        Set<String> preferred = new LinkedHashSet<>();
        Section section = Section.NONE;

        for (String rawLine : LINE_BREAK.split(rawJobText)) {
            String line = normalizer.normalize(rawLine);
            if (line.isEmpty()) {
                continue;
            }

            Section marked = markerOf(line);
            Section lineSection;
            if (isHeading(rawLine)) {
                section = marked;
                lineSection = marked;
            } else {
                lineSection = marked != Section.NONE ? marked : section;
            }

            Set<String> terms = extract(line).all();
            all.addAll(terms);
            if (lineSection == Section.REQUIRED) {
                required.addAll(terms);
            } else if (lineSection == Section.PREFERRED) {
                preferred.addAll(terms);
            }
        }
        preferred.removeAll(required);

        return new JobRequirements(
                Collections.unmodifiableSet(all),
                Collections.unmodifiableSet(required),
                Collections.unmodifiableSet(preferred));
    }

    /**
     * Check whether the stemmed term occurs as a contiguous token run.
     */
    private boolean matchesStems(List<String> term, List<String> stems, Set<String> stemSet) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        if (term.size() == 1) {
            return stemSet.contains(term.get(0));
        }
        return Collections.indexOfSubList(stems, term) >= 0;
    }

    private Section markerOf(String normalizedLine) {
        // Preferred first: "preferred requirements" is a nice-to-have section
        for (String marker : extractionConfig.getPreferredMarkers()) {
            if (normalizedLine.contains(marker.toLowerCase(Locale.ROOT))) {
                return Section.PREFERRED;
            }
        }
        for (String marker : extractionConfig.getRequiredMarkers()) {
            if (normalizedLine.contains(marker.toLowerCase(Locale.ROOT))) {
                return Section.REQUIRED;
            }
        }
        return Section.NONE;
    }

    private boolean isHeading(String rawLine) {
        String trimmed = rawLine.strip();
        return trimmed.endsWith(":") || trimmed.startsWith("#");
    }
}
