package dev.resumeranker.service;

import dev.resumeranker.config.DuplicateConfig;
import dev.resumeranker.extraction.TextAnalyzer;
import dev.resumeranker.model.ContactInfo;
import dev.resumeranker.model.DuplicateCriterion;
import dev.resumeranker.model.PairSimilarity;
import dev.resumeranker.model.ResumeRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pairwise resume similarity on content, contact, skills and score proximity.
 */
@Component
@RequiredArgsConstructor
public class ResumeSimilarityCalculator {

    private final TextAnalyzer analyzer;
    private final DuplicateConfig duplicateConfig;

    /**
     * Compare two resumes. Composite scores only feed the informational proximity value.
     */
    public PairSimilarity compare(ResumeRecord a, ResumeRecord b, double scoreA, double scoreB) {
        double content = contentSimilarity(a.getNormalizedText(), b.getNormalizedText());
        double contact = contactSimilarity(a.getContact(), b.getContact());
        double skills = jaccard(a.getSkills(), b.getSkills());
        double proximity = 1.0 - Math.abs(clamp(scoreA) - clamp(scoreB));

        double strong = Math.max(content, contact);
        double overall;
        DuplicateCriterion trigger;
        if (strong >= duplicateConfig.getStrongSignal()) {
            overall = strong;
            trigger = contact >= content ? DuplicateCriterion.CONTACT : DuplicateCriterion.CONTENT;
        } else {
            overall = blend(content, skills);
            trigger = DuplicateCriterion.BLEND;
        }

        return new PairSimilarity(a.getSubmissionId(), b.getSubmissionId(),
                content, contact, skills, proximity, overall, trigger);
    }

    /**
     * Jaccard overlap of word shingles. Texts shorter than the shingle size are compared on single words.
     */
    double contentSimilarity(String first, String second) {
        List<String> wordsA = analyzer.words(first);
        List<String> wordsB = analyzer.words(second);
        int size = duplicateConfig.getShingleSize();
        if (wordsA.size() < size || wordsB.size() < size) {
            size = 1;
        }
        return jaccard(shingles(wordsA, size), shingles(wordsB, size));
    }

    /**
     * 1 when email (case-insensitive) or canonical phone is shared, else 0.
     */
    double contactSimilarity(ContactInfo a, ContactInfo b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.hasEmail() && b.hasEmail() && a.email().equalsIgnoreCase(b.email())) {
            return 1.0;
        }
        if (a.hasPhone() && b.hasPhone() && a.phone().equals(b.phone())) {
            return 1.0;
        }
        return 0.0;
    }

    private double blend(double content, double skills) {
        double contentWeight = duplicateConfig.getContentWeight();
        double skillWeight = duplicateConfig.getSkillWeight();
        double total = contentWeight + skillWeight;
        if (total <= 0) {
            return content;
        }
        return (content * contentWeight + skills * skillWeight) / total;
    }

    private Set<String> shingles(List<String> words, int size) {
        Set<String> shingles = new HashSet<>();
        for (int i = 0; i + size <= words.size(); i++) {
            shingles.add(String.join(" ", words.subList(i, i + size)));
        }
        return shingles;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        int union = a.size() + b.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
