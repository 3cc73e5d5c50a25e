package dev.resumeranker.service;

import dev.resumeranker.config.ScoringConfig;
import dev.resumeranker.extraction.TextAnalyzer;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.ResumeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for scoring keyword overlap between a resume and a job description.
 * Always available: it needs nothing beyond the extracted features.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordMatchingService {

    private final ScoringConfig scoringConfig;
    private final TextAnalyzer analyzer;

    /**
     * Lexical sub-score with the terms behind it.
     *
     * @param score           weighted match ratio in [0,1], after penalties
     * @param exactMatches    requirement terms found verbatim
     * @param partialMatches  requirement terms found only in stemmed form
     * @param missingRequired mandatory terms absent from the resume
     */
    public record LexicalMatch(
            double score,
            List<String> exactMatches,
            List<String> partialMatches,
            List<String> missingRequired) {
    }

    public LexicalMatch match(ResumeRecord resume, JobDescriptionRecord job) {
        Set<String> terms = job.getRequirementTerms();
        if (terms == null || terms.isEmpty()) {
            return new LexicalMatch(stemCoverage(resume, job), List.of(), List.of(), List.of());
        }

        ScoringConfig.Lexical lexical = scoringConfig.getLexical();
        Set<String> required = job.getRequiredTerms() == null ? Set.of() : job.getRequiredTerms();
        Set<String> resumeSkills = resume.getSkills() == null ? Set.of() : resume.getSkills();
        Set<String> partialSkills = resume.getPartialSkills() == null ? Set.of() : resume.getPartialSkills();

        List<String> exact = new ArrayList<>();
        List<String> partial = new ArrayList<>();
        List<String> missingRequired = new ArrayList<>();
        double totalWeight = 0.0;
        double matchedWeight = 0.0;

        for (String term : terms) {
            double weight = required.contains(term) ? lexical.getRequiredTermWeight() : lexical.getPreferredTermWeight();
            totalWeight += weight;

            if (resumeSkills.contains(term) && !partialSkills.contains(term)) {
                exact.add(term);
                matchedWeight += weight;
            } else if (resumeSkills.contains(term)) {
                partial.add(term);
                matchedWeight += weight * lexical.getPartialCredit();
            } else if (required.contains(term)) {
                missingRequired.add(term);
            }
        }

        double score = totalWeight > 0 ? matchedWeight / totalWeight : 0.0;
        score *= Math.pow(lexical.getMissingRequiredPenalty(), missingRequired.size());
        score = Math.max(0.0, Math.min(1.0, score));

        log.debug("Lexical match for '{}': {} exact, {} partial, {} required missing -> {}",
                resume.getDisplayName(), exact.size(), partial.size(), missingRequired.size(), score);
        return new LexicalMatch(score, List.copyOf(exact), List.copyOf(partial), List.copyOf(missingRequired));
    }

    /**
     * Fraction of the job's distinct content stems present in the resume.
     */
    private double stemCoverage(ResumeRecord resume, JobDescriptionRecord job) {
        Set<String> jobStems = new LinkedHashSet<>(analyzer.stems(job.getNormalizedText()));
        if (jobStems.isEmpty()) {
            return 0.0;
        }
        Set<String> resumeStems = new HashSet<>(analyzer.stems(resume.getNormalizedText()));
        long present = jobStems.stream().filter(resumeStems::contains).count();
        return (double) present / jobStems.size();
    }
}
