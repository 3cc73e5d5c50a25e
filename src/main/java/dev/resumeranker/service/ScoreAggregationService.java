package dev.resumeranker.service;

import dev.resumeranker.ai.AiAssessment;
import dev.resumeranker.config.ScoringConfig;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.service.KeywordMatchingService.LexicalMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Combines sub-scores into the composite score and its explanation.
 * Weights are renormalized over the sub-scores actually produced, so an unavailable signal
 * never counts as zero.
 */
@Service
@RequiredArgsConstructor
public class ScoreAggregationService {

    private final ScoringConfig scoringConfig;
    private final Clock clock;

    /**
     * Build an unlocked result with revision 0; the consistency guard decides locking and revision.
     *
     * @param key       result identity
     * @param lexical   lexical match, always present
     * @param semantic  semantic sub-score, null when the embedding backend was unavailable
     * @param ai        AI assessment, null when disabled or failed
     * @param aiEnabled whether an AI score was expected
     */
    public MatchResult aggregate(ResultKey key, LexicalMatch lexical, Double semantic, AiAssessment ai,
                                 boolean aiEnabled) {
        ScoringConfig.Weights weights = scoringConfig.getWeights();
        Double aiScore = ai != null ? ai.score() : null;

        double weightedSum = weights.getLexical() * lexical.score();
        double totalWeight = weights.getLexical();
        double plainSum = lexical.score();
        int produced = 1;

        if (semantic != null) {
            weightedSum += weights.getSemantic() * semantic;
            totalWeight += weights.getSemantic();
            plainSum += semantic;
            produced++;
        }
        if (aiScore != null) {
            weightedSum += weights.getAi() * aiScore;
            totalWeight += weights.getAi();
            plainSum += aiScore;
            produced++;
        }

        double composite = totalWeight > 0 ? weightedSum / totalWeight : plainSum / produced;
        composite = Math.max(0.0, Math.min(1.0, composite));

        boolean degraded = semantic == null || (aiEnabled && aiScore == null);

        return MatchResult.builder()
                .key(key)
                .lexicalScore(lexical.score())
                .semanticScore(semantic)
                .aiScore(aiScore)
                .aiRationale(ai != null ? ai.rationale() : null)
                .compositeScore(composite)
                .rationale(buildRationale(lexical, semantic, aiScore, aiEnabled, composite))
                .strengths(buildStrengths(lexical, ai))
                .concerns(buildConcerns(lexical, ai))
                .computedAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .locked(false)
                .degraded(degraded)
                .algorithmVersion(scoringConfig.getAlgorithmVersion())
                .revision(0)
                .build();
    }

    private String buildRationale(LexicalMatch lexical, Double semantic, Double aiScore, boolean aiEnabled,
                                  double composite) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Composite %d/100 from lexical %.2f", Math.round(composite * 100),
                lexical.score()));
        if (semantic != null) {
            sb.append(String.format(Locale.ROOT, ", semantic %.2f", semantic));
        } else {
            sb.append(", semantic unavailable");
        }
        if (aiScore != null) {
            sb.append(String.format(Locale.ROOT, ", AI %.2f", aiScore));
        } else if (aiEnabled) {
            sb.append(", AI unavailable");
        }
        sb.append(". Matched ")
                .append(lexical.exactMatches().size() + lexical.partialMatches().size())
                .append(" requirement terms");
        if (!lexical.missingRequired().isEmpty()) {
            sb.append(", missing ").append(lexical.missingRequired().size()).append(" required");
        }
        return sb.append('.').toString();
    }

    private List<String> buildStrengths(LexicalMatch lexical, AiAssessment ai) {
        List<String> strengths = new ArrayList<>();
        lexical.exactMatches().forEach(term -> strengths.add("Matches skill: " + term));
        lexical.partialMatches().forEach(term -> strengths.add("Related experience: " + term));
        if (ai != null) {
            strengths.addAll(ai.strengths());
        }
        return List.copyOf(strengths);
    }

    private List<String> buildConcerns(LexicalMatch lexical, AiAssessment ai) {
        List<String> concerns = new ArrayList<>();
        lexical.missingRequired().forEach(term -> concerns.add("Missing required skill: " + term));
        if (ai != null) {
            concerns.addAll(ai.concerns());
        }
        return List.copyOf(concerns);
    }
}
