package dev.resumeranker.service;

import dev.resumeranker.ai.AiAssessment;
import dev.resumeranker.ai.AiAssessmentService;
import dev.resumeranker.model.JobDescriptionRecord;
import dev.resumeranker.model.MatchResult;
import dev.resumeranker.model.ResultKey;
import dev.resumeranker.model.ResumeRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Computes a fresh, unlocked result by running the lexical, semantic and AI scorers
 * independently and aggregating what they produce.
 */
@Service
@RequiredArgsConstructor
public class CandidateScoringService {

    private final KeywordMatchingService keywordMatchingService;
    private final SemanticScoringService semanticScoringService;
    private final AiAssessmentService aiAssessmentService;
    private final ScoreAggregationService aggregationService;

    public Mono<MatchResult> compute(ResumeRecord resume, JobDescriptionRecord job) {
        ResultKey key = ResultKey.of(resume, job);
        boolean aiEnabled = aiAssessmentService.isActive();

        Mono<Optional<Double>> semantic = semanticScoringService
                .score(resume.getNormalizedText(), job.getNormalizedText())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
        Mono<Optional<AiAssessment>> ai = aiAssessmentService.assess(resume, job)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());

        return Mono.zip(semantic, ai)
                .map(scores -> aggregationService.aggregate(
                        key,
                        keywordMatchingService.match(resume, job),
                        scores.getT1().orElse(null),
                        scores.getT2().orElse(null),
                        aiEnabled));
    }
}
