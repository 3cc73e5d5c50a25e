package dev.resumeranker.config;

import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for sub-score weights, lexical matching and result locking.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig implements InitializingBean {

    private Weights weights = new Weights();
    private LockPolicy lockPolicy = LockPolicy.NON_DEGRADED;
    private int algorithmVersion = 1;
    private int maxParallelResumes = 8;
    private Lexical lexical = new Lexical();
    private Shortlist shortlist = new Shortlist();

    /**
     * When a freshly computed result becomes immutable.
     */
    public enum LockPolicy {
        /** Lock only results computed with every enabled signal present. */
        NON_DEGRADED,
        /** Lock every computed result. */
        ALWAYS,
        /** Never lock automatically; callers mark results final. */
        EXPLICIT
    }

    @Data
    public static class Weights {
        private double lexical = 0.4;
        private double semantic = 0.3;
        private double ai = 0.3;
    }

    @Data
    public static class Lexical {
        private double partialCredit = 0.5;
        private double requiredTermWeight = 2.0;
        private double preferredTermWeight = 1.0;
        private double missingRequiredPenalty = 0.9;
    }

    /**
     * Cut applied to ranked candidates to form the shortlist of a report.
     */
    @Data
    public static class Shortlist {
        /** Maximum shortlist size; 0 means unlimited. */
        private int topCandidates = 0;
        private double minCompositeScore = 0.0;
    }

    @Override
    public void afterPropertiesSet() {
        if (weights.getLexical() < 0 || weights.getSemantic() < 0 || weights.getAi() < 0) {
            throw new IllegalStateException("scoring.weights must not be negative: " + weights);
        }
        if (lexical.getPartialCredit() < 0 || lexical.getPartialCredit() > 1) {
            throw new IllegalStateException("scoring.lexical.partial-credit must be within [0,1]");
        }
        if (lexical.getMissingRequiredPenalty() < 0 || lexical.getMissingRequiredPenalty() > 1) {
            throw new IllegalStateException("scoring.lexical.missing-required-penalty must be within [0,1]");
        }
        if (shortlist.getTopCandidates() < 0) {
            throw new IllegalStateException("scoring.shortlist.top-candidates must not be negative");
        }
        if (shortlist.getMinCompositeScore() < 0 || shortlist.getMinCompositeScore() > 1) {
            throw new IllegalStateException("scoring.shortlist.min-composite-score must be within [0,1]");
        }
        if (maxParallelResumes < 1) {
            throw new IllegalStateException("scoring.max-parallel-resumes must be positive");
        }
    }
}
