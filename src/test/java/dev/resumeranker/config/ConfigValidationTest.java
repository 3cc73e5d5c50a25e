package dev.resumeranker.config;

import dev.resumeranker.error.DuplicateThresholdInvalidException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidationTest {

    @Nested
    @DisplayName("Duplicate configuration")
    class DuplicateConfigTests {

        @ParameterizedTest
        @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
        @DisplayName("Should reject thresholds outside [0,1]")
        void shouldRejectInvalidThreshold(double threshold) {
            DuplicateConfig config = new DuplicateConfig();
            config.setThreshold(threshold);

            assertThatThrownBy(config::afterPropertiesSet)
                    .isInstanceOf(DuplicateThresholdInvalidException.class);
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.85, 1.0})
        @DisplayName("Should accept thresholds within [0,1]")
        void shouldAcceptValidThreshold(double threshold) {
            DuplicateConfig config = new DuplicateConfig();
            config.setThreshold(threshold);

            assertThatCode(config::afterPropertiesSet).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should reject a non-positive shingle size")
        void shouldRejectShingleSize() {
            DuplicateConfig config = new DuplicateConfig();
            config.setShingleSize(0);

            assertThatThrownBy(config::afterPropertiesSet).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Scoring configuration")
    class ScoringConfigTests {

        @Test
        @DisplayName("Should reject negative weights")
        void shouldRejectNegativeWeights() {
            ScoringConfig config = new ScoringConfig();
            config.getWeights().setSemantic(-0.1);

            assertThatThrownBy(config::afterPropertiesSet)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("scoring.weights");
        }

        @Test
        @DisplayName("Should reject a negative shortlist size or a minimum score above one")
        void shouldRejectInvalidShortlist() {
            ScoringConfig negativeSize = new ScoringConfig();
            negativeSize.getShortlist().setTopCandidates(-1);
            ScoringConfig highScore = new ScoringConfig();
            highScore.getShortlist().setMinCompositeScore(1.5);

            assertThatThrownBy(negativeSize::afterPropertiesSet)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("top-candidates");
            assertThatThrownBy(highScore::afterPropertiesSet)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("min-composite-score");
        }

        @Test
        @DisplayName("Should reject partial credit above one")
        void shouldRejectPartialCredit() {
            ScoringConfig config = new ScoringConfig();
            config.getLexical().setPartialCredit(1.5);

            assertThatThrownBy(config::afterPropertiesSet).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should accept the defaults")
        void shouldAcceptDefaults() {
            assertThatCode(() -> new ScoringConfig().afterPropertiesSet()).doesNotThrowAnyException();
        }
    }
}
