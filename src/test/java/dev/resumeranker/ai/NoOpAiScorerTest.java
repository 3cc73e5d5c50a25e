package dev.resumeranker.ai;

import dev.resumeranker.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NoOpAiScorerTest {

    private NoOpAiScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new NoOpAiScorer();
    }

    @Test
    @DisplayName("Should return false for isEnabled")
    void shouldReturnFalseForIsEnabled() {
        assertThat(scorer.isEnabled()).isFalse();
        assertThat(scorer.name()).isEqualTo("none");
    }

    @Test
    @DisplayName("Should complete without an assessment")
    void shouldCompleteEmpty() {
        StepVerifier.create(scorer.assess(
                        TestFixtures.resume("r1", "fp1", Set.of("java")),
                        TestFixtures.job(Set.of("java"), Set.of())))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should complete without a detailed analysis")
    void shouldCompleteEmptyAnalysis() {
        StepVerifier.create(scorer.analyze(
                        TestFixtures.resume("r1", "fp1", Set.of("java")),
                        TestFixtures.job(Set.of("java"), Set.of())))
                .verifyComplete();
    }
}
