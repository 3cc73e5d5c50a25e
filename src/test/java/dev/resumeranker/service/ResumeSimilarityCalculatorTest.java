package dev.resumeranker.service;

import dev.resumeranker.TestFixtures;
import dev.resumeranker.config.DuplicateConfig;
import dev.resumeranker.extraction.TextAnalyzer;
import dev.resumeranker.model.ContactInfo;
import dev.resumeranker.model.DuplicateCriterion;
import dev.resumeranker.model.PairSimilarity;
import dev.resumeranker.model.ResumeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResumeSimilarityCalculatorTest {

    private static final String TEXT = "senior java engineer with ten years of spring boot and kafka experience";

    private ResumeSimilarityCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ResumeSimilarityCalculator(new TextAnalyzer(), new DuplicateConfig());
    }

    private ResumeRecord resume(String id, String text, String email, Set<String> skills) {
        ResumeRecord resume = TestFixtures.resume(id, "fp-" + id, skills);
        resume.setNormalizedText(text);
        resume.setContact(new ContactInfo("", email, ""));
        return resume;
    }

    @Nested
    @DisplayName("Strong signals")
    class StrongSignalTests {

        @Test
        @DisplayName("Should treat identical text with the same email as a contact match")
        void shouldMatchIdenticalTextAndEmail() {
            ResumeRecord a = resume("a", TEXT, "a@x.com", Set.of("java"));
            ResumeRecord b = resume("b", TEXT, "A@X.com", Set.of("java"));

            PairSimilarity pair = calculator.compare(a, b, 0.8, 0.8);

            assertThat(pair.content()).isEqualTo(1.0);
            assertThat(pair.contact()).isEqualTo(1.0);
            assertThat(pair.overall()).isEqualTo(1.0);
            assertThat(pair.trigger()).isEqualTo(DuplicateCriterion.CONTACT);
            assertThat(pair.firstId()).isEqualTo("a");
            assertThat(pair.secondId()).isEqualTo("b");
        }

        @Test
        @DisplayName("Should flag identical text with different contacts on content")
        void shouldMatchIdenticalContent() {
            ResumeRecord a = resume("a", TEXT, "a@x.com", Set.of());
            ResumeRecord b = resume("b", TEXT, "b@y.com", Set.of());

            PairSimilarity pair = calculator.compare(a, b, 0.8, 0.3);

            assertThat(pair.overall()).isEqualTo(1.0);
            assertThat(pair.trigger()).isEqualTo(DuplicateCriterion.CONTENT);
        }

        @Test
        @DisplayName("Should flag different text sharing a phone number on contact")
        void shouldMatchSharedPhone() {
            ResumeRecord a = resume("a", TEXT, "", Set.of());
            ResumeRecord b = resume("b", "python data scientist", "", Set.of());
            a.setContact(new ContactInfo("", "", "+15551234567"));
            b.setContact(new ContactInfo("", "", "+15551234567"));

            PairSimilarity pair = calculator.compare(a, b, 0.5, 0.5);

            assertThat(pair.overall()).isEqualTo(1.0);
            assertThat(pair.trigger()).isEqualTo(DuplicateCriterion.CONTACT);
        }
    }

    @Nested
    @DisplayName("Blended similarity")
    class BlendTests {

        @Test
        @DisplayName("Should blend content and skill overlap when no strong signal exists")
        void shouldBlendContentAndSkills() {
            ResumeRecord a = resume("a", "alpha beta", "", Set.of("java", "kafka"));
            ResumeRecord b = resume("b", "gamma delta", "", Set.of("java", "kafka"));

            PairSimilarity pair = calculator.compare(a, b, 0.5, 0.5);

            assertThat(pair.content()).isZero();
            assertThat(pair.skills()).isEqualTo(1.0);
            assertThat(pair.overall()).isCloseTo(0.4, within(1e-9));
            assertThat(pair.trigger()).isEqualTo(DuplicateCriterion.BLEND);
        }

        @Test
        @DisplayName("Should score unrelated resumes at zero")
        void shouldScoreUnrelatedAtZero() {
            ResumeRecord a = resume("a", TEXT, "a@x.com", Set.of("java"));
            ResumeRecord b = resume("b", "registered nurse in pediatric intensive care unit", "b@y.com", Set.of("sql"));

            PairSimilarity pair = calculator.compare(a, b, 0.9, 0.1);

            assertThat(pair.overall()).isZero();
            assertThat(pair.scoreProximity()).isCloseTo(0.2, within(1e-9));
        }

        @Test
        @DisplayName("Should compare short texts on single words")
        void shouldFallBackToUnigrams() {
            assertThat(calculator.contentSimilarity("java developer", "java engineer"))
                    .isCloseTo(1.0 / 3, within(1e-9));
        }

        @Test
        @DisplayName("Should score empty texts at zero")
        void shouldScoreEmptyTextsAtZero() {
            assertThat(calculator.contentSimilarity("", "")).isZero();
        }

        @Test
        @DisplayName("Should ignore missing contact fields")
        void shouldIgnoreMissingContacts() {
            assertThat(calculator.contactSimilarity(ContactInfo.EMPTY, ContactInfo.EMPTY)).isZero();
        }
    }
}
