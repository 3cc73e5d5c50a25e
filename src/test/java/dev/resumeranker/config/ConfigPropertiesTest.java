package dev.resumeranker.config;

import dev.resumeranker.ExitManager;
import dev.resumeranker.PipelineRunner;
import dev.resumeranker.model.SurvivorCriterion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private ScoringConfig scoringConfig;

  @Autowired
  private DuplicateConfig duplicateConfig;

  @Autowired
  private ExtractionConfig extractionConfig;

  @Autowired
  private AiConfig aiConfig;

  @Autowired
  private EmbeddingConfig embeddingConfig;

  @Test
  void shouldLoadScoringConfig() {
    assertThat(scoringConfig.getWeights().getLexical()).isPositive();
    assertThat(scoringConfig.getLockPolicy()).isEqualTo(ScoringConfig.LockPolicy.NON_DEGRADED);
    assertThat(scoringConfig.getShortlist().getTopCandidates()).isEqualTo(10);
    assertThat(scoringConfig.getShortlist().getMinCompositeScore()).isEqualTo(0.1);
  }

  @Test
  void shouldLoadDuplicateConfig() {
    assertThat(duplicateConfig.getThreshold()).isBetween(0.0, 1.0);
    assertThat(duplicateConfig.getSurvivorOrder()).startsWith(SurvivorCriterion.SCORE);
  }

  @Test
  void shouldLoadSkillVocabulary() {
    // Just verify the imported skills file is present
    assertThat(extractionConfig.getSkillVocabulary()).contains("java", "kafka");
  }

  @Test
  void shouldLoadAiAndEmbeddingConfig() {
    assertThat(aiConfig.isEnabled()).isFalse();
    assertThat(embeddingConfig.getProvider()).isEqualTo("hashing");
  }
}
