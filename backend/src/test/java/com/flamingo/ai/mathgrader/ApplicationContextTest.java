package com.flamingo.ai.mathgrader;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.service.grading.AnswerParsingService;
import com.flamingo.ai.mathgrader.service.grading.GradingService;
import com.flamingo.ai.mathgrader.service.llm.ChatModelProvider;
import com.flamingo.ai.mathgrader.service.llm.LlmQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The chat model provider is mocked so the test
 * runs without API keys.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModelProvider chatModelProvider;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(AnswerParsingService.class)).isNotNull();
    assertThat(applicationContext.getBean(GradingService.class)).isNotNull();
    assertThat(applicationContext.getBean(LlmQueryService.class)).isNotNull();
  }

  @Test
  @DisplayName("Default pipeline settings are bound from application.yml")
  void shouldBindGraderConfig() {
    GraderConfig config = applicationContext.getBean(GraderConfig.class);

    assertThat(config.getNormalizer().getNestedRuleCap()).isEqualTo(5);
    assertThat(config.getEquivalence().getNormalOrderingCap()).isEqualTo(100);
    assertThat(config.getLlm().getModels()).hasSize(4);
  }
}
