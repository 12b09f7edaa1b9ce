package com.flamingo.ai.mathgrader.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.openai.OpenAiChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class LangChain4jConfigTest {

  private final GraderConfig graderConfig = new GraderConfig();
  private final LangChain4jConfig config = new LangChain4jConfig();

  @Test
  @DisplayName("a missing API key is reported when the model is first built")
  void missingKeyFailsLazily() {
    GraderConfig.Model gemini = new GraderConfig.Model("Gemini", "gemini", "gemini-2.0-flash");

    assertThatThrownBy(() -> config.buildChatModel(gemini, graderConfig.getLlm()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("GEMINI_API_KEY");
  }

  @Test
  @DisplayName("OpenAI models are built with the configured key")
  void buildsOpenAiModel() {
    ReflectionTestUtils.setField(config, "openAiApiKey", "test-key");
    ReflectionTestUtils.setField(config, "openAiBaseUrl", "https://api.openai.com/v1");
    GraderConfig.Model model = new GraderConfig.Model("GPT", "openai", "gpt-4o-mini");

    assertThat(config.buildChatModel(model, graderConfig.getLlm()))
        .isInstanceOf(OpenAiChatModel.class);
  }

  @Test
  @DisplayName("unknown providers are rejected")
  void unknownProvider() {
    GraderConfig.Model model = new GraderConfig.Model("Local", "ollama", "llama3");

    assertThatThrownBy(() -> config.buildChatModel(model, graderConfig.getLlm()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Unknown provider");
  }
}
