package com.flamingo.ai.mathgrader.config;

import com.flamingo.ai.mathgrader.service.llm.ChatModelProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Both providers are reached through the OpenAI chat API; Gemini through Google's
 * OpenAI-compatible endpoint. Keys are checked when a model is first used, so the service starts
 * without them.
 */
@Configuration
public class LangChain4jConfig {

  static final String OPENAI = "openai";
  static final String GEMINI = "gemini";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String openAiBaseUrl;

  @Value("${langchain4j.gemini.api-key:}")
  private String geminiApiKey;

  @Value("${langchain4j.gemini.base-url:https://generativelanguage.googleapis.com/v1beta/openai/}")
  private String geminiBaseUrl;

  @Bean
  public ChatModelProvider chatModelProvider(GraderConfig graderConfig) {
    GraderConfig.Llm llm = graderConfig.getLlm();
    return model -> buildChatModel(model, llm);
  }

  ChatModel buildChatModel(GraderConfig.Model model, GraderConfig.Llm llm) {
    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .modelName(model.getModelId())
            .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
            .logRequests(false)
            .logResponses(false);
    switch (model.getProvider()) {
      case OPENAI -> {
        validateApiKey(openAiApiKey, "OpenAI", "OPENAI_API_KEY");
        builder
            .apiKey(openAiApiKey)
            .baseUrl(openAiBaseUrl)
            .maxCompletionTokens(llm.getMaxCompletionTokens());
      }
      case GEMINI -> {
        validateApiKey(geminiApiKey, "Gemini", "GEMINI_API_KEY");
        builder.apiKey(geminiApiKey).baseUrl(geminiBaseUrl).maxTokens(llm.getMaxCompletionTokens());
      }
      default ->
          throw new IllegalStateException(
              "Unknown provider '" + model.getProvider() + "' for model " + model.getName());
    }
    return builder.build();
  }

  private static void validateApiKey(String apiKey, String provider, String variable) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          provider + " API key is required. Set " + variable + " environment variable.");
    }
  }
}
