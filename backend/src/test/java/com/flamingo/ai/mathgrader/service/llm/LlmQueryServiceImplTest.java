package com.flamingo.ai.mathgrader.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.LlmServiceException;
import com.flamingo.ai.mathgrader.exception.UnsupportedModelException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class LlmQueryServiceImplTest {

  private static final String MODEL = "GPT-4o-mini";

  private final List<ChatRequest> requests = new ArrayList<>();
  private final List<String> builtModels = new ArrayList<>();

  private GraderConfig config;
  private PromptSettings promptSettings;
  private MeterRegistry meterRegistry;
  private LlmQueryServiceImpl service;

  @BeforeEach
  void setUp() {
    config = new GraderConfig();
    promptSettings = new PromptSettings(config);
    meterRegistry = new SimpleMeterRegistry();
    ChatModelProvider provider =
        model -> {
          builtModels.add(model.getModelId());
          return new ChatModel() {
            @Override
            public ChatResponse doChat(ChatRequest request) {
              requests.add(request);
              return ChatResponse.builder().aiMessage(AiMessage.from("\\boxed{4}")).build();
            }
          };
        };
    service =
        new LlmQueryServiceImpl(new ModelCatalog(config), provider, promptSettings, meterRegistry);
  }

  @Nested
  @DisplayName("solve")
  class Solve {

    @Test
    @DisplayName("should append the current prompt suffix to the question")
    void shouldAppendSuffix() {
      // Given
      promptSettings.replacePromptSuffix("Box it.");

      // When
      String answer = service.solve("What is 2+2?", MODEL);

      // Then
      assertThat(answer).isEqualTo("\\boxed{4}");
      assertThat(requests).hasSize(1);
      assertThat(requests.get(0).messages().toString()).contains("What is 2+2?", "Box it.");
      assertThat(meterRegistry.counter("llm.requests.success", "model", MODEL).count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should build each model once")
    void shouldCacheAgents() {
      service.solve("q1", MODEL);
      service.solve("q2", MODEL);

      assertThat(builtModels).containsExactly("gpt-4o-mini");
    }

    @Test
    @DisplayName("should reject models outside the catalog")
    void shouldRejectUnknownModel() {
      assertThatThrownBy(() -> service.solve("q", "gpt-99"))
          .isInstanceOf(UnsupportedModelException.class)
          .hasMessageContaining("gpt-99");
      assertThat(builtModels).isEmpty();
    }
  }

  @Test
  @DisplayName("query should send the prompt without the suffix")
  void queryShouldNotAppendSuffix() {
    service.query("raw prompt", MODEL);

    assertThat(requests.get(0).messages().toString())
        .contains("raw prompt")
        .doesNotContain(promptSettings.getPromptSuffix());
  }

  @Test
  @DisplayName("supportedModels should list the catalog names")
  void shouldListModels() {
    assertThat(service.supportedModels()).contains(MODEL, "Gemini 2.0 Flash");
  }

  @Nested
  @DisplayName("queryFallback")
  class Fallback {

    @Test
    @DisplayName("should wrap provider failures")
    void shouldWrapFailure() {
      assertThatThrownBy(
              () ->
                  ReflectionTestUtils.invokeMethod(
                      service, "queryFallback", "q", MODEL, new RuntimeException("timeout")))
          .isInstanceOf(LlmServiceException.class)
          .hasMessageContaining(MODEL);
      assertThat(meterRegistry.counter("llm.requests.failure", "model", MODEL).count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should pass unsupported models through unchanged")
    void shouldRethrowUnsupportedModel() {
      UnsupportedModelException unsupported = new UnsupportedModelException("x", List.of(MODEL));

      assertThatThrownBy(
              () -> ReflectionTestUtils.invokeMethod(service, "queryFallback", "q", "x", unsupported))
          .isSameAs(unsupported);
    }
  }
}
