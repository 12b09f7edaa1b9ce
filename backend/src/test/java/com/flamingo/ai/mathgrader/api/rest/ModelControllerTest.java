package com.flamingo.ai.mathgrader.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.GlobalExceptionHandler;
import com.flamingo.ai.mathgrader.service.llm.LlmQueryService;
import com.flamingo.ai.mathgrader.service.llm.PromptSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ModelControllerTest {

  @Mock private LlmQueryService llmQueryService;

  private PromptSettings promptSettings;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    promptSettings = new PromptSettings(new GraderConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ModelController(llmQueryService),
                new SettingsController(promptSettings),
                new HealthController())
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("GET /models lists supported models")
  void shouldListModels() throws Exception {
    when(llmQueryService.supportedModels()).thenReturn(List.of("GPT-4o-mini", "Gemini 2.0 Flash"));

    mockMvc
        .perform(get("/models"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.models[1]").value("Gemini 2.0 Flash"));
  }

  @Test
  @DisplayName("POST /query returns the raw model reply")
  void shouldQuery() throws Exception {
    when(llmQueryService.query("Say hi", "GPT-4o-mini")).thenReturn("hi");

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"Say hi\", \"model\": \"GPT-4o-mini\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.model").value("GPT-4o-mini"))
        .andExpect(jsonPath("$.response").value("hi"));
  }

  @Test
  @DisplayName("PUT /settings/prompt-suffix replaces the suffix")
  void shouldReplaceSuffix() throws Exception {
    mockMvc
        .perform(
            put("/settings/prompt-suffix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"suffix\": \"Box the answer.\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.suffix").value("Box the answer."));

    mockMvc
        .perform(get("/settings/prompt-suffix"))
        .andExpect(jsonPath("$.suffix").value("Box the answer."));
  }

  @Test
  @DisplayName("PUT /settings/prompt-suffix requires a suffix")
  void shouldRequireSuffix() throws Exception {
    mockMvc
        .perform(put("/settings/prompt-suffix").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("GET /health reports the service as healthy")
  void shouldReportHealth() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.service").value("math-grader"));
  }
}
