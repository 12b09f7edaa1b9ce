package com.flamingo.ai.mathgrader.service.llm;

import com.flamingo.ai.mathgrader.agent.MathSolverAgent;
import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.LlmServiceException;
import com.flamingo.ai.mathgrader.exception.UnsupportedModelException;
import dev.langchain4j.service.AiServices;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link LlmQueryService} using one LangChain4j agent per catalog model.
 *
 * <p>Agents are built on first use and cached by display name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmQueryServiceImpl implements LlmQueryService {

  private final ModelCatalog catalog;
  private final ChatModelProvider chatModelProvider;
  private final PromptSettings promptSettings;
  private final MeterRegistry meterRegistry;

  private final Map<String, MathSolverAgent> agents = new ConcurrentHashMap<>();

  @Override
  @Timed(value = "llm.solve", description = "Time for a model to answer a question")
  @CircuitBreaker(name = "llm", fallbackMethod = "queryFallback")
  @Retry(name = "llm")
  public String solve(String question, String modelName) {
    MathSolverAgent agent = agent(modelName);
    log.debug("Asking '{}' to solve a {} char question", modelName, question.length());
    String answer = agent.solve(question, promptSettings.getPromptSuffix());
    meterRegistry.counter("llm.requests.success", "model", modelName).increment();
    return answer;
  }

  @Override
  @Timed(value = "llm.query", description = "Time for a raw model query")
  @CircuitBreaker(name = "llm", fallbackMethod = "queryFallback")
  @Retry(name = "llm")
  public String query(String prompt, String modelName) {
    MathSolverAgent agent = agent(modelName);
    log.debug("Sending raw {} char prompt to '{}'", prompt.length(), modelName);
    String answer = agent.ask(prompt);
    meterRegistry.counter("llm.requests.success", "model", modelName).increment();
    return answer;
  }

  @Override
  public List<String> supportedModels() {
    return catalog.names();
  }

  private MathSolverAgent agent(String modelName) {
    GraderConfig.Model model = catalog.resolve(modelName);
    return agents.computeIfAbsent(
        model.getName(),
        name ->
            AiServices.builder(MathSolverAgent.class)
                .chatModel(chatModelProvider.chatModel(model))
                .build());
  }

  @SuppressWarnings("unused")
  private String queryFallback(String text, String modelName, Throwable t) {
    if (t instanceof UnsupportedModelException unsupported) {
      throw unsupported;
    }
    log.error("Query to '{}' failed: {}", modelName, t.getMessage());
    meterRegistry.counter("llm.requests.failure", "model", modelName).increment();
    throw new LlmServiceException(modelName, "Query to '" + modelName + "' failed", t);
  }
}
