package com.flamingo.ai.mathgrader.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the grading pipeline. */
@Configuration
@ConfigurationProperties(prefix = "grader")
@Getter
@Setter
public class GraderConfig {

  private Normalizer normalizer = new Normalizer();
  private Sampling sampling = new Sampling();
  private Equivalence equivalence = new Equivalence();
  private Llm llm = new Llm();

  @Getter
  @Setter
  public static class Normalizer {
    /** Maximum passes of the nested rewrite rules; the phase stops quietly when reached. */
    private int nestedRuleCap = 5;
  }

  @Getter
  @Setter
  public static class Sampling {
    private long seed = 42L;
    private double lower = 1.0;
    private double upper = 2.0;

    /** Parameter held at a fixed value instead of being sampled. */
    private String pinnedVariable = "x";

    private double pinnedValue = 2.0;
  }

  @Getter
  @Setter
  public static class Equivalence {
    private double absoluteTolerance = 1e-6;
    private double relativeTolerance = 1e-5;

    /** Maximum normal-ordering passes before the comparison fails. */
    private int normalOrderingCap = 100;
  }

  @Getter
  @Setter
  public static class Llm {
    private String promptSuffix =
        "Put the final answer in a single \\boxed{}. Separate multiple answers with semicolons.";
    private int timeoutSeconds = 120;
    private int maxCompletionTokens = 8192;
    private List<Model> models = new ArrayList<>(defaultModels());
  }

  @Getter
  @Setter
  public static class Model {
    /** Display name clients use to pick the model. */
    private String name;

    /** Provider key: {@code openai} or {@code gemini}. */
    private String provider;

    /** Provider-side model id. */
    private String modelId;

    public Model() {}

    public Model(String name, String provider, String modelId) {
      this.name = name;
      this.provider = provider;
      this.modelId = modelId;
    }
  }

  static List<Model> defaultModels() {
    return List.of(
        new Model("GPT-4o-mini", "openai", "gpt-4o-mini"),
        new Model("Gemini 2.0 Flash", "gemini", "gemini-2.0-flash"),
        new Model("Gemini 2.0 Flash Thinking", "gemini", "gemini-2.0-flash-thinking-exp-01-21"),
        new Model("Gemini 2.5 Flash Thinking", "gemini", "gemini-2.5-flash"));
  }
}
