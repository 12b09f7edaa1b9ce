package com.flamingo.ai.mathgrader.service.llm;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import com.flamingo.ai.mathgrader.exception.UnsupportedModelException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Language models clients may pick by display name. */
@Component
@RequiredArgsConstructor
public class ModelCatalog {

  private final GraderConfig config;

  public List<String> names() {
    return config.getLlm().getModels().stream().map(GraderConfig.Model::getName).toList();
  }

  /**
   * Looks up a model by display name.
   *
   * @throws UnsupportedModelException if no model has that name
   */
  public GraderConfig.Model resolve(String name) {
    return config.getLlm().getModels().stream()
        .filter(model -> model.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new UnsupportedModelException(name, names()));
  }
}
