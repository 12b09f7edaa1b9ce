package com.flamingo.ai.mathgrader.service.llm;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Process-wide answer format instruction appended to every solver prompt. */
@Component
@Slf4j
public class PromptSettings {

  private final AtomicReference<String> promptSuffix;

  public PromptSettings(GraderConfig config) {
    this.promptSuffix = new AtomicReference<>(config.getLlm().getPromptSuffix());
  }

  public String getPromptSuffix() {
    return promptSuffix.get();
  }

  /** Replaces the suffix and returns the previous one. */
  public String replacePromptSuffix(String suffix) {
    String previous = promptSuffix.getAndSet(suffix);
    log.info("Prompt suffix replaced ({} -> {} chars)", previous.length(), suffix.length());
    return previous;
  }
}
