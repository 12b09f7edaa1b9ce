package com.flamingo.ai.mathgrader.service.llm;

import com.flamingo.ai.mathgrader.config.GraderConfig;
import dev.langchain4j.model.chat.ChatModel;

/** Builds the chat model for a catalog entry. */
@FunctionalInterface
public interface ChatModelProvider {

  ChatModel chatModel(GraderConfig.Model model);
}
