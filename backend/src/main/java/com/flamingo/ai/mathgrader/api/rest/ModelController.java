package com.flamingo.ai.mathgrader.api.rest;

import com.flamingo.ai.mathgrader.api.dto.request.QueryRequest;
import com.flamingo.ai.mathgrader.api.dto.response.ModelsResponse;
import com.flamingo.ai.mathgrader.api.dto.response.QueryResponse;
import com.flamingo.ai.mathgrader.service.llm.LlmQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the language model catalog and raw queries. */
@RestController
@RequiredArgsConstructor
public class ModelController {

  private final LlmQueryService llmQueryService;

  /** Lists the supported model names. */
  @GetMapping("/models")
  public ResponseEntity<ModelsResponse> models() {
    return ResponseEntity.ok(new ModelsResponse(true, llmQueryService.supportedModels()));
  }

  /** Sends a prompt to a model unchanged. */
  @PostMapping("/query")
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    String response = llmQueryService.query(request.getPrompt(), request.getModel());
    return ResponseEntity.ok(new QueryResponse(request.getModel(), response));
  }
}
