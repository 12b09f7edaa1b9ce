package com.flamingo.ai.mathgrader.api.rest;

import com.flamingo.ai.mathgrader.api.dto.request.PromptSuffixRequest;
import com.flamingo.ai.mathgrader.api.dto.response.PromptSuffixResponse;
import com.flamingo.ai.mathgrader.service.llm.PromptSettings;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for runtime settings. */
@RestController
@RequestMapping("/settings")
@RequiredArgsConstructor
public class SettingsController {

  private final PromptSettings promptSettings;

  /** Returns the answer format instruction appended to solver prompts. */
  @GetMapping("/prompt-suffix")
  public ResponseEntity<PromptSuffixResponse> getPromptSuffix() {
    return ResponseEntity.ok(new PromptSuffixResponse(promptSettings.getPromptSuffix()));
  }

  /** Replaces the answer format instruction. */
  @PutMapping("/prompt-suffix")
  public ResponseEntity<PromptSuffixResponse> updatePromptSuffix(
      @Valid @RequestBody PromptSuffixRequest request) {
    promptSettings.replacePromptSuffix(request.getSuffix());
    return ResponseEntity.ok(new PromptSuffixResponse(promptSettings.getPromptSuffix()));
  }
}
