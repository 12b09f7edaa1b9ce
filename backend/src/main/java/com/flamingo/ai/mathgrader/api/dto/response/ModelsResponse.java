package com.flamingo.ai.mathgrader.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO listing the supported model names. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelsResponse {

  private boolean success;
  private List<String> models;
}
