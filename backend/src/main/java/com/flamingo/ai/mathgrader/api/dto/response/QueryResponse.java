package com.flamingo.ai.mathgrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a raw model query. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  private String model;
  private String response;
}
