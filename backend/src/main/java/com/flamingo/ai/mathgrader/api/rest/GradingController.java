package com.flamingo.ai.mathgrader.api.rest;

import com.flamingo.ai.mathgrader.api.dto.request.CompareRequest;
import com.flamingo.ai.mathgrader.api.dto.request.EvalRequest;
import com.flamingo.ai.mathgrader.api.dto.request.LiteralEvalRequest;
import com.flamingo.ai.mathgrader.api.dto.request.ParseRequest;
import com.flamingo.ai.mathgrader.api.dto.response.GradingResponse;
import com.flamingo.ai.mathgrader.api.dto.response.LiteralGradingResponse;
import com.flamingo.ai.mathgrader.api.dto.response.ParsingResponse;
import com.flamingo.ai.mathgrader.service.grading.AnswerParsingService;
import com.flamingo.ai.mathgrader.service.grading.GradingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for parsing and grading answers.
 *
 * <p>Pipeline failures are part of the response body with HTTP 200; only malformed requests and
 * model failures produce error statuses.
 */
@RestController
@RequiredArgsConstructor
public class GradingController {

  private final AnswerParsingService parsingService;
  private final GradingService gradingService;

  /** Parses and, for numeric answers, evaluates one answer. */
  @PostMapping("/parse")
  public ResponseEntity<ParsingResponse> parse(@Valid @RequestBody ParseRequest request) {
    return ResponseEntity.ok(
        ParsingResponse.fromResult(
            parsingService.parse(
                request.getInput(), request.getParameters(), request.getFunctions())));
  }

  /** Grades a supplied answer against a solution. */
  @PostMapping("/compare")
  public ResponseEntity<GradingResponse> compare(@Valid @RequestBody CompareRequest request) {
    return ResponseEntity.ok(
        GradingResponse.fromResult(
            gradingService.compare(
                request.getInput(),
                request.getSolution(),
                request.getParameters(),
                request.getFunctions())));
  }

  /** Asks a model the question and grades its answer. */
  @PostMapping("/eval")
  public ResponseEntity<GradingResponse> evaluate(@Valid @RequestBody EvalRequest request) {
    return ResponseEntity.ok(
        GradingResponse.fromResult(
            gradingService.evaluate(
                request.getInput(),
                request.getSolution(),
                request.getParameters(),
                request.getFunctions(),
                request.getModel())));
  }

  /** Asks a model the question and compares its answer with an expected numeric literal. */
  @PostMapping("/eval_cmt_numerics")
  public ResponseEntity<LiteralGradingResponse> evaluateNumerics(
      @Valid @RequestBody LiteralEvalRequest request) {
    return ResponseEntity.ok(
        LiteralGradingResponse.fromResult(
            gradingService.evaluateNumericLiterals(
                request.getInput(), request.getSolution(), request.getModel())));
  }
}
