package com.flamingo.ai.factcheck.api.rest;

import com.flamingo.ai.factcheck.api.dto.request.VerifyClaimRequest;
import com.flamingo.ai.factcheck.api.dto.response.VerificationResponse;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import com.flamingo.ai.factcheck.domain.model.VerificationResult;
import com.flamingo.ai.factcheck.service.pipeline.VerificationOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for claim verification. */
@RestController
@RequestMapping("/api/verifications")
@RequiredArgsConstructor
public class VerificationController {

  private final VerificationOrchestrator orchestrator;

  /**
   * Verifies a claim. A claim rejected by the supervisor answers 422; a failing provider answers
   * 503. Both carry the full verification body.
   */
  @PostMapping
  public ResponseEntity<VerificationResponse> verify(
      @Valid @RequestBody VerifyClaimRequest request) {
    VerificationResult result = orchestrator.verify(request.getClaim());
    return ResponseEntity.status(statusOf(result)).body(VerificationResponse.from(result));
  }

  private static HttpStatus statusOf(VerificationResult result) {
    if (result.success()) {
      return HttpStatus.OK;
    }
    return result.failedStage() == VerificationStage.SUPERVISOR
        ? HttpStatus.UNPROCESSABLE_ENTITY
        : HttpStatus.SERVICE_UNAVAILABLE;
  }
}
