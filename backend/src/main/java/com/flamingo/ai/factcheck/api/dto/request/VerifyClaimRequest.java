package com.flamingo.ai.factcheck.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for verifying a claim. Blank and overlong claims are rejected by the pipeline against
 * {@code factcheck.claim.max-length}, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyClaimRequest {

  @NotNull(message = "Claim is required")
  private String claim;
}
