package com.flamingo.ai.factcheck.service.safety;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.factcheck.domain.enums.RiskLevel;
import com.flamingo.ai.factcheck.domain.enums.SafetyDecision;
import java.util.List;

/** Outcome of the safety review, including the answer text to deliver. */
public record SafetyReview(
    SafetyDecision decision,
    String reason,
    List<String> suggestions,
    RiskLevel riskLevel,
    List<String> foundKeywords,
    List<String> riskCategories,
    String disclaimer,
    String finalAnswer,
    boolean reviewFailed) {

  @JsonProperty("isSafe")
  public boolean safe() {
    return decision != SafetyDecision.REJECT;
  }

  @JsonProperty("requiresModification")
  public boolean requiresModification() {
    return decision == SafetyDecision.MODIFY;
  }
}
