package com.flamingo.ai.factcheck.domain.model;

import com.flamingo.ai.factcheck.domain.enums.SufficiencyQuality;

/** Judgment of whether the evidence supports reaching a conclusion. */
public record SufficiencyVerdict(
    SufficiencyQuality quality, double confidence, String reasoning, boolean escalated) {

  public SufficiencyVerdict {
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static SufficiencyVerdict noEvidence() {
    return new SufficiencyVerdict(
        SufficiencyQuality.INSUFFICIENT, 0.0, "No evidence was found for the claim", false);
  }

  public boolean shouldProceed() {
    return quality.allowsAnswer();
  }
}
