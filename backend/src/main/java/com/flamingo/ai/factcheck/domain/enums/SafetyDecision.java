package com.flamingo.ai.factcheck.domain.enums;

import java.util.Locale;

/** Outcome of the safety review of a synthesized answer. */
public enum SafetyDecision {
  APPROVE,
  MODIFY,
  REJECT;

  /** Parses a reviewer label; anything unrecognized is treated as APPROVE. */
  public static SafetyDecision fromLabel(String label) {
    if (label == null) {
      return APPROVE;
    }
    String normalized = label.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
    for (SafetyDecision decision : values()) {
      if (decision.name().equals(normalized)) {
        return decision;
      }
    }
    return APPROVE;
  }
}
