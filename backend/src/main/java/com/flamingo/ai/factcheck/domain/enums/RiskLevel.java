package com.flamingo.ai.factcheck.domain.enums;

/** Risk of disallowed advice in an answer, graded by keyword hits. */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH;

  public static RiskLevel fromKeywordCount(int count) {
    if (count > 2) {
      return HIGH;
    }
    return count > 0 ? MEDIUM : LOW;
  }
}
