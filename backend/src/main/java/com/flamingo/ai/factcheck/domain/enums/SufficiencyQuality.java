package com.flamingo.ai.factcheck.domain.enums;

/** Whether an evidence set allows a conclusion about a claim. */
public enum SufficiencyQuality {
  SUFFICIENT,
  INSUFFICIENT,
  CONTRADICTORY;

  /** Evidence of this quality is handed on to answer synthesis. */
  public boolean allowsAnswer() {
    return this == SUFFICIENT || this == CONTRADICTORY;
  }
}
