package com.flamingo.ai.factcheck.domain.enums;

import java.util.Locale;

/** States of the verification pipeline. */
public enum VerificationStage {
  START,
  SUPERVISOR,
  RETRIEVE,
  SELF_CHECK,
  ANSWER,
  SAFETY,
  DONE,
  ERROR;

  public boolean isTerminal() {
    return this == DONE || this == ERROR;
  }

  /** Key used for this stage in per-stage results. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
