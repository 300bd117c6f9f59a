package com.flamingo.ai.factcheck.domain.enums;

/** Provider an evidence item was retrieved from. */
public enum EvidenceOrigin {
  LOCAL,
  WEB
}
