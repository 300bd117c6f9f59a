package com.flamingo.ai.factcheck.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which providers contributed to a retrieval outcome. */
public enum SearchSource {
  LOCAL_ONLY("local_only"),
  HYBRID("hybrid"),
  WEB_ONLY("web_only"),
  ERROR("error");

  private final String label;

  SearchSource(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /** True when a web search contributed items, so citations are restricted to web evidence. */
  public boolean includesWeb() {
    return this == HYBRID || this == WEB_ONLY;
  }
}
