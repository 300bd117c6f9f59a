package com.flamingo.ai.factcheck.domain.model;

/** Source reference kept in the final result, without the evidence content. */
public record Citation(String source, String url, double relevanceScore) {

  public static Citation of(EvidenceItem item) {
    return new Citation(item.getSourceId(), item.getUrl(), item.getRelevanceScore());
  }

  public boolean hasUrl() {
    return url != null && !url.isBlank();
  }
}
