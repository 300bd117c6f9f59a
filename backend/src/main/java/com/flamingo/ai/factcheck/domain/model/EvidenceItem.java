package com.flamingo.ai.factcheck.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One retrieved document fragment with provenance and scores.
 *
 * <p>{@code rawScore} is provider specific: a cosine distance for local items (lower is closer) and
 * the 0-based result position for web items. {@code relevanceScore} is filled by the score
 * normalizer and {@code rank} by the re-rank step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceItem {

  private String content;
  private EvidenceOrigin origin;

  /** File path for local items, URL for web items. */
  private String sourceId;

  private String url;
  private double rawScore;
  @Builder.Default private double relevanceScore = 0.0;
  @Builder.Default private int rank = 0;

  // Claim/content token overlap, computed during re-rank
  @JsonIgnore @Builder.Default private int keywordOverlap = 0;

  /** Identity of the item inside an evidence set. */
  @JsonIgnore
  public String identity() {
    return origin + "|" + sourceId;
  }
}
