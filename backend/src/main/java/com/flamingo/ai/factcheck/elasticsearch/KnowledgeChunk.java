package com.flamingo.ai.factcheck.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A curated fact-check passage, or a persisted web result, stored with its embedding in the
 * knowledge index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String content;

  /** File path of a curated document, or the URL a web result was found at. */
  private String source;

  private String url;

  /** "local" for curated documents, "web" for persisted web results. */
  @Builder.Default private String origin = "local";

  private List<Float> embedding;

  // Raw Elasticsearch score of the hit this chunk was read from
  private Double searchScore;
}
