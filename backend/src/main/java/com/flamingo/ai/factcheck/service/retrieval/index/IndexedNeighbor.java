package com.flamingo.ai.factcheck.service.retrieval.index;

import java.util.Map;

/**
 * A stored passage returned by a similarity search.
 *
 * @param distance cosine distance to the query, 0 for identical direction, lower is closer
 */
public record IndexedNeighbor(String content, Map<String, String> metadata, double distance) {

  public String metadata(String key) {
    return metadata != null ? metadata.get(key) : null;
  }
}
