package com.flamingo.ai.factcheck.service.retrieval.index;

import java.util.Map;

/** A passage to store, with "source", "url" and "origin" metadata. */
public record IndexableDocument(String content, Map<String, String> metadata) {

  public static final String SOURCE = "source";
  public static final String URL = "url";
  public static final String ORIGIN = "origin";

  public String metadata(String key) {
    return metadata != null ? metadata.get(key) : null;
  }
}
