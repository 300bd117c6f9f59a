package com.flamingo.ai.factcheck.service.retrieval.web;

import java.util.List;

/** Live web search. */
public interface WebSearchClient {

  /** False when no credential is configured; searches then return nothing without failing. */
  boolean isConfigured();

  /**
   * Searches the web.
   *
   * @param query the search query
   * @param maxResults maximum number of hits
   * @return hits in the provider's ranking order
   * @throws com.flamingo.ai.factcheck.exception.SearchException if a configured search fails
   */
  List<WebSearchHit> search(String query, int maxResults);
}
