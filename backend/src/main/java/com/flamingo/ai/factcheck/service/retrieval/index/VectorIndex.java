package com.flamingo.ai.factcheck.service.retrieval.index;

import java.util.List;

/** Similarity search and append over the local knowledge store. */
public interface VectorIndex {

  /**
   * Finds the stored passages closest to a query text.
   *
   * @param query the query text
   * @param k maximum number of neighbors
   * @return neighbors ordered by ascending distance
   * @throws com.flamingo.ai.factcheck.exception.SearchException if the index cannot be queried
   */
  List<IndexedNeighbor> nearestNeighbors(String query, int k);

  /**
   * Appends passages to the store. Safe to call from concurrent requests.
   *
   * @param documents passages with metadata
   * @return true when every passage was stored
   */
  boolean add(List<IndexableDocument> documents);

  /** Number of stored passages. */
  long size();
}
