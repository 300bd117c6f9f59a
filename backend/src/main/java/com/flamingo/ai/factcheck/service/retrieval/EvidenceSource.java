package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import java.util.List;

/** A provider of raw evidence items for a claim. */
public interface EvidenceSource {

  /** False when the provider is not configured; lookups then return nothing. */
  boolean isAvailable();

  /**
   * Retrieves raw evidence for a claim. Relevance and rank are left unset.
   *
   * @param claim the claim text used as query
   * @param maxResults maximum number of items
   * @return items in provider order
   * @throws com.flamingo.ai.factcheck.exception.SearchException if the provider fails
   */
  List<EvidenceItem> lookup(String claim, int maxResults);
}
