package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.model.EvidenceSet;

/** Result of a hybrid retrieval. {@code error} is set only when {@code source} is ERROR. */
public record RetrievalOutcome(
    EvidenceSet evidence,
    SearchSource source,
    boolean webSearchTriggered,
    int localCount,
    int webCount,
    String error) {

  public static RetrievalOutcome failure(String error) {
    return new RetrievalOutcome(EvidenceSet.empty(), SearchSource.ERROR, false, 0, 0, error);
  }

  public boolean failed() {
    return source == SearchSource.ERROR;
  }

  /** True when retrieval succeeded and produced at least one item. */
  public boolean searchSuccessful() {
    return !failed() && !evidence.isEmpty();
  }
}
