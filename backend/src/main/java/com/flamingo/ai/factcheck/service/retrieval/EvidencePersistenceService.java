package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.service.retrieval.index.IndexableDocument;
import com.flamingo.ai.factcheck.service.retrieval.index.VectorIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stores freshly retrieved web evidence in the local index so later requests can find it locally.
 * Failures are logged and reported as {@code false}; they never fail the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidencePersistenceService {

  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;

  public boolean persist(List<EvidenceItem> webItems) {
    if (webItems.isEmpty()) {
      return false;
    }
    List<IndexableDocument> documents =
        webItems.stream().map(EvidencePersistenceService::toDocument).toList();
    try {
      boolean stored = vectorIndex.add(documents);
      if (stored) {
        meterRegistry.counter("retrieval.persisted").increment(documents.size());
        log.info("Persisted {} web evidence items to the local index", documents.size());
      } else {
        log.warn("Local index rejected {} web evidence items", documents.size());
      }
      return stored;
    } catch (RuntimeException e) {
      log.warn("Failed to persist web evidence: {}", e.getMessage());
      return false;
    }
  }

  private static IndexableDocument toDocument(EvidenceItem item) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(IndexableDocument.SOURCE, item.getSourceId());
    metadata.put(IndexableDocument.ORIGIN, "web");
    if (item.getUrl() != null) {
      metadata.put(IndexableDocument.URL, item.getUrl());
    }
    return new IndexableDocument(item.getContent(), metadata);
  }
}
