package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.service.retrieval.index.IndexableDocument;
import com.flamingo.ai.factcheck.service.retrieval.index.IndexedNeighbor;
import com.flamingo.ai.factcheck.service.retrieval.index.VectorIndex;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Evidence from the local vector index. Raw score is the cosine distance. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalEvidenceSource implements EvidenceSource {

  private final VectorIndex vectorIndex;

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public List<EvidenceItem> lookup(String claim, int maxResults) {
    List<IndexedNeighbor> neighbors = vectorIndex.nearestNeighbors(claim, maxResults);
    List<EvidenceItem> items = new ArrayList<>(neighbors.size());
    for (IndexedNeighbor neighbor : neighbors) {
      if (neighbor.content() == null || neighbor.content().isBlank()) {
        continue;
      }
      items.add(
          EvidenceItem.builder()
              .content(neighbor.content())
              .origin(EvidenceOrigin.LOCAL)
              .sourceId(sourceIdOf(neighbor))
              .url(neighbor.metadata(IndexableDocument.URL))
              .rawScore(neighbor.distance())
              .build());
    }
    log.debug("Local index returned {} items", items.size());
    return items;
  }

  private static String sourceIdOf(IndexedNeighbor neighbor) {
    String source = neighbor.metadata(IndexableDocument.SOURCE);
    if (source != null && !source.isBlank()) {
      return source;
    }
    String id = neighbor.metadata("id");
    return id != null ? id : "unknown";
  }
}
