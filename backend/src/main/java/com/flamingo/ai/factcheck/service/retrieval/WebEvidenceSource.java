package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.service.retrieval.web.WebSearchClient;
import com.flamingo.ai.factcheck.service.retrieval.web.WebSearchHit;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Evidence from live web search. Raw score is the 0-based result position. */
@Component
@RequiredArgsConstructor
public class WebEvidenceSource implements EvidenceSource {

  private final WebSearchClient webSearchClient;

  @Override
  public boolean isAvailable() {
    return webSearchClient.isConfigured();
  }

  @Override
  public List<EvidenceItem> lookup(String claim, int maxResults) {
    if (!isAvailable()) {
      return List.of();
    }
    List<WebSearchHit> hits = webSearchClient.search(claim, maxResults);
    List<EvidenceItem> items = new ArrayList<>(hits.size());
    for (WebSearchHit hit : hits) {
      items.add(
          EvidenceItem.builder()
              .content(hit.content())
              .origin(EvidenceOrigin.WEB)
              .sourceId(hit.url())
              .url(hit.url())
              .rawScore(items.size())
              .build());
    }
    return items;
  }
}
