package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Decides from normalized local evidence whether a web search is needed. */
@Component
@RequiredArgsConstructor
public class WebSearchPolicy {

  static final double MAX_MARGIN = 0.1;
  static final double WEAK_MAX = 0.6;
  static final double WEAK_AVERAGE = 0.5;

  private final FactCheckConfig config;

  public WebSearchDecision decide(List<EvidenceItem> localItems) {
    FactCheckConfig.Retrieval settings = config.getRetrieval();
    int count = localItems.size();
    double avg =
        localItems.stream().mapToDouble(EvidenceItem::getRelevanceScore).average().orElse(0.0);
    double max =
        localItems.stream().mapToDouble(EvidenceItem::getRelevanceScore).max().orElse(0.0);
    double threshold = settings.getWebSearchThreshold();

    String reason = null;
    if (count < settings.getMinLocalDocs()) {
      reason = "too few local documents";
    } else if (avg < threshold) {
      reason = "average relevance below threshold";
    } else if (max < threshold + MAX_MARGIN) {
      reason = "best relevance below threshold margin";
    } else if (max < WEAK_MAX && avg < WEAK_AVERAGE) {
      reason = "uniformly weak relevance";
    }
    return new WebSearchDecision(
        reason != null, count, avg, max, reason != null ? reason : "local evidence is strong");
  }

  public boolean shouldSearchWeb(List<EvidenceItem> localItems) {
    return decide(localItems).searchWeb();
  }
}
