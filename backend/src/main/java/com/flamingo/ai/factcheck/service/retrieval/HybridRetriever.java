package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.domain.model.EvidenceSet;
import com.flamingo.ai.factcheck.exception.SearchException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Local-first evidence retrieval with a conditional web search.
 *
 * <p>Local items are filtered by relevance; when too few pass, the best few are kept regardless of
 * score. If {@link WebSearchPolicy} judges the local evidence weak, the web is searched, new web
 * items are offered to {@link EvidencePersistenceService}, and both lists are merged and re-ranked.
 * A provider failure yields an ERROR outcome with an empty evidence set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

  private final LocalEvidenceSource localSource;
  private final WebEvidenceSource webSource;
  private final ScoreNormalizer scoreNormalizer;
  private final WebSearchPolicy webSearchPolicy;
  private final EvidencePersistenceService persistenceService;
  private final FactCheckConfig config;
  private final MeterRegistry meterRegistry;

  @Timed(value = "retrieval.hybrid", description = "Time for hybrid evidence retrieval")
  public RetrievalOutcome retrieve(String claim) {
    try {
      return doRetrieve(claim);
    } catch (SearchException e) {
      log.error("Evidence lookup failed at {}: {}", e.getProvider(), e.getMessage());
      return RetrievalOutcome.failure(e.getMessage());
    }
  }

  private RetrievalOutcome doRetrieve(String claim) {
    FactCheckConfig.Retrieval settings = config.getRetrieval();

    List<EvidenceItem> local =
        scoreNormalizer.normalizeLocal(localSource.lookup(claim, settings.getTopK()));
    List<EvidenceItem> keptLocal = applyThreshold(local, settings);

    WebSearchDecision decision = webSearchPolicy.decide(keptLocal);
    log.info(
        "Local retrieval: {} items kept of {}, avg={}, max={}, searchWeb={} ({})",
        keptLocal.size(),
        local.size(),
        String.format("%.3f", decision.averageRelevance()),
        String.format("%.3f", decision.maxRelevance()),
        decision.searchWeb(),
        decision.reason());

    List<EvidenceItem> web = List.of();
    boolean webTriggered = decision.searchWeb() && webSource.isAvailable();
    if (webTriggered) {
      meterRegistry.counter("retrieval.web.triggered").increment();
      int maxResults = Math.min(3, config.getWebSearch().getMaxResults());
      web = scoreNormalizer.normalizeWeb(new ArrayList<>(webSource.lookup(claim, maxResults)));
      if (!web.isEmpty()) {
        persistenceService.persist(web);
      }
    } else if (decision.searchWeb()) {
      log.debug("Web search wanted but not configured; staying local");
    }

    List<EvidenceItem> merged = new ArrayList<>(keptLocal);
    merged.addAll(web);
    EvidenceSet evidence = scoreNormalizer.rerank(claim, merged);

    SearchSource source = label(keptLocal.isEmpty(), web.isEmpty());
    return new RetrievalOutcome(
        evidence, source, webTriggered, keptLocal.size(), web.size(), null);
  }

  private List<EvidenceItem> applyThreshold(
      List<EvidenceItem> local, FactCheckConfig.Retrieval settings) {
    List<EvidenceItem> passing =
        local.stream()
            .filter(item -> item.getRelevanceScore() >= settings.getScoreThreshold())
            .toList();
    if (passing.size() >= settings.getMinScoredResults()) {
      return passing;
    }
    return local.stream()
        .sorted(Comparator.comparingDouble(EvidenceItem::getRelevanceScore).reversed())
        .limit(settings.getRelaxedResultCount())
        .toList();
  }

  /**
   * Labels an outcome by the providers that contributed items. A web search that ran but returned
   * nothing is labeled {@code local_only}; {@code webSearchTriggered} still records that it ran.
   */
  static SearchSource label(boolean localEmpty, boolean webEmpty) {
    if (webEmpty) {
      return SearchSource.LOCAL_ONLY;
    }
    return localEmpty ? SearchSource.WEB_ONLY : SearchSource.HYBRID;
  }
}
