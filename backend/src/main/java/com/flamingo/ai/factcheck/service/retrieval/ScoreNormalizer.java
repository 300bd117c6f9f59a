package com.flamingo.ai.factcheck.service.retrieval;

import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.domain.model.EvidenceSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps provider scores onto a common 0..1 relevance scale and re-ranks merged evidence.
 *
 * <p>Local relevance is {@code 1 / (1 + distance)}. Web relevance decays with result position from
 * 0.8 down to a floor of 0.5.
 */
@Component
public class ScoreNormalizer {

  static final double WEB_TOP_RELEVANCE = 0.8;
  static final double WEB_POSITION_DECAY = 0.1;
  static final double WEB_MIN_RELEVANCE = 0.5;

  public double localRelevance(double distance) {
    return 1.0 / (1.0 + Math.max(0.0, distance));
  }

  public double webRelevance(int position) {
    return Math.max(WEB_MIN_RELEVANCE, WEB_TOP_RELEVANCE - WEB_POSITION_DECAY * position);
  }

  public List<EvidenceItem> normalizeLocal(List<EvidenceItem> items) {
    for (EvidenceItem item : items) {
      item.setRelevanceScore(localRelevance(item.getRawScore()));
    }
    return items;
  }

  public List<EvidenceItem> normalizeWeb(List<EvidenceItem> items) {
    for (int i = 0; i < items.size(); i++) {
      items.get(i).setRelevanceScore(webRelevance(i));
    }
    return items;
  }

  /**
   * Orders items by claim keyword overlap, then relevance, both descending. The sort is stable, so
   * ties keep their input order. Duplicates are dropped and ranks rebuilt as 1..n.
   */
  public EvidenceSet rerank(String claim, List<EvidenceItem> items) {
    Set<String> claimTokens = tokens(claim);
    List<EvidenceItem> ordered = new ArrayList<>(items);
    for (EvidenceItem item : ordered) {
      item.setKeywordOverlap(keywordOverlap(claimTokens, item.getContent()));
    }
    ordered.sort(
        Comparator.comparingInt(EvidenceItem::getKeywordOverlap)
            .thenComparingDouble(EvidenceItem::getRelevanceScore)
            .reversed());
    return EvidenceSet.ranked(ordered);
  }

  /** Number of distinct lowercase whitespace tokens of the claim that occur in the content. */
  static int keywordOverlap(Set<String> claimTokens, String content) {
    if (content == null || claimTokens.isEmpty()) {
      return 0;
    }
    Set<String> contentTokens = tokens(content);
    int overlap = 0;
    for (String token : claimTokens) {
      if (contentTokens.contains(token)) {
        overlap++;
      }
    }
    return overlap;
  }

  static Set<String> tokens(String text) {
    Set<String> tokens = new HashSet<>();
    if (text == null) {
      return tokens;
    }
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
