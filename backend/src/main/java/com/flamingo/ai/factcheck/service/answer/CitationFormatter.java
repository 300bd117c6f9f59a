package com.flamingo.ai.factcheck.service.answer;

import com.flamingo.ai.factcheck.domain.model.Citation;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders citations as a numbered plain-text list. */
@Component
public class CitationFormatter {

  static final String NO_CITATIONS = "No citations available.";

  public String format(List<Citation> citations) {
    if (citations == null || citations.isEmpty()) {
      return NO_CITATIONS;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < citations.size(); i++) {
      Citation citation = citations.get(i);
      if (i > 0) {
        sb.append('\n');
      }
      sb.append(i + 1).append(". ").append(citation.source());
      if (citation.hasUrl()) {
        sb.append(" - ").append(citation.url());
      }
      sb.append(String.format(Locale.ROOT, " (relevance: %.2f)", citation.relevanceScore()));
    }
    return sb.toString();
  }
}
