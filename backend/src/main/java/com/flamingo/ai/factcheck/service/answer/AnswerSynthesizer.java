package com.flamingo.ai.factcheck.service.answer;

import com.flamingo.ai.factcheck.agent.VerdictSynthesisAgent;
import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.enums.EvidenceOrigin;
import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.enums.SufficiencyQuality;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.model.Citation;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.domain.model.EvidenceSet;
import com.flamingo.ai.factcheck.domain.model.SufficiencyVerdict;
import com.flamingo.ai.factcheck.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes the verdict and explanation for a claim from its evidence.
 *
 * <p>Citations are built only from evidence items. When a web search contributed to the evidence,
 * only web items are cited; local fact-check documents then serve as background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  static final String INSUFFICIENT_TEMPLATE =
      "There is not enough evidence to verify the claim \"%s\". We recommend consulting primary"
          + " sources such as official agencies, peer-reviewed publications and recognized"
          + " fact-checking organizations.";

  private final VerdictSynthesisAgent synthesisAgent;
  private final VerdictResponseParser verdictParser;
  private final CitationFormatter citationFormatter;
  private final FactCheckConfig config;

  /**
   * Produces the answer. INSUFFICIENT evidence yields a fixed explanation without a model call.
   *
   * @throws LlmServiceException if the model call fails
   */
  @Timed(value = "answer.synthesis", description = "Time for verdict synthesis")
  public SynthesizedAnswer synthesize(
      String claim, EvidenceSet evidence, SufficiencyVerdict sufficiency, SearchSource source) {
    if (sufficiency == null || sufficiency.quality() == SufficiencyQuality.INSUFFICIENT) {
      return insufficient(claim);
    }

    String response;
    try {
      response = synthesisAgent.synthesize(claim, renderEvidence(evidence));
    } catch (RuntimeException e) {
      throw new LlmServiceException("Answer synthesis", e);
    }

    Verdict verdict = verdictParser.parse(response);
    List<EvidenceItem> citable = citable(evidence, source);
    List<Citation> citations = citable.stream().map(Citation::of).toList();
    log.info("Synthesized verdict {} with {} citations ({})", verdict, citations.size(), source);

    return new SynthesizedAnswer(
        verdict,
        response != null ? response.trim() : "",
        citations,
        citationFormatter.format(citations),
        summarize(citable));
  }

  public SynthesizedAnswer insufficient(String claim) {
    return new SynthesizedAnswer(
        Verdict.INSUFFICIENT,
        String.format(INSUFFICIENT_TEMPLATE, claim),
        List.of(),
        citationFormatter.format(List.of()),
        List.of());
  }

  static List<EvidenceItem> citable(EvidenceSet evidence, SearchSource source) {
    if (source != null && source.includesWeb()) {
      return evidence.fromOrigin(EvidenceOrigin.WEB);
    }
    return evidence.items();
  }

  private List<SynthesizedAnswer.EvidenceExcerpt> summarize(List<EvidenceItem> items) {
    int limit = config.getAnswer().getSummaryChars();
    return items.stream()
        .map(
            item -> {
              String content = item.getContent() != null ? item.getContent() : "";
              String excerpt =
                  content.length() > limit ? content.substring(0, limit) + "..." : content;
              return new SynthesizedAnswer.EvidenceExcerpt(item.getSourceId(), excerpt);
            })
        .toList();
  }

  private static String renderEvidence(EvidenceSet evidence) {
    StringBuilder sb = new StringBuilder();
    for (EvidenceItem item : evidence) {
      sb.append("Evidence ").append(item.getRank()).append(":\n");
      sb.append("Source: ").append(item.getSourceId()).append('\n');
      if (item.getUrl() != null) {
        sb.append("URL: ").append(item.getUrl()).append('\n');
      }
      sb.append(String.format(Locale.ROOT, "Relevance: %.2f%n", item.getRelevanceScore()));
      sb.append("Content: ").append(item.getContent()).append("\n\n");
    }
    return sb.toString().trim();
  }
}
