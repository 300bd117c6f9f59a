package com.flamingo.ai.factcheck.service.evaluation;

import com.flamingo.ai.factcheck.agent.EvidenceSufficiencyAgent;
import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.enums.SufficiencyQuality;
import com.flamingo.ai.factcheck.domain.model.EvidenceItem;
import com.flamingo.ai.factcheck.domain.model.EvidenceSet;
import com.flamingo.ai.factcheck.domain.model.SufficiencyVerdict;
import com.flamingo.ai.factcheck.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Judges whether an evidence set is enough to verify a claim. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceEvaluator {

  private static final Pattern RELEVANCE_WORDS =
      Pattern.compile("\\b(relevant|related|topic|similar)", Pattern.CASE_INSENSITIVE);

  private final EvidenceSufficiencyAgent sufficiencyAgent;
  private final SufficiencyResponseParser parser;
  private final FactCheckConfig config;

  /**
   * Evaluates the evidence for a claim. Empty evidence is INSUFFICIENT without a model call.
   *
   * @throws LlmServiceException if the model call fails
   */
  @Timed(value = "evaluation.sufficiency", description = "Time for evidence sufficiency check")
  public SufficiencyVerdict evaluate(String claim, EvidenceSet evidence) {
    if (evidence.isEmpty()) {
      return SufficiencyVerdict.noEvidence();
    }

    String response;
    try {
      response = sufficiencyAgent.assess(claim, renderPreview(evidence));
    } catch (RuntimeException e) {
      throw new LlmServiceException("Evidence evaluation", e);
    }

    SufficiencyVerdict verdict = escalate(parser.parse(response));
    log.info(
        "Sufficiency: {} (confidence={}, escalated={})",
        verdict.quality(),
        verdict.confidence(),
        verdict.escalated());
    return verdict;
  }

  /**
   * Upgrades a confident INSUFFICIENT to SUFFICIENT when the reasoning speaks of relevance. Words
   * like "irrelevant" or "unrelated" do not match.
   */
  SufficiencyVerdict escalate(SufficiencyVerdict raw) {
    if (raw.quality() == SufficiencyQuality.INSUFFICIENT
        && raw.confidence() > config.getEvaluation().getEscalationConfidence()
        && raw.reasoning() != null
        && RELEVANCE_WORDS.matcher(raw.reasoning()).find()) {
      log.debug("Escalating INSUFFICIENT to SUFFICIENT on relevance wording");
      return new SufficiencyVerdict(
          SufficiencyQuality.SUFFICIENT, raw.confidence(), raw.reasoning(), true);
    }
    return raw;
  }

  private String renderPreview(EvidenceSet evidence) {
    int previewChars = config.getEvaluation().getPreviewChars();
    StringBuilder sb = new StringBuilder();
    for (EvidenceItem item : evidence) {
      String content = item.getContent() != null ? item.getContent() : "";
      if (content.length() > previewChars) {
        content = content.substring(0, previewChars) + "...";
      }
      sb.append("Document ")
          .append(item.getRank())
          .append(" (")
          .append(item.getSourceId())
          .append(", relevance ")
          .append(String.format(Locale.ROOT, "%.2f", item.getRelevanceScore()))
          .append("):\n")
          .append(content)
          .append("\n\n");
    }
    return sb.toString().trim();
  }
}
