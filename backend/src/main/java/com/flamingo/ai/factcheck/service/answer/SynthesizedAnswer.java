package com.flamingo.ai.factcheck.service.answer;

import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.model.Citation;
import java.util.List;

/** Verdict, explanation and citations produced for a claim. */
public record SynthesizedAnswer(
    Verdict verdict,
    String explanation,
    List<Citation> citations,
    String formattedCitations,
    List<EvidenceExcerpt> evidenceSummary) {

  /** Short excerpt of one cited evidence item. */
  public record EvidenceExcerpt(String source, String excerpt) {}
}
