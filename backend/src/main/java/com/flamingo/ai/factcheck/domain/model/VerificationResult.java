package com.flamingo.ai.factcheck.domain.model;

import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Outcome of one verification request, as returned to callers of the pipeline. */
public record VerificationResult(
    boolean success,
    String claim,
    Verdict verdict,
    String finalAnswer,
    List<Citation> citations,
    String formattedCitations,
    SearchSource searchSource,
    Map<String, Object> perStageResults,
    String error,
    VerificationStage failedStage) {

  public static VerificationResult from(VerificationState state) {
    Map<String, Object> stages = new LinkedHashMap<>(state.getPerStageResults());
    stages.put("trail", state.getTrail().stream().map(Enum::name).toList());
    return new VerificationResult(
        !state.hasError(),
        state.getClaim(),
        state.getVerdict(),
        state.getFinalAnswer(),
        List.copyOf(state.getCitations()),
        state.getFormattedCitations(),
        state.getSearchSource(),
        stages,
        state.getErrorMessage(),
        state.getFailedStage());
  }
}
