package com.flamingo.ai.factcheck.domain.model;

import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/**
 * Mutable record threaded through the pipeline stages of a single request.
 *
 * <p>Once an error message is recorded the state is pinned to the error path: the error is never
 * overwritten and only {@link #applyErrorAnswer(String)} may set the final answer afterwards.
 */
@Getter
public class VerificationState {

  private final String claim;

  @Setter private EvidenceSet evidenceSet = EvidenceSet.empty();
  @Setter private SearchSource searchSource;
  @Setter private SufficiencyVerdict sufficiency;
  @Setter private Verdict verdict;
  @Setter private String explanation;
  @Setter private List<Citation> citations = List.of();
  @Setter private String formattedCitations;

  private String finalAnswer;
  private String errorMessage;
  private VerificationStage failedStage;

  private final Map<String, Object> perStageResults = new LinkedHashMap<>();
  private final List<VerificationStage> trail = new ArrayList<>();

  public VerificationState(String claim) {
    this.claim = claim;
  }

  public boolean hasError() {
    return errorMessage != null;
  }

  /** Records the first error and the stage it occurred in; later calls keep the original. */
  public void fail(VerificationStage stage, String message) {
    if (errorMessage == null) {
      errorMessage = message != null && !message.isBlank() ? message : "Unknown error";
      failedStage = stage;
    }
  }

  public void setFinalAnswer(String finalAnswer) {
    if (hasError()) {
      throw new IllegalStateException("Final answer is pinned to the error path");
    }
    this.finalAnswer = finalAnswer;
  }

  /** Sets the failure message as final answer; only valid once an error was recorded. */
  public void applyErrorAnswer(String message) {
    if (!hasError()) {
      throw new IllegalStateException("No error recorded");
    }
    this.finalAnswer = message;
    this.verdict = Verdict.ERROR;
    this.citations = List.of();
  }

  public void recordStageResult(VerificationStage stage, Object result) {
    perStageResults.put(stage.key(), result);
  }

  public void visit(VerificationStage stage) {
    trail.add(stage);
  }

  public List<VerificationStage> getTrail() {
    return Collections.unmodifiableList(trail);
  }

  public Map<String, Object> getPerStageResults() {
    return Collections.unmodifiableMap(perStageResults);
  }
}
