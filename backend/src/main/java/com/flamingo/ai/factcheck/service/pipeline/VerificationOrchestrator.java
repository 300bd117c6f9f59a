package com.flamingo.ai.factcheck.service.pipeline;

import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import com.flamingo.ai.factcheck.domain.model.SufficiencyVerdict;
import com.flamingo.ai.factcheck.domain.model.VerificationResult;
import com.flamingo.ai.factcheck.domain.model.VerificationState;
import com.flamingo.ai.factcheck.exception.LlmServiceException;
import com.flamingo.ai.factcheck.exception.SearchException;
import com.flamingo.ai.factcheck.service.answer.AnswerSynthesizer;
import com.flamingo.ai.factcheck.service.answer.SynthesizedAnswer;
import com.flamingo.ai.factcheck.service.evaluation.EvidenceEvaluator;
import com.flamingo.ai.factcheck.service.retrieval.HybridRetriever;
import com.flamingo.ai.factcheck.service.retrieval.RetrievalOutcome;
import com.flamingo.ai.factcheck.service.safety.SafetyReview;
import com.flamingo.ai.factcheck.service.safety.SafetyReviewer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a claim through the verification stages.
 *
 * <p>Stages run one after another on the calling thread. A stage that throws or records an error
 * sends the request to ERROR, whose answer names the failure. {@link #verify} itself does not throw
 * for pipeline faults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VerificationOrchestrator {

  private final StageRouter router;
  private final HybridRetriever retriever;
  private final EvidenceEvaluator evaluator;
  private final AnswerSynthesizer synthesizer;
  private final SafetyReviewer safetyReviewer;
  private final FactCheckConfig config;
  private final MeterRegistry meterRegistry;

  @Timed(value = "verification.pipeline", description = "Time for a full claim verification")
  public VerificationResult verify(String claim) {
    VerificationState state = new VerificationState(claim);
    VerificationStage stage = VerificationStage.START;
    state.visit(stage);

    while (!stage.isTerminal()) {
      stage = router.next(stage, state);
      state.visit(stage);
      log.debug("Entering stage {}", stage);
      if (stage == VerificationStage.DONE) {
        break;
      }
      if (stage == VerificationStage.ERROR) {
        handleError(state);
        break;
      }
      try {
        run(stage, state);
      } catch (SearchException | LlmServiceException e) {
        log.error("Stage {} failed: {}", stage, e.getMessage());
        state.fail(stage, e.getMessage());
      } catch (RuntimeException e) {
        log.error("Unexpected failure in stage {}", stage, e);
        state.fail(stage, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      }
    }

    if (!state.hasError()) {
      meterRegistry
          .counter("verification.completed", "verdict", String.valueOf(state.getVerdict()))
          .increment();
      log.info(
          "Verification finished: verdict={}, source={}",
          state.getVerdict(),
          state.getSearchSource());
    }
    return VerificationResult.from(state);
  }

  private void run(VerificationStage stage, VerificationState state) {
    switch (stage) {
      case SUPERVISOR -> supervise(state);
      case RETRIEVE -> retrieve(state);
      case SELF_CHECK -> selfCheck(state);
      case ANSWER -> answer(state);
      case SAFETY -> safety(state);
      default -> throw new IllegalStateException("No handler for stage " + stage);
    }
  }

  private void supervise(VerificationState state) {
    String claim = state.getClaim();
    int maxLength = config.getClaim().getMaxLength();
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("claimLength", claim != null ? claim.length() : 0);

    if (claim == null || claim.isBlank()) {
      result.put("valid", false);
      state.recordStageResult(VerificationStage.SUPERVISOR, result);
      state.fail(VerificationStage.SUPERVISOR, "Claim must not be empty");
      return;
    }
    if (claim.length() > maxLength) {
      result.put("valid", false);
      state.recordStageResult(VerificationStage.SUPERVISOR, result);
      state.fail(
          VerificationStage.SUPERVISOR,
          "Claim exceeds the maximum length of " + maxLength + " characters");
      return;
    }
    result.put("valid", true);
    state.recordStageResult(VerificationStage.SUPERVISOR, result);
  }

  private void retrieve(VerificationState state) {
    RetrievalOutcome outcome = retriever.retrieve(state.getClaim());
    state.setEvidenceSet(outcome.evidence());
    state.setSearchSource(outcome.source());

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("searchSource", outcome.source().getLabel());
    result.put("searchSuccessful", outcome.searchSuccessful());
    result.put("webSearchTriggered", outcome.webSearchTriggered());
    result.put("localCount", outcome.localCount());
    result.put("webCount", outcome.webCount());
    result.put("evidenceCount", outcome.evidence().size());
    state.recordStageResult(VerificationStage.RETRIEVE, result);

    if (outcome.failed()) {
      state.fail(VerificationStage.RETRIEVE, "Evidence retrieval failed: " + outcome.error());
    }
  }

  private void selfCheck(VerificationState state) {
    SufficiencyVerdict sufficiency = evaluator.evaluate(state.getClaim(), state.getEvidenceSet());
    state.setSufficiency(sufficiency);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("quality", sufficiency.quality());
    result.put("confidence", sufficiency.confidence());
    result.put("reasoning", sufficiency.reasoning());
    result.put("escalated", sufficiency.escalated());
    result.put("shouldProceed", sufficiency.shouldProceed());
    state.recordStageResult(VerificationStage.SELF_CHECK, result);

    if (!sufficiency.shouldProceed()) {
      SynthesizedAnswer answer = synthesizer.insufficient(state.getClaim());
      applyAnswer(state, answer);
      state.setFinalAnswer(safetyReviewer.withDisclaimer(answer.explanation()));
    }
  }

  private void answer(VerificationState state) {
    SynthesizedAnswer answer =
        synthesizer.synthesize(
            state.getClaim(),
            state.getEvidenceSet(),
            state.getSufficiency(),
            state.getSearchSource());
    applyAnswer(state, answer);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("verdict", answer.verdict());
    result.put("citationCount", answer.citations().size());
    result.put("evidenceSummary", answer.evidenceSummary());
    state.recordStageResult(VerificationStage.ANSWER, result);
  }

  private void safety(VerificationState state) {
    SafetyReview review =
        safetyReviewer.review(state.getClaim(), state.getExplanation(), state.getVerdict());
    state.setFinalAnswer(review.finalAnswer());

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("decision", review.decision());
    result.put("reason", review.reason());
    result.put("suggestions", review.suggestions());
    result.put("riskLevel", review.riskLevel());
    result.put("foundKeywords", review.foundKeywords());
    result.put("riskCategories", review.riskCategories());
    result.put("isSafe", review.safe());
    result.put("requiresModification", review.requiresModification());
    result.put("reviewFailed", review.reviewFailed());
    state.recordStageResult(VerificationStage.SAFETY, result);
  }

  private void handleError(VerificationState state) {
    meterRegistry.counter("verification.errors").increment();
    state.applyErrorAnswer("Verification failed: " + state.getErrorMessage());
    log.warn(
        "Verification ended in ERROR at stage {}: {}",
        state.getFailedStage(),
        state.getErrorMessage());
  }

  private static void applyAnswer(VerificationState state, SynthesizedAnswer answer) {
    state.setVerdict(answer.verdict());
    state.setExplanation(answer.explanation());
    state.setCitations(answer.citations());
    state.setFormattedCitations(answer.formattedCitations());
  }
}
