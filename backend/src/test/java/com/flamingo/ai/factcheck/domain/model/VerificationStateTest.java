package com.flamingo.ai.factcheck.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VerificationState Tests")
class VerificationStateTest {

  @Test
  @DisplayName("Should keep the first error and its stage")
  void shouldKeepFirstError() {
    VerificationState state = new VerificationState("claim");

    state.fail(VerificationStage.RETRIEVE, "index down");
    state.fail(VerificationStage.ANSWER, "model down");

    assertThat(state.getErrorMessage()).isEqualTo("index down");
    assertThat(state.getFailedStage()).isEqualTo(VerificationStage.RETRIEVE);
  }

  @Test
  @DisplayName("Should refuse a regular answer once an error is recorded")
  void shouldPinErrorPath() {
    VerificationState state = new VerificationState("claim");
    state.fail(VerificationStage.SUPERVISOR, "empty");

    assertThatThrownBy(() -> state.setFinalAnswer("answer"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should set the ERROR verdict and clear citations on the error answer")
  void shouldApplyErrorAnswer() {
    VerificationState state = new VerificationState("claim");
    state.setCitations(List.of(new Citation("a.txt", null, 0.9)));
    state.fail(VerificationStage.ANSWER, "model down");

    state.applyErrorAnswer("Verification failed: model down");

    assertThat(state.getVerdict()).isEqualTo(Verdict.ERROR);
    assertThat(state.getCitations()).isEmpty();
    assertThat(state.getFinalAnswer()).isEqualTo("Verification failed: model down");
  }

  @Test
  @DisplayName("Should expose the trail in the result")
  void shouldExposeTrail() {
    VerificationState state = new VerificationState("claim");
    state.visit(VerificationStage.START);
    state.visit(VerificationStage.SUPERVISOR);

    VerificationResult result = VerificationResult.from(state);

    assertThat(result.perStageResults().get("trail")).isEqualTo(List.of("START", "SUPERVISOR"));
    assertThat(result.success()).isTrue();
  }
}
