package com.flamingo.ai.factcheck.service.pipeline;

import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import com.flamingo.ai.factcheck.domain.model.VerificationState;
import org.springframework.stereotype.Component;

/**
 * Transition table of the verification pipeline. The next stage depends only on the current stage
 * and the state; any recorded error leads to ERROR.
 */
@Component
public class StageRouter {

  public VerificationStage next(VerificationStage current, VerificationState state) {
    if (current == VerificationStage.ERROR || state.hasError()) {
      return VerificationStage.ERROR;
    }
    return switch (current) {
      case START -> VerificationStage.SUPERVISOR;
      case SUPERVISOR -> VerificationStage.RETRIEVE;
      case RETRIEVE -> VerificationStage.SELF_CHECK;
      case SELF_CHECK ->
          state.getSufficiency() != null && state.getSufficiency().shouldProceed()
              ? VerificationStage.ANSWER
              : VerificationStage.DONE;
      case ANSWER -> VerificationStage.SAFETY;
      case SAFETY, DONE -> VerificationStage.DONE;
      case ERROR -> VerificationStage.ERROR;
    };
  }
}
