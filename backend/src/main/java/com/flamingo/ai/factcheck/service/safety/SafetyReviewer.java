package com.flamingo.ai.factcheck.service.safety;

import com.flamingo.ai.factcheck.agent.SafetyReviewAgent;
import com.flamingo.ai.factcheck.domain.enums.SafetyDecision;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reviews an answer before delivery.
 *
 * <p>A keyword scan grades risk and a model classifies the answer as APPROVE, MODIFY or REJECT. A
 * failing model call is treated as APPROVE. The disclaimer is appended in every case. REJECT
 * replaces the answer with a fixed fallback; MODIFY keeps it and adds the reviewer's note.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SafetyReviewer {

  public static final String DISCLAIMER =
      "Disclaimer: This verification was produced by an automated system from the sources listed"
          + " and may contain errors. Always consult official and primary sources before drawing"
          + " conclusions.";

  static final String REJECTED_ANSWER =
      "This answer was withheld because it did not pass the safety review. Please consult"
          + " official sources and recognized fact-checking organizations about this claim.";

  static final String SAFETY_NOTE =
      "Safety note: This content touches on sensitive topics and is informational only. It is"
          + " not legal, medical or financial advice.";

  static final String FAIL_OPEN_REASON = "Safety review unavailable; approved by default";

  private final SafetyReviewAgent reviewAgent;
  private final SafetyReviewParser parser;
  private final HarmfulContentScanner scanner;
  private final MeterRegistry meterRegistry;

  @Timed(value = "safety.review", description = "Time for answer safety review")
  public SafetyReview review(String claim, String answer, Verdict verdict) {
    HarmfulContentScanner.ScanResult scan = scanner.scan(answer);

    SafetyReviewParser.ParsedReview parsed;
    boolean reviewFailed = false;
    try {
      parsed = parser.parse(reviewAgent.review(claim, String.valueOf(verdict), answer));
    } catch (RuntimeException e) {
      log.warn("Safety review failed, approving by default: {}", e.getMessage());
      parsed =
          new SafetyReviewParser.ParsedReview(
              SafetyDecision.APPROVE, FAIL_OPEN_REASON, List.of());
      reviewFailed = true;
    }

    meterRegistry.counter("safety.decision", "decision", parsed.decision().name()).increment();
    if (scan.flagged()) {
      log.warn("Answer flagged by keyword scan: {} (risk {})", scan.foundKeywords(), scan.risk());
    }
    log.info("Safety decision {}: {}", parsed.decision(), parsed.reason());

    return new SafetyReview(
        parsed.decision(),
        parsed.reason(),
        parsed.suggestions(),
        scan.risk(),
        scan.foundKeywords(),
        scan.categories(),
        DISCLAIMER,
        compose(answer, parsed, scan),
        reviewFailed);
  }

  /** Appends the standard disclaimer to text delivered without a review. */
  public String withDisclaimer(String answer) {
    return answer + "\n\n" + DISCLAIMER;
  }

  private String compose(
      String answer,
      SafetyReviewParser.ParsedReview review,
      HarmfulContentScanner.ScanResult scan) {
    StringBuilder sb = new StringBuilder();
    if (review.decision() == SafetyDecision.REJECT) {
      sb.append(REJECTED_ANSWER);
    } else {
      sb.append(answer != null ? answer : "");
      if (review.decision() == SafetyDecision.MODIFY) {
        sb.append("\n\nReview note: ").append(review.reason());
      }
      if (scan.flagged()) {
        sb.append("\n\n").append(SAFETY_NOTE);
      }
    }
    sb.append("\n\n").append(DISCLAIMER);
    return sb.toString();
  }
}
