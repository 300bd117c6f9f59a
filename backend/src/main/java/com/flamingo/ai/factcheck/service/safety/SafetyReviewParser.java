package com.flamingo.ai.factcheck.service.safety;

import com.flamingo.ai.factcheck.domain.enums.SafetyDecision;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Line scanner for the safety reviewer's reply: {@code DECISION:}, {@code REASON:} and {@code
 * SUGGESTIONS:}. A missing or unknown decision is APPROVE.
 */
@Component
public class SafetyReviewParser {

  static final String DEFAULT_REASON = "No reason given by the reviewer";

  public ParsedReview parse(String response) {
    SafetyDecision decision = null;
    String reason = null;
    List<String> suggestions = List.of();

    if (response != null) {
      for (String rawLine : response.split("\\R")) {
        String line = rawLine.replace("*", "").trim();
        String upper = line.toUpperCase(Locale.ROOT);
        if (decision == null && upper.startsWith("DECISION")) {
          decision = SafetyDecision.fromLabel(firstWord(valueOf(line)));
        } else if (reason == null && upper.startsWith("REASON")) {
          String value = valueOf(line);
          reason = value.isEmpty() ? null : value;
        } else if (upper.startsWith("SUGGESTIONS")) {
          suggestions =
              Arrays.stream(valueOf(line).split(","))
                  .map(String::trim)
                  .filter(s -> !s.isEmpty() && !s.equalsIgnoreCase("none"))
                  .toList();
        }
      }
    }
    return new ParsedReview(
        decision != null ? decision : SafetyDecision.APPROVE,
        reason != null ? reason : DEFAULT_REASON,
        suggestions);
  }

  private static String valueOf(String line) {
    int colon = line.indexOf(':');
    return colon >= 0 ? line.substring(colon + 1).trim() : "";
  }

  private static String firstWord(String value) {
    String[] words = value.split("[\\s|,.;-]+");
    return words.length > 0 ? words[0] : "";
  }

  /** Decision, reason and suggestions extracted from the reviewer text. */
  public record ParsedReview(SafetyDecision decision, String reason, List<String> suggestions) {}
}
