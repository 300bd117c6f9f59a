package com.flamingo.ai.factcheck.service.evaluation;

import com.flamingo.ai.factcheck.domain.enums.SufficiencyQuality;
import com.flamingo.ai.factcheck.domain.model.SufficiencyVerdict;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Line scanner for the sufficiency evaluator's reply.
 *
 * <p>Recognized lines are {@code DECISION:}, {@code CONFIDENCE:} and {@code REASONING:}, matched
 * case-insensitively and ignoring markdown emphasis. Missing or malformed lines fall back to
 * INSUFFICIENT, 0.5 and a generic reasoning. A confidence must be a plain number in [0, 1];
 * percentages, ratios and out-of-range values count as malformed. Never throws.
 */
@Component
@Slf4j
public class SufficiencyResponseParser {

  static final double DEFAULT_CONFIDENCE = 0.5;
  static final String DEFAULT_REASONING = "The evaluator did not provide a usable reasoning";

  private static final Pattern DECISION_TOKEN =
      Pattern.compile("\\b(INSUFFICIENT|SUFFICIENT|CONTRADICTORY)\\b");
  // leading number, rejected when followed by a percent sign or a ratio slash
  private static final Pattern CONFIDENCE_VALUE =
      Pattern.compile("([-+]?\\d+(?:[.,]\\d+)?)(?!\\d|[.,]\\d|\\s*[%/])");

  public SufficiencyVerdict parse(String response) {
    SufficiencyQuality quality = null;
    Double confidence = null;
    String reasoning = null;

    if (response != null) {
      for (String rawLine : response.split("\\R")) {
        String line = rawLine.replace("*", "").trim();
        String upper = line.toUpperCase(Locale.ROOT);
        if (quality == null && upper.startsWith("DECISION")) {
          quality = parseDecision(upper);
        } else if (confidence == null && upper.startsWith("CONFIDENCE")) {
          confidence = parseConfidence(valueOf(line));
        } else if (reasoning == null && upper.startsWith("REASONING")) {
          String value = valueOf(line);
          reasoning = value.isEmpty() ? null : value;
        }
      }
    }

    if (quality == null || confidence == null) {
      log.warn("Unparsable sufficiency response, applying defaults where missing");
    }
    return new SufficiencyVerdict(
        quality != null ? quality : SufficiencyQuality.INSUFFICIENT,
        confidence != null ? confidence : DEFAULT_CONFIDENCE,
        reasoning != null ? reasoning : DEFAULT_REASONING,
        false);
  }

  private static SufficiencyQuality parseDecision(String upperLine) {
    Matcher matcher = DECISION_TOKEN.matcher(upperLine);
    return matcher.find() ? SufficiencyQuality.valueOf(matcher.group(1)) : null;
  }

  private static Double parseConfidence(String value) {
    Matcher matcher = CONFIDENCE_VALUE.matcher(value);
    if (!matcher.lookingAt()) {
      return null;
    }
    try {
      double parsed = Double.parseDouble(matcher.group(1).replace(',', '.'));
      return parsed >= 0.0 && parsed <= 1.0 ? parsed : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String valueOf(String line) {
    int colon = line.indexOf(':');
    return colon >= 0 ? line.substring(colon + 1).trim() : "";
  }
}
