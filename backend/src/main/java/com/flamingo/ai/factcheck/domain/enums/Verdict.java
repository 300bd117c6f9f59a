package com.flamingo.ai.factcheck.domain.enums;

import java.util.Locale;
import java.util.Map;

/** Final truth label of a verified claim. */
public enum Verdict {
  TRUE,
  FALSE,
  PARTIALLY_TRUE,
  INSUFFICIENT,
  ERROR;

  private static final Map<String, Verdict> LABELS =
      Map.ofEntries(
          Map.entry("TRUE", TRUE),
          Map.entry("VERDADEIRA", TRUE),
          Map.entry("VERDADEIRO", TRUE),
          Map.entry("FALSE", FALSE),
          Map.entry("FALSA", FALSE),
          Map.entry("FALSO", FALSE),
          Map.entry("PARTIALLY_TRUE", PARTIALLY_TRUE),
          Map.entry("PARTIALLY TRUE", PARTIALLY_TRUE),
          Map.entry("PARTIAL", PARTIALLY_TRUE),
          Map.entry("PARCIALMENTE VERDADEIRA", PARTIALLY_TRUE),
          Map.entry("PARCIALMENTE VERDADEIRO", PARTIALLY_TRUE),
          Map.entry("INSUFFICIENT", INSUFFICIENT),
          Map.entry("INSUFICIENTE", INSUFFICIENT));

  /**
   * Maps a free-form label produced by a language model onto a verdict.
   *
   * <p>Surrounding punctuation, brackets and markdown emphasis are ignored. {@link #ERROR} is never
   * produced from model text; anything unrecognized maps to {@link #INSUFFICIENT}.
   *
   * @param label the raw label, may be null
   * @return the matching verdict, or INSUFFICIENT
   */
  public static Verdict fromLabel(String label) {
    if (label == null) {
      return INSUFFICIENT;
    }
    String normalized =
        label
            .replaceAll("[\\[\\]*_.\"'`]", " ")
            .replaceAll("\\s+", " ")
            .trim()
            .toUpperCase(Locale.ROOT);
    Verdict verdict = LABELS.get(normalized);
    if (verdict == null) {
      verdict = LABELS.get(normalized.replace(' ', '_'));
    }
    return verdict != null ? verdict : INSUFFICIENT;
  }
}
