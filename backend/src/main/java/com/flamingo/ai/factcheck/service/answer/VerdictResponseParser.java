package com.flamingo.ai.factcheck.service.answer;

import com.flamingo.ai.factcheck.domain.enums.Verdict;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts the verdict from the synthesis reply's {@code VERDICT:} line.
 *
 * <p>The line value may carry trailing commentary ("FALSE - the data shows..."), so the full value
 * is tried first and then its leading words. Anything unrecognized is INSUFFICIENT.
 */
@Component
public class VerdictResponseParser {

  private static final Pattern VERDICT_LINE =
      Pattern.compile(
          "^[#>*\\s]*(?:VERDICT|VEREDICTO)[*\\s]*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEADING_WORDS = Pattern.compile("^[\\p{L}_\\[\\]*\"'`]+");

  public Verdict parse(String response) {
    if (response == null) {
      return Verdict.INSUFFICIENT;
    }
    for (String line : response.split("\\R")) {
      Matcher matcher = VERDICT_LINE.matcher(line.trim());
      if (matcher.matches()) {
        return parseValue(matcher.group(1));
      }
    }
    return Verdict.INSUFFICIENT;
  }

  private static Verdict parseValue(String value) {
    for (String candidate : candidates(value)) {
      Verdict verdict = Verdict.fromLabel(candidate);
      if (verdict != Verdict.INSUFFICIENT) {
        return verdict;
      }
    }
    return Verdict.INSUFFICIENT;
  }

  private static List<String> candidates(String value) {
    List<String> candidates = new ArrayList<>();
    String trimmed = value.trim();
    candidates.add(trimmed);

    String[] words = trimmed.split("\\s+");
    if (words.length >= 2) {
      candidates.add(leading(words[0]) + " " + leading(words[1]));
    }
    if (words.length >= 1) {
      candidates.add(leading(words[0]));
    }
    return candidates;
  }

  private static String leading(String word) {
    Matcher matcher = LEADING_WORDS.matcher(word.toUpperCase(Locale.ROOT));
    return matcher.find() ? matcher.group() : "";
  }
}
