package com.flamingo.ai.factcheck.service.safety;

import com.flamingo.ai.factcheck.domain.enums.RiskLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Keyword scan for disallowed advice in legal, medical, financial and violence/hate categories.
 * Keywords match on word boundaries, case-insensitively, in English and Portuguese.
 */
@Component
public class HarmfulContentScanner {

  static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

  static {
    KEYWORDS.put(
        "legal",
        List.of(
            "legal advice",
            "file a lawsuit",
            "you should sue",
            "hire a lawyer",
            "aconselhamento jurídico",
            "processe",
            "entre com uma ação"));
    KEYWORDS.put(
        "medical",
        List.of(
            "diagnosis",
            "you should take",
            "dosage",
            "prescription",
            "stop taking your medication",
            "diagnóstico",
            "tome este remédio",
            "receita médica"));
    KEYWORDS.put(
        "financial",
        List.of(
            "financial advice",
            "invest in",
            "buy shares",
            "guaranteed return",
            "aconselhamento financeiro",
            "invista em",
            "compre ações"));
    KEYWORDS.put(
        "violence",
        List.of(
            "kill",
            "attack them",
            "hate speech",
            "exterminate",
            "matar",
            "discurso de ódio",
            "ataque"));
  }

  private final Map<String, Pattern> patterns = new LinkedHashMap<>();

  public HarmfulContentScanner() {
    for (List<String> keywords : KEYWORDS.values()) {
      for (String keyword : keywords) {
        patterns.put(
            keyword,
            Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
      }
    }
  }

  public ScanResult scan(String text) {
    if (text == null || text.isBlank()) {
      return new ScanResult(List.of(), List.of(), RiskLevel.LOW);
    }
    List<String> found = new ArrayList<>();
    Set<String> categories = new LinkedHashSet<>();
    for (Map.Entry<String, List<String>> category : KEYWORDS.entrySet()) {
      for (String keyword : category.getValue()) {
        if (patterns.get(keyword).matcher(text).find()) {
          found.add(keyword);
          categories.add(category.getKey());
        }
      }
    }
    return new ScanResult(
        List.copyOf(found), List.copyOf(categories), RiskLevel.fromKeywordCount(found.size()));
  }

  /** Keywords found, the categories they belong to and the resulting risk. */
  public record ScanResult(List<String> foundKeywords, List<String> categories, RiskLevel risk) {

    public boolean flagged() {
      return !foundKeywords.isEmpty();
    }
  }
}
