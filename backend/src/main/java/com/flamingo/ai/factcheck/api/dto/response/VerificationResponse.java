package com.flamingo.ai.factcheck.api.dto.response;

import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.model.Citation;
import com.flamingo.ai.factcheck.domain.model.VerificationResult;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a claim verification. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResponse {

  private boolean success;
  private String claim;
  private Verdict verdict;
  private String finalAnswer;
  private List<Citation> citations;
  private String formattedCitations;
  private SearchSource searchSource;
  private Map<String, Object> perStageResults;
  private String error;

  public static VerificationResponse from(VerificationResult result) {
    return VerificationResponse.builder()
        .success(result.success())
        .claim(result.claim())
        .verdict(result.verdict())
        .finalAnswer(result.finalAnswer())
        .citations(result.citations())
        .formattedCitations(result.formattedCitations())
        .searchSource(result.searchSource())
        .perStageResults(result.perStageResults())
        .error(result.error())
        .build();
  }
}
