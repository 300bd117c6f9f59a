package com.flamingo.ai.factcheck.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.factcheck.agent.EvidenceSufficiencyAgent;
import com.flamingo.ai.factcheck.agent.SafetyReviewAgent;
import com.flamingo.ai.factcheck.agent.VerdictSynthesisAgent;
import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.domain.enums.SearchSource;
import com.flamingo.ai.factcheck.domain.enums.Verdict;
import com.flamingo.ai.factcheck.domain.enums.VerificationStage;
import com.flamingo.ai.factcheck.domain.model.Citation;
import com.flamingo.ai.factcheck.domain.model.VerificationResult;
import com.flamingo.ai.factcheck.exception.SearchException;
import com.flamingo.ai.factcheck.service.answer.AnswerSynthesizer;
import com.flamingo.ai.factcheck.service.answer.CitationFormatter;
import com.flamingo.ai.factcheck.service.answer.VerdictResponseParser;
import com.flamingo.ai.factcheck.service.evaluation.EvidenceEvaluator;
import com.flamingo.ai.factcheck.service.evaluation.SufficiencyResponseParser;
import com.flamingo.ai.factcheck.service.retrieval.EvidencePersistenceService;
import com.flamingo.ai.factcheck.service.retrieval.HybridRetriever;
import com.flamingo.ai.factcheck.service.retrieval.LocalEvidenceSource;
import com.flamingo.ai.factcheck.service.retrieval.ScoreNormalizer;
import com.flamingo.ai.factcheck.service.retrieval.WebEvidenceSource;
import com.flamingo.ai.factcheck.service.retrieval.WebSearchPolicy;
import com.flamingo.ai.factcheck.service.retrieval.index.IndexedNeighbor;
import com.flamingo.ai.factcheck.service.retrieval.index.VectorIndex;
import com.flamingo.ai.factcheck.service.retrieval.web.WebSearchClient;
import com.flamingo.ai.factcheck.service.retrieval.web.WebSearchHit;
import com.flamingo.ai.factcheck.service.safety.HarmfulContentScanner;
import com.flamingo.ai.factcheck.service.safety.SafetyReviewParser;
import com.flamingo.ai.factcheck.service.safety.SafetyReviewer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Drives the real pipeline with mocked index, web search and language model agents. */
@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationOrchestrator Tests")
class VerificationOrchestratorTest {

  private static final String COFFEE_CLAIM = "O Brasil é o maior produtor de café do mundo";

  private static final String SUFFICIENT_REPLY =
      "DECISION: SUFFICIENT\nCONFIDENCE: 0.9\nREASONING: The documents address coffee production.";
  private static final String APPROVE_REPLY =
      "DECISION: APPROVE\nREASON: Neutral and sourced\nSUGGESTIONS:";

  @Mock private VectorIndex vectorIndex;
  @Mock private WebSearchClient webSearchClient;
  @Mock private EvidenceSufficiencyAgent sufficiencyAgent;
  @Mock private VerdictSynthesisAgent synthesisAgent;
  @Mock private SafetyReviewAgent safetyAgent;

  private FactCheckConfig config;
  private SimpleMeterRegistry meterRegistry;
  private VerificationOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    config = new FactCheckConfig();
    meterRegistry = new SimpleMeterRegistry();

    ScoreNormalizer normalizer = new ScoreNormalizer();
    HybridRetriever retriever =
        new HybridRetriever(
            new LocalEvidenceSource(vectorIndex),
            new WebEvidenceSource(webSearchClient),
            normalizer,
            new WebSearchPolicy(config),
            new EvidencePersistenceService(vectorIndex, meterRegistry),
            config,
            meterRegistry);
    EvidenceEvaluator evaluator =
        new EvidenceEvaluator(sufficiencyAgent, new SufficiencyResponseParser(), config);
    AnswerSynthesizer synthesizer =
        new AnswerSynthesizer(
            synthesisAgent, new VerdictResponseParser(), new CitationFormatter(), config);
    SafetyReviewer safetyReviewer =
        new SafetyReviewer(
            safetyAgent, new SafetyReviewParser(), new HarmfulContentScanner(), meterRegistry);

    orchestrator =
        new VerificationOrchestrator(
            new StageRouter(),
            retriever,
            evaluator,
            synthesizer,
            safetyReviewer,
            config,
            meterRegistry);
  }

  @Nested
  @DisplayName("Successful verification")
  class Successful {

    @Test
    @DisplayName("Should answer from strong local evidence without a web search")
    void shouldAnswerFromLocalEvidence() {
      // relevance 1/(1+d): 0.85 and ~0.87
      when(vectorIndex.nearestNeighbors(eq(COFFEE_CLAIM), anyInt()))
          .thenReturn(
              List.of(
                  neighbor("Brasil é o maior produtor de café.", "cafe-brasil.txt", 0.1765),
                  neighbor("O maior produtor de café é o Brasil.", "fatos-cafe.txt", 0.15)));
      when(sufficiencyAgent.assess(anyString(), anyString())).thenReturn(SUFFICIENT_REPLY);
      when(synthesisAgent.synthesize(anyString(), anyString()))
          .thenReturn(
              "VERDICT: TRUE\nEVIDENCE: two fact-checks\nCITATIONS: cafe-brasil.txt\n"
                  + "EXPLANATION: Brazil leads world coffee production.");
      when(safetyAgent.review(anyString(), anyString(), anyString())).thenReturn(APPROVE_REPLY);

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.searchSource()).isEqualTo(SearchSource.LOCAL_ONLY);
      assertThat(result.verdict()).isEqualTo(Verdict.TRUE);
      assertThat(result.citations())
          .extracting(Citation::source)
          .containsExactlyInAnyOrder("cafe-brasil.txt", "fatos-cafe.txt");
      assertThat(result.finalAnswer())
          .contains("Brazil leads world coffee production")
          .endsWith(SafetyReviewer.DISCLAIMER);
      assertThat(result.error()).isNull();
      verifyNoInteractions(webSearchClient);
      assertThat(meterRegistry.counter("verification.completed", "verdict", "TRUE").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record the visited stages in order")
    void shouldRecordTrail() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenReturn(
              List.of(
                  neighbor("Brasil produz mais café.", "a.txt", 0.1),
                  neighbor("Café do Brasil lidera.", "b.txt", 0.1)));
      when(sufficiencyAgent.assess(anyString(), anyString())).thenReturn(SUFFICIENT_REPLY);
      when(synthesisAgent.synthesize(anyString(), anyString())).thenReturn("VERDICT: TRUE");
      when(safetyAgent.review(anyString(), anyString(), anyString())).thenReturn(APPROVE_REPLY);

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.perStageResults().get("trail"))
          .isEqualTo(
              List.of("START", "SUPERVISOR", "RETRIEVE", "SELF_CHECK", "ANSWER", "SAFETY", "DONE"));
    }

    @Test
    @DisplayName("Should search the web and cite only web sources when nothing is local")
    void shouldUseWebWhenLocalIsEmpty() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt())).thenReturn(List.of());
      when(webSearchClient.isConfigured()).thenReturn(true);
      when(webSearchClient.search(anyString(), eq(3)))
          .thenReturn(
              List.of(
                  new WebSearchHit("USDA", "https://usda.gov/coffee", "Brazil tops coffee output"),
                  new WebSearchHit("ICO", "https://ico.org/stats", "Coffee output by country")));
      when(vectorIndex.add(anyList())).thenReturn(true);
      when(sufficiencyAgent.assess(anyString(), anyString())).thenReturn(SUFFICIENT_REPLY);
      when(synthesisAgent.synthesize(anyString(), anyString())).thenReturn("VERDICT: TRUE");
      when(safetyAgent.review(anyString(), anyString(), anyString())).thenReturn(APPROVE_REPLY);

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.searchSource()).isIn(SearchSource.HYBRID, SearchSource.WEB_ONLY);
      assertThat(result.citations())
          .extracting(Citation::url)
          .containsExactlyInAnyOrder("https://usda.gov/coffee", "https://ico.org/stats");
      assertThat(result.perStageResults())
          .extractingByKey("retrieve")
          .asInstanceOf(InstanceOfAssertFactories.MAP)
          .containsEntry("webSearchTriggered", true);
      verify(vectorIndex).add(anyList());
    }

    @Test
    @DisplayName("Should cite only web items in a hybrid result")
    void shouldRestrictCitationsToWebInHybridResult() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenReturn(List.of(neighbor("Brasil lidera café.", "local-cafe.txt", 0.1)));
      when(webSearchClient.isConfigured()).thenReturn(true);
      when(webSearchClient.search(anyString(), anyInt()))
          .thenReturn(List.of(new WebSearchHit("ICO", "https://ico.org/stats", "Coffee stats")));
      when(vectorIndex.add(anyList())).thenReturn(true);
      when(sufficiencyAgent.assess(anyString(), anyString())).thenReturn(SUFFICIENT_REPLY);
      when(synthesisAgent.synthesize(anyString(), anyString())).thenReturn("VERDICT: TRUE");
      when(safetyAgent.review(anyString(), anyString(), anyString())).thenReturn(APPROVE_REPLY);

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.searchSource()).isEqualTo(SearchSource.HYBRID);
      assertThat(result.citations())
          .extracting(Citation::source)
          .containsExactly("https://ico.org/stats");
    }
  }

  @Nested
  @DisplayName("Insufficient evidence")
  class Insufficient {

    @Test
    @DisplayName("Should return INSUFFICIENT with disclaimer and no citations")
    void shouldReturnInsufficientAnswer() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenReturn(
              List.of(
                  neighbor("Exercise improves cardiovascular health.", "exercise.txt", 0.1),
                  neighbor("Sleep matters for recovery.", "sleep.txt", 0.1)));
      when(sufficiencyAgent.assess(anyString(), anyString()))
          .thenReturn("DECISION: INSUFFICIENT\nCONFIDENCE: 0.3\nREASONING: Off subject.");

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.verdict()).isEqualTo(Verdict.INSUFFICIENT);
      assertThat(result.citations()).isEmpty();
      assertThat(result.finalAnswer()).contains(COFFEE_CLAIM).contains(SafetyReviewer.DISCLAIMER);
      verifyNoInteractions(synthesisAgent, safetyAgent);
      assertThat(result.perStageResults().get("trail"))
          .isEqualTo(List.of("START", "SUPERVISOR", "RETRIEVE", "SELF_CHECK", "DONE"));
    }

    @Test
    @DisplayName("Should treat zero evidence as an insufficient answer, not an error")
    void shouldHandleZeroEvidence() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt())).thenReturn(List.of());
      when(webSearchClient.isConfigured()).thenReturn(false);

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.verdict()).isEqualTo(Verdict.INSUFFICIENT);
      assertThat(result.searchSource()).isEqualTo(SearchSource.LOCAL_ONLY);
      assertThat(result.perStageResults())
          .extractingByKey("retrieve")
          .asInstanceOf(InstanceOfAssertFactories.MAP)
          .containsEntry("searchSuccessful", false);
      verifyNoInteractions(sufficiencyAgent, synthesisAgent, safetyAgent);
      verify(webSearchClient, never()).search(anyString(), anyInt());
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Should reject an empty claim before any external call")
    void shouldRejectEmptyClaim() {
      VerificationResult result = orchestrator.verify("   ");

      assertThat(result.success()).isFalse();
      assertThat(result.error()).isEqualTo("Claim must not be empty");
      assertThat(result.failedStage()).isEqualTo(VerificationStage.SUPERVISOR);
      assertThat(result.verdict()).isEqualTo(Verdict.ERROR);
      assertThat(result.finalAnswer()).startsWith("Verification failed:");
      verifyNoInteractions(vectorIndex, webSearchClient, sufficiencyAgent, synthesisAgent);
      verifyNoInteractions(safetyAgent);
    }

    @Test
    @DisplayName("Should reject a claim over the maximum length")
    void shouldRejectOverlongClaim() {
      config.getClaim().setMaxLength(10);

      VerificationResult result = orchestrator.verify("This claim is far too long");

      assertThat(result.success()).isFalse();
      assertThat(result.error()).contains("maximum length of 10");
      verifyNoInteractions(vectorIndex);
    }

    @Test
    @DisplayName("Should route an index failure to ERROR")
    void shouldRouteProviderErrorToError() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenThrow(new SearchException("elasticsearch", "cluster unavailable"));

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isFalse();
      assertThat(result.searchSource()).isEqualTo(SearchSource.ERROR);
      assertThat(result.failedStage()).isEqualTo(VerificationStage.RETRIEVE);
      assertThat(result.error()).contains("cluster unavailable");
      assertThat(result.finalAnswer()).startsWith("Verification failed:");
      assertThat(result.citations()).isEmpty();
      verifyNoInteractions(sufficiencyAgent);
      assertThat(meterRegistry.counter("verification.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should route a synthesis model failure to ERROR")
    void shouldRouteSynthesisFailureToError() {
      when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenReturn(
              List.of(neighbor("Café.", "a.txt", 0.1), neighbor("Brasil café.", "b.txt", 0.1)));
      when(sufficiencyAgent.assess(anyString(), anyString())).thenReturn(SUFFICIENT_REPLY);
      when(synthesisAgent.synthesize(anyString(), anyString()))
          .thenThrow(new RuntimeException("model timeout"));

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isFalse();
      assertThat(result.failedStage()).isEqualTo(VerificationStage.ANSWER);
      assertThat(result.error()).contains("model timeout");
      verifyNoInteractions(safetyAgent);
      assertThat(result.perStageResults().get("trail"))
          .isEqualTo(List.of("START", "SUPERVISOR", "RETRIEVE", "SELF_CHECK", "ANSWER", "ERROR"));
    }
  }

  @Nested
  @DisplayName("Safety outcomes")
  class SafetyOutcomes {

    @BeforeEach
    void stubUntilSafety() {
      lenient()
          .when(vectorIndex.nearestNeighbors(anyString(), anyInt()))
          .thenReturn(
              List.of(neighbor("Café.", "a.txt", 0.1), neighbor("Brasil café.", "b.txt", 0.1)));
      lenient()
          .when(sufficiencyAgent.assess(anyString(), anyString()))
          .thenReturn(SUFFICIENT_REPLY);
      lenient()
          .when(synthesisAgent.synthesize(anyString(), anyString()))
          .thenReturn("VERDICT: TRUE\nEXPLANATION: Brazil is the largest producer.");
    }

    @Test
    @DisplayName("Should deliver the answer when the safety check is unavailable")
    void shouldFailOpen() {
      when(safetyAgent.review(anyString(), anyString(), anyString()))
          .thenThrow(new RuntimeException("safety model down"));

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.finalAnswer())
          .contains("Brazil is the largest producer")
          .endsWith(SafetyReviewer.DISCLAIMER);
      assertThat(result.perStageResults())
          .extractingByKey("safety")
          .asInstanceOf(InstanceOfAssertFactories.MAP)
          .containsEntry("reviewFailed", true)
          .containsEntry("isSafe", true)
          .containsKey("riskCategories");
    }

    @Test
    @DisplayName("Should withhold a rejected answer but keep the disclaimer")
    void shouldWithholdRejectedAnswer() {
      when(safetyAgent.review(anyString(), anyString(), anyString()))
          .thenReturn("DECISION: REJECT\nREASON: Gives medical advice");

      VerificationResult result = orchestrator.verify(COFFEE_CLAIM);

      assertThat(result.success()).isTrue();
      assertThat(result.finalAnswer())
          .doesNotContain("Brazil is the largest producer")
          .contains("withheld")
          .endsWith(SafetyReviewer.DISCLAIMER);
      Map<?, ?> safety = (Map<?, ?>) result.perStageResults().get("safety");
      assertThat(safety.get("isSafe")).isEqualTo(false);
      assertThat(safety.get("requiresModification")).isEqualTo(false);
    }
  }

  private static IndexedNeighbor neighbor(String content, String source, double distance) {
    return new IndexedNeighbor(content, Map.of("source", source, "origin", "local"), distance);
  }
}
