package com.flamingo.ai.factcheck.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the verification pipeline. */
@Configuration
@ConfigurationProperties(prefix = "factcheck")
@Getter
@Setter
public class FactCheckConfig {

  private Retrieval retrieval = new Retrieval();
  private WebSearch webSearch = new WebSearch();
  private Evaluation evaluation = new Evaluation();
  private Answer answer = new Answer();
  private Claim claim = new Claim();

  @Getter
  @Setter
  public static class Retrieval {
    /** Neighbors requested from the local index. */
    private int topK = 5;

    /** Minimum normalized relevance for a local item to be kept. */
    private double scoreThreshold = 0.6;

    /** Below this many items passing the threshold, the threshold is relaxed. */
    private int minScoredResults = 2;

    /** Number of best local items kept when the threshold is relaxed. */
    private int relaxedResultCount = 3;

    /** Fewer local items than this always triggers a web search. */
    private int minLocalDocs = 2;

    /** Average relevance below which local evidence is considered weak. */
    private double webSearchThreshold = 0.7;
  }

  /** Tavily web search settings. An empty API key disables web lookups without error. */
  @Getter
  @Setter
  public static class WebSearch {
    private boolean enabled = true;
    private String apiKey = "";
    private String baseUrl = "https://api.tavily.com";
    private int maxResults = 3;
    private String searchDepth = "basic";
    private int timeoutMs = 10000;

    public boolean isConfigured() {
      return enabled && apiKey != null && !apiKey.isBlank();
    }
  }

  @Getter
  @Setter
  public static class Evaluation {
    /** Characters of each evidence item shown to the sufficiency evaluator. */
    private int previewChars = 500;

    /** Confidence above which an INSUFFICIENT decision with relevance wording is upgraded. */
    private double escalationConfidence = 0.6;
  }

  @Getter
  @Setter
  public static class Answer {
    /** Excerpt length of each entry in the evidence summary. */
    private int summaryChars = 200;
  }

  @Getter
  @Setter
  public static class Claim {
    private int maxLength = 2000;
  }
}
