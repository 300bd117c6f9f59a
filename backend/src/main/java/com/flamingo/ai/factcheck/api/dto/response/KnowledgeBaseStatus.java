package com.flamingo.ai.factcheck.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for the knowledge base and retrieval configuration status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeBaseStatus {
  private String indexName;
  private long documentCount;
  private boolean webSearchConfigured;
  private String chatModel;
  private String embeddingModel;
  private int topK;
  private double scoreThreshold;
  private int minLocalDocs;
  private double webSearchThreshold;
  private LocalDateTime timestamp;
}
