package com.flamingo.ai.factcheck.service.knowledge;

import com.flamingo.ai.factcheck.api.dto.request.AddDocumentsRequest;
import com.flamingo.ai.factcheck.api.dto.response.KnowledgeBaseStatus;
import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.elasticsearch.KnowledgeChunkIndexService;
import com.flamingo.ai.factcheck.exception.SearchException;
import com.flamingo.ai.factcheck.service.retrieval.index.IndexableDocument;
import com.flamingo.ai.factcheck.service.retrieval.index.VectorIndex;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Implementation of knowledge base management on top of the vector index. */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeBaseServiceImpl implements KnowledgeBaseService {

  private final VectorIndex vectorIndex;
  private final KnowledgeChunkIndexService indexService;
  private final FactCheckConfig config;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Override
  public int addDocuments(List<AddDocumentsRequest.DocumentEntry> documents) {
    List<IndexableDocument> indexable =
        documents.stream().map(KnowledgeBaseServiceImpl::toIndexable).toList();
    if (!vectorIndex.add(indexable)) {
      throw new SearchException(
          "elasticsearch", "Failed to index " + indexable.size() + " documents");
    }
    log.info("Added {} documents to the knowledge base", indexable.size());
    return indexable.size();
  }

  @Override
  public KnowledgeBaseStatus status() {
    FactCheckConfig.Retrieval retrieval = config.getRetrieval();
    return KnowledgeBaseStatus.builder()
        .indexName(indexService.getIndexName())
        .documentCount(vectorIndex.size())
        .webSearchConfigured(config.getWebSearch().isConfigured())
        .chatModel(chatModelName)
        .embeddingModel(embeddingModelName)
        .topK(retrieval.getTopK())
        .scoreThreshold(retrieval.getScoreThreshold())
        .minLocalDocs(retrieval.getMinLocalDocs())
        .webSearchThreshold(retrieval.getWebSearchThreshold())
        .timestamp(LocalDateTime.now())
        .build();
  }

  private static IndexableDocument toIndexable(AddDocumentsRequest.DocumentEntry entry) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(IndexableDocument.SOURCE, entry.getSource());
    metadata.put(IndexableDocument.ORIGIN, "local");
    if (entry.getUrl() != null && !entry.getUrl().isBlank()) {
      metadata.put(IndexableDocument.URL, entry.getUrl());
    }
    return new IndexableDocument(entry.getContent(), metadata);
  }
}
