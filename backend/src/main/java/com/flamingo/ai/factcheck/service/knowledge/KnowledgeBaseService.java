package com.flamingo.ai.factcheck.service.knowledge;

import com.flamingo.ai.factcheck.api.dto.request.AddDocumentsRequest;
import com.flamingo.ai.factcheck.api.dto.response.KnowledgeBaseStatus;
import java.util.List;

/** Service for managing the curated local knowledge base. */
public interface KnowledgeBaseService {

  /**
   * Adds fact-check documents to the local index.
   *
   * @param documents documents to index
   * @return number of documents indexed
   * @throws com.flamingo.ai.factcheck.exception.SearchException if indexing fails
   */
  int addDocuments(List<AddDocumentsRequest.DocumentEntry> documents);

  /** Returns index size and the active retrieval settings. */
  KnowledgeBaseStatus status();
}
