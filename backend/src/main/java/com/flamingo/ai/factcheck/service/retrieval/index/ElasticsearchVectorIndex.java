package com.flamingo.ai.factcheck.service.retrieval.index;

import com.flamingo.ai.factcheck.elasticsearch.KnowledgeChunk;
import com.flamingo.ai.factcheck.elasticsearch.KnowledgeChunkIndexService;
import com.flamingo.ai.factcheck.service.embedding.EmbeddingService;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link VectorIndex} backed by the Elasticsearch knowledge index.
 *
 * <p>Document ids are derived from origin, source and content, so storing the same passage twice
 * overwrites it. Each {@link #add} is a single bulk request; concurrent writers need no extra
 * locking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchVectorIndex implements VectorIndex {

  private final KnowledgeChunkIndexService indexService;
  private final EmbeddingService embeddingService;

  @Override
  @Timed(value = "vector_index.nearest_neighbors", description = "Time for local kNN lookup")
  public List<IndexedNeighbor> nearestNeighbors(String query, int k) {
    List<Float> queryEmbedding = embeddingService.embed(query);
    List<KnowledgeChunk> hits = indexService.vectorSearch(queryEmbedding, k);

    List<IndexedNeighbor> neighbors = new ArrayList<>(hits.size());
    for (KnowledgeChunk hit : hits) {
      double score = hit.getSearchScore() != null ? hit.getSearchScore() : 0.0;
      neighbors.add(new IndexedNeighbor(hit.getContent(), metadataOf(hit), toCosineDistance(score)));
    }
    return neighbors;
  }

  @Override
  public boolean add(List<IndexableDocument> documents) {
    if (documents.isEmpty()) {
      return true;
    }
    List<List<Float>> embeddings =
        embeddingService.embedAll(documents.stream().map(IndexableDocument::content).toList());

    List<KnowledgeChunk> chunks = new ArrayList<>(documents.size());
    for (int i = 0; i < documents.size(); i++) {
      IndexableDocument document = documents.get(i);
      String origin =
          document.metadata(IndexableDocument.ORIGIN) != null
              ? document.metadata(IndexableDocument.ORIGIN)
              : "local";
      String source = document.metadata(IndexableDocument.SOURCE);
      chunks.add(
          KnowledgeChunk.builder()
              .id(documentId(origin, source, document.content()))
              .content(document.content())
              .source(source)
              .url(document.metadata(IndexableDocument.URL))
              .origin(origin)
              .embedding(embeddings.get(i))
              .build());
    }

    boolean stored = indexService.indexDocuments(chunks);
    if (stored) {
      indexService.refresh();
    }
    log.debug("Stored {} passages in {}: {}", chunks.size(), indexService.getIndexName(), stored);
    return stored;
  }

  @Override
  public long size() {
    return indexService.count();
  }

  /**
   * Converts an Elasticsearch cosine kNN score {@code s = (1 + cos) / 2} into the cosine distance
   * {@code 1 - cos = 2 (1 - s)}.
   */
  static double toCosineDistance(double score) {
    return Math.max(0.0, 2.0 * (1.0 - score));
  }

  static String documentId(String origin, String source, String content) {
    return Hashing.sha256()
        .hashString(origin + "\n" + source + "\n" + content, StandardCharsets.UTF_8)
        .toString();
  }

  private static Map<String, String> metadataOf(KnowledgeChunk chunk) {
    Map<String, String> metadata = new HashMap<>();
    metadata.put(IndexableDocument.SOURCE, chunk.getSource());
    metadata.put(IndexableDocument.ORIGIN, chunk.getOrigin());
    if (chunk.getUrl() != null) {
      metadata.put(IndexableDocument.URL, chunk.getUrl());
    }
    if (chunk.getId() != null) {
      metadata.put("id", chunk.getId());
    }
    return metadata;
  }
}
