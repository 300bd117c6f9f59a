package com.flamingo.ai.factcheck.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of knowledge chunks used as the local evidence store.
 *
 * <p>The embedding field uses cosine similarity, so kNN hit scores are {@code (1 + cos) / 2}.
 */
@Service
@Slf4j
public class KnowledgeChunkIndexService extends AbstractElasticsearchIndexService<KnowledgeChunk> {

  @Value("${app.elasticsearch.index-name:factcheck-knowledge}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public KnowledgeChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public KnowledgeChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("source", Property.of(p -> p.keyword(k -> k)));
    properties.put("url", Property.of(p -> p.keyword(k -> k)));
    properties.put("origin", Property.of(p -> p.keyword(k -> k)));
    properties.put(
        "content", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(KnowledgeChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("content", chunk.getContent());
    document.put("source", chunk.getSource());
    document.put("origin", chunk.getOrigin());
    document.put("embedding", chunk.getEmbedding());
    if (chunk.getUrl() != null && !chunk.getUrl().isBlank()) {
      document.put("url", chunk.getUrl());
    }
    return document;
  }

  @Override
  protected KnowledgeChunk convertFromDocument(Map<String, Object> source) {
    return KnowledgeChunk.builder()
        .id((String) source.get("id"))
        .content((String) source.get("content"))
        .source((String) source.get("source"))
        .url((String) source.get("url"))
        .origin(source.get("origin") != null ? (String) source.get("origin") : "local")
        .build();
  }

  @Override
  protected String getDocumentId(KnowledgeChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK) {
    log.debug(
        "kNN search on {}: topK={}, embedding size={}",
        indexName,
        topK,
        queryEmbedding.size());
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, 10)))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected String getMetricPrefix() {
    return "knowledge_chunk";
  }
}
