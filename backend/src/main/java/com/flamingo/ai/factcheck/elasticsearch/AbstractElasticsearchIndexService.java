package com.flamingo.ai.factcheck.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.factcheck.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch indexes of embedded documents.
 *
 * <p>Search failures surface as {@link SearchException}; they are never replaced by an empty
 * result, because callers must tell "nothing found" apart from "index unavailable". Bulk writes
 * are best-effort and report failure through their return value.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK);

  /** Prefix of the meters recorded for this index, e.g. "knowledge_chunk". */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        addMissingFields();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // only declared fields are mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds declared fields missing from an existing index. A field whose type changed cannot be
   * migrated in place and fails startup so the index can be recreated.
   */
  private void addMissingFields() throws IOException {
    Map<String, Property> expected = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    Map<String, Property> missing = new HashMap<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      Property current = actual.get(entry.getKey());
      if (current == null) {
        missing.put(entry.getKey(), entry.getValue());
      } else if (current._kind() != entry.getValue()._kind()) {
        throw new IllegalStateException(
            String.format(
                "Index '%s' maps field '%s' as '%s' but '%s' is required. "
                    + "Delete the index and restart the application.",
                getIndexName(), entry.getKey(), current._kind(), entry.getValue()._kind()));
      }
    }

    if (missing.isEmpty()) {
      log.debug("Index '{}' mapping verified", getIndexName());
      return;
    }
    elasticsearchClient
        .indices()
        .putMapping(PutMappingRequest.of(p -> p.index(getIndexName()).properties(missing)));
    log.info("Added field(s) {} to index '{}'", missing.keySet(), getIndexName());
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  @CircuitBreaker(name = "elasticsearch-write", fallbackMethod = "indexDocumentsFallback")
  public boolean indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return true;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        log.warn("Some documents failed to index in {}: {}", getIndexName(), response.items());
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        return false;
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
      return true;
    } catch (IOException e) {
      throw new SearchException("elasticsearch", "Failed to index documents", e);
    }
  }

  @SuppressWarnings("unused")
  private boolean indexDocumentsFallback(List<T> documents, Throwable t) {
    log.warn(
        "Indexing {} documents to {} failed: {}", documents.size(), getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".index.fallback").increment();
    return false;
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug("[vectorSearch] index={} topK={} returned={}", getIndexName(), topK, results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("elasticsearch", "Vector search failed: " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(List<Float> queryEmbedding, int topK, Throwable t) {
    if (t instanceof SearchException searchException) {
      throw searchException;
    }
    throw new SearchException("elasticsearch", "Vector search unavailable: " + t.getMessage(), t);
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException e) {
      throw new SearchException("elasticsearch", "Failed to count documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata, not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setSearchScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Documents that carry the score of the search hit they were read from. */
  public interface ScoredDocument {
    void setSearchScore(Double score);
  }
}
