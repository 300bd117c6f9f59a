package com.flamingo.ai.factcheck.elasticsearch;

import java.util.List;

/**
 * Operations on an Elasticsearch index holding documents with a vector embedding.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index if missing, otherwise adds missing fields to its mapping. */
  void initIndex();

  /**
   * Indexes documents in one bulk request. Documents with an existing id are overwritten.
   *
   * @param documents the documents to index
   * @return true when every document was accepted
   */
  boolean indexDocuments(List<T> documents);

  /**
   * Approximate kNN search on the embedding field.
   *
   * @param queryEmbedding the query vector
   * @param topK number of neighbors to return
   * @return documents ordered by descending similarity, each carrying its search score
   */
  List<T> vectorSearch(List<Float> queryEmbedding, int topK);

  /** Number of documents currently in the index. */
  long count();

  /** Makes recent writes visible to search. */
  void refresh();

  String getIndexName();
}
