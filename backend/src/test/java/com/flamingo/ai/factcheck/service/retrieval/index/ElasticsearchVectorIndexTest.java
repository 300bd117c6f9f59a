package com.flamingo.ai.factcheck.service.retrieval.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.factcheck.elasticsearch.KnowledgeChunk;
import com.flamingo.ai.factcheck.elasticsearch.KnowledgeChunkIndexService;
import com.flamingo.ai.factcheck.service.embedding.EmbeddingService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchVectorIndex Tests")
class ElasticsearchVectorIndexTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private KnowledgeChunkIndexService indexService;
  @Mock private EmbeddingService embeddingService;
  @Captor private ArgumentCaptor<List<KnowledgeChunk>> chunksCaptor;

  private ElasticsearchVectorIndex vectorIndex;

  @BeforeEach
  void setUp() {
    vectorIndex = new ElasticsearchVectorIndex(indexService, embeddingService);
  }

  @Test
  @DisplayName("Should convert kNN scores to cosine distances")
  void shouldConvertScoresToDistances() {
    KnowledgeChunk exact = chunk("id-1", "Brazil leads coffee", "cafe.txt", 1.0);
    KnowledgeChunk partial = chunk("id-2", "Coffee facts", "facts.txt", 0.9);
    when(embeddingService.embed("coffee")).thenReturn(VECTOR);
    when(indexService.vectorSearch(VECTOR, 2)).thenReturn(List.of(exact, partial));

    List<IndexedNeighbor> neighbors = vectorIndex.nearestNeighbors("coffee", 2);

    assertThat(neighbors).hasSize(2);
    assertThat(neighbors.get(0).distance()).isZero();
    assertThat(neighbors.get(1).distance()).isCloseTo(0.2, within(1e-9));
    assertThat(neighbors.get(0).metadata(IndexableDocument.SOURCE)).isEqualTo("cafe.txt");
  }

  @Test
  @DisplayName("Should map score to distance so that 1/(1+d) decreases with lower score")
  void shouldKeepDistanceOrdering() {
    assertThat(ElasticsearchVectorIndex.toCosineDistance(0.95))
        .isLessThan(ElasticsearchVectorIndex.toCosineDistance(0.7));
    assertThat(ElasticsearchVectorIndex.toCosineDistance(1.2)).isZero();
  }

  @Test
  @DisplayName("Should embed, index and refresh added documents")
  void shouldAddDocuments() {
    when(embeddingService.embedAll(List.of("Brazil leads coffee"))).thenReturn(List.of(VECTOR));
    when(indexService.indexDocuments(anyList())).thenReturn(true);

    boolean stored =
        vectorIndex.add(
            List.of(
                new IndexableDocument(
                    "Brazil leads coffee",
                    Map.of(
                        IndexableDocument.SOURCE, "https://ico.org",
                        IndexableDocument.URL, "https://ico.org",
                        IndexableDocument.ORIGIN, "web"))));

    assertThat(stored).isTrue();
    verify(indexService).indexDocuments(chunksCaptor.capture());
    KnowledgeChunk chunk = chunksCaptor.getValue().get(0);
    assertThat(chunk.getOrigin()).isEqualTo("web");
    assertThat(chunk.getEmbedding()).isEqualTo(VECTOR);
    assertThat(chunk.getId())
        .isEqualTo(
            ElasticsearchVectorIndex.documentId("web", "https://ico.org", "Brazil leads coffee"));
    verify(indexService).refresh();
  }

  @Test
  @DisplayName("Should not refresh when indexing fails")
  void shouldNotRefreshOnFailure() {
    when(embeddingService.embedAll(anyList())).thenReturn(List.of(VECTOR));
    when(indexService.indexDocuments(anyList())).thenReturn(false);

    boolean stored =
        vectorIndex.add(List.of(new IndexableDocument("text", Map.of("source", "a.txt"))));

    assertThat(stored).isFalse();
    verify(indexService, never()).refresh();
  }

  @Test
  @DisplayName("Should derive the same id for the same passage")
  void shouldDeriveStableIds() {
    assertThat(ElasticsearchVectorIndex.documentId("web", "u", "c"))
        .isEqualTo(ElasticsearchVectorIndex.documentId("web", "u", "c"))
        .isNotEqualTo(ElasticsearchVectorIndex.documentId("local", "u", "c"));
  }

  private static KnowledgeChunk chunk(String id, String content, String source, double score) {
    KnowledgeChunk chunk =
        KnowledgeChunk.builder().id(id).content(content).source(source).origin("local").build();
    chunk.setSearchScore(score);
    return chunk;
  }
}
