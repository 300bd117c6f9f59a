package com.flamingo.ai.factcheck.service.embedding;

import com.flamingo.ai.factcheck.exception.SearchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds claims and knowledge passages with the configured embedding model.
 *
 * <p>Failures are not retried. They surface as {@link SearchException} because an embedding is
 * only ever needed to reach the vector index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; one char per token keeps dense text in range
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public List<Float> embed(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content().vector());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @CircuitBreaker(name = "openai-batch", fallbackMethod = "embedAllFallback")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(truncate(t))).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<List<Float>> vectors = new ArrayList<>(texts.size());
      for (Embedding embedding : response.content()) {
        vectors.add(toList(embedding.vector()));
      }
      meterRegistry.counter("embedding.requests.success").increment();
      return vectors;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    throw new SearchException("embedding", "Embedding failed: " + t.getMessage(), t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedAllFallback(List<String> texts, Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    throw new SearchException(
        "embedding", "Batch embedding of " + texts.size() + " texts failed: " + t.getMessage(), t);
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
