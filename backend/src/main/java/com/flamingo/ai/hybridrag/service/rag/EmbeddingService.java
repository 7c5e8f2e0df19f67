package com.flamingo.ai.hybridrag.service.rag;

import com.flamingo.ai.hybridrag.config.CacheConfig;
import com.flamingo.ai.hybridrag.config.RagConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Service for embedding query text with the configured embedding model. An empty list means the
 * embedding could not be produced and dense search should be skipped; such results are never
 * cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String modelName;

  @Cacheable(
      cacheNames = CacheConfig.QUERY_EMBEDDINGS,
      key = "#root.target.cacheKey(#root.args[0])",
      condition = "@ragConfig.embedding.cache.enabled",
      unless = "#result.isEmpty()")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    String text = ragConfig.getEmbedding().getQueryPrefix() + query;
    int maxChars = ragConfig.getEmbedding().getMaxChars();
    if (text.length() > maxChars) {
      log.warn(
          "Query too long for embedding, truncating from {} to {} chars", text.length(), maxChars);
      text = text.substring(0, maxChars);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success").increment();

      float[] vector = response.content().vector();
      log.debug("Query embedding generated, dimension: {}", vector.length);
      List<Float> result = new ArrayList<>(vector.length);
      for (float f : vector) {
        result.add(f);
      }
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** Cache key: the model and the exact text sent to it, so a model or prefix change misses. */
  public String cacheKey(String query) {
    return modelName + ":" + ragConfig.getEmbedding().getQueryPrefix() + query;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
