package com.flamingo.ai.hybridrag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.config.CacheConfig;
import com.flamingo.ai.hybridrag.config.RagConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

/** Runs the service behind the real caching proxy and Caffeine cache manager. */
@SpringJUnitConfig(EmbeddingServiceCacheTest.TestConfig.class)
@DisplayName("EmbeddingService cache Tests")
class EmbeddingServiceCacheTest {

  @Configuration
  @Import({CacheConfig.class, EmbeddingService.class})
  static class TestConfig {

    @Bean
    RagConfig ragConfig() {
      return new RagConfig();
    }

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private EmbeddingService embeddingService;
  @Autowired private CacheManager cacheManager;
  @Autowired private RagConfig ragConfig;

  @BeforeEach
  void setUp() {
    cacheManager.getCache(CacheConfig.QUERY_EMBEDDINGS).clear();
    ragConfig.getEmbedding().getCache().setEnabled(true);
  }

  @Test
  @DisplayName("Should embed a repeated query only once")
  void shouldReuseEmbeddingForRepeatedQuery() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f));

    List<Float> first = embeddingService.embedQuery("refund policy");
    List<Float> second = embeddingService.embedQuery("refund policy");

    assertThat(second).isEqualTo(first).containsExactly(0.1f, 0.2f);
    verify(embeddingModel, times(1)).embed("refund policy");
  }

  @Test
  @DisplayName("Should embed different queries separately")
  void shouldEmbedDifferentQueriesSeparately() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f));

    embeddingService.embedQuery("refund policy");
    embeddingService.embedQuery("money back guarantee");

    verify(embeddingModel).embed("refund policy");
    verify(embeddingModel).embed("money back guarantee");
  }

  @Test
  @DisplayName("Should not cache an empty embedding")
  void shouldNotCacheEmptyEmbedding() {
    when(embeddingModel.embed(anyString())).thenReturn(response());

    assertThat(embeddingService.embedQuery("refund policy")).isEmpty();
    embeddingService.embedQuery("refund policy");

    verify(embeddingModel, times(2)).embed("refund policy");
  }

  @Test
  @DisplayName("Should call the model every time when the cache is disabled")
  void shouldBypassCacheWhenDisabled() {
    ragConfig.getEmbedding().getCache().setEnabled(false);
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f));

    embeddingService.embedQuery("refund policy");
    embeddingService.embedQuery("refund policy");

    verify(embeddingModel, times(2)).embed("refund policy");
  }

  private static Response<Embedding> response(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
