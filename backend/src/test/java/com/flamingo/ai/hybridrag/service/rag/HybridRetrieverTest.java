package com.flamingo.ai.hybridrag.service.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.RankOrigin;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import com.flamingo.ai.hybridrag.service.rag.model.RerankOutcome;
import com.flamingo.ai.hybridrag.service.rag.model.SourceMetadata;
import com.flamingo.ai.hybridrag.service.rag.search.DenseSearch;
import com.flamingo.ai.hybridrag.service.rag.search.SparseSearch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("HybridRetriever Tests")
class HybridRetrieverTest {

  private static final List<Float> EMBEDDING = List.of(0.1f, 0.2f, 0.3f);

  @Mock private EmbeddingService embeddingService;
  @Mock private DenseSearch denseSearch;
  @Mock private SparseSearch sparseSearch;
  @Mock private RelevanceReranker relevanceReranker;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private HybridRetriever hybridRetriever;
  private Query query;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getTimeouts().setEmbedding(Duration.ofSeconds(2));
    ragConfig.getTimeouts().setDenseSearch(Duration.ofSeconds(2));
    ragConfig.getTimeouts().setSparseSearch(Duration.ofSeconds(2));
    meterRegistry = new SimpleMeterRegistry();
    hybridRetriever =
        new HybridRetriever(
            embeddingService,
            denseSearch,
            sparseSearch,
            new RankFusion(ragConfig),
            relevanceReranker,
            new StageExecutor(new SimpleAsyncTaskExecutor("retrieval-test-")),
            ragConfig,
            meterRegistry);
    query = new Query("refund policy", 3);
  }

  @Nested
  @DisplayName("retrieve")
  class RetrieveTests {

    @Test
    @DisplayName("should fuse both searches, rerank and cut to topK")
    void shouldFuseRerankAndCut() throws Exception {
      when(embeddingService.embedQuery("refund policy")).thenReturn(EMBEDDING);
      when(denseSearch.search(EMBEDDING, 20)).thenReturn(results(RankOrigin.DENSE, "A", "B", "C"));
      when(sparseSearch.search("refund policy", 20))
          .thenReturn(results(RankOrigin.SPARSE, "B", "D"));
      when(relevanceReranker.rerank(eq(query), anyList(), eq(10)))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "disabled"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      assertThat(results).extracting(RankedResult::id).containsExactly("B", "A", "D");
      assertThat(results).allMatch(r -> r.rankOrigin() == RankOrigin.FUSED);
    }

    @Test
    @DisplayName("should pass fused candidates to the reranker in fusion order")
    @SuppressWarnings("unchecked")
    void shouldPassFusedCandidatesToReranker() throws Exception {
      when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
      when(denseSearch.search(any(), anyInt()))
          .thenReturn(results(RankOrigin.DENSE, "A", "B", "C"));
      when(sparseSearch.search(anyString(), anyInt()))
          .thenReturn(results(RankOrigin.SPARSE, "B", "D"));
      when(relevanceReranker.rerank(any(), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "disabled"));

      hybridRetriever.retrieve(query, "refund policy");

      ArgumentCaptor<List<RankedResult>> captor = ArgumentCaptor.forClass(List.class);
      verify(relevanceReranker).rerank(eq(query), captor.capture(), eq(10));
      assertThat(captor.getValue())
          .extracting(RankedResult::id)
          .containsExactly("B", "A", "D", "C");
    }

    @Test
    @DisplayName("should search and rerank with the alternative text")
    void shouldSearchAndRerankWithAlternativeText() throws Exception {
      when(embeddingService.embedQuery("money back rules")).thenReturn(EMBEDDING);
      when(denseSearch.search(EMBEDDING, 20)).thenReturn(results(RankOrigin.DENSE, "A"));
      when(sparseSearch.search("money back rules", 20)).thenReturn(List.of());
      when(relevanceReranker.rerank(eq(new Query("money back rules", 3)), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "single"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "money back rules");

      assertThat(results).extracting(RankedResult::id).containsExactly("A");
      verify(relevanceReranker, never()).rerank(eq(query), anyList(), anyInt());
    }

    @Test
    @DisplayName("should return empty without reranking when both searches find nothing")
    void shouldReturnEmptyWhenNothingFound() throws Exception {
      when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
      when(denseSearch.search(any(), anyInt())).thenReturn(List.of());
      when(sparseSearch.search(anyString(), anyInt())).thenReturn(List.of());

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      assertThat(results).isEmpty();
      verify(relevanceReranker, never()).rerank(any(), anyList(), anyInt());
      assertThat(meterRegistry.counter("rag.retrieval.empty").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("degraded stages")
  class DegradedStageTests {

    @Test
    @DisplayName("should fall back to keyword search when embedding is empty")
    void shouldUseKeywordOnlyWhenEmbeddingEmpty() throws Exception {
      when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
      when(sparseSearch.search(anyString(), anyInt()))
          .thenReturn(results(RankOrigin.SPARSE, "S1", "S2"));
      when(relevanceReranker.rerank(any(), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "disabled"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      verify(denseSearch, never()).search(anyList(), anyInt());
      assertThat(results).extracting(RankedResult::id).containsExactly("S1", "S2");
    }

    @Test
    @DisplayName("should fall back to keyword search when embedding throws")
    void shouldUseKeywordOnlyWhenEmbeddingThrows() throws Exception {
      when(embeddingService.embedQuery(anyString()))
          .thenThrow(new RuntimeException("OpenAI unavailable"));
      when(sparseSearch.search(anyString(), anyInt())).thenReturn(results(RankOrigin.SPARSE, "S1"));
      when(relevanceReranker.rerank(any(), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "single"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      verify(denseSearch, never()).search(anyList(), anyInt());
      assertThat(results).extracting(RankedResult::id).containsExactly("S1");
      assertThat(
              meterRegistry.counter("rag.retrieval.stage_failures", "stage", "embedding").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should continue with dense results when sparse search fails")
    void shouldContinueWhenSparseFails() throws Exception {
      when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
      when(denseSearch.search(any(), anyInt())).thenReturn(results(RankOrigin.DENSE, "A", "B"));
      when(sparseSearch.search(anyString(), anyInt()))
          .thenThrow(new RuntimeException("index unavailable"));
      when(relevanceReranker.rerank(any(), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "disabled"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      assertThat(results).extracting(RankedResult::id).containsExactly("A", "B");
    }

    @Test
    @DisplayName("should continue with sparse results when dense search times out")
    void shouldContinueWhenDenseTimesOut() throws Exception {
      ragConfig.getTimeouts().setDenseSearch(Duration.ofMillis(50));
      when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
      when(denseSearch.search(any(), anyInt()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return results(RankOrigin.DENSE, "A");
              });
      when(sparseSearch.search(anyString(), anyInt())).thenReturn(results(RankOrigin.SPARSE, "S1"));
      when(relevanceReranker.rerank(any(), anyList(), anyInt()))
          .thenAnswer(invocation -> RerankOutcome.fused(invocation.getArgument(1), "single"));

      List<RankedResult> results = hybridRetriever.retrieve(query, "refund policy");

      assertThat(results).extracting(RankedResult::id).containsExactly("S1");
    }
  }

  @Test
  @DisplayName("should propagate interruption while searches are in flight")
  void shouldPropagateInterruption() throws Exception {
    CountDownLatch searching = new CountDownLatch(1);
    when(embeddingService.embedQuery(anyString())).thenReturn(EMBEDDING);
    when(denseSearch.search(any(), anyInt()))
        .thenAnswer(
            invocation -> {
              searching.countDown();
              Thread.sleep(10_000);
              return List.of();
            });
    lenient().when(sparseSearch.search(anyString(), anyInt())).thenReturn(List.of());

    AtomicReference<Throwable> outcome = new AtomicReference<>();
    Thread caller =
        new Thread(
            () -> {
              try {
                hybridRetriever.retrieve(query, "refund policy");
              } catch (Throwable t) {
                outcome.set(t);
              }
            });
    caller.start();
    assertThat(searching.await(2, TimeUnit.SECONDS)).isTrue();

    caller.interrupt();
    caller.join(2_000);

    assertThat(outcome.get()).isInstanceOf(InterruptedException.class);
    verify(relevanceReranker, never()).rerank(any(), anyList(), anyInt());
  }

  private static List<RankedResult> results(RankOrigin origin, String... ids) {
    return Arrays.stream(ids)
        .map(
            id ->
                new RankedResult(
                    id,
                    "Passage " + id,
                    new SourceMetadata("doc-" + id, id + ".pdf", null, null),
                    0.5,
                    origin))
        .toList();
  }
}
