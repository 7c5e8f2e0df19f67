package com.flamingo.ai.hybridrag.service.rag;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.exception.StageFailureException;
import com.flamingo.ai.hybridrag.service.rag.model.FusedCandidateSet;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import com.flamingo.ai.hybridrag.service.rag.model.RerankOutcome;
import com.flamingo.ai.hybridrag.service.rag.search.DenseSearch;
import com.flamingo.ai.hybridrag.service.rag.search.SparseSearch;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One hybrid retrieval attempt: dense and keyword search run concurrently, are fused with
 * Reciprocal Rank Fusion and the leading candidates are reranked by the LLM judge.
 *
 * <p>A failed or timed-out search contributes an empty list; the attempt itself never fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridRetriever {

  private final EmbeddingService embeddingService;
  private final DenseSearch denseSearch;
  private final SparseSearch sparseSearch;
  private final RankFusion rankFusion;
  private final RelevanceReranker relevanceReranker;
  private final StageExecutor stageExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves passages for {@code queryText}, returning at most {@code query.topK()} results.
   *
   * @param query the validated user query, supplies the result count
   * @param queryText the text to search and rerank with, either the original or an alternative
   *     phrasing
   * @return ranked results, best first, possibly empty
   * @throws InterruptedException if the calling thread is interrupted; in-flight searches are
   *     cancelled
   */
  @Timed(value = "rag.retrieval", description = "Time for one hybrid retrieval attempt")
  public List<RankedResult> retrieve(Query query, String queryText) throws InterruptedException {
    RagConfig.Timeouts timeouts = ragConfig.getTimeouts();
    int candidateTopK = ragConfig.getRetrieval().getCandidateTopK();
    log.debug("Starting hybrid retrieval for '{}' with candidateTopK={}", queryText, candidateTopK);

    List<Float> embedding = embed(queryText, timeouts.getEmbedding());

    Future<List<RankedResult>> denseFuture = null;
    Future<List<RankedResult>> sparseFuture = null;
    List<RankedResult> denseResults;
    List<RankedResult> sparseResults;
    try {
      if (embedding.isEmpty()) {
        log.warn("Query embedding unavailable, falling back to keyword search only");
      } else {
        denseFuture = submit("dense_search", () -> denseSearch.search(embedding, candidateTopK));
      }
      sparseFuture = submit("sparse_search", () -> sparseSearch.search(queryText, candidateTopK));

      denseResults = join("dense_search", denseFuture, timeouts.getDenseSearch());
      sparseResults = join("sparse_search", sparseFuture, timeouts.getSparseSearch());
    } catch (InterruptedException e) {
      stageExecutor.cancelAll(denseFuture, sparseFuture);
      throw e;
    }
    log.debug("Dense returned {}, sparse returned {}", denseResults.size(), sparseResults.size());

    FusedCandidateSet fused = rankFusion.fuse(denseResults, sparseResults);
    if (fused.isEmpty()) {
      log.info("No candidates found for '{}'", queryText);
      meterRegistry.counter("rag.retrieval.empty").increment();
      return List.of();
    }

    // The judge scores against the phrasing that produced these candidates
    Query searched = queryText.equals(query.text()) ? query : new Query(queryText, query.topK());
    RerankOutcome outcome =
        relevanceReranker.rerank(
            searched, fused.candidates(), ragConfig.getReranking().getCandidateCap());
    if (!outcome.isReranked()) {
      log.debug("Keeping fusion order: {}", outcome.fallbackReason());
    }

    List<RankedResult> results = outcome.items();
    if (results.size() > query.topK()) {
      results = results.subList(0, query.topK());
    }

    for (int i = 0; i < results.size(); i++) {
      RankedResult result = results.get(i);
      log.debug(
          "  [{}] id={} score={} origin={} file='{}'",
          i,
          result.id(),
          String.format("%.4f", result.score()),
          result.rankOrigin(),
          result.source() != null ? result.source().fileName() : "");
    }

    meterRegistry.counter("rag.retrieval.success").increment();
    return List.copyOf(results);
  }

  private List<Float> embed(String queryText, Duration timeout) throws InterruptedException {
    try {
      List<Float> embedding =
          stageExecutor.call("embedding", timeout, () -> embeddingService.embedQuery(queryText));
      return embedding != null ? embedding : List.of();
    } catch (StageFailureException e) {
      log.warn("Embedding failed: {}", e.getMessage());
      meterRegistry.counter("rag.retrieval.stage_failures", "stage", "embedding").increment();
      return List.of();
    }
  }

  private Future<List<RankedResult>> submit(
      String stage, Callable<List<RankedResult>> task) {
    try {
      return stageExecutor.submit(stage, task);
    } catch (StageFailureException e) {
      log.warn("{} not started: {}", stage, e.getMessage());
      meterRegistry.counter("rag.retrieval.stage_failures", "stage", stage).increment();
      return null;
    }
  }

  private List<RankedResult> join(String stage, Future<List<RankedResult>> future, Duration timeout)
      throws InterruptedException {
    if (future == null) {
      return List.of();
    }
    try {
      List<RankedResult> results = stageExecutor.await(stage, future, timeout);
      return results != null ? results : List.of();
    } catch (StageFailureException e) {
      log.warn("{} failed, continuing without it: {}", stage, e.getMessage());
      meterRegistry.counter("rag.retrieval.stage_failures", "stage", stage).increment();
      return List.of();
    }
  }
}
