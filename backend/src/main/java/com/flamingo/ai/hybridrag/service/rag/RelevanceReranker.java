package com.flamingo.ai.hybridrag.service.rag;

import com.flamingo.ai.hybridrag.agent.RelevanceRerankerAgent;
import com.flamingo.ai.hybridrag.agent.dto.RelevanceRankings;
import com.flamingo.ai.hybridrag.agent.dto.RelevanceRankings.PassageRanking;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.exception.StageFailureException;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import com.flamingo.ai.hybridrag.service.rag.model.RerankOutcome;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * LLM-based relevance reranking of fused candidates.
 *
 * <p>Only the first {@code cap} candidates are scored, all in a single batched call; the rest keep
 * their fusion rank and follow the reranked prefix. Any failure of the judge (exception, timeout,
 * malformed response) keeps the fusion order for the whole set and is reported through {@link
 * RerankOutcome#origin()}, never as an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelevanceReranker {

  private final RelevanceRerankerAgent agent;
  private final StageExecutor stageExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Reranks the first {@code cap} candidates by LLM relevance score.
   *
   * @param query the user query
   * @param candidates fused candidates, best first
   * @param cap number of leading candidates sent to the judge
   * @return every candidate exactly once, reranked prefix first
   * @throws InterruptedException if the calling thread is interrupted while waiting for the judge
   */
  @Timed(value = "rag.rerank", description = "Time for LLM reranking")
  public RerankOutcome rerank(Query query, List<RankedResult> candidates, int cap)
      throws InterruptedException {
    if (!ragConfig.getReranking().isEnabled()) {
      log.debug("LLM reranking disabled, keeping fusion order");
      return RerankOutcome.fused(candidates, "reranking disabled");
    }

    int prefixSize = Math.min(Math.max(cap, 0), candidates.size());
    if (prefixSize < 2) {
      log.debug("{} candidate(s) within cap, nothing to rerank", prefixSize);
      return RerankOutcome.fused(candidates, "fewer than two candidates within cap");
    }

    List<RankedResult> prefix = candidates.subList(0, prefixSize);
    List<RankedResult> tail = candidates.subList(prefixSize, candidates.size());
    log.debug(
        "Reranking {} of {} candidates with LLM for query '{}'",
        prefixSize,
        candidates.size(),
        query.preview());

    RelevanceRankings rankings;
    try {
      String passages = buildPassagesString(prefix);
      rankings =
          stageExecutor.call(
              "rerank",
              ragConfig.getTimeouts().getRerank(),
              () -> agent.scorePassages(query.text(), passages));
    } catch (StageFailureException e) {
      log.warn("Batch reranking failed: {}, falling back to fusion order", e.getMessage());
      meterRegistry.counter("rag.rerank.fallback", "reason", "call_failed").increment();
      return RerankOutcome.fused(candidates, e.getMessage());
    }

    double[] scores = new double[prefixSize];
    String[] reasons = new String[prefixSize];
    String problem = readScores(rankings, scores, reasons);
    if (problem != null) {
      log.warn("Malformed rerank response ({}), falling back to fusion order", problem);
      meterRegistry.counter("rag.rerank.fallback", "reason", "malformed").increment();
      return RerankOutcome.fused(candidates, "malformed response: " + problem);
    }

    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < prefixSize; i++) {
      order.add(i);
    }
    // Stable sort: equal scores keep fusion rank.
    order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

    List<RankedResult> reranked = new ArrayList<>(candidates.size());
    for (int i : order) {
      reranked.add(prefix.get(i).reranked(scores[i], reasons[i]));
    }
    reranked.addAll(tail);

    meterRegistry.counter("rag.rerank.invocations").increment();
    log.debug(
        "LLM reranking complete, top score: {}", String.format("%.3f", reranked.get(0).score()));
    return RerankOutcome.reranked(reranked);
  }

  /**
   * Copies judge scores into {@code scores}, clamped to [0,1].
   *
   * @return a description of what is wrong with the response, or null if it is usable
   */
  private String readScores(RelevanceRankings rankings, double[] scores, String[] reasons) {
    if (rankings == null || rankings.rankings() == null || rankings.rankings().isEmpty()) {
      return "no rankings";
    }
    boolean[] seen = new boolean[scores.length];
    for (PassageRanking ranking : rankings.rankings()) {
      if (ranking == null || ranking.passageIndex() == null || ranking.score() == null) {
        return "ranking without index or score";
      }
      int index = ranking.passageIndex();
      if (index < 0 || index >= scores.length) {
        return "passage index " + index + " out of range";
      }
      if (seen[index]) {
        return "passage index " + index + " scored twice";
      }
      double score = ranking.score();
      if (Double.isNaN(score) || Double.isInfinite(score)) {
        return "non-finite score for passage " + index;
      }
      seen[index] = true;
      scores[index] = Math.max(0.0, Math.min(1.0, score));
      reasons[index] = ranking.reasoning() != null ? ranking.reasoning() : "";
    }
    for (int i = 0; i < seen.length; i++) {
      if (!seen[i]) {
        return "passage " + i + " not scored";
      }
    }
    return null;
  }

  private String buildPassagesString(List<RankedResult> batch) {
    int previewChars = ragConfig.getReranking().getPreviewChars();
    StringBuilder sb = new StringBuilder();

    for (int i = 0; i < batch.size(); i++) {
      String content = batch.get(i).text();

      // Truncate long passages to keep the batch prompt small
      if (content.length() > previewChars) {
        content = content.substring(0, previewChars) + "...";
      }

      sb.append("[").append(i).append("] ").append(content).append("\n\n");
    }

    return sb.toString();
  }
}
