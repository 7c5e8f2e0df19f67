package com.flamingo.ai.hybridrag.service.rag;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.service.rag.model.FusedCandidateSet;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reciprocal Rank Fusion of dense and sparse rankings.
 *
 * <p>RRF score = Σ 1/(k + rank + 1) over the lists a passage appears in, with 0-based ranks. Only
 * rank positions are used, never the raw dense or sparse scores. A passage found by both retrievers
 * sums both contributions and therefore outranks one found by a single retriever at the same
 * position. Ties keep discovery order: dense positions first, then sparse-only positions.
 *
 * <p>Pure function: no I/O and no shared state.
 */
@Component
@RequiredArgsConstructor
public class RankFusion {

  private final RagConfig ragConfig;

  /** Fuses with the configured {@code rag.retrieval.rrf-k}. */
  public FusedCandidateSet fuse(List<RankedResult> dense, List<RankedResult> sparse) {
    return fuse(dense, sparse, ragConfig.getRetrieval().getRrfK());
  }

  /**
   * Fuses two rankings.
   *
   * @param dense dense ranking, best first
   * @param sparse sparse ranking, best first
   * @param k damping constant, larger values flatten the gap between ranks
   * @return deduplicated candidates in descending fused score
   */
  public FusedCandidateSet fuse(List<RankedResult> dense, List<RankedResult> sparse, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("RRF k must be positive, was " + k);
    }

    // Insertion order is discovery order, which the stable sort below keeps for ties.
    Map<String, Accumulator> byId = new LinkedHashMap<>();
    accumulate(byId, dense, k);
    accumulate(byId, sparse, k);
    if (byId.isEmpty()) {
      return FusedCandidateSet.empty();
    }

    List<Accumulator> ordered = new ArrayList<>(byId.values());
    ordered.sort((a, b) -> Double.compare(b.score, a.score));

    return new FusedCandidateSet(
        ordered.stream().map(acc -> acc.first.fused(acc.score)).toList());
  }

  /** Partial score contributed by a 0-based rank position. */
  public static double partialScore(int rank, int k) {
    return 1.0 / (k + rank + 1);
  }

  private static void accumulate(Map<String, Accumulator> byId, List<RankedResult> ranking, int k) {
    if (ranking == null) {
      return;
    }
    Set<String> seenInList = new HashSet<>();
    for (int rank = 0; rank < ranking.size(); rank++) {
      RankedResult result = ranking.get(rank);
      if (!seenInList.add(result.id())) {
        continue; // a list counts each passage once, at its best position
      }
      double partial = partialScore(rank, k);
      byId.computeIfAbsent(result.id(), id -> new Accumulator(result)).score += partial;
    }
  }

  private static final class Accumulator {
    private final RankedResult first;
    private double score;

    private Accumulator(RankedResult first) {
      this.first = first;
    }
  }
}
