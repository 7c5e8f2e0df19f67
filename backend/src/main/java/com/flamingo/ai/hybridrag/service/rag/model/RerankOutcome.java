package com.flamingo.ai.hybridrag.service.rag.model;

import com.flamingo.ai.hybridrag.domain.enums.RankOrigin;
import java.util.List;

/**
 * Result of a rerank pass. {@code origin} is {@link RankOrigin#RERANKED} when the judge's scores
 * were applied, or {@link RankOrigin#FUSED} when the fusion order was kept.
 *
 * @param origin which ordering the items follow
 * @param items all candidates, none dropped or duplicated
 * @param fallbackReason why fusion order was kept, null when reranked
 */
public record RerankOutcome(RankOrigin origin, List<RankedResult> items, String fallbackReason) {

  public RerankOutcome {
    items = List.copyOf(items);
  }

  public static RerankOutcome reranked(List<RankedResult> items) {
    return new RerankOutcome(RankOrigin.RERANKED, items, null);
  }

  public static RerankOutcome fused(List<RankedResult> items, String reason) {
    return new RerankOutcome(RankOrigin.FUSED, items, reason);
  }

  public boolean isReranked() {
    return origin == RankOrigin.RERANKED;
  }
}
