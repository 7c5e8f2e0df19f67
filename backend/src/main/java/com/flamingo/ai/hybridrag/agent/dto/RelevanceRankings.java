package com.flamingo.ai.hybridrag.agent.dto;

import java.util.List;

/**
 * Structured JSON output from RelevanceRerankerAgent. One ranking per passage index sent in the
 * batch.
 */
public record RelevanceRankings(List<PassageRanking> rankings) {

  /** Relevance score (0.0-1.0) for the passage at {@code passageIndex}. */
  public record PassageRanking(Integer passageIndex, Double score, String reasoning) {}
}
