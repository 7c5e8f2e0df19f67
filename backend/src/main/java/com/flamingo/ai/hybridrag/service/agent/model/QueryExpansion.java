package com.flamingo.ai.hybridrag.service.agent.model;

import java.util.List;

/**
 * Alternative phrasings of a query, most promising first. Never empty.
 *
 * @param originalQuery the query that was expanded, unchanged
 * @param alternatives alternative query texts
 * @param reasoning why these alternatives were chosen
 */
public record QueryExpansion(String originalQuery, List<String> alternatives, String reasoning) {

  public QueryExpansion {
    if (alternatives == null || alternatives.isEmpty()) {
      throw new IllegalArgumentException("Query expansion needs at least one alternative");
    }
    alternatives = List.copyOf(alternatives);
  }

  /** Expansion that only repeats the original query. */
  public static QueryExpansion ofOriginal(String originalQuery, String reasoning) {
    return new QueryExpansion(originalQuery, List.of(originalQuery), reasoning);
  }

  /** The alternative at {@code index}, clamped to the last one. */
  public String alternative(int index) {
    return alternatives.get(Math.max(0, Math.min(index, alternatives.size() - 1)));
  }
}
