package com.flamingo.ai.hybridrag.service.rag.model;

import java.util.List;

/**
 * Fused candidates in descending fusion score. Contains no duplicate identities.
 *
 * @param candidates ordered candidates carrying {@code FUSED} scores
 */
public record FusedCandidateSet(List<RankedResult> candidates) {

  public FusedCandidateSet {
    candidates = List.copyOf(candidates);
  }

  public static FusedCandidateSet empty() {
    return new FusedCandidateSet(List.of());
  }

  public int size() {
    return candidates.size();
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  public List<String> ids() {
    return candidates.stream().map(RankedResult::id).toList();
  }
}
