package com.flamingo.ai.hybridrag.domain.enums;

/**
 * Stage that produced a {@code RankedResult} score. Scores are only comparable between results of
 * the same origin.
 */
public enum RankOrigin {
  DENSE,
  SPARSE,
  FUSED,
  RERANKED
}
