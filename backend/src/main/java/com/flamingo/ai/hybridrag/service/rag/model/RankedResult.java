package com.flamingo.ai.hybridrag.service.rag.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.hybridrag.domain.enums.RankOrigin;

/**
 * A scored passage candidate. The {@code id} is the chunk key shared by dense and sparse search so
 * fusion can recognise the same passage returned by both.
 *
 * @param id stable passage identity
 * @param text passage text
 * @param source provenance of the passage
 * @param score score assigned by the stage named in {@code rankOrigin}
 * @param rankOrigin stage that produced the score
 * @param justification reranker explanation, null unless reranked
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankedResult(
    String id,
    String text,
    SourceMetadata source,
    double score,
    RankOrigin rankOrigin,
    String justification) {

  public RankedResult(
      String id, String text, SourceMetadata source, double score, RankOrigin rankOrigin) {
    this(id, text, source, score, rankOrigin, null);
  }

  /** Copy with a fused score. */
  public RankedResult fused(double fusedScore) {
    return new RankedResult(id, text, source, fusedScore, RankOrigin.FUSED, null);
  }

  /** Copy with a reranker score and its justification. */
  public RankedResult reranked(double relevanceScore, String reason) {
    return new RankedResult(id, text, source, relevanceScore, RankOrigin.RERANKED, reason);
  }
}
