package com.flamingo.ai.hybridrag.service.agent.model;

import com.flamingo.ai.hybridrag.domain.enums.SuggestedAction;

/**
 * Verdict on how well one retrieval attempt answers the query.
 *
 * @param score quality score in [0,1]
 * @param adequate whether the judge considers the passages sufficient
 * @param suggestedAction what to try next
 * @param reasoning explanation from the judge
 */
public record QualityEvaluation(
    double score, boolean adequate, SuggestedAction suggestedAction, String reasoning) {

  /** Verdict used when the judge cannot be reached: accept the results. */
  public static QualityEvaluation failOpen(String reason) {
    return new QualityEvaluation(1.0, true, SuggestedAction.PROCEED, reason);
  }

  /** Whether the results are good enough under the given score threshold. */
  public boolean isAcceptable(double threshold) {
    return adequate || score >= threshold;
  }
}
