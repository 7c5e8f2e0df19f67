package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.service.agent.model.QualityEvaluation;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import java.util.List;

/** Judges whether retrieved passages are good enough to answer a query. */
public interface QualityEvaluator {
  /**
   * Evaluates one retrieval attempt. When the judge is unreachable the results are accepted.
   *
   * @param query the original user query
   * @param retrievedTexts passage texts, best first
   * @param attempt retrieval attempt number, 1-based
   * @return the verdict
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  QualityEvaluation evaluate(Query query, List<String> retrievedTexts, int attempt)
      throws InterruptedException;
}
