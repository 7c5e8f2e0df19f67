package com.flamingo.ai.hybridrag.service.agent.model;

import com.flamingo.ai.hybridrag.domain.enums.OrchestrationState;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import java.util.List;

/**
 * Outcome of one orchestrated retrieval.
 *
 * @param results ranked passages, possibly empty
 * @param trace steps taken
 * @param plan the planner's decision
 * @param finalState terminal state reached
 */
public record OrchestrationResult(
    List<RankedResult> results, ExecutionTrace trace, Plan plan, OrchestrationState finalState) {

  public OrchestrationResult {
    results = List.copyOf(results);
  }
}
