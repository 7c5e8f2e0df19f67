package com.flamingo.ai.hybridrag.service.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.hybridrag.domain.enums.PlanAction;

/**
 * Decision made once per query on whether to enter the retrieval loop.
 *
 * @param needsRetrieval whether documents must be searched
 * @param action what to do with the query
 * @param reasoning short explanation from the planner
 * @param suggestedResponse reply for conversational turns, null when retrieving
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Plan(
    boolean needsRetrieval, PlanAction action, String reasoning, String suggestedResponse) {

  /** Plan used when the planner cannot be reached: retrieve anyway. */
  public static Plan failOpen(String reason) {
    return new Plan(
        true, PlanAction.RETRIEVE, "Planning failed, defaulting to retrieval: " + reason, null);
  }
}
