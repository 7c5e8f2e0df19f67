package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.service.agent.model.Plan;
import com.flamingo.ai.hybridrag.service.rag.model.Query;

/** Decides whether a query needs document retrieval. */
public interface IntentPlanner {
  /**
   * Classifies the query. Never fails: when the classification call errors or times out the plan
   * defaults to retrieval.
   *
   * @param query the user query
   * @return the plan for this query
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  Plan plan(Query query) throws InterruptedException;
}
