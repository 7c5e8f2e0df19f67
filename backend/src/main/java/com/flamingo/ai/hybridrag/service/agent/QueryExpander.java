package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.service.agent.model.QueryExpansion;
import com.flamingo.ai.hybridrag.service.rag.model.Query;

/**
 * Generates alternative phrasings for a query whose retrieval came back empty or weak. The query
 * itself is never modified.
 */
public interface QueryExpander {
  /**
   * @param query the original user query
   * @return up to five alternatives, best first; just the original text if expansion fails
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  QueryExpansion expand(Query query) throws InterruptedException;
}
