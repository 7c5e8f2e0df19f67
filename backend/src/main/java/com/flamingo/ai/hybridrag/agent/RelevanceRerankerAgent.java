package com.flamingo.ai.hybridrag.agent;

import com.flamingo.ai.hybridrag.agent.dto.RelevanceRankings;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent scoring query-passage relevance for a whole candidate batch in one call.
 *
 * <p>This is an LLM judge, not a cross-encoder model.
 */
public interface RelevanceRerankerAgent {

  @SystemMessage(
      """
        You are a relevance ranking system. Given a query and multiple numbered passages,
        score each passage by how well it helps answer the query.

        Scoring Guidelines:
        - 1.0 = Perfectly answers the query with precise information
        - 0.7-0.9 = Highly relevant, contains most needed information
        - 0.4-0.6 = Somewhat relevant, contains related information
        - 0.1-0.3 = Marginally relevant, tangentially related
        - 0.0 = Not relevant at all

        Score every passage exactly once. Return a JSON object with a "rankings" array of
        objects with:
        - passageIndex: the number shown in brackets
        - score: relevance score from 0.0 to 1.0
        - reasoning: brief explanation
        Example: {"rankings": [{"passageIndex": 0, "score": 0.8, "reasoning": "..."}]}
        """)
  @UserMessage(
      """
        Query: {{query}}

        Passages:
        {{passages}}
        """)
  RelevanceRankings scorePassages(@V("query") String query, @V("passages") String passages);
}
