package com.flamingo.ai.hybridrag.agent;

import com.flamingo.ai.hybridrag.agent.dto.QueryExpansionResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent proposing alternative phrasings for a query that retrieved nothing useful. */
public interface QueryExpansionAgent {

  @SystemMessage(
      """
        You are an expert at query expansion for information retrieval.

        Generate 3-5 alternative phrasings of the query that:
        1. Use synonyms and related terms
        2. Add specificity or context
        3. Rephrase from different angles
        4. Cover variations in how the information might appear in documents

        Keep the core intent but vary the expression. Put the most promising phrasing first.

        Return JSON with these fields:
        - expandedQueries (array of strings)
        - reasoning (string) - why these expansions were chosen
        """)
  @UserMessage("Expand this query: \"{{query}}\"")
  QueryExpansionResult expand(@V("query") String query);
}
