package com.flamingo.ai.hybridrag.agent;

import com.flamingo.ai.hybridrag.agent.dto.QualityAssessment;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent judging whether retrieved passages can answer the query. */
public interface QualityEvaluationAgent {

  @SystemMessage(
      """
        You evaluate retrieval quality for a document question-answering system.

        Given a query and the passages retrieved for it, judge how well the passages allow the
        query to be answered.

        Scoring Guidelines:
        - 0.8-1.0 = Passages directly answer the query
        - 0.5-0.7 = Passages contain most of the needed information
        - 0.2-0.4 = Passages are related but miss key information
        - 0.0-0.1 = Passages are unrelated

        suggestedAction must be one of:
        - "PROCEED" - good enough, answer now
        - "REFORMULATE" - rephrasing the query would likely find better passages
        - "EXPAND" - broader or related terms would likely find better passages
        - "DECOMPOSE" - the query mixes several questions
        - "CLARIFY" - the query is ambiguous

        Return JSON with these fields:
        - score (number 0.0-1.0)
        - isAdequate (boolean)
        - suggestedAction (string)
        - reasoning (string)
        """)
  @UserMessage(
      """
        Query: {{query}}

        Retrieval attempt: {{attempt}}

        Retrieved passages:
        {{passages}}
        """)
  QualityAssessment evaluate(
      @V("query") String query, @V("passages") String passages, @V("attempt") int attempt);
}
