package com.flamingo.ai.hybridrag.agent;

import com.flamingo.ai.hybridrag.agent.dto.IntentClassification;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent deciding whether a query needs document retrieval at all. */
public interface IntentPlannerAgent {

  @SystemMessage(
      """
        You are the planning step of a document question-answering assistant.

        Decide whether the user's message needs information from the document knowledge base.

        Rules:
        1. Knowledge questions, requests for facts, policies, procedures or anything that could
           be answered from documents → needsRetrieval=true, action="RETRIEVE"
        2. Purely conversational turns (greetings, thanks, acknowledgements, small talk)
           → needsRetrieval=false, action="DIRECT_RESPONSE", and write a short friendly
           suggestedResponse
        3. Messages too vague to search for (e.g. "tell me more" with no topic)
           → needsRetrieval=false, action="CLARIFY", suggestedResponse asks what the user means
        4. When unsure, choose retrieval

        Examples:
        - "hello" → needsRetrieval=false, action="DIRECT_RESPONSE",
          suggestedResponse="Hello! How can I help you today?"
        - "What is the refund policy?" → needsRetrieval=true, action="RETRIEVE"
        - "thanks, that helps" → needsRetrieval=false, action="DIRECT_RESPONSE"

        Return JSON with these fields:
        - needsRetrieval (boolean)
        - action (one of "RETRIEVE", "DIRECT_RESPONSE", "CLARIFY")
        - reasoning (string) - brief explanation
        - suggestedResponse (string or null)
        """)
  @UserMessage("User message: {{query}}")
  IntentClassification classify(@V("query") String query);
}
