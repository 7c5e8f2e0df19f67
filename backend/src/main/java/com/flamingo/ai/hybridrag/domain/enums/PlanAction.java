package com.flamingo.ai.hybridrag.domain.enums;

/** Action chosen by the intent planner for an incoming query. */
public enum PlanAction {
  /** Knowledge question, answer from retrieved passages. */
  RETRIEVE,
  /** Conversational turn (greeting, thanks), answer without retrieval. */
  DIRECT_RESPONSE,
  /** Query too vague to act on, ask the user to clarify. */
  CLARIFY
}
