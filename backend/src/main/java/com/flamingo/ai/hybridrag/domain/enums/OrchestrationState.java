package com.flamingo.ai.hybridrag.domain.enums;

/** States of the retrieval orchestrator. */
public enum OrchestrationState {
  PLANNING,
  RETRIEVING,
  EVALUATING,
  EXPANDING,
  SATISFIED,
  EXHAUSTED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SATISFIED || this == EXHAUSTED || this == CANCELLED;
  }
}
