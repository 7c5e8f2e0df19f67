package com.flamingo.ai.hybridrag.domain.enums;

/** Next step suggested by the quality evaluator after a retrieval attempt. */
public enum SuggestedAction {
  PROCEED,
  REFORMULATE,
  EXPAND,
  DECOMPOSE,
  CLARIFY;

  /** Whether a retry with a different phrasing of the query is worth an extra attempt. */
  public boolean warrantsRetry() {
    return this == REFORMULATE || this == EXPAND;
  }
}
