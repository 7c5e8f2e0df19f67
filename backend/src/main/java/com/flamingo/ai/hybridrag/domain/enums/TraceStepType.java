package com.flamingo.ai.hybridrag.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of step recorded in an execution trace. */
public enum TraceStepType {
  PLAN,
  RETRIEVE,
  EXPAND,
  EVALUATE,
  REFORMULATE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase();
  }
}
