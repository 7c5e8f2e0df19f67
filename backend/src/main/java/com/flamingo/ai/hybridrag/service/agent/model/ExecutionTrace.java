package com.flamingo.ai.hybridrag.service.agent.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.hybridrag.domain.enums.TraceStepType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered, append-only log of the steps taken for one query. Serialized as a JSON array. */
public final class ExecutionTrace {

  private final List<TraceStep> steps = new ArrayList<>();

  public void append(TraceStep step) {
    steps.add(step);
  }

  @JsonValue
  public List<TraceStep> steps() {
    return Collections.unmodifiableList(steps);
  }

  public int size() {
    return steps.size();
  }

  public long count(TraceStepType type) {
    return steps.stream().filter(s -> s.step() == type).count();
  }

  public List<TraceStepType> stepTypes() {
    return steps.stream().map(TraceStep::step).toList();
  }

  @Override
  public String toString() {
    return "ExecutionTrace" + stepTypes();
  }
}
