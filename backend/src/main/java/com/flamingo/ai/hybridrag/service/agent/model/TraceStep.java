package com.flamingo.ai.hybridrag.service.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.hybridrag.domain.enums.SuggestedAction;
import com.flamingo.ai.hybridrag.domain.enums.TraceStepType;
import java.util.List;

/**
 * One entry of an {@link ExecutionTrace}. Fields that do not apply to the step are null.
 *
 * @param step kind of step
 * @param attempt retrieval attempt number, 1-based
 * @param query query text used by the step
 * @param candidateCount number of results retrieved
 * @param qualityScore evaluator score
 * @param adequate evaluator verdict
 * @param suggestedAction evaluator suggestion
 * @param alternatives expanded query texts
 * @param detail free-text reasoning or reason for the step
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceStep(
    TraceStepType step,
    Integer attempt,
    String query,
    Integer candidateCount,
    Double qualityScore,
    Boolean adequate,
    SuggestedAction suggestedAction,
    List<String> alternatives,
    String detail) {

  public static TraceStep plan(Plan plan) {
    return new TraceStep(
        TraceStepType.PLAN,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        plan.action() + ": " + plan.reasoning());
  }

  public static TraceStep retrieve(int attempt, String query, int candidateCount) {
    return new TraceStep(
        TraceStepType.RETRIEVE, attempt, query, candidateCount, null, null, null, null, null);
  }

  public static TraceStep expand(QueryExpansion expansion) {
    return new TraceStep(
        TraceStepType.EXPAND,
        null,
        expansion.originalQuery(),
        null,
        null,
        null,
        null,
        expansion.alternatives(),
        expansion.reasoning());
  }

  public static TraceStep evaluate(int attempt, QualityEvaluation evaluation) {
    return new TraceStep(
        TraceStepType.EVALUATE,
        attempt,
        null,
        null,
        evaluation.score(),
        evaluation.adequate(),
        evaluation.suggestedAction(),
        null,
        evaluation.reasoning());
  }

  public static TraceStep reformulate(int attempt, String newQuery, String reason) {
    return new TraceStep(
        TraceStepType.REFORMULATE, attempt, newQuery, null, null, null, null, null, reason);
  }
}
