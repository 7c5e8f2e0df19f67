package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.agent.IntentPlannerAgent;
import com.flamingo.ai.hybridrag.agent.dto.IntentClassification;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.PlanAction;
import com.flamingo.ai.hybridrag.exception.StageFailureException;
import com.flamingo.ai.hybridrag.service.agent.model.Plan;
import com.flamingo.ai.hybridrag.service.rag.StageExecutor;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class IntentPlannerImpl implements IntentPlanner {

  static final String DEFAULT_DIRECT_RESPONSE = "Hello! How can I help you with your documents?";
  static final String DEFAULT_CLARIFY_RESPONSE =
      "Could you tell me a bit more about what you are looking for?";

  private final IntentPlannerAgent agent;
  private final StageExecutor stageExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.planner", description = "Time to plan a query")
  public Plan plan(Query query) throws InterruptedException {
    IntentClassification classification;
    try {
      classification =
          stageExecutor.call(
              "planning",
              ragConfig.getTimeouts().getPlanning(),
              () -> agent.classify(query.text()));
    } catch (StageFailureException e) {
      log.warn("Intent planning failed for '{}': {}", query.preview(), e.getMessage());
      meterRegistry.counter("rag.planner.errors").increment();
      return Plan.failOpen(e.getMessage());
    }

    if (classification == null) {
      log.warn("Intent planner returned no classification, defaulting to retrieval");
      meterRegistry.counter("rag.planner.errors").increment();
      return Plan.failOpen("empty classification");
    }

    Plan plan = toPlan(classification);
    log.debug(
        "Plan for '{}': needsRetrieval={}, action={}, reasoning={}",
        query.preview(),
        plan.needsRetrieval(),
        plan.action(),
        plan.reasoning());
    meterRegistry.counter("rag.planner.decisions", "action", plan.action().name()).increment();
    return plan;
  }

  /** A missing retrieval flag counts as true. */
  private Plan toPlan(IntentClassification classification) {
    String reasoning = classification.reasoning() != null ? classification.reasoning() : "";
    boolean needsRetrieval = !Boolean.FALSE.equals(classification.needsRetrieval());
    if (needsRetrieval) {
      return new Plan(true, PlanAction.RETRIEVE, reasoning, null);
    }

    PlanAction action =
        classification.action() == PlanAction.CLARIFY
            ? PlanAction.CLARIFY
            : PlanAction.DIRECT_RESPONSE;
    String response = classification.suggestedResponse();
    if (response == null || response.isBlank()) {
      response =
          action == PlanAction.CLARIFY ? DEFAULT_CLARIFY_RESPONSE : DEFAULT_DIRECT_RESPONSE;
    }
    return new Plan(false, action, reasoning, response.trim());
  }
}
