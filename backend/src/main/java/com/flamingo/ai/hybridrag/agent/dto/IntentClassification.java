package com.flamingo.ai.hybridrag.agent.dto;

import com.flamingo.ai.hybridrag.domain.enums.PlanAction;

/**
 * Structured output from IntentPlannerAgent. LangChain4j deserializes the JSON response into this
 * record.
 */
public record IntentClassification(
    Boolean needsRetrieval,
    PlanAction action,
    String reasoning,
    String suggestedResponse // Only for conversational turns
    ) {}
