package com.flamingo.ai.hybridrag.agent.dto;

import com.flamingo.ai.hybridrag.domain.enums.SuggestedAction;

/** Structured output from QualityEvaluationAgent. */
public record QualityAssessment(
    Double score, Boolean isAdequate, SuggestedAction suggestedAction, String reasoning) {}
