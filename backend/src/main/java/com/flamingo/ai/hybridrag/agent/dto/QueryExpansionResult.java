package com.flamingo.ai.hybridrag.agent.dto;

import java.util.List;

/** Structured output from QueryExpansionAgent: alternative phrasings, best first. */
public record QueryExpansionResult(List<String> expandedQueries, String reasoning) {}
