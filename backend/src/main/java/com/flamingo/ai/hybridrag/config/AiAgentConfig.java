package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.agent.IntentPlannerAgent;
import com.flamingo.ai.hybridrag.agent.QualityEvaluationAgent;
import com.flamingo.ai.hybridrag.agent.QueryExpansionAgent;
import com.flamingo.ai.hybridrag.agent.RelevanceRerankerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LLM judges used by the retrieval pipeline, built with LangChain4j AI
 * Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder(). All agents share the JSON-mode ChatModel.
 */
@Configuration
public class AiAgentConfig {

  /** Intent planner: decides whether a query needs retrieval. */
  @Bean
  public IntentPlannerAgent intentPlannerAgent(ChatModel chatModel) {
    return AiServices.builder(IntentPlannerAgent.class).chatModel(chatModel).build();
  }

  /** Query expansion: alternative phrasings for weak or empty retrievals. */
  @Bean
  public QueryExpansionAgent queryExpansionAgent(ChatModel chatModel) {
    return AiServices.builder(QueryExpansionAgent.class).chatModel(chatModel).build();
  }

  /** Quality evaluation: judges whether retrieved passages answer the query. */
  @Bean
  public QualityEvaluationAgent qualityEvaluationAgent(ChatModel chatModel) {
    return AiServices.builder(QualityEvaluationAgent.class).chatModel(chatModel).build();
  }

  /** Relevance reranker: scores a capped candidate batch in a single call. */
  @Bean
  public RelevanceRerankerAgent relevanceRerankerAgent(ChatModel chatModel) {
    return AiServices.builder(RelevanceRerankerAgent.class).chatModel(chatModel).build();
  }
}
