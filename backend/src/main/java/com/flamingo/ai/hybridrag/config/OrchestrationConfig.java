package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.service.agent.RetrievalPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the retrieval loop. */
@Configuration
@Slf4j
public class OrchestrationConfig {

  @Bean
  public RetrievalPolicy retrievalPolicy(RagConfig ragConfig) {
    RetrievalPolicy policy = RetrievalPolicy.from(ragConfig.getOrchestration());
    log.info(
        "Retrieval policy '{}': maxAttempts={}, qualityGate={}, threshold={}",
        policy.name(),
        policy.maxAttempts(),
        policy.qualityGateEnabled(),
        policy.qualityThreshold());
    return policy;
  }
}
