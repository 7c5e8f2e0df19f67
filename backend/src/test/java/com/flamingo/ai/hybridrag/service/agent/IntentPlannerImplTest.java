package com.flamingo.ai.hybridrag.service.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.agent.IntentPlannerAgent;
import com.flamingo.ai.hybridrag.agent.dto.IntentClassification;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.PlanAction;
import com.flamingo.ai.hybridrag.service.agent.model.Plan;
import com.flamingo.ai.hybridrag.service.rag.StageExecutor;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("IntentPlannerImpl Tests")
class IntentPlannerImplTest {

  @Mock private IntentPlannerAgent agent;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private IntentPlannerImpl planner;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getTimeouts().setPlanning(Duration.ofSeconds(2));
    meterRegistry = new SimpleMeterRegistry();
    planner =
        new IntentPlannerImpl(
            agent,
            new StageExecutor(new SimpleAsyncTaskExecutor("planner-test-")),
            ragConfig,
            meterRegistry);
  }

  @Test
  @DisplayName("Should skip retrieval for a greeting")
  void shouldSkipRetrievalForGreeting() throws Exception {
    when(agent.classify("hello"))
        .thenReturn(
            new IntentClassification(
                false, PlanAction.DIRECT_RESPONSE, "greeting", "Hi! What would you like to know?"));

    Plan plan = planner.plan(new Query("hello", 5));

    assertThat(plan.needsRetrieval()).isFalse();
    assertThat(plan.action()).isEqualTo(PlanAction.DIRECT_RESPONSE);
    assertThat(plan.suggestedResponse()).isEqualTo("Hi! What would you like to know?");
  }

  @Test
  @DisplayName("Should retrieve for a knowledge question")
  void shouldRetrieveForKnowledgeQuestion() throws Exception {
    when(agent.classify(anyString()))
        .thenReturn(new IntentClassification(true, PlanAction.RETRIEVE, "asks about policy", null));

    Plan plan = planner.plan(new Query("What is the refund policy?", 5));

    assertThat(plan.needsRetrieval()).isTrue();
    assertThat(plan.action()).isEqualTo(PlanAction.RETRIEVE);
    assertThat(plan.suggestedResponse()).isNull();
  }

  @Test
  @DisplayName("Should default to retrieval when the planner fails")
  void shouldFailOpenOnError() throws Exception {
    when(agent.classify(anyString())).thenThrow(new RuntimeException("LLM API error"));

    Plan plan = planner.plan(new Query("refund policy", 5));

    assertThat(plan.needsRetrieval()).isTrue();
    assertThat(plan.action()).isEqualTo(PlanAction.RETRIEVE);
    assertThat(plan.reasoning()).startsWith("Planning failed");
    assertThat(meterRegistry.counter("rag.planner.errors").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should default to retrieval when the planner times out")
  void shouldFailOpenOnTimeout() throws Exception {
    ragConfig.getTimeouts().setPlanning(Duration.ofMillis(50));
    when(agent.classify(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return new IntentClassification(false, PlanAction.DIRECT_RESPONSE, "late", "Hi");
            });

    Plan plan = planner.plan(new Query("refund policy", 5));

    assertThat(plan.needsRetrieval()).isTrue();
  }

  @Test
  @DisplayName("Should treat a missing retrieval flag as retrieval")
  void shouldTreatMissingFlagAsRetrieval() throws Exception {
    when(agent.classify(anyString()))
        .thenReturn(new IntentClassification(null, null, null, null));

    Plan plan = planner.plan(new Query("refund policy", 5));

    assertThat(plan.needsRetrieval()).isTrue();
    assertThat(plan.action()).isEqualTo(PlanAction.RETRIEVE);
  }

  @Test
  @DisplayName("Should default to retrieval for a null classification")
  void shouldFailOpenOnNullClassification() throws Exception {
    when(agent.classify(anyString())).thenReturn(null);

    Plan plan = planner.plan(new Query("refund policy", 5));

    assertThat(plan.needsRetrieval()).isTrue();
  }

  @Test
  @DisplayName("Should fill in a response when a direct answer has none")
  void shouldFillMissingSuggestedResponse() throws Exception {
    when(agent.classify(anyString()))
        .thenReturn(new IntentClassification(false, PlanAction.DIRECT_RESPONSE, "thanks", " "));

    Plan plan = planner.plan(new Query("thanks", 5));

    assertThat(plan.needsRetrieval()).isFalse();
    assertThat(plan.suggestedResponse()).isEqualTo(IntentPlannerImpl.DEFAULT_DIRECT_RESPONSE);
  }

  @Test
  @DisplayName("Should keep the clarify action for vague messages")
  void shouldKeepClarifyAction() throws Exception {
    when(agent.classify(anyString()))
        .thenReturn(new IntentClassification(false, PlanAction.CLARIFY, "too vague", null));

    Plan plan = planner.plan(new Query("tell me more", 5));

    assertThat(plan.action()).isEqualTo(PlanAction.CLARIFY);
    assertThat(plan.suggestedResponse()).isEqualTo(IntentPlannerImpl.DEFAULT_CLARIFY_RESPONSE);
  }
}
