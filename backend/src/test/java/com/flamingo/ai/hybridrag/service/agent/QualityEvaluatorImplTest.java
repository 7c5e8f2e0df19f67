package com.flamingo.ai.hybridrag.service.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.agent.QualityEvaluationAgent;
import com.flamingo.ai.hybridrag.agent.dto.QualityAssessment;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.SuggestedAction;
import com.flamingo.ai.hybridrag.service.agent.model.QualityEvaluation;
import com.flamingo.ai.hybridrag.service.rag.StageExecutor;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("QualityEvaluatorImpl Tests")
class QualityEvaluatorImplTest {

  @Mock private QualityEvaluationAgent agent;

  private RagConfig ragConfig;
  private QualityEvaluatorImpl evaluator;
  private Query query;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getTimeouts().setEvaluation(Duration.ofSeconds(2));
    evaluator =
        new QualityEvaluatorImpl(
            agent,
            new StageExecutor(new SimpleAsyncTaskExecutor("quality-test-")),
            ragConfig,
            new SimpleMeterRegistry());
    query = new Query("refund policy", 5);
  }

  @Test
  @DisplayName("Should return the judge's verdict")
  void shouldReturnVerdict() throws Exception {
    when(agent.evaluate(eq("refund policy"), anyString(), eq(1)))
        .thenReturn(new QualityAssessment(0.3, false, SuggestedAction.REFORMULATE, "off topic"));

    QualityEvaluation evaluation = evaluator.evaluate(query, List.of("passage"), 1);

    assertThat(evaluation.score()).isEqualTo(0.3);
    assertThat(evaluation.adequate()).isFalse();
    assertThat(evaluation.suggestedAction()).isEqualTo(SuggestedAction.REFORMULATE);
    assertThat(evaluation.isAcceptable(0.5)).isFalse();
  }

  @Test
  @DisplayName("Should truncate passages and cap how many are sent")
  void shouldTruncateAndCapPassages() throws Exception {
    ragConfig.getQuality().setPreviewChars(10);
    ragConfig.getQuality().setMaxPassages(2);
    when(agent.evaluate(anyString(), anyString(), anyInt()))
        .thenReturn(new QualityAssessment(0.9, true, SuggestedAction.PROCEED, "good"));
    List<String> texts = new ArrayList<>(List.of("y".repeat(50), "second passage", "third"));

    evaluator.evaluate(query, texts, 2);

    ArgumentCaptor<String> passages = ArgumentCaptor.forClass(String.class);
    verify(agent).evaluate(eq("refund policy"), passages.capture(), eq(2));
    assertThat(passages.getValue())
        .contains("1. " + "y".repeat(10) + "...")
        .contains("2. second pas...")
        .doesNotContain("third");
  }

  @Test
  @DisplayName("Should accept results when the judge fails")
  void shouldFailOpenOnError() throws Exception {
    when(agent.evaluate(anyString(), anyString(), anyInt()))
        .thenThrow(new RuntimeException("LLM API error"));

    QualityEvaluation evaluation = evaluator.evaluate(query, List.of("passage"), 1);

    assertThat(evaluation.score()).isEqualTo(1.0);
    assertThat(evaluation.adequate()).isTrue();
    assertThat(evaluation.suggestedAction()).isEqualTo(SuggestedAction.PROCEED);
  }

  @Test
  @DisplayName("Should accept results when the judge returns no score")
  void shouldFailOpenOnMissingScore() throws Exception {
    when(agent.evaluate(anyString(), anyString(), anyInt()))
        .thenReturn(new QualityAssessment(null, null, null, null));

    QualityEvaluation evaluation = evaluator.evaluate(query, List.of("passage"), 1);

    assertThat(evaluation.adequate()).isTrue();
    assertThat(evaluation.suggestedAction()).isEqualTo(SuggestedAction.PROCEED);
  }

  @Test
  @DisplayName("Should clamp out-of-range scores")
  void shouldClampScore() throws Exception {
    when(agent.evaluate(anyString(), anyString(), anyInt()))
        .thenReturn(new QualityAssessment(1.7, true, SuggestedAction.PROCEED, "great"));

    QualityEvaluation evaluation = evaluator.evaluate(query, List.of("passage"), 1);

    assertThat(evaluation.score()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should suggest reformulation when an inadequate verdict has no action")
  void shouldDefaultActionForInadequateVerdict() throws Exception {
    when(agent.evaluate(anyString(), anyString(), anyInt()))
        .thenReturn(new QualityAssessment(0.2, false, null, "weak"));

    QualityEvaluation evaluation = evaluator.evaluate(query, List.of("passage"), 1);

    assertThat(evaluation.suggestedAction()).isEqualTo(SuggestedAction.REFORMULATE);
  }
}
