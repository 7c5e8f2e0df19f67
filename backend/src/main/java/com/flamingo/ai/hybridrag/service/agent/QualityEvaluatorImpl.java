package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.agent.QualityEvaluationAgent;
import com.flamingo.ai.hybridrag.agent.dto.QualityAssessment;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.SuggestedAction;
import com.flamingo.ai.hybridrag.exception.StageFailureException;
import com.flamingo.ai.hybridrag.service.agent.model.QualityEvaluation;
import com.flamingo.ai.hybridrag.service.rag.StageExecutor;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QualityEvaluatorImpl implements QualityEvaluator {

  private final QualityEvaluationAgent agent;
  private final StageExecutor stageExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.quality", description = "Time to evaluate retrieval quality")
  public QualityEvaluation evaluate(Query query, List<String> retrievedTexts, int attempt)
      throws InterruptedException {
    String passages = buildPassagesString(retrievedTexts);

    QualityAssessment assessment;
    try {
      assessment =
          stageExecutor.call(
              "evaluation",
              ragConfig.getTimeouts().getEvaluation(),
              () -> agent.evaluate(query.text(), passages, attempt));
    } catch (StageFailureException e) {
      log.warn("Quality evaluation failed on attempt {}: {}", attempt, e.getMessage());
      meterRegistry.counter("rag.quality.errors").increment();
      return QualityEvaluation.failOpen("Evaluation failed: " + e.getMessage());
    }

    if (assessment == null || assessment.score() == null || assessment.score().isNaN()) {
      log.warn("Quality evaluation returned no score on attempt {}, accepting results", attempt);
      meterRegistry.counter("rag.quality.errors").increment();
      return QualityEvaluation.failOpen("Evaluation returned no score");
    }

    double score = Math.max(0.0, Math.min(1.0, assessment.score()));
    boolean adequate = Boolean.TRUE.equals(assessment.isAdequate());
    SuggestedAction action =
        assessment.suggestedAction() != null
            ? assessment.suggestedAction()
            : (adequate ? SuggestedAction.PROCEED : SuggestedAction.REFORMULATE);

    log.debug(
        "Quality attempt {}: score={}, adequate={}, action={}",
        attempt,
        String.format("%.2f", score),
        adequate,
        action);
    meterRegistry.summary("rag.quality.score").record(score);
    return new QualityEvaluation(
        score, adequate, action, assessment.reasoning() != null ? assessment.reasoning() : "");
  }

  private String buildPassagesString(List<String> texts) {
    int previewChars = ragConfig.getQuality().getPreviewChars();
    int maxPassages = ragConfig.getQuality().getMaxPassages();
    StringBuilder sb = new StringBuilder();

    int count = Math.min(texts.size(), maxPassages);
    for (int i = 0; i < count; i++) {
      String text = texts.get(i) != null ? texts.get(i) : "";
      if (text.length() > previewChars) {
        text = text.substring(0, previewChars) + "...";
      }
      sb.append(i + 1).append(". ").append(text).append("\n\n");
    }

    return sb.toString().trim();
  }
}
