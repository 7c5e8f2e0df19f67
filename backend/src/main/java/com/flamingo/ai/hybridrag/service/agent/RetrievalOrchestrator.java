package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.OrchestrationState;
import com.flamingo.ai.hybridrag.exception.InvalidQueryException;
import com.flamingo.ai.hybridrag.service.agent.model.ExecutionTrace;
import com.flamingo.ai.hybridrag.service.agent.model.OrchestrationResult;
import com.flamingo.ai.hybridrag.service.agent.model.Plan;
import com.flamingo.ai.hybridrag.service.agent.model.QualityEvaluation;
import com.flamingo.ai.hybridrag.service.agent.model.QueryExpansion;
import com.flamingo.ai.hybridrag.service.agent.model.TraceStep;
import com.flamingo.ai.hybridrag.service.rag.HybridRetriever;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Plans a query, then retrieves with self-correction until the results are good enough or the
 * attempt budget of the {@link RetrievalPolicy} is spent.
 *
 * <p>State flow: {@code PLANNING -> RETRIEVING -> (EVALUATING) -> SATISFIED | EXPANDING ->
 * RETRIEVING | EXHAUSTED}. Degraded stages never surface as exceptions; only invalid input does.
 * Interrupting the calling thread stops the loop and yields {@link OrchestrationState#CANCELLED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalOrchestrator {

  private final IntentPlanner intentPlanner;
  private final HybridRetriever hybridRetriever;
  private final QueryExpander queryExpander;
  private final QualityEvaluator qualityEvaluator;
  private final RetrievalPolicy policy;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the full plan-retrieve-reflect loop for one query.
   *
   * @param queryText raw query text
   * @param topK number of results requested
   * @return results, trace, plan and the terminal state
   * @throws InvalidQueryException if the text is blank or too long, or topK is out of range
   */
  @Timed(value = "rag.orchestrator", description = "Time for orchestrated retrieval")
  public OrchestrationResult execute(String queryText, int topK) {
    RagConfig.Orchestration limits = ragConfig.getOrchestration();
    Query query = Query.of(queryText, topK, limits.getMaxQueryLength(), limits.getMaxTopK());

    Run run = new Run(query);
    try {
      return run.execute();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Retrieval for '{}' cancelled in state {}", query.preview(), run.state);
      return run.finish(OrchestrationState.CANCELLED, run.bestOrEmpty());
    }
  }

  /** Mutable state of one {@link #execute} call. Never shared between requests. */
  private final class Run {

    private final Query query;
    private final ExecutionTrace trace = new ExecutionTrace();
    private OrchestrationState state = OrchestrationState.PLANNING;
    private Plan plan;
    private QueryExpansion expansion;
    private List<RankedResult> best;
    private double bestScore = Double.NEGATIVE_INFINITY;

    Run(Query query) {
      this.query = query;
    }

    OrchestrationResult execute() throws InterruptedException {
      log.info("=== Starting retrieval for '{}' (policy {}) ===", query.preview(), policy.name());

      checkCancelled();
      plan = intentPlanner.plan(query);
      trace.append(TraceStep.plan(plan));
      if (!plan.needsRetrieval()) {
        log.info("No retrieval needed ({}), responding directly", plan.action());
        return finish(OrchestrationState.SATISFIED, List.of());
      }

      String currentQuery = query.text();
      for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
        checkCancelled();
        state = OrchestrationState.RETRIEVING;
        log.info("--- Attempt {}/{} with '{}' ---", attempt, policy.maxAttempts(), currentQuery);

        List<RankedResult> results = hybridRetriever.retrieve(query, currentQuery);
        trace.append(TraceStep.retrieve(attempt, currentQuery, results.size()));

        if (results.isEmpty()) {
          if (attempt == 1 && attempt < policy.maxAttempts()) {
            currentQuery = expand().alternative(0);
            log.info("No results, trying expanded query '{}'", currentQuery);
            continue;
          }
          log.warn("No results on attempt {}, giving up", attempt);
          break;
        }

        if (!policy.qualityGateEnabled()) {
          log.info("Quality gate disabled, accepting {} results", results.size());
          return finish(OrchestrationState.SATISFIED, results);
        }

        checkCancelled();
        state = OrchestrationState.EVALUATING;
        List<String> texts = results.stream().map(RankedResult::text).toList();
        QualityEvaluation evaluation = qualityEvaluator.evaluate(query, texts, attempt);
        trace.append(TraceStep.evaluate(attempt, evaluation));
        remember(results, evaluation.score());

        if (evaluation.isAcceptable(policy.qualityThreshold())) {
          log.info(
              "Quality acceptable (score: {}), proceeding",
              String.format("%.2f", evaluation.score()));
          return finish(OrchestrationState.SATISFIED, results);
        }

        log.info(
            "Quality insufficient (score: {}), suggested action: {}",
            String.format("%.2f", evaluation.score()),
            evaluation.suggestedAction());
        if (attempt < policy.maxAttempts() && evaluation.suggestedAction().warrantsRetry()) {
          // A different alternative on each attempt
          currentQuery = expand().alternative(attempt - 1);
          String reason =
              "Quality too low (" + evaluation.suggestedAction() + "), trying different phrasing";
          trace.append(TraceStep.reformulate(attempt + 1, currentQuery, reason));
          log.info("Reformulated query: '{}'", currentQuery);
          continue;
        }

        log.info("Max attempts reached or no better strategy, keeping best results");
        break;
      }

      return best != null
          ? finish(OrchestrationState.SATISFIED, best)
          : finish(OrchestrationState.EXHAUSTED, List.of());
    }

    /** Expands the original query once per request and reuses the alternatives afterwards. */
    private QueryExpansion expand() throws InterruptedException {
      if (expansion == null) {
        checkCancelled();
        state = OrchestrationState.EXPANDING;
        expansion = queryExpander.expand(query);
        trace.append(TraceStep.expand(expansion));
      }
      return expansion;
    }

    /** Keeps the highest-scoring non-empty result set; earlier sets win ties. */
    private void remember(List<RankedResult> results, double score) {
      if (best == null || score > bestScore) {
        best = results;
        bestScore = score;
      }
    }

    List<RankedResult> bestOrEmpty() {
      return best != null ? best : List.of();
    }

    OrchestrationResult finish(OrchestrationState terminal, List<RankedResult> results) {
      if (!terminal.isTerminal()) {
        throw new IllegalStateException("Cannot finish in non-terminal state " + terminal);
      }
      state = terminal;
      log.info(
          "Retrieval finished in {} with {} results after {} steps",
          terminal,
          results.size(),
          trace.size());
      meterRegistry.counter("rag.orchestrator.outcomes", "state", terminal.name()).increment();
      meterRegistry.summary("rag.orchestrator.steps").record(trace.size());
      return new OrchestrationResult(results, trace, plan, terminal);
    }

    private void checkCancelled() throws InterruptedException {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Retrieval cancelled");
      }
    }
  }
}
