package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.agent.QueryExpansionAgent;
import com.flamingo.ai.hybridrag.agent.dto.QueryExpansionResult;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.exception.StageFailureException;
import com.flamingo.ai.hybridrag.service.agent.model.QueryExpansion;
import com.flamingo.ai.hybridrag.service.rag.StageExecutor;
import com.flamingo.ai.hybridrag.service.rag.model.Query;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class QueryExpanderImpl implements QueryExpander {

  private final QueryExpansionAgent agent;
  private final StageExecutor stageExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.expansion", description = "Time to expand a query")
  public QueryExpansion expand(Query query) throws InterruptedException {
    QueryExpansionResult result;
    try {
      result =
          stageExecutor.call(
              "expansion",
              ragConfig.getTimeouts().getExpansion(),
              () -> agent.expand(query.text()));
    } catch (StageFailureException e) {
      log.warn("Query expansion failed for '{}': {}", query.preview(), e.getMessage());
      meterRegistry.counter("rag.expansion.errors").increment();
      return QueryExpansion.ofOriginal(query.text(), "Expansion failed: " + e.getMessage());
    }

    List<String> alternatives =
        result != null ? cleanAlternatives(query.text(), result.expandedQueries()) : List.of();
    if (alternatives.isEmpty()) {
      log.warn("Query expansion returned no usable alternatives, using original query");
      meterRegistry.counter("rag.expansion.empty").increment();
      return QueryExpansion.ofOriginal(query.text(), "No usable alternatives returned");
    }

    log.info("Expanded '{}' into {} alternatives", query.preview(), alternatives.size());
    log.debug("Alternatives: {}", alternatives);
    meterRegistry.counter("rag.expansion.success").increment();
    String reasoning = result.reasoning() != null ? result.reasoning() : "";
    return new QueryExpansion(query.text(), alternatives, reasoning);
  }

  /**
   * Trims, drops blanks and duplicates, truncates to the maximum query length and caps the count.
   * The original text is kept only when nothing else remains.
   */
  private List<String> cleanAlternatives(String original, List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    int maxLength = ragConfig.getOrchestration().getMaxQueryLength();
    Set<String> unique = new LinkedHashSet<>();
    for (String candidate : raw) {
      if (candidate == null || candidate.isBlank()) {
        continue;
      }
      String trimmed = candidate.trim();
      if (trimmed.length() > maxLength) {
        trimmed = trimmed.substring(0, maxLength);
      }
      unique.add(trimmed);
    }

    List<String> alternatives = new ArrayList<>(unique);
    if (alternatives.size() > 1) {
      alternatives.removeIf(a -> a.equalsIgnoreCase(original));
    }
    int max = ragConfig.getExpansion().getMaxAlternatives();
    return alternatives.size() > max ? alternatives.subList(0, max) : alternatives;
  }
}
