package com.flamingo.ai.hybridrag.api.dto.response;

import com.flamingo.ai.hybridrag.domain.enums.OrchestrationState;
import com.flamingo.ai.hybridrag.service.agent.model.OrchestrationResult;
import com.flamingo.ai.hybridrag.service.agent.model.Plan;
import com.flamingo.ai.hybridrag.service.agent.model.TraceStep;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an orchestrated retrieval. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResponse {

  private OrchestrationState state;
  private Plan plan;
  private List<RankedResult> results;
  private List<TraceStep> trace;

  public static RetrievalResponse fromResult(OrchestrationResult result) {
    return RetrievalResponse.builder()
        .state(result.finalState())
        .plan(result.plan())
        .results(result.results())
        .trace(result.trace().steps())
        .build();
  }
}
