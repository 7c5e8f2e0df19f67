package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.api.dto.request.RetrievalRequest;
import com.flamingo.ai.hybridrag.api.dto.response.RetrievalResponse;
import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.service.agent.RetrievalOrchestrator;
import com.flamingo.ai.hybridrag.service.agent.model.OrchestrationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for orchestrated hybrid retrieval. */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
@Slf4j
public class RetrievalController {

  private final RetrievalOrchestrator retrievalOrchestrator;
  private final RagConfig ragConfig;

  /**
   * Plans, retrieves and self-corrects for one query.
   *
   * <p>Runs on the servlet thread. Only interrupting that thread cancels the in-flight stages; a
   * client that disconnects does not, and the run finishes within its stage timeouts.
   */
  @PostMapping
  public ResponseEntity<RetrievalResponse> retrieve(@Valid @RequestBody RetrievalRequest request) {
    int topK =
        request.getTopK() != null ? request.getTopK() : ragConfig.getRetrieval().getTopK();
    log.debug("Retrieval request: topK={}", topK);
    OrchestrationResult result = retrievalOrchestrator.execute(request.getQuery(), topK);
    return ResponseEntity.ok(RetrievalResponse.fromResult(result));
  }
}
