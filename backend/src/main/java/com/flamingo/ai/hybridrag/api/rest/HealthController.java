package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.service.agent.RetrievalPolicy;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness probe that also reports how retrieval is configured. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RetrievalPolicy retrievalPolicy;
  private final RagConfig ragConfig;

  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> retrieval = new LinkedHashMap<>();
    retrieval.put("policy", retrievalPolicy.name());
    retrieval.put("maxAttempts", retrievalPolicy.maxAttempts());
    retrieval.put("qualityGate", retrievalPolicy.qualityGateEnabled());
    retrieval.put("reranking", ragConfig.getReranking().isEnabled());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("service", "hybrid-rag");
    body.put("timestamp", Instant.now());
    body.put("retrieval", retrieval);
    return ResponseEntity.ok(body);
  }
}
