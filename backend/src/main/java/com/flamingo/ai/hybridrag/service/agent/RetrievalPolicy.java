package com.flamingo.ai.hybridrag.service.agent;

import com.flamingo.ai.hybridrag.config.RagConfig;
import java.util.Locale;

/**
 * Retry budget and quality gate of the retrieval loop.
 *
 * <p>Two named presets exist: {@code reflective} evaluates every non-empty attempt and may retry
 * with a different phrasing, {@code single-expansion} accepts the first non-empty attempt and only
 * retries once after expanding an empty one. {@code custom} takes every value from configuration.
 *
 * @param name policy name, for logs
 * @param maxAttempts retrieval attempts per query, at least 1
 * @param qualityGateEnabled whether non-empty results are evaluated before being accepted
 * @param qualityThreshold evaluator score at or above which results are accepted
 */
public record RetrievalPolicy(
    String name, int maxAttempts, boolean qualityGateEnabled, double qualityThreshold) {

  public static final String REFLECTIVE = "reflective";
  public static final String SINGLE_EXPANSION = "single-expansion";
  public static final String CUSTOM = "custom";

  public RetrievalPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
    }
    if (qualityThreshold < 0.0 || qualityThreshold > 1.0) {
      throw new IllegalArgumentException(
          "qualityThreshold must be within [0,1], was " + qualityThreshold);
    }
  }

  public static RetrievalPolicy reflective() {
    return new RetrievalPolicy(REFLECTIVE, 2, true, 0.5);
  }

  public static RetrievalPolicy singleExpansion() {
    return new RetrievalPolicy(SINGLE_EXPANSION, 2, false, 0.5);
  }

  /**
   * Resolves the policy named by {@code rag.orchestration.policy}.
   *
   * @throws IllegalArgumentException for an unknown policy name
   */
  public static RetrievalPolicy from(RagConfig.Orchestration config) {
    String policy = config.getPolicy() == null ? REFLECTIVE : config.getPolicy().trim();
    return switch (policy.toLowerCase(Locale.ROOT)) {
      case REFLECTIVE -> reflective();
      case SINGLE_EXPANSION -> singleExpansion();
      case CUSTOM ->
          new RetrievalPolicy(
              CUSTOM,
              config.getMaxAttempts(),
              config.isQualityGateEnabled(),
              config.getQualityThreshold());
      default ->
          throw new IllegalArgumentException(
              "Unknown retrieval policy '"
                  + policy
                  + "', expected one of: reflective, single-expansion, custom");
    };
  }
}
