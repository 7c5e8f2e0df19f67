package com.flamingo.ai.hybridrag.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private Reranking reranking = new Reranking();
  private Expansion expansion = new Expansion();
  private Quality quality = new Quality();
  private Orchestration orchestration = new Orchestration();
  private Timeouts timeouts = new Timeouts();

  @Getter
  @Setter
  public static class Retrieval {
    /** Default number of final results when the caller does not ask for a count. */
    private int topK = 5;

    /** Candidates fetched from each of dense and sparse search before fusion. */
    private int candidateTopK = 20;

    private int rrfK = 60;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Instruction prefix prepended to query text before embedding. Empty for OpenAI models. */
    private String queryPrefix = "";

    private int maxChars = 5000;

    private Cache cache = new Cache();

    /** Query embeddings are reused across attempts and requests for the same text. */
    @Getter
    @Setter
    public static class Cache {
      private boolean enabled = true;
      private long maxSize = 10_000;
      private Duration ttl = Duration.ofHours(1);
    }
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;

    /** Only this many fused candidates are sent to the LLM judge. */
    private int candidateCap = 10;

    private int previewChars = 500;
  }

  @Getter
  @Setter
  public static class Expansion {
    private int maxAlternatives = 5;
  }

  @Getter
  @Setter
  public static class Quality {
    private int previewChars = 300;
    private int maxPassages = 10;
  }

  @Getter
  @Setter
  public static class Orchestration {
    /** Named retry policy: "reflective", "single-expansion" or "custom". */
    private String policy = "reflective";

    /** Used by the "custom" policy only. */
    private int maxAttempts = 2;

    /** Used by the "custom" policy only. */
    private boolean qualityGateEnabled = true;

    private double qualityThreshold = 0.5;

    private int maxQueryLength = 1000;

    private int maxTopK = 20;
  }

  /** Per-call timeouts for external stages. A timeout is handled like any other stage failure. */
  @Getter
  @Setter
  public static class Timeouts {
    private Duration planning = Duration.ofSeconds(10);
    private Duration embedding = Duration.ofSeconds(10);
    private Duration denseSearch = Duration.ofSeconds(5);
    private Duration sparseSearch = Duration.ofSeconds(5);
    private Duration rerank = Duration.ofSeconds(20);
    private Duration expansion = Duration.ofSeconds(15);
    private Duration evaluation = Duration.ofSeconds(15);
  }
}
