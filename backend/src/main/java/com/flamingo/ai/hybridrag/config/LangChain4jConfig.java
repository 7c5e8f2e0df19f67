package com.flamingo.ai.hybridrag.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * LangChain4j models. One JSON-mode chat model serves every structured judge (planner, expander,
 * evaluator, reranker); the embedding model must produce vectors of the index's dimension.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  /** Optional OpenAI-compatible endpoint; blank means the public API. */
  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.log-requests:false}")
  private boolean logRequests;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String judgeModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.0}")
  private double judgeTemperature;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:1000}")
  private int judgeMaxTokens;

  @Value("${langchain4j.openai.chat-model.timeout:PT30S}")
  private Duration judgeTimeout;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.timeout:PT30S}")
  private Duration embeddingTimeout;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Bean
  public ChatModel chatModel() {
    log.info("Judge model: {} (temperature {})", judgeModelName, judgeTemperature);
    var builder =
        OpenAiChatModel.builder()
            .apiKey(requireApiKey())
            .modelName(judgeModelName)
            .temperature(judgeTemperature)
            .maxCompletionTokens(judgeMaxTokens)
            .timeout(judgeTimeout)
            .responseFormat("json_object")
            // Stage timeouts and fallbacks handle failures; one retry is enough here
            .maxRetries(1)
            .logRequests(logRequests)
            .logResponses(logRequests);
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    log.info("Embedding model: {} ({} dimensions)", embeddingModelName, vectorDimensions);
    var builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(requireApiKey())
            .modelName(embeddingModelName)
            .dimensions(vectorDimensions)
            .timeout(embeddingTimeout);
    if (!baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  private String requireApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the retrieval judges and query embeddings. "
              + "Set the OPENAI_API_KEY environment variable.");
    }
    return apiKey;
  }
}
