package com.flamingo.ai.hybridrag.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for an orchestrated retrieval. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  /** Optional result count. If null, uses rag.retrieval.top-k. */
  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 20, message = "topK must not exceed 20")
  private Integer topK;
}
