package com.flamingo.ai.hybridrag.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A passage stored in Elasticsearch with both text and vector embedding. Written by the external
 * ingestion pipeline; this service only reads it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PassageDocument {

  private String id; // Elasticsearch _id, same key for kNN and BM25 hits
  private String documentId;
  private String sourcePath;
  private Integer pageNumber;
  private String sectionTitle;
  private String content;
  private List<Float> embedding;

  // Score of the hit that produced this document
  @Builder.Default private Double relevanceScore = 0.0;
}
