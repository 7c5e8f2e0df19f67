package com.flamingo.ai.hybridrag.service.rag.model;

import com.flamingo.ai.hybridrag.exception.InvalidQueryException;

/**
 * Immutable user query with the number of results requested.
 *
 * @param text the query text, trimmed
 * @param topK number of final results requested
 */
public record Query(String text, int topK) {

  /**
   * Validates and creates a query.
   *
   * @param text raw query text
   * @param topK requested result count
   * @param maxLength maximum accepted text length
   * @param maxTopK maximum accepted result count
   * @return the validated query
   * @throws InvalidQueryException if the text is blank or too long, or topK is out of range
   */
  public static Query of(String text, int topK, int maxLength, int maxTopK) {
    if (text == null || text.isBlank()) {
      throw new InvalidQueryException("Query text must not be empty");
    }
    String trimmed = text.trim();
    if (trimmed.length() > maxLength) {
      throw new InvalidQueryException(
          "Query text must not exceed " + maxLength + " characters (was " + trimmed.length() + ")");
    }
    if (topK < 1 || topK > maxTopK) {
      throw new InvalidQueryException(
          "topK must be between 1 and " + maxTopK + " (was " + topK + ")");
    }
    return new Query(trimmed, topK);
  }

  /** Short preview for log lines. */
  public String preview() {
    return text.length() > 50 ? text.substring(0, 50) + "..." : text;
  }
}
