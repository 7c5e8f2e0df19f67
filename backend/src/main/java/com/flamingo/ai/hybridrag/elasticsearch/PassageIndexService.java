package com.flamingo.ai.hybridrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.hybridrag.domain.enums.RankOrigin;
import com.flamingo.ai.hybridrag.exception.SearchException;
import com.flamingo.ai.hybridrag.service.rag.model.RankedResult;
import com.flamingo.ai.hybridrag.service.rag.model.SourceMetadata;
import com.flamingo.ai.hybridrag.service.rag.search.DenseSearch;
import com.flamingo.ai.hybridrag.service.rag.search.SparseSearch;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed passage search. Serves both retrieval paths from one index: kNN over the
 * {@code embedding} field for dense search and BM25 {@code multi_match} over {@code content} for
 * sparse search. Hits keep the Elasticsearch {@code _id} as their identity so fusion can match the
 * same passage across both paths.
 */
@Service
@Slf4j
public class PassageIndexService implements DenseSearch, SparseSearch {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.index-name:hybrid-rag-passages}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public PassageIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  PassageIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    this(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  /** Creates the passage index on startup when it does not exist yet. */
  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        indices.create(
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(defineProperties()))));
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        log.debug("Elasticsearch index '{}' already exists", indexName);
      }
    } catch (Exception e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> defineProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourcePath", Property.of(p -> p.keyword(k -> k)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "sectionTitle",
        Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "content", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "elasticsearch.dense_search", description = "Time for kNN passage search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "denseSearchFallback")
  public List<RankedResult> search(List<Float> embedding, int topK) {
    if (embedding == null || embedding.isEmpty()) {
      return List.of();
    }
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(embedding)
                                .k(topK)
                                .numCandidates(Math.max(topK * 2, 50)))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(topK));
    List<RankedResult> results = execute(request, RankOrigin.DENSE);
    meterRegistry.counter("passage_index.dense_search").increment();
    return results;
  }

  @Override
  @Timed(value = "elasticsearch.sparse_search", description = "Time for BM25 passage search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "sparseSearchFallback")
  public List<RankedResult> search(String text, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.multiMatch(
                                mm ->
                                    mm.fields("content^1.0", "sectionTitle^0.5")
                                        .query(text)
                                        .type(TextQueryType.BestFields)
                                        .tieBreaker(0.3)))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(topK));
    List<RankedResult> results = execute(request, RankOrigin.SPARSE);
    meterRegistry.counter("passage_index.sparse_search").increment();
    return results;
  }

  @SuppressWarnings("unused")
  private List<RankedResult> denseSearchFallback(List<Float> embedding, int topK, Throwable t) {
    log.warn("{} dense search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter("passage_index.dense_search.fallback").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<RankedResult> sparseSearchFallback(String text, int topK, Throwable t) {
    log.warn("{} sparse search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter("passage_index.sparse_search.fallback").increment();
    return List.of();
  }

  private List<RankedResult> execute(SearchRequest request, RankOrigin origin) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<RankedResult> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Map<String, Object> source = hit.source();
        if (source == null) {
          continue;
        }
        PassageDocument document = convertFromSource(hit.id(), source, hit.score());
        results.add(toRankedResult(document, origin));
      }
      log.debug(
          "[{}] index={} returned {} hits (top score: {})",
          origin,
          indexName,
          results.size(),
          results.isEmpty() ? "N/A" : String.format("%.4f", results.get(0).score()));
      return results;
    } catch (IOException e) {
      throw new SearchException(indexName, origin + " search", e);
    }
  }

  @VisibleForTesting
  static PassageDocument convertFromSource(String id, Map<String, Object> source, Double score) {
    Object page = source.get("pageNumber");
    return PassageDocument.builder()
        .id(id)
        .documentId(asString(source.get("documentId")))
        .sourcePath(asString(source.get("sourcePath")))
        .pageNumber(page instanceof Number n ? n.intValue() : null)
        .sectionTitle(asString(source.get("sectionTitle")))
        .content(asString(source.get("content")))
        .relevanceScore(score != null ? score : 0.0)
        .build();
  }

  @VisibleForTesting
  static RankedResult toRankedResult(PassageDocument document, RankOrigin origin) {
    String content = document.getContent() != null ? document.getContent() : "";
    return new RankedResult(
        document.getId(),
        content,
        new SourceMetadata(
            document.getDocumentId(),
            document.getSourcePath(),
            document.getPageNumber(),
            document.getSectionTitle()),
        document.getRelevanceScore(),
        origin);
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  public String getIndexName() {
    return indexName;
  }
}
