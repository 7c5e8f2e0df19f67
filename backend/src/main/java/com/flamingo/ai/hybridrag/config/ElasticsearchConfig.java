package com.flamingo.ai.hybridrag.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import java.net.URISyntaxException;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Elasticsearch client backing dense and sparse passage search. */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  /** Comma-separated node URIs, e.g. {@code http://es-1:9200,http://es-2:9200}. */
  @Value("${elasticsearch.uris:http://localhost:9200}")
  private String[] uris;

  /** Optional API key for secured clusters. */
  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    HttpHost[] hosts =
        Arrays.stream(uris).map(ElasticsearchConfig::toHost).toArray(HttpHost[]::new);
    log.info("Elasticsearch nodes: {}", Arrays.toString(hosts));

    var builder = Rest5Client.builder(hosts);
    if (!apiKey.isBlank()) {
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader("Authorization", "ApiKey " + apiKey)});
    }
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }

  private static HttpHost toHost(String uri) {
    try {
      return HttpHost.create(uri.trim());
    } catch (URISyntaxException e) {
      throw new IllegalStateException("Invalid Elasticsearch URI '" + uri + "'", e);
    }
  }
}
