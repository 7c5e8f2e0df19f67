package com.flamingo.ai.hybridrag.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** In-process caches. Cache names used by {@code @Cacheable} must be listed here. */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

  public static final String QUERY_EMBEDDINGS = "queryEmbeddings";

  @Bean
  public CacheManager cacheManager(RagConfig ragConfig) {
    RagConfig.Embedding.Cache settings = ragConfig.getEmbedding().getCache();
    log.info(
        "Query embedding cache: enabled={}, maxSize={}, ttl={}",
        settings.isEnabled(),
        settings.getMaxSize(),
        settings.getTtl());

    CaffeineCacheManager cacheManager = new CaffeineCacheManager(QUERY_EMBEDDINGS);
    cacheManager.setAllowNullValues(false);
    cacheManager.setCaffeine(
        Caffeine.newBuilder()
            // Hit ratio is exported through the actuator cache metrics
            .recordStats()
            .expireAfterWrite(settings.getTtl())
            .maximumSize(settings.getMaxSize()));
    return cacheManager;
  }
}
