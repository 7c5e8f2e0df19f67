package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.service.agent.RetrievalPolicy;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for the retrieval pipeline. Every meter carries the application and the active retrieval
 * policy so runs under different policies can be compared side by side.
 */
@Configuration
public class MetricsConfig {

  private static final String RAG_METER_PREFIX = "rag.";

  @Value("${spring.application.name:hybrid-rag}")
  private String applicationName;

  /** Backs {@code @Timed} on the retriever, orchestrator and index adapter. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(RetrievalPolicy retrievalPolicy) {
    return registry ->
        registry
            .config()
            .commonTags("application", applicationName, "retrieval_policy", retrievalPolicy.name());
  }

  /** Publishes p50/p95/p99 for the {@code rag.*} timers. */
  @Bean
  public MeterFilter ragTimerPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith(RAG_METER_PREFIX)) {
          return config;
        }
        return DistributionStatisticConfig.builder()
            .percentiles(0.5, 0.95, 0.99)
            .build()
            .merge(config);
      }
    };
  }
}
