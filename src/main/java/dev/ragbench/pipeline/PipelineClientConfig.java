package dev.ragbench.pipeline;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Configures the single retry primitive used for every pipeline call.
 *
 * <p>The schedule is externalized via {@code ragbench.pipeline.retry.*}: total attempts,
 * exponential backoff and its cap. Only {@link TransientPipelineException} is retried.
 */
@Configuration
public class PipelineClientConfig {

  @Bean
  public RetryTemplate pipelineRetryTemplate(PipelineProperties properties) {
    PipelineProperties.Retry retry = properties.retry();
    return RetryTemplate.builder()
        .maxAttempts(retry.maxAttempts())
        .exponentialBackoff(retry.initialDelayMs(), retry.multiplier(), retry.maxDelayMs())
        .retryOn(TransientPipelineException.class)
        .build();
  }
}
