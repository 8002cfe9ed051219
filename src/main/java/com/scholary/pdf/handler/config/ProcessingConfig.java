package com.scholary.pdf.handler.config;

import com.scholary.pdf.handler.worker.WorkerPool;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the processing worker pool.
 *
 * <p>The pool is sized from {@link ProcessingProperties#workers()}. With the default of one worker,
 * jobs never run concurrently.
 */
@Configuration
@EnableConfigurationProperties(ProcessingProperties.class)
public class ProcessingConfig {

  @Bean(destroyMethod = "close")
  public WorkerPool workerPool(ProcessingProperties properties) {
    return new WorkerPool(
        properties.workers(),
        properties.requestTimeout(),
        properties.admissionTimeout(),
        properties.terminationGrace());
  }

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
