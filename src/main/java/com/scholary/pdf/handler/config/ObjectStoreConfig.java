package com.scholary.pdf.handler.config;

import com.scholary.pdf.handler.objectstore.ObjectStoreClient;
import com.scholary.pdf.handler.objectstore.ObjectStoreProperties;
import com.scholary.pdf.handler.objectstore.S3ObjectStoreClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code objectstore.enabled=true}. Without it the object and folder endpoints
 * answer that no object store is configured.
 */
@Configuration
@ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
