package com.scholary.pdf.handler.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml and are only bound when
 * {@code objectstore.enabled=true}. {@code bucket} is used when a request doesn't name one.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {}
