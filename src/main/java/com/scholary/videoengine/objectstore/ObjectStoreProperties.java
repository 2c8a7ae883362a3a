package com.scholary.videoengine.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage ("objectstore.*" in application.yml).
 *
 * @param keyPrefix prefix for mirrored artifact keys
 * @param publicBaseUrl when set, mirrored artifacts are referenced as {@code publicBaseUrl/key}
 *     instead of by presigned URL
 * @param presignTtl lifetime of presigned URLs
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @NotBlank String keyPrefix,
    String publicBaseUrl,
    @NotNull Duration presignTtl) {}
