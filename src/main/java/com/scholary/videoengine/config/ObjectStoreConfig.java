package com.scholary.videoengine.config;

import com.scholary.videoengine.objectstore.ArtifactMirror;
import com.scholary.videoengine.objectstore.ObjectStoreClient;
import com.scholary.videoengine.objectstore.ObjectStoreProperties;
import com.scholary.videoengine.objectstore.S3ObjectStoreClient;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>The S3 client connects lazily, so the beans exist even when no provider mirrors artifacts.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public ArtifactMirror artifactMirror(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    return new ArtifactMirror(objectStoreClient, properties, httpClient);
  }
}
