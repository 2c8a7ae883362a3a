package com.scholary.videoengine.objectstore;

import com.scholary.videoengine.pipeline.StageKind;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a provider-hosted artifact into our bucket.
 *
 * <p>Provider URLs expire; the mirrored copy is referenced either through {@code publicBaseUrl} or
 * a presigned URL. The download is spooled to a temp file so the upload has a known length.
 */
public class ArtifactMirror {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactMirror.class);

  private final ObjectStoreClient objectStore;
  private final ObjectStoreProperties properties;
  private final HttpClient httpClient;

  public ArtifactMirror(
      ObjectStoreClient objectStore, ObjectStoreProperties properties, HttpClient httpClient) {
    this.objectStore = objectStore;
    this.properties = properties;
    this.httpClient = httpClient;
  }

  /**
   * Download {@code sourceUrl} and store it under {@code keyPrefix/entityId/stage-token.ext}.
   *
   * @return URL of the mirrored copy
   * @throws ObjectStoreException if the download or the upload fails
   */
  public String mirror(String entityId, StageKind stage, String token, String sourceUrl) {
    String key = objectKey(entityId, stage, token, sourceUrl);
    Path spool = null;
    try {
      spool = Files.createTempFile("artifact-", ".tmp");
      HttpResponse<Path> response =
          httpClient.send(
              HttpRequest.newBuilder(URI.create(sourceUrl))
                  .timeout(Duration.ofMinutes(5))
                  .GET()
                  .build(),
              HttpResponse.BodyHandlers.ofFile(spool));
      if (response.statusCode() / 100 != 2) {
        throw new ObjectStoreException(
            String.format("Download of %s returned status %d", sourceUrl, response.statusCode()));
      }

      String contentType =
          response.headers().firstValue("Content-Type").orElse(contentTypeFor(key));
      try (InputStream data = Files.newInputStream(spool)) {
        objectStore.putObject(properties.bucket(), key, data, Files.size(spool), contentType);
      }
      LOGGER.info("Mirrored {} artifact of {} to {}", stage.key(), entityId, key);
      return referenceFor(key);

    } catch (IOException e) {
      throw new ObjectStoreException("Failed to mirror " + sourceUrl, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ObjectStoreException("Interrupted while mirroring " + sourceUrl, e);
    } finally {
      if (spool != null) {
        try {
          Files.deleteIfExists(spool);
        } catch (IOException e) {
          LOGGER.warn("Could not delete spool file {}", spool, e);
        }
      }
    }
  }

  /**
   * Delete the copy {@link #mirror} stored for this attempt, when the attempt lost the race to
   * record it.
   *
   * @throws ObjectStoreException if the delete fails
   */
  public void discard(String entityId, StageKind stage, String token, String sourceUrl) {
    String key = objectKey(entityId, stage, token, sourceUrl);
    objectStore.deleteObject(properties.bucket(), key);
    LOGGER.info("Discarded unrecorded {} artifact of {} at {}", stage.key(), entityId, key);
  }

  String objectKey(String entityId, StageKind stage, String token, String sourceUrl) {
    return String.format(
        "%s/%s/%s-%s%s",
        properties.keyPrefix(), entityId, stage.key(), token, extensionOf(sourceUrl));
  }

  private String referenceFor(String key) {
    String publicBase = properties.publicBaseUrl();
    if (publicBase != null && !publicBase.isBlank()) {
      return (publicBase.endsWith("/") ? publicBase : publicBase + "/") + key;
    }
    return objectStore.presignGet(properties.bucket(), key, properties.presignTtl()).toString();
  }

  private static String extensionOf(String url) {
    String path = URI.create(url).getPath();
    if (path == null) {
      return "";
    }
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    return dot > slash && path.length() - dot <= 5 ? path.substring(dot) : "";
  }

  private static String contentTypeFor(String key) {
    if (key.endsWith(".mp3")) {
      return "audio/mpeg";
    }
    if (key.endsWith(".mp4")) {
      return "video/mp4";
    }
    return "application/octet-stream";
  }
}
