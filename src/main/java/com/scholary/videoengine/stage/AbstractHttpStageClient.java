package com.scholary.videoengine.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoengine.pipeline.Provider;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for provider clients that submit a JSON body and get a JSON acknowledgement back.
 *
 * <p>Uses the JDK HttpClient with the configured timeouts. No retry loop: a failed submission
 * surfaces as a {@link StageDispatchException} straight away and the scheduler decides what
 * happens next.
 */
public abstract class AbstractHttpStageClient implements StageClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractHttpStageClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ProviderProperties.Connection connection;

  protected AbstractHttpStageClient(
      ProviderProperties.Connection connection, ObjectMapper objectMapper) {
    this(
        connection,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(connection.connectTimeout()))
            .build());
  }

  protected AbstractHttpStageClient(
      ProviderProperties.Connection connection, ObjectMapper objectMapper, HttpClient httpClient) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
  }

  /** Headers carrying the provider's credentials. */
  protected abstract Map<String, String> authHeaders(String apiKey);

  protected ObjectMapper objectMapper() {
    return objectMapper;
  }

  /**
   * POST a JSON body to {@code baseUrl + path} and return the parsed response.
   *
   * @throws StageDispatchException on transport failure or a non-2xx status
   */
  protected JsonNode postJson(String path, Object body) {
    Provider provider = provider();
    URI uri = URI.create(connection.baseUrl() + path);
    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(uri)
              .timeout(Duration.ofSeconds(connection.readTimeout()))
              .header("Content-Type", "application/json")
              .header("Accept", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
      authHeaders(connection.apiKey()).forEach(builder::header);

      LOGGER.debug("Sending {} request to {}", provider.pathName(), uri);
      HttpResponse<String> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

      int status = response.statusCode();
      if (status < 200 || status >= 300) {
        throw new StageDispatchException(
            provider,
            String.format("%s returned status %d: %s", provider.pathName(), status, response.body()),
            isRetryableStatus(status));
      }

      String responseBody = response.body();
      return responseBody == null || responseBody.isBlank()
          ? objectMapper.createObjectNode()
          : objectMapper.readTree(responseBody);

    } catch (IOException e) {
      throw new StageDispatchException(
          provider, String.format("%s request to %s failed", provider.pathName(), uri), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageDispatchException(
          provider, String.format("%s request to %s interrupted", provider.pathName(), uri), e);
    }
  }

  /** First non-blank text value among the given JSON pointers, or null. */
  protected static String firstText(JsonNode node, String... pointers) {
    for (String pointer : pointers) {
      JsonNode value = node.at(pointer);
      if (value.isValueNode() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  static boolean isRetryableStatus(int status) {
    return status >= 500 || status == 408 || status == 429;
  }
}
