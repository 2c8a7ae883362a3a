package com.scholary.videoengine.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoengine.pipeline.Provider;

/**
 * Turns one provider's callback JSON into a {@link WebhookEvent}.
 *
 * <p>Providers vary their payload shape by operation and API version, so implementations look in
 * several places for the status, artifact URL and error text.
 */
public interface WebhookPayloadNormalizer {

  Provider provider();

  /**
   * @param correlationToken token taken from the callback URL
   * @param payload parsed callback body
   * @throws MalformedWebhookException if no outcome or no artifact can be found
   */
  WebhookEvent normalize(String correlationToken, JsonNode payload);

  /** First non-blank text among the given JSON pointers, or null. */
  static String firstText(JsonNode node, String... pointers) {
    for (String pointer : pointers) {
      JsonNode value = node.at(pointer);
      if (value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }
}
