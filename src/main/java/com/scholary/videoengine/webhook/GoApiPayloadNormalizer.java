package com.scholary.videoengine.webhook;

import static com.scholary.videoengine.webhook.WebhookPayloadNormalizer.firstText;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoengine.pipeline.Provider;
import org.springframework.stereotype.Component;

/**
 * GoAPI sends two shapes: the current one wraps everything in {@code data}, the older one has
 * {@code status}, {@code output} and {@code error} at the root.
 */
@Component
public class GoApiPayloadNormalizer implements WebhookPayloadNormalizer {

  @Override
  public Provider provider() {
    return Provider.GOAPI;
  }

  @Override
  public WebhookEvent normalize(String correlationToken, JsonNode payload) {
    String status = firstText(payload, "/data/status", "/status");
    if (status == null) {
      throw new MalformedWebhookException(provider(), "Callback without status");
    }

    switch (status.toLowerCase()) {
      case "completed":
        String url =
            firstText(
                payload,
                "/data/output/audio_url",
                "/data/output/url",
                "/output/audio_url",
                "/output/url");
        if (url == null) {
          throw new MalformedWebhookException(provider(), "Completed callback without audio url");
        }
        return WebhookEvent.succeeded(provider(), correlationToken, url);

      case "failed":
      case "error":
        String error =
            firstText(
                payload,
                "/data/error/message",
                "/data/error/raw_message",
                "/error/message",
                "/error/raw_message",
                "/error");
        return WebhookEvent.failed(
            provider(), correlationToken, error == null ? "Unknown error" : error);

      default:
        throw new MalformedWebhookException(provider(), "Unknown status: " + status);
    }
  }
}
