package com.scholary.videoengine.webhook;

import static com.scholary.videoengine.webhook.WebhookPayloadNormalizer.firstText;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoengine.pipeline.Provider;
import org.springframework.stereotype.Component;

/** ElevenLabs: {@code status}, {@code output.url}, {@code error.message}. */
@Component
public class ElevenLabsPayloadNormalizer implements WebhookPayloadNormalizer {

  @Override
  public Provider provider() {
    return Provider.ELEVENLABS;
  }

  @Override
  public WebhookEvent normalize(String correlationToken, JsonNode payload) {
    String status = firstText(payload, "/status");
    if ("completed".equalsIgnoreCase(status)) {
      String url = firstText(payload, "/output/url", "/audio_url", "/url");
      if (url == null) {
        throw new MalformedWebhookException(provider(), "Completed callback without audio url");
      }
      return WebhookEvent.succeeded(provider(), correlationToken, url);
    }
    if ("failed".equalsIgnoreCase(status) || "error".equalsIgnoreCase(status)) {
      String error = firstText(payload, "/error/message", "/error", "/message");
      return WebhookEvent.failed(
          provider(), correlationToken, error == null ? "Unknown error" : error);
    }
    throw new MalformedWebhookException(provider(), "Unknown status: " + status);
  }
}
