package com.scholary.videoengine.webhook;

import static com.scholary.videoengine.webhook.WebhookPayloadNormalizer.firstText;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoengine.pipeline.Provider;
import org.springframework.stereotype.Component;

/**
 * NCA Toolkit callbacks.
 *
 * <p>The outcome is taken from {@code code} (200 or 400+), then {@code status}, then the wording of
 * {@code message}. The output URL lives in {@code response}, which may be a plain string, an array
 * of {@code {file_url}} objects, or an object holding {@code outputs[0].url} or a direct URL field.
 */
@Component
public class NcaPayloadNormalizer implements WebhookPayloadNormalizer {

  @Override
  public Provider provider() {
    return Provider.NCA_TOOLKIT;
  }

  @Override
  public WebhookEvent normalize(String correlationToken, JsonNode payload) {
    Boolean succeeded = outcome(payload);
    if (succeeded == null) {
      throw new MalformedWebhookException(provider(), "Cannot tell whether the job completed");
    }

    if (succeeded) {
      String url = outputUrl(payload);
      if (url == null) {
        throw new MalformedWebhookException(provider(), "Completed callback without output url");
      }
      return WebhookEvent.succeeded(provider(), correlationToken, url);
    }
    String error = errorMessage(payload);
    return WebhookEvent.failed(provider(), correlationToken, error == null ? "Unknown error" : error);
  }

  private static Boolean outcome(JsonNode payload) {
    JsonNode code = payload.path("code");
    if (code.isNumber()) {
      if (code.asInt() == 200) {
        return true;
      }
      if (code.asInt() >= 400) {
        return false;
      }
    }

    String status = firstText(payload, "/status");
    if (status != null) {
      String lower = status.toLowerCase();
      if (lower.equals("completed") || lower.equals("success")) {
        return true;
      }
      if (lower.equals("failed") || lower.equals("error")) {
        return false;
      }
    }

    String message = firstText(payload, "/message");
    if (message != null) {
      String lower = message.toLowerCase();
      if (lower.contains("success") || lower.contains("complete")) {
        return true;
      }
      if (lower.contains("error") || lower.contains("fail")) {
        return false;
      }
    }
    return null;
  }

  private static String outputUrl(JsonNode payload) {
    JsonNode response = payload.path("response");
    if (response.isTextual() && !response.asText().isBlank()) {
      return response.asText();
    }
    if (response.isArray()) {
      String url = firstText(response, "/0/file_url", "/0/url");
      if (url != null) {
        return url;
      }
    }
    if (response.isObject()) {
      String url =
          firstText(
              response, "/outputs/0/url", "/url", "/output_url", "/file_url", "/text_url");
      if (url != null) {
        return url;
      }
    }
    return firstText(payload, "/output_url", "/file_url", "/url");
  }

  private static String errorMessage(JsonNode payload) {
    JsonNode response = payload.path("response");
    if (response.isObject()) {
      String error = firstText(response, "/error", "/message");
      if (error != null) {
        return error;
      }
    }
    if (response.isTextual()) {
      return response.asText();
    }
    return firstText(payload, "/error", "/error_details", "/message");
  }
}
