package com.scholary.videoengine.webhook;

import com.scholary.videoengine.pipeline.Provider;
import java.util.Objects;

/**
 * A provider callback reduced to what the pipeline needs.
 *
 * @param provider who called back
 * @param correlationToken the token from the callback URL
 * @param outcome success or failure as the provider reports it
 * @param artifactRef URL of the produced artifact; present on success
 * @param errorMessage provider error text; may be null on failure
 */
public record WebhookEvent(
    Provider provider,
    String correlationToken,
    Outcome outcome,
    String artifactRef,
    String errorMessage) {

  public enum Outcome {
    SUCCEEDED,
    FAILED
  }

  public WebhookEvent {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(correlationToken, "correlationToken");
    Objects.requireNonNull(outcome, "outcome");
    if (outcome == Outcome.SUCCEEDED && (artifactRef == null || artifactRef.isBlank())) {
      throw new IllegalArgumentException("A successful callback must carry an artifact");
    }
  }

  public static WebhookEvent succeeded(Provider provider, String token, String artifactRef) {
    return new WebhookEvent(provider, token, Outcome.SUCCEEDED, artifactRef, null);
  }

  public static WebhookEvent failed(Provider provider, String token, String errorMessage) {
    return new WebhookEvent(provider, token, Outcome.FAILED, null, errorMessage);
  }

  /** Replays of the same callback share this key. */
  public String idempotencyKey() {
    return provider.pathName() + ":" + correlationToken + ":" + outcome.name().toLowerCase();
  }
}
