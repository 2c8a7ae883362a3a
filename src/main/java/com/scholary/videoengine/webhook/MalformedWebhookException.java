package com.scholary.videoengine.webhook;

import com.scholary.videoengine.pipeline.Provider;

/** A callback body we cannot turn into a {@link WebhookEvent}. */
public class MalformedWebhookException extends RuntimeException {

  private final Provider provider;

  public MalformedWebhookException(Provider provider, String message) {
    super(message);
    this.provider = provider;
  }

  public MalformedWebhookException(Provider provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
  }

  public Provider getProvider() {
    return provider;
  }
}
