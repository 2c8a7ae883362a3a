package com.scholary.videoengine.api;

import com.scholary.videoengine.webhook.CallbackResolution;

/** Body returned to a provider for every well-formed callback. */
public record WebhookAck(String status, CallbackResolution resolution) {

  public static WebhookAck of(CallbackResolution resolution) {
    return new WebhookAck("ok", resolution);
  }
}
