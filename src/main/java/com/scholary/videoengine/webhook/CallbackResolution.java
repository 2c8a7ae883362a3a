package com.scholary.videoengine.webhook;

/** How the correlator handled a callback. All three are acknowledged to the provider. */
public enum CallbackResolution {
  APPLIED,
  DUPLICATE,
  STALE
}
