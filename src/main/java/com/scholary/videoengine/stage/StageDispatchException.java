package com.scholary.videoengine.stage;

import com.scholary.videoengine.pipeline.Provider;

/**
 * Exception thrown when a provider does not accept a stage request.
 *
 * <p>Network errors, timeouts, throttling and 5xx responses are retryable; other 4xx responses mean
 * the request itself is wrong and retrying it will not help.
 */
public class StageDispatchException extends RuntimeException {

  private final Provider provider;
  private final boolean retryable;

  public StageDispatchException(Provider provider, String message, boolean retryable) {
    super(message);
    this.provider = provider;
    this.retryable = retryable;
  }

  public StageDispatchException(Provider provider, String message, Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.retryable = true;
  }

  public Provider getProvider() {
    return provider;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
