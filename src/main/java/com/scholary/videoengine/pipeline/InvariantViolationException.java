package com.scholary.videoengine.pipeline;

/**
 * Thrown when pipeline data breaks a structural rule: non-contiguous segment indices, a transition
 * against an entity that does not exist, missing stage inputs.
 *
 * <p>Fatal to the operation that found it, but never to unrelated entities.
 */
public class InvariantViolationException extends RuntimeException {

  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
