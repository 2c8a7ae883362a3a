package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.time.Duration;
import java.time.Instant;

/**
 * One in-flight call to a provider for a single stage of a single entity.
 *
 * <p>A retry never mutates an attempt: it creates the next one with a new correlation token, and
 * callbacks carrying the old token become stale. The only in-place annotations are the provider's
 * job id and the error of a failed dispatch, both attached to the same token.
 *
 * @param stage the stage being run
 * @param provider the provider running this attempt; usually the stage's own provider, the
 *     finishing provider once a stage has handed off its intermediate artifact
 * @param correlationToken opaque token round-tripped through the provider's webhook
 * @param attemptNumber 1-based attempt counter for this stage
 * @param dispatchedAt when the attempt was claimed
 * @param deadline when the attempt is considered timed out
 * @param externalJobId provider-assigned job id, null until the provider accepted the request
 * @param lastError dispatch error message, null if the provider accepted the request
 */
public record StageAttempt(
    StageKind stage,
    Provider provider,
    String correlationToken,
    int attemptNumber,
    Instant dispatchedAt,
    Instant deadline,
    String externalJobId,
    String lastError) {

  public static StageAttempt first(
      StageKind stage, String correlationToken, Instant now, Duration timeout) {
    return first(stage, stage.provider(), correlationToken, now, timeout);
  }

  public static StageAttempt first(
      StageKind stage, Provider provider, String correlationToken, Instant now, Duration timeout) {
    return new StageAttempt(
        stage, provider, correlationToken, 1, now, now.plus(timeout), null, null);
  }

  /** The attempt that supersedes this one. */
  public StageAttempt next(String newToken, Instant now, Duration timeout) {
    return new StageAttempt(
        stage, provider, newToken, attemptNumber + 1, now, now.plus(timeout), null, null);
  }

  public StageAttempt withExternalJobId(String jobId) {
    return new StageAttempt(
        stage,
        provider,
        correlationToken,
        attemptNumber,
        dispatchedAt,
        deadline,
        jobId,
        lastError);
  }

  /** Record a failed dispatch and pull the deadline in so the sweep retries it at {@code retryAt}. */
  public StageAttempt withDispatchError(String error, Instant retryAt) {
    return new StageAttempt(
        stage,
        provider,
        correlationToken,
        attemptNumber,
        dispatchedAt,
        retryAt,
        externalJobId,
        error);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(deadline);
  }

  public boolean dispatchFailed() {
    return lastError != null;
  }
}
