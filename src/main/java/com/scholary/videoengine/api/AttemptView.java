package com.scholary.videoengine.api;

import com.scholary.videoengine.ledger.StageAttempt;
import java.time.Instant;

/** The attempt currently in flight for an entity. */
public record AttemptView(
    String stage,
    String provider,
    int attemptNumber,
    String correlationToken,
    String externalJobId,
    Instant dispatchedAt,
    Instant deadline,
    String lastError) {

  public static AttemptView of(StageAttempt attempt) {
    if (attempt == null) {
      return null;
    }
    return new AttemptView(
        attempt.stage().key(),
        attempt.provider().pathName(),
        attempt.attemptNumber(),
        attempt.correlationToken(),
        attempt.externalJobId(),
        attempt.dispatchedAt(),
        attempt.deadline(),
        attempt.lastError());
  }
}
