package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.EntityScope;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.PipelineState;
import java.time.Instant;

/** Common view of a ledger row, either a {@link Video} or a {@link Segment}. */
public interface PipelineEntity {

  String id();

  EntityScope scope();

  PipelineState state();

  EntityStatus status();

  /** The attempt currently in flight, or null. */
  StageAttempt liveAttempt();

  FailureReason failureReason();

  String failureDetail();

  Instant createdAt();

  Instant updatedAt();

  /** Return a copy with the transition applied. The caller has already checked it is legal. */
  PipelineEntity apply(Transition transition, Instant now);

  /** Return a copy with the live attempt replaced. */
  PipelineEntity withLiveAttempt(StageAttempt attempt, Instant now);

  default String liveToken() {
    StageAttempt attempt = liveAttempt();
    return attempt == null ? null : attempt.correlationToken();
  }
}
