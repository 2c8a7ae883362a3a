package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.EntityScope;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.PipelineState;
import java.time.Instant;

/**
 * Ledger row for one Segment of a Video.
 *
 * <p>{@code sequenceIndex} fixes the concatenation order; indices within a Video are contiguous
 * from 0. Artifact refs of completed stages are kept when a later stage fails.
 */
public record Segment(
    String id,
    String videoId,
    int sequenceIndex,
    String sourceText,
    String backgroundMediaRef,
    PipelineState state,
    EntityStatus status,
    StageAttempt liveAttempt,
    String voiceoverRef,
    String combinedMediaRef,
    FailureReason failureReason,
    String failureDetail,
    Instant createdAt,
    Instant updatedAt)
    implements PipelineEntity {

  public static Segment create(
      String id,
      String videoId,
      int sequenceIndex,
      String sourceText,
      String backgroundMediaRef,
      Instant now) {
    return new Segment(
        id,
        videoId,
        sequenceIndex,
        sourceText,
        backgroundMediaRef,
        PipelineState.CREATED,
        EntityStatus.PENDING,
        null,
        null,
        null,
        null,
        null,
        now,
        now);
  }

  @Override
  public EntityScope scope() {
    return EntityScope.SEGMENT;
  }

  @Override
  public Segment apply(Transition transition, Instant now) {
    PipelineState next = transition.nextState();
    String voiceover = voiceoverRef;
    String combined = combinedMediaRef;
    if (next == PipelineState.VOICE_DONE) {
      voiceover = transition.artifactRef();
    } else if (next == PipelineState.MEDIA_DONE) {
      combined = transition.artifactRef();
    }
    boolean failed = next == PipelineState.FAILED;
    return new Segment(
        id,
        videoId,
        sequenceIndex,
        sourceText,
        backgroundMediaRef,
        next,
        next.impliedStatus(),
        next.isDispatched() ? transition.attempt() : null,
        voiceover,
        combined,
        failed ? transition.failureReason() : failureReason,
        failed ? transition.failureDetail() : failureDetail,
        createdAt,
        now);
  }

  @Override
  public Segment withLiveAttempt(StageAttempt attempt, Instant now) {
    return new Segment(
        id,
        videoId,
        sequenceIndex,
        sourceText,
        backgroundMediaRef,
        state,
        status,
        attempt,
        voiceoverRef,
        combinedMediaRef,
        failureReason,
        failureDetail,
        createdAt,
        now);
  }
}
