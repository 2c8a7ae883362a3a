package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.EntityScope;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.PipelineState;
import java.time.Instant;
import java.util.List;

/**
 * Ledger row for a Video: the script, its ordered Segments and the Video-scoped stage progress.
 *
 * <p>{@code musicTrackRef} holds the generated music track while it is being mixed in; {@code
 * finalMediaRef} is only set once concatenation and the music mix have both succeeded.
 */
public record Video(
    String id,
    String script,
    int targetSegmentSeconds,
    String voiceId,
    String musicPrompt,
    List<String> segmentIds,
    PipelineState state,
    EntityStatus status,
    StageAttempt liveAttempt,
    String concatenatedMediaRef,
    String musicTrackRef,
    String finalMediaRef,
    FailureReason failureReason,
    String failureDetail,
    Instant createdAt,
    Instant updatedAt)
    implements PipelineEntity {

  public Video {
    segmentIds = List.copyOf(segmentIds);
  }

  public static Video create(
      String id,
      String script,
      int targetSegmentSeconds,
      String voiceId,
      String musicPrompt,
      List<String> segmentIds,
      Instant now) {
    return new Video(
        id,
        script,
        targetSegmentSeconds,
        voiceId,
        musicPrompt,
        segmentIds,
        PipelineState.CREATED,
        EntityStatus.PENDING,
        null,
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
    return EntityScope.VIDEO;
  }

  @Override
  public Video apply(Transition transition, Instant now) {
    PipelineState next = transition.nextState();
    String concatenated = concatenatedMediaRef;
    String musicTrack = musicTrackRef;
    String finalMedia = finalMediaRef;
    if (next == PipelineState.CONCAT_DONE) {
      concatenated = transition.artifactRef();
    } else if (next == PipelineState.MUSIC_DISPATCHED && transition.artifactRef() != null) {
      musicTrack = transition.artifactRef();
    } else if (next == PipelineState.MUSIC_DONE) {
      finalMedia = transition.artifactRef();
    }
    boolean failed = next == PipelineState.FAILED;
    return new Video(
        id,
        script,
        targetSegmentSeconds,
        voiceId,
        musicPrompt,
        segmentIds,
        next,
        next == PipelineState.CREATED ? status : next.impliedStatus(),
        next.isDispatched() ? transition.attempt() : null,
        concatenated,
        musicTrack,
        finalMedia,
        failed ? transition.failureReason() : failureReason,
        failed ? transition.failureDetail() : failureDetail,
        createdAt,
        now);
  }

  @Override
  public Video withLiveAttempt(StageAttempt attempt, Instant now) {
    return new Video(
        id,
        script,
        targetSegmentSeconds,
        voiceId,
        musicPrompt,
        segmentIds,
        state,
        status,
        attempt,
        concatenatedMediaRef,
        musicTrackRef,
        finalMediaRef,
        failureReason,
        failureDetail,
        createdAt,
        now);
  }

  public Video withStatus(EntityStatus newStatus, Instant now) {
    return new Video(
        id,
        script,
        targetSegmentSeconds,
        voiceId,
        musicPrompt,
        segmentIds,
        state,
        newStatus,
        liveAttempt,
        concatenatedMediaRef,
        musicTrackRef,
        finalMediaRef,
        failureReason,
        failureDetail,
        createdAt,
        now);
  }
}
