package com.scholary.videoengine.api;

import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.PipelineState;
import java.time.Instant;
import java.util.List;

/**
 * A Video with its Segments in sequence order.
 *
 * <p>Includes a Kibana link for the Video's logs.
 */
public record VideoView(
    String id,
    PipelineState state,
    EntityStatus status,
    int targetSegmentSeconds,
    String voiceId,
    String musicPrompt,
    String concatenatedMediaRef,
    String musicTrackRef,
    String finalMediaRef,
    AttemptView liveAttempt,
    String failureReason,
    String failureDetail,
    Instant createdAt,
    Instant updatedAt,
    List<SegmentView> segments,
    String kibanaUrl) {}
