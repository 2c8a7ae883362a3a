package com.scholary.videoengine.api;

import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.PipelineState;

public record SegmentView(
    String id,
    int sequenceIndex,
    String text,
    PipelineState state,
    EntityStatus status,
    String backgroundMediaRef,
    String voiceoverRef,
    String combinedMediaRef,
    AttemptView liveAttempt,
    String failureReason,
    String failureDetail) {

  public static SegmentView of(Segment segment) {
    return new SegmentView(
        segment.id(),
        segment.sequenceIndex(),
        segment.sourceText(),
        segment.state(),
        segment.status(),
        segment.backgroundMediaRef(),
        segment.voiceoverRef(),
        segment.combinedMediaRef(),
        AttemptView.of(segment.liveAttempt()),
        segment.failureReason() == null ? null : segment.failureReason().code(),
        segment.failureDetail());
  }
}
