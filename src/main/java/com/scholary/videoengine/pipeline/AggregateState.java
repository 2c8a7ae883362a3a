package com.scholary.videoengine.pipeline;

import java.util.Collection;

/**
 * Summary of a Video's Segment states relative to a segment-scoped threshold state.
 *
 * @param totalSegments number of Segments the Video owns
 * @param readySegments Segments at or past the threshold
 * @param failedSegments Segments in {@link PipelineState#FAILED}
 * @param threshold the state every Segment must reach
 */
public record AggregateState(
    int totalSegments, int readySegments, int failedSegments, PipelineState threshold) {

  public static AggregateState of(Collection<PipelineState> segmentStates, PipelineState threshold) {
    int ready = 0;
    int failed = 0;
    for (PipelineState state : segmentStates) {
      if (state == PipelineState.FAILED) {
        failed++;
      } else if (state.rank() >= threshold.rank()) {
        ready++;
      }
    }
    return new AggregateState(segmentStates.size(), ready, failed, threshold);
  }

  /** True when there is at least one Segment and every one reached the threshold. */
  public boolean isReady() {
    return totalSegments > 0 && failedSegments == 0 && readySegments == totalSegments;
  }

  public boolean hasFailures() {
    return failedSegments > 0;
  }
}
