package com.scholary.videoengine.pipeline;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Transition rules shared by the scheduler and the webhook correlator.
 *
 * <p>The rules are:
 *
 * <ul>
 *   <li>a {@code *_DISPATCHED} state is entered from the stage's ready state, or re-entered from
 *       itself when a retry supersedes the live attempt
 *   <li>a {@code *_DONE} state is entered only from the matching {@code *_DISPATCHED} state
 *   <li>{@link PipelineState#FAILED} is reachable from any non-terminal state
 *   <li>nothing leaves a terminal state
 * </ul>
 */
@Component
public class PipelineStateMachine {

  /** The Segment state every Segment must reach before the Video-scoped stages may start. */
  public static final PipelineState SEGMENTS_COMPLETE = PipelineState.MEDIA_DONE;

  public boolean canTransition(EntityScope scope, PipelineState from, PipelineState to) {
    if (from.isTerminal() || !from.belongsTo(scope) || !to.belongsTo(scope)) {
      return false;
    }
    if (to == PipelineState.FAILED) {
      return true;
    }
    if (to.isDispatched()) {
      StageKind stage = stageOf(to);
      return from == stage.readyState() || from == to;
    }
    return stageForDone(to).map(stage -> from == stage.dispatchedState()).orElse(false);
  }

  /**
   * Same as {@link #canTransition} but throws when the transition is not allowed.
   *
   * @throws InvariantViolationException if the transition breaks the state order
   */
  public void requireTransition(EntityScope scope, PipelineState from, PipelineState to) {
    if (!canTransition(scope, from, to)) {
      throw new InvariantViolationException(
          String.format("Illegal %s transition %s -> %s", scope, from, to));
    }
  }

  /** The stage that can be dispatched from a resting state, if any. */
  public Optional<StageKind> nextStage(EntityScope scope, PipelineState state) {
    return Arrays.stream(StageKind.values())
        .filter(stage -> stage.scope() == scope && stage.readyState() == state)
        .findFirst();
  }

  /** The stage that owns a dispatched state. */
  public StageKind stageOf(PipelineState dispatchedState) {
    return Arrays.stream(StageKind.values())
        .filter(stage -> stage.dispatchedState() == dispatchedState)
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Not a dispatched state: " + dispatchedState));
  }

  private Optional<StageKind> stageForDone(PipelineState doneState) {
    return Arrays.stream(StageKind.values())
        .filter(stage -> stage.doneState() == doneState)
        .findFirst();
  }

  /** Aggregate readiness of a Video's Segments for the Video-scoped stages. */
  public AggregateState aggregate(Collection<PipelineState> segmentStates) {
    return AggregateState.of(segmentStates, SEGMENTS_COMPLETE);
  }

  /**
   * Check that segment sequence indices are exactly {@code 0..N-1}.
   *
   * @throws InvariantViolationException if an index is missing, repeated or out of range
   */
  public void validateSequence(List<Integer> sequenceIndices) {
    TreeSet<Integer> unique = new TreeSet<>(sequenceIndices);
    boolean contiguous =
        !unique.isEmpty()
            && unique.size() == sequenceIndices.size()
            && unique.first() == 0
            && unique.last() == sequenceIndices.size() - 1;
    if (!contiguous) {
      throw new InvariantViolationException(
          "Segment sequence indices must be contiguous from 0, got " + sequenceIndices);
    }
  }
}
