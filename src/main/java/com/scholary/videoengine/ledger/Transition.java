package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.PipelineState;

/**
 * A compare-and-swap request against one ledger row.
 *
 * <p>The swap applies only if the row's state equals {@code expectedState} and, when {@code
 * checkToken} is set, its live attempt token equals {@code expectedToken} (null meaning no live
 * attempt).
 *
 * @param entityId the Video or Segment id
 * @param expectedState the state the row must be in
 * @param checkToken whether the live attempt token is part of the comparison
 * @param expectedToken the live attempt token the row must hold
 * @param nextState the state to move to
 * @param attempt the attempt that becomes live; required for, and only kept for, dispatched states
 * @param artifactRef artifact produced by the stage being completed, or null
 * @param failureReason reason code when moving to FAILED
 * @param failureDetail free-form failure detail
 */
public record Transition(
    String entityId,
    PipelineState expectedState,
    boolean checkToken,
    String expectedToken,
    PipelineState nextState,
    StageAttempt attempt,
    String artifactRef,
    FailureReason failureReason,
    String failureDetail) {

  public Transition {
    if (nextState.isDispatched()
        && (attempt == null || attempt.stage().dispatchedState() != nextState)) {
      throw new IllegalArgumentException(
          "Transition of " + entityId + " to " + nextState + " needs an attempt of that stage");
    }
  }

  /** Claim a stage: move from its ready state to its dispatched state with a first attempt. */
  public static Transition claim(String entityId, PipelineState from, StageAttempt attempt) {
    return new Transition(
        entityId,
        from,
        true,
        null,
        attempt.stage().dispatchedState(),
        attempt,
        null,
        null,
        null);
  }

  /** Resolve the live attempt successfully, writing its artifact in the same swap. */
  public static Transition complete(String entityId, StageAttempt live, String artifactRef) {
    return new Transition(
        entityId,
        live.stage().dispatchedState(),
        true,
        live.correlationToken(),
        live.stage().doneState(),
        null,
        artifactRef,
        null,
        null);
  }

  /**
   * Keep the stage dispatched but hand it to its finishing step: the live attempt is superseded by
   * {@code next} and the intermediate artifact is written in the same swap.
   */
  public static Transition handOff(
      String entityId, StageAttempt live, String intermediateRef, StageAttempt next) {
    return new Transition(
        entityId,
        live.stage().dispatchedState(),
        true,
        live.correlationToken(),
        live.stage().dispatchedState(),
        next,
        intermediateRef,
        null,
        null);
  }

  /** Fail the entity, but only while the given attempt is still the live one. */
  public static Transition failAttempt(
      String entityId, StageAttempt live, FailureReason reason, String detail) {
    return new Transition(
        entityId,
        live.stage().dispatchedState(),
        true,
        live.correlationToken(),
        PipelineState.FAILED,
        null,
        null,
        reason,
        detail);
  }

  /** Fail the entity from whatever it is doing in {@code expectedState}. */
  public static Transition fail(
      String entityId, PipelineState expectedState, FailureReason reason, String detail) {
    return new Transition(
        entityId, expectedState, false, null, PipelineState.FAILED, null, null, reason, detail);
  }
}
