package com.scholary.videoengine.scheduler;

/** What a call to {@link StageScheduler#advance(String)} did. */
public enum AdvanceResult {
  /** A new attempt was claimed and the provider accepted it. */
  DISPATCHED,
  /** The provider rejected the dispatch; the attempt will be retried after a backoff. */
  RETRY_SCHEDULED,
  /** An attempt is in flight, or the Video is waiting on its Segments. */
  WAITING,
  /** Another caller changed the entity first; nothing was applied. */
  CONTENDED,
  /** The entity was moved to FAILED. */
  FAILED,
  /** Nothing to do: the entity is terminal or its Video has failed. */
  NO_OP
}
