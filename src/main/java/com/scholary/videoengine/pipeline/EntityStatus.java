package com.scholary.videoengine.pipeline;

/** Coarse status of a Video or Segment, as reported to callers. */
public enum EntityStatus {
  PENDING,
  RUNNING,
  COMPLETE,
  FAILED
}
