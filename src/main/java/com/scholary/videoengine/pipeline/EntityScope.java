package com.scholary.videoengine.pipeline;

/** Which kind of ledger entity a state or stage belongs to. */
public enum EntityScope {
  SEGMENT,
  VIDEO
}
