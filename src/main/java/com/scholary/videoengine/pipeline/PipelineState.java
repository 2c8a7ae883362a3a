package com.scholary.videoengine.pipeline;

/**
 * Pipeline states for Segments and Videos.
 *
 * <p>Each scope has its own fixed order, starting at {@link #CREATED}:
 *
 * <ul>
 *   <li>Segment: CREATED, VOICE_DISPATCHED, VOICE_DONE, MEDIA_DISPATCHED, MEDIA_DONE
 *   <li>Video: CREATED, CONCAT_DISPATCHED, CONCAT_DONE, MUSIC_DISPATCHED, MUSIC_DONE
 * </ul>
 *
 * <p>{@link #FAILED} is terminal for both scopes.
 */
public enum PipelineState {
  CREATED(null, 0),

  VOICE_DISPATCHED(EntityScope.SEGMENT, 1),
  VOICE_DONE(EntityScope.SEGMENT, 2),
  MEDIA_DISPATCHED(EntityScope.SEGMENT, 3),
  MEDIA_DONE(EntityScope.SEGMENT, 4),

  CONCAT_DISPATCHED(EntityScope.VIDEO, 1),
  CONCAT_DONE(EntityScope.VIDEO, 2),
  MUSIC_DISPATCHED(EntityScope.VIDEO, 3),
  MUSIC_DONE(EntityScope.VIDEO, 4),

  FAILED(null, Integer.MAX_VALUE);

  private final EntityScope scope; // null = shared by both scopes
  private final int rank;

  PipelineState(EntityScope scope, int rank) {
    this.scope = scope;
    this.rank = rank;
  }

  /** Position within the scope's order. CREATED is 0. */
  public int rank() {
    return rank;
  }

  public boolean belongsTo(EntityScope entityScope) {
    return scope == null || scope == entityScope;
  }

  public boolean isTerminal() {
    return this == FAILED || this == MEDIA_DONE || this == MUSIC_DONE;
  }

  public boolean isDispatched() {
    return this == VOICE_DISPATCHED
        || this == MEDIA_DISPATCHED
        || this == CONCAT_DISPATCHED
        || this == MUSIC_DISPATCHED;
  }

  /** The entity status a record in this state reports. */
  public EntityStatus impliedStatus() {
    if (this == FAILED) {
      return EntityStatus.FAILED;
    }
    if (this == MEDIA_DONE || this == MUSIC_DONE) {
      return EntityStatus.COMPLETE;
    }
    if (this == CREATED) {
      return EntityStatus.PENDING;
    }
    return EntityStatus.RUNNING;
  }
}
