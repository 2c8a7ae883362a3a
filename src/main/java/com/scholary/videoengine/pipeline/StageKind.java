package com.scholary.videoengine.pipeline;

/**
 * One externally processed step of the pipeline.
 *
 * <p>Voice synthesis and media combination run per Segment; concatenation and music generation run
 * once per Video after every Segment is done.
 *
 * <p>Music runs in two steps under the same dispatched state: GoAPI generates the track, then the
 * NCA Toolkit mixes it under the concatenated video. Only the mixed video completes the stage.
 */
public enum StageKind {
  VOICE(
      EntityScope.SEGMENT,
      PipelineState.CREATED,
      PipelineState.VOICE_DISPATCHED,
      PipelineState.VOICE_DONE,
      Provider.ELEVENLABS,
      null),
  MEDIA(
      EntityScope.SEGMENT,
      PipelineState.VOICE_DONE,
      PipelineState.MEDIA_DISPATCHED,
      PipelineState.MEDIA_DONE,
      Provider.NCA_TOOLKIT,
      null),
  CONCAT(
      EntityScope.VIDEO,
      PipelineState.CREATED,
      PipelineState.CONCAT_DISPATCHED,
      PipelineState.CONCAT_DONE,
      Provider.NCA_TOOLKIT,
      null),
  MUSIC(
      EntityScope.VIDEO,
      PipelineState.CONCAT_DONE,
      PipelineState.MUSIC_DISPATCHED,
      PipelineState.MUSIC_DONE,
      Provider.GOAPI,
      Provider.NCA_TOOLKIT);

  private final EntityScope scope;
  private final PipelineState readyState;
  private final PipelineState dispatchedState;
  private final PipelineState doneState;
  private final Provider provider;
  private final Provider finishingProvider;

  StageKind(
      EntityScope scope,
      PipelineState readyState,
      PipelineState dispatchedState,
      PipelineState doneState,
      Provider provider,
      Provider finishingProvider) {
    this.scope = scope;
    this.readyState = readyState;
    this.dispatchedState = dispatchedState;
    this.doneState = doneState;
    this.provider = provider;
    this.finishingProvider = finishingProvider;
  }

  public EntityScope scope() {
    return scope;
  }

  /** State the entity must be resting in before this stage can be dispatched. */
  public PipelineState readyState() {
    return readyState;
  }

  public PipelineState dispatchedState() {
    return dispatchedState;
  }

  public PipelineState doneState() {
    return doneState;
  }

  public Provider provider() {
    return provider;
  }

  /** Provider that turns the primary provider's output into the stage result, or null. */
  public Provider finishingProvider() {
    return finishingProvider;
  }

  /** Whether a successful callback from {@code completedBy} still needs the finishing step. */
  public boolean needsFinishing(Provider completedBy) {
    return finishingProvider != null && completedBy != finishingProvider;
  }

  /** Configuration key, e.g. {@code voice}. */
  public String key() {
    return name().toLowerCase();
  }
}
