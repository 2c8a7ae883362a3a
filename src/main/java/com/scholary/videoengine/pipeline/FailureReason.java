package com.scholary.videoengine.pipeline;

/** Reason code recorded on an entity when it enters {@link PipelineState#FAILED}. */
public enum FailureReason {
  STAGE_TIMEOUT("stage_timeout"),
  PROVIDER_ERROR("provider_error"),
  PROVIDER_REPORTED_FAILURE("provider_reported_failure"),
  SEGMENT_FAILED("segment_failed"),
  INVARIANT_VIOLATION("invariant_violation"),
  CANCELLED("cancelled");

  private final String code;

  FailureReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
