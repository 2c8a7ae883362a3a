package com.scholary.videoengine.logging;

import com.scholary.videoengine.ledger.StageAttempt;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.PipelineState;
import com.scholary.videoengine.pipeline.Provider;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in Kibana.
 * Every event carries {@code event_type} and {@code entityId}; attempt events also carry the stage,
 * attempt number and correlation token.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a stage request accepted by its provider. */
  public void logStageDispatched(String entityId, StageAttempt attempt, String externalJobId) {
    try {
      putAttempt("stage_dispatched", entityId, attempt);
      MDC.put("externalJobId", String.valueOf(externalJobId));

      logger.info(
          "Stage dispatched: entity={}, stage={}, provider={}, attempt={}, token={},"
              + " externalJobId={}",
          entityId,
          attempt.stage(),
          attempt.provider().pathName(),
          attempt.attemptNumber(),
          attempt.correlationToken(),
          externalJobId);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retry: a dispatch error or an expired deadline that still has budget left. */
  public void logStageRetry(
      String entityId, StageAttempt attempt, int maxAttempts, String cause) {
    try {
      putAttempt("stage_retry", entityId, attempt);
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("cause", cause);

      logger.warn(
          "Stage retry: entity={}, stage={}, attempt={}/{}, cause={}",
          entityId,
          attempt.stage(),
          attempt.attemptNumber(),
          maxAttempts,
          cause);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log an entity entering the FAILED state. Cancellation is requested by an operator and logged
   * at WARN; every other reason is a pipeline failure and logged at ERROR.
   */
  public void logStageFailed(
      String entityId, PipelineState fromState, FailureReason reason, String detail) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("entityId", entityId);
      MDC.put("fromState", fromState.name());
      MDC.put("reason", reason.code());

      if (reason == FailureReason.CANCELLED) {
        logger.warn(
            "Entity cancelled: entity={}, from={}, reason={}, detail={}",
            entityId,
            fromState,
            reason.code(),
            detail);
      } else {
        logger.error(
            "Entity failed: entity={}, from={}, reason={}, detail={}",
            entityId,
            fromState,
            reason.code(),
            detail);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a stage handing its intermediate artifact to the finishing provider. */
  public void logStageHandOff(String entityId, StageAttempt attempt, String intermediateRef) {
    try {
      putAttempt("stage_handoff", entityId, attempt);

      logger.info(
          "Stage handed off: entity={}, stage={}, provider={}, token={}, intermediate={}",
          entityId,
          attempt.stage(),
          attempt.provider().pathName(),
          attempt.correlationToken(),
          intermediateRef);
    } finally {
      clearEventFields();
    }
  }

  /** Log an applied state transition. */
  public void logTransition(String entityId, PipelineState from, PipelineState to) {
    try {
      MDC.put("event_type", "transition_applied");
      MDC.put("entityId", entityId);
      MDC.put("fromState", from.name());
      MDC.put("toState", to.name());

      logger.info("Transition applied: entity={}, {} -> {}", entityId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log how a webhook callback was resolved. */
  public void logCallbackResolved(
      Provider provider, String correlationToken, String outcome, String resolution) {
    try {
      MDC.put("event_type", "callback_resolved");
      MDC.put("provider", provider.pathName());
      MDC.put("correlationToken", correlationToken);
      MDC.put("outcome", outcome);
      MDC.put("resolution", resolution);

      logger.info(
          "Callback resolved: provider={}, token={}, outcome={}, resolution={}",
          provider.pathName(),
          correlationToken,
          outcome,
          resolution);
    } finally {
      clearEventFields();
    }
  }

  /** Log timeout sweep progress. */
  public void logSweep(int expired, int advanced, int errors) {
    try {
      MDC.put("event_type", "timeout_sweep");
      MDC.put("expired", String.valueOf(expired));
      MDC.put("errors", String.valueOf(errors));

      logger.info("Timeout sweep: expired={}, advanced={}, errors={}", expired, advanced, errors);
    } finally {
      clearEventFields();
    }
  }

  /** Set video context in MDC. */
  public static void setVideoContext(String videoId) {
    MDC.put("videoId", videoId);
  }

  /** Clear video context from MDC. */
  public static void clearVideoContext() {
    MDC.remove("videoId");
  }

  private void putAttempt(String eventType, String entityId, StageAttempt attempt) {
    MDC.put("event_type", eventType);
    MDC.put("entityId", entityId);
    MDC.put("stage", attempt.stage().key());
    MDC.put("provider", attempt.provider().pathName());
    MDC.put("attempt", String.valueOf(attempt.attemptNumber()));
    MDC.put("correlationToken", attempt.correlationToken());
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("entityId");
    MDC.remove("stage");
    MDC.remove("attempt");
    MDC.remove("correlationToken");
    MDC.remove("externalJobId");
    MDC.remove("maxAttempts");
    MDC.remove("cause");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("reason");
    MDC.remove("provider");
    MDC.remove("outcome");
    MDC.remove("resolution");
    MDC.remove("expired");
    MDC.remove("errors");
  }
}
