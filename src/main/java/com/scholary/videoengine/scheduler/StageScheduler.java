package com.scholary.videoengine.scheduler;

import com.scholary.videoengine.config.PipelineProperties;
import com.scholary.videoengine.config.PipelineProperties.StageBudget;
import com.scholary.videoengine.ledger.JobLedger;
import com.scholary.videoengine.ledger.PipelineEntity;
import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.ledger.StageAttempt;
import com.scholary.videoengine.ledger.Transition;
import com.scholary.videoengine.ledger.Video;
import com.scholary.videoengine.logging.StructuredLogger;
import com.scholary.videoengine.pipeline.AggregateState;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.PipelineState;
import com.scholary.videoengine.pipeline.PipelineStateMachine;
import com.scholary.videoengine.pipeline.StageKind;
import com.scholary.videoengine.stage.CorrelationTokenGenerator;
import com.scholary.videoengine.stage.StageClientRegistry;
import com.scholary.videoengine.stage.StageDispatchException;
import com.scholary.videoengine.stage.StageRequest;
import com.scholary.videoengine.stage.StageRequestFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives entities forward through the pipeline.
 *
 * <p>{@link #advance(String)} is safe to call at any time, from any thread, any number of times:
 * every change goes through a ledger compare-and-swap, so of two overlapping calls for the same
 * entity at most one claims or supersedes an attempt and the other reports {@link
 * AdvanceResult#CONTENDED}. It never waits for a webhook; it returns as soon as the provider
 * accepted (or rejected) the request.
 *
 * <p>The attempt is claimed in the ledger before the provider is called, so a callback can never
 * arrive for a token the ledger does not know.
 */
@Service
public class StageScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobLedger ledger;
  private final PipelineStateMachine stateMachine;
  private final StageClientRegistry stageClients;
  private final StageRequestFactory requestFactory;
  private final CorrelationTokenGenerator tokenGenerator;
  private final PipelineProperties properties;
  private final Clock clock;

  public StageScheduler(
      JobLedger ledger,
      PipelineStateMachine stateMachine,
      StageClientRegistry stageClients,
      StageRequestFactory requestFactory,
      CorrelationTokenGenerator tokenGenerator,
      PipelineProperties properties,
      Clock clock) {
    this.ledger = ledger;
    this.stateMachine = stateMachine;
    this.stageClients = stageClients;
    this.requestFactory = requestFactory;
    this.tokenGenerator = tokenGenerator;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Move an entity forward if it can move.
   *
   * <ol>
   *   <li>terminal entities are left alone
   *   <li>a Segment of a failed Video gets no further stage; its expired attempt is failed
   *   <li>a live attempt past its deadline is retried, or failed once the budget is spent
   *   <li>with no live attempt, the next stage is claimed and dispatched
   *   <li>Video concatenation waits until every Segment is done
   * </ol>
   *
   * @param entityId a Video or Segment id
   * @return what was done
   * @throws InvariantViolationException if the entity does not exist or its stage inputs are
   *     broken; in the latter case the entity is failed first
   */
  public AdvanceResult advance(String entityId) {
    PipelineEntity entity =
        ledger
            .get(entityId)
            .orElseThrow(() -> new InvariantViolationException("No such entity: " + entityId));

    if (entity.state().isTerminal()) {
      return AdvanceResult.NO_OP;
    }

    StageAttempt live = entity.liveAttempt();
    if (entity instanceof Segment segment && parentHasFailed(segment)) {
      if (live != null && live.isExpired(clock.instant())) {
        return failAttempt(entity, live, FailureReason.SEGMENT_FAILED, "video has failed")
            ? AdvanceResult.FAILED
            : AdvanceResult.CONTENDED;
      }
      LOGGER.debug("Not advancing segment {}: video has failed", entityId);
      return AdvanceResult.NO_OP;
    }

    if (live != null) {
      if (live.isExpired(clock.instant())) {
        return handleExpired(entity, live);
      }
      return AdvanceResult.WAITING;
    }

    Optional<StageKind> next = stateMachine.nextStage(entity.scope(), entity.state());
    if (next.isEmpty()) {
      LOGGER.warn(
          "Entity {} is in {} with no live attempt and nothing to dispatch",
          entityId,
          entity.state());
      return AdvanceResult.NO_OP;
    }
    StageKind stage = next.get();

    if (stage == StageKind.CONCAT) {
      AggregateState aggregate = ledger.readAggregateState(entityId);
      if (aggregate.hasFailures()) {
        return failVideo(
                entityId,
                FailureReason.SEGMENT_FAILED,
                aggregate.failedSegments() + " segment(s) failed")
            ? AdvanceResult.FAILED
            : AdvanceResult.CONTENDED;
      }
      if (!aggregate.isReady()) {
        LOGGER.debug(
            "Video {} waiting on segments: {}/{} ready",
            entityId,
            aggregate.readySegments(),
            aggregate.totalSegments());
        return AdvanceResult.WAITING;
      }
    }

    return claimAndDispatch(entity, stage);
  }

  /**
   * Fail an entity while the given attempt is still its live one, cascading Segment failures to
   * the Video.
   *
   * @return true if this call moved the entity to FAILED
   */
  public boolean failAttempt(
      PipelineEntity entity, StageAttempt live, FailureReason reason, String detail) {
    boolean applied =
        ledger.tryTransition(Transition.failAttempt(entity.id(), live, reason, detail));
    if (applied) {
      structuredLogger.logStageFailed(entity.id(), entity.state(), reason, detail);
      cascade(entity);
    }
    return applied;
  }

  /**
   * Hand a stage over to its finishing provider once the primary provider delivered its
   * intermediate artifact. The live attempt is superseded by a first finishing attempt with a new
   * token, the artifact is recorded in the same swap, and the finishing request is dispatched.
   *
   * @return {@link AdvanceResult#CONTENDED} if {@code live} is no longer the live attempt
   * @throws InvariantViolationException if the finishing request cannot be built; the entity is
   *     failed first
   */
  public AdvanceResult handOff(PipelineEntity entity, StageAttempt live, String intermediateRef) {
    if (!(entity instanceof Video video) || live.stage() != StageKind.MUSIC) {
      throw new InvariantViolationException(
          "Stage " + live.stage() + " of " + entity.id() + " has no finishing step");
    }
    String token = tokenGenerator.next();
    StageRequest request =
        buildRequest(
            entity,
            live.stage(),
            () -> requestFactory.buildMusicMix(video, intermediateRef, token));
    StageAttempt attempt =
        StageAttempt.first(
            live.stage(),
            request.provider(),
            token,
            clock.instant(),
            budgetFor(live.stage()).timeout());

    if (!ledger.tryTransition(Transition.handOff(entity.id(), live, intermediateRef, attempt))) {
      LOGGER.debug("Lost hand-off of {} on {}", live.stage(), entity.id());
      return AdvanceResult.CONTENDED;
    }
    structuredLogger.logStageHandOff(entity.id(), attempt, intermediateRef);

    return dispatch(entity.id(), attempt, request);
  }

  /**
   * Mark an entity FAILED from outside the pipeline. A cancelled Segment fails its Video; a
   * cancelled Video leaves its Segments as they are but no further Segment stage is dispatched.
   *
   * @return true if this call moved the entity to FAILED
   */
  public boolean cancel(String entityId, String detail) {
    while (true) {
      PipelineEntity entity =
          ledger
              .get(entityId)
              .orElseThrow(() -> new InvariantViolationException("No such entity: " + entityId));
      if (entity.state().isTerminal()) {
        return false;
      }
      if (ledger.tryTransition(
          Transition.fail(entityId, entity.state(), FailureReason.CANCELLED, detail))) {
        structuredLogger.logStageFailed(entityId, entity.state(), FailureReason.CANCELLED, detail);
        cascade(entity);
        return true;
      }
    }
  }

  private AdvanceResult claimAndDispatch(PipelineEntity entity, StageKind stage) {
    String token = tokenGenerator.next();
    StageRequest request =
        buildRequest(entity, stage, () -> requestFactory.build(stage, entity, token));
    StageAttempt attempt =
        StageAttempt.first(
            stage, request.provider(), token, clock.instant(), budgetFor(stage).timeout());

    if (!ledger.tryTransition(Transition.claim(entity.id(), entity.state(), attempt))) {
      LOGGER.debug("Lost claim for {} on {}", stage, entity.id());
      return AdvanceResult.CONTENDED;
    }
    structuredLogger.logTransition(entity.id(), entity.state(), stage.dispatchedState());

    return dispatch(entity.id(), attempt, request);
  }

  private AdvanceResult handleExpired(PipelineEntity entity, StageAttempt live) {
    StageBudget budget = budgetFor(live.stage());

    if (live.attemptNumber() >= budget.maxAttempts()) {
      FailureReason reason =
          live.dispatchFailed() ? FailureReason.PROVIDER_ERROR : FailureReason.STAGE_TIMEOUT;
      String detail =
          live.dispatchFailed()
              ? live.lastError()
              : String.format(
                  "%s gave no callback after %d attempt(s)", live.stage().key(), live.attemptNumber());
      return failAttempt(entity, live, reason, detail)
          ? AdvanceResult.FAILED
          : AdvanceResult.CONTENDED;
    }

    String token = tokenGenerator.next();
    StageRequest request =
        buildRequest(entity, live.stage(), () -> requestFactory.build(live.stage(), entity, token));
    StageAttempt next = live.next(token, clock.instant(), budget.timeout());

    if (!ledger.recordAttempt(entity.id(), live.correlationToken(), next)) {
      LOGGER.debug("Lost retry of {} on {}", live.stage(), entity.id());
      return AdvanceResult.CONTENDED;
    }
    structuredLogger.logStageRetry(
        entity.id(), next, budget.maxAttempts(), live.dispatchFailed() ? "dispatch_error" : "timeout");

    return dispatch(entity.id(), next, request);
  }

  private AdvanceResult dispatch(String entityId, StageAttempt attempt, StageRequest request) {
    try {
      String externalJobId =
          stageClients.clientFor(attempt.provider(), attempt.stage()).dispatch(request);
      if (externalJobId != null) {
        ledger.recordAttempt(
            entityId, attempt.correlationToken(), attempt.withExternalJobId(externalJobId));
      }
      structuredLogger.logStageDispatched(entityId, attempt, externalJobId);
      return AdvanceResult.DISPATCHED;

    } catch (StageDispatchException e) {
      return handleDispatchFailure(entityId, attempt, e);
    }
  }

  private AdvanceResult handleDispatchFailure(
      String entityId, StageAttempt attempt, StageDispatchException e) {
    int maxAttempts = budgetFor(attempt.stage()).maxAttempts();
    LOGGER.warn(
        "Dispatch of {} for {} failed (attempt {}/{}): {}",
        attempt.stage(),
        entityId,
        attempt.attemptNumber(),
        maxAttempts,
        e.getMessage());

    if (!e.isRetryable() || attempt.attemptNumber() >= maxAttempts) {
      PipelineEntity entity =
          ledger
              .get(entityId)
              .orElseThrow(() -> new InvariantViolationException("No such entity: " + entityId));
      return failAttempt(entity, attempt, FailureReason.PROVIDER_ERROR, e.getMessage())
          ? AdvanceResult.FAILED
          : AdvanceResult.CONTENDED;
    }

    Instant retryAt = clock.instant().plus(properties.backoffFor(attempt.attemptNumber()));
    if (retryAt.isAfter(attempt.deadline())) {
      retryAt = attempt.deadline();
    }
    if (!ledger.recordAttempt(
        entityId, attempt.correlationToken(), attempt.withDispatchError(e.getMessage(), retryAt))) {
      return AdvanceResult.CONTENDED;
    }
    structuredLogger.logStageRetry(entityId, attempt, maxAttempts, "dispatch_error");
    return AdvanceResult.RETRY_SCHEDULED;
  }

  private StageRequest buildRequest(
      PipelineEntity entity, StageKind stage, Supplier<StageRequest> builder) {
    try {
      return builder.get();
    } catch (InvariantViolationException e) {
      LOGGER.error("Cannot build {} request for {}: {}", stage, entity.id(), e.getMessage());
      if (ledger.tryTransition(
          Transition.fail(
              entity.id(), entity.state(), FailureReason.INVARIANT_VIOLATION, e.getMessage()))) {
        structuredLogger.logStageFailed(
            entity.id(), entity.state(), FailureReason.INVARIANT_VIOLATION, e.getMessage());
        cascade(entity);
      }
      throw e;
    }
  }

  private void cascade(PipelineEntity failed) {
    if (failed instanceof Segment segment) {
      failVideo(
          segment.videoId(),
          FailureReason.SEGMENT_FAILED,
          "segment " + segment.sequenceIndex() + " (" + segment.id() + ") failed");
    }
  }

  private boolean failVideo(String videoId, FailureReason reason, String detail) {
    while (true) {
      Video video =
          ledger
              .getVideo(videoId)
              .orElseThrow(() -> new InvariantViolationException("No such video: " + videoId));
      if (video.state().isTerminal()) {
        return false;
      }
      if (ledger.tryTransition(Transition.fail(videoId, video.state(), reason, detail))) {
        structuredLogger.logStageFailed(videoId, video.state(), reason, detail);
        return true;
      }
    }
  }

  private boolean parentHasFailed(Segment segment) {
    return ledger
        .getVideo(segment.videoId())
        .map(video -> video.state() == PipelineState.FAILED)
        .orElseThrow(
            () ->
                new InvariantViolationException(
                    "Segment " + segment.id() + " references missing video " + segment.videoId()));
  }

  private StageBudget budgetFor(StageKind stage) {
    return properties.budgetFor(stage);
  }
}
