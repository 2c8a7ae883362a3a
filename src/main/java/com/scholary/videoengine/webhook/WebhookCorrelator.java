package com.scholary.videoengine.webhook;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.videoengine.config.PipelineProperties;
import com.scholary.videoengine.ledger.JobLedger;
import com.scholary.videoengine.ledger.PipelineEntity;
import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.ledger.StageAttempt;
import com.scholary.videoengine.ledger.Transition;
import com.scholary.videoengine.logging.StructuredLogger;
import com.scholary.videoengine.objectstore.ArtifactMirror;
import com.scholary.videoengine.objectstore.ObjectStoreException;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.scheduler.AdvanceResult;
import com.scholary.videoengine.scheduler.StageScheduler;
import com.scholary.videoengine.stage.ProviderProperties;
import com.scholary.videoengine.webhook.WebhookEvent.Outcome;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies provider callbacks to the ledger.
 *
 * <p>A callback only counts if its token is still the entity's live token and the entity is still
 * in the stage's dispatched state; the check and the write happen in one ledger compare-and-swap.
 * Replays are absorbed by a cache of recently seen idempotency keys, and by the token check once
 * the key has been evicted.
 *
 * <p>A success for a stage with a finishing step hands the intermediate artifact to the scheduler
 * instead of completing the stage. A mirrored copy whose swap is lost is deleted again.
 */
@Service
public class WebhookCorrelator {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookCorrelator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobLedger ledger;
  private final StageScheduler scheduler;
  private final ArtifactMirror artifactMirror;
  private final ProviderProperties providerProperties;
  private final Cache<String, Boolean> seenKeys;

  public WebhookCorrelator(
      JobLedger ledger,
      StageScheduler scheduler,
      ArtifactMirror artifactMirror,
      ProviderProperties providerProperties,
      PipelineProperties pipelineProperties) {
    this.ledger = ledger;
    this.scheduler = scheduler;
    this.artifactMirror = artifactMirror;
    this.providerProperties = providerProperties;
    this.seenKeys =
        Caffeine.newBuilder()
            .maximumSize(pipelineProperties.dedup().maxSize())
            .expireAfterWrite(pipelineProperties.dedup().ttl())
            .build();
  }

  public CallbackResolution onCallback(WebhookEvent event) {
    String key = event.idempotencyKey();
    if (seenKeys.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
      return resolved(event, CallbackResolution.DUPLICATE);
    }

    try {
      return resolved(event, apply(event));
    } catch (RuntimeException e) {
      // let the provider's retry through
      seenKeys.invalidate(key);
      throw e;
    }
  }

  private CallbackResolution apply(WebhookEvent event) {
    Optional<PipelineEntity> found = ledger.findByToken(event.correlationToken());
    if (found.isEmpty()) {
      return CallbackResolution.STALE;
    }
    PipelineEntity entity = found.get();
    StageAttempt live = entity.liveAttempt();
    if (live.provider() != event.provider()) {
      LOGGER.warn(
          "Callback from {} for token {} belongs to {} stage {}",
          event.provider(),
          event.correlationToken(),
          live.provider(),
          live.stage());
      return CallbackResolution.STALE;
    }

    if (event.outcome() == Outcome.FAILED) {
      boolean failed =
          scheduler.failAttempt(
              entity, live, FailureReason.PROVIDER_REPORTED_FAILURE, event.errorMessage());
      return failed ? CallbackResolution.APPLIED : CallbackResolution.STALE;
    }

    Artifact artifact = artifactOf(entity, live, event);
    if (live.stage().needsFinishing(live.provider())) {
      if (scheduler.handOff(entity, live, artifact.ref()) == AdvanceResult.CONTENDED) {
        discardUnrecorded(entity, live, event, artifact);
        return CallbackResolution.STALE;
      }
      return CallbackResolution.APPLIED;
    }

    if (!ledger.tryTransition(Transition.complete(entity.id(), live, artifact.ref()))) {
      discardUnrecorded(entity, live, event, artifact);
      return CallbackResolution.STALE;
    }
    structuredLogger.logTransition(entity.id(), entity.state(), live.stage().doneState());

    advanceQuietly(entity.id());
    if (entity instanceof Segment segment) {
      advanceQuietly(segment.videoId());
    }
    return CallbackResolution.APPLIED;
  }

  private Artifact artifactOf(PipelineEntity entity, StageAttempt live, WebhookEvent event) {
    if (!providerProperties.webhookFor(event.provider()).mirrorArtifacts()) {
      return new Artifact(event.artifactRef(), false);
    }
    try {
      return new Artifact(
          artifactMirror.mirror(
              entity.id(), live.stage(), live.correlationToken(), event.artifactRef()),
          true);
    } catch (ObjectStoreException e) {
      LOGGER.warn(
          "Mirroring {} artifact of {} failed, keeping provider url: {}",
          live.stage(),
          entity.id(),
          e.getMessage());
      return new Artifact(event.artifactRef(), false);
    }
  }

  private void discardUnrecorded(
      PipelineEntity entity, StageAttempt live, WebhookEvent event, Artifact artifact) {
    if (!artifact.mirrored()) {
      return;
    }
    try {
      artifactMirror.discard(
          entity.id(), live.stage(), live.correlationToken(), event.artifactRef());
    } catch (ObjectStoreException e) {
      LOGGER.warn(
          "Could not discard unrecorded {} artifact of {}: {}",
          live.stage(),
          entity.id(),
          e.getMessage());
    }
  }

  private void advanceQuietly(String entityId) {
    try {
      scheduler.advance(entityId);
    } catch (InvariantViolationException e) {
      LOGGER.error("Could not advance {} after callback: {}", entityId, e.getMessage());
    }
  }

  private record Artifact(String ref, boolean mirrored) {}

  private CallbackResolution resolved(WebhookEvent event, CallbackResolution resolution) {
    structuredLogger.logCallbackResolved(
        event.provider(),
        event.correlationToken(),
        event.outcome().name().toLowerCase(),
        resolution.name().toLowerCase());
    return resolution;
  }
}
