package com.scholary.videoengine.ledger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.videoengine.pipeline.AggregateState;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.PipelineStateMachine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory ledger backed by a Caffeine cache.
 *
 * <p>Every compare-and-swap runs inside the cache map's per-key {@code compute}, so two callers
 * racing on the same entity see each other's writes and only one of them wins. Unrelated entities
 * never contend.
 *
 * <p>Rows expire after the configured retention, measured on the injected clock. Retention is a
 * store concern; the orchestrator itself never deletes a row. An evicted row takes its live token
 * out of the token index with it.
 */
@Repository
public class InMemoryJobLedger implements JobLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobLedger.class);

  private final Cache<String, PipelineEntity> entities;
  private final Map<String, String> entityIdsByToken = new ConcurrentHashMap<>();
  private final PipelineStateMachine stateMachine;
  private final Clock clock;

  public InMemoryJobLedger(
      @Value("${ledger.maxEntities}") long maxEntities,
      @Value("${ledger.retentionHours}") int retentionHours,
      PipelineStateMachine stateMachine,
      Clock clock) {

    this.entities =
        Caffeine.newBuilder()
            .maximumSize(maxEntities)
            .expireAfterWrite(Duration.ofHours(retentionHours))
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .evictionListener(
                (String id, PipelineEntity evicted, RemovalCause cause) -> {
                  if (evicted != null && evicted.liveToken() != null) {
                    entityIdsByToken.remove(evicted.liveToken(), id);
                  }
                })
            .build();
    this.stateMachine = stateMachine;
    this.clock = clock;

    LOGGER.info(
        "Initialized in-memory ledger: maxEntities={}, retentionHours={}",
        maxEntities,
        retentionHours);
  }

  @Override
  public void createVideo(Video video, List<Segment> segments) {
    stateMachine.validateSequence(segments.stream().map(Segment::sequenceIndex).toList());

    List<String> orderedIds =
        segments.stream()
            .sorted(Comparator.comparingInt(Segment::sequenceIndex))
            .map(Segment::id)
            .toList();
    if (!orderedIds.equals(video.segmentIds())) {
      throw new InvariantViolationException(
          "Video " + video.id() + " segment ids do not match its segments in sequence order");
    }
    for (Segment segment : segments) {
      if (!segment.videoId().equals(video.id())) {
        throw new InvariantViolationException(
            "Segment " + segment.id() + " does not belong to video " + video.id());
      }
    }

    Map<String, PipelineEntity> map = entities.asMap();
    if (map.putIfAbsent(video.id(), video) != null) {
      throw new InvariantViolationException("Entity already exists: " + video.id());
    }
    for (Segment segment : segments) {
      if (map.putIfAbsent(segment.id(), segment) != null) {
        throw new InvariantViolationException("Entity already exists: " + segment.id());
      }
    }
    LOGGER.info("Created video {} with {} segments", video.id(), segments.size());
  }

  @Override
  public Optional<PipelineEntity> get(String entityId) {
    return Optional.ofNullable(entities.getIfPresent(entityId));
  }

  @Override
  public Optional<Video> getVideo(String videoId) {
    return get(videoId).filter(Video.class::isInstance).map(Video.class::cast);
  }

  @Override
  public Optional<Segment> getSegment(String segmentId) {
    return get(segmentId).filter(Segment.class::isInstance).map(Segment.class::cast);
  }

  @Override
  public List<Segment> listSegments(String videoId) {
    Video video =
        getVideo(videoId)
            .orElseThrow(() -> new InvariantViolationException("No such video: " + videoId));
    List<Segment> segments = new ArrayList<>();
    for (String segmentId : video.segmentIds()) {
      segments.add(
          getSegment(segmentId)
              .orElseThrow(
                  () ->
                      new InvariantViolationException(
                          "Video " + videoId + " references missing segment " + segmentId)));
    }
    segments.sort(Comparator.comparingInt(Segment::sequenceIndex));
    return segments;
  }

  @Override
  public boolean tryTransition(Transition transition) {
    requireExists(transition.entityId());
    AtomicBoolean applied = new AtomicBoolean(false);

    entities
        .asMap()
        .computeIfPresent(
            transition.entityId(),
            (id, current) -> {
              if (current.state() != transition.expectedState()) {
                return current;
              }
              if (transition.checkToken()
                  && !Objects.equals(current.liveToken(), transition.expectedToken())) {
                return current;
              }
              stateMachine.requireTransition(
                  current.scope(), current.state(), transition.nextState());

              PipelineEntity updated = current.apply(transition, clock.instant());
              reindex(id, current.liveToken(), updated.liveToken());
              applied.set(true);
              return updated;
            });

    if (applied.get()) {
      LOGGER.debug(
          "Transition applied: entity={}, {} -> {}",
          transition.entityId(),
          transition.expectedState(),
          transition.nextState());
    }
    return applied.get();
  }

  @Override
  public boolean recordAttempt(String entityId, String expectedToken, StageAttempt attempt) {
    requireExists(entityId);
    AtomicBoolean recorded = new AtomicBoolean(false);

    entities
        .asMap()
        .computeIfPresent(
            entityId,
            (id, current) -> {
              if (current.liveAttempt() == null
                  || !current.liveToken().equals(expectedToken)
                  || current.state() != attempt.stage().dispatchedState()) {
                return current;
              }
              PipelineEntity updated = current.withLiveAttempt(attempt, clock.instant());
              reindex(id, current.liveToken(), updated.liveToken());
              recorded.set(true);
              return updated;
            });

    return recorded.get();
  }

  @Override
  public Optional<PipelineEntity> findByToken(String correlationToken) {
    String entityId = entityIdsByToken.get(correlationToken);
    if (entityId == null) {
      return Optional.empty();
    }
    return get(entityId).filter(entity -> correlationToken.equals(entity.liveToken()));
  }

  @Override
  public AggregateState readAggregateState(String videoId) {
    return stateMachine.aggregate(listSegments(videoId).stream().map(Segment::state).toList());
  }

  @Override
  public List<String> findExpiredAttempts(Instant now) {
    return entities.asMap().values().stream()
        .filter(entity -> entity.liveAttempt() != null && entity.liveAttempt().isExpired(now))
        .map(PipelineEntity::id)
        .toList();
  }

  @Override
  public boolean markStarted(String videoId) {
    requireExists(videoId);
    AtomicBoolean started = new AtomicBoolean(false);

    entities
        .asMap()
        .computeIfPresent(
            videoId,
            (id, current) -> {
              if (current instanceof Video video && video.status() == EntityStatus.PENDING) {
                started.set(true);
                return video.withStatus(EntityStatus.RUNNING, clock.instant());
              }
              return current;
            });

    return started.get();
  }

  /** Run pending evictions now. */
  void cleanUp() {
    entities.cleanUp();
  }

  int tokenIndexSize() {
    return entityIdsByToken.size();
  }

  private void requireExists(String entityId) {
    if (entities.getIfPresent(entityId) == null) {
      throw new InvariantViolationException("No such entity: " + entityId);
    }
  }

  private void reindex(String entityId, String oldToken, String newToken) {
    if (Objects.equals(oldToken, newToken)) {
      return;
    }
    if (oldToken != null) {
      entityIdsByToken.remove(oldToken);
    }
    if (newToken != null) {
      entityIdsByToken.put(newToken, entityId);
    }
  }
}
