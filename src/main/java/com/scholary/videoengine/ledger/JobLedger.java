package com.scholary.videoengine.ledger;

import com.scholary.videoengine.pipeline.AggregateState;
import com.scholary.videoengine.pipeline.PipelineState;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative record of pipeline progress: one row per Video, one per Segment.
 *
 * <p>All coordination between the webhook path and the timeout sweep goes through the
 * compare-and-swap operations here, never through in-process locks. Any store that offers
 * single-row compare-and-swap can back this interface.
 */
public interface JobLedger {

  /**
   * Store a new Video together with its Segments.
   *
   * @throws com.scholary.videoengine.pipeline.InvariantViolationException if the segment indices
   *     are not contiguous from 0, the Segments do not belong to the Video, or an id is taken
   */
  void createVideo(Video video, List<Segment> segments);

  Optional<PipelineEntity> get(String entityId);

  Optional<Video> getVideo(String videoId);

  Optional<Segment> getSegment(String segmentId);

  /**
   * Segments of a Video in sequence order.
   *
   * @throws com.scholary.videoengine.pipeline.InvariantViolationException if the Video or one of
   *     its Segments is missing
   */
  List<Segment> listSegments(String videoId);

  /**
   * Apply a transition if the row still matches what the caller observed.
   *
   * @return true if this caller's swap was applied, false if the row had moved on
   * @throws com.scholary.videoengine.pipeline.InvariantViolationException if the entity does not
   *     exist or the transition breaks the state order
   */
  boolean tryTransition(Transition transition);

  /**
   * Compare-and-swap on state alone, installing {@code attempt} if the next state is dispatched.
   *
   * @throws IllegalArgumentException if the next state is dispatched and {@code attempt} is null
   *     or belongs to another stage
   */
  default boolean tryTransition(
      String entityId, PipelineState expected, PipelineState next, StageAttempt attempt) {
    return tryTransition(
        new Transition(entityId, expected, false, null, next, attempt, null, null, null));
  }

  /**
   * Replace the live attempt, provided {@code expectedToken} is still the live token.
   *
   * <p>Used to supersede an attempt on retry (new token) and to annotate the current one (same
   * token) with the provider job id or a dispatch error.
   *
   * @return true if the attempt was recorded
   */
  boolean recordAttempt(String entityId, String expectedToken, StageAttempt attempt);

  /** The entity whose live attempt carries this token. Superseded and resolved tokens are unknown. */
  Optional<PipelineEntity> findByToken(String correlationToken);

  /** Readiness of a Video's Segments for the Video-scoped stages. */
  AggregateState readAggregateState(String videoId);

  /** Ids of entities whose live attempt deadline is at or before {@code now}. */
  List<String> findExpiredAttempts(Instant now);

  /**
   * Mark a Video as running.
   *
   * @return true if the Video moved from PENDING to RUNNING
   */
  boolean markStarted(String videoId);
}
