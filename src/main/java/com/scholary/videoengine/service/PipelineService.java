package com.scholary.videoengine.service;

import com.scholary.videoengine.api.AttemptView;
import com.scholary.videoengine.api.CreateVideoRequest;
import com.scholary.videoengine.api.SegmentSpec;
import com.scholary.videoengine.api.SegmentView;
import com.scholary.videoengine.api.VideoView;
import com.scholary.videoengine.ledger.JobLedger;
import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.ledger.Video;
import com.scholary.videoengine.logging.StructuredLogger;
import com.scholary.videoengine.monitoring.KibanaUrlGenerator;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.PipelineStateMachine;
import com.scholary.videoengine.scheduler.AdvanceResult;
import com.scholary.videoengine.scheduler.StageScheduler;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for API requests: creates Videos, starts and cancels them, and reads them back.
 *
 * <p>All progress after creation is made by {@link StageScheduler}; this class never changes
 * pipeline state itself.
 */
@Service
public class PipelineService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineService.class);

  private final JobLedger ledger;
  private final StageScheduler scheduler;
  private final PipelineStateMachine stateMachine;
  private final ScriptSegmenter segmenter;
  private final KibanaUrlGenerator kibanaUrlGenerator;
  private final Clock clock;

  public PipelineService(
      JobLedger ledger,
      StageScheduler scheduler,
      PipelineStateMachine stateMachine,
      ScriptSegmenter segmenter,
      KibanaUrlGenerator kibanaUrlGenerator,
      Clock clock) {
    this.ledger = ledger;
    this.scheduler = scheduler;
    this.stateMachine = stateMachine;
    this.segmenter = segmenter;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
    this.clock = clock;
  }

  /**
   * Create a Video and its Segments, and start it if asked to.
   *
   * @throws IllegalArgumentException if the request cannot produce a valid set of Segments
   */
  public VideoView createVideo(CreateVideoRequest request) {
    String videoId = UUID.randomUUID().toString();
    Instant now = clock.instant();
    List<SegmentSpec> specs = segmentSpecs(request);

    try {
      stateMachine.validateSequence(specs.stream().map(SegmentSpec::sequenceIndex).toList());
    } catch (InvariantViolationException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }

    List<Segment> segments = new ArrayList<>();
    for (SegmentSpec spec : specs) {
      segments.add(
          Segment.create(
              UUID.randomUUID().toString(),
              videoId,
              spec.sequenceIndex(),
              spec.text(),
              spec.backgroundMediaRef(),
              now));
    }
    List<String> segmentIds =
        segments.stream()
            .sorted(Comparator.comparingInt(Segment::sequenceIndex))
            .map(Segment::id)
            .toList();

    Video video =
        Video.create(
            videoId,
            request.script(),
            request.targetSegmentSeconds(),
            request.voiceId(),
            request.musicPrompt(),
            segmentIds,
            now);
    ledger.createVideo(video, segments);

    try {
      StructuredLogger.setVideoContext(videoId);
      LOGGER.info("Created video {} with {} segments", videoId, segments.size());
      if (request.start()) {
        startVideo(videoId);
      }
    } finally {
      StructuredLogger.clearVideoContext();
    }
    return describe(videoId);
  }

  /**
   * Mark a Video running and advance each of its Segments.
   *
   * @throws EntityNotFoundException if there is no such Video
   */
  public VideoView startVideo(String videoId) {
    requireVideo(videoId);
    try {
      StructuredLogger.setVideoContext(videoId);
      if (!ledger.markStarted(videoId)) {
        LOGGER.info("Video {} already started", videoId);
      }
      for (Segment segment : ledger.listSegments(videoId)) {
        AdvanceResult result = scheduler.advance(segment.id());
        LOGGER.debug("Start advanced segment {}: {}", segment.id(), result);
      }
    } finally {
      StructuredLogger.clearVideoContext();
    }
    return describe(videoId);
  }

  /**
   * Nudge a Video or Segment.
   *
   * @throws EntityNotFoundException if there is no such entity
   */
  public AdvanceResult advance(String entityId) {
    if (ledger.get(entityId).isEmpty()) {
      throw new EntityNotFoundException(entityId);
    }
    return scheduler.advance(entityId);
  }

  /**
   * Cancel a Video.
   *
   * @throws EntityNotFoundException if there is no such Video
   */
  public VideoView cancel(String videoId, String detail) {
    requireVideo(videoId);
    boolean cancelled =
        scheduler.cancel(videoId, detail == null || detail.isBlank() ? "cancelled by request" : detail);
    LOGGER.info("Cancel of video {} applied={}", videoId, cancelled);
    return describe(videoId);
  }

  /**
   * Current view of a Video.
   *
   * @throws EntityNotFoundException if there is no such Video
   */
  public VideoView describe(String videoId) {
    Video video = requireVideo(videoId);
    List<SegmentView> segments =
        ledger.listSegments(videoId).stream().map(SegmentView::of).toList();
    return new VideoView(
        video.id(),
        video.state(),
        video.status(),
        video.targetSegmentSeconds(),
        video.voiceId(),
        video.musicPrompt(),
        video.concatenatedMediaRef(),
        video.musicTrackRef(),
        video.finalMediaRef(),
        AttemptView.of(video.liveAttempt()),
        video.failureReason() == null ? null : video.failureReason().code(),
        video.failureDetail(),
        video.createdAt(),
        video.updatedAt(),
        segments,
        kibanaUrlGenerator.generateVideoUrl(videoId, video.segmentIds()));
  }

  private Video requireVideo(String videoId) {
    return ledger.getVideo(videoId).orElseThrow(() -> new EntityNotFoundException(videoId));
  }

  private List<SegmentSpec> segmentSpecs(CreateVideoRequest request) {
    if (request.hasExplicitSegments()) {
      return request.segments();
    }
    if (request.defaultBackgroundMediaRef() == null
        || request.defaultBackgroundMediaRef().isBlank()) {
      throw new IllegalArgumentException(
          "defaultBackgroundMediaRef is required when segments are not given");
    }
    ScriptSegmenter.Mode mode =
        request.segmentationMode() == null
            ? ScriptSegmenter.Mode.SENTENCES
            : request.segmentationMode();
    List<String> texts =
        segmenter.segment(request.script(), request.targetSegmentSeconds(), mode);

    List<SegmentSpec> specs = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      specs.add(new SegmentSpec(i, texts.get(i), request.defaultBackgroundMediaRef()));
    }
    return specs;
  }
}
