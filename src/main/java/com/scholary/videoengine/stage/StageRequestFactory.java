package com.scholary.videoengine.stage;

import com.scholary.videoengine.ledger.JobLedger;
import com.scholary.videoengine.ledger.PipelineEntity;
import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.ledger.Video;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.PipelineStateMachine;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Assembles and validates the input of each stage from ledger state.
 *
 * <p>Stage clients trust what they receive, so every business rule on inputs is checked here:
 * non-empty text for voice synthesis, both media refs for combination, a contiguous and complete
 * set of combined segments for concatenation.
 *
 * <p>The music stage builds a GoAPI generation request until the track has been recorded on the
 * Video, and the NCA Toolkit mix request from then on.
 */
@Component
public class StageRequestFactory {

  static final int MIN_MUSIC_SECONDS = 30;
  static final int MAX_MUSIC_SECONDS = 600;

  private final JobLedger ledger;
  private final PipelineStateMachine stateMachine;
  private final CallbackUrlFactory callbackUrlFactory;
  private final String defaultMusicPrompt;

  public StageRequestFactory(
      JobLedger ledger,
      PipelineStateMachine stateMachine,
      CallbackUrlFactory callbackUrlFactory,
      ProviderProperties providerProperties) {
    this.ledger = ledger;
    this.stateMachine = stateMachine;
    this.callbackUrlFactory = callbackUrlFactory;
    this.defaultMusicPrompt = providerProperties.goapi().defaultPrompt();
  }

  /**
   * Build the request for one attempt.
   *
   * @throws InvariantViolationException if a required input is missing
   */
  public StageRequest build(StageKind stage, PipelineEntity entity, String correlationToken) {
    List<String> inputs = new ArrayList<>();
    Map<String, String> parameters = new HashMap<>();
    Provider provider = stage.provider();

    switch (stage) {
      case VOICE -> {
        Segment segment = (Segment) entity;
        Video video = parentOf(segment);
        parameters.put(StageRequest.TEXT, require(segment.sourceText(), "source text", segment));
        parameters.put(StageRequest.VOICE_ID, require(video.voiceId(), "voice id", video));
      }
      case MEDIA -> {
        Segment segment = (Segment) entity;
        inputs.add(require(segment.backgroundMediaRef(), "background media", segment));
        inputs.add(require(segment.voiceoverRef(), "voiceover", segment));
        parameters.put(StageRequest.OUTPUT_NAME, "segment_" + segment.id() + ".mp4");
      }
      case CONCAT -> {
        Video video = (Video) entity;
        List<Segment> segments = ledger.listSegments(video.id());
        stateMachine.validateSequence(segments.stream().map(Segment::sequenceIndex).toList());
        for (Segment segment : segments) {
          inputs.add(require(segment.combinedMediaRef(), "combined media", segment));
        }
        parameters.put(StageRequest.OUTPUT_NAME, "video_" + video.id() + ".mp4");
      }
      case MUSIC -> {
        Video video = (Video) entity;
        if (video.musicTrackRef() != null) {
          return buildMusicMix(video, video.musicTrackRef(), correlationToken);
        }
        inputs.add(require(video.concatenatedMediaRef(), "concatenated media", video));
        String prompt = video.musicPrompt() != null ? video.musicPrompt() : defaultMusicPrompt;
        parameters.put(StageRequest.PROMPT, require(prompt, "music prompt", video));
        parameters.put(StageRequest.DURATION_SECONDS, String.valueOf(musicDuration(video)));
      }
      default -> throw new IllegalArgumentException("Unknown stage: " + stage);
    }

    return new StageRequest(
        stage,
        provider,
        entity.id(),
        correlationToken,
        inputs,
        parameters,
        callbackUrlFactory.callbackUrl(provider, correlationToken));
  }

  /**
   * Build the request that mixes a generated music track under the concatenated video.
   *
   * @throws InvariantViolationException if the concatenated video or the track is missing
   */
  public StageRequest buildMusicMix(Video video, String musicTrackRef, String correlationToken) {
    Provider provider = StageKind.MUSIC.finishingProvider();
    return new StageRequest(
        StageKind.MUSIC,
        provider,
        video.id(),
        correlationToken,
        List.of(
            require(video.concatenatedMediaRef(), "concatenated media", video),
            require(musicTrackRef, "music track", video)),
        Map.of(StageRequest.OUTPUT_NAME, "video_" + video.id() + "_final.mp4"),
        callbackUrlFactory.callbackUrl(provider, correlationToken));
  }

  private Video parentOf(Segment segment) {
    return ledger
        .getVideo(segment.videoId())
        .orElseThrow(
            () ->
                new InvariantViolationException(
                    "Segment " + segment.id() + " references missing video " + segment.videoId()));
  }

  private int musicDuration(Video video) {
    long estimated = (long) video.segmentIds().size() * video.targetSegmentSeconds();
    return (int) Math.max(MIN_MUSIC_SECONDS, Math.min(MAX_MUSIC_SECONDS, estimated));
  }

  private static String require(String value, String what, PipelineEntity owner) {
    if (value == null || value.isBlank()) {
      throw new InvariantViolationException(
          String.format("Missing %s on %s %s", what, owner.scope(), owner.id()));
    }
    return value;
  }
}
