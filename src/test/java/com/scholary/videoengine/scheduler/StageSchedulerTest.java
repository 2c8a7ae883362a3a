package com.scholary.videoengine.scheduler;

import static com.scholary.videoengine.support.PipelineHarness.VIDEO_ID;
import static com.scholary.videoengine.support.PipelineHarness.segmentId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.videoengine.ledger.Segment;
import com.scholary.videoengine.ledger.StageAttempt;
import com.scholary.videoengine.ledger.Video;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.PipelineState;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import com.scholary.videoengine.stage.StageDispatchException;
import com.scholary.videoengine.stage.StageRequest;
import com.scholary.videoengine.support.PipelineHarness;
import com.scholary.videoengine.support.TestProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StageSchedulerTest {

  private static final Duration PAST_VOICE_DEADLINE = TestProperties.VOICE_TIMEOUT.plusSeconds(1);
  private static final Duration PAST_MEDIA_DEADLINE = TestProperties.MEDIA_TIMEOUT.plusSeconds(1);

  @Test
  void advance_dispatchesVoiceForNewSegment() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);

    AdvanceResult result = harness.scheduler.advance(segmentId(0));

    assertThat(result).isEqualTo(AdvanceResult.DISPATCHED);
    Segment segment = harness.segment(0);
    assertThat(segment.state()).isEqualTo(PipelineState.VOICE_DISPATCHED);
    assertThat(segment.status()).isEqualTo(EntityStatus.RUNNING);
    assertThat(segment.liveAttempt().attemptNumber()).isEqualTo(1);
    assertThat(segment.liveAttempt().externalJobId()).isEqualTo("elevenlabs-job-1");
    assertThat(segment.liveAttempt().deadline())
        .isEqualTo(harness.clock.instant().plus(TestProperties.VOICE_TIMEOUT));

    StageRequest request = harness.voice.requests().get(0);
    assertThat(request.parameter(StageRequest.TEXT)).isEqualTo("Sentence 0.");
    assertThat(request.parameter(StageRequest.VOICE_ID)).isEqualTo("voice-1");
    assertThat(request.callbackUrl().toString())
        .isEqualTo(
            "http://engine.test/webhooks/elevenlabs?token="
                + segment.liveAttempt().correlationToken());
  }

  @Test
  void advance_waitsWhileAttemptIsInFlight() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.scheduler.advance(segmentId(0));

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.WAITING);
    assertThat(harness.voice.requests()).hasSize(1);
  }

  @Test
  void advance_isNoOpForTerminalEntity() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.runVoice(0);
    harness.complete(segmentId(0), "https://nca.test/0.mp4");

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.NO_OP);
  }

  @Test
  void advance_rejectsUnknownEntity() {
    PipelineHarness harness = new PipelineHarness(3);

    assertThatThrownBy(() -> harness.scheduler.advance("nope"))
        .isInstanceOf(InvariantViolationException.class);
  }

  @Test
  void timeoutOnEveryAttempt_failsWithStageTimeout() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.scheduler.advance(segmentId(0));
    String firstToken = harness.segment(0).liveToken();

    harness.clock.advance(PAST_VOICE_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.DISPATCHED);
    StageAttempt second = harness.segment(0).liveAttempt();
    assertThat(second.attemptNumber()).isEqualTo(2);
    assertThat(second.correlationToken()).isNotEqualTo(firstToken);
    assertThat(harness.ledger.findByToken(firstToken)).isEmpty();

    harness.clock.advance(PAST_VOICE_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.DISPATCHED);
    assertThat(harness.segment(0).liveAttempt().attemptNumber()).isEqualTo(3);

    harness.clock.advance(PAST_VOICE_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.FAILED);

    Segment segment = harness.segment(0);
    assertThat(segment.state()).isEqualTo(PipelineState.FAILED);
    assertThat(segment.failureReason()).isEqualTo(FailureReason.STAGE_TIMEOUT);
    assertThat(segment.liveAttempt()).isNull();
    assertThat(harness.voice.requests()).hasSize(3);
    assertThat(harness.video().state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.SEGMENT_FAILED);
  }

  @Test
  void oneSegmentTimingOut_failsVideoButLeavesSiblingsAlone() {
    PipelineHarness harness = new PipelineHarness(2);
    harness.createVideo(3);
    for (int i = 0; i < 3; i++) {
      harness.runVoice(i);
    }
    harness.complete(segmentId(0), "https://nca.test/0.mp4");
    harness.complete(segmentId(2), "https://nca.test/2.mp4");
    assertThat(harness.scheduler.advance(VIDEO_ID)).isEqualTo(AdvanceResult.WAITING);

    harness.clock.advance(PAST_MEDIA_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(1))).isEqualTo(AdvanceResult.DISPATCHED);
    harness.clock.advance(PAST_MEDIA_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(1))).isEqualTo(AdvanceResult.FAILED);

    assertThat(harness.segment(1).state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.segment(1).failureReason()).isEqualTo(FailureReason.STAGE_TIMEOUT);
    assertThat(harness.video().state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.SEGMENT_FAILED);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.MEDIA_DONE);
    assertThat(harness.segment(2).state()).isEqualTo(PipelineState.MEDIA_DONE);
    assertThat(harness.nca.requests(StageKind.CONCAT)).isEmpty();
  }

  @Test
  void concatInputsFollowSequenceOrderWhateverTheCompletionOrder() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(3);
    for (int i = 0; i < 3; i++) {
      harness.runVoice(i);
    }

    for (int index : new int[] {2, 0, 1}) {
      harness.complete(segmentId(index), "https://nca.test/combined-" + index + ".mp4");
      harness.scheduler.advance(VIDEO_ID);
    }

    List<StageRequest> concat = harness.nca.requests(StageKind.CONCAT);
    assertThat(concat).hasSize(1);
    assertThat(concat.get(0).inputRefs())
        .containsExactly(
            "https://nca.test/combined-0.mp4",
            "https://nca.test/combined-1.mp4",
            "https://nca.test/combined-2.mp4");
    assertThat(harness.video().state()).isEqualTo(PipelineState.CONCAT_DISPATCHED);
  }

  @Test
  void nonContiguousSequenceIsRejected() {
    PipelineHarness harness = new PipelineHarness(3);
    Segment first =
        Segment.create("a", "v", 0, "one.", "bg", harness.clock.instant());
    Segment third =
        Segment.create("c", "v", 2, "three.", "bg", harness.clock.instant());
    Video video =
        Video.create("v", "script", 30, "voice", null, List.of("a", "c"), harness.clock.instant());

    assertThatThrownBy(() -> harness.ledger.createVideo(video, List.of(first, third)))
        .isInstanceOf(InvariantViolationException.class)
        .hasMessageContaining("contiguous");
    assertThat(harness.ledger.get("v")).isEmpty();
  }

  @Test
  void concurrentSegmentCompletions_dispatchConcatExactlyOnce() throws Exception {
    int segments = 8;
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(segments);
    for (int i = 0; i < segments; i++) {
      harness.runVoice(i);
    }

    ExecutorService pool = Executors.newFixedThreadPool(segments);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<AdvanceResult>> results = new ArrayList<>();
    try {
      for (int i = 0; i < segments; i++) {
        int index = i;
        results.add(
            pool.submit(
                () -> {
                  go.await();
                  harness.complete(segmentId(index), "https://nca.test/c" + index + ".mp4");
                  return harness.scheduler.advance(VIDEO_ID);
                }));
      }
      go.countDown();
      for (Future<AdvanceResult> result : results) {
        result.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(harness.nca.requests(StageKind.CONCAT)).hasSize(1);
    assertThat(harness.video().state()).isEqualTo(PipelineState.CONCAT_DISPATCHED);
    assertThat(results.stream().filter(f -> resultOf(f) == AdvanceResult.DISPATCHED)).hasSize(1);
  }

  @Test
  void fullRun_completesVideoWithMixedVideoAsFinalArtifact() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(2);
    for (int i = 0; i < 2; i++) {
      harness.runVoice(i);
      harness.complete(segmentId(i), "https://nca.test/c" + i + ".mp4");
    }

    assertThat(harness.scheduler.advance(VIDEO_ID)).isEqualTo(AdvanceResult.DISPATCHED);
    harness.complete(VIDEO_ID, "https://nca.test/joined.mp4");
    assertThat(harness.scheduler.advance(VIDEO_ID)).isEqualTo(AdvanceResult.DISPATCHED);

    StageRequest musicRequest = harness.music.requests().get(0);
    assertThat(musicRequest.inputRefs()).containsExactly("https://nca.test/joined.mp4");
    assertThat(musicRequest.parameter(StageRequest.PROMPT)).isEqualTo("lofi piano");
    assertThat(musicRequest.parameter(StageRequest.DURATION_SECONDS)).isEqualTo("60");

    StageAttempt generation = harness.video().liveAttempt();
    assertThat(generation.provider()).isEqualTo(Provider.GOAPI);
    assertThat(
            harness.scheduler.handOff(
                harness.video(), generation, "https://goapi.test/track.mp3"))
        .isEqualTo(AdvanceResult.DISPATCHED);

    Video mixing = harness.video();
    assertThat(mixing.state()).isEqualTo(PipelineState.MUSIC_DISPATCHED);
    assertThat(mixing.musicTrackRef()).isEqualTo("https://goapi.test/track.mp3");
    assertThat(mixing.liveAttempt().provider()).isEqualTo(Provider.NCA_TOOLKIT);
    assertThat(mixing.liveAttempt().correlationToken())
        .isNotEqualTo(generation.correlationToken());
    assertThat(mixing.finalMediaRef()).isNull();
    assertThat(harness.nca.requests(StageKind.MUSIC).get(0).inputRefs())
        .containsExactly("https://nca.test/joined.mp4", "https://goapi.test/track.mp3");

    harness.complete(VIDEO_ID, "https://nca.test/final.mp4");
    Video video = harness.video();
    assertThat(video.state()).isEqualTo(PipelineState.MUSIC_DONE);
    assertThat(video.status()).isEqualTo(EntityStatus.COMPLETE);
    assertThat(video.concatenatedMediaRef()).isEqualTo("https://nca.test/joined.mp4");
    assertThat(video.finalMediaRef()).isEqualTo("https://nca.test/final.mp4");
    assertThat(harness.scheduler.advance(VIDEO_ID)).isEqualTo(AdvanceResult.NO_OP);
  }

  @Test
  void expiredMusicMix_retriesTheMixNotTheGeneration() {
    PipelineHarness harness = runToMusic(new PipelineHarness(3));
    StageAttempt generation = harness.video().liveAttempt();
    harness.scheduler.handOff(harness.video(), generation, "https://goapi.test/track.mp3");

    harness.clock.advance(TestProperties.MUSIC_TIMEOUT);
    assertThat(harness.scheduler.advance(VIDEO_ID)).isEqualTo(AdvanceResult.DISPATCHED);

    StageAttempt retry = harness.video().liveAttempt();
    assertThat(retry.provider()).isEqualTo(Provider.NCA_TOOLKIT);
    assertThat(retry.attemptNumber()).isEqualTo(2);
    assertThat(harness.music.requests()).hasSize(1);
    assertThat(harness.nca.requests(StageKind.MUSIC)).hasSize(2);
    assertThat(harness.nca.requests(StageKind.MUSIC).get(1).inputRefs())
        .containsExactly("https://nca.test/joined.mp4", "https://goapi.test/track.mp3");
  }

  @Test
  void handOffOfSupersededAttempt_isContended() {
    PipelineHarness harness = runToMusic(new PipelineHarness(3));
    StageAttempt generation = harness.video().liveAttempt();
    harness.clock.advance(TestProperties.MUSIC_TIMEOUT);
    harness.scheduler.advance(VIDEO_ID);

    assertThat(
            harness.scheduler.handOff(harness.video(), generation, "https://goapi.test/late.mp3"))
        .isEqualTo(AdvanceResult.CONTENDED);
    assertThat(harness.video().musicTrackRef()).isNull();
    assertThat(harness.nca.requests(StageKind.MUSIC)).isEmpty();
  }

  @Test
  void handOffOfStageWithoutFinishingStep_isRejected() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.scheduler.advance(segmentId(0));

    assertThatThrownBy(
            () ->
                harness.scheduler.handOff(
                    harness.segment(0), harness.segment(0).liveAttempt(), "https://x.test/a"))
        .isInstanceOf(InvariantViolationException.class);
  }

  @Test
  void retryableDispatchError_isRetriedAfterBackoff() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.voice.failNext(new StageDispatchException(Provider.ELEVENLABS, "503", true));

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.RETRY_SCHEDULED);
    StageAttempt failed = harness.segment(0).liveAttempt();
    assertThat(failed.dispatchFailed()).isTrue();
    assertThat(failed.deadline())
        .isEqualTo(harness.clock.instant().plus(TestProperties.INITIAL_BACKOFF));
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.WAITING);

    harness.clock.advance(TestProperties.INITIAL_BACKOFF);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.DISPATCHED);
    StageAttempt retried = harness.segment(0).liveAttempt();
    assertThat(retried.attemptNumber()).isEqualTo(2);
    assertThat(retried.dispatchFailed()).isFalse();
    assertThat(harness.voice.requests()).hasSize(2);
  }

  @Test
  void dispatchErrorOnLastAttempt_failsWithProviderError() {
    PipelineHarness harness = new PipelineHarness(1);
    harness.createVideo(1);
    harness.voice.failNext(new StageDispatchException(Provider.ELEVENLABS, "503", true));

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.FAILED);
    assertThat(harness.segment(0).failureReason()).isEqualTo(FailureReason.PROVIDER_ERROR);
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.SEGMENT_FAILED);
  }

  @Test
  void nonRetryableDispatchError_failsImmediately() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(1);
    harness.voice.failNext(new StageDispatchException(Provider.ELEVENLABS, "401", false));

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.FAILED);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.segment(0).failureDetail()).isEqualTo("401");
  }

  @Test
  void segmentsOfCancelledVideo_areNotDispatched() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(2);

    assertThat(harness.scheduler.cancel(VIDEO_ID, "user request")).isTrue();

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.NO_OP);
    assertThat(harness.voice.requests()).isEmpty();
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.CANCELLED);
    assertThat(harness.segment(1).state()).isEqualTo(PipelineState.CREATED);
    assertThat(harness.scheduler.cancel(VIDEO_ID, "again")).isFalse();
  }

  @Test
  void expiredAttemptOfSegmentWhoseVideoFailed_isFailedNotRetried() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(2);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.DISPATCHED);
    assertThat(harness.scheduler.cancel(VIDEO_ID, "user request")).isTrue();

    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.NO_OP);
    harness.clock.advance(PAST_VOICE_DEADLINE);
    assertThat(harness.scheduler.advance(segmentId(0))).isEqualTo(AdvanceResult.FAILED);

    assertThat(harness.voice.requests()).hasSize(1);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.segment(0).failureReason()).isEqualTo(FailureReason.SEGMENT_FAILED);
    assertThat(harness.segment(0).liveAttempt()).isNull();
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.CANCELLED);
    assertThat(harness.ledger.findExpiredAttempts(harness.clock.instant())).isEmpty();
  }

  @Test
  void cancellingSegment_failsItsVideo() {
    PipelineHarness harness = new PipelineHarness(3);
    harness.createVideo(2);
    harness.scheduler.advance(segmentId(0));

    assertThat(harness.scheduler.cancel(segmentId(0), "bad take")).isTrue();

    assertThat(harness.segment(0).liveAttempt()).isNull();
    assertThat(harness.video().state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.video().failureReason()).isEqualTo(FailureReason.SEGMENT_FAILED);
  }

  private static PipelineHarness runToMusic(PipelineHarness harness) {
    harness.createVideo(1);
    harness.runVoice(0);
    harness.complete(segmentId(0), "https://nca.test/c0.mp4");
    harness.scheduler.advance(VIDEO_ID);
    harness.complete(VIDEO_ID, "https://nca.test/joined.mp4");
    harness.scheduler.advance(VIDEO_ID);
    return harness;
  }

  private static AdvanceResult resultOf(Future<AdvanceResult> future) {
    try {
      return future.get();
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }
}
