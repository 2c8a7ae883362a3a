package com.scholary.videoengine.webhook;

import static com.scholary.videoengine.support.PipelineHarness.VIDEO_ID;
import static com.scholary.videoengine.support.PipelineHarness.segmentId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.videoengine.ledger.Video;
import com.scholary.videoengine.objectstore.ArtifactMirror;
import com.scholary.videoengine.objectstore.ObjectStoreException;
import com.scholary.videoengine.pipeline.FailureReason;
import com.scholary.videoengine.pipeline.EntityStatus;
import com.scholary.videoengine.pipeline.PipelineState;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import com.scholary.videoengine.stage.ProviderProperties;
import com.scholary.videoengine.support.PipelineHarness;
import com.scholary.videoengine.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookCorrelatorTest {

  private PipelineHarness harness;
  private ArtifactMirror artifactMirror;
  private WebhookCorrelator correlator;

  @BeforeEach
  void setUp() {
    harness = new PipelineHarness(3);
    harness.createVideo(2);
    artifactMirror = mock(ArtifactMirror.class);
    correlator = correlator(harness.providerProperties);
  }

  @Test
  void success_advancesSegmentToNextStage() {
    harness.scheduler.advance(segmentId(0));
    String token = harness.segment(0).liveToken();

    CallbackResolution resolution =
        correlator.onCallback(WebhookEvent.succeeded(Provider.ELEVENLABS, token, "https://v/0.mp3"));

    assertThat(resolution).isEqualTo(CallbackResolution.APPLIED);
    assertThat(harness.segment(0).voiceoverRef()).isEqualTo("https://v/0.mp3");
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.MEDIA_DISPATCHED);
    assertThat(harness.nca.requests(StageKind.MEDIA)).hasSize(1);
    verifyNoInteractions(artifactMirror);
  }

  @Test
  void replayedCallback_isAppliedExactlyOnce() {
    harness.scheduler.advance(segmentId(0));
    String token = harness.segment(0).liveToken();
    WebhookEvent event = WebhookEvent.succeeded(Provider.ELEVENLABS, token, "https://v/0.mp3");

    assertThat(correlator.onCallback(event)).isEqualTo(CallbackResolution.APPLIED);
    assertThat(correlator.onCallback(event)).isEqualTo(CallbackResolution.DUPLICATE);
    assertThat(correlator.onCallback(event)).isEqualTo(CallbackResolution.DUPLICATE);

    assertThat(harness.nca.requests(StageKind.MEDIA)).hasSize(1);
  }

  @Test
  void replayAfterDedupCacheLoss_isStale() {
    harness.scheduler.advance(segmentId(0));
    String token = harness.segment(0).liveToken();
    WebhookEvent event = WebhookEvent.succeeded(Provider.ELEVENLABS, token, "https://v/0.mp3");
    correlator.onCallback(event);

    WebhookCorrelator restarted = correlator(harness.providerProperties);

    assertThat(restarted.onCallback(event)).isEqualTo(CallbackResolution.STALE);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.MEDIA_DISPATCHED);
  }

  @Test
  void callbackForSupersededAttempt_isStale() {
    harness.scheduler.advance(segmentId(0));
    String oldToken = harness.segment(0).liveToken();
    harness.clock.advance(TestProperties.VOICE_TIMEOUT);
    harness.scheduler.advance(segmentId(0));

    CallbackResolution resolution =
        correlator.onCallback(
            WebhookEvent.succeeded(Provider.ELEVENLABS, oldToken, "https://v/late.mp3"));

    assertThat(resolution).isEqualTo(CallbackResolution.STALE);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.VOICE_DISPATCHED);
    assertThat(harness.segment(0).voiceoverRef()).isNull();
  }

  @Test
  void unknownToken_isStale() {
    assertThat(
            correlator.onCallback(
                WebhookEvent.succeeded(Provider.ELEVENLABS, "no-such-token", "https://v/x.mp3")))
        .isEqualTo(CallbackResolution.STALE);
  }

  @Test
  void callbackFromWrongProvider_isStale() {
    harness.scheduler.advance(segmentId(0));
    String token = harness.segment(0).liveToken();

    assertThat(
            correlator.onCallback(
                WebhookEvent.succeeded(Provider.GOAPI, token, "https://g/x.mp3")))
        .isEqualTo(CallbackResolution.STALE);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.VOICE_DISPATCHED);
  }

  @Test
  void reportedFailure_failsSegmentAndVideo() {
    harness.scheduler.advance(segmentId(0));
    harness.scheduler.advance(segmentId(1));
    String token = harness.segment(0).liveToken();

    CallbackResolution resolution =
        correlator.onCallback(WebhookEvent.failed(Provider.ELEVENLABS, token, "quota exceeded"));

    assertThat(resolution).isEqualTo(CallbackResolution.APPLIED);
    assertThat(harness.segment(0).state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.segment(0).failureReason())
        .isEqualTo(FailureReason.PROVIDER_REPORTED_FAILURE);
    assertThat(harness.segment(0).failureDetail()).isEqualTo("quota exceeded");
    assertThat(harness.video().state()).isEqualTo(PipelineState.FAILED);
    assertThat(harness.segment(1).state()).isEqualTo(PipelineState.VOICE_DISPATCHED);
  }

  @Test
  void lastSegmentCompletion_dispatchesConcat() {
    harness.runVoice(0);
    harness.runVoice(1);
    String token0 = harness.segment(0).liveToken();
    String token1 = harness.segment(1).liveToken();

    correlator.onCallback(WebhookEvent.succeeded(Provider.NCA_TOOLKIT, token1, "https://n/1.mp4"));
    assertThat(harness.video().state()).isEqualTo(PipelineState.CREATED);
    correlator.onCallback(WebhookEvent.succeeded(Provider.NCA_TOOLKIT, token0, "https://n/0.mp4"));

    assertThat(harness.video().state()).isEqualTo(PipelineState.CONCAT_DISPATCHED);
    assertThat(harness.nca.requests(StageKind.CONCAT).get(0).inputRefs())
        .containsExactly("https://n/0.mp4", "https://n/1.mp4");
    assertThat(harness.ledger.readAggregateState(VIDEO_ID).isReady()).isTrue();
  }

  @Test
  void mirroring_recordsMirroredUrlAndFallsBackOnFailure() {
    WebhookCorrelator mirroringCorrelator = correlator(mirroringProviders());
    harness.scheduler.advance(segmentId(0));
    harness.scheduler.advance(segmentId(1));
    String token0 = harness.segment(0).liveToken();
    String token1 = harness.segment(1).liveToken();
    when(artifactMirror.mirror(segmentId(0), StageKind.VOICE, token0, "https://v/0.mp3"))
        .thenReturn("https://bucket.test/videos/seg-0/voice.mp3");
    when(artifactMirror.mirror(segmentId(1), StageKind.VOICE, token1, "https://v/1.mp3"))
        .thenThrow(new ObjectStoreException("bucket down"));

    mirroringCorrelator.onCallback(
        WebhookEvent.succeeded(Provider.ELEVENLABS, token0, "https://v/0.mp3"));
    mirroringCorrelator.onCallback(
        WebhookEvent.succeeded(Provider.ELEVENLABS, token1, "https://v/1.mp3"));

    assertThat(harness.segment(0).voiceoverRef())
        .isEqualTo("https://bucket.test/videos/seg-0/voice.mp3");
    assertThat(harness.segment(1).voiceoverRef()).isEqualTo("https://v/1.mp3");
  }

  @Test
  void musicTrack_isMixedUnderVideoBeforeCompleting() {
    runToMusic();
    String generationToken = harness.video().liveToken();

    CallbackResolution generated =
        correlator.onCallback(
            WebhookEvent.succeeded(Provider.GOAPI, generationToken, "https://g/track.mp3"));

    assertThat(generated).isEqualTo(CallbackResolution.APPLIED);
    Video mixing = harness.video();
    assertThat(mixing.state()).isEqualTo(PipelineState.MUSIC_DISPATCHED);
    assertThat(mixing.musicTrackRef()).isEqualTo("https://g/track.mp3");
    assertThat(mixing.finalMediaRef()).isNull();
    assertThat(harness.nca.requests(StageKind.MUSIC)).hasSize(1);

    String mixToken = mixing.liveToken();
    CallbackResolution mixed =
        correlator.onCallback(
            WebhookEvent.succeeded(Provider.NCA_TOOLKIT, mixToken, "https://n/final.mp4"));

    assertThat(mixed).isEqualTo(CallbackResolution.APPLIED);
    assertThat(harness.video().state()).isEqualTo(PipelineState.MUSIC_DONE);
    assertThat(harness.video().status()).isEqualTo(EntityStatus.COMPLETE);
    assertThat(harness.video().finalMediaRef()).isEqualTo("https://n/final.mp4");
  }

  @Test
  void musicGenerationReplayedAfterHandOff_isStale() {
    runToMusic();
    String generationToken = harness.video().liveToken();
    WebhookEvent event =
        WebhookEvent.succeeded(Provider.GOAPI, generationToken, "https://g/track.mp3");
    correlator.onCallback(event);

    assertThat(correlator(harness.providerProperties).onCallback(event))
        .isEqualTo(CallbackResolution.STALE);
    assertThat(harness.nca.requests(StageKind.MUSIC)).hasSize(1);
  }

  @Test
  void mixCallbackFromGoApi_isStale() {
    runToMusic();
    correlator.onCallback(
        WebhookEvent.succeeded(Provider.GOAPI, harness.video().liveToken(), "https://g/t.mp3"));

    assertThat(
            correlator.onCallback(
                WebhookEvent.succeeded(
                    Provider.GOAPI, harness.video().liveToken(), "https://g/again.mp3")))
        .isEqualTo(CallbackResolution.STALE);
    assertThat(harness.video().state()).isEqualTo(PipelineState.MUSIC_DISPATCHED);
  }

  @Test
  void mirroredArtifactOfLostSwap_isDiscarded() {
    WebhookCorrelator mirroringCorrelator = correlator(mirroringProviders());
    harness.scheduler.advance(segmentId(0));
    String token0 = harness.segment(0).liveToken();
    when(artifactMirror.mirror(segmentId(0), StageKind.VOICE, token0, "https://v/0.mp3"))
        .thenAnswer(
            invocation -> {
              // a timeout retry supersedes the attempt while the download runs
              harness.clock.advance(TestProperties.VOICE_TIMEOUT);
              harness.scheduler.advance(segmentId(0));
              return "https://bucket.test/videos/seg-0/voice.mp3";
            });

    CallbackResolution resolution =
        mirroringCorrelator.onCallback(
            WebhookEvent.succeeded(Provider.ELEVENLABS, token0, "https://v/0.mp3"));

    assertThat(resolution).isEqualTo(CallbackResolution.STALE);
    assertThat(harness.segment(0).voiceoverRef()).isNull();
    assertThat(harness.segment(0).liveAttempt().attemptNumber()).isEqualTo(2);
    verify(artifactMirror).discard(segmentId(0), StageKind.VOICE, token0, "https://v/0.mp3");
  }

  @Test
  void recordedMirror_isKept() {
    WebhookCorrelator mirroringCorrelator = correlator(mirroringProviders());
    harness.scheduler.advance(segmentId(0));
    String token0 = harness.segment(0).liveToken();
    when(artifactMirror.mirror(segmentId(0), StageKind.VOICE, token0, "https://v/0.mp3"))
        .thenReturn("https://bucket.test/videos/seg-0/voice.mp3");

    mirroringCorrelator.onCallback(
        WebhookEvent.succeeded(Provider.ELEVENLABS, token0, "https://v/0.mp3"));

    verify(artifactMirror, never())
        .discard(anyString(), eq(StageKind.VOICE), anyString(), anyString());
  }

  private void runToMusic() {
    for (int i = 0; i < 2; i++) {
      harness.runVoice(i);
      harness.complete(segmentId(i), "https://n/" + i + ".mp4");
    }
    harness.scheduler.advance(VIDEO_ID);
    harness.complete(VIDEO_ID, "https://n/joined.mp4");
    harness.scheduler.advance(VIDEO_ID);
    assertThat(harness.video().liveAttempt().provider()).isEqualTo(Provider.GOAPI);
  }

  private static ProviderProperties mirroringProviders() {
    return TestProperties.providers(
        "http://providers.test", new ProviderProperties.Webhook(false, "X-Signature", null, true));
  }

  private WebhookCorrelator correlator(ProviderProperties providerProperties) {
    return new WebhookCorrelator(
        harness.ledger,
        harness.scheduler,
        artifactMirror,
        providerProperties,
        harness.pipelineProperties);
  }
}
