package com.scholary.videoengine.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoengine.webhook.WebhookEvent.Outcome;
import org.junit.jupiter.api.Test;

class GoApiPayloadNormalizerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GoApiPayloadNormalizer normalizer = new GoApiPayloadNormalizer();

  @Test
  void dataWrappedCompletion() throws Exception {
    WebhookEvent event =
        normalizer.normalize(
            "tok",
            objectMapper.readTree(
                "{\"data\":{\"status\":\"completed\",\"output\":{\"audio_url\":\"https://g/m.mp3\"}}}"));

    assertThat(event.outcome()).isEqualTo(Outcome.SUCCEEDED);
    assertThat(event.artifactRef()).isEqualTo("https://g/m.mp3");
  }

  @Test
  void rootLevelFailure() throws Exception {
    WebhookEvent event =
        normalizer.normalize(
            "tok",
            objectMapper.readTree(
                "{\"status\":\"failed\",\"error\":{\"message\":\"content policy\"}}"));

    assertThat(event.outcome()).isEqualTo(Outcome.FAILED);
    assertThat(event.errorMessage()).isEqualTo("content policy");
  }

  @Test
  void pendingStatus_isMalformed() throws Exception {
    assertThatThrownBy(
            () ->
                normalizer.normalize(
                    "tok", objectMapper.readTree("{\"data\":{\"status\":\"processing\"}}")))
        .isInstanceOf(MalformedWebhookException.class)
        .hasMessageContaining("processing");
  }
}
