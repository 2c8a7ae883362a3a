package com.scholary.videoengine.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.webhook.CallbackResolution;
import com.scholary.videoengine.webhook.ElevenLabsPayloadNormalizer;
import com.scholary.videoengine.webhook.GoApiPayloadNormalizer;
import com.scholary.videoengine.webhook.NcaPayloadNormalizer;
import com.scholary.videoengine.webhook.WebhookCorrelator;
import com.scholary.videoengine.webhook.WebhookEvent;
import com.scholary.videoengine.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WebhookController.class)
@Import({
  ElevenLabsPayloadNormalizer.class,
  NcaPayloadNormalizer.class,
  GoApiPayloadNormalizer.class
})
class WebhookControllerTest {

  private static final String NCA_SUCCESS =
      "{\"code\": 200, \"response\": \"https://nca.test/out.mp4\", \"id\": \"tok-1\"}";

  @Autowired private MockMvc mockMvc;

  @MockBean private WebhookCorrelator correlator;

  @MockBean private WebhookSignatureVerifier signatureVerifier;

  @BeforeEach
  void setUp() {
    when(signatureVerifier.verify(any(Provider.class), any(), anyString())).thenReturn(true);
  }

  @Test
  void receive_appliesNormalizedEvent() throws Exception {
    when(correlator.onCallback(
            eq(WebhookEvent.succeeded(Provider.NCA_TOOLKIT, "tok-1", "https://nca.test/out.mp4"))))
        .thenReturn(CallbackResolution.APPLIED);

    mockMvc
        .perform(
            post("/webhooks/nca-toolkit")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(NCA_SUCCESS))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.resolution").value("APPLIED"));
  }

  @Test
  void receive_acknowledgesDuplicateWithOk() throws Exception {
    when(correlator.onCallback(any())).thenReturn(CallbackResolution.DUPLICATE);

    mockMvc
        .perform(
            post("/webhooks/nca-toolkit")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(NCA_SUCCESS))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.resolution").value("DUPLICATE"));
  }

  @Test
  void receive_unknownProviderIsNotFound() throws Exception {
    mockMvc
        .perform(
            post("/webhooks/acme")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isNotFound());

    verify(correlator, never()).onCallback(any());
  }

  @Test
  void receive_badSignatureIsUnauthorized() throws Exception {
    when(signatureVerifier.verify(eq(Provider.GOAPI), any(), anyString())).thenReturn(false);

    mockMvc
        .perform(
            post("/webhooks/goapi")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"data\": {\"status\": \"completed\"}}"))
        .andExpect(status().isUnauthorized());

    verify(correlator, never()).onCallback(any());
  }

  @Test
  void receive_invalidJsonIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/webhooks/elevenlabs")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("not json"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void receive_unknownStatusIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/webhooks/elevenlabs")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"queued\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Unknown status: queued"));
  }

  @Test
  void receive_invariantViolationIsAcknowledgedAsStale() throws Exception {
    when(correlator.onCallback(any())).thenThrow(new InvariantViolationException("broken"));

    mockMvc
        .perform(
            post("/webhooks/nca-toolkit")
                .param("token", "tok-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(NCA_SUCCESS))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.resolution").value("STALE"));
  }
}
