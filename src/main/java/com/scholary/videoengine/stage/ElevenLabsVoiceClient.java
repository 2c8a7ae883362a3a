package com.scholary.videoengine.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Voice synthesis through the ElevenLabs text-to-speech API.
 *
 * <p>The request carries a {@code webhook_url}, so ElevenLabs answers immediately and posts the
 * audio location to the webhook when synthesis completes.
 */
@Component
public class ElevenLabsVoiceClient extends AbstractHttpStageClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElevenLabsVoiceClient.class);

  private final ProviderProperties.ElevenLabs properties;

  public ElevenLabsVoiceClient(ProviderProperties providerProperties, ObjectMapper objectMapper) {
    super(providerProperties.elevenlabs().connection(), objectMapper);
    this.properties = providerProperties.elevenlabs();
    LOGGER.info(
        "Initialized ElevenLabs client: baseUrl={}, model={}",
        properties.connection().baseUrl(),
        properties.modelId());
  }

  @Override
  public Provider provider() {
    return Provider.ELEVENLABS;
  }

  @Override
  public Set<StageKind> supportedStages() {
    return Set.of(StageKind.VOICE);
  }

  @Override
  protected Map<String, String> authHeaders(String apiKey) {
    return apiKey == null ? Map.of() : Map.of("xi-api-key", apiKey);
  }

  @Override
  public String dispatch(StageRequest request) {
    String text = request.parameter(StageRequest.TEXT);
    String voiceId = request.parameter(StageRequest.VOICE_ID);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("text", text);
    body.put("model_id", properties.modelId());
    body.put(
        "voice_settings",
        Map.of(
            "stability", properties.stability(),
            "similarity_boost", properties.similarityBoost()));
    body.put("webhook_url", request.callbackUrl().toString());

    LOGGER.info(
        "Requesting voiceover: entity={}, voice={}, textLength={}",
        request.entityId(),
        voiceId,
        text.length());

    JsonNode response = postJson("/text-to-speech/" + voiceId + "/stream", body);
    return firstText(response, "/request_id", "/id", "/job_id");
  }
}
