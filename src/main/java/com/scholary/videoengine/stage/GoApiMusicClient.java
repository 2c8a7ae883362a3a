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

/** Instrumental music generation through GoAPI's Suno endpoint. */
@Component
public class GoApiMusicClient extends AbstractHttpStageClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoApiMusicClient.class);

  private final String model;

  public GoApiMusicClient(ProviderProperties providerProperties, ObjectMapper objectMapper) {
    super(providerProperties.goapi().connection(), objectMapper);
    this.model = providerProperties.goapi().model();
    LOGGER.info(
        "Initialized GoAPI client: baseUrl={}, model={}",
        providerProperties.goapi().connection().baseUrl(),
        model);
  }

  @Override
  public Provider provider() {
    return Provider.GOAPI;
  }

  @Override
  public Set<StageKind> supportedStages() {
    return Set.of(StageKind.MUSIC);
  }

  @Override
  protected Map<String, String> authHeaders(String apiKey) {
    return apiKey == null ? Map.of() : Map.of("Authorization", "Bearer " + apiKey);
  }

  @Override
  public String dispatch(StageRequest request) {
    int duration = Integer.parseInt(request.parameter(StageRequest.DURATION_SECONDS));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("prompt", request.parameter(StageRequest.PROMPT));
    body.put("duration", duration);
    body.put("model", model);
    body.put("instrumental", true);
    body.put("wait_audio", false);
    body.put("webhook_url", request.callbackUrl().toString());

    LOGGER.info(
        "Requesting music: entity={}, duration={}s, model={}", request.entityId(), duration, model);

    JsonNode response = postJson("/music/suno", body);
    return firstText(response, "/data/task_id", "/task_id", "/id");
  }
}
