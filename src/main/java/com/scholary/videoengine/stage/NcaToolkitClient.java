package com.scholary.videoengine.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Media combination, concatenation and the music mix through the NCA Toolkit.
 *
 * <ul>
 *   <li>MEDIA: {@code /v1/ffmpeg/compose} lays the voiceover over the background video, keeping
 *       the video stream as is and stopping at the shorter input
 *   <li>CONCAT: {@code /v1/video/combine} joins the segment videos in the given order
 *   <li>MUSIC: {@code /v1/ffmpeg/compose} mixes the generated track under the concatenated video's
 *       own audio, keeping the video stream as is
 * </ul>
 *
 * <p>The correlation token is sent as the NCA job {@code id} as well as in the webhook URL.
 */
@Component
public class NcaToolkitClient extends AbstractHttpStageClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(NcaToolkitClient.class);

  static final String MUSIC_VOLUME = "0.2";

  public NcaToolkitClient(ProviderProperties providerProperties, ObjectMapper objectMapper) {
    super(providerProperties.ncaToolkit().connection(), objectMapper);
    LOGGER.info(
        "Initialized NCA Toolkit client: baseUrl={}",
        providerProperties.ncaToolkit().connection().baseUrl());
  }

  @Override
  public Provider provider() {
    return Provider.NCA_TOOLKIT;
  }

  @Override
  public Set<StageKind> supportedStages() {
    return Set.of(StageKind.MEDIA, StageKind.CONCAT, StageKind.MUSIC);
  }

  @Override
  protected Map<String, String> authHeaders(String apiKey) {
    return apiKey == null ? Map.of() : Map.of("x-api-key", apiKey);
  }

  @Override
  public String dispatch(StageRequest request) {
    JsonNode response =
        switch (request.stage()) {
          case MEDIA -> postJson("/v1/ffmpeg/compose", composeBody(request));
          case CONCAT -> postJson("/v1/video/combine", combineBody(request));
          case MUSIC -> postJson("/v1/ffmpeg/compose", musicMixBody(request));
          default -> throw new IllegalArgumentException(
              "NCA Toolkit does not run stage " + request.stage());
        };
    return firstText(response, "/job_id", "/jobId", "/id");
  }

  private Map<String, Object> composeBody(StageRequest request) {
    List<String> inputs = request.inputRefs();
    LOGGER.info(
        "Requesting media combination: entity={}, video={}, audio={}",
        request.entityId(),
        inputs.get(0),
        inputs.get(1));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("inputs", List.of(Map.of("file_url", inputs.get(0)), Map.of("file_url", inputs.get(1))));
    body.put("filename", request.parameter(StageRequest.OUTPUT_NAME));
    body.put(
        "filters",
        List.of(Map.of("filter", "[0:v]copy[vout]"), Map.of("filter", "[1:a]copy[aout]")));
    body.put(
        "outputs",
        List.of(
            Map.of(
                "options",
                List.of(
                    Map.of("option", "-map", "argument", "[vout]"),
                    Map.of("option", "-map", "argument", "[aout]"),
                    Map.of("option", "-c:v", "argument", "copy"),
                    Map.of("option", "-c:a", "argument", "aac"),
                    Map.of("option", "-shortest")))));
    body.put("webhook_url", request.callbackUrl().toString());
    body.put("id", request.correlationToken());
    return body;
  }

  private Map<String, Object> combineBody(StageRequest request) {
    LOGGER.info(
        "Requesting concatenation: entity={}, segments={}",
        request.entityId(),
        request.inputRefs().size());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("video_urls", request.inputRefs());
    body.put("filename", request.parameter(StageRequest.OUTPUT_NAME));
    body.put("transition", "none");
    body.put("output_format", "mp4");
    body.put("webhook_url", request.callbackUrl().toString());
    body.put("id", request.correlationToken());
    return body;
  }

  private Map<String, Object> musicMixBody(StageRequest request) {
    List<String> inputs = request.inputRefs();
    LOGGER.info(
        "Requesting music mix: entity={}, video={}, music={}",
        request.entityId(),
        inputs.get(0),
        inputs.get(1));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("inputs", List.of(Map.of("file_url", inputs.get(0)), Map.of("file_url", inputs.get(1))));
    body.put("filename", request.parameter(StageRequest.OUTPUT_NAME));
    body.put(
        "filters",
        List.of(
            Map.of("filter", "[0:a]volume=1.0[a0]"),
            Map.of("filter", "[1:a]volume=" + MUSIC_VOLUME + "[a1]"),
            Map.of("filter", "[a0][a1]amix=inputs=2:duration=shortest:dropout_transition=2[aout]")));
    body.put(
        "outputs",
        List.of(
            Map.of(
                "options",
                List.of(
                    Map.of("option", "-map", "argument", "0:v"),
                    Map.of("option", "-map", "argument", "[aout]"),
                    Map.of("option", "-c:v", "argument", "copy"),
                    Map.of("option", "-shortest")))));
    body.put("webhook_url", request.callbackUrl().toString());
    body.put("id", request.correlationToken());
    return body;
  }
}
