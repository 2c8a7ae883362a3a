package com.scholary.videoengine.stage;

import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Everything a provider needs to run one stage attempt.
 *
 * <p>Inputs are already validated and ordered: background video then voiceover for media
 * combination, segment videos in sequence order for concatenation, concatenated video then music
 * track for the music mix.
 *
 * @param stage the stage to run
 * @param provider the provider that runs this request
 * @param entityId the owning Video or Segment
 * @param correlationToken the attempt's token, also embedded in {@code callbackUrl}
 * @param inputRefs ordered input artifact references
 * @param parameters stage parameters such as text, voice id or music prompt
 * @param callbackUrl where the provider posts its completion
 */
public record StageRequest(
    StageKind stage,
    Provider provider,
    String entityId,
    String correlationToken,
    List<String> inputRefs,
    Map<String, String> parameters,
    URI callbackUrl) {

  public static final String TEXT = "text";
  public static final String VOICE_ID = "voiceId";
  public static final String OUTPUT_NAME = "outputName";
  public static final String PROMPT = "prompt";
  public static final String DURATION_SECONDS = "durationSeconds";

  public StageRequest {
    inputRefs = List.copyOf(inputRefs);
    parameters = Map.copyOf(parameters);
  }

  public String parameter(String name) {
    return parameters.get(name);
  }
}
