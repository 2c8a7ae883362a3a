package com.scholary.videoengine.api;

import com.scholary.videoengine.service.ScriptSegmenter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request to create a Video.
 *
 * <p>Either {@code segments} is given explicitly, or the script is split by {@link
 * ScriptSegmenter} and every segment uses {@code defaultBackgroundMediaRef}.
 */
public record CreateVideoRequest(
    @NotBlank String script,
    @Positive @Max(600) int targetSegmentSeconds,
    @NotBlank String voiceId,
    String musicPrompt,
    String defaultBackgroundMediaRef,
    ScriptSegmenter.Mode segmentationMode,
    List<@Valid SegmentSpec> segments,
    boolean start) {

  public boolean hasExplicitSegments() {
    return segments != null && !segments.isEmpty();
  }
}
