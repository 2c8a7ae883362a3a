package com.scholary.videoengine.api;

import com.scholary.videoengine.scheduler.AdvanceResult;
import com.scholary.videoengine.service.PipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for video generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating a Video from a script, optionally starting it straight away
 *   <li>Starting, nudging and cancelling
 *   <li>Reading a Video with its Segments
 * </ul>
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Videos", description = "Script to narrated video pipeline")
public class PipelineController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

  private final PipelineService pipelineService;

  public PipelineController(PipelineService pipelineService) {
    this.pipelineService = pipelineService;
  }

  @PostMapping("/videos")
  @Operation(
      summary = "Create a video",
      description =
          "Create a Video from a script. Segments are either given explicitly or derived from the "
              + "script at roughly the target duration each.")
  public ResponseEntity<VideoView> create(@Valid @RequestBody CreateVideoRequest request) {
    LOGGER.info(
        "Create video request: targetSegmentSeconds={}, explicitSegments={}, start={}",
        request.targetSegmentSeconds(),
        request.hasExplicitSegments(),
        request.start());
    return ResponseEntity.status(HttpStatus.CREATED).body(pipelineService.createVideo(request));
  }

  @PostMapping("/videos/{id}/start")
  @Operation(summary = "Start a video", description = "Dispatch the first stage of every segment")
  public VideoView start(@PathVariable String id) {
    return pipelineService.startVideo(id);
  }

  @PostMapping("/entities/{id}/advance")
  @Operation(
      summary = "Advance a video or segment",
      description = "Dispatch the next stage, retry an expired attempt, or report why it waits")
  public AdvanceResponse advance(@PathVariable String id) {
    AdvanceResult result = pipelineService.advance(id);
    return new AdvanceResponse(id, result);
  }

  @PostMapping("/videos/{id}/cancel")
  @Operation(summary = "Cancel a video", description = "Mark the video failed; no new stages run")
  public VideoView cancel(
      @PathVariable String id, @RequestParam(required = false) String reason) {
    return pipelineService.cancel(id, reason);
  }

  @GetMapping("/videos/{id}")
  @Operation(summary = "Get a video", description = "Video state, segments, artifacts and log link")
  public VideoView get(@PathVariable String id) {
    return pipelineService.describe(id);
  }
}
