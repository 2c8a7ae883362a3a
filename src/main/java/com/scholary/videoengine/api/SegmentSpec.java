package com.scholary.videoengine.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/** One explicitly supplied segment of a new Video. */
public record SegmentSpec(
    @PositiveOrZero int sequenceIndex,
    @NotBlank String text,
    @NotBlank String backgroundMediaRef) {}
