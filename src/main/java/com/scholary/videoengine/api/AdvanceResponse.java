package com.scholary.videoengine.api;

import com.scholary.videoengine.scheduler.AdvanceResult;

public record AdvanceResponse(String entityId, AdvanceResult result) {}
