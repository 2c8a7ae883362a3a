package com.scholary.videoengine.pipeline;

import java.util.Arrays;
import java.util.Optional;

/** External processors that run pipeline stages and call back via webhook. */
public enum Provider {
  ELEVENLABS("elevenlabs"),
  NCA_TOOLKIT("nca-toolkit"),
  GOAPI("goapi");

  private final String pathName;

  Provider(String pathName) {
    this.pathName = pathName;
  }

  /** Name used in webhook paths and configuration keys. */
  public String pathName() {
    return pathName;
  }

  public static Optional<Provider> fromPathName(String name) {
    return Arrays.stream(values()).filter(p -> p.pathName.equalsIgnoreCase(name)).findFirst();
  }
}
