package com.scholary.videoengine.stage;

import java.util.UUID;
import org.springframework.stereotype.Component;

/** Mints one opaque correlation token per dispatch attempt. */
@Component
public class CorrelationTokenGenerator {

  public String next() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
