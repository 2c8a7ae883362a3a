package com.scholary.videoengine.stage;

import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the {@link StageClient} of each provider.
 *
 * <p>Every stage must be runnable by its provider, and by its finishing provider where it has one.
 */
@Component
public class StageClientRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageClientRegistry.class);

  private final Map<Provider, StageClient> clients = new EnumMap<>(Provider.class);

  public StageClientRegistry(List<StageClient> stageClients) {
    for (StageClient client : stageClients) {
      StageClient previous = clients.put(client.provider(), client);
      if (previous != null) {
        throw new IllegalStateException("Two stage clients registered for " + client.provider());
      }
    }
    for (StageKind stage : StageKind.values()) {
      requireSupport(stage, stage.provider());
      if (stage.finishingProvider() != null) {
        requireSupport(stage, stage.finishingProvider());
      }
    }
    LOGGER.info("Registered stage clients: {}", clients.keySet());
  }

  /**
   * The client that runs {@code stage} for {@code provider}.
   *
   * @throws IllegalStateException if that provider does not run the stage
   */
  public StageClient clientFor(Provider provider, StageKind stage) {
    StageClient client = clients.get(provider);
    if (client == null || !client.supportedStages().contains(stage)) {
      throw new IllegalStateException(provider + " does not run stage " + stage);
    }
    return client;
  }

  private void requireSupport(StageKind stage, Provider provider) {
    StageClient client = clients.get(provider);
    if (client == null || !client.supportedStages().contains(stage)) {
      throw new IllegalStateException("No stage client registered for " + stage + " on " + provider);
    }
  }
}
