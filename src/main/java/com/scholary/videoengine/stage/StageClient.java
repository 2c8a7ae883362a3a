package com.scholary.videoengine.stage;

import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.pipeline.StageKind;
import java.util.Set;

/**
 * Uniform interface over the asynchronous media providers.
 *
 * <p>Implementations translate a {@link StageRequest} into the provider's request shape and return
 * as soon as the provider accepted it. They do not validate business rules and do not retry: the
 * scheduler owns the retry policy for every stage.
 */
public interface StageClient {

  Provider provider();

  Set<StageKind> supportedStages();

  /**
   * Submit a stage request.
   *
   * @param request the validated request, callback URL included
   * @return the provider's job id, or null if the provider does not return one
   * @throws StageDispatchException if the provider could not be reached or rejected the request
   */
  String dispatch(StageRequest request);
}
