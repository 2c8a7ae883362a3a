package com.scholary.videoengine.stage;

import com.scholary.videoengine.config.PipelineProperties;
import com.scholary.videoengine.pipeline.Provider;
import java.net.URI;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds the webhook URL a provider calls when an attempt finishes.
 *
 * <p>Format: {@code {webhookBaseUrl}/webhooks/{provider}?token={correlationToken}}. The token is
 * the only thing that ties a callback to its attempt.
 */
@Component
public class CallbackUrlFactory {

  public static final String TOKEN_PARAM = "token";

  private final String webhookBaseUrl;

  public CallbackUrlFactory(PipelineProperties properties) {
    this.webhookBaseUrl = properties.webhookBaseUrl();
  }

  public URI callbackUrl(Provider provider, String correlationToken) {
    return UriComponentsBuilder.fromHttpUrl(webhookBaseUrl)
        .pathSegment("webhooks", provider.pathName())
        .queryParam(TOKEN_PARAM, correlationToken)
        .build()
        .encode()
        .toUri();
  }
}
