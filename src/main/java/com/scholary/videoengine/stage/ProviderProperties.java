package com.scholary.videoengine.stage;

import com.scholary.videoengine.pipeline.Provider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the three providers.
 *
 * <p>These map to the "providers.*" keys in application.yml. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "providers")
@Validated
public record ProviderProperties(
    @Valid @NotNull ElevenLabs elevenlabs,
    @Valid @NotNull NcaToolkit ncaToolkit,
    @Valid @NotNull GoApi goapi) {

  public Webhook webhookFor(Provider provider) {
    return switch (provider) {
      case ELEVENLABS -> elevenlabs.webhook();
      case NCA_TOOLKIT -> ncaToolkit.webhook();
      case GOAPI -> goapi.webhook();
    };
  }

  /** Shared HTTP connection settings. */
  public record Connection(
      @NotBlank String baseUrl,
      String apiKey,
      @Positive int connectTimeout,
      @Positive int readTimeout) {}

  /**
   * Inbound webhook settings.
   *
   * @param signatureHeader header carrying the hex HMAC-SHA256 of the raw body
   * @param signatureSecret shared secret; verification is skipped when {@code verifySignature} is
   *     false
   * @param mirrorArtifacts copy the produced artifact into our own object store
   */
  public record Webhook(
      boolean verifySignature,
      String signatureHeader,
      String signatureSecret,
      boolean mirrorArtifacts) {}

  public record ElevenLabs(
      @Valid @NotNull Connection connection,
      @Valid @NotNull Webhook webhook,
      @NotBlank String modelId,
      double stability,
      double similarityBoost) {}

  public record NcaToolkit(@Valid @NotNull Connection connection, @Valid @NotNull Webhook webhook) {}

  public record GoApi(
      @Valid @NotNull Connection connection,
      @Valid @NotNull Webhook webhook,
      @NotBlank String model,
      String defaultPrompt) {}
}
