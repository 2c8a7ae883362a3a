package com.scholary.videoengine.config;

import com.scholary.videoengine.pipeline.StageKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline orchestrator.
 *
 * <p>Per-stage budgets are keyed by {@link StageKind#key()} ({@code voice}, {@code media}, {@code
 * concat}, {@code music}).
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String webhookBaseUrl,
    @NotNull Map<String, @Valid StageBudget> stages,
    @Valid @NotNull RetryProperties retry,
    @Valid @NotNull SweepProperties sweep,
    @Valid @NotNull DedupProperties dedup) {

  public record StageBudget(@Positive int maxAttempts, @NotNull Duration timeout) {}

  public record RetryProperties(@NotNull Duration initialBackoff, @NotNull Duration maxBackoff) {}

  public record SweepProperties(@Positive long intervalMs) {}

  public record DedupProperties(@Positive int maxSize, @NotNull Duration ttl) {}

  /**
   * Budget for a stage.
   *
   * @throws IllegalStateException if the stage has no configured budget
   */
  public StageBudget budgetFor(StageKind stage) {
    StageBudget budget = stages.get(stage.key());
    if (budget == null) {
      throw new IllegalStateException("No budget configured for stage " + stage.key());
    }
    return budget;
  }

  /** Backoff before retrying a failed dispatch: doubles per attempt, capped at the maximum. */
  public Duration backoffFor(int attemptNumber) {
    long factor = 1L << Math.min(Math.max(attemptNumber - 1, 0), 16);
    Duration backoff = retry.initialBackoff().multipliedBy(factor);
    return backoff.compareTo(retry.maxBackoff()) > 0 ? retry.maxBackoff() : backoff;
  }
}
