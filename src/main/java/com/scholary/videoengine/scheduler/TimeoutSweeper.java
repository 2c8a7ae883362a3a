package com.scholary.videoengine.scheduler;

import com.scholary.videoengine.ledger.JobLedger;
import com.scholary.videoengine.logging.StructuredLogger;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically advances entities whose live attempt has passed its deadline.
 *
 * <p>This is the only path that recovers a lost webhook or a dispatch that needs retrying. Each
 * expired entity is advanced on the task executor; a failure on one is logged and counted.
 */
@Component
public class TimeoutSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutSweeper.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobLedger ledger;
  private final StageScheduler scheduler;
  private final Executor executor;
  private final Clock clock;

  public TimeoutSweeper(
      JobLedger ledger,
      StageScheduler scheduler,
      @Qualifier("taskExecutor") Executor executor,
      Clock clock) {
    this.ledger = ledger;
    this.scheduler = scheduler;
    this.executor = executor;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${pipeline.sweep.intervalMs}",
      initialDelayString = "${pipeline.sweep.intervalMs}")
  public void scheduledSweep() {
    sweepOnce();
  }

  /** Advance every entity with an expired attempt and wait for all of them. */
  public SweepResult sweepOnce() {
    List<String> expired = ledger.findExpiredAttempts(clock.instant());
    if (expired.isEmpty()) {
      LOGGER.debug("Timeout sweep tick: nothing expired");
      return new SweepResult(0, 0, 0);
    }

    AtomicInteger advanced = new AtomicInteger();
    AtomicInteger errors = new AtomicInteger();
    CompletableFuture<?>[] futures =
        expired.stream()
            .map(
                entityId ->
                    CompletableFuture.runAsync(
                        () -> {
                          try {
                            AdvanceResult result = scheduler.advance(entityId);
                            if (result != AdvanceResult.CONTENDED) {
                              advanced.incrementAndGet();
                            }
                          } catch (RuntimeException e) {
                            errors.incrementAndGet();
                            LOGGER.error("Sweep could not advance {}", entityId, e);
                          }
                        },
                        executor))
            .toArray(CompletableFuture[]::new);
    CompletableFuture.allOf(futures).join();

    structuredLogger.logSweep(expired.size(), advanced.get(), errors.get());
    return new SweepResult(expired.size(), advanced.get(), errors.get());
  }

  /** Counts from one sweep. */
  public record SweepResult(int expired, int advanced, int errors) {}
}
