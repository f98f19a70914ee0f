package com.scholary.dubbing.remote;

import com.scholary.dubbing.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks until an uploaded asset becomes usable by the remote service.
 *
 * <p>State machine:
 *
 * <pre>
 * PENDING --(interval elapses)--> re-query --> PENDING | ACTIVE | FAILED
 * </pre>
 *
 * <p>{@code ACTIVE} returns the refreshed handle. {@code FAILED} throws {@link
 * RemoteAssetFailedException} right away. Staying {@code PENDING} until the next interval would
 * overrun {@code maxWait} throws {@link RemoteAssetTimeoutException}.
 *
 * <p>The interval is fixed: the remote service processes uploads in a bounded, predictable time,
 * so backoff would only add latency. The wait blocks the calling thread and is not cancellable
 * except by interrupting that thread.
 */
public class RemoteAssetPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteAssetPoller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** Sleeps the calling thread. Replaced in tests to avoid real waiting. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final Duration defaultMaxWait;
  private final Duration defaultPollInterval;
  private final Clock clock;
  private final Sleeper sleeper;

  public RemoteAssetPoller(Duration defaultMaxWait, Duration defaultPollInterval) {
    this(
        defaultMaxWait,
        defaultPollInterval,
        Clock.systemUTC(),
        duration -> Thread.sleep(duration.toMillis()));
  }

  public RemoteAssetPoller(
      Duration defaultMaxWait, Duration defaultPollInterval, Clock clock, Sleeper sleeper) {
    requirePositive(defaultMaxWait, "maxWait");
    requirePositive(defaultPollInterval, "pollInterval");
    this.defaultMaxWait = defaultMaxWait;
    this.defaultPollInterval = defaultPollInterval;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /** Wait with the configured maximum wait and poll interval. */
  public RemoteAssetHandle waitUntilActive(
      RemoteAssetHandle handle, RemoteAssetStatusQuery statusQuery) {
    return waitUntilActive(handle, statusQuery, defaultMaxWait, defaultPollInterval);
  }

  /**
   * Wait until the asset is active.
   *
   * <p>The handle's own state counts as the first observation, so a handle that is already active
   * returns without querying.
   *
   * @param handle the uploaded asset
   * @param statusQuery fetches the asset's current state
   * @param maxWait total wall-clock budget
   * @param pollInterval fixed delay between queries
   * @return the handle with its state set to {@link RemoteAssetState#ACTIVE}
   * @throws RemoteAssetFailedException if the service reports a failure
   * @throws RemoteAssetTimeoutException if the asset is still pending when the budget runs out
   */
  public RemoteAssetHandle waitUntilActive(
      RemoteAssetHandle handle,
      RemoteAssetStatusQuery statusQuery,
      Duration maxWait,
      Duration pollInterval) {
    requirePositive(maxWait, "maxWait");
    requirePositive(pollInterval, "pollInterval");

    Instant startedAt = clock.instant();
    RemoteAssetState state = handle.state() == null ? RemoteAssetState.PENDING : handle.state();
    int attempt = 0;

    LOGGER.info(
        "Waiting for file to become active: name={}, state={}, maxWait={}, pollInterval={}",
        handle.name(),
        state,
        maxWait,
        pollInterval);

    while (state == RemoteAssetState.PENDING) {
      Duration elapsed = Duration.between(startedAt, clock.instant());
      if (elapsed.plus(pollInterval).compareTo(maxWait) > 0) {
        LOGGER.error(
            "File still pending after {} attempts: name={}, elapsed={}",
            attempt,
            handle.name(),
            elapsed);
        throw new RemoteAssetTimeoutException(handle.name(), elapsed);
      }

      try {
        sleeper.sleep(pollInterval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RemoteAssetTimeoutException(
            handle.name(), Duration.between(startedAt, clock.instant()), e);
      }

      state = statusQuery.queryStatus(handle);
      attempt++;
      structuredLogger.logAssetPoll(
          handle.name(),
          attempt,
          state.name(),
          Duration.between(startedAt, clock.instant()).toMillis());
    }

    if (state == RemoteAssetState.FAILED) {
      LOGGER.error("File failed to process: name={}, attempts={}", handle.name(), attempt);
      throw new RemoteAssetFailedException(handle.name());
    }

    LOGGER.info("File is active: name={}, attempts={}", handle.name(), attempt);
    return handle.withState(RemoteAssetState.ACTIVE);
  }

  private static void requirePositive(Duration duration, String name) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive: " + duration);
    }
  }
}
