package ai.docindexer.api;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared pause for all upload workers. When the service throttles one caller, every caller waits
 * out the same window before sending its next request.
 */
@Slf4j
public class RateLimitGate {
  private final Clock clock;
  private final Sleeper sleeper;
  private final ReentrantLock lock = new ReentrantLock();
  private long pausedUntilMillis;

  public RateLimitGate() {
    this(Clock.systemUTC(), new Sleeper.Default());
  }

  public RateLimitGate(@Nonnull Clock clock, @Nonnull Sleeper sleeper) {
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /** Extends the pause window; a shorter pause never shortens one already in effect. */
  public void pauseFor(long millis) {
    if (millis <= 0) {
      return;
    }
    lock.lock();
    try {
      long until = clock.millis() + millis;
      if (until > pausedUntilMillis) {
        pausedUntilMillis = until;
        log.warn("Throttled by search service, pausing uploads for {} ms", millis);
      }
    } finally {
      lock.unlock();
    }
  }

  public long remainingPauseMillis() {
    lock.lock();
    try {
      return Math.max(0, pausedUntilMillis - clock.millis());
    } finally {
      lock.unlock();
    }
  }

  /** Blocks until no pause is in effect. Returns the time spent waiting. */
  public long awaitClearance() throws InterruptedException {
    long waited = 0;
    long remaining = remainingPauseMillis();
    while (remaining > 0) {
      sleeper.sleep(remaining);
      waited += remaining;
      remaining = remainingPauseMillis();
    }
    return waited;
  }
}
