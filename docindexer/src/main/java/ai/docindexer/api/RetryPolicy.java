package ai.docindexer.api;

import com.google.common.base.Preconditions;
import java.util.Random;
import lombok.Getter;
import lombok.ToString;

/**
 * Exponential backoff with jitter: the delay after attempt {@code n} is {@code base * 2^n} plus or
 * minus up to half of itself, capped at {@code maxDelayMillis}. A server supplied retry-after
 * value is used as a floor.
 */
@Getter
@ToString
public class RetryPolicy {
  private final int maxAttempts;
  private final long baseDelayMillis;
  private final long maxDelayMillis;
  @ToString.Exclude private final Random random;

  public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {
    this(maxAttempts, baseDelayMillis, maxDelayMillis, new Random());
  }

  public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis, Random random) {
    Preconditions.checkArgument(maxAttempts > 0, "maxAttempts must be positive");
    Preconditions.checkArgument(baseDelayMillis >= 0, "baseDelayMillis must not be negative");
    Preconditions.checkArgument(
        maxDelayMillis >= baseDelayMillis, "maxDelayMillis must be at least baseDelayMillis");
    this.maxAttempts = maxAttempts;
    this.baseDelayMillis = baseDelayMillis;
    this.maxDelayMillis = maxDelayMillis;
    this.random = random;
  }

  public boolean canRetry(int attempt) {
    return attempt < maxAttempts;
  }

  public long delayForAttempt(int attempt) {
    return delayForAttempt(attempt, 0);
  }

  public long delayForAttempt(int attempt, long retryAfterMillis) {
    // Exponential backoff with jitter and upper bound
    long delay = (long) (baseDelayMillis * Math.pow(2, attempt));
    long jitter = (long) (random.nextDouble() * delay) - (delay / 2);
    long bounded = Math.min(delay + jitter, maxDelayMillis);
    return Math.max(bounded, retryAfterMillis);
  }
}
