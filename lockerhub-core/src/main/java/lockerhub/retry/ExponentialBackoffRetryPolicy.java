package lockerhub.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 * Jitter is off by default so kiosks see predictable schedules; when enabled the
 * delay is scaled by a random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 5_000L;
  public static final long DEFAULT_MAX_DELAY_MS = 3_600_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, false);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, false);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      whether to randomize each delay
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  /**
   * Returns a policy with the same cap and jitter but a different base delay,
   * used for per-call overrides of the base delay.
   */
  public ExponentialBackoffRetryPolicy withBaseDelayMs(long baseDelayMs) {
    return new ExponentialBackoffRetryPolicy(baseDelayMs, Math.max(baseDelayMs, maxDelayMs), jitter);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // overflow guard: anything past maxDelay/baseDelay is capped anyway
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (!jitter) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }
}
