package jobwatch.core;

import jobwatch.api.ratelimit.RateLimiter;
import jobwatch.api.ratelimit.RateLimiterStats;

import java.time.Duration;

public final class RateLimiters {

  public static final int DEFAULT_MAX_REQUESTS = 10;
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private RateLimiters() {}

  /** 10 new streams per resource id per minute. */
  public static RateLimiter slidingWindow() {
    return new SlidingWindowRateLimiter(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW);
  }

  public static RateLimiter unlimited() {
    return Unlimited.INSTANCE;
  }

  private enum Unlimited implements RateLimiter {
    INSTANCE;

    @Override
    public boolean isAllowed(String key) {
      return true;
    }

    @Override
    public void recordRequest(String key) {}

    @Override
    public Duration getTimeUntilReset(String key) {
      return Duration.ZERO;
    }

    @Override
    public RateLimiterStats getStats() {
      return RateLimiterStats.empty();
    }
  }
}
