/*
 * Copyright 2025 XueFeng Ma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jobwatch.core;

import com.google.common.base.MoreObjects;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tuning knobs of a {@link SubscriptionManager}.
 *
 * <p>The delays are tuning constants, not part of any protocol. The defaults suit UI consumers that
 * remount frequently and a backend that may burst several writes per second for a busy job.
 */
public final class SubscriptionManagerOptions {

  public static final Duration DEFAULT_DEBOUNCE_DELAY = Duration.ofMillis(100);
  public static final Duration DEFAULT_CLEANUP_GRACE_PERIOD = Duration.ofSeconds(30);
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);
  public static final Duration DEFAULT_ORPHAN_TIMER_THRESHOLD = Duration.ofMinutes(5);

  private final Duration debounceDelay;
  private final Duration cleanupGracePeriod;
  private final Duration heartbeatInterval;
  private final Duration sweepInterval;
  private final Duration orphanTimerThreshold;
  private final int subscriptionWarnThreshold;
  private final int debounceTimerWarnThreshold;
  private final int cleanupTimerWarnThreshold;
  private final long memoryWarnThresholdKb;

  private SubscriptionManagerOptions(Builder builder) {
    this.debounceDelay = builder.debounceDelay;
    this.cleanupGracePeriod = builder.cleanupGracePeriod;
    this.heartbeatInterval = builder.heartbeatInterval;
    this.sweepInterval = builder.sweepInterval;
    this.orphanTimerThreshold = builder.orphanTimerThreshold;
    this.subscriptionWarnThreshold = builder.subscriptionWarnThreshold;
    this.debounceTimerWarnThreshold = builder.debounceTimerWarnThreshold;
    this.cleanupTimerWarnThreshold = builder.cleanupTimerWarnThreshold;
    this.memoryWarnThresholdKb = builder.memoryWarnThresholdKb;
  }

  public static SubscriptionManagerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Duration getDebounceDelay() {
    return debounceDelay;
  }

  public Duration getCleanupGracePeriod() {
    return cleanupGracePeriod;
  }

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public Duration getOrphanTimerThreshold() {
    return orphanTimerThreshold;
  }

  public int getSubscriptionWarnThreshold() {
    return subscriptionWarnThreshold;
  }

  public int getDebounceTimerWarnThreshold() {
    return debounceTimerWarnThreshold;
  }

  public int getCleanupTimerWarnThreshold() {
    return cleanupTimerWarnThreshold;
  }

  public long getMemoryWarnThresholdKb() {
    return memoryWarnThresholdKb;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("debounceDelay", debounceDelay)
        .add("cleanupGracePeriod", cleanupGracePeriod)
        .add("heartbeatInterval", heartbeatInterval)
        .add("sweepInterval", sweepInterval)
        .add("orphanTimerThreshold", orphanTimerThreshold)
        .toString();
  }

  public static final class Builder {
    private Duration debounceDelay = DEFAULT_DEBOUNCE_DELAY;
    private Duration cleanupGracePeriod = DEFAULT_CLEANUP_GRACE_PERIOD;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
    private Duration orphanTimerThreshold = DEFAULT_ORPHAN_TIMER_THRESHOLD;
    private int subscriptionWarnThreshold = 100;
    private int debounceTimerWarnThreshold = 50;
    private int cleanupTimerWarnThreshold = 20;
    private long memoryWarnThresholdKb = 10 * 1024;

    private Builder() {}

    public Builder debounceDelay(Duration debounceDelay) {
      this.debounceDelay = nonNegative(debounceDelay, "debounceDelay");
      return this;
    }

    public Builder cleanupGracePeriod(Duration cleanupGracePeriod) {
      this.cleanupGracePeriod = nonNegative(cleanupGracePeriod, "cleanupGracePeriod");
      return this;
    }

    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = positive(heartbeatInterval, "heartbeatInterval");
      return this;
    }

    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = positive(sweepInterval, "sweepInterval");
      return this;
    }

    public Builder orphanTimerThreshold(Duration orphanTimerThreshold) {
      this.orphanTimerThreshold = nonNegative(orphanTimerThreshold, "orphanTimerThreshold");
      return this;
    }

    public Builder subscriptionWarnThreshold(int threshold) {
      checkArgument(threshold > 0, "subscriptionWarnThreshold must be positive");
      this.subscriptionWarnThreshold = threshold;
      return this;
    }

    public Builder debounceTimerWarnThreshold(int threshold) {
      checkArgument(threshold > 0, "debounceTimerWarnThreshold must be positive");
      this.debounceTimerWarnThreshold = threshold;
      return this;
    }

    public Builder cleanupTimerWarnThreshold(int threshold) {
      checkArgument(threshold > 0, "cleanupTimerWarnThreshold must be positive");
      this.cleanupTimerWarnThreshold = threshold;
      return this;
    }

    public Builder memoryWarnThresholdKb(long thresholdKb) {
      checkArgument(thresholdKb > 0, "memoryWarnThresholdKb must be positive");
      this.memoryWarnThresholdKb = thresholdKb;
      return this;
    }

    public SubscriptionManagerOptions build() {
      return new SubscriptionManagerOptions(this);
    }

    private static Duration nonNegative(Duration d, String name) {
      checkNotNull(d, name);
      checkArgument(!d.isNegative(), "%s must not be negative: %s", name, d);
      return d;
    }

    private static Duration positive(Duration d, String name) {
      checkNotNull(d, name);
      checkArgument(!d.isNegative() && !d.isZero(), "%s must be positive: %s", name, d);
      return d;
    }
  }
}
