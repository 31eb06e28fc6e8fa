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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import jobwatch.api.ratelimit.RateLimiter;
import jobwatch.api.ratelimit.RateLimiterStats;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Allows at most {@code maxRequests} recorded requests per key inside a sliding {@code window}.
 *
 * <p>Time is read from a Guava {@link Ticker}, so tests can drive the window deterministically.
 *
 * <p>A key is forgotten once its window is empty. Keys that are never asked about again are purged
 * by {@link #recordRequest}, at most once per window, so memory is bounded by the keys active in
 * the last two windows.
 */
@ThreadSafe
public final class SlidingWindowRateLimiter implements RateLimiter {

  private final int maxRequests;
  private final long windowNanos;
  private final Ticker ticker;

  @GuardedBy("this")
  private final Map<String, Deque<Long>> requests = new HashMap<>();

  @GuardedBy("this")
  private long lastPurgeNanos;

  public SlidingWindowRateLimiter(int maxRequests, Duration window) {
    this(maxRequests, window, Ticker.systemTicker());
  }

  public SlidingWindowRateLimiter(int maxRequests, Duration window, Ticker ticker) {
    checkArgument(maxRequests > 0, "maxRequests must be positive: %s", maxRequests);
    checkNotNull(window, "window");
    checkArgument(!window.isNegative() && !window.isZero(), "window must be positive: %s", window);
    this.maxRequests = maxRequests;
    this.windowNanos = window.toNanos();
    this.ticker = checkNotNull(ticker, "ticker");
    this.lastPurgeNanos = ticker.read();
  }

  @Override
  public synchronized boolean isAllowed(String key) {
    Deque<Long> timestamps = liveRequests(key, ticker.read());
    return timestamps == null || timestamps.size() < maxRequests;
  }

  @Override
  public synchronized void recordRequest(String key) {
    long now = ticker.read();
    purgeExpired(now);
    Deque<Long> timestamps = requests.computeIfAbsent(key, k -> new ArrayDeque<>());
    evictExpired(timestamps, now);
    timestamps.addLast(now);
  }

  @Override
  public synchronized Duration getTimeUntilReset(String key) {
    long now = ticker.read();
    Deque<Long> timestamps = liveRequests(key, now);
    if (timestamps == null || timestamps.size() < maxRequests) return Duration.ZERO;
    // The oldest request leaving the window frees one slot.
    return Duration.ofNanos(timestamps.peekFirst() + windowNanos - now);
  }

  @Override
  public synchronized RateLimiterStats getStats() {
    long now = ticker.read();
    long total = 0;
    List<String> active = new ArrayList<>();
    Iterator<Map.Entry<String, Deque<Long>>> it = requests.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Deque<Long>> e = it.next();
      evictExpired(e.getValue(), now);
      if (e.getValue().isEmpty()) {
        it.remove();
        continue;
      }
      total += e.getValue().size();
      active.add(e.getKey());
    }
    return new RateLimiterStats(requests.size(), total, active);
  }

  /** Number of keys currently held, expired or not. */
  @VisibleForTesting
  public synchronized int trackedKeys() {
    return requests.size();
  }

  /** The unexpired requests of {@code key}, or {@code null} after forgetting an empty key. */
  @GuardedBy("this")
  private Deque<Long> liveRequests(String key, long now) {
    Deque<Long> timestamps = requests.get(key);
    if (timestamps == null) return null;
    evictExpired(timestamps, now);
    if (timestamps.isEmpty()) {
      requests.remove(key);
      return null;
    }
    return timestamps;
  }

  @GuardedBy("this")
  private void purgeExpired(long now) {
    if (now - lastPurgeNanos < windowNanos) return;
    lastPurgeNanos = now;
    Iterator<Deque<Long>> it = requests.values().iterator();
    while (it.hasNext()) {
      Deque<Long> timestamps = it.next();
      evictExpired(timestamps, now);
      if (timestamps.isEmpty()) it.remove();
    }
  }

  private void evictExpired(Deque<Long> timestamps, long now) {
    while (!timestamps.isEmpty() && now - timestamps.peekFirst() >= windowNanos) {
      timestamps.pollFirst();
    }
  }
}
