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

import jobwatch.api.ratelimit.RateLimiterStats;
import jobwatch.api.stats.MemoryStats;
import jobwatch.api.stats.ResourceStats;
import jobwatch.api.stats.SubscriptionStats;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Aggregates registry counters. Callers hold the manager lock; every method is a single pass over
 * the entries and has no side effects.
 */
final class StatsReporter {

  private static final long BYTES_PER_ENTRY = 1000;
  private static final long BYTES_PER_TIMER = 100;
  private static final long BYTES_PER_CALLBACK = 50;

  SubscriptionStats stats(
      Collection<SubscriptionEntry> entries, RateLimiterStats rateLimitStats, boolean shuttingDown) {
    int active = 0;
    int callbacks = 0;
    Map<String, ResourceStats> byResource = new HashMap<>();
    for (SubscriptionEntry entry : entries) {
      int count = entry.callbackCount();
      if (count > 0) active++;
      callbacks += count;
      byResource.put(entry.resourceId, new ResourceStats(count, entry.errorCount));
    }
    return new SubscriptionStats(
        entries.size(), active, callbacks, byResource, rateLimitStats, shuttingDown);
  }

  MemoryStats memoryStats(
      Collection<SubscriptionEntry> entries, int intervalCount, long lastCleanupTime) {
    int callbacks = 0;
    int debounceTimers = 0;
    int cleanupTimers = 0;
    for (SubscriptionEntry entry : entries) {
      callbacks += entry.callbackCount();
      if (entry.debounceTimer != null) debounceTimers++;
      if (entry.cleanupTimer != null) cleanupTimers++;
    }
    long estimatedBytes =
        entries.size() * BYTES_PER_ENTRY
            + (debounceTimers + cleanupTimers) * BYTES_PER_TIMER
            + callbacks * BYTES_PER_CALLBACK;
    return new MemoryStats(
        entries.size(),
        callbacks,
        debounceTimers,
        cleanupTimers,
        intervalCount,
        Math.round(estimatedBytes / 1024.0),
        lastCleanupTime);
  }
}
