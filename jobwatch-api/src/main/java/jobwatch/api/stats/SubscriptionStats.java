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

package jobwatch.api.stats;

import jobwatch.api.ratelimit.RateLimiterStats;

import java.util.Map;

/**
 * A snapshot of the subscription registry.
 *
 * @param totalSubscriptions Entries in the registry, including those in their grace period.
 * @param activeSubscriptions Entries with at least one attached callback.
 * @param totalCallbacks Callbacks attached across all entries.
 * @param subscriptionsByResource Counters keyed by resource id.
 * @param rateLimitStats The rate limiter's own statistics.
 * @param shuttingDown Whether the manager refuses new subscriptions.
 */
public record SubscriptionStats(
    int totalSubscriptions,
    int activeSubscriptions,
    int totalCallbacks,
    Map<String, ResourceStats> subscriptionsByResource,
    RateLimiterStats rateLimitStats,
    boolean shuttingDown) {

  public SubscriptionStats {
    subscriptionsByResource = Map.copyOf(subscriptionsByResource);
  }
}
