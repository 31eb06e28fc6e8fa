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

/**
 * Cheap resource accounting of a subscription manager, meant to be polled.
 *
 * @param subscriptionsCount Entries in the registry.
 * @param callbacksCount Callbacks attached across all entries.
 * @param debounceTimersCount Debounce timers currently scheduled.
 * @param cleanupTimersCount Cleanup grace timers currently scheduled.
 * @param intervalCount Recurring tasks currently scheduled (heartbeat, sweep).
 * @param memoryUsageKb Rough estimate of the memory held by the registry.
 * @param lastCleanupTime Epoch millis of the last orphan sweep, {@code 0} if none ran yet.
 */
public record MemoryStats(
    int subscriptionsCount,
    int callbacksCount,
    int debounceTimersCount,
    int cleanupTimersCount,
    int intervalCount,
    long memoryUsageKb,
    long lastCleanupTime) {}
