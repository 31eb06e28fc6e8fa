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

import jobwatch.api.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.LongSupplier;

/**
 * Coalesces bursts of backend snapshots for one entry into a single fan-out.
 *
 * <p>Every snapshot restarts the entry's debounce timer. When the timer fires, the callbacks
 * attached at that moment receive the entry's latest snapshot; intermediate values are dropped.
 *
 * <p>{@link #start} and {@link #cancel} must be called while holding the manager lock.
 */
final class DebounceScheduler {

  private final Logger log = LoggerFactory.getLogger(DebounceScheduler.class);

  private final ScheduledExecutorService executor;
  private final Duration delay;
  private final Lock lock;
  private final CallbackDispatcher dispatcher;
  private final LongSupplier clock;

  DebounceScheduler(
      ScheduledExecutorService executor,
      Duration delay,
      Lock lock,
      CallbackDispatcher dispatcher,
      LongSupplier clock) {
    this.executor = executor;
    this.delay = delay;
    this.lock = lock;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  void start(SubscriptionEntry entry) {
    cancel(entry);
    TimerHandle handle = new TimerHandle(clock.getAsLong());
    try {
      handle.bind(
          executor.schedule(() -> fire(entry, handle), delay.toNanos(), TimeUnit.NANOSECONDS));
      entry.debounceTimer = handle;
    } catch (RejectedExecutionException e) {
      log.warn("Scheduler rejected debounce timer for resource [{}]", entry.resourceId, e);
    }
  }

  void cancel(SubscriptionEntry entry) {
    if (entry.debounceTimer != null) {
      entry.debounceTimer.cancel();
      entry.debounceTimer = null;
    }
  }

  private void fire(SubscriptionEntry entry, TimerHandle handle) {
    List<CallbackRegistration> targets;
    Resource value;
    lock.lock();
    try {
      // Cancelled or superseded after the task was already running.
      if (entry.debounceTimer != handle) return;
      entry.debounceTimer = null;
      targets = entry.registrations();
      value = entry.currentValue();
    } finally {
      lock.unlock();
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "Fan-out for resource [{}] to {} callbacks, found: {}",
          entry.resourceId,
          targets.size(),
          value != null);
    }
    dispatcher.deliverSnapshot(entry.resourceId, targets, value);
  }
}
