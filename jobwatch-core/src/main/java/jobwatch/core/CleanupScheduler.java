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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Delays the teardown of an entry whose last callback left.
 *
 * <p>A callback attaching during the grace period cancels the timer and reuses the open stream and
 * the cached snapshot. When the timer fires with no callbacks attached, the entry is handed to the
 * expiry action, which runs under the manager lock.
 *
 * <p>{@link #start} and {@link #cancel} must be called while holding the manager lock.
 */
final class CleanupScheduler {

  private final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

  private final ScheduledExecutorService executor;
  private final Duration gracePeriod;
  private final Lock lock;
  private final Consumer<SubscriptionEntry> onExpired;
  private final LongSupplier clock;

  CleanupScheduler(
      ScheduledExecutorService executor,
      Duration gracePeriod,
      Lock lock,
      Consumer<SubscriptionEntry> onExpired,
      LongSupplier clock) {
    this.executor = executor;
    this.gracePeriod = gracePeriod;
    this.lock = lock;
    this.onExpired = onExpired;
    this.clock = clock;
  }

  void start(SubscriptionEntry entry) {
    cancel(entry);
    TimerHandle handle = new TimerHandle(clock.getAsLong());
    try {
      handle.bind(
          executor.schedule(
              () -> fire(entry, handle), gracePeriod.toNanos(), TimeUnit.NANOSECONDS));
      entry.cleanupTimer = handle;
    } catch (RejectedExecutionException e) {
      // Without a timer the entry would never be torn down.
      log.warn(
          "Scheduler rejected cleanup timer for resource [{}], expiring now",
          entry.resourceId,
          e);
      onExpired.accept(entry);
    }
  }

  void cancel(SubscriptionEntry entry) {
    if (entry.cleanupTimer != null) {
      entry.cleanupTimer.cancel();
      entry.cleanupTimer = null;
    }
  }

  private void fire(SubscriptionEntry entry, TimerHandle handle) {
    lock.lock();
    try {
      if (entry.cleanupTimer != handle) return;
      entry.cleanupTimer = null;
      if (entry.hasCallbacks()) return;

      if (log.isDebugEnabled()) {
        log.debug(
            "Grace period of {} elapsed for resource [{}], closing stream",
            gracePeriod,
            entry.resourceId);
      }
      onExpired.accept(entry);
    } finally {
      lock.unlock();
    }
  }
}
