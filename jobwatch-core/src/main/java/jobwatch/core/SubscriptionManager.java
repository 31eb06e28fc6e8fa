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
import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import jobwatch.api.Resource;
import jobwatch.api.SnapshotCallback;
import jobwatch.api.Subscription;
import jobwatch.api.SubscriptionStatus;
import jobwatch.api.ratelimit.RateLimiter;
import jobwatch.api.stats.MemoryStats;
import jobwatch.api.stats.SubscriptionStats;
import jobwatch.api.stream.BackendStream;
import jobwatch.api.stream.StreamHandle;
import jobwatch.api.stream.StreamListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Multiplexes many in-process consumers of a job onto a single backend stream.
 *
 * <p>However many callbacks subscribe to the same resource id, at most one {@link StreamHandle}
 * is open for it. New subscribers of a live resource receive the cached snapshot synchronously.
 * Backend snapshots are debounced before they fan out; backend errors reach every callback at once
 * as {@code null}. When the last callback leaves, the stream is kept open for a grace period so that
 * a quick re-subscription reuses it.
 *
 * <h4>Threading</h4>
 *
 * Public calls, backend events and timer expirations are serialized by one lock. Callbacks are
 * invoked outside that lock, in registration order, each one isolated from the failures of the
 * others. Nothing in this class blocks on network I/O.
 *
 * <h4>Failure model</h4>
 *
 * Nothing is thrown across the public API in normal operation. A rate-limited or late subscription
 * resolves to an inert {@link Subscription} whose {@link Subscription#getStatus()} tells why.
 *
 * <p>One instance per process is usually managed through {@link SubscriptionManagers}; tests may
 * build as many as they need.
 */
@ThreadSafe
public final class SubscriptionManager implements AutoCloseable {

  private final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

  private final BackendStream backendStream;
  private final RateLimiter rateLimiter;
  private final SubscriptionManagerOptions options;
  private final Clock clock;

  private final ScheduledExecutorService scheduler;
  private final boolean ownScheduler;

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Map<String, SubscriptionEntry> entries = new HashMap<>();

  @GuardedBy("lock")
  private final List<ScheduledFuture<?>> intervals = new ArrayList<>(2);

  @GuardedBy("lock")
  private long nextRegistrationId = 1L;

  @GuardedBy("lock")
  private long lastCleanupTime;

  private volatile boolean shuttingDown;

  private final CallbackDispatcher dispatcher;
  private final DebounceScheduler debounceScheduler;
  private final CleanupScheduler cleanupScheduler;
  private final StatsReporter statsReporter = new StatsReporter();

  private final List<Consumer<SubscriptionManager>> shutdownListeners =
      new CopyOnWriteArrayList<>();

  private SubscriptionManager(Builder builder) {
    this.backendStream = builder.backendStream;
    this.rateLimiter = builder.rateLimiter;
    this.options = builder.options;
    this.clock = builder.clock;

    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownScheduler = false;
    } else {
      ScheduledThreadPoolExecutor executor =
          new ScheduledThreadPoolExecutor(
              1,
              new ThreadFactoryBuilder()
                  .setNameFormat("jobwatch-scheduler-%d")
                  .setDaemon(true)
                  .build());
      executor.setRemoveOnCancelPolicy(true);
      this.scheduler = executor;
      this.ownScheduler = true;
    }

    this.dispatcher = new CallbackDispatcher(() -> shuttingDown);
    this.debounceScheduler =
        new DebounceScheduler(
            scheduler, options.getDebounceDelay(), lock, dispatcher, clock::millis);
    this.cleanupScheduler =
        new CleanupScheduler(
            scheduler, options.getCleanupGracePeriod(), lock, this::destroyEntry, clock::millis);

    startIntervals();
  }

  public static Builder builder() {
    return new Builder();
  }

  private void startIntervals() {
    lock.lock();
    try {
      intervals.add(
          scheduleInterval("heartbeat", this::heartbeat, options.getHeartbeatInterval()));
      intervals.add(
          scheduleInterval("orphan sweep", this::sweepOrphans, options.getSweepInterval()));
    } finally {
      lock.unlock();
    }
  }

  private ScheduledFuture<?> scheduleInterval(String name, Runnable task, Duration period) {
    long nanos = period.toNanos();
    return scheduler.scheduleAtFixedRate(
        () -> {
          if (shuttingDown) return;
          try {
            task.run();
          } catch (RuntimeException e) {
            log.warn("Recurring {} task failed", name, e);
          }
        },
        nanos,
        nanos,
        TimeUnit.NANOSECONDS);
  }

  /** Subscribes with {@link SubscribeOptions#defaults()}. */
  @CanIgnoreReturnValue
  public Subscription subscribe(String resourceId, SnapshotCallback callback) {
    return subscribe(resourceId, callback, SubscribeOptions.defaults());
  }

  /**
   * Registers interest of {@code callback} in {@code resourceId}.
   *
   * <p>If the resource is already tracked, the callback joins the existing stream, any pending
   * teardown is cancelled, and the cached snapshot (if any) is delivered to the callback before
   * this method returns. Otherwise the rate limiter is consulted and, if it allows, one backend
   * stream is opened.
   *
   * @param resourceId The non-empty id of the resource.
   * @param callback The consumer of snapshots.
   * @param options Per-callback options.
   * @return The subscription handle. Its status is {@link SubscriptionStatus#ACTIVE} only if the
   *     callback was attached.
   */
  @CanIgnoreReturnValue
  public Subscription subscribe(
      String resourceId, SnapshotCallback callback, SubscribeOptions options) {
    checkArgument(!Strings.isNullOrEmpty(resourceId), "resourceId must not be empty");
    checkNotNull(callback, "callback");
    checkNotNull(options, "options");

    CallbackRegistration registration;
    SubscriptionEntry.Snapshot cached = null;

    lock.lock();
    try {
      if (shuttingDown) {
        log.warn("Ignoring subscription to [{}], manager is shutting down", resourceId);
        return ManagedSubscription.inert(resourceId, SubscriptionStatus.SHUTTING_DOWN);
      }

      long now = clock.millis();
      SubscriptionEntry entry = entries.get(resourceId);
      if (entry == null) {
        if (!rateLimiter.isAllowed(resourceId)) {
          log.warn(
              "Rate limit exceeded for resource [{}], try again in {} ms",
              resourceId,
              rateLimiter.getTimeUntilReset(resourceId).toMillis());
          return ManagedSubscription.inert(resourceId, SubscriptionStatus.RATE_LIMITED);
        }
        rateLimiter.recordRequest(resourceId);

        entry = openEntry(resourceId, now);
        if (entry == null) {
          return ManagedSubscription.inert(resourceId, SubscriptionStatus.FAILED);
        }
      } else {
        cleanupScheduler.cancel(entry);
        cached = entry.lastSnapshot;
      }

      registration = new CallbackRegistration(nextRegistrationId++, callback, options);
      entry.attach(registration);
      entry.touch(now);

      if (log.isDebugEnabled()) {
        log.debug(
            "Subscribed {} callback [{}] to resource [{}], callbacks: {}",
            options.getCallbackType(),
            registration.id(),
            resourceId,
            entry.callbackCount());
      }
    } finally {
      lock.unlock();
    }

    if (cached != null) {
      dispatcher.deliverCached(resourceId, registration, cached.value());
    }
    return ManagedSubscription.active(
        resourceId, registration::isActive, () -> detach(resourceId, registration));
  }

  @GuardedBy("lock")
  private SubscriptionEntry openEntry(String resourceId, long now) {
    SubscriptionEntry entry = new SubscriptionEntry(resourceId, now);
    // Registered before open() so that events delivered synchronously by the backend are kept.
    entries.put(resourceId, entry);
    try {
      entry.streamHandle = backendStream.open(resourceId, new EntryListener(entry));
    } catch (RuntimeException e) {
      log.warn("Failed to open backend stream for resource [{}]", resourceId, e);
      debounceScheduler.cancel(entry);
      entries.remove(resourceId, entry);
      return null;
    }
    if (log.isDebugEnabled()) {
      log.debug("Opened backend stream for resource [{}]", resourceId);
    }
    return entry;
  }

  private void detach(String resourceId, CallbackRegistration registration) {
    lock.lock();
    try {
      registration.deactivate();
      SubscriptionEntry entry = entries.get(resourceId);
      if (entry == null || !entry.detach(registration)) return;
      entry.touch(clock.millis());

      if (log.isDebugEnabled()) {
        log.debug(
            "Unsubscribed callback [{}] from resource [{}], remaining callbacks: {}",
            registration.id(),
            resourceId,
            entry.callbackCount());
      }
      if (!entry.hasCallbacks()) {
        cleanupScheduler.start(entry);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads the cached snapshot without side effects.
   *
   * @return The last value delivered by the backend, or {@code null} if the resource is not
   *     tracked, no snapshot arrived yet, or the resource was not found.
   */
  public Resource getCurrent(String resourceId) {
    lock.lock();
    try {
      SubscriptionEntry entry = entries.get(resourceId);
      return entry == null ? null : entry.currentValue();
    } finally {
      lock.unlock();
    }
  }

  public boolean hasActiveSubscribers(String resourceId) {
    lock.lock();
    try {
      SubscriptionEntry entry = entries.get(resourceId);
      return entry != null && entry.hasCallbacks();
    } finally {
      lock.unlock();
    }
  }

  public SubscriptionStats getStats() {
    lock.lock();
    try {
      return statsReporter.stats(entries.values(), rateLimiter.getStats(), shuttingDown);
    } finally {
      lock.unlock();
    }
  }

  public MemoryStats getMemoryStats() {
    lock.lock();
    try {
      return statsReporter.memoryStats(entries.values(), activeIntervalCount(), lastCleanupTime);
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private int activeIntervalCount() {
    int count = 0;
    for (ScheduledFuture<?> interval : intervals) {
      if (!interval.isDone()) count++;
    }
    return count;
  }

  public boolean isShuttingDown() {
    return shuttingDown;
  }

  public SubscriptionManagerOptions getOptions() {
    return options;
  }

  /**
   * Tears down every entry: closes its backend stream and cancels its timers. The manager stays
   * usable afterward. Safe to call repeatedly.
   */
  public void cleanup() {
    lock.lock();
    try {
      int count = entries.size();
      teardownEntries();
      lastCleanupTime = clock.millis();
      if (count > 0) {
        log.info("Cleaned up {} subscriptions", count);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Permanently stops this manager. Later subscriptions resolve to {@link
   * SubscriptionStatus#SHUTTING_DOWN}. If this instance is the process-wide one, the next {@link
   * SubscriptionManagers#getInstance()} builds a new manager. Idempotent.
   */
  public void shutdown() {
    lock.lock();
    try {
      if (shuttingDown) return;
      shuttingDown = true;

      log.info(
          "Shutting down subscription manager, final memory stats: {}",
          statsReporter.memoryStats(entries.values(), activeIntervalCount(), lastCleanupTime));

      teardownEntries();
      for (ScheduledFuture<?> interval : intervals) {
        interval.cancel(false);
      }
      intervals.clear();
    } finally {
      lock.unlock();
    }

    if (ownScheduler) {
      scheduler.shutdownNow();
    }
    for (Consumer<SubscriptionManager> listener : shutdownListeners) {
      listener.accept(this);
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  void addShutdownListener(Consumer<SubscriptionManager> listener) {
    shutdownListeners.add(listener);
  }

  @GuardedBy("lock")
  private void teardownEntries() {
    // Copy first, destroyEntry mutates the map.
    for (SubscriptionEntry entry : new ArrayList<>(entries.values())) {
      destroyEntry(entry);
    }
    entries.clear();
  }

  /** Cancels the entry's timers and stream and forgets it. Called with the lock held. */
  @GuardedBy("lock")
  private void destroyEntry(SubscriptionEntry entry) {
    debounceScheduler.cancel(entry);
    cleanupScheduler.cancel(entry);
    // In-flight fan-outs hold copies of the registrations; this silences them.
    entry.registrations().forEach(CallbackRegistration::deactivate);

    StreamHandle handle = entry.streamHandle;
    entry.streamHandle = null;
    if (handle != null) {
      try {
        handle.cancel();
      } catch (RuntimeException e) {
        log.warn("Error cancelling backend stream for resource [{}]", entry.resourceId, e);
      }
    }
    entries.remove(entry.resourceId, entry);

    if (log.isDebugEnabled()) {
      long now = clock.millis();
      log.debug(
          "Closed subscription for resource [{}] after {} ms, idle {} ms, errors observed: {}",
          entry.resourceId,
          now - entry.createdAt,
          now - entry.lastActivityAt,
          entry.errorCount);
    }
  }

  /**
   * Destroys entries that have no callbacks and whose grace timer is missing, or overdue by more
   * than the orphan threshold. An entry still inside its grace period is never swept, whatever the
   * threshold, and entries with callbacks are never touched.
   */
  @VisibleForTesting
  void sweepOrphans() {
    lock.lock();
    try {
      long now = clock.millis();
      long overdueAfter =
          options.getCleanupGracePeriod().toMillis() + options.getOrphanTimerThreshold().toMillis();
      List<SubscriptionEntry> orphans = new ArrayList<>();
      for (SubscriptionEntry entry : entries.values()) {
        if (entry.hasCallbacks()) continue;
        if (entry.cleanupTimer == null || now - entry.cleanupTimer.createdAt() > overdueAfter) {
          orphans.add(entry);
        }
      }
      orphans.forEach(this::destroyEntry);
      lastCleanupTime = now;
      if (!orphans.isEmpty()) {
        log.warn("Swept {} orphaned subscriptions", orphans.size());
      }
    } finally {
      lock.unlock();
    }
  }

  private void heartbeat() {
    MemoryStats stats = getMemoryStats();
    if (log.isDebugEnabled()) {
      log.debug("Memory stats: {}", stats);
    }
    if (stats.subscriptionsCount() > options.getSubscriptionWarnThreshold()) {
      log.warn("High subscription count: {}", stats.subscriptionsCount());
    }
    if (stats.debounceTimersCount() > options.getDebounceTimerWarnThreshold()) {
      log.warn("High debounce timer count: {}", stats.debounceTimersCount());
    }
    if (stats.cleanupTimersCount() > options.getCleanupTimerWarnThreshold()) {
      log.warn("High cleanup timer count: {}", stats.cleanupTimersCount());
    }
    if (stats.memoryUsageKb() > options.getMemoryWarnThresholdKb()) {
      log.warn("High estimated memory usage: {} KB", stats.memoryUsageKb());
    }
  }

  /** Routes backend events of one stream to its entry. Events of a torn-down entry are dropped. */
  private final class EntryListener implements StreamListener {

    private final SubscriptionEntry entry;

    EntryListener(SubscriptionEntry entry) {
      this.entry = entry;
    }

    @Override
    public void onSnapshot(Optional<Resource> value) {
      lock.lock();
      try {
        if (entries.get(entry.resourceId) != entry) return;
        entry.lastSnapshot = new SubscriptionEntry.Snapshot(value.orElse(null));
        entry.touch(clock.millis());
        debounceScheduler.start(entry);
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void onError(Throwable error) {
      List<CallbackRegistration> targets;
      lock.lock();
      try {
        if (entries.get(entry.resourceId) != entry) return;
        entry.errorCount++;
        targets = entry.registrations();
      } finally {
        lock.unlock();
      }
      log.warn(
          "Backend error for resource [{}], notifying {} callbacks",
          entry.resourceId,
          targets.size(),
          error);
      dispatcher.deliverError(entry.resourceId, targets);
    }
  }

  public static final class Builder {
    private BackendStream backendStream;
    private RateLimiter rateLimiter;
    private SubscriptionManagerOptions options = SubscriptionManagerOptions.defaults();
    private ScheduledExecutorService scheduler;
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    public Builder backendStream(BackendStream backendStream) {
      this.backendStream = checkNotNull(backendStream, "backendStream");
      return this;
    }

    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = checkNotNull(rateLimiter, "rateLimiter");
      return this;
    }

    public Builder options(SubscriptionManagerOptions options) {
      this.options = checkNotNull(options, "options");
      return this;
    }

    /**
     * Runs timers on {@code scheduler} instead of a private single-threaded one. A supplied
     * scheduler is not shut down by {@link SubscriptionManager#shutdown()}.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = checkNotNull(scheduler, "scheduler");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = checkNotNull(clock, "clock");
      return this;
    }

    public SubscriptionManager build() {
      checkState(backendStream != null, "backendStream is required");
      if (rateLimiter == null) {
        rateLimiter = RateLimiters.slidingWindow();
      }
      try {
        return new SubscriptionManager(this);
      } catch (RejectedExecutionException e) {
        throw new IllegalStateException("Scheduler does not accept tasks", e);
      }
    }
  }
}
