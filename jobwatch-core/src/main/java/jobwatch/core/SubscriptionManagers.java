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
import jobwatch.api.JobWatchStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Holds the process-wide {@link SubscriptionManager}.
 *
 * <p>The composition root registers a factory with {@link #initialize(Supplier)}. The first {@link
 * #getInstance()} builds the manager and installs a JVM shutdown hook; the hook is installed once
 * per process and always shuts down whichever manager is current when the JVM exits. {@link
 * SubscriptionManager#shutdown()} clears the instance, so the next {@link #getInstance()} builds a
 * fresh one.
 */
public final class SubscriptionManagers {

  private static final Logger log = LoggerFactory.getLogger(SubscriptionManagers.class);

  private static final AtomicBoolean exitHookInstalled = new AtomicBoolean(false);

  private static Supplier<SubscriptionManager> factory;
  private static SubscriptionManager instance;

  private SubscriptionManagers() {}

  /**
   * Registers how the process-wide manager is built. Replacing the factory does not affect an
   * instance that already exists.
   */
  public static synchronized void initialize(Supplier<SubscriptionManager> managerFactory) {
    factory = checkNotNull(managerFactory, "managerFactory");
  }

  /**
   * @return The process-wide manager, built on first access.
   * @throws JobWatchStateException if no factory was registered.
   */
  public static synchronized SubscriptionManager getInstance() {
    if (instance == null) {
      if (factory == null) {
        throw new JobWatchStateException(
            "SubscriptionManagers.initialize(...) must be called before getInstance()");
      }
      SubscriptionManager manager = checkNotNull(factory.get(), "factory returned null");
      manager.addShutdownListener(SubscriptionManagers::release);
      instance = manager;
      installExitHook();
    }
    return instance;
  }

  /** Shuts down the current manager, if any. */
  public static void shutdown() {
    SubscriptionManager current;
    synchronized (SubscriptionManagers.class) {
      current = instance;
    }
    if (current != null) {
      current.shutdown();
    }
  }

  @VisibleForTesting
  public static boolean isExitHookInstalled() {
    return exitHookInstalled.get();
  }

  @VisibleForTesting
  static synchronized boolean hasInstance() {
    return instance != null;
  }

  private static synchronized void release(SubscriptionManager manager) {
    if (instance == manager) {
      instance = null;
    }
  }

  private static void installExitHook() {
    if (!exitHookInstalled.compareAndSet(false, true)) return;
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    shutdown();
                  } catch (RuntimeException e) {
                    log.warn("Error shutting down subscription manager on exit", e);
                  }
                },
                "jobwatch-shutdown-hook"));
  }
}
