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

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * The single place where consumer callbacks are invoked.
 *
 * <p>Each invocation is isolated: an exception thrown by one callback (or by its filter) is logged
 * and delivery continues with the next one. Registrations that were detached after the target list
 * was taken are skipped, so a consumer never hears from a resource after its unsubscribe returned.
 */
final class CallbackDispatcher {

  private final Logger log = LoggerFactory.getLogger(CallbackDispatcher.class);

  private final BooleanSupplier shuttingDown;

  CallbackDispatcher(BooleanSupplier shuttingDown) {
    this.shuttingDown = shuttingDown;
  }

  /**
   * Delivers a snapshot. Callbacks whose filter rejects the value are skipped.
   *
   * @param resourceId The resource the value belongs to, for logging.
   * @param targets The registrations to notify, in registration order.
   * @param value The value to deliver, {@code null} for not found.
   */
  void deliverSnapshot(String resourceId, List<CallbackRegistration> targets, Resource value) {
    deliver(resourceId, targets, value, true);
  }

  /**
   * Hands the cached snapshot to a registration that just joined. Skipped if a live event reached
   * the registration first.
   */
  void deliverCached(String resourceId, CallbackRegistration registration, Resource value) {
    if (shuttingDown.getAsBoolean()) return;
    try {
      registration.replay(value);
    } catch (RuntimeException e) {
      logFailure(resourceId, registration, e);
    }
  }

  /** Tells every target that the last known value may be stale. Filters are not consulted. */
  void deliverError(String resourceId, List<CallbackRegistration> targets) {
    deliver(resourceId, targets, null, false);
  }

  private void deliver(
      String resourceId, List<CallbackRegistration> targets, Resource value, boolean filtered) {
    for (CallbackRegistration registration : targets) {
      if (shuttingDown.getAsBoolean()) return;
      if (!registration.isActive()) continue;
      try {
        registration.deliver(value, filtered);
      } catch (RuntimeException e) {
        logFailure(resourceId, registration, e);
      }
    }
  }

  private void logFailure(String resourceId, CallbackRegistration registration, Exception e) {
    log.warn(
        "Callback [{}] of type {} failed for resource [{}]",
        registration.id(),
        registration.type(),
        resourceId,
        e);
  }
}
