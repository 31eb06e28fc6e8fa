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
import jobwatch.api.stream.StreamHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookkeeping for one resource id: the open backend stream, the attached callbacks, the cached
 * snapshot and the timers.
 *
 * <p>Not thread safe. Every field is guarded by the owning manager's lock.
 */
final class SubscriptionEntry {

  /**
   * A snapshot received from the backend. A {@code null} value is an explicit "not found", which
   * differs from having no snapshot at all.
   */
  record Snapshot(Resource value) {}

  final String resourceId;
  final long createdAt;

  StreamHandle streamHandle;
  Snapshot lastSnapshot;
  int errorCount;
  TimerHandle debounceTimer;
  TimerHandle cleanupTimer;
  long lastActivityAt;

  private final Map<Long, CallbackRegistration> callbacks = new LinkedHashMap<>();

  SubscriptionEntry(String resourceId, long now) {
    this.resourceId = resourceId;
    this.createdAt = now;
    this.lastActivityAt = now;
  }

  void attach(CallbackRegistration registration) {
    callbacks.put(registration.id(), registration);
  }

  /**
   * @return {@code true} if the registration was attached to this entry.
   */
  boolean detach(CallbackRegistration registration) {
    return callbacks.remove(registration.id()) != null;
  }

  boolean hasCallbacks() {
    return !callbacks.isEmpty();
  }

  int callbackCount() {
    return callbacks.size();
  }

  /** Registrations in registration order, copied so they can be invoked outside the lock. */
  List<CallbackRegistration> registrations() {
    return new ArrayList<>(callbacks.values());
  }

  Resource currentValue() {
    return lastSnapshot == null ? null : lastSnapshot.value();
  }

  void touch(long now) {
    this.lastActivityAt = now;
  }
}
