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

import com.google.errorprone.annotations.concurrent.GuardedBy;
import jobwatch.api.Resource;
import jobwatch.api.SnapshotCallback;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One {@code subscribe} call: the callback, its options and whether it is still attached.
 *
 * <p>Deliveries to one registration are serialized on the registration. A cached snapshot replayed
 * on join is dropped if a live event already reached the registration, so the callback never sees
 * the older cached value after a newer snapshot or error.
 */
final class CallbackRegistration {

  private final long id;
  private final SnapshotCallback callback;
  private final SubscribeOptions options;
  private final AtomicBoolean active = new AtomicBoolean(true);

  @GuardedBy("this")
  private boolean seenLiveEvent;

  CallbackRegistration(long id, SnapshotCallback callback, SubscribeOptions options) {
    this.id = id;
    this.callback = callback;
    this.options = options;
  }

  long id() {
    return id;
  }

  CallbackType type() {
    return options.getCallbackType();
  }

  boolean isActive() {
    return active.get();
  }

  boolean deactivate() {
    return active.compareAndSet(true, false);
  }

  boolean accepts(Resource value) {
    return options.getFilter().map(f -> f.test(value)).orElse(true);
  }

  /**
   * Invokes the callback with a live event unless the registration was detached or, for snapshot
   * deliveries, its filter rejects the value. Exceptions of the filter or callback propagate.
   */
  synchronized void deliver(Resource value, boolean filtered) {
    seenLiveEvent = true;
    invoke(value, filtered);
  }

  /** Delivers the cached snapshot unless a live event got here first. */
  synchronized void replay(Resource value) {
    if (seenLiveEvent) return;
    invoke(value, true);
  }

  @GuardedBy("this")
  private void invoke(Resource value, boolean filtered) {
    if (!isActive()) return;
    if (filtered && !accepts(value)) return;
    callback.onSnapshot(value);
  }
}
