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

import java.util.concurrent.ScheduledFuture;

/**
 * A one-shot timer owned by a single {@link SubscriptionEntry}.
 *
 * <p>The handle is created before its task is scheduled so that the task can compare itself with
 * the handle currently stored on the entry. A task whose handle is no longer the entry's current
 * one has been cancelled or replaced and must not act.
 */
final class TimerHandle {

  private final long createdAt;
  private volatile ScheduledFuture<?> future;

  TimerHandle(long createdAt) {
    this.createdAt = createdAt;
  }

  void bind(ScheduledFuture<?> future) {
    this.future = future;
  }

  long createdAt() {
    return createdAt;
  }

  void cancel() {
    ScheduledFuture<?> f = future;
    if (f != null) {
      f.cancel(false);
    }
  }
}
