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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Per-callback options of {@link SubscriptionManager#subscribe(String,
 * jobwatch.api.SnapshotCallback, SubscribeOptions)}.
 *
 * <p>A filter decides, for every snapshot, whether the callback wants it. The filter receives
 * {@code null} for a not-found snapshot. Error notifications bypass filters.
 */
public final class SubscribeOptions {

  private static final SubscribeOptions DEFAULTS = new SubscribeOptions(CallbackType.GENERAL, null);

  private final CallbackType callbackType;
  private final Predicate<Resource> filter;

  private SubscribeOptions(CallbackType callbackType, Predicate<Resource> filter) {
    this.callbackType = callbackType;
    this.filter = filter;
  }

  public static SubscribeOptions defaults() {
    return DEFAULTS;
  }

  public static SubscribeOptions of(CallbackType callbackType, Predicate<Resource> filter) {
    return new SubscribeOptions(Objects.requireNonNull(callbackType, "callbackType"), filter);
  }

  public CallbackType getCallbackType() {
    return callbackType;
  }

  public Optional<Predicate<Resource>> getFilter() {
    return Optional.ofNullable(filter);
  }
}
