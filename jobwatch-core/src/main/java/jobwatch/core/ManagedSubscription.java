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

import jobwatch.api.Subscription;
import jobwatch.api.SubscriptionStatus;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

final class ManagedSubscription implements Subscription {

  private static final Runnable NO_OP = () -> {};

  private final String resourceKey;
  private final SubscriptionStatus status;
  private final AtomicBoolean subscribed;
  private final BooleanSupplier attached;
  private final Runnable unsubscribeAction;

  private ManagedSubscription(
      String resourceKey,
      SubscriptionStatus status,
      boolean subscribed,
      BooleanSupplier attached,
      Runnable unsubscribeAction) {
    this.resourceKey = resourceKey;
    this.status = status;
    this.subscribed = new AtomicBoolean(subscribed);
    this.attached = attached;
    this.unsubscribeAction = unsubscribeAction;
  }

  /**
   * @param attached Whether the manager still holds the callback. Turns false when the manager
   *     tears the resource down on its own, through {@code cleanup()} or {@code shutdown()}.
   */
  static ManagedSubscription active(
      String resourceKey, BooleanSupplier attached, Runnable unsubscribeAction) {
    return new ManagedSubscription(
        resourceKey, SubscriptionStatus.ACTIVE, true, attached, unsubscribeAction);
  }

  /** A subscription that was never attached. Unsubscribing it does nothing. */
  static ManagedSubscription inert(String resourceKey, SubscriptionStatus status) {
    return new ManagedSubscription(resourceKey, status, false, () -> false, NO_OP);
  }

  @Override
  public void unsubscribe() {
    if (subscribed.compareAndSet(true, false)) {
      unsubscribeAction.run();
    }
  }

  @Override
  public boolean isSubscribed() {
    return subscribed.get() && attached.getAsBoolean();
  }

  @Override
  public String getResourceKey() {
    return resourceKey;
  }

  @Override
  public SubscriptionStatus getStatus() {
    return status;
  }
}
