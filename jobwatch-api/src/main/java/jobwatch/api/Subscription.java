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

package jobwatch.api;

/**
 * Represents the interest of one callback in one resource.
 *
 * <p>Subscriptions that were never attached (see {@link #getStatus()}) are inert: {@link
 * #unsubscribe()} on them does nothing and may be called any number of times.
 *
 * <p>This interface extends {@link AutoCloseable}, making it suitable for use in
 * try-with-resources statements.
 */
public interface Subscription extends AutoCloseable {

  /**
   * Detaches the callback from the resource. This operation is idempotent.
   *
   * <p>Detaching the last callback of a resource does not close the underlying backend stream
   * right away; the stream is kept for a grace period so that a quick re-subscription can reuse it.
   */
  void unsubscribe();

  /**
   * @return {@code true} while the callback is attached and has not been unsubscribed.
   */
  boolean isSubscribed();

  /**
   * @return The resource id this subscription was requested for.
   */
  String getResourceKey();

  /**
   * @return How the subscribe call was resolved.
   */
  SubscriptionStatus getStatus();

  /** Equivalent to {@link #unsubscribe()}. */
  @Override
  default void close() {
    unsubscribe();
  }
}
