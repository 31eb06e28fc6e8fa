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
 * A consumer of job snapshots registered through a subscription manager.
 *
 * <p>The callback receives the latest known value of the resource, or {@code null} when the
 * resource does not exist or when the backend reported an error. A {@code null} should be read as
 * "temporarily unknown": callers that need to tell the two apart must query the backend
 * themselves.
 *
 * <p>Callbacks are invoked outside of any internal lock, so they may freely subscribe or
 * unsubscribe. An exception thrown by a callback is caught and logged; it never prevents delivery to
 * the other callbacks of the same resource.
 */
@FunctionalInterface
public interface SnapshotCallback {

  /**
   * Called with the most recent snapshot of the subscribed resource.
   *
   * @param value the current resource value, or {@code null} if unknown or not found
   */
  void onSnapshot(Resource value);
}
