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

package jobwatch.api.stream;

import jobwatch.api.Resource;

import java.util.Optional;

/** Receives the events of one opened {@link BackendStream}. */
public interface StreamListener {

  /**
   * Called with the current state of the resource.
   *
   * @param value The resource, or an empty {@link Optional} if it does not exist.
   */
  void onSnapshot(Optional<Resource> value);

  /**
   * Called when the backend failed to deliver an update. The stream stays open.
   *
   * @param error The failure reported by the backend.
   */
  void onError(Throwable error);
}
