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

/**
 * {@code BackendStream} is the seam between the subscription manager and the remote real-time
 * document store. It opens a push-based stream of snapshots for one resource id.
 *
 * <p>Implementations own transport concerns such as reconnection and backoff. A transient failure
 * should be reported through {@link StreamListener#onError(Throwable)} without closing the stream.
 *
 * <p>Listener methods may be invoked from any thread, including the thread calling {@link
 * #open(String, StreamListener)}.
 */
public interface BackendStream {

  /**
   * Opens a change stream for a single resource.
   *
   * @param resourceId The unique key of the resource to watch.
   * @param listener The listener receiving snapshots and errors for this resource.
   * @return A {@link StreamHandle} used to cancel the stream.
   */
  StreamHandle open(String resourceId, StreamListener listener);
}
