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
 * The cancel handle of an opened {@link BackendStream}.
 *
 * <p>Once cancelled, the stream's listener receives no further events and any underlying
 * resources (e.g., database change stream registrations) are released.
 */
public interface StreamHandle extends AutoCloseable {

  void cancel();

  @Override
  default void close() {
    cancel();
  }
}
