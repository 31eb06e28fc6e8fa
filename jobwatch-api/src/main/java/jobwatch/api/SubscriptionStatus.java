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

/** Outcome of a subscribe call. */
public enum SubscriptionStatus {

  /** The callback is attached and will receive snapshots. */
  ACTIVE,

  /** The rate limiter denied opening a new stream. Nothing was attached; retry later. */
  RATE_LIMITED,

  /** The manager is shutting down. Nothing was attached. */
  SHUTTING_DOWN,

  /** The backend refused to open a stream. Nothing was attached. */
  FAILED
}
