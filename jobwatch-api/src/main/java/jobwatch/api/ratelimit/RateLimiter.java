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

package jobwatch.api.ratelimit;

import java.time.Duration;

/**
 * Decides whether a new backend subscription may be opened for a key.
 *
 * <p>A rate limiter is a shared resource: several managers may consult the same instance.
 * Implementations are responsible for their own thread safety.
 */
public interface RateLimiter {

  /**
   * @param key The key of the request, usually a resource id.
   * @return {@code true} if a request for {@code key} is allowed right now.
   */
  boolean isAllowed(String key);

  /**
   * Records a request for {@code key}, consuming part of its allowance.
   *
   * @param key The key of the request.
   */
  void recordRequest(String key);

  /**
   * @param key The key of the request.
   * @return The time until a request for {@code key} would be allowed again, {@link
   *     Duration#ZERO} if it is allowed now.
   */
  Duration getTimeUntilReset(String key);

  /**
   * @return A point-in-time view of the limiter's bookkeeping.
   */
  RateLimiterStats getStats();
}
