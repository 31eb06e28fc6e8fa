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

import java.util.List;

/**
 * @param totalKeys Number of keys with recorded requests.
 * @param totalRequests Number of requests still inside their window, across all keys.
 * @param activeKeys Keys with at least one request inside its window.
 */
public record RateLimiterStats(int totalKeys, long totalRequests, List<String> activeKeys) {

  public RateLimiterStats {
    activeKeys = List.copyOf(activeKeys);
  }

  public static RateLimiterStats empty() {
    return new RateLimiterStats(0, 0L, List.of());
  }
}
