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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Snapshot filters over job documents.
 *
 * <p>A job document carries a {@code status} string and optionally {@code progress}, {@code
 * features} (a list of documents with {@code name} or {@code id}), {@code cvData} and {@code
 * previewData}.
 */
public final class JobFilters {

  public static final String STATUS = "status";
  public static final String PROGRESS = "progress";
  public static final String FEATURES = "features";
  public static final String CV_DATA = "cvData";
  public static final String PREVIEW_DATA = "previewData";

  private JobFilters() {}

  /** Processing or completed jobs, or jobs reporting progress or features. Passes not-found. */
  public static Predicate<Resource> progress() {
    return job -> {
      if (job == null) return true;
      Object status = job.get(STATUS);
      return "processing".equals(status)
          || "completed".equals(status)
          || job.get(PROGRESS) != null
          || job.get(FEATURES) != null;
    };
  }

  /** Completed jobs, or jobs carrying CV or preview data. Passes not-found. */
  public static Predicate<Resource> preview() {
    return job -> {
      if (job == null) return true;
      Object status = job.get(STATUS);
      return "completed".equals(status)
          || job.get(CV_DATA) != null
          || job.get(PREVIEW_DATA) != null;
    };
  }

  /**
   * Jobs with features. If {@code featureNames} is not empty, only jobs having at least one of the
   * named features (matched by {@code name}, or {@code id} when unnamed) pass. Rejects not-found.
   */
  public static Predicate<Resource> features(Collection<String> featureNames) {
    Set<String> names = Set.copyOf(featureNames);
    return job -> {
      if (job == null) return false;
      Object raw = job.get(FEATURES);
      if (!(raw instanceof List<?> features) || features.isEmpty()) return false;
      if (names.isEmpty()) return true;
      for (Object feature : features) {
        if (feature instanceof Map<?, ?> f) {
          Object key = f.get("name") != null ? f.get("name") : f.get("id");
          if (key != null && names.contains(key.toString())) return true;
        }
      }
      return false;
    };
  }
}
