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

import jobwatch.api.SnapshotCallback;
import jobwatch.api.Subscription;

import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/** Typed shortcuts for the common kinds of job consumers. */
public final class JobSubscriptions {

  private final SubscriptionManager manager;

  public JobSubscriptions(SubscriptionManager manager) {
    this.manager = checkNotNull(manager, "manager");
  }

  public Subscription subscribeToJob(String jobId, SnapshotCallback callback) {
    return manager.subscribe(jobId, callback);
  }

  public Subscription subscribeToProgress(String jobId, SnapshotCallback callback) {
    return manager.subscribe(
        jobId, callback, SubscribeOptions.of(CallbackType.PROGRESS, JobFilters.progress()));
  }

  public Subscription subscribeToPreview(String jobId, SnapshotCallback callback) {
    return manager.subscribe(
        jobId, callback, SubscribeOptions.of(CallbackType.PREVIEW, JobFilters.preview()));
  }

  public Subscription subscribeToFeatures(String jobId, SnapshotCallback callback) {
    return subscribeToFeatures(jobId, callback, List.of());
  }

  public Subscription subscribeToFeatures(
      String jobId, SnapshotCallback callback, Collection<String> featureNames) {
    return manager.subscribe(
        jobId,
        callback,
        SubscribeOptions.of(CallbackType.FEATURES, JobFilters.features(featureNames)));
  }
}
