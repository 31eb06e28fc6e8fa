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
package jobwatch.storage.mongo;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import com.mongodb.MongoException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.OperationType;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import jobwatch.api.Resource;
import jobwatch.api.stream.BackendStream;
import jobwatch.api.stream.StreamHandle;
import jobwatch.api.stream.StreamListener;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.mongodb.client.model.Aggregates.match;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.in;
import static java.util.Collections.singletonList;

/**
 * A {@link BackendStream} over the change stream of a MongoDB job collection.
 *
 * <p>One change stream cursor is shared by every opened resource. A daemon thread reads it and
 * demultiplexes each change by {@code _id} to the listeners registered for that id. Opening a
 * stream also looks up the current document in the background, so the listener gets a first
 * snapshot without waiting for a write.
 *
 * <p>Cursor failures are reported to every open listener through {@link
 * StreamListener#onError(Throwable)}; the cursor is then re-established with exponential backoff,
 * resuming after the last seen change when possible. Listeners stay registered across reconnects.
 *
 * <p>Change streams require a replica set or a sharded cluster.
 */
public class MongoBackendStream implements BackendStream, AutoCloseable {

  private static final Duration MAX_AWAIT = Duration.ofSeconds(1);

  private final Logger log = LoggerFactory.getLogger(MongoBackendStream.class);

  private final MongoCollection<Document> collection;

  private final Map<String, List<Registration>> listenerRegistry = new ConcurrentHashMap<>();

  private final RetryPolicy<MongoChangeStreamCursor<ChangeStreamDocument<Document>>> reconnectPolicy;
  private final RetryPolicy<Document> lookupPolicy;

  private final ExecutorService lookupExecutor;
  private final Thread watcherThread;

  private volatile boolean closed;
  private BsonDocument resumeToken;

  @MustBeClosed
  public MongoBackendStream(MongoClient mongoClient, String db, String collectionName) {
    this.collection = mongoClient.getDatabase(db).getCollection(collectionName);

    this.reconnectPolicy =
        RetryPolicy.<MongoChangeStreamCursor<ChangeStreamDocument<Document>>>builder()
            .handle(MongoException.class)
            .withBackoff(Duration.ofMillis(200), Duration.ofSeconds(10))
            .withMaxRetries(-1)
            .abortIf((cursor, e) -> closed)
            .onFailedAttempt(
                event ->
                    log.warn(
                        "Failed to open change stream on [{}]",
                        collectionName,
                        event.getLastException()))
            .build();

    this.lookupPolicy =
        RetryPolicy.<Document>builder()
            .handle(MongoSocketException.class, MongoTimeoutException.class)
            .withDelay(Duration.ofMillis(100))
            .withMaxRetries(3)
            .build();

    this.lookupExecutor =
        Executors.newFixedThreadPool(
            2,
            new ThreadFactoryBuilder()
                .setNameFormat("jobwatch-mongo-lookup-%d")
                .setDaemon(true)
                .build());

    this.watcherThread = new Thread(this::demultiplexerLoop, "jobwatch-change-demultiplexer");
    this.watcherThread.setDaemon(true);
    this.watcherThread.start();
  }

  @Override
  public StreamHandle open(String resourceId, StreamListener listener) {
    Registration registration = new Registration(listener);
    listenerRegistry
        .computeIfAbsent(resourceId, k -> new CopyOnWriteArrayList<>())
        .add(registration);

    try {
      lookupExecutor.execute(() -> initialLookup(resourceId, registration));
    } catch (RejectedExecutionException e) {
      // Closed store: the listener simply never hears anything.
      log.warn("Initial lookup of [{}] rejected, stream is closed", resourceId);
    }

    return new MongoStreamHandle(
        resourceId,
        () -> {
          registration.live = false;
          listenerRegistry.computeIfPresent(
              resourceId,
              (k, v) -> {
                v.remove(registration);
                return v.isEmpty() ? null : v;
              });
        });
  }

  private void initialLookup(String resourceId, Registration registration) {
    Document document;
    try {
      document =
          Failsafe.with(lookupPolicy).get(() -> collection.find(eq("_id", resourceId)).first());
    } catch (MongoException e) {
      if (registration.live) {
        registration.error(resourceId, e);
      }
      return;
    }
    registration.lookedUp(resourceId, Optional.ofNullable(document).map(BsonResource::new));
  }

  private void demultiplexerLoop() {
    while (!closed && !Thread.currentThread().isInterrupted()) {
      MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor = reopenCursor();
      if (cursor == null) continue;

      try (cursor) {
        while (!closed) {
          ChangeStreamDocument<Document> change = cursor.tryNext();
          if (change == null) continue;
          resumeToken = change.getResumeToken();
          dispatch(change);
        }
      } catch (MongoInterruptedException e) {
        if (closed) break;
        log.warn("Change stream interrupted", e);
      } catch (MongoException e) {
        if (closed) break;
        log.warn("Change stream failed, notifying {} resources", listenerRegistry.size(), e);
        notifyError(e);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("Change stream demultiplexer stopped");
    }
  }

  private MongoChangeStreamCursor<ChangeStreamDocument<Document>> reopenCursor() {
    try {
      return Failsafe.with(reconnectPolicy).get(this::openCursor);
    } catch (RuntimeException e) {
      if (!closed) {
        log.warn("Change stream unavailable, retrying", e);
      }
      return null;
    }
  }

  private MongoChangeStreamCursor<ChangeStreamDocument<Document>> openCursor() {
    var iterable =
        collection
            .watch(
                singletonList(
                    match(
                        in(
                            "operationType",
                            List.of("insert", "update", "replace", "delete", "invalidate")))))
            .fullDocument(FullDocument.UPDATE_LOOKUP)
            .maxAwaitTime(MAX_AWAIT.toMillis(), TimeUnit.MILLISECONDS);
    if (resumeToken != null) {
      iterable = iterable.resumeAfter(resumeToken);
    }
    return iterable.cursor();
  }

  private void dispatch(ChangeStreamDocument<Document> change) {
    OperationType operation = change.getOperationType();
    if (operation == OperationType.INVALIDATE) {
      // The collection was dropped or renamed, the old token cannot be resumed.
      resumeToken = null;
      return;
    }

    BsonDocument documentKey = change.getDocumentKey();
    if (documentKey == null) return;
    BsonValue id = documentKey.get("_id");
    if (id == null || !id.isString()) return;

    String resourceId = id.asString().getValue();
    List<Registration> interested = listenerRegistry.get(resourceId);
    if (interested == null || interested.isEmpty()) return;

    Optional<Resource> value =
        operation == OperationType.DELETE
            ? Optional.empty()
            : Optional.ofNullable(change.getFullDocument()).map(BsonResource::new);

    for (Registration registration : interested) {
      registration.changed(resourceId, value);
    }
  }

  private void notifyError(Throwable error) {
    listenerRegistry.forEach(
        (resourceId, registrations) ->
            registrations.forEach(registration -> registration.error(resourceId, error)));
  }

  /** Stops the watcher thread. Open handles receive no further events. */
  @Override
  public void close() {
    closed = true;
    watcherThread.interrupt();
    lookupExecutor.shutdownNow();
    listenerRegistry.clear();
  }

  /**
   * One opened stream. Snapshot deliveries are serialized on the registration so that the initial
   * lookup can never overwrite a change that was delivered before it.
   */
  private final class Registration {
    final StreamListener listener;
    volatile boolean live = true;

    @GuardedBy("this")
    private boolean changeSeen;

    Registration(StreamListener listener) {
      this.listener = listener;
    }

    /** Delivers the lookup result unless a change event was delivered first. */
    synchronized void lookedUp(String resourceId, Optional<Resource> value) {
      if (!live || changeSeen) return;
      snapshot(resourceId, value);
    }

    synchronized void changed(String resourceId, Optional<Resource> value) {
      changeSeen = true;
      snapshot(resourceId, value);
    }

    @GuardedBy("this")
    private void snapshot(String resourceId, Optional<Resource> value) {
      try {
        listener.onSnapshot(value);
      } catch (RuntimeException e) {
        log.warn("Listener of [{}] failed on snapshot", resourceId, e);
      }
    }

    void error(String resourceId, Throwable error) {
      try {
        listener.onError(error);
      } catch (RuntimeException e) {
        log.warn("Listener of [{}] failed on error", resourceId, e);
      }
    }
  }
}
