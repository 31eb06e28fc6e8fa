package jobwatch.test.registry;

import jobwatch.api.Resource;
import jobwatch.core.SubscriptionManager;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

import static org.assertj.core.api.Assertions.assertThat;

public class CacheOnJoinTest extends BaseTest {

  @DisplayName("A late subscriber receives the cached job before subscribe returns")
  @Test
  public void testLateSubscriberGetsCachedSnapshotSynchronously() throws Exception {
    SubscriptionManager manager = newManager();
    RecordingCallback early = new RecordingCallback();
    manager.subscribe("job-A", early);
    backend.emit("job-A", job("job-A", "done"));
    assertThat(early.awaitCount(1, AWAIT)).isTrue();

    RecordingCallback late = new RecordingCallback();
    manager.subscribe("job-A", late);

    assertThat(late.count()).isEqualTo(1);
    assertThat((String) late.last().get("status")).isEqualTo("done");
    assertThat(backend.openCount("job-A")).isEqualTo(1);
  }

  @DisplayName("Without a cached snapshot a new subscriber gets nothing until the backend speaks")
  @Test
  public void testNoSnapshotNoImmediateDelivery() throws Exception {
    SubscriptionManager manager = newManager();
    manager.subscribe("job-A", new RecordingCallback());

    RecordingCallback late = new RecordingCallback();
    manager.subscribe("job-A", late);
    Thread.sleep(DEBOUNCE.toMillis() * 3);

    assertThat(late.count()).isZero();
  }

  @DisplayName("A cached not-found is replayed as null")
  @Test
  public void testCachedNotFoundReplayedAsNull() throws Exception {
    SubscriptionManager manager = newManager();
    RecordingCallback early = new RecordingCallback();
    manager.subscribe("job-gone", early);
    backend.emitNotFound("job-gone");
    assertThat(early.awaitCount(1, AWAIT)).isTrue();

    RecordingCallback late = new RecordingCallback();
    manager.subscribe("job-gone", late);

    assertThat(late.values()).containsExactly((Resource) null);
  }

  @DisplayName("A cached snapshot is never replayed after a newer error reached the newcomer")
  @Test
  public void testReplayNeverFollowsError() throws Exception {
    SubscriptionManager manager = newManager();
    RecordingCallback early = new RecordingCallback();
    manager.subscribe("job-A", early);
    backend.emit("job-A", job("job-A", "processing"));
    assertThat(early.awaitCount(1, AWAIT)).isTrue();

    AtomicBoolean running = new AtomicBoolean(true);
    RuntimeException flapping = new RuntimeException("flapping");
    Thread errors =
        new Thread(
            () -> {
              while (running.get()) {
                backend.fail("job-A", flapping);
                LockSupport.parkNanos(100_000L);
              }
            },
            "error-emitter");
    List<RecordingCallback> joiners = new ArrayList<>();
    errors.start();
    try {
      for (int i = 0; i < 500; i++) {
        RecordingCallback joiner = new RecordingCallback();
        manager.subscribe("job-A", joiner);
        joiners.add(joiner);
      }
    } finally {
      running.set(false);
      errors.join();
    }

    // No new snapshot was emitted, so any value after a null would be the stale replay.
    for (RecordingCallback joiner : joiners) {
      List<Resource> values = joiner.values();
      int firstNull = values.indexOf(null);
      if (firstNull >= 0) {
        assertThat(values.subList(firstNull, values.size())).containsOnlyNulls();
      }
    }
  }
}
