package jobwatch.test.lifecycle;

import jobwatch.api.Subscription;
import jobwatch.api.SubscriptionStatus;
import jobwatch.api.stats.MemoryStats;
import jobwatch.core.SubscriptionManager;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class ShutdownTest extends BaseTest {

  @DisplayName("Shutdown closes every stream exactly once and clears all state")
  @Test
  public void testShutdownTearsDownEverything() {
    SubscriptionManager manager =
        newManager(testOptions().debounceDelay(Duration.ofSeconds(10)).build());
    manager.subscribe("job-1", new RecordingCallback());
    manager.subscribe("job-2", new RecordingCallback());
    Subscription leaving = manager.subscribe("job-3", new RecordingCallback());
    leaving.unsubscribe();
    backend.emit("job-1", job("job-1", "processing"));

    manager.shutdown();

    MemoryStats memory = manager.getMemoryStats();
    assertThat(memory.subscriptionsCount()).isZero();
    assertThat(memory.callbacksCount()).isZero();
    assertThat(memory.debounceTimersCount()).isZero();
    assertThat(memory.cleanupTimersCount()).isZero();
    assertThat(memory.intervalCount()).isZero();
    assertThat(manager.isShuttingDown()).isTrue();
    assertThat(manager.getStats().shuttingDown()).isTrue();
    assertThat(backend.cancelCount("job-1")).isEqualTo(1);
    assertThat(backend.cancelCount("job-2")).isEqualTo(1);
    assertThat(backend.cancelCount("job-3")).isEqualTo(1);
  }

  @DisplayName("Shutdown is idempotent")
  @Test
  public void testShutdownIdempotent() {
    SubscriptionManager manager = newManager();
    manager.subscribe("job-1", new RecordingCallback());

    manager.shutdown();
    manager.shutdown();
    manager.close();

    assertThat(backend.cancelCount("job-1")).isEqualTo(1);
  }

  @DisplayName("Subscribing after shutdown yields an inert subscription")
  @Test
  public void testSubscribeAfterShutdown() {
    SubscriptionManager manager = newManager();
    manager.shutdown();

    RecordingCallback callback = new RecordingCallback();
    Subscription subscription = manager.subscribe("job-1", callback);

    assertThat(subscription.getStatus()).isEqualTo(SubscriptionStatus.SHUTTING_DOWN);
    assertThat(subscription.isSubscribed()).isFalse();
    subscription.unsubscribe();
    assertThat(backend.openCount("job-1")).isZero();
    assertThat(callback.count()).isZero();
  }

  @DisplayName("Pending debounced snapshots are never delivered after shutdown")
  @Test
  public void testNoDeliveryAfterShutdown() throws Exception {
    SubscriptionManager manager =
        newManager(testOptions().debounceDelay(Duration.ofMillis(200)).build());
    RecordingCallback callback = new RecordingCallback();
    manager.subscribe("job-1", callback);
    backend.emit("job-1", job("job-1", "processing"));

    manager.shutdown();
    Thread.sleep(400);

    assertThat(callback.count()).isZero();
  }
}
