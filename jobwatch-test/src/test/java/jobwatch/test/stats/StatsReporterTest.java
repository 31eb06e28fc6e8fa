package jobwatch.test.stats;

import jobwatch.api.Subscription;
import jobwatch.api.stats.MemoryStats;
import jobwatch.api.stats.SubscriptionStats;
import jobwatch.core.SubscriptionManager;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class StatsReporterTest extends BaseTest {

  @DisplayName("An idle manager reports empty stats and two running intervals")
  @Test
  public void testEmptyStats() {
    SubscriptionManager manager = newManager();

    SubscriptionStats stats = manager.getStats();
    assertThat(stats.totalSubscriptions()).isZero();
    assertThat(stats.activeSubscriptions()).isZero();
    assertThat(stats.totalCallbacks()).isZero();
    assertThat(stats.subscriptionsByResource()).isEmpty();
    assertThat(stats.shuttingDown()).isFalse();

    MemoryStats memory = manager.getMemoryStats();
    assertThat(memory.intervalCount()).isEqualTo(2);
    assertThat(memory.memoryUsageKb()).isZero();
    assertThat(memory.lastCleanupTime()).isZero();
  }

  @DisplayName("Subscription stats count entries, callbacks and errors per resource")
  @Test
  public void testSubscriptionStats() {
    SubscriptionManager manager =
        newManager(testOptions().cleanupGracePeriod(Duration.ofSeconds(10)).build());
    manager.subscribe("job-1", new RecordingCallback());
    manager.subscribe("job-1", new RecordingCallback());
    Subscription idle = manager.subscribe("job-2", new RecordingCallback());
    idle.unsubscribe();
    backend.fail("job-1", new RuntimeException("boom"));

    SubscriptionStats stats = manager.getStats();

    assertThat(stats.totalSubscriptions()).isEqualTo(2);
    assertThat(stats.activeSubscriptions()).isEqualTo(1);
    assertThat(stats.totalCallbacks()).isEqualTo(2);
    assertThat(stats.subscriptionsByResource().get("job-1").callbackCount()).isEqualTo(2);
    assertThat(stats.subscriptionsByResource().get("job-1").errorCount()).isEqualTo(1);
    assertThat(stats.subscriptionsByResource().get("job-2").callbackCount()).isZero();
  }

  @DisplayName("Memory estimate follows entries, timers and callbacks")
  @Test
  public void testMemoryEstimate() {
    SubscriptionManager manager =
        newManager(testOptions().debounceDelay(Duration.ofSeconds(10)).build());
    manager.subscribe("job-1", new RecordingCallback());
    manager.subscribe("job-1", new RecordingCallback());
    manager.subscribe("job-2", new RecordingCallback());
    backend.emit("job-1", job("job-1", "processing"));

    MemoryStats memory = manager.getMemoryStats();

    assertThat(memory.subscriptionsCount()).isEqualTo(2);
    assertThat(memory.callbacksCount()).isEqualTo(3);
    assertThat(memory.debounceTimersCount()).isEqualTo(1);
    assertThat(memory.cleanupTimersCount()).isZero();
    // (2 * 1000 + 1 * 100 + 3 * 50) / 1024 = 2.19
    assertThat(memory.memoryUsageKb()).isEqualTo(2);
  }
}
