package jobwatch.test.timer;

import jobwatch.api.Subscription;
import jobwatch.core.SubscriptionManager;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class CleanupTimerLeakTest extends BaseTest {

  @DisplayName("Repeated subscribe/unsubscribe cycles keep at most one grace timer")
  @Test
  public void testRapidCyclesDoNotLeakTimers() {
    SubscriptionManager manager =
        newManager(testOptions().cleanupGracePeriod(Duration.ofSeconds(10)).build());

    for (int i = 0; i < 50; i++) {
      Subscription subscription = manager.subscribe("job-A", new RecordingCallback());
      subscription.unsubscribe();
      assertThat(manager.getMemoryStats().cleanupTimersCount()).isLessThanOrEqualTo(1);
    }

    assertThat(manager.getMemoryStats().cleanupTimersCount()).isEqualTo(1);
    assertThat(manager.getStats().totalSubscriptions()).isEqualTo(1);
    assertThat(backend.openCount("job-A")).isEqualTo(1);
    assertThat(backend.cancelCount("job-A")).isZero();
  }

  @DisplayName("Unsubscribing a non-last callback starts no grace timer")
  @Test
  public void testNonLastUnsubscribeStartsNoTimer() {
    SubscriptionManager manager = newManager();
    manager.subscribe("job-A", new RecordingCallback());
    Subscription second = manager.subscribe("job-A", new RecordingCallback());

    second.unsubscribe();

    assertThat(manager.getMemoryStats().cleanupTimersCount()).isZero();
    assertThat(manager.hasActiveSubscribers("job-A")).isTrue();
  }
}
