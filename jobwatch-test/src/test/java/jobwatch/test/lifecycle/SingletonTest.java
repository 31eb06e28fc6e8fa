package jobwatch.test.lifecycle;

import jobwatch.core.RateLimiters;
import jobwatch.core.SubscriptionManager;
import jobwatch.core.SubscriptionManagers;
import jobwatch.test.BaseTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class SingletonTest extends BaseTest {

  private final AtomicInteger built = new AtomicInteger();

  @AfterEach
  void shutdownInstance() {
    SubscriptionManagers.shutdown();
  }

  private void initialize() {
    SubscriptionManagers.initialize(
        () -> {
          built.incrementAndGet();
          return SubscriptionManager.builder()
              .backendStream(backend)
              .rateLimiter(RateLimiters.unlimited())
              .options(testOptions().build())
              .build();
        });
  }

  @DisplayName("getInstance returns the same manager until it is shut down")
  @Test
  public void testSameInstance() {
    initialize();

    SubscriptionManager first = SubscriptionManagers.getInstance();
    SubscriptionManager second = SubscriptionManagers.getInstance();

    assertThat(first).isSameAs(second);
    assertThat(built.get()).isEqualTo(1);
    assertThat(SubscriptionManagers.isExitHookInstalled()).isTrue();
  }

  @DisplayName("A shut down instance is replaced on next access")
  @Test
  public void testNewInstanceAfterShutdown() {
    initialize();
    SubscriptionManager first = SubscriptionManagers.getInstance();

    first.shutdown();
    SubscriptionManager second = SubscriptionManagers.getInstance();

    assertThat(second).isNotSameAs(first);
    assertThat(second.isShuttingDown()).isFalse();
    assertThat(built.get()).isEqualTo(2);
    assertThat(SubscriptionManagers.isExitHookInstalled()).isTrue();
  }

  @DisplayName("The static shutdown stops the current instance")
  @Test
  public void testStaticShutdown() {
    initialize();
    SubscriptionManager manager = SubscriptionManagers.getInstance();

    SubscriptionManagers.shutdown();

    assertThat(manager.isShuttingDown()).isTrue();
    assertThat(SubscriptionManagers.getInstance()).isNotSameAs(manager);
  }
}
