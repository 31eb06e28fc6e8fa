package jobwatch.test.registry;

import jobwatch.api.Resource;
import jobwatch.core.CallbackType;
import jobwatch.core.SubscribeOptions;
import jobwatch.core.SubscriptionManager;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class BackendErrorTest extends BaseTest {

  @DisplayName("A stream error notifies every callback with null right away")
  @Test
  public void testErrorDeliversNullImmediately() throws Exception {
    SubscriptionManager manager = newManager();
    RecordingCallback first = new RecordingCallback();
    RecordingCallback second = new RecordingCallback();
    manager.subscribe("job-A", first);
    manager.subscribe("job-A", second);
    backend.emit("job-A", job("job-A", "processing"));
    assertThat(first.awaitCount(1, AWAIT)).isTrue();
    assertThat(second.awaitCount(1, AWAIT)).isTrue();

    backend.fail("job-A", new RuntimeException("connection reset"));

    // No debounce for errors: delivered on the emitting thread.
    assertThat(first.count()).isEqualTo(2);
    assertThat(second.count()).isEqualTo(2);
    assertThat(first.last()).isNull();
    assertThat(second.last()).isNull();
    assertThat(manager.getStats().subscriptionsByResource().get("job-A").errorCount())
        .isEqualTo(1);
  }

  @DisplayName("An error keeps the stream open and the cached snapshot intact")
  @Test
  public void testErrorKeepsStreamAndCache() throws Exception {
    SubscriptionManager manager = newManager();
    RecordingCallback callback = new RecordingCallback();
    manager.subscribe("job-A", callback);
    backend.emit("job-A", job("job-A", "processing"));
    assertThat(callback.awaitCount(1, AWAIT)).isTrue();

    backend.fail("job-A", new RuntimeException("boom"));
    backend.fail("job-A", new RuntimeException("boom again"));

    assertThat(backend.cancelCount("job-A")).isZero();
    assertThat(backend.liveStreamCount("job-A")).isEqualTo(1);
    assertThat((String) manager.getCurrent("job-A").get("status")).isEqualTo("processing");
    assertThat(manager.getStats().subscriptionsByResource().get("job-A").errorCount())
        .isEqualTo(2);

    backend.emit("job-A", job("job-A", "done"));
    assertThat(callback.awaitCount(4, AWAIT)).isTrue();
    assertThat((String) callback.last().get("status")).isEqualTo("done");
  }

  @DisplayName("Errors bypass snapshot filters")
  @Test
  public void testErrorBypassesFilter() {
    SubscriptionManager manager = newManager();
    RecordingCallback callback = new RecordingCallback();
    manager.subscribe(
        "job-A",
        callback,
        SubscribeOptions.of(CallbackType.PREVIEW, job -> false));

    backend.fail("job-A", new RuntimeException("boom"));

    assertThat(callback.values()).containsExactly((Resource) null);
  }
}
