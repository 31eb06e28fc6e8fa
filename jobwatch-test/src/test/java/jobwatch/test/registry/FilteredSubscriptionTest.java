package jobwatch.test.registry;

import jobwatch.api.Resource;
import jobwatch.core.JobSubscriptions;
import jobwatch.core.SubscriptionManager;
import jobwatch.storage.mongo.BsonResource;
import jobwatch.test.BaseTest;
import jobwatch.test.RecordingCallback;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

public class FilteredSubscriptionTest extends BaseTest {

  private SubscriptionManager manager;
  private JobSubscriptions jobs;

  @BeforeEach
  void setUp() {
    manager = newManager();
    jobs = new JobSubscriptions(manager);
  }

  @DisplayName("Typed subscriptions share one stream and see only matching snapshots")
  @Test
  public void testTypedSubscriptionsShareStream() throws Exception {
    RecordingCallback general = new RecordingCallback();
    RecordingCallback progress = new RecordingCallback();
    RecordingCallback preview = new RecordingCallback();

    jobs.subscribeToJob("job-A", general);
    jobs.subscribeToProgress("job-A", progress);
    jobs.subscribeToPreview("job-A", preview);
    assertThat(backend.openCount("job-A")).isEqualTo(1);

    backend.emit("job-A", job("job-A", "queued"));
    assertThat(general.awaitCount(1, AWAIT)).isTrue();

    backend.emit("job-A", job("job-A", "processing"));
    assertThat(general.awaitCount(2, AWAIT)).isTrue();

    backend.emit("job-A", job("job-A", "completed"));
    assertThat(general.awaitCount(3, AWAIT)).isTrue();
    // Let any pending delivery settle.
    Thread.sleep(DEBOUNCE.toMillis() * 3);

    assertThat(statuses(progress)).containsExactly("processing", "completed");
    assertThat(statuses(preview)).containsExactly("completed");
  }

  @DisplayName("Feature subscriptions match by feature name or id")
  @Test
  public void testFeatureSubscription() throws Exception {
    RecordingCallback general = new RecordingCallback();
    RecordingCallback anyFeature = new RecordingCallback();
    RecordingCallback faces = new RecordingCallback();
    jobs.subscribeToJob("job-F", general);
    jobs.subscribeToFeatures("job-F", anyFeature);
    jobs.subscribeToFeatures("job-F", faces, List.of("faces"));

    backend.emit("job-F", withFeatures("job-F", List.of(new Document("name", "labels"))));
    assertThat(general.awaitCount(1, AWAIT)).isTrue();

    backend.emit("job-F", withFeatures("job-F", List.of(new Document("id", "faces"))));
    assertThat(general.awaitCount(2, AWAIT)).isTrue();
    Thread.sleep(DEBOUNCE.toMillis() * 3);

    assertThat(anyFeature.count()).isEqualTo(2);
    assertThat(faces.count()).isEqualTo(1);
  }

  @DisplayName("Cache-on-join respects the newcomer's filter")
  @Test
  public void testCacheOnJoinIsFiltered() throws Exception {
    RecordingCallback general = new RecordingCallback();
    jobs.subscribeToJob("job-A", general);
    backend.emit("job-A", job("job-A", "queued"));
    assertThat(general.awaitCount(1, AWAIT)).isTrue();

    RecordingCallback preview = new RecordingCallback();
    jobs.subscribeToPreview("job-A", preview);
    RecordingCallback late = new RecordingCallback();
    jobs.subscribeToJob("job-A", late);

    assertThat(preview.count()).isZero();
    assertThat(late.count()).isEqualTo(1);
  }

  private static List<String> statuses(RecordingCallback callback) {
    return callback.values().stream()
        .map(r -> r.<String>get("status"))
        .collect(Collectors.toList());
  }

  private static Resource withFeatures(String id, List<Document> features) {
    return new BsonResource(
        new Document("_id", id).append("status", "processing").append("features", features));
  }
}
