package jobwatch.test.filter;

import jobwatch.api.Resource;
import jobwatch.core.JobFilters;
import jobwatch.storage.mongo.BsonResource;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

public class JobFiltersTest {

  private static Resource doc(Document document) {
    return new BsonResource(document.append("_id", "job-1"));
  }

  @DisplayName("Progress filter accepts processing, completed, progress or features")
  @Test
  public void testProgressFilter() {
    Predicate<Resource> filter = JobFilters.progress();

    assertThat(filter.test(null)).isTrue();
    assertThat(filter.test(doc(new Document("status", "processing")))).isTrue();
    assertThat(filter.test(doc(new Document("status", "completed")))).isTrue();
    assertThat(filter.test(doc(new Document("status", "queued").append("progress", 40)))).isTrue();
    assertThat(filter.test(doc(new Document("status", "queued").append("features", List.of()))))
        .isTrue();
    assertThat(filter.test(doc(new Document("status", "queued")))).isFalse();
    assertThat(filter.test(doc(new Document("status", 7)))).isFalse();
  }

  @DisplayName("Preview filter accepts completed jobs or jobs with CV or preview data")
  @Test
  public void testPreviewFilter() {
    Predicate<Resource> filter = JobFilters.preview();

    assertThat(filter.test(null)).isTrue();
    assertThat(filter.test(doc(new Document("status", "completed")))).isTrue();
    assertThat(filter.test(doc(new Document("status", "processing").append("cvData", "x"))))
        .isTrue();
    assertThat(
            filter.test(doc(new Document("status", "processing").append("previewData", "x"))))
        .isTrue();
    assertThat(filter.test(doc(new Document("status", "processing")))).isFalse();
  }

  @DisplayName("Features filter needs at least one matching feature")
  @Test
  public void testFeaturesFilter() {
    Resource named = doc(new Document("features", List.of(new Document("name", "faces"))));
    Resource unnamed = doc(new Document("features", List.of(new Document("id", "labels"))));
    Resource empty = doc(new Document("features", List.of()));
    Resource none = doc(new Document("status", "processing"));

    Predicate<Resource> any = JobFilters.features(List.of());
    assertThat(any.test(null)).isFalse();
    assertThat(any.test(named)).isTrue();
    assertThat(any.test(unnamed)).isTrue();
    assertThat(any.test(empty)).isFalse();
    assertThat(any.test(none)).isFalse();

    Predicate<Resource> faces = JobFilters.features(Set.of("faces"));
    assertThat(faces.test(named)).isTrue();
    assertThat(faces.test(unnamed)).isFalse();

    Predicate<Resource> labels = JobFilters.features(Set.of("labels"));
    assertThat(labels.test(unnamed)).isTrue();
  }
}
