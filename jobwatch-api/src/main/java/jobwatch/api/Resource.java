package jobwatch.api;

import java.util.Map;

public interface Resource {

  String getId();

  Map<String, Object> getData();

  <T> T get(String key);

  <T> T get(String key, T defaultValue);
}
