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

import jobwatch.api.Resource;
import org.bson.Document;

import java.util.Collections;
import java.util.Map;

/** A job document read from MongoDB. */
public final class BsonResource implements Resource {

  private final Document bson;

  public BsonResource(Document bson) {
    this.bson = bson;
  }

  @Override
  public String getId() {
    Object id = this.bson.get("_id");
    return id == null ? null : id.toString();
  }

  @Override
  public Map<String, Object> getData() {
    return Collections.unmodifiableMap(this.bson);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T get(String key) {
    return (T) this.bson.get(key);
  }

  @Override
  public <T> T get(String key, T defaultValue) {
    T r;
    if ((r = get(key)) != null) return r;
    return defaultValue;
  }

  @Override
  public String toString() {
    return "BsonResource" + bson.toJson();
  }
}
