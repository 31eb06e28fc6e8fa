package jobwatch.storage.mongo;

import jobwatch.api.stream.StreamHandle;

import java.util.concurrent.atomic.AtomicBoolean;

final class MongoStreamHandle implements StreamHandle {
  private final String resourceKey;
  private final AtomicBoolean open = new AtomicBoolean(true);
  private final Runnable cancelAction;

  MongoStreamHandle(String resourceKey, Runnable cancelAction) {
    this.resourceKey = resourceKey;
    this.cancelAction = cancelAction;
  }

  @Override
  public void cancel() {
    if (open.compareAndSet(true, false)) {
      cancelAction.run();
    }
  }

  @Override
  public String toString() {
    return "MongoStreamHandle[" + resourceKey + (open.get() ? ", open]" : ", cancelled]");
  }
}
