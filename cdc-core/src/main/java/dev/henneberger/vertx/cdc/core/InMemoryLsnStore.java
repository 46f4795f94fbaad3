package dev.henneberger.vertx.cdc.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps checkpoints for the life of the JVM; useful to share a position between sessions that
 * are recreated in-process and in tests.
 */
public final class InMemoryLsnStore implements LsnStore {
  private final Map<String, String> checkpoints = new ConcurrentHashMap<>();
  private final AtomicInteger saves = new AtomicInteger();

  @Override
  public Optional<String> load(String slotName) {
    return Optional.ofNullable(checkpoints.get(slotName));
  }

  @Override
  public void save(String slotName, String lsn) {
    checkpoints.put(slotName, lsn);
    saves.incrementAndGet();
  }

  public int saveCount() {
    return saves.get();
  }
}
