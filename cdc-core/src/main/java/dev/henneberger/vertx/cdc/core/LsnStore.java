package dev.henneberger.vertx.cdc.core;

import java.util.Optional;

/**
 * Persists the last confirmed position of a replication slot so that a new process can resume
 * where the previous one stopped acknowledging.
 */
public interface LsnStore {

  Optional<String> load(String slotName) throws Exception;

  void save(String slotName, String lsn) throws Exception;

  /**
   * A store that remembers nothing; the server side slot position is the only checkpoint.
   */
  static LsnStore none() {
    return new LsnStore() {
      @Override
      public Optional<String> load(String slotName) {
        return Optional.empty();
      }

      @Override
      public void save(String slotName, String lsn) {
        // slot confirmed_flush_lsn is authoritative
      }
    };
  }
}
