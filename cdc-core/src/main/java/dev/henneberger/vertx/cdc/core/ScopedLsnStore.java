package dev.henneberger.vertx.cdc.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Decorator that namespaces slot names with a fixed scope, so slots with the same name on
 * different databases can share one backing store.
 */
public final class ScopedLsnStore implements LsnStore {

  private final LsnStore delegate;
  private final String scope;

  public ScopedLsnStore(LsnStore delegate, String scope) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.scope = Objects.requireNonNull(scope, "scope");
  }

  @Override
  public Optional<String> load(String slotName) throws Exception {
    return delegate.load(key(slotName));
  }

  @Override
  public void save(String slotName, String lsn) throws Exception {
    Objects.requireNonNull(lsn, "lsn");
    delegate.save(key(slotName), lsn);
  }

  String key(String slotName) {
    return scope + ':' + Objects.requireNonNull(slotName, "slotName");
  }
}
