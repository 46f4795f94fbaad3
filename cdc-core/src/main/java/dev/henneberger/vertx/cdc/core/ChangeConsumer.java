package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;

/**
 * Receives events on the Vert.x context. The next event is only dispatched once the returned
 * future completes.
 */
@FunctionalInterface
public interface ChangeConsumer<E> {
  Future<Void> handle(E event);
}
