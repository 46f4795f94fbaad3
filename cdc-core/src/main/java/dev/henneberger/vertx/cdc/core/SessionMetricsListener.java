package dev.henneberger.vertx.cdc.core;

/**
 * Synchronous observation hooks. Called on the session threads, so implementations must be cheap
 * and must not block.
 */
public interface SessionMetricsListener<E> {

  default void onEvent(E event) {
  }

  default void onDecodeFailure(Throwable error) {
  }

  default void onStateChange(SessionStateChange stateChange) {
  }

  default void onLsnConfirmed(String slotName, String lsn) {
  }
}
