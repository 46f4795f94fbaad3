package dev.henneberger.vertx.cdc.core;

/**
 * Lifecycle of a replication session.
 * <pre>
 * CREATED -> CONNECTING -> CONNECTED -> DISCONNECTED -> BACKOFF -> CONNECTING ...
 *                                    \-> FAILED (retries exhausted or non retryable)
 * any state -> CLOSED
 * </pre>
 */
public enum SessionState {
  CREATED,
  CONNECTING,
  CONNECTED,
  DISCONNECTED,
  BACKOFF,
  FAILED,
  CLOSED;

  public boolean isTerminal() {
    return this == FAILED || this == CLOSED;
  }
}
