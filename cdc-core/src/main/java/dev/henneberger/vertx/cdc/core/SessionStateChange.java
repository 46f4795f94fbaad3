package dev.henneberger.vertx.cdc.core;

public final class SessionStateChange {
  private final SessionState previousState;
  private final SessionState state;
  private final Throwable cause;
  private final long attempt;

  public SessionStateChange(SessionState previousState,
                            SessionState state,
                            Throwable cause,
                            long attempt) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public SessionState previousState() {
    return previousState;
  }

  public SessionState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  /**
   * Reconnect attempt this change belongs to, {@code 0} outside of the reconnect cycle.
   */
  public long attempt() {
    return attempt;
  }

  @Override
  public String toString() {
    return previousState + " -> " + state + " (attempt " + attempt + (cause == null ? ")" : ", " + cause + ")");
  }
}
