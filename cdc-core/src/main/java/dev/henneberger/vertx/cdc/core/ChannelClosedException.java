package dev.henneberger.vertx.cdc.core;

/**
 * Terminal signal of an {@link EventChannel}. The cause, when present, is the error that ended
 * the producing session.
 */
public final class ChannelClosedException extends IllegalStateException {

  public ChannelClosedException(String message, Throwable cause) {
    super(message, cause);
  }

  public boolean isFailure() {
    return getCause() != null;
  }
}
