package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Assertions every {@link ReplicationSession} implementation is expected to satisfy. Usable from
 * any test framework; failures are reported as {@link AssertionError}.
 */
public final class SessionContractKit {

  private SessionContractKit() {
  }

  public static void assertClosePreventsStart(ReplicationSession<?> session, Duration timeout) {
    Objects.requireNonNull(session, "session");
    session.close();
    if (session.state() != SessionState.CLOSED) {
      throw new AssertionError("Expected CLOSED state after close(), got " + session.state());
    }
    Throwable failure = awaitFailure(session.start(), timeout);
    if (failure == null) {
      throw new AssertionError("Expected start() failure after close()");
    }
    if (!session.events().isClosed()) {
      throw new AssertionError("Expected the event channel to be closed after close()");
    }
  }

  public static void assertPreflightFailureTransitionsToFailed(ReplicationSession<?> session, Duration timeout) {
    Objects.requireNonNull(session, "session");
    Throwable failure = awaitFailure(session.start(), timeout);
    if (!(failure instanceof PreflightFailedException)) {
      throw new AssertionError("Expected PreflightFailedException, got: " + failure);
    }
    if (session.state() != SessionState.FAILED) {
      throw new AssertionError("Expected FAILED state after preflight failure, got " + session.state());
    }
  }

  public static void assertExhaustedReconnectsFailSession(ReplicationSession<?> session, Duration timeout) {
    Objects.requireNonNull(session, "session");
    Throwable failure = awaitFailure(session.start(), timeout);
    if (failure == null) {
      throw new AssertionError("Expected start() failure once reconnects are exhausted");
    }
    if (session.state() != SessionState.FAILED) {
      throw new AssertionError("Expected FAILED state after exhausted reconnects, got " + session.state());
    }
    try {
      session.events().poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      throw new AssertionError("Expected the event channel to terminate after FAILED");
    } catch (ChannelClosedException expected) {
      if (!expected.isFailure()) {
        throw new AssertionError("Expected the event channel to carry the terminal failure", expected);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssertionError("Interrupted while polling the event channel", e);
    }
  }

  public static Throwable awaitFailure(Future<?> future, Duration timeout) {
    Objects.requireNonNull(future, "future");
    Objects.requireNonNull(timeout, "timeout");
    try {
      future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (TimeoutException e) {
      throw new AssertionError("Timed out waiting for future completion", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return e;
    }
  }
}
