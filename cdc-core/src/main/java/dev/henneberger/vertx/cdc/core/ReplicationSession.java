package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A single replication connection with an explicit lifecycle. Several sessions may live side by
 * side; none of them share state.
 *
 * @param <E> event type produced by the session
 */
public interface ReplicationSession<E> extends AutoCloseable {

  Future<Void> start();

  Future<PreflightReport> preflight();

  SessionState state();

  /**
   * Pull surface of the session. Use it or {@link #subscribe}, not both.
   */
  EventChannel<E> events();

  Subscription onStateChange(Handler<SessionStateChange> handler);

  Subscription addMetricsListener(SessionMetricsListener<E> listener);

  Subscription subscribe(ChangeFilter<E> filter, ChangeConsumer<E> eventConsumer, Handler<Throwable> errorHandler);

  SubscriptionRegistration startAndSubscribe(ChangeFilter<E> filter,
                                             ChangeConsumer<E> eventConsumer,
                                             Handler<Throwable> errorHandler);

  @Override
  void close();
}
