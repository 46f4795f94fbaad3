package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base for sessions that own one blocking connection on a dedicated thread.
 * <p>
 * The connection thread runs {@link #runConnection(long)} and drives the reconnect state machine
 * {@code CONNECTING -> CONNECTED -> DISCONNECTED -> BACKOFF -> CONNECTING}. Events are handed
 * to the {@link EventChannel}; when subscriptions exist a second thread pumps the channel to them
 * on the Vert.x context, one event at a time.
 *
 * @param <E> event type
 */
public abstract class AbstractReplicationSession<E> implements ReplicationSession<E> {

  private static final long DISPATCH_POLL_MILLIS = 100L;

  private final Vertx vertx;
  private final EventChannel<E> channel;
  private final List<ListenerRegistration<E>> listeners = new CopyOnWriteArrayList<>();
  private final List<Handler<SessionStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<SessionMetricsListener<E>> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Thread worker;
  private volatile Thread dispatcher;
  private volatile Promise<Void> startPromise;
  private volatile SessionState state = SessionState.CREATED;
  private volatile boolean connectedSinceLastFailure;

  protected AbstractReplicationSession(Vertx vertx, int channelCapacity) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.channel = new EventChannel<>(channelCapacity);
  }

  protected final Vertx vertx() {
    return vertx;
  }

  protected final boolean shouldRun() {
    return shouldRun.get();
  }

  @Override
  public EventChannel<E> events() {
    return channel;
  }

  @Override
  public Future<Void> start() {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if (state == SessionState.CLOSED) {
        return Future.failedFuture("session is closed");
      }
      if (state == SessionState.CONNECTED) {
        return Future.succeededFuture();
      }
      if (shouldRun.get() && startPromise != null) {
        return startPromise.future();
      }
      if (state == SessionState.FAILED) {
        channel.reopen();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      promiseToReturn = startPromise;
      transition(SessionState.CONNECTING, null, 0);
    }

    Future<Void> preflightFuture = preflightEnabled()
      ? preflight().compose(report -> report.ok()
      ? Future.succeededFuture()
      : Future.failedFuture(new PreflightFailedException(report)))
      : Future.succeededFuture();

    preflightFuture.onSuccess(v -> startWorker())
      .onFailure(err -> {
        synchronized (this) {
          if (state == SessionState.CLOSED) {
            return;
          }
          shouldRun.set(false);
          transition(SessionState.FAILED, err, 0);
        }
        failStart(err);
      });

    return promiseToReturn.future();
  }

  @Override
  public Future<PreflightReport> preflight() {
    return vertx.executeBlocking(this::runPreflightChecks);
  }

  @Override
  public SessionState state() {
    return state;
  }

  @Override
  public Subscription onStateChange(Handler<SessionStateChange> handler) {
    Handler<SessionStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  @Override
  public Subscription addMetricsListener(SessionMetricsListener<E> listener) {
    SessionMetricsListener<E> resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  @Override
  public Subscription subscribe(ChangeFilter<E> filter,
                                ChangeConsumer<E> eventConsumer,
                                Handler<Throwable> errorHandler) {
    return registerSubscription(filter, eventConsumer, errorHandler, true);
  }

  @Override
  public SubscriptionRegistration startAndSubscribe(ChangeFilter<E> filter,
                                                    ChangeConsumer<E> eventConsumer,
                                                    Handler<Throwable> errorHandler) {
    Subscription subscription = registerSubscription(filter, eventConsumer, errorHandler, false);
    Future<Void> started = start().onFailure(err -> {
      subscription.cancel();
      if (errorHandler != null) {
        errorHandler.handle(err);
      }
    });
    return new SubscriptionRegistration(subscription, started);
  }

  @Override
  public void close() {
    Thread connectionThread;
    Thread dispatchThread;
    Promise<Void> currentStartPromise;
    synchronized (this) {
      if (state == SessionState.CLOSED) {
        return;
      }
      shouldRun.set(false);
      transition(SessionState.CLOSED, null, 0);
      connectionThread = worker;
      dispatchThread = dispatcher;
      worker = null;
      dispatcher = null;
      currentStartPromise = startPromise;
      startPromise = null;
    }

    onCloseResources();
    channel.close();

    if (connectionThread != null) {
      connectionThread.interrupt();
    }
    if (dispatchThread != null) {
      dispatchThread.interrupt();
    }
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("session closed before reaching CONNECTED");
    }
  }

  protected final Subscription registerSubscription(ChangeFilter<E> filter,
                                                    ChangeConsumer<E> eventConsumer,
                                                    Handler<Throwable> errorHandler,
                                                    boolean withAutoStart) {
    Objects.requireNonNull(filter, "filter");
    Objects.requireNonNull(eventConsumer, "eventConsumer");
    ListenerRegistration<E> registration = new ListenerRegistration<>(filter, eventConsumer, errorHandler);
    listeners.add(registration);

    if (withAutoStart && autoStart()) {
      start().onFailure(err -> {
        if (errorHandler != null) {
          errorHandler.handle(err);
        }
      });
    }
    startDispatcher();

    return () -> listeners.remove(registration);
  }

  /**
   * Called by the connection thread once the server accepted the stream. Completes the start
   * future and resets the reconnect attempt counter.
   */
  protected final void sessionConnected(long attempt) {
    synchronized (this) {
      if (!shouldRun.get()) {
        return;
      }
      transition(SessionState.CONNECTED, null, attempt);
    }
    connectedSinceLastFailure = true;
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  protected final void emitEventMetric(E event) {
    for (SessionMetricsListener<E> listener : metricsListeners) {
      listener.onEvent(event);
    }
  }

  protected final void emitDecodeFailure(Throwable error) {
    for (SessionMetricsListener<E> listener : metricsListeners) {
      listener.onDecodeFailure(error);
    }
  }

  protected final void emitLsnConfirmed(String slotName, String lsn) {
    for (SessionMetricsListener<E> listener : metricsListeners) {
      listener.onLsnConfirmed(slotName, lsn);
    }
  }

  protected final void sleepInterruptibly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  protected final void notifyError(Throwable error) {
    for (ListenerRegistration<E> listener : listeners) {
      if (listener.errorHandler != null) {
        vertx.runOnContext(v -> listener.errorHandler.handle(error));
      }
    }
  }

  protected final void transition(SessionState nextState, Throwable cause, long attempt) {
    SessionState previous = state;
    if (previous == nextState && cause == null) {
      return;
    }
    state = nextState;
    SessionStateChange change = new SessionStateChange(previous, nextState, cause, attempt);
    for (SessionMetricsListener<E> listener : metricsListeners) {
      listener.onStateChange(change);
    }
    for (Handler<SessionStateChange> handler : stateHandlers) {
      vertx.runOnContext(v -> handler.handle(change));
    }
  }

  protected final String loadCheckpoint(String slotName) throws Exception {
    return lsnStore().load(slotName).orElse("");
  }

  protected final void saveCheckpoint(String slotName, String lsn) throws Exception {
    lsnStore().save(slotName, lsn);
  }

  private synchronized void startWorker() {
    if (!shouldRun.get()) {
      return;
    }
    if (worker == null || !worker.isAlive()) {
      worker = new Thread(this::runLoop, sessionName());
      worker.setDaemon(true);
      worker.start();
    }
    startDispatcher();
  }

  private synchronized void startDispatcher() {
    if (listeners.isEmpty() || !shouldRun.get()) {
      return;
    }
    if (dispatcher != null && dispatcher.isAlive()) {
      return;
    }
    dispatcher = new Thread(this::dispatchLoop, sessionName() + "-dispatch");
    dispatcher.setDaemon(true);
    dispatcher.start();
  }

  private void runLoop() {
    long failures = 0;
    while (shouldRun.get()) {
      connectedSinceLastFailure = false;
      synchronized (this) {
        if (!shouldRun.get()) {
          return;
        }
        transition(SessionState.CONNECTING, null, failures + 1);
      }
      Throwable failure;
      try {
        runConnection(failures + 1);
        failure = new IllegalStateException("replication stream ended");
      } catch (Exception e) {
        failure = e;
      }
      if (!shouldRun.get()) {
        return;
      }
      failures = connectedSinceLastFailure ? 1 : failures + 1;

      ReconnectPolicy policy = reconnectPolicy();
      synchronized (this) {
        if (!shouldRun.get()) {
          return;
        }
        transition(SessionState.DISCONNECTED, failure, failures);
      }
      logSessionFailure(failure, failures);
      if (!isRetryable(failure) || !policy.shouldRetry(failure, failures)) {
        synchronized (this) {
          if (!shouldRun.get()) {
            return;
          }
          shouldRun.set(false);
          transition(SessionState.FAILED, failure, failures);
        }
        channel.close(failure);
        notifyError(failure);
        failStart(failure);
        return;
      }
      long delay = policy.computeDelayMillis(failures);
      synchronized (this) {
        if (!shouldRun.get()) {
          return;
        }
        transition(SessionState.BACKOFF, failure, failures);
      }
      logReconnectScheduled(failures, delay);
      sleepInterruptibly(delay);
    }
  }

  private void dispatchLoop() {
    while (shouldRun.get() || channel.size() > 0) {
      E event;
      try {
        event = channel.poll(DISPATCH_POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (ChannelClosedException e) {
        return;
      } catch (RuntimeException e) {
        emitDecodeFailure(e);
        notifyError(e);
        continue;
      }
      if (event == null) {
        continue;
      }
      try {
        dispatchAndAwait(event);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (Exception e) {
        logDispatchFailure(e);
      }
    }
  }

  private void dispatchAndAwait(E event) throws Exception {
    List<ListenerRegistration<E>> matching = new ArrayList<>();
    for (ListenerRegistration<E> listener : listeners) {
      if (listener.filter.test(event)) {
        matching.add(listener);
      }
    }
    if (matching.isEmpty()) {
      return;
    }

    CountDownLatch latch = new CountDownLatch(matching.size());
    AtomicReference<Throwable> failure = new AtomicReference<>();
    for (ListenerRegistration<E> listener : matching) {
      vertx.runOnContext(v -> invokeListener(event, listener, latch, failure));
    }
    latch.await();
    Throwable err = failure.get();
    if (err != null) {
      if (err instanceof Exception) {
        throw (Exception) err;
      }
      throw new RuntimeException(err);
    }
  }

  private void failStart(Throwable err) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(err);
    }
  }

  private void invokeListener(E event,
                              ListenerRegistration<E> listener,
                              CountDownLatch latch,
                              AtomicReference<Throwable> failure) {
    try {
      Future<Void> result = listener.eventConsumer.handle(event);
      if (result == null) {
        result = Future.succeededFuture();
      }
      result.onComplete(ar -> {
        if (ar.failed()) {
          Throwable err = ar.cause();
          if (listener.errorHandler != null) {
            listener.errorHandler.handle(err);
          }
          failure.compareAndSet(null, err);
        }
        latch.countDown();
      });
    } catch (Throwable err) {
      if (listener.errorHandler != null) {
        listener.errorHandler.handle(err);
      }
      failure.compareAndSet(null, err);
      latch.countDown();
    }
  }

  protected abstract String sessionName();
  protected abstract boolean preflightEnabled();
  protected abstract boolean autoStart();
  protected abstract ReconnectPolicy reconnectPolicy();
  protected abstract LsnStore lsnStore();
  protected abstract PreflightReport runPreflightChecks();

  /**
   * Opens the connection and runs until it fails. Implementations call
   * {@link #sessionConnected(long)} once the stream is established and return or throw when the
   * connection is lost; the return value is treated like an unexpected end of stream.
   */
  protected abstract void runConnection(long attempt) throws Exception;

  protected abstract void logSessionFailure(Throwable error, long attempt);

  /**
   * Errors for which no reconnect is attempted regardless of the policy.
   */
  protected boolean isRetryable(Throwable error) {
    return true;
  }

  protected void logReconnectScheduled(long attempt, long delayMillis) {
  }

  protected void logDispatchFailure(Throwable error) {
  }

  protected void onCloseResources() {
  }

  private static final class ListenerRegistration<E> {
    private final ChangeFilter<E> filter;
    private final ChangeConsumer<E> eventConsumer;
    private final Handler<Throwable> errorHandler;

    private ListenerRegistration(ChangeFilter<E> filter,
                                 ChangeConsumer<E> eventConsumer,
                                 Handler<Throwable> errorHandler) {
      this.filter = filter;
      this.eventConsumer = eventConsumer;
      this.errorHandler = errorHandler;
    }
  }
}
