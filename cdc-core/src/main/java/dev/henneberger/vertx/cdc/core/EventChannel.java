package dev.henneberger.vertx.cdc.core;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded hand-off between the decoding loop and whoever consumes events.
 * <p>
 * Producers block while the channel is full, which is what throttles the replication read loop
 * when the consumer is slow. Besides events the channel carries per-entry failures: {@link #take()}
 * rethrows them in order, and the consumer may keep reading afterwards.
 * <p>
 * {@link #close(Throwable)} wakes every blocked producer and consumer. Producers fail with
 * {@link ChannelClosedException} immediately; consumers first drain what is buffered.
 *
 * @param <E> event type
 */
public final class EventChannel<E> {

  private final int capacity;
  private final ArrayDeque<Object> entries;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private volatile Consumer<? super E> handOffListener = event -> { };
  private boolean closed;
  private Throwable terminalCause;

  public EventChannel(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1");
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  /**
   * Called on the consuming thread for every event leaving the channel, before it is returned.
   */
  public void setHandOffListener(Consumer<? super E> listener) {
    this.handOffListener = Objects.requireNonNull(listener, "listener");
  }

  public void put(E event) throws InterruptedException {
    enqueue(Objects.requireNonNull(event, "event"), -1L);
  }

  public boolean offer(E event, long timeout, TimeUnit unit) throws InterruptedException {
    return enqueue(Objects.requireNonNull(event, "event"), unit.toNanos(timeout));
  }

  public void putFailure(RuntimeException failure) throws InterruptedException {
    enqueue(new Failure(Objects.requireNonNull(failure, "failure")), -1L);
  }

  public boolean offerFailure(RuntimeException failure, long timeout, TimeUnit unit) throws InterruptedException {
    return enqueue(new Failure(Objects.requireNonNull(failure, "failure")), unit.toNanos(timeout));
  }

  /**
   * Blocks until an entry is available.
   *
   * @throws ChannelClosedException once the channel is closed and drained
   * @throws RuntimeException the failure stored in the next entry
   */
  public E take() throws InterruptedException {
    return dequeue(-1L);
  }

  /**
   * Like {@link #take()} but returns {@code null} when nothing arrives within the timeout.
   */
  public E poll(long timeout, TimeUnit unit) throws InterruptedException {
    return dequeue(unit.toNanos(timeout));
  }

  public void close() {
    close(null);
  }

  public void close(Throwable cause) {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      terminalCause = cause;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Makes a closed channel usable again. Buffered entries and the terminal cause are dropped.
   */
  public void reopen() {
    lock.lock();
    try {
      entries.clear();
      closed = false;
      terminalCause = null;
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops everything buffered and returns how many entries were discarded.
   */
  public int clear() {
    lock.lock();
    try {
      int dropped = entries.size();
      entries.clear();
      notFull.signalAll();
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int capacity() {
    return capacity;
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  private boolean enqueue(Object entry, long timeoutNanos) throws InterruptedException {
    long remaining = timeoutNanos;
    lock.lockInterruptibly();
    try {
      while (!closed && entries.size() >= capacity) {
        if (timeoutNanos < 0) {
          notFull.await();
        } else {
          if (remaining <= 0L) {
            return false;
          }
          remaining = notFull.awaitNanos(remaining);
        }
      }
      if (closed) {
        throw new ChannelClosedException("event channel closed", terminalCause);
      }
      entries.addLast(entry);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @SuppressWarnings("unchecked")
  private E dequeue(long timeoutNanos) throws InterruptedException {
    Object entry;
    long remaining = timeoutNanos;
    lock.lockInterruptibly();
    try {
      while (entries.isEmpty()) {
        if (closed) {
          throw new ChannelClosedException("event channel closed", terminalCause);
        }
        if (timeoutNanos < 0) {
          notEmpty.await();
        } else {
          if (remaining <= 0L) {
            return null;
          }
          remaining = notEmpty.awaitNanos(remaining);
        }
      }
      entry = entries.pollFirst();
      notFull.signal();
    } finally {
      lock.unlock();
    }

    if (entry instanceof Failure) {
      throw ((Failure) entry).error;
    }
    E event = (E) entry;
    handOffListener.accept(event);
    return event;
  }

  private static final class Failure {
    private final RuntimeException error;

    private Failure(RuntimeException error) {
      this.error = error;
    }
  }
}
