package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class EventChannelTest {

  @Test
  void offerTimesOutWhileFull() throws Exception {
    EventChannel<String> channel = new EventChannel<>(2);
    assertTrue(channel.offer("a", 10, TimeUnit.MILLISECONDS));
    assertTrue(channel.offer("b", 10, TimeUnit.MILLISECONDS));

    assertFalse(channel.offer("c", 20, TimeUnit.MILLISECONDS));
    assertEquals("a", channel.take());
    assertTrue(channel.offer("c", 10, TimeUnit.MILLISECONDS));
    assertEquals("b", channel.take());
    assertEquals("c", channel.take());
  }

  @Test
  void blockedProducerResumesWhenConsumerTakes() throws Exception {
    EventChannel<Integer> channel = new EventChannel<>(1);
    channel.put(1);
    CountDownLatch produced = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      try {
        channel.put(2);
        produced.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();

    assertFalse(produced.await(50, TimeUnit.MILLISECONDS));
    assertEquals(1, channel.take());
    assertTrue(produced.await(2, TimeUnit.SECONDS));
    assertEquals(2, channel.take());
    producer.join(1000);
  }

  @Test
  void closeReleasesBlockedProducerWithTerminalSignal() throws Exception {
    EventChannel<Integer> channel = new EventChannel<>(1);
    channel.put(1);
    AtomicReference<Throwable> producerError = new AtomicReference<>();
    Thread producer = new Thread(() -> {
      try {
        channel.put(2);
      } catch (Throwable e) {
        producerError.set(e);
      }
    });
    producer.start();
    Thread.sleep(50);

    IllegalStateException cause = new IllegalStateException("stopped");
    channel.close(cause);
    producer.join(2000);

    assertTrue(producerError.get() instanceof ChannelClosedException);
    assertSame(cause, producerError.get().getCause());
    assertEquals(1, channel.take());
    ChannelClosedException drained = assertThrows(ChannelClosedException.class, channel::take);
    assertTrue(drained.isFailure());
  }

  @Test
  void closeReleasesBlockedConsumer() throws Exception {
    EventChannel<Integer> channel = new EventChannel<>(4);
    AtomicReference<Throwable> consumerError = new AtomicReference<>();
    Thread consumer = new Thread(() -> {
      try {
        channel.take();
      } catch (Throwable e) {
        consumerError.set(e);
      }
    });
    consumer.start();
    Thread.sleep(50);

    channel.close();
    consumer.join(2000);

    assertTrue(consumerError.get() instanceof ChannelClosedException);
    assertFalse(((ChannelClosedException) consumerError.get()).isFailure());
  }

  @Test
  void failureEntriesAreRethrownInOrderAndReadingContinues() throws Exception {
    EventChannel<String> channel = new EventChannel<>(4);
    channel.put("first");
    channel.putFailure(new IllegalArgumentException("bad column"));
    channel.put("second");

    assertEquals("first", channel.take());
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class, channel::take);
    assertEquals("bad column", error.getMessage());
    assertEquals("second", channel.take());
  }

  @Test
  void handOffListenerSeesEventsBeforeTheyAreReturned() throws Exception {
    EventChannel<String> channel = new EventChannel<>(4);
    List<String> handedOff = new CopyOnWriteArrayList<>();
    channel.setHandOffListener(handedOff::add);
    channel.put("a");
    channel.putFailure(new IllegalStateException("x"));
    channel.put("b");

    channel.take();
    assertThrows(IllegalStateException.class, channel::take);
    channel.take();

    assertEquals(List.of("a", "b"), handedOff);
  }

  @Test
  void pollReturnsNullOnTimeout() throws Exception {
    EventChannel<String> channel = new EventChannel<>(1);
    assertNull(channel.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void clearAndReopen() throws Exception {
    EventChannel<String> channel = new EventChannel<>(4);
    channel.put("a");
    channel.put("b");
    assertEquals(2, channel.clear());
    assertEquals(0, channel.size());

    channel.put("c");
    channel.close();
    assertThrows(ChannelClosedException.class, () -> channel.put("d"));

    channel.reopen();
    assertFalse(channel.isClosed());
    assertEquals(0, channel.size());
    channel.put("e");
    assertEquals("e", channel.take());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new EventChannel<String>(0));
  }
}
