/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.cdc.pg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PositionTrackerTest {

  @Test
  void transactionBoundariesAdvanceReceived() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);

    tracker.observe(0x200L);
    tracker.observe(0x210L);
    tracker.observe(0L);

    assertEquals(0x210L, tracker.received());
    assertEquals(0x100L, tracker.confirmed());
  }

  @Test
  void backwardsTransactionPositionIsAnInvariantViolation() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0L);
    tracker.observe(0x300L);

    InvariantViolationException error = assertThrows(InvariantViolationException.class,
      () -> tracker.observe(0x2FFL));
    assertTrue(error.getMessage().contains("0/2FF"), error.getMessage());
  }

  @Test
  void keepalivePositionsOnlyMoveReceivedForward() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0L);

    assertTrue(tracker.observeIfAhead(0x500L));
    assertFalse(tracker.observeIfAhead(0x400L));
    assertEquals(0x500L, tracker.received());

    // a transaction whose commit precedes the keepalive position is still accepted
    tracker.observe(0x450L);
    assertEquals(0x500L, tracker.received());
  }

  @Test
  void confirmStaysBelowHeldBackPosition() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);
    tracker.observe(0x300L);
    tracker.observe(0x310L);

    assertEquals(0x1FFL, tracker.confirm(0x300L, 0x200L));
    assertEquals(0x1FFL, tracker.confirmed());
    assertTrue(tracker.tryConfirm(0x310L, 0x200L));
    assertEquals(0x1FFL, tracker.confirmed());

    assertTrue(tracker.tryConfirm(0x310L, -1L));
    assertEquals(0x310L, tracker.confirmed());
  }

  @Test
  void heldBackPositionNeverMovesConfirmedBackwards() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x250L);
    tracker.observe(0x300L);

    assertEquals(0x250L, tracker.confirm(0x300L, 0x200L));
    assertEquals(0x250L, tracker.confirmed());
  }

  @Test
  void confirmStaysWithinConfirmedAndReceived() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);
    tracker.observe(0x300L);

    tracker.confirm(0x200L);
    assertEquals(0x200L, tracker.confirmed());
    tracker.confirm(0x200L);

    assertThrows(InvariantViolationException.class, () -> tracker.confirm(0x301L));
    assertThrows(InvariantViolationException.class, () -> tracker.confirm(0x1FFL));
    assertFalse(tracker.tryConfirm(0x301L));
    assertFalse(tracker.tryConfirm(0x100L));
    assertTrue(tracker.tryConfirm(0x300L));
    assertEquals(0x300L, tracker.confirmed());
  }

  @Test
  void rewindResumesAtConfirmed() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);
    tracker.observe(0x200L);
    tracker.observe(0x300L);
    tracker.confirm(0x200L);

    assertEquals(0x200L, tracker.rewind());
    assertEquals(0x200L, tracker.received());

    // the server redelivers the transaction committed at the confirmed position
    tracker.observe(0x200L);
    tracker.observe(0x300L);
    assertEquals(0x300L, tracker.received());
  }

  @Test
  void statusUpdateReportsConfirmedAsFlushedAndApplied() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);
    tracker.observe(0x300L);
    tracker.confirm(0x200L);
    Instant now = Instant.parse("2024-01-15T10:30:00Z");

    StatusUpdate update = tracker.statusUpdate(now, false);

    assertEquals(0x300L, update.written());
    assertEquals(0x200L, update.flushed());
    assertEquals(0x200L, update.applied());
    assertEquals(now, update.clock());
    assertFalse(update.replyRequested());
  }

  @Test
  void confirmedChangeIsReportedOnce() {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0x100L);
    assertEquals(-1L, tracker.takeConfirmedChange());

    tracker.observe(0x200L);
    tracker.confirm(0x200L);
    assertEquals(0x200L, tracker.takeConfirmedChange());
    assertEquals(-1L, tracker.takeConfirmedChange());
  }

  @Test
  void concurrentConfirmationsNeverPassReceived() throws Exception {
    PositionTracker tracker = new PositionTracker();
    tracker.reset(0L);
    List<Throwable> errors = new CopyOnWriteArrayList<>();
    CountDownLatch done = new CountDownLatch(2);

    Thread reader = new Thread(() -> {
      try {
        for (long lsn = 1; lsn <= 20_000; lsn++) {
          tracker.observe(lsn);
        }
      } catch (Throwable t) {
        errors.add(t);
      } finally {
        done.countDown();
      }
    });
    Thread acker = new Thread(() -> {
      try {
        while (tracker.confirmed() < 20_000L) {
          long received = tracker.received();
          if (received > tracker.confirmed()) {
            tracker.confirm(received);
          }
          if (tracker.confirmed() > tracker.received()) {
            errors.add(new AssertionError("confirmed passed received"));
          }
        }
      } catch (Throwable t) {
        errors.add(t);
      } finally {
        done.countDown();
      }
    });
    reader.start();
    acker.start();

    assertTrue(done.await(30, TimeUnit.SECONDS));
    assertEquals(List.of(), errors);
    assertEquals(20_000L, tracker.confirmed());
  }
}
