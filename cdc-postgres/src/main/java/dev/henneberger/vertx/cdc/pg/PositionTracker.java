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

import java.time.Instant;

/**
 * The {@code received} and {@code confirmed} stream positions of one session.
 * <p>
 * {@code received} is driven by the read loop, {@code confirmed} by consumers on other threads;
 * all operations are mutually exclusive. {@code confirmed <= received} holds at all times.
 */
public final class PositionTracker {

  private long received;
  private long confirmed;
  private long lastTransactionLsn;
  private long lastReportedConfirmed;

  public synchronized void reset(long startLsn) {
    received = startLsn;
    confirmed = startLsn;
    lastTransactionLsn = startLsn;
    lastReportedConfirmed = startLsn;
  }

  /**
   * Records a transaction boundary position (BEGIN final LSN, COMMIT end LSN) and advances
   * {@code received} to it. {@code 0/0} carries no position and is ignored.
   *
   * @throws InvariantViolationException when {@code lsn} is behind the previous boundary
   */
  public synchronized void observe(long lsn) {
    if (lsn == 0L) {
      return;
    }
    if (Lsns.compare(lsn, lastTransactionLsn) < 0) {
      throw new InvariantViolationException("Transaction LSN moved backwards from " + Lsns.format(lastTransactionLsn)
        + " to " + Lsns.format(lsn));
    }
    lastTransactionLsn = lsn;
    if (Lsns.compare(lsn, received) > 0) {
      received = lsn;
    }
  }

  /**
   * Advances {@code received} when {@code lsn} is ahead of it, otherwise leaves it untouched.
   * Used for keepalive positions, which may trail the transaction being sent.
   */
  public synchronized boolean observeIfAhead(long lsn) {
    if (Lsns.compare(lsn, received) > 0) {
      received = lsn;
      return true;
    }
    return false;
  }

  /**
   * @throws InvariantViolationException when {@code lsn} is beyond {@code received} or behind
   *   {@code confirmed}
   */
  public synchronized void confirm(long lsn) {
    confirm(lsn, -1L);
  }

  /**
   * Like {@link #confirm(long)} but keeps {@code confirmed} strictly below {@code holdLsn}, the
   * position of rows not yet delivered. {@code -1} holds nothing back.
   *
   * @return the confirmed position afterwards
   */
  public synchronized long confirm(long lsn, long holdLsn) {
    if (Lsns.compare(lsn, received) > 0) {
      throw new InvariantViolationException("Cannot confirm " + Lsns.format(lsn) + " beyond received "
        + Lsns.format(received));
    }
    if (Lsns.compare(lsn, confirmed) < 0) {
      throw new InvariantViolationException("Cannot confirm " + Lsns.format(lsn) + " behind confirmed "
        + Lsns.format(confirmed));
    }
    confirmed = capped(lsn, holdLsn);
    return confirmed;
  }

  /**
   * Like {@link #confirm(long)} but reports out of range positions by returning {@code false}.
   */
  public synchronized boolean tryConfirm(long lsn) {
    return tryConfirm(lsn, -1L);
  }

  /**
   * Like {@link #confirm(long, long)} but reports out of range positions by returning {@code false}.
   */
  public synchronized boolean tryConfirm(long lsn, long holdLsn) {
    if (Lsns.compare(lsn, received) > 0 || Lsns.compare(lsn, confirmed) < 0) {
      return false;
    }
    confirmed = capped(lsn, holdLsn);
    return true;
  }

  private long capped(long lsn, long holdLsn) {
    if (holdLsn == -1L || Lsns.compare(lsn, holdLsn) < 0) {
      return lsn;
    }
    if (holdLsn == 0L || Lsns.compare(holdLsn - 1L, confirmed) < 0) {
      return confirmed;
    }
    return holdLsn - 1L;
  }

  /**
   * Drops everything received after the confirmed position; the next connection resumes there.
   */
  public synchronized long rewind() {
    received = confirmed;
    lastTransactionLsn = confirmed;
    return confirmed;
  }

  public synchronized long received() {
    return received;
  }

  public synchronized long confirmed() {
    return confirmed;
  }

  public synchronized StatusUpdate statusUpdate(Instant now, boolean replyRequested) {
    return new StatusUpdate(received, confirmed, confirmed, now, replyRequested);
  }

  /**
   * Returns the confirmed position when it changed since the last call, {@code -1} otherwise.
   */
  public synchronized long takeConfirmedChange() {
    if (confirmed == lastReportedConfirmed) {
      return -1L;
    }
    lastReportedConfirmed = confirmed;
    return confirmed;
  }
}
