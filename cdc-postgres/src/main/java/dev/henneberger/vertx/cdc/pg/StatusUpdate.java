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
import java.util.Objects;

/**
 * Standby status update reported to the server. {@code written} is the highest received position,
 * {@code flushed} and {@code applied} the highest confirmed one.
 */
public final class StatusUpdate {
  private final long written;
  private final long flushed;
  private final long applied;
  private final Instant clock;
  private final boolean replyRequested;

  public StatusUpdate(long written, long flushed, long applied, Instant clock, boolean replyRequested) {
    this.written = written;
    this.flushed = flushed;
    this.applied = applied;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.replyRequested = replyRequested;
  }

  public long written() {
    return written;
  }

  public long flushed() {
    return flushed;
  }

  public long applied() {
    return applied;
  }

  public Instant clock() {
    return clock;
  }

  public boolean replyRequested() {
    return replyRequested;
  }

  public byte[] encode() {
    return PgOutputCodec.encodeStatusUpdate(this);
  }

  @Override
  public String toString() {
    return "StatusUpdate{written=" + Lsns.format(written) + ", flushed=" + Lsns.format(flushed)
      + ", applied=" + Lsns.format(applied) + '}';
  }
}
