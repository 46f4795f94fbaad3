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
 * CopyData frame sent by the server on a streaming replication connection.
 */
public abstract class ReplicationFrame {

  private ReplicationFrame() {
  }

  /**
   * {@code 'w'} frame wrapping one {@code pgoutput} message.
   */
  public static final class XLogData extends ReplicationFrame {
    private final long walStart;
    private final long walEnd;
    private final Instant sendTime;
    private final byte[] payload;

    public XLogData(long walStart, long walEnd, Instant sendTime, byte[] payload) {
      this.walStart = walStart;
      this.walEnd = walEnd;
      this.sendTime = Objects.requireNonNull(sendTime, "sendTime");
      this.payload = Objects.requireNonNull(payload, "payload");
    }

    public long walStart() {
      return walStart;
    }

    public long walEnd() {
      return walEnd;
    }

    public Instant sendTime() {
      return sendTime;
    }

    public byte[] payload() {
      return payload;
    }
  }

  /**
   * {@code 'k'} primary keepalive.
   */
  public static final class Keepalive extends ReplicationFrame {
    private final long walEnd;
    private final Instant sendTime;
    private final boolean replyRequested;

    public Keepalive(long walEnd, Instant sendTime, boolean replyRequested) {
      this.walEnd = walEnd;
      this.sendTime = Objects.requireNonNull(sendTime, "sendTime");
      this.replyRequested = replyRequested;
    }

    public long walEnd() {
      return walEnd;
    }

    public Instant sendTime() {
      return sendTime;
    }

    public boolean replyRequested() {
      return replyRequested;
    }
  }
}
