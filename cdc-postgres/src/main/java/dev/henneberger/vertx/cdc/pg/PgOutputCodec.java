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

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless codec for the streaming replication CopyData frames and the {@code pgoutput}
 * (protocol version 1) messages they carry. Performs no I/O.
 */
public final class PgOutputCodec {

  /**
   * Seconds between the Unix epoch and 2000-01-01T00:00:00Z, the epoch of server timestamps.
   */
  public static final long PG_EPOCH_SECONDS = 946684800L;

  private static final byte FRAME_XLOG_DATA = 'w';
  private static final byte FRAME_KEEPALIVE = 'k';
  private static final byte FRAME_STATUS_UPDATE = 'r';

  private PgOutputCodec() {
  }

  public static ReplicationFrame decodeFrame(byte[] frame) {
    if (frame == null || frame.length == 0) {
      throw new ProtocolException("Empty replication frame");
    }
    ByteCursor cursor = new ByteCursor(frame, "replication frame");
    byte tag = cursor.readByte();
    switch (tag) {
      case FRAME_XLOG_DATA: {
        long walStart = cursor.readLong();
        long walEnd = cursor.readLong();
        Instant sendTime = fromPgEpochMicros(cursor.readLong());
        return new ReplicationFrame.XLogData(walStart, walEnd, sendTime, cursor.readRemaining());
      }
      case FRAME_KEEPALIVE: {
        long walEnd = cursor.readLong();
        Instant sendTime = fromPgEpochMicros(cursor.readLong());
        boolean reply = cursor.readByte() != 0;
        cursor.expectEnd();
        return new ReplicationFrame.Keepalive(walEnd, sendTime, reply);
      }
      default:
        throw new ProtocolException("Unknown replication frame tag '" + printable(tag) + "'");
    }
  }

  public static PgOutputMessage decodeMessage(byte[] payload) {
    if (payload == null || payload.length == 0) {
      throw new ProtocolException("Empty pgoutput message");
    }
    ByteCursor cursor = new ByteCursor(payload, "pgoutput message");
    byte tag = cursor.readByte();
    PgOutputMessage message;
    switch (tag) {
      case 'B':
        message = decodeBegin(cursor);
        break;
      case 'C':
        message = decodeCommit(cursor);
        break;
      case 'R':
        message = decodeRelation(cursor);
        break;
      case 'I':
        message = decodeInsert(cursor);
        break;
      case 'U':
        message = decodeUpdate(cursor);
        break;
      case 'D':
        message = decodeDelete(cursor);
        break;
      case 'T':
        message = decodeTruncate(cursor);
        break;
      case 'Y':
        message = new PgOutputMessage.Type(cursor.readInt(), cursor.readCString(), cursor.readCString());
        break;
      case 'O':
        message = new PgOutputMessage.Origin(cursor.readLong(), cursor.readCString());
        break;
      case 'M':
        message = decodeLogicalMessage(cursor);
        break;
      default:
        throw new ProtocolException("Unknown pgoutput message tag '" + printable(tag) + "'");
    }
    cursor.expectEnd();
    return message;
  }

  public static byte[] encodeStatusUpdate(StatusUpdate update) {
    ByteBuffer buffer = ByteBuffer.allocate(34);
    buffer.put(FRAME_STATUS_UPDATE);
    buffer.putLong(update.written());
    buffer.putLong(update.flushed());
    buffer.putLong(update.applied());
    buffer.putLong(toPgEpochMicros(update.clock()));
    buffer.put((byte) (update.replyRequested() ? 1 : 0));
    return buffer.array();
  }

  public static Instant fromPgEpochMicros(long micros) {
    long seconds = Math.floorDiv(micros, 1_000_000L);
    long microsRemainder = Math.floorMod(micros, 1_000_000L);
    return Instant.ofEpochSecond(PG_EPOCH_SECONDS + seconds, microsRemainder * 1_000L);
  }

  public static long toPgEpochMicros(Instant instant) {
    long seconds = instant.getEpochSecond() - PG_EPOCH_SECONDS;
    return Math.addExact(Math.multiplyExact(seconds, 1_000_000L), instant.getNano() / 1_000L);
  }

  private static PgOutputMessage.Begin decodeBegin(ByteCursor cursor) {
    long finalLsn = cursor.readLong();
    Instant commitTimestamp = fromPgEpochMicros(cursor.readLong());
    long xid = Integer.toUnsignedLong(cursor.readInt());
    return new PgOutputMessage.Begin(finalLsn, commitTimestamp, xid);
  }

  private static PgOutputMessage.Commit decodeCommit(ByteCursor cursor) {
    int flags = cursor.readByte() & 0xff;
    long commitLsn = cursor.readLong();
    long endLsn = cursor.readLong();
    Instant commitTimestamp = fromPgEpochMicros(cursor.readLong());
    return new PgOutputMessage.Commit(flags, commitLsn, endLsn, commitTimestamp);
  }

  private static PgOutputMessage.Relation decodeRelation(ByteCursor cursor) {
    int relationId = cursor.readInt();
    String namespace = cursor.readCString();
    String name = cursor.readCString();
    ReplicaIdentity identity = ReplicaIdentity.fromCode((char) cursor.readByte());
    int columnCount = cursor.readUnsignedShort();
    List<RelationColumn> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      int flags = cursor.readByte() & 0xff;
      String columnName = cursor.readCString();
      int typeOid = cursor.readInt();
      int typeModifier = cursor.readInt();
      columns.add(new RelationColumn(columnName, typeOid, typeModifier, (flags & 1) != 0));
    }
    // the empty namespace stands for pg_catalog
    if (namespace.isEmpty()) {
      namespace = "pg_catalog";
    }
    return new PgOutputMessage.Relation(new RelationSchema(relationId, namespace, name, identity, columns));
  }

  private static PgOutputMessage.Insert decodeInsert(ByteCursor cursor) {
    int relationId = cursor.readInt();
    char marker = (char) cursor.readByte();
    if (marker != 'N') {
      throw new ProtocolException("Unexpected tuple marker for Insert: '" + marker + "'");
    }
    return new PgOutputMessage.Insert(relationId, decodeTuple(cursor));
  }

  private static PgOutputMessage.Update decodeUpdate(ByteCursor cursor) {
    int relationId = cursor.readInt();
    char marker = (char) cursor.readByte();
    char oldKind = 0;
    TupleData oldTuple = null;
    if (marker == 'K' || marker == 'O') {
      oldKind = marker;
      oldTuple = decodeTuple(cursor);
      marker = (char) cursor.readByte();
    }
    if (marker != 'N') {
      throw new ProtocolException("Unexpected tuple marker for Update: '" + marker + "'");
    }
    return new PgOutputMessage.Update(relationId, oldKind, oldTuple, decodeTuple(cursor));
  }

  private static PgOutputMessage.Delete decodeDelete(ByteCursor cursor) {
    int relationId = cursor.readInt();
    char marker = (char) cursor.readByte();
    if (marker != 'K' && marker != 'O') {
      throw new ProtocolException("Unexpected tuple marker for Delete: '" + marker + "'");
    }
    return new PgOutputMessage.Delete(relationId, marker, decodeTuple(cursor));
  }

  private static PgOutputMessage.Truncate decodeTruncate(ByteCursor cursor) {
    int count = cursor.readInt();
    if (count < 0 || count > cursor.remaining()) {
      throw new ProtocolException("Invalid relation count " + count + " in Truncate");
    }
    int options = cursor.readByte() & 0xff;
    List<Integer> relationIds = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      relationIds.add(cursor.readInt());
    }
    return new PgOutputMessage.Truncate(options, relationIds);
  }

  private static PgOutputMessage.LogicalMessage decodeLogicalMessage(ByteCursor cursor) {
    boolean transactional = (cursor.readByte() & 1) != 0;
    long lsn = cursor.readLong();
    String prefix = cursor.readCString();
    int length = cursor.readInt();
    return new PgOutputMessage.LogicalMessage(transactional, lsn, prefix, cursor.readBytes(length));
  }

  private static TupleData decodeTuple(ByteCursor cursor) {
    int columnCount = cursor.readUnsignedShort();
    List<RawColumnValue> values = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      char kind = (char) cursor.readByte();
      switch (kind) {
        case 'n':
          values.add(RawColumnValue.nullValue());
          break;
        case 'u':
          values.add(RawColumnValue.unchangedToast());
          break;
        case 't':
          values.add(RawColumnValue.text(cursor.readBytes(cursor.readInt())));
          break;
        case 'b':
          values.add(RawColumnValue.binary(cursor.readBytes(cursor.readInt())));
          break;
        default:
          throw new ProtocolException("Unknown tuple column kind '" + kind + "' at column " + i);
      }
    }
    return new TupleData(values);
  }

  private static String printable(byte tag) {
    return tag >= 0x20 && tag < 0x7f ? String.valueOf((char) tag) : String.format("0x%02x", tag & 0xff);
  }
}
