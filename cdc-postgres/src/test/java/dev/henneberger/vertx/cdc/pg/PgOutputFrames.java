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

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Builds pgoutput messages and replication frames the way the server lays them out on the wire.
 */
final class PgOutputFrames {

  /** Tuple value standing for an unchanged TOAST column. */
  static final Object UNCHANGED = new Object();

  static final Instant COMMIT_TIME = Instant.parse("2024-01-15T10:30:00Z");

  private PgOutputFrames() {
  }

  static Column col(String name, int typeOid, boolean key) {
    return new Column(name, typeOid, key);
  }

  static byte[] begin(long finalLsn, long xid) {
    return message(out -> {
      out.writeByte('B');
      out.writeLong(finalLsn);
      out.writeLong(PgOutputCodec.toPgEpochMicros(COMMIT_TIME));
      out.writeInt((int) xid);
    });
  }

  static byte[] commit(long commitLsn, long endLsn) {
    return message(out -> {
      out.writeByte('C');
      out.writeByte(0);
      out.writeLong(commitLsn);
      out.writeLong(endLsn);
      out.writeLong(PgOutputCodec.toPgEpochMicros(COMMIT_TIME));
    });
  }

  static byte[] relation(int relationId, String namespace, String name, char identity, Column... columns) {
    return message(out -> {
      out.writeByte('R');
      out.writeInt(relationId);
      cstring(out, namespace);
      cstring(out, name);
      out.writeByte(identity);
      out.writeShort(columns.length);
      for (Column column : columns) {
        out.writeByte(column.key ? 1 : 0);
        cstring(out, column.name);
        out.writeInt(column.typeOid);
        out.writeInt(-1);
      }
    });
  }

  static byte[] insert(int relationId, Object... values) {
    return message(out -> {
      out.writeByte('I');
      out.writeInt(relationId);
      out.writeByte('N');
      tuple(out, values);
    });
  }

  static byte[] update(int relationId, char oldKind, Object[] oldValues, Object... newValues) {
    return message(out -> {
      out.writeByte('U');
      out.writeInt(relationId);
      if (oldValues != null) {
        out.writeByte(oldKind);
        tuple(out, oldValues);
      }
      out.writeByte('N');
      tuple(out, newValues);
    });
  }

  static byte[] delete(int relationId, char oldKind, Object... oldValues) {
    return message(out -> {
      out.writeByte('D');
      out.writeInt(relationId);
      out.writeByte(oldKind);
      tuple(out, oldValues);
    });
  }

  static byte[] truncate(int options, int... relationIds) {
    return message(out -> {
      out.writeByte('T');
      out.writeInt(relationIds.length);
      out.writeByte(options);
      for (int id : relationIds) {
        out.writeInt(id);
      }
    });
  }

  static byte[] type(int oid, String namespace, String name) {
    return message(out -> {
      out.writeByte('Y');
      out.writeInt(oid);
      cstring(out, namespace);
      cstring(out, name);
    });
  }

  static byte[] origin(long originLsn, String name) {
    return message(out -> {
      out.writeByte('O');
      out.writeLong(originLsn);
      cstring(out, name);
    });
  }

  static byte[] logicalMessage(boolean transactional, long lsn, String prefix, String content) {
    byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
    return message(out -> {
      out.writeByte('M');
      out.writeByte(transactional ? 1 : 0);
      out.writeLong(lsn);
      cstring(out, prefix);
      out.writeInt(bytes.length);
      out.write(bytes);
    });
  }

  static byte[] xlog(long walStart, byte[] payload) {
    return message(out -> {
      out.writeByte('w');
      out.writeLong(walStart);
      out.writeLong(walStart);
      out.writeLong(PgOutputCodec.toPgEpochMicros(COMMIT_TIME));
      out.write(payload);
    });
  }

  static byte[] keepalive(long walEnd, boolean replyRequested) {
    return message(out -> {
      out.writeByte('k');
      out.writeLong(walEnd);
      out.writeLong(PgOutputCodec.toPgEpochMicros(COMMIT_TIME));
      out.writeByte(replyRequested ? 1 : 0);
    });
  }

  /**
   * A whole single-row insert transaction as XLogData frames.
   */
  static byte[][] insertTransaction(long commitLsn, long xid, int relationId, Object... values) {
    return new byte[][] {
      xlog(commitLsn, begin(commitLsn, xid)),
      xlog(commitLsn, insert(relationId, values)),
      xlog(commitLsn, commit(commitLsn, commitLsn + 0x10))
    };
  }

  private static void tuple(DataOutputStream out, Object... values) throws IOException {
    out.writeShort(values.length);
    for (Object value : values) {
      if (value == null) {
        out.writeByte('n');
      } else if (value == UNCHANGED) {
        out.writeByte('u');
      } else if (value instanceof byte[]) {
        byte[] bytes = (byte[]) value;
        out.writeByte('b');
        out.writeInt(bytes.length);
        out.write(bytes);
      } else {
        byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
        out.writeByte('t');
        out.writeInt(bytes.length);
        out.write(bytes);
      }
    }
  }

  private static void cstring(DataOutputStream out, String value) throws IOException {
    out.write(value.getBytes(StandardCharsets.UTF_8));
    out.writeByte(0);
  }

  private static byte[] message(Writer writer) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      writer.write(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  private interface Writer {
    void write(DataOutputStream out) throws IOException;
  }

  static final class Column {
    private final String name;
    private final int typeOid;
    private final boolean key;

    private Column(String name, int typeOid, boolean key) {
      this.name = name;
      this.typeOid = typeOid;
      this.key = key;
    }
  }
}
