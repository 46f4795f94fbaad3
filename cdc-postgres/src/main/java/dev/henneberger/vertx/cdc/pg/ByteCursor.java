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

import java.nio.charset.StandardCharsets;

/**
 * Big-endian reader over one protocol payload. Every read is bounds checked and reports a
 * truncated frame as {@link ProtocolException}.
 */
final class ByteCursor {
  private final byte[] bytes;
  private final String what;
  private int index;

  ByteCursor(byte[] bytes, String what) {
    this.bytes = bytes;
    this.what = what;
  }

  boolean hasRemaining() {
    return index < bytes.length;
  }

  int remaining() {
    return bytes.length - index;
  }

  int position() {
    return index;
  }

  byte readByte() {
    require(1);
    return bytes[index++];
  }

  int readUnsignedShort() {
    require(2);
    return ((bytes[index++] & 0xff) << 8) | (bytes[index++] & 0xff);
  }

  int readInt() {
    require(4);
    int value = ((bytes[index] & 0xff) << 24)
      | ((bytes[index + 1] & 0xff) << 16)
      | ((bytes[index + 2] & 0xff) << 8)
      | (bytes[index + 3] & 0xff);
    index += 4;
    return value;
  }

  long readLong() {
    require(8);
    long value = ((long) (bytes[index] & 0xff) << 56)
      | ((long) (bytes[index + 1] & 0xff) << 48)
      | ((long) (bytes[index + 2] & 0xff) << 40)
      | ((long) (bytes[index + 3] & 0xff) << 32)
      | ((long) (bytes[index + 4] & 0xff) << 24)
      | ((long) (bytes[index + 5] & 0xff) << 16)
      | ((long) (bytes[index + 6] & 0xff) << 8)
      | (bytes[index + 7] & 0xff);
    index += 8;
    return value;
  }

  String readCString() {
    int start = index;
    while (index < bytes.length && bytes[index] != 0) {
      index++;
    }
    if (index >= bytes.length) {
      throw new ProtocolException("Unterminated string in " + what + " at offset " + start);
    }
    String out = new String(bytes, start, index - start, StandardCharsets.UTF_8);
    index++;
    return out;
  }

  byte[] readBytes(int len) {
    if (len < 0) {
      throw new ProtocolException("Negative length " + len + " in " + what + " at offset " + index);
    }
    require(len);
    byte[] out = new byte[len];
    System.arraycopy(bytes, index, out, 0, len);
    index += len;
    return out;
  }

  byte[] readRemaining() {
    return readBytes(remaining());
  }

  void expectEnd() {
    if (hasRemaining()) {
      throw new ProtocolException(remaining() + " trailing bytes after " + what);
    }
  }

  private void require(int count) {
    if (bytes.length - index < count) {
      throw new ProtocolException("Truncated " + what + ": needed " + count + " bytes at offset " + index
        + ", " + (bytes.length - index) + " available");
    }
  }
}
