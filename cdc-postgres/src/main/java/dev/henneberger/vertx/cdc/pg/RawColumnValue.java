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
import java.util.Arrays;
import java.util.Objects;

/**
 * One column of a tuple as it came off the wire.
 */
public final class RawColumnValue {

  public enum Kind {
    NULL('n'),
    UNCHANGED_TOAST('u'),
    TEXT('t'),
    BINARY('b');

    private final char marker;

    Kind(char marker) {
      this.marker = marker;
    }

    public char marker() {
      return marker;
    }
  }

  private static final RawColumnValue NULL = new RawColumnValue(Kind.NULL, null);
  private static final RawColumnValue UNCHANGED_TOAST = new RawColumnValue(Kind.UNCHANGED_TOAST, null);

  private final Kind kind;
  private final byte[] bytes;

  private RawColumnValue(Kind kind, byte[] bytes) {
    this.kind = kind;
    this.bytes = bytes;
  }

  public static RawColumnValue nullValue() {
    return NULL;
  }

  public static RawColumnValue unchangedToast() {
    return UNCHANGED_TOAST;
  }

  public static RawColumnValue text(byte[] bytes) {
    return new RawColumnValue(Kind.TEXT, Objects.requireNonNull(bytes, "bytes"));
  }

  public static RawColumnValue text(String value) {
    return text(value.getBytes(StandardCharsets.UTF_8));
  }

  public static RawColumnValue binary(byte[] bytes) {
    return new RawColumnValue(Kind.BINARY, Objects.requireNonNull(bytes, "bytes"));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean isUnchangedToast() {
    return kind == Kind.UNCHANGED_TOAST;
  }

  public byte[] bytes() {
    return bytes == null ? null : bytes.clone();
  }

  /**
   * Payload decoded as UTF-8, {@code null} for NULL and unchanged-toast columns.
   */
  public String text() {
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawColumnValue)) {
      return false;
    }
    RawColumnValue that = (RawColumnValue) o;
    return kind == that.kind && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NULL:
        return "null";
      case UNCHANGED_TOAST:
        return "<unchanged-toast>";
      case TEXT:
        return '\'' + text() + '\'';
      default:
        return "<binary " + bytes.length + " bytes>";
    }
  }
}
