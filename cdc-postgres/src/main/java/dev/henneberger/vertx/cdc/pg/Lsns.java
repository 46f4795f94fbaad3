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

import org.postgresql.replication.LogSequenceNumber;

/**
 * Conversions between the numeric and {@code X/Y} text form of log sequence numbers.
 */
public final class Lsns {

  private Lsns() {
  }

  public static String format(long lsn) {
    return LogSequenceNumber.valueOf(lsn).asString();
  }

  /**
   * @throws IllegalArgumentException when the text is not an {@code X/Y} LSN
   */
  public static long parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("LSN is blank");
    }
    LogSequenceNumber lsn = LogSequenceNumber.valueOf(text.trim());
    if (lsn == LogSequenceNumber.INVALID_LSN && !"0/0".equals(text.trim())) {
      throw new IllegalArgumentException("Invalid LSN '" + text + "'");
    }
    return lsn.asLong();
  }

  public static int compare(long left, long right) {
    return Long.compareUnsigned(left, right);
  }
}
