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

import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row change. {@code before} is absent for creates, {@code after} for deletes; updates carry
 * both. Column maps keep the relation's column order.
 */
public final class ChangeEvent {

  /**
   * The row operation type.
   */
  public enum Operation {
    CREATE("c"),
    UPDATE("u"),
    DELETE("d");

    private final String code;

    Operation(String code) {
      this.code = code;
    }

    public String code() {
      return code;
    }
  }

  private final Operation operation;
  private final Map<String, CanonicalValue> before;
  private final Map<String, CanonicalValue> after;
  private final SourceInfo source;
  private final Instant emittedAt;
  private final DecimalHandling decimalHandling;

  public ChangeEvent(Operation operation,
                     Map<String, CanonicalValue> before,
                     Map<String, CanonicalValue> after,
                     SourceInfo source,
                     Instant emittedAt,
                     DecimalHandling decimalHandling) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.before = unmodifiableCopy(before);
    this.after = unmodifiableCopy(after);
    this.source = Objects.requireNonNull(source, "source");
    this.emittedAt = Objects.requireNonNull(emittedAt, "emittedAt");
    this.decimalHandling = Objects.requireNonNull(decimalHandling, "decimalHandling");
    if ((operation == Operation.CREATE) != (this.before == null) || (operation == Operation.DELETE) != (this.after == null)) {
      throw new IllegalArgumentException(operation + " event with before=" + before + " after=" + after);
    }
  }

  public Operation getOperation() {
    return operation;
  }

  /**
   * @return the old image, {@code null} for creates
   */
  public Map<String, CanonicalValue> getBefore() {
    return before;
  }

  /**
   * @return the new image, {@code null} for deletes
   */
  public Map<String, CanonicalValue> getAfter() {
    return after;
  }

  public SourceInfo getSource() {
    return source;
  }

  /**
   * {@code schema.table}
   */
  public String getTable() {
    return source.getSchema() + '.' + source.getTable();
  }

  /**
   * Position to acknowledge once this event is processed.
   */
  public long ackLsn() {
    return source.getLsn();
  }

  public Instant getEmittedAt() {
    return emittedAt;
  }

  public long getTsMs() {
    return emittedAt.toEpochMilli();
  }

  public long getTsUs() {
    return Math.addExact(Math.multiplyExact(emittedAt.getEpochSecond(), 1_000_000L), emittedAt.getNano() / 1_000L);
  }

  public long getTsNs() {
    return Math.addExact(Math.multiplyExact(emittedAt.getEpochSecond(), 1_000_000_000L), emittedAt.getNano());
  }

  public Map<String, CanonicalValue> rowOrKeys() {
    return after != null ? after : before;
  }

  public CanonicalValue value(String field) {
    return rowOrKeys().get(field);
  }

  public String string(String field) {
    return asString(value(field));
  }

  public Long longValue(String field) {
    CanonicalValue value = value(field);
    if (value == null || value.isNull()) {
      return null;
    }
    switch (value.kind()) {
      case INTEGER:
        return value.asLong();
      case DECIMAL:
      case TEXT:
        try {
          return Long.valueOf(value.asText());
        } catch (NumberFormatException ignore) {
          return null;
        }
      default:
        return null;
    }
  }

  public BigDecimal decimal(String field) {
    CanonicalValue value = value(field);
    if (value == null || value.isNull()) {
      return null;
    }
    try {
      switch (value.kind()) {
        case DECIMAL:
        case TEXT:
          return new BigDecimal(value.asText());
        case INTEGER:
          return BigDecimal.valueOf(value.asLong());
        case FLOAT:
          return BigDecimal.valueOf(value.asDouble());
        default:
          return null;
      }
    } catch (NumberFormatException ignore) {
      return null;
    }
  }

  public String stringFromBefore(String field) {
    return before == null ? null : asString(before.get(field));
  }

  public JsonObject afterJson() {
    return after == null ? null : rowJson(after);
  }

  public JsonObject beforeJson() {
    return before == null ? null : rowJson(before);
  }

  /**
   * Debezium style envelope {@code {op, before, after, source, ts_ms, ts_us, ts_ns}}.
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("op", operation.code())
      .put("before", beforeJson())
      .put("after", afterJson())
      .put("source", source.toJson())
      .put("ts_ms", getTsMs())
      .put("ts_us", getTsUs())
      .put("ts_ns", getTsNs());
  }

  @Override
  public String toString() {
    return "ChangeEvent{" +
      "op=" + operation.code() +
      ", source=" + source +
      ", before=" + before +
      ", after=" + after +
      '}';
  }

  private JsonObject rowJson(Map<String, CanonicalValue> row) {
    JsonObject json = new JsonObject();
    row.forEach((name, value) -> json.put(name, value.toJsonValue(decimalHandling)));
    return json;
  }

  private static String asString(CanonicalValue value) {
    if (value == null || value.isNull()) {
      return null;
    }
    switch (value.kind()) {
      case TEXT:
      case DECIMAL:
      case TEMPORAL:
        return value.asText();
      case INTEGER:
        return Long.toString(value.asLong());
      case BOOL:
        return Boolean.toString(value.asBoolean());
      case FLOAT:
        return Double.toString(value.asDouble());
      default:
        return String.valueOf(value.toJsonValue(DecimalHandling.STRING));
    }
  }

  private static Map<String, CanonicalValue> unmodifiableCopy(Map<String, CanonicalValue> data) {
    if (data == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
