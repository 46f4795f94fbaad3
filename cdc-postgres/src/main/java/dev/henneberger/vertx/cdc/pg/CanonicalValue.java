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

import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Database independent representation of one column value.
 * <p>
 * Decimals keep their exact text. Temporals hold ISO-8601 text, except for values ISO-8601 cannot
 * express ({@code infinity}, BC dates, intervals) which keep the server's text.
 */
public final class CanonicalValue {

  public enum Kind {
    NULL,
    BOOL,
    INTEGER,
    FLOAT,
    DECIMAL,
    TEXT,
    BYTES,
    JSON,
    ARRAY,
    COMPOSITE,
    TEMPORAL
  }

  private static final CanonicalValue NULL = new CanonicalValue(Kind.NULL, null);
  private static final CanonicalValue TRUE = new CanonicalValue(Kind.BOOL, Boolean.TRUE);
  private static final CanonicalValue FALSE = new CanonicalValue(Kind.BOOL, Boolean.FALSE);

  private final Kind kind;
  private final Object value;

  private CanonicalValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  public static CanonicalValue nullValue() {
    return NULL;
  }

  public static CanonicalValue bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static CanonicalValue integer(long value) {
    return new CanonicalValue(Kind.INTEGER, value);
  }

  public static CanonicalValue floating(double value) {
    return new CanonicalValue(Kind.FLOAT, value);
  }

  public static CanonicalValue decimal(String exactText) {
    return new CanonicalValue(Kind.DECIMAL, Objects.requireNonNull(exactText, "exactText"));
  }

  public static CanonicalValue text(String value) {
    return new CanonicalValue(Kind.TEXT, Objects.requireNonNull(value, "value"));
  }

  public static CanonicalValue bytes(byte[] value) {
    return new CanonicalValue(Kind.BYTES, Objects.requireNonNull(value, "value").clone());
  }

  /**
   * @param value a decoded JSON value: {@link JsonObject}, {@link JsonArray}, String, Number,
   *   Boolean or {@code null} for the JSON literal {@code null}
   */
  public static CanonicalValue json(Object value) {
    return new CanonicalValue(Kind.JSON, value);
  }

  public static CanonicalValue array(List<CanonicalValue> elements) {
    return new CanonicalValue(Kind.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)));
  }

  public static CanonicalValue composite(Map<String, CanonicalValue> fields) {
    return new CanonicalValue(Kind.COMPOSITE, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
  }

  public static CanonicalValue temporal(String isoText) {
    return new CanonicalValue(Kind.TEMPORAL, Objects.requireNonNull(isoText, "isoText"));
  }

  public Kind kind() {
    return kind;
  }

  public boolean isNull() {
    return kind == Kind.NULL;
  }

  public boolean asBoolean() {
    return (Boolean) expect(Kind.BOOL);
  }

  public long asLong() {
    return (Long) expect(Kind.INTEGER);
  }

  public double asDouble() {
    return (Double) expect(Kind.FLOAT);
  }

  /**
   * Text of DECIMAL, TEXT and TEMPORAL values.
   */
  public String asText() {
    if (kind != Kind.DECIMAL && kind != Kind.TEXT && kind != Kind.TEMPORAL) {
      throw new IllegalStateException("Value of kind " + kind + " has no text form");
    }
    return (String) value;
  }

  /**
   * @throws NumberFormatException for {@code NaN} and infinite decimals
   */
  public BigDecimal asBigDecimal() {
    return new BigDecimal((String) expect(Kind.DECIMAL));
  }

  public byte[] asBytes() {
    return ((byte[]) expect(Kind.BYTES)).clone();
  }

  public Object asJson() {
    return expect(Kind.JSON);
  }

  @SuppressWarnings("unchecked")
  public List<CanonicalValue> asArray() {
    return (List<CanonicalValue>) expect(Kind.ARRAY);
  }

  @SuppressWarnings("unchecked")
  public Map<String, CanonicalValue> asComposite() {
    return (Map<String, CanonicalValue>) expect(Kind.COMPOSITE);
  }

  /**
   * Value as it appears in the JSON rendering of a change event.
   */
  public Object toJsonValue(DecimalHandling decimalHandling) {
    switch (kind) {
      case NULL:
        return null;
      case FLOAT: {
        double d = (Double) value;
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          return Double.toString(d);
        }
        return d;
      }
      case DECIMAL:
        return decimalHandling == DecimalHandling.NUMBER ? decimalAsNumber((String) value) : value;
      case BYTES:
        return Base64.getEncoder().encodeToString((byte[]) value);
      case JSON:
        return value;
      case ARRAY: {
        JsonArray out = new JsonArray();
        for (CanonicalValue element : asArray()) {
          out.add(element.toJsonValue(decimalHandling));
        }
        return out;
      }
      case COMPOSITE: {
        JsonObject out = new JsonObject();
        asComposite().forEach((name, field) -> out.put(name, field.toJsonValue(decimalHandling)));
        return out;
      }
      default:
        return value;
    }
  }

  private static Object decimalAsNumber(String text) {
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return text;
    }
  }

  private Object expect(Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("Expected " + expected + " but value is " + kind);
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalValue)) {
      return false;
    }
    CanonicalValue that = (CanonicalValue) o;
    if (kind != that.kind) {
      return false;
    }
    if (kind == Kind.BYTES) {
      return Arrays.equals((byte[]) value, (byte[]) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + (kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value));
  }

  @Override
  public String toString() {
    switch (kind) {
      case NULL:
        return "NULL";
      case BYTES:
        return "bytes[" + ((byte[]) value).length + ']';
      case JSON:
        return Json.encode(value);
      default:
        return kind + "(" + value + ")";
    }
  }
}
