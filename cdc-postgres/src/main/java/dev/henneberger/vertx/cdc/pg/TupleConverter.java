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
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns column text literals into {@link CanonicalValue}s using the strategies of a
 * {@link TypeRegistry}. Numeric text is never routed through binary floating point.
 */
public final class TupleConverter {

  private final TypeRegistry types;

  public TupleConverter(TypeRegistry types) {
    this.types = Objects.requireNonNull(types, "types");
  }

  public TypeRegistry types() {
    return types;
  }

  /**
   * @throws DecodeException when the literal cannot be read as the column's type
   */
  public CanonicalValue convertColumn(RelationSchema relation, RelationColumn column, RawColumnValue raw) {
    try {
      return convert(raw, column.typeOid());
    } catch (IllegalArgumentException e) {
      throw new DecodeException(relation.namespace(), relation.name(), column.name(), column.typeOid(), raw.text(), e);
    }
  }

  /**
   * @throws IllegalArgumentException when the literal cannot be read as the type
   */
  public CanonicalValue convert(RawColumnValue raw, int typeOid) {
    switch (raw.kind()) {
      case NULL:
        return CanonicalValue.nullValue();
      case BINARY:
        return CanonicalValue.bytes(raw.bytes());
      case TEXT:
        return convertText(raw.text(), types.resolve(typeOid));
      default:
        throw new IllegalArgumentException("Unchanged toast value has no content to convert");
    }
  }

  public CanonicalValue convertText(String text, TypeInfo type) {
    switch (type.category()) {
      case BOOL:
        return CanonicalValue.bool(parseBool(text));
      case INTEGER:
        return CanonicalValue.integer(Long.parseLong(text.trim()));
      case FLOAT:
        return CanonicalValue.floating(Double.parseDouble(text.trim()));
      case DECIMAL:
        return CanonicalValue.decimal(checkDecimal(text.trim()));
      case BYTES:
        return CanonicalValue.bytes(parseBytea(text));
      case JSON:
        return CanonicalValue.json(parseJson(text));
      case DATE:
      case TIME:
      case INTERVAL:
        return CanonicalValue.temporal(text);
      case TIMETZ:
        return CanonicalValue.temporal(normalizeOffset(text, 0));
      case TIMESTAMP:
        return CanonicalValue.temporal(isoTimestamp(text, false));
      case TIMESTAMPTZ:
        return CanonicalValue.temporal(isoTimestamp(text, true));
      case ARRAY:
        return parseArray(text, types.elementOf(type));
      case COMPOSITE:
        return parseComposite(text, type.layout());
      default:
        return CanonicalValue.text(text);
    }
  }

  private static boolean parseBool(String text) {
    switch (text.trim().toLowerCase()) {
      case "t":
      case "true":
        return true;
      case "f":
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("Invalid boolean literal '" + text + "'");
    }
  }

  private static String checkDecimal(String text) {
    if ("NaN".equals(text) || "Infinity".equals(text) || "-Infinity".equals(text)) {
      return text;
    }
    new BigDecimal(text);
    return text;
  }

  private static Object parseJson(String text) {
    try {
      return Json.decodeValue(text);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
    }
  }

  static byte[] parseBytea(String text) {
    if (text.startsWith("\\x")) {
      int digits = text.length() - 2;
      if (digits % 2 != 0) {
        throw new IllegalArgumentException("Odd number of hex digits in bytea literal");
      }
      byte[] out = new byte[digits / 2];
      for (int i = 0; i < out.length; i++) {
        int hi = Character.digit(text.charAt(2 + i * 2), 16);
        int lo = Character.digit(text.charAt(3 + i * 2), 16);
        if (hi < 0 || lo < 0) {
          throw new IllegalArgumentException("Invalid hex digit in bytea literal");
        }
        out[i] = (byte) ((hi << 4) | lo);
      }
      return out;
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c != '\\') {
        out.write((byte) c);
        continue;
      }
      if (i + 1 < text.length() && text.charAt(i + 1) == '\\') {
        out.write('\\');
        i++;
      } else if (isOctal(text, i + 1)) {
        out.write(Integer.parseInt(text.substring(i + 1, i + 4), 8));
        i += 3;
      } else {
        throw new IllegalArgumentException("Invalid escape in bytea literal at " + i);
      }
    }
    return out.toByteArray();
  }

  private static boolean isOctal(String text, int start) {
    if (start + 3 > text.length()) {
      return false;
    }
    for (int i = start; i < start + 3; i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '7') {
        return false;
      }
    }
    return true;
  }

  static String isoTimestamp(String text, boolean withZone) {
    if (isSpecialTemporal(text)) {
      return text;
    }
    int space = text.indexOf(' ');
    String iso = space > 0 ? text.substring(0, space) + 'T' + text.substring(space + 1) : text;
    if (!withZone) {
      return iso;
    }
    return normalizeOffset(iso, iso.indexOf('T') + 1);
  }

  /**
   * Rewrites a trailing {@code +HH[:MM[:SS]]} offset as {@code +HH:MM[:SS]}, and a zero offset as
   * {@code Z}.
   */
  static String normalizeOffset(String value, int timeStart) {
    if (value.endsWith("Z") || isSpecialTemporal(value)) {
      return value;
    }
    int sign = Math.max(value.lastIndexOf('+'), value.lastIndexOf('-'));
    if (sign < timeStart || sign < 0) {
      return value;
    }
    String[] parts = value.substring(sign + 1).split(":");
    boolean zero = true;
    for (String part : parts) {
      if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
        throw new IllegalArgumentException("Invalid zone offset in '" + value + "'");
      }
      zero &= Integer.parseInt(part) == 0;
    }
    String base = value.substring(0, sign);
    if (zero) {
      return base + 'Z';
    }
    StringBuilder sb = new StringBuilder(base).append(value.charAt(sign)).append(pad2(parts[0]))
      .append(':').append(parts.length > 1 ? pad2(parts[1]) : "00");
    if (parts.length > 2) {
      sb.append(':').append(pad2(parts[2]));
    }
    return sb.toString();
  }

  private static String pad2(String digits) {
    return digits.length() == 1 ? "0" + digits : digits;
  }

  private static boolean isSpecialTemporal(String text) {
    return "infinity".equals(text) || "-infinity".equals(text) || text.endsWith(" BC");
  }

  private CanonicalValue parseArray(String text, TypeInfo elementType) {
    String literal = text.trim();
    if (literal.startsWith("[")) {
      int eq = literal.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("Invalid array dimensions in '" + text + "'");
      }
      literal = literal.substring(eq + 1).trim();
    }
    ArrayReader reader = new ArrayReader(literal, elementType);
    CanonicalValue value = reader.readArray();
    reader.skipWhitespace();
    if (reader.pos != literal.length()) {
      throw new IllegalArgumentException("Trailing characters after array literal '" + text + "'");
    }
    return value;
  }

  private CanonicalValue parseComposite(String text, CompositeLayout layout) {
    List<String> fields = splitRecord(text.trim());
    if (fields.size() != layout.fields().size()) {
      throw new IllegalArgumentException("Composite " + layout.qualifiedName() + " expects "
        + layout.fields().size() + " fields, literal has " + fields.size());
    }
    Map<String, CanonicalValue> values = new LinkedHashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      CompositeLayout.Field field = layout.fields().get(i);
      String raw = fields.get(i);
      if (raw == null) {
        values.put(field.name(), CanonicalValue.nullValue());
        continue;
      }
      TypeInfo fieldType = field.typeName() != null ? types.resolve(field.typeName()) : types.resolve(field.typeOid());
      values.put(field.name(), convertText(raw, fieldType));
    }
    return CanonicalValue.composite(values);
  }

  /**
   * Splits a record literal {@code (a,"b c",,"")}; an empty unquoted field is NULL.
   */
  static List<String> splitRecord(String literal) {
    if (literal.length() < 2 || literal.charAt(0) != '(' || literal.charAt(literal.length() - 1) != ')') {
      throw new IllegalArgumentException("Invalid record literal '" + literal + "'");
    }
    List<String> fields = new ArrayList<>();
    int pos = 1;
    int end = literal.length() - 1;
    while (true) {
      StringBuilder sb = new StringBuilder();
      boolean quoted = false;
      boolean inQuotes = false;
      while (pos < end || inQuotes) {
        if (pos >= end) {
          throw new IllegalArgumentException("Unterminated quote in record literal '" + literal + "'");
        }
        char c = literal.charAt(pos);
        if (inQuotes) {
          if (c == '"') {
            if (pos + 1 < end && literal.charAt(pos + 1) == '"') {
              sb.append('"');
              pos += 2;
            } else {
              inQuotes = false;
              pos++;
            }
          } else if (c == '\\' && pos + 1 < end) {
            sb.append(literal.charAt(pos + 1));
            pos += 2;
          } else {
            sb.append(c);
            pos++;
          }
          continue;
        }
        if (c == ',') {
          break;
        }
        if (c == '"') {
          inQuotes = true;
          quoted = true;
        } else if (c == '\\' && pos + 1 < end) {
          sb.append(literal.charAt(++pos));
        } else {
          sb.append(c);
        }
        pos++;
      }
      fields.add(!quoted && sb.length() == 0 ? null : sb.toString());
      if (pos >= end) {
        return fields;
      }
      pos++;
    }
  }

  private final class ArrayReader {
    private final String text;
    private final TypeInfo elementType;
    private final char delimiter;
    private int pos;

    private ArrayReader(String text, TypeInfo elementType) {
      this.text = text;
      this.elementType = elementType;
      this.delimiter = elementType.delimiter();
    }

    private CanonicalValue readArray() {
      skipWhitespace();
      expect('{');
      List<CanonicalValue> elements = new ArrayList<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return CanonicalValue.array(elements);
      }
      while (true) {
        skipWhitespace();
        if (peek() == '{') {
          elements.add(readArray());
        } else {
          elements.add(readElement());
        }
        skipWhitespace();
        char c = next();
        if (c == '}') {
          return CanonicalValue.array(elements);
        }
        if (c != delimiter) {
          throw new IllegalArgumentException("Unexpected '" + c + "' at " + (pos - 1) + " in array literal");
        }
      }
    }

    private CanonicalValue readElement() {
      StringBuilder sb = new StringBuilder();
      if (peek() == '"') {
        pos++;
        while (true) {
          char c = next();
          if (c == '"') {
            break;
          }
          sb.append(c == '\\' ? next() : c);
        }
        return convertText(sb.toString(), elementType);
      }
      while (peek() != delimiter && peek() != '}') {
        char c = next();
        sb.append(c == '\\' ? next() : c);
      }
      String element = sb.toString().trim();
      if (element.isEmpty()) {
        throw new IllegalArgumentException("Empty unquoted array element at " + pos);
      }
      if ("NULL".equalsIgnoreCase(element)) {
        return CanonicalValue.nullValue();
      }
      return convertText(element, elementType);
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      if (pos >= text.length()) {
        throw new IllegalArgumentException("Unterminated array literal");
      }
      return text.charAt(pos);
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private void expect(char expected) {
      char c = next();
      if (c != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at " + (pos - 1) + " in array literal");
      }
    }
  }
}
