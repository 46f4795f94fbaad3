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

import java.util.Objects;

/**
 * Conversion strategy of one type: how its text literal is read into a {@link CanonicalValue}.
 * Arrays reference their element type by OID (built-ins) or qualified name (user types).
 */
public final class TypeInfo {

  public enum Category {
    BOOL,
    INTEGER,
    FLOAT,
    DECIMAL,
    TEXT,
    BYTES,
    JSON,
    DATE,
    TIME,
    TIMETZ,
    TIMESTAMP,
    TIMESTAMPTZ,
    INTERVAL,
    ARRAY,
    COMPOSITE
  }

  private final int oid;
  private final String name;
  private final Category category;
  private final int elementOid;
  private final String elementName;
  private final char delimiter;
  private final CompositeLayout layout;

  private TypeInfo(int oid,
                   String name,
                   Category category,
                   int elementOid,
                   String elementName,
                   char delimiter,
                   CompositeLayout layout) {
    this.oid = oid;
    this.name = Objects.requireNonNull(name, "name");
    this.category = Objects.requireNonNull(category, "category");
    this.elementOid = elementOid;
    this.elementName = elementName;
    this.delimiter = delimiter;
    this.layout = layout;
  }

  public static TypeInfo scalar(int oid, String name, Category category) {
    return new TypeInfo(oid, name, category, 0, null, ',', null);
  }

  public static TypeInfo scalar(int oid, String name, Category category, char arrayDelimiter) {
    return new TypeInfo(oid, name, category, 0, null, arrayDelimiter, null);
  }

  public static TypeInfo arrayOf(int oid, String name, int elementOid) {
    return new TypeInfo(oid, name, Category.ARRAY, elementOid, null, ',', null);
  }

  public static TypeInfo arrayOf(int oid, String name, String elementName) {
    return new TypeInfo(oid, name, Category.ARRAY, 0, Objects.requireNonNull(elementName, "elementName"), ',', null);
  }

  public static TypeInfo composite(int oid, CompositeLayout layout) {
    return new TypeInfo(oid, layout.qualifiedName(), Category.COMPOSITE, 0, null, ',', layout);
  }

  public static TypeInfo text(int oid, String name) {
    return scalar(oid, name, Category.TEXT);
  }

  public int oid() {
    return oid;
  }

  public String name() {
    return name;
  }

  public Category category() {
    return category;
  }

  public int elementOid() {
    return elementOid;
  }

  public String elementName() {
    return elementName;
  }

  /**
   * Separator between elements when this type appears inside an array literal.
   */
  public char delimiter() {
    return delimiter;
  }

  public CompositeLayout layout() {
    return layout;
  }

  @Override
  public String toString() {
    return name + '(' + oid + ", " + category + ')';
  }
}
