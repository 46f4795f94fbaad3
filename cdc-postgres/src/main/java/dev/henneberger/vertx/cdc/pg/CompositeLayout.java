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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Field layout of a user-defined composite type. {@code pgoutput} only announces the type name,
 * so layouts are registered up front through {@link TypeRegistry#registerComposite}.
 */
public final class CompositeLayout {

  private final String qualifiedName;
  private final List<Field> fields;

  public CompositeLayout(String qualifiedName, List<Field> fields) {
    this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
    this.fields = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(fields, "fields")));
    if (this.fields.isEmpty()) {
      throw new IllegalArgumentException("composite " + qualifiedName + " needs at least one field");
    }
  }

  public String qualifiedName() {
    return qualifiedName;
  }

  public List<Field> fields() {
    return fields;
  }

  public static Field field(String name, int typeOid) {
    return new Field(name, typeOid, null);
  }

  /**
   * A field whose type is itself a registered user type, e.g. a nested composite.
   */
  public static Field field(String name, String typeName) {
    return new Field(name, 0, Objects.requireNonNull(typeName, "typeName"));
  }

  public static final class Field {
    private final String name;
    private final int typeOid;
    private final String typeName;

    private Field(String name, int typeOid, String typeName) {
      this.name = Objects.requireNonNull(name, "name");
      this.typeOid = typeOid;
      this.typeName = typeName;
    }

    public String name() {
      return name;
    }

    public int typeOid() {
      return typeOid;
    }

    public String typeName() {
      return typeName;
    }
  }
}
