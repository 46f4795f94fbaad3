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

public final class RelationColumn {
  private final String name;
  private final int typeOid;
  private final int typeModifier;
  private final boolean key;

  public RelationColumn(String name, int typeOid, int typeModifier, boolean key) {
    this.name = Objects.requireNonNull(name, "name");
    this.typeOid = typeOid;
    this.typeModifier = typeModifier;
    this.key = key;
  }

  public static RelationColumn of(String name, int typeOid, boolean key) {
    return new RelationColumn(name, typeOid, -1, key);
  }

  public String name() {
    return name;
  }

  public int typeOid() {
    return typeOid;
  }

  public int typeModifier() {
    return typeModifier;
  }

  /**
   * Part of the replica identity key.
   */
  public boolean isKey() {
    return key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RelationColumn)) {
      return false;
    }
    RelationColumn that = (RelationColumn) o;
    return typeOid == that.typeOid && typeModifier == that.typeModifier && key == that.key && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeOid, typeModifier, key);
  }

  @Override
  public String toString() {
    return name + ':' + typeOid + (key ? " key" : "");
  }
}
