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
 * Column layout of one relation as announced by a Relation message. Relation ids are assigned by
 * the server and may be announced again with a different layout after DDL.
 */
public final class RelationSchema {
  private final int relationId;
  private final String namespace;
  private final String name;
  private final ReplicaIdentity replicaIdentity;
  private final List<RelationColumn> columns;

  public RelationSchema(int relationId,
                        String namespace,
                        String name,
                        ReplicaIdentity replicaIdentity,
                        List<RelationColumn> columns) {
    this.relationId = relationId;
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
    this.replicaIdentity = Objects.requireNonNull(replicaIdentity, "replicaIdentity");
    this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
  }

  public int relationId() {
    return relationId;
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  public String qualifiedName() {
    return namespace + '.' + name;
  }

  public ReplicaIdentity replicaIdentity() {
    return replicaIdentity;
  }

  public List<RelationColumn> columns() {
    return columns;
  }

  public int columnCount() {
    return columns.size();
  }

  public RelationColumn column(int index) {
    return columns.get(index);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RelationSchema)) {
      return false;
    }
    RelationSchema that = (RelationSchema) o;
    return relationId == that.relationId
      && namespace.equals(that.namespace)
      && name.equals(that.name)
      && replicaIdentity == that.replicaIdentity
      && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(relationId, namespace, name, replicaIdentity, columns);
  }

  @Override
  public String toString() {
    return "RelationSchema{" + Integer.toUnsignedString(relationId) + ' ' + qualifiedName() + ' ' + columns + '}';
  }
}
