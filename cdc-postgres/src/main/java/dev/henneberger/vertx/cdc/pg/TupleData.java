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

public final class TupleData {
  private final List<RawColumnValue> columns;

  public TupleData(List<RawColumnValue> columns) {
    this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
  }

  public static TupleData of(RawColumnValue... columns) {
    return new TupleData(List.of(columns));
  }

  public int size() {
    return columns.size();
  }

  public RawColumnValue get(int index) {
    return columns.get(index);
  }

  public List<RawColumnValue> columns() {
    return columns;
  }

  public boolean hasUnchangedToast() {
    for (RawColumnValue column : columns) {
      if (column.isUnchangedToast()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TupleData && columns.equals(((TupleData) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return columns.toString();
  }
}
