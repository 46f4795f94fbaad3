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

import dev.henneberger.vertx.cdc.core.ChangeFilter;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Selects change events by table and operation. Table names match either {@code schema.table} or
 * the bare table name, case-insensitively.
 */
public final class ChangeEventFilter implements ChangeFilter<ChangeEvent> {

  private final Set<String> includeTables = new LinkedHashSet<>();
  private final Set<String> excludeTables = new LinkedHashSet<>();
  private final EnumSet<ChangeEvent.Operation> operations = EnumSet.allOf(ChangeEvent.Operation.class);

  private ChangeEventFilter() {
  }

  public static ChangeEventFilter all() {
    return new ChangeEventFilter();
  }

  public static ChangeEventFilter tables(String... tables) {
    return new ChangeEventFilter().includeTables(tables);
  }

  public ChangeEventFilter includeTables(String... tables) {
    addTables(includeTables, tables);
    return this;
  }

  public ChangeEventFilter excludeTables(String... tables) {
    addTables(excludeTables, tables);
    return this;
  }

  public ChangeEventFilter operations(ChangeEvent.Operation... operations) {
    Objects.requireNonNull(operations, "operations");
    this.operations.clear();
    this.operations.addAll(Arrays.asList(operations));
    return this;
  }

  public ChangeEventFilter onlyCreates() {
    return operations(ChangeEvent.Operation.CREATE);
  }

  public ChangeEventFilter nonDeletes() {
    return operations(ChangeEvent.Operation.CREATE, ChangeEvent.Operation.UPDATE);
  }

  @Override
  public boolean test(ChangeEvent event) {
    Objects.requireNonNull(event, "event");
    if (!operations.contains(event.getOperation())) {
      return false;
    }
    String qualified = normalize(event.getTable());
    String bare = normalize(event.getSource().getTable());
    if (!includeTables.isEmpty() && !includeTables.contains(qualified) && !includeTables.contains(bare)) {
      return false;
    }
    return !excludeTables.contains(qualified) && !excludeTables.contains(bare);
  }

  public Set<String> includedTables() {
    return Collections.unmodifiableSet(includeTables);
  }

  public Set<String> excludedTables() {
    return Collections.unmodifiableSet(excludeTables);
  }

  private static void addTables(Set<String> target, String... tables) {
    Objects.requireNonNull(tables, "tables");
    for (String table : tables) {
      if (table != null && !table.isBlank()) {
        target.add(normalize(table));
      }
    }
  }

  private static String normalize(String table) {
    return table.toLowerCase(Locale.ROOT);
  }
}
