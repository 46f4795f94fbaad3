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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RelationCacheTest {

  private static final int CUSTOMERS = 16385;

  @Test
  void unseenRelationIsUnknown() {
    RelationCache cache = new RelationCache();

    UnknownRelationException error = assertThrows(UnknownRelationException.class, () -> cache.get(CUSTOMERS));
    assertEquals(CUSTOMERS, error.relationId());
    assertFalse(cache.contains(CUSTOMERS));
  }

  @Test
  void relationIdsAboveSignedRangeAreReportedUnsigned() {
    UnknownRelationException error = assertThrows(UnknownRelationException.class,
      () -> new RelationCache().get(0xFFFFFFF0));
    assertTrue(error.getMessage().endsWith("4294967280"), error.getMessage());
  }

  @Test
  void laterRelationMessageReplacesTheLayout() {
    RelationCache cache = new RelationCache();
    cache.upsert(customers(RelationColumn.of("_id", PgTypeOids.TEXT, true)));
    RelationSchema altered = customers(
      RelationColumn.of("_id", PgTypeOids.TEXT, true),
      RelationColumn.of("email", PgTypeOids.TEXT, false));

    cache.upsert(altered);

    assertSame(altered, cache.get(CUSTOMERS));
    assertEquals(2, cache.get(CUSTOMERS).columnCount());
    assertEquals(1, cache.size());
  }

  @Test
  void clearForgetsLearnedRelations() {
    RelationCache cache = new RelationCache();
    cache.upsert(customers(RelationColumn.of("_id", PgTypeOids.TEXT, true)));
    assertTrue(cache.contains(CUSTOMERS));

    cache.clear();

    assertEquals(0, cache.size());
    assertThrows(UnknownRelationException.class, () -> cache.get(CUSTOMERS));
  }

  private static RelationSchema customers(RelationColumn... columns) {
    return new RelationSchema(CUSTOMERS, "public", "customers", ReplicaIdentity.DEFAULT, List.of(columns));
  }
}
