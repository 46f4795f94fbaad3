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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChangeEventTest {

  private static final Instant EMITTED = Instant.parse("2024-01-15T10:30:01.123456789Z");
  private static final SourceInfo SOURCE = new SourceInfo("orders_slot", "app", "public", "orders", 731L,
    0x16B3748L, Instant.parse("2024-01-15T10:30:00.250Z"));

  @Test
  void rendersTheEnvelope() {
    Map<String, CanonicalValue> after = new LinkedHashMap<>();
    after.put("id", CanonicalValue.integer(42));
    after.put("total", CanonicalValue.decimal("19.90"));
    after.put("tags", CanonicalValue.array(List.of(CanonicalValue.text("new"), CanonicalValue.nullValue())));
    after.put("payload", CanonicalValue.bytes(new byte[] {1, 2, 3}));
    after.put("placed_at", CanonicalValue.temporal("2024-01-15T10:30:00Z"));
    after.put("note", CanonicalValue.nullValue());

    JsonObject json = new ChangeEvent(ChangeEvent.Operation.CREATE, null, after, SOURCE, EMITTED,
      DecimalHandling.STRING).toJson();

    assertEquals("c", json.getString("op"));
    assertNull(json.getValue("before"));
    assertEquals(1705314601123L, json.getLong("ts_ms"));
    assertEquals(1705314601123456L, json.getLong("ts_us"));
    assertEquals(1705314601123456789L, json.getLong("ts_ns"));

    JsonObject row = json.getJsonObject("after");
    assertEquals(42L, row.getLong("id"));
    assertEquals("19.90", row.getString("total"));
    assertEquals(new JsonArray().add("new").addNull(), row.getJsonArray("tags"));
    assertEquals("AQID", row.getString("payload"));
    assertEquals("2024-01-15T10:30:00Z", row.getString("placed_at"));
    assertTrue(row.containsKey("note"));

    JsonObject source = json.getJsonObject("source");
    assertEquals("0.1.0", source.getString("version"));
    assertEquals("postgresql", source.getString("connector"));
    assertEquals("orders_slot", source.getString("name"));
    assertEquals(1705314600250L, source.getLong("ts_ms"));
    assertEquals("false", source.getString("snapshot"));
    assertEquals("app", source.getString("db"));
    assertEquals("public", source.getString("schema"));
    assertEquals("orders", source.getString("table"));
    assertEquals(731L, source.getLong("txId"));
    assertEquals(0x16B3748L, source.getLong("lsn"));
  }

  @Test
  void numberDecimalHandlingRendersDecimalsAsNumbers() {
    Map<String, CanonicalValue> before = Map.of("total", CanonicalValue.decimal("19.90"));
    ChangeEvent event = new ChangeEvent(ChangeEvent.Operation.DELETE, before, null, SOURCE, EMITTED,
      DecimalHandling.NUMBER);

    assertEquals(new BigDecimal("19.90"), event.beforeJson().getValue("total"));
    assertNull(event.afterJson());
    assertEquals(new BigDecimal("19.90"), event.decimal("total"));
    assertEquals("19.90", event.string("total"));
  }

  @Test
  void exposesSourcePositionForAcknowledgement() {
    ChangeEvent event = new ChangeEvent(ChangeEvent.Operation.UPDATE, Map.of(), Map.of(), SOURCE, EMITTED,
      DecimalHandling.STRING);

    assertEquals(0x16B3748L, event.ackLsn());
    assertEquals("0/16B3748", event.getSource().getLsnText());
    assertEquals("public.orders", event.getTable());
  }

  @Test
  void rejectsImagesThatDoNotFitTheOperation() {
    Map<String, CanonicalValue> row = Map.of("id", CanonicalValue.integer(1));

    assertThrows(IllegalArgumentException.class,
      () -> new ChangeEvent(ChangeEvent.Operation.CREATE, row, row, SOURCE, EMITTED, DecimalHandling.STRING));
    assertThrows(IllegalArgumentException.class,
      () -> new ChangeEvent(ChangeEvent.Operation.DELETE, row, row, SOURCE, EMITTED, DecimalHandling.STRING));
    assertThrows(IllegalArgumentException.class,
      () -> new ChangeEvent(ChangeEvent.Operation.UPDATE, null, row, SOURCE, EMITTED, DecimalHandling.STRING));
  }

  @Test
  void imagesAreImmutableCopies() {
    Map<String, CanonicalValue> after = new LinkedHashMap<>();
    after.put("id", CanonicalValue.integer(1));
    ChangeEvent event = new ChangeEvent(ChangeEvent.Operation.CREATE, null, after, SOURCE, EMITTED,
      DecimalHandling.STRING);
    after.put("id", CanonicalValue.integer(2));

    assertEquals(1L, event.longValue("id"));
    assertThrows(UnsupportedOperationException.class, () -> event.getAfter().put("x", CanonicalValue.nullValue()));
  }
}
