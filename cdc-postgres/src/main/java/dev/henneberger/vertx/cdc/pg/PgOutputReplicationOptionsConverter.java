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

import dev.henneberger.vertx.cdc.core.ReconnectPolicy;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class PgOutputReplicationOptionsConverter {

  private PgOutputReplicationOptionsConverter() {
  }

  static void fromJson(JsonObject json, PgOutputReplicationOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("database")) {
      options.setDatabase(json.getString("database"));
    }
    if (json.containsKey("databaseName")) {
      options.setDatabaseName(json.getString("databaseName"));
    }
    if (json.containsKey("user")) {
      options.setUser(json.getString("user"));
    }
    if (json.containsKey("password")) {
      options.setPassword(json.getString("password"));
    }
    if (json.containsKey("passwordEnv")) {
      options.setPasswordEnv(json.getString("passwordEnv"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("createSlot")) {
      options.setCreateSlot(json.getBoolean("createSlot", false));
    }

    JsonArray publications = json.getJsonArray("publicationNames");
    if (publications != null) {
      List<String> names = new ArrayList<>(publications.size());
      for (int i = 0; i < publications.size(); i++) {
        names.add(publications.getString(i));
      }
      options.setPublicationNames(names);
    }

    if (json.containsKey("protocolVersion")) {
      options.setProtocolVersion(json.getInteger("protocolVersion"));
    }
    if (json.containsKey("startLsn")) {
      options.setStartLsn(json.getString("startLsn"));
    }
    if (json.getString("acknowledgeMode") != null) {
      options.setAcknowledgeMode(AcknowledgeMode.valueOf(json.getString("acknowledgeMode")));
    }
    if (json.containsKey("statusIntervalMs")) {
      options.setStatusInterval(Duration.ofMillis(json.getLong("statusIntervalMs")));
    }
    if (json.containsKey("pollIntervalMs")) {
      options.setPollInterval(Duration.ofMillis(json.getLong("pollIntervalMs")));
    }
    if (json.containsKey("channelCapacity")) {
      options.setChannelCapacity(json.getInteger("channelCapacity"));
    }
    if (json.containsKey("maxDeferredRows")) {
      options.setMaxDeferredRows(json.getInteger("maxDeferredRows"));
    }
    if (json.getString("decodeErrorPolicy") != null) {
      options.setDecodeErrorPolicy(DecodeErrorPolicy.valueOf(json.getString("decodeErrorPolicy")));
    }
    if (json.getString("decimalHandling") != null) {
      options.setDecimalHandling(DecimalHandling.valueOf(json.getString("decimalHandling")));
    }
    if (json.containsKey("preflightEnabled")) {
      options.setPreflightEnabled(json.getBoolean("preflightEnabled"));
    }
    if (json.containsKey("autoStart")) {
      options.setAutoStart(json.getBoolean("autoStart"));
    }

    if (json.containsKey("reconnectPolicy")) {
      JsonObject policyJson = json.getJsonObject("reconnectPolicy");
      if (policyJson == null) {
        options.setReconnectPolicy(ReconnectPolicy.never());
      } else {
        ReconnectPolicy parsed = PgOutputReplicationOptions.defaultReconnectPolicy();
        parsed.setInitialDelay(Duration.ofMillis(policyJson.getLong("initialDelayMs",
          ReconnectPolicy.DEFAULT_INITIAL_DELAY.toMillis())));
        parsed.setMaxDelay(Duration.ofMillis(policyJson.getLong("maxDelayMs", ReconnectPolicy.DEFAULT_MAX_DELAY.toMillis())));
        parsed.setMultiplier(policyJson.getDouble("multiplier", 2.0d));
        parsed.setJitter(policyJson.getDouble("jitter", 0.2d));
        parsed.setMaxAttempts(policyJson.getLong("maxAttempts", 0L));
        options.setReconnectPolicy(parsed);
      }
    }
  }

  static void toJson(PgOutputReplicationOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("database", options.getDatabase());
    json.put("databaseName", options.getDatabaseName());
    json.put("user", options.getUser());
    json.put("password", options.getPassword());
    json.put("passwordEnv", options.getPasswordEnv());
    json.put("ssl", options.getSsl());
    json.put("slotName", options.getSlotName());
    json.put("createSlot", options.isCreateSlot());
    json.put("publicationNames", new JsonArray(new ArrayList<>(options.getPublicationNames())));
    json.put("protocolVersion", options.getProtocolVersion());
    json.put("startLsn", options.getStartLsn());
    json.put("acknowledgeMode", options.getAcknowledgeMode().name());
    json.put("statusIntervalMs", options.getStatusInterval().toMillis());
    json.put("pollIntervalMs", options.getPollInterval().toMillis());
    json.put("channelCapacity", options.getChannelCapacity());
    json.put("maxDeferredRows", options.getMaxDeferredRows());
    json.put("decodeErrorPolicy", options.getDecodeErrorPolicy().name());
    json.put("decimalHandling", options.getDecimalHandling().name());
    json.put("preflightEnabled", options.isPreflightEnabled());
    json.put("autoStart", options.isAutoStart());

    ReconnectPolicy policy = options.getReconnectPolicy();
    if (policy != null && policy.isEnabled()) {
      JsonObject retry = new JsonObject();
      retry.put("initialDelayMs", policy.getInitialDelay().toMillis());
      retry.put("maxDelayMs", policy.getMaxDelay().toMillis());
      retry.put("multiplier", policy.getMultiplier());
      retry.put("jitter", policy.getJitter());
      retry.put("maxAttempts", policy.getMaxAttempts());
      json.put("reconnectPolicy", retry);
    } else {
      json.putNull("reconnectPolicy");
    }
  }
}
