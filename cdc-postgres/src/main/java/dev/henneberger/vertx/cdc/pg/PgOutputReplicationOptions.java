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

import dev.henneberger.vertx.cdc.core.LsnStore;
import dev.henneberger.vertx.cdc.core.OptionValidation;
import dev.henneberger.vertx.cdc.core.ReconnectPolicy;
import io.vertx.codegen.annotations.DataObject;
import io.vertx.codegen.annotations.GenIgnore;
import io.vertx.codegen.json.annotations.JsonGen;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Connection, slot and delivery configuration of a {@link PgOutputReplicationSession}.
 */
@DataObject
@JsonGen(publicConverter = false)
public class PgOutputReplicationOptions {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;
  public static final int DEFAULT_PROTOCOL_VERSION = 1;
  public static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
  public static final int DEFAULT_CHANNEL_CAPACITY = 8192;
  public static final int DEFAULT_MAX_DEFERRED_ROWS = 10_000;

  private String host;
  private int port;
  private String database;
  private String databaseName;
  private String user;
  private String password;
  private String passwordEnv;
  private boolean ssl;
  private String slotName;
  private boolean createSlot;
  private List<String> publicationNames;
  private int protocolVersion;
  private String startLsn;
  private AcknowledgeMode acknowledgeMode;
  private Duration statusInterval;
  private Duration pollInterval;
  private int channelCapacity;
  private int maxDeferredRows;
  private DecodeErrorPolicy decodeErrorPolicy;
  private DecimalHandling decimalHandling;
  private ReconnectPolicy reconnectPolicy;
  private boolean preflightEnabled;
  private boolean autoStart;
  private LsnStore lsnStore;

  public PgOutputReplicationOptions() {
    init();
  }

  public PgOutputReplicationOptions(JsonObject json) {
    init();
    PgOutputReplicationOptionsConverter.fromJson(json, this);
  }

  public PgOutputReplicationOptions(PgOutputReplicationOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.databaseName = other.databaseName;
    this.user = other.user;
    this.password = other.password;
    this.passwordEnv = other.passwordEnv;
    this.ssl = other.ssl;
    this.slotName = other.slotName;
    this.createSlot = other.createSlot;
    this.publicationNames = new ArrayList<>(other.publicationNames);
    this.protocolVersion = other.protocolVersion;
    this.startLsn = other.startLsn;
    this.acknowledgeMode = other.acknowledgeMode;
    this.statusInterval = other.statusInterval;
    this.pollInterval = other.pollInterval;
    this.channelCapacity = other.channelCapacity;
    this.maxDeferredRows = other.maxDeferredRows;
    this.decodeErrorPolicy = other.decodeErrorPolicy;
    this.decimalHandling = other.decimalHandling;
    this.reconnectPolicy = other.reconnectPolicy.copy();
    this.preflightEnabled = other.preflightEnabled;
    this.autoStart = other.autoStart;
    this.lsnStore = other.lsnStore;
  }

  /**
   * Reconnect policy used unless one is configured: unbounded exponential backoff that gives up
   * immediately on {@link InvariantViolationException}.
   */
  public static ReconnectPolicy defaultReconnectPolicy() {
    return ReconnectPolicy.exponentialBackoff()
      .setRetryOn(err -> !(err instanceof InvariantViolationException));
  }

  public String getHost() {
    return host;
  }

  public PgOutputReplicationOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public PgOutputReplicationOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public PgOutputReplicationOptions setDatabase(String database) {
    this.database = database;
    return this;
  }

  /**
   * Name reported as {@code source.db}; falls back to {@link #getDatabase()}.
   */
  public String getDatabaseName() {
    return databaseName == null || databaseName.isBlank() ? database : databaseName;
  }

  public PgOutputReplicationOptions setDatabaseName(String databaseName) {
    this.databaseName = databaseName;
    return this;
  }

  public String getUser() {
    return user;
  }

  public PgOutputReplicationOptions setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public PgOutputReplicationOptions setPassword(String password) {
    this.password = password;
    return this;
  }

  public String getPasswordEnv() {
    return passwordEnv;
  }

  public PgOutputReplicationOptions setPasswordEnv(String passwordEnv) {
    this.passwordEnv = passwordEnv;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public PgOutputReplicationOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getSlotName() {
    return slotName;
  }

  public PgOutputReplicationOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public boolean isCreateSlot() {
    return createSlot;
  }

  /**
   * Create the {@code pgoutput} slot on connect when it does not exist yet.
   */
  public PgOutputReplicationOptions setCreateSlot(boolean createSlot) {
    this.createSlot = createSlot;
    return this;
  }

  public List<String> getPublicationNames() {
    return Collections.unmodifiableList(publicationNames);
  }

  public PgOutputReplicationOptions setPublicationNames(List<String> publicationNames) {
    this.publicationNames = publicationNames == null ? new ArrayList<>() : new ArrayList<>(publicationNames);
    return this;
  }

  public PgOutputReplicationOptions addPublicationName(String publicationName) {
    this.publicationNames.add(publicationName);
    return this;
  }

  public int getProtocolVersion() {
    return protocolVersion;
  }

  public PgOutputReplicationOptions setProtocolVersion(int protocolVersion) {
    this.protocolVersion = protocolVersion;
    return this;
  }

  public String getStartLsn() {
    return startLsn;
  }

  /**
   * Position to request on the first connection, in {@code X/Y} form. Takes precedence over the
   * checkpoint in the {@link LsnStore}.
   */
  public PgOutputReplicationOptions setStartLsn(String startLsn) {
    this.startLsn = startLsn;
    return this;
  }

  public AcknowledgeMode getAcknowledgeMode() {
    return acknowledgeMode;
  }

  public PgOutputReplicationOptions setAcknowledgeMode(AcknowledgeMode acknowledgeMode) {
    this.acknowledgeMode = Objects.requireNonNull(acknowledgeMode, "acknowledgeMode");
    return this;
  }

  public Duration getStatusInterval() {
    return statusInterval;
  }

  public PgOutputReplicationOptions setStatusInterval(Duration statusInterval) {
    this.statusInterval = statusInterval;
    return this;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public PgOutputReplicationOptions setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
    return this;
  }

  public int getChannelCapacity() {
    return channelCapacity;
  }

  public PgOutputReplicationOptions setChannelCapacity(int channelCapacity) {
    this.channelCapacity = channelCapacity;
    return this;
  }

  public int getMaxDeferredRows() {
    return maxDeferredRows;
  }

  public PgOutputReplicationOptions setMaxDeferredRows(int maxDeferredRows) {
    this.maxDeferredRows = maxDeferredRows;
    return this;
  }

  public DecodeErrorPolicy getDecodeErrorPolicy() {
    return decodeErrorPolicy;
  }

  public PgOutputReplicationOptions setDecodeErrorPolicy(DecodeErrorPolicy decodeErrorPolicy) {
    this.decodeErrorPolicy = Objects.requireNonNull(decodeErrorPolicy, "decodeErrorPolicy");
    return this;
  }

  public DecimalHandling getDecimalHandling() {
    return decimalHandling;
  }

  public PgOutputReplicationOptions setDecimalHandling(DecimalHandling decimalHandling) {
    this.decimalHandling = Objects.requireNonNull(decimalHandling, "decimalHandling");
    return this;
  }

  @GenIgnore
  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @GenIgnore
  public PgOutputReplicationOptions setReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  public boolean isPreflightEnabled() {
    return preflightEnabled;
  }

  public PgOutputReplicationOptions setPreflightEnabled(boolean preflightEnabled) {
    this.preflightEnabled = preflightEnabled;
    return this;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public PgOutputReplicationOptions setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
    return this;
  }

  @GenIgnore
  public LsnStore getLsnStore() {
    return lsnStore;
  }

  @GenIgnore
  public PgOutputReplicationOptions setLsnStore(LsnStore lsnStore) {
    this.lsnStore = Objects.requireNonNull(lsnStore, "lsnStore");
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PgOutputReplicationOptionsConverter.toJson(this, json);
    return json;
  }

  public PgOutputReplicationOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    PgOutputReplicationOptions merged = new PgOutputReplicationOptions(json);
    if (!other.containsKey("reconnectPolicy")) {
      merged.reconnectPolicy = reconnectPolicy.copy();
    }
    merged.lsnStore = lsnStore;
    return merged;
  }

  void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requirePort(port);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
    OptionValidation.require("slotName", slotName);
    OptionValidation.requireNotEmpty("publicationNames", publicationNames);
    if (protocolVersion != 1) {
      throw new IllegalArgumentException("protocolVersion " + protocolVersion + " is not supported, use 1");
    }
    if (startLsn != null && !startLsn.isBlank()) {
      Lsns.parse(startLsn);
    }
    OptionValidation.requirePositive("statusInterval", statusInterval);
    OptionValidation.requirePositive("pollInterval", pollInterval);
    OptionValidation.requireMin("channelCapacity", channelCapacity, 1);
    OptionValidation.requireMin("maxDeferredRows", maxDeferredRows, 0);
    Objects.requireNonNull(reconnectPolicy, "reconnectPolicy").validate();
    Objects.requireNonNull(lsnStore, "lsnStore");
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = false;
    createSlot = false;
    publicationNames = new ArrayList<>();
    protocolVersion = DEFAULT_PROTOCOL_VERSION;
    acknowledgeMode = AcknowledgeMode.AUTO;
    statusInterval = DEFAULT_STATUS_INTERVAL;
    pollInterval = DEFAULT_POLL_INTERVAL;
    channelCapacity = DEFAULT_CHANNEL_CAPACITY;
    maxDeferredRows = DEFAULT_MAX_DEFERRED_ROWS;
    decodeErrorPolicy = DecodeErrorPolicy.FAIL;
    decimalHandling = DecimalHandling.STRING;
    reconnectPolicy = defaultReconnectPolicy();
    preflightEnabled = false;
    autoStart = true;
    lsnStore = LsnStore.none();
  }
}
