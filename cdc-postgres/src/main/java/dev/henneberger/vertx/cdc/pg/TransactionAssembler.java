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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the decoded pgoutput message stream into row-at-a-time {@link ChangeEvent}s.
 * <p>
 * Confined to the read loop thread. Rows that reference a relation not yet described on this
 * connection are held back and replayed, in arrival order, once the Relation message shows up.
 */
public final class TransactionAssembler {

  private static final Logger LOG = LoggerFactory.getLogger(TransactionAssembler.class);

  /**
   * Receives assembled output. Both methods may block for backpressure.
   */
  public interface Sink {
    void event(ChangeEvent event) throws InterruptedException;

    void decodeFailure(DecodeException failure) throws InterruptedException;
  }

  private enum State {
    IDLE,
    IN_TRANSACTION
  }

  private final RelationCache relations;
  private final TupleConverter converter;
  private final String connectorName;
  private final String databaseName;
  private final DecodeErrorPolicy decodeErrorPolicy;
  private final DecimalHandling decimalHandling;
  private final int maxDeferredRows;
  private final Clock clock;

  private final Map<Integer, Deque<DeferredRow>> deferred = new LinkedHashMap<>();
  private int deferredCount;
  private volatile long heldBackLsn = -1L;

  private State state = State.IDLE;
  private PgOutputMessage.Begin transaction;

  public TransactionAssembler(RelationCache relations,
                              TupleConverter converter,
                              String connectorName,
                              String databaseName,
                              DecodeErrorPolicy decodeErrorPolicy,
                              DecimalHandling decimalHandling,
                              int maxDeferredRows,
                              Clock clock) {
    this.relations = Objects.requireNonNull(relations, "relations");
    this.converter = Objects.requireNonNull(converter, "converter");
    this.connectorName = Objects.requireNonNull(connectorName, "connectorName");
    this.databaseName = databaseName;
    this.decodeErrorPolicy = Objects.requireNonNull(decodeErrorPolicy, "decodeErrorPolicy");
    this.decimalHandling = Objects.requireNonNull(decimalHandling, "decimalHandling");
    if (maxDeferredRows < 0) {
      throw new IllegalArgumentException("maxDeferredRows must be >= 0");
    }
    this.maxDeferredRows = maxDeferredRows;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @throws ProtocolException when the message is out of place in the transaction sequence or a
   *   tuple does not match its relation
   */
  public void accept(PgOutputMessage message, Sink sink) throws InterruptedException {
    switch (message.kind()) {
      case BEGIN:
        begin((PgOutputMessage.Begin) message);
        break;
      case COMMIT:
        commit((PgOutputMessage.Commit) message);
        break;
      case RELATION:
        relation(((PgOutputMessage.Relation) message).schema(), sink);
        break;
      case INSERT:
      case UPDATE:
      case DELETE:
        row(message, sink);
        break;
      case TRUNCATE:
        PgOutputMessage.Truncate truncate = (PgOutputMessage.Truncate) message;
        LOG.warn("Ignoring TRUNCATE of relations {} (cascade={}, restartIdentity={})",
          describeRelations(truncate.relationIds()), truncate.cascade(), truncate.restartIdentity());
        break;
      case TYPE:
        PgOutputMessage.Type type = (PgOutputMessage.Type) message;
        converter.types().bind(type.typeOid(), type.namespace(), type.name());
        break;
      case ORIGIN:
        LOG.debug("Transaction replicated from origin {}", ((PgOutputMessage.Origin) message).name());
        break;
      case MESSAGE:
        PgOutputMessage.LogicalMessage logical = (PgOutputMessage.LogicalMessage) message;
        LOG.debug("Ignoring logical decoding message prefix={} transactional={} at {}",
          logical.prefix(), logical.transactional(), Lsns.format(logical.lsn()));
        break;
      default:
        throw new ProtocolException("Unhandled pgoutput message " + message.kind());
    }
  }

  public boolean isIdle() {
    return state == State.IDLE;
  }

  public int deferredCount() {
    return deferredCount;
  }

  /**
   * Lowest transaction LSN among rows waiting for their relation, {@code -1} when none wait.
   * Readable from any thread; positions at or past it must not be confirmed.
   */
  public long heldBackLsn() {
    return heldBackLsn;
  }

  /**
   * Forgets the open transaction and any held back rows.
   */
  public void reset() {
    state = State.IDLE;
    transaction = null;
    deferred.clear();
    deferredCount = 0;
    heldBackLsn = -1L;
  }

  private void begin(PgOutputMessage.Begin begin) {
    if (state != State.IDLE) {
      throw new ProtocolException("BEGIN of xid " + begin.xid() + " while xid " + transaction.xid() + " is open");
    }
    state = State.IN_TRANSACTION;
    transaction = begin;
  }

  private void commit(PgOutputMessage.Commit commit) {
    if (state != State.IN_TRANSACTION) {
      throw new ProtocolException("COMMIT at " + Lsns.format(commit.commitLsn()) + " outside a transaction");
    }
    if (commit.commitLsn() != transaction.finalLsn()) {
      throw new ProtocolException("COMMIT at " + Lsns.format(commit.commitLsn()) + " does not match BEGIN final LSN "
        + Lsns.format(transaction.finalLsn()));
    }
    state = State.IDLE;
    transaction = null;
  }

  private void relation(RelationSchema schema, Sink sink) throws InterruptedException {
    relations.upsert(schema);
    Deque<DeferredRow> waiting = deferred.remove(schema.relationId());
    if (waiting == null) {
      return;
    }
    deferredCount -= waiting.size();
    LOG.info("Replaying {} deferred row(s) for {}", waiting.size(), schema.qualifiedName());
    for (DeferredRow row : waiting) {
      emit(schema, row.message, row.transaction, sink);
    }
    heldBackLsn = lowestDeferredLsn();
  }

  private void row(PgOutputMessage message, Sink sink) throws InterruptedException {
    if (state != State.IN_TRANSACTION) {
      throw new ProtocolException(message.kind() + " outside a transaction");
    }
    int relationId = relationId(message);
    Deque<DeferredRow> waiting = deferred.get(relationId);
    if (waiting != null) {
      defer(relationId, waiting, message);
      return;
    }
    RelationSchema schema;
    try {
      schema = relations.get(relationId);
    } catch (UnknownRelationException e) {
      LOG.warn("Deferring {} until relation {} is described", message.kind(), Integer.toUnsignedString(relationId));
      waiting = new ArrayDeque<>();
      deferred.put(relationId, waiting);
      defer(relationId, waiting, message);
      return;
    }
    emit(schema, message, transaction, sink);
  }

  private void defer(int relationId, Deque<DeferredRow> waiting, PgOutputMessage message) {
    if (deferredCount >= maxDeferredRows) {
      throw new ProtocolException("More than " + maxDeferredRows + " rows waiting for relation metadata, last for relation "
        + Integer.toUnsignedString(relationId));
    }
    waiting.addLast(new DeferredRow(message, transaction));
    deferredCount++;
    if (heldBackLsn == -1L) {
      heldBackLsn = transaction.finalLsn();
    }
  }

  private long lowestDeferredLsn() {
    long lowest = -1L;
    for (Deque<DeferredRow> waiting : deferred.values()) {
      long lsn = waiting.peekFirst().transaction.finalLsn();
      if (lowest == -1L || Lsns.compare(lsn, lowest) < 0) {
        lowest = lsn;
      }
    }
    return lowest;
  }

  private void emit(RelationSchema schema,
                    PgOutputMessage message,
                    PgOutputMessage.Begin tx,
                    Sink sink) throws InterruptedException {
    ChangeEvent event;
    try {
      event = assemble(schema, message, tx);
    } catch (DecodeException e) {
      sink.decodeFailure(e);
      return;
    }
    sink.event(event);
  }

  private ChangeEvent assemble(RelationSchema schema, PgOutputMessage message, PgOutputMessage.Begin tx) {
    Map<String, CanonicalValue> before;
    Map<String, CanonicalValue> after;
    ChangeEvent.Operation operation;
    switch (message.kind()) {
      case INSERT: {
        TupleData tuple = ((PgOutputMessage.Insert) message).newTuple();
        checkShape(schema, tuple);
        if (tuple.hasUnchangedToast()) {
          throw new ProtocolException("INSERT into " + schema.qualifiedName() + " carries an unchanged TOAST value");
        }
        operation = ChangeEvent.Operation.CREATE;
        before = null;
        after = image(schema, tuple, null, false);
        break;
      }
      case UPDATE: {
        PgOutputMessage.Update update = (PgOutputMessage.Update) message;
        checkShape(schema, update.newTuple());
        operation = ChangeEvent.Operation.UPDATE;
        if (update.oldTuple() != null) {
          checkShape(schema, update.oldTuple());
          before = image(schema, update.oldTuple(), null, update.oldTupleKind() == 'K');
        } else {
          before = image(schema, update.newTuple(), null, true);
        }
        TupleData fullOld = update.oldTupleKind() == 'O' ? update.oldTuple() : null;
        after = image(schema, update.newTuple(), fullOld, false);
        break;
      }
      case DELETE: {
        PgOutputMessage.Delete delete = (PgOutputMessage.Delete) message;
        checkShape(schema, delete.oldTuple());
        operation = ChangeEvent.Operation.DELETE;
        before = image(schema, delete.oldTuple(), null, delete.oldTupleKind() == 'K');
        after = null;
        break;
      }
      default:
        throw new ProtocolException("Not a row message: " + message.kind());
    }
    SourceInfo source = new SourceInfo(connectorName, databaseName, schema.namespace(), schema.name(),
      tx.xid(), tx.finalLsn(), tx.commitTimestamp());
    return new ChangeEvent(operation, before, after, source, Instant.now(clock), decimalHandling);
  }

  /**
   * Builds a column map in schema order. Unchanged TOAST columns are taken from {@code fallback}
   * when it has a value for them and are left out otherwise.
   */
  private Map<String, CanonicalValue> image(RelationSchema schema,
                                            TupleData tuple,
                                            TupleData fallback,
                                            boolean keysOnly) {
    Map<String, CanonicalValue> values = new LinkedHashMap<>();
    for (int i = 0; i < schema.columnCount(); i++) {
      RelationColumn column = schema.column(i);
      if (keysOnly && !column.isKey()) {
        continue;
      }
      RawColumnValue raw = tuple.get(i);
      if (raw.isUnchangedToast()) {
        if (fallback == null || fallback.get(i).isUnchangedToast()) {
          continue;
        }
        raw = fallback.get(i);
      }
      values.put(column.name(), convert(schema, column, raw));
    }
    return values;
  }

  private CanonicalValue convert(RelationSchema schema, RelationColumn column, RawColumnValue raw) {
    try {
      return converter.convertColumn(schema, column, raw);
    } catch (DecodeException e) {
      if (decodeErrorPolicy == DecodeErrorPolicy.FAIL) {
        throw e;
      }
      LOG.warn("Emitting raw text for {}.{}: {}", schema.qualifiedName(), column.name(), e.getMessage());
      return CanonicalValue.text(raw.text());
    }
  }

  private static void checkShape(RelationSchema schema, TupleData tuple) {
    if (tuple.size() != schema.columnCount()) {
      throw new ProtocolException("Tuple has " + tuple.size() + " columns but " + schema.qualifiedName() + " has "
        + schema.columnCount());
    }
  }

  private static int relationId(PgOutputMessage message) {
    switch (message.kind()) {
      case INSERT:
        return ((PgOutputMessage.Insert) message).relationId();
      case UPDATE:
        return ((PgOutputMessage.Update) message).relationId();
      default:
        return ((PgOutputMessage.Delete) message).relationId();
    }
  }

  private static List<String> describeRelations(List<Integer> relationIds) {
    List<String> out = new ArrayList<>(relationIds.size());
    for (Integer id : relationIds) {
      out.add(Integer.toUnsignedString(id));
    }
    return out;
  }

  private static final class DeferredRow {
    private final PgOutputMessage message;
    private final PgOutputMessage.Begin transaction;

    private DeferredRow(PgOutputMessage message, PgOutputMessage.Begin transaction) {
      this.message = message;
      this.transaction = transaction;
    }
  }
}
