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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A decoded {@code pgoutput} message. Subclasses are plain value holders; {@link #kind()} tells
 * which one to cast to.
 */
public abstract class PgOutputMessage {

  public enum Kind {
    BEGIN('B'),
    COMMIT('C'),
    RELATION('R'),
    INSERT('I'),
    UPDATE('U'),
    DELETE('D'),
    TRUNCATE('T'),
    TYPE('Y'),
    ORIGIN('O'),
    MESSAGE('M');

    private final char tag;

    Kind(char tag) {
      this.tag = tag;
    }

    public char tag() {
      return tag;
    }
  }

  private PgOutputMessage() {
  }

  public abstract Kind kind();

  public static final class Begin extends PgOutputMessage {
    private final long finalLsn;
    private final Instant commitTimestamp;
    private final long xid;

    public Begin(long finalLsn, Instant commitTimestamp, long xid) {
      this.finalLsn = finalLsn;
      this.commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
      this.xid = xid;
    }

    @Override
    public Kind kind() {
      return Kind.BEGIN;
    }

    /**
     * LSN of the transaction's commit record.
     */
    public long finalLsn() {
      return finalLsn;
    }

    public Instant commitTimestamp() {
      return commitTimestamp;
    }

    public long xid() {
      return xid;
    }
  }

  public static final class Commit extends PgOutputMessage {
    private final int flags;
    private final long commitLsn;
    private final long endLsn;
    private final Instant commitTimestamp;

    public Commit(int flags, long commitLsn, long endLsn, Instant commitTimestamp) {
      this.flags = flags;
      this.commitLsn = commitLsn;
      this.endLsn = endLsn;
      this.commitTimestamp = Objects.requireNonNull(commitTimestamp, "commitTimestamp");
    }

    @Override
    public Kind kind() {
      return Kind.COMMIT;
    }

    public int flags() {
      return flags;
    }

    public long commitLsn() {
      return commitLsn;
    }

    /**
     * End of the commit record; the position to resume after once the transaction is processed.
     */
    public long endLsn() {
      return endLsn;
    }

    public Instant commitTimestamp() {
      return commitTimestamp;
    }
  }

  public static final class Relation extends PgOutputMessage {
    private final RelationSchema schema;

    public Relation(RelationSchema schema) {
      this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public Kind kind() {
      return Kind.RELATION;
    }

    public RelationSchema schema() {
      return schema;
    }
  }

  public static final class Insert extends PgOutputMessage {
    private final int relationId;
    private final TupleData newTuple;

    public Insert(int relationId, TupleData newTuple) {
      this.relationId = relationId;
      this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    @Override
    public Kind kind() {
      return Kind.INSERT;
    }

    public int relationId() {
      return relationId;
    }

    public TupleData newTuple() {
      return newTuple;
    }
  }

  /**
   * {@code oldTupleKind} is {@code 'K'} when the old image only carries the replica identity key,
   * {@code 'O'} when it carries the full row, and {@code 0} when no old image was sent.
   */
  public static final class Update extends PgOutputMessage {
    private final int relationId;
    private final char oldTupleKind;
    private final TupleData oldTuple;
    private final TupleData newTuple;

    public Update(int relationId, char oldTupleKind, TupleData oldTuple, TupleData newTuple) {
      this.relationId = relationId;
      this.oldTupleKind = oldTupleKind;
      this.oldTuple = oldTuple;
      this.newTuple = Objects.requireNonNull(newTuple, "newTuple");
    }

    @Override
    public Kind kind() {
      return Kind.UPDATE;
    }

    public int relationId() {
      return relationId;
    }

    public char oldTupleKind() {
      return oldTupleKind;
    }

    public TupleData oldTuple() {
      return oldTuple;
    }

    public TupleData newTuple() {
      return newTuple;
    }
  }

  public static final class Delete extends PgOutputMessage {
    private final int relationId;
    private final char oldTupleKind;
    private final TupleData oldTuple;

    public Delete(int relationId, char oldTupleKind, TupleData oldTuple) {
      this.relationId = relationId;
      this.oldTupleKind = oldTupleKind;
      this.oldTuple = Objects.requireNonNull(oldTuple, "oldTuple");
    }

    @Override
    public Kind kind() {
      return Kind.DELETE;
    }

    public int relationId() {
      return relationId;
    }

    public char oldTupleKind() {
      return oldTupleKind;
    }

    public TupleData oldTuple() {
      return oldTuple;
    }
  }

  public static final class Truncate extends PgOutputMessage {
    public static final int OPTION_CASCADE = 1;
    public static final int OPTION_RESTART_IDENTITY = 2;

    private final int options;
    private final List<Integer> relationIds;

    public Truncate(int options, List<Integer> relationIds) {
      this.options = options;
      this.relationIds = Collections.unmodifiableList(new ArrayList<>(relationIds));
    }

    @Override
    public Kind kind() {
      return Kind.TRUNCATE;
    }

    public boolean cascade() {
      return (options & OPTION_CASCADE) != 0;
    }

    public boolean restartIdentity() {
      return (options & OPTION_RESTART_IDENTITY) != 0;
    }

    public List<Integer> relationIds() {
      return relationIds;
    }
  }

  public static final class Type extends PgOutputMessage {
    private final int typeOid;
    private final String namespace;
    private final String name;

    public Type(int typeOid, String namespace, String name) {
      this.typeOid = typeOid;
      this.namespace = Objects.requireNonNull(namespace, "namespace");
      this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Kind kind() {
      return Kind.TYPE;
    }

    public int typeOid() {
      return typeOid;
    }

    public String namespace() {
      return namespace;
    }

    public String name() {
      return name;
    }
  }

  public static final class Origin extends PgOutputMessage {
    private final long originLsn;
    private final String name;

    public Origin(long originLsn, String name) {
      this.originLsn = originLsn;
      this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Kind kind() {
      return Kind.ORIGIN;
    }

    public long originLsn() {
      return originLsn;
    }

    public String name() {
      return name;
    }
  }

  /**
   * Payload of {@code pg_logical_emit_message}.
   */
  public static final class LogicalMessage extends PgOutputMessage {
    private final boolean transactional;
    private final long lsn;
    private final String prefix;
    private final byte[] content;

    public LogicalMessage(boolean transactional, long lsn, String prefix, byte[] content) {
      this.transactional = transactional;
      this.lsn = lsn;
      this.prefix = Objects.requireNonNull(prefix, "prefix");
      this.content = Objects.requireNonNull(content, "content").clone();
    }

    @Override
    public Kind kind() {
      return Kind.MESSAGE;
    }

    public boolean transactional() {
      return transactional;
    }

    public long lsn() {
      return lsn;
    }

    public String prefix() {
      return prefix;
    }

    public byte[] content() {
      return content.clone();
    }
  }
}
