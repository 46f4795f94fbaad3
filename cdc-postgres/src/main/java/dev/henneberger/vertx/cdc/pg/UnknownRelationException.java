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

/**
 * A row referenced a relation id for which no Relation message was seen in this session.
 * Transient: the row is replayed once the schema arrives.
 */
public class UnknownRelationException extends ReplicationException {

  private final int relationId;

  public UnknownRelationException(int relationId) {
    super("Unknown relation id " + Integer.toUnsignedString(relationId));
    this.relationId = relationId;
  }

  public int relationId() {
    return relationId;
  }
}
