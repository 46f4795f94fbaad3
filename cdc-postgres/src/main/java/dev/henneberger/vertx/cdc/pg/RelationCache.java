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

import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relation id to schema mapping for one connection. Confined to the read loop thread.
 */
public final class RelationCache {

  private static final Logger LOG = LoggerFactory.getLogger(RelationCache.class);

  private final Map<Integer, RelationSchema> relations = new HashMap<>();

  public void upsert(RelationSchema schema) {
    RelationSchema previous = relations.put(schema.relationId(), schema);
    if (LOG.isDebugEnabled()) {
      if (previous == null) {
        LOG.debug("Learned relation {} as {}", Integer.toUnsignedString(schema.relationId()), schema.qualifiedName());
      } else if (!previous.equals(schema)) {
        LOG.debug("Relation {} changed: {} -> {}", Integer.toUnsignedString(schema.relationId()), previous, schema);
      }
    }
  }

  /**
   * @throws UnknownRelationException when no Relation message was seen for the id since the last
   *   {@link #clear()}
   */
  public RelationSchema get(int relationId) {
    RelationSchema schema = relations.get(relationId);
    if (schema == null) {
      throw new UnknownRelationException(relationId);
    }
    return schema;
  }

  public boolean contains(int relationId) {
    return relations.containsKey(relationId);
  }

  public int size() {
    return relations.size();
  }

  public void clear() {
    relations.clear();
  }
}
