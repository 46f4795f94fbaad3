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
 * How {@code numeric} columns are rendered into JSON. Values inside {@link ChangeEvent} always keep
 * the exact text.
 */
public enum DecimalHandling {
  /**
   * Exact text, e.g. {@code "12.50"}.
   */
  STRING,
  /**
   * JSON number built from {@link java.math.BigDecimal}; {@code NaN} and infinities stay strings.
   */
  NUMBER
}
