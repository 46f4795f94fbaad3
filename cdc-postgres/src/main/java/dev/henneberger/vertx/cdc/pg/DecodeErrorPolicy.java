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
 * What to do with a row that has a column whose text cannot be read as its declared type.
 */
public enum DecodeErrorPolicy {
  /**
   * Deliver a {@link DecodeException} in place of the event; consumers may keep reading.
   */
  FAIL,
  /**
   * Deliver the event with the offending column as its raw text.
   */
  RAW
}
