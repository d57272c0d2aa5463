/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.bran.resolver;

/**
 * Strategy producing identifiers for keys seen for the first time by an {@link
 * IdentifierRegistry}.
 *
 * @param <K> key type
 */
@FunctionalInterface
public interface IdentifierGenerator<K> {

  /**
   * Generate an identifier.
   *
   * @param key the key seen for the first time
   * @param ordinal how many identifiers the registry generated before this one, counted from the
   *     last rebuild. Advanced by the registry if the previous result was already taken.
   * @return a non-negative identifier
   */
  int generate(K key, int ordinal);
}
