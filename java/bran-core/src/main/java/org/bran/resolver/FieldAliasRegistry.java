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

import org.bran.exception.FieldAliasConflictException;
import org.bran.exception.IdentifierConflictException;

/** Field name to wire alias mapping owned by one class definition. */
public class FieldAliasRegistry extends IdentifierRegistry<String> {
  public static final int DEFAULT_ALIAS_BASE = 0;

  public FieldAliasRegistry() {
    this(IdentifierGenerators.counter(DEFAULT_ALIAS_BASE));
  }

  public FieldAliasRegistry(IdentifierGenerator<String> generator) {
    super(generator);
  }

  public int aliasOf(String field) {
    return get(field);
  }

  /** Returns the field bound to {@code alias}, or null. */
  public String fieldOf(int alias) {
    return getByIdentifier(alias);
  }

  @Override
  protected IdentifierConflictException conflict(String field, int alias, String boundField) {
    return new FieldAliasConflictException(field, alias, boundField);
  }
}
