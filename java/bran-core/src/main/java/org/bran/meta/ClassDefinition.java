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

package org.bran.meta;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.bran.reflect.ObjectCreator;
import org.bran.resolver.FieldAliasRegistry;

/**
 * Registered field layout of a type.
 *
 * <p>Field order is the declaration order and is part of the wire contract. The definition owns
 * the {@link FieldAliasRegistry} translating field names to the tokens written on the wire.
 */
public final class ClassDefinition {
  private final Class<?> type;
  private final ImmutableList<FieldDefinition> fields;
  private final ImmutableMap<String, FieldDefinition> fieldsByName;
  private final FieldAliasRegistry aliasRegistry;
  private final ObjectCreator<?> objectCreator;

  public ClassDefinition(
      Class<?> type, List<FieldDefinition> fields, FieldAliasRegistry aliasRegistry) {
    this.type = type;
    this.fields = ImmutableList.copyOf(fields);
    ImmutableMap.Builder<String, FieldDefinition> builder = ImmutableMap.builder();
    for (FieldDefinition field : fields) {
      builder.put(field.getName(), field);
    }
    this.fieldsByName = builder.build();
    this.aliasRegistry = aliasRegistry;
    this.objectCreator = ObjectCreator.of(type);
  }

  public Class<?> getType() {
    return type;
  }

  public List<FieldDefinition> getFields() {
    return fields;
  }

  public int getFieldCount() {
    return fields.size();
  }

  /** Returns the field called {@code name}, or null. */
  public FieldDefinition getField(String name) {
    return fieldsByName.get(name);
  }

  public FieldAliasRegistry getAliasRegistry() {
    return aliasRegistry;
  }

  public int aliasOf(FieldDefinition field) {
    return aliasRegistry.aliasOf(field.getName());
  }

  /** Returns the field whose wire token is {@code alias}, or null. */
  public FieldDefinition fieldOf(int alias) {
    String name = aliasRegistry.fieldOf(alias);
    return name == null ? null : fieldsByName.get(name);
  }

  public ObjectCreator<?> getObjectCreator() {
    return objectCreator;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type.getName())
        .add("fields", fields)
        .add("aliases", aliasRegistry)
        .toString();
  }
}
