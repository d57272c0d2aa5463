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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Primitives;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import org.bran.exception.IdentifierConflictException;
import org.bran.exception.TypeTagConflictException;
import org.bran.exception.UnknownTypeTagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Type to wire tag mapping used by tagging mode and by heterogeneous containers.
 *
 * <p>The built-in wire types are seeded in a fixed order at construction, so every fresh registry
 * agrees on their tags. User types get their tags when they are registered or first seen.
 */
public class TypeTagRegistry extends IdentifierRegistry<Class<?>> {
  private static final Logger LOG = LoggerFactory.getLogger(TypeTagRegistry.class);

  public static final int DEFAULT_TAG_BASE = 1;

  /** Seeding order of built-in wire types. Appending is safe, reordering changes tags. */
  public static final List<Class<?>> BUILTIN_TYPES =
      ImmutableList.of(
          Boolean.class,
          Byte.class,
          Short.class,
          Integer.class,
          Long.class,
          Float.class,
          Double.class,
          String.class,
          ArrayList.class,
          LinkedList.class,
          HashSet.class,
          LinkedHashSet.class,
          HashMap.class,
          LinkedHashMap.class,
          Object[].class);

  public TypeTagRegistry() {
    this(IdentifierGenerators.counter(DEFAULT_TAG_BASE));
  }

  public TypeTagRegistry(IdentifierGenerator<Class<?>> generator) {
    super(generator);
    for (Class<?> type : BUILTIN_TYPES) {
      get(type);
    }
  }

  /** Returns the tag of {@code type}, assigning one on first sight. */
  public int tagOf(Class<?> type) {
    return get(Primitives.wrap(type));
  }

  /**
   * Returns the type bound to {@code tag}.
   *
   * @throws UnknownTypeTagException if no type is bound to it
   */
  public Class<?> typeOf(int tag) {
    Class<?> type = getByIdentifier(tag);
    if (type == null) {
      throw new UnknownTypeTagException(tag);
    }
    return type;
  }

  /**
   * Binds {@code type} to an explicit tag.
   *
   * @throws TypeTagConflictException if the tag is bound to another type
   */
  public void register(Class<?> type, int tag) {
    put(Primitives.wrap(type), tag);
    LOG.debug("Registered type tag {} for {}", tag, type);
  }

  @Override
  public void rebuild() {
    super.rebuild();
    LOG.info("Rebuilt type tag registry with {} entries", size());
  }

  @Override
  protected IdentifierConflictException conflict(Class<?> type, int tag, Class<?> boundType) {
    return new TypeTagConflictException(type, tag, boundType);
  }
}
