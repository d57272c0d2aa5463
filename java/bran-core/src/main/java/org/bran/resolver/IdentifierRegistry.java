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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.bran.exception.IdentifierConflictException;

/**
 * Symmetric mapping between keys and compact int identifiers.
 *
 * <p>Identifiers are created lazily by the {@link IdentifierGenerator} on the first {@link
 * #get(Object)} of an unseen key, unless {@link #put(Object, int)} binds one explicitly. Generated
 * identifiers are assigned in first-seen order, so the same generator and the same sequence of
 * lookups always produce the same identifiers.
 *
 * <p>Changing the generator does not touch cached entries. Callers must invoke {@link #rebuild()}
 * afterwards, otherwise identifiers from the old and the new strategy coexist.
 *
 * <p>Not thread safe.
 *
 * @param <K> key type
 */
public class IdentifierRegistry<K> {
  // Upper bound on how far the ordinal is advanced to step over identifiers that are taken.
  static final int MAX_GENERATE_ATTEMPTS = 1 << 16;

  private final BiMap<K, Integer> entries = HashBiMap.create();
  // Keys in first-seen order, the replay order of `rebuild`.
  private final Set<K> order = new LinkedHashSet<>();
  private final Set<K> overridden = new HashSet<>();
  private IdentifierGenerator<K> generator;
  private int ordinal;

  public IdentifierRegistry(IdentifierGenerator<K> generator) {
    this.generator = Preconditions.checkNotNull(generator, "generator");
  }

  /** Returns the identifier of {@code key}, generating one if the key is unseen. */
  public int get(K key) {
    Preconditions.checkNotNull(key, "key");
    Integer id = entries.get(key);
    if (id == null) {
      id = generate(key);
      entries.put(key, id);
      order.add(key);
    }
    return id;
  }

  /** Returns the key bound to {@code identifier}, or null. */
  public K getByIdentifier(int identifier) {
    return entries.inverse().get(identifier);
  }

  /**
   * Binds {@code key} to an explicit identifier, replacing any previous binding of {@code key}.
   * Explicit bindings survive {@link #rebuild()}.
   *
   * @throws IdentifierConflictException if {@code identifier} is bound to another key
   */
  public void put(K key, int identifier) {
    Preconditions.checkNotNull(key, "key");
    Preconditions.checkArgument(
        identifier >= 0, "Identifier must be non-negative, got %s for %s", identifier, key);
    K bound = entries.inverse().get(identifier);
    if (bound != null && !bound.equals(key)) {
      throw conflict(key, identifier, bound);
    }
    entries.forcePut(key, identifier);
    order.add(key);
    overridden.add(key);
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  public boolean containsIdentifier(int identifier) {
    return entries.containsValue(identifier);
  }

  /** Whether {@code key} was bound through {@link #put(Object, int)}. */
  public boolean isOverridden(K key) {
    return overridden.contains(key);
  }

  /** Removes {@code key} and returns its identifier, or null if absent. */
  public Integer remove(K key) {
    order.remove(key);
    overridden.remove(key);
    return entries.remove(key);
  }

  public int size() {
    return entries.size();
  }

  /** Keys in first-seen order. */
  public Set<K> keys() {
    return Collections.unmodifiableSet(order);
  }

  public IdentifierGenerator<K> getGenerator() {
    return generator;
  }

  /** Replaces the generator. Existing entries keep their identifiers until {@link #rebuild()}. */
  public void setGenerator(IdentifierGenerator<K> generator) {
    this.generator = Preconditions.checkNotNull(generator, "generator");
  }

  /**
   * Discards all generated identifiers and regenerates them with the current generator, in the
   * order their keys were first seen. Explicit bindings are kept. If the generator fails for any
   * key, the registry is left as it was.
   */
  public void rebuild() {
    commitRebuild(prepareRebuild(generator));
  }

  /** Computes the bindings of a rebuild with {@code generator}, leaving this registry untouched. */
  IdentifierRegistry<K> prepareRebuild(IdentifierGenerator<K> generator) {
    IdentifierRegistry<K> rebuilt = new IdentifierRegistry<>(generator);
    for (K key : overridden) {
      rebuilt.entries.put(key, entries.get(key));
    }
    for (K key : order) {
      if (!overridden.contains(key)) {
        rebuilt.entries.put(key, rebuilt.generate(key));
      }
    }
    return rebuilt;
  }

  void commitRebuild(IdentifierRegistry<K> rebuilt) {
    entries.clear();
    entries.putAll(rebuilt.entries);
    generator = rebuilt.generator;
    ordinal = rebuilt.ordinal;
  }

  private int generate(K key) {
    for (int attempt = 0; attempt < MAX_GENERATE_ATTEMPTS; attempt++) {
      int id = generator.generate(key, ordinal++);
      Preconditions.checkState(
          id >= 0, "Generator %s produced negative identifier %s for %s", generator, id, key);
      if (!entries.containsValue(id)) {
        return id;
      }
    }
    throw new IllegalStateException(
        String.format(
            "Generator %s produced no free identifier for %s after %s attempts",
            generator, key, MAX_GENERATE_ATTEMPTS));
  }

  /** Creates the exception raised when an explicit identifier is bound to another key. */
  protected IdentifierConflictException conflict(K key, int identifier, K boundKey) {
    return new IdentifierConflictException(key, identifier, boundKey);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("entries", entries)
        .add("overridden", overridden)
        .toString();
  }
}
