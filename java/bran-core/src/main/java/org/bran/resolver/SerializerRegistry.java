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

import com.google.common.base.Preconditions;
import com.google.common.primitives.Primitives;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.bran.serializer.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializers keyed by exact class. Lookups don't walk the class hierarchy, a subclass of a
 * registered class needs its own registration.
 */
public class SerializerRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(SerializerRegistry.class);

  private final Map<Class<?>, Serializer<?>> serializers = new IdentityHashMap<>();

  /** Binds {@code serializer} to {@code type}, replacing a previous binding. */
  public <T> void register(Class<T> type, Serializer<? super T> serializer) {
    Preconditions.checkNotNull(type, "type");
    Preconditions.checkNotNull(serializer, "serializer");
    Serializer<?> previous = serializers.put(Primitives.wrap(type), serializer);
    if (previous != null && previous != serializer) {
      LOG.debug("Serializer of {} replaced: {} -> {}", type, previous, serializer);
    }
  }

  /** Returns the serializer bound to {@code type}, or null. */
  public Serializer<?> get(Class<?> type) {
    return serializers.get(Primitives.wrap(type));
  }

  public boolean contains(Class<?> type) {
    return serializers.containsKey(Primitives.wrap(type));
  }

  public Set<Class<?>> registeredTypes() {
    return Collections.unmodifiableSet(serializers.keySet());
  }
}
