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

package org.bran.serializer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bran.resolver.SerializerRegistry;
import org.bran.serializer.collection.CollectionSerializer;
import org.bran.serializer.collection.MapSerializer;

/** Built-in serializers. */
@SuppressWarnings({"rawtypes", "unchecked"})
public class Serializers {

  /**
   * Registers the serializers of the built-in wire types. Interfaces and JDK immutable collection
   * classes share the serializer of their wire type, so they can be written and requested as read
   * targets; they decode to the wire type.
   */
  public static void registerDefaults(SerializerRegistry registry) {
    registry.register(Boolean.class, new PrimitiveSerializers.BooleanSerializer());
    registry.register(Byte.class, new PrimitiveSerializers.ByteSerializer());
    registry.register(Short.class, new PrimitiveSerializers.ShortSerializer());
    registry.register(Integer.class, new PrimitiveSerializers.IntSerializer());
    registry.register(Long.class, new PrimitiveSerializers.LongSerializer());
    registry.register(Float.class, new PrimitiveSerializers.FloatSerializer());
    registry.register(Double.class, new PrimitiveSerializers.DoubleSerializer());
    registry.register(String.class, new StringSerializer());
    registry.register(Object[].class, new ObjectArraySerializer());

    CollectionSerializer<ArrayList> arrayList =
        new CollectionSerializer<>(ArrayList.class, ArrayList::new);
    registerAll(
        registry,
        arrayList,
        ArrayList.class,
        List.class,
        Collection.class,
        Arrays.asList().getClass(),
        List.of().getClass(),
        List.of(1).getClass(),
        Collections.emptyList().getClass(),
        Collections.singletonList(1).getClass(),
        Collections.unmodifiableList(new ArrayList<>()).getClass());
    registry.register(
        LinkedList.class, new CollectionSerializer<>(LinkedList.class, size -> new LinkedList()));

    CollectionSerializer<HashSet> hashSet = new CollectionSerializer<>(HashSet.class, HashSet::new);
    registerAll(
        registry,
        hashSet,
        HashSet.class,
        Set.class,
        Set.of().getClass(),
        Set.of(1).getClass(),
        Collections.emptySet().getClass(),
        Collections.singleton(1).getClass(),
        Collections.unmodifiableSet(new HashSet<>()).getClass());
    registry.register(
        LinkedHashSet.class, new CollectionSerializer<>(LinkedHashSet.class, LinkedHashSet::new));

    MapSerializer<HashMap> hashMap = new MapSerializer<>(HashMap.class, HashMap::new);
    registerAll(
        registry,
        hashMap,
        HashMap.class,
        Map.class,
        Map.of().getClass(),
        Map.of(1, 1).getClass(),
        Collections.emptyMap().getClass(),
        Collections.singletonMap(1, 1).getClass(),
        Collections.unmodifiableMap(new HashMap<>()).getClass());
    registry.register(
        LinkedHashMap.class, new MapSerializer<>(LinkedHashMap.class, LinkedHashMap::new));
  }

  private static void registerAll(
      SerializerRegistry registry, Serializer serializer, Class<?>... types) {
    for (Class type : types) {
      registry.register(type, serializer);
    }
  }
}
