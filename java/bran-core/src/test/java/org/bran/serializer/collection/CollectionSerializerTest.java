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

package org.bran.serializer.collection;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bran.BranTestBase;
import org.bran.Loader;
import org.bran.exception.MalformedStreamException;
import org.bran.exception.SerializationException;
import org.testng.annotations.Test;

public class CollectionSerializerTest extends BranTestBase {

  @Test(dataProvider = "tagging")
  public void testLists(boolean tagging) {
    Loader loader = newRegisteredLoader();
    serDeCheck(loader, new ArrayList<>(), tagging);
    serDeCheck(loader, new ArrayList<>(Arrays.asList(1, "a", 2.5, true)), tagging);
    serDeCheck(loader, new LinkedList<>(Arrays.asList(1L, (short) 2)), tagging);
    serDeCheck(loader, new ArrayList<>(List.of(new Point(1, 2), List.of("nested"))), tagging);
  }

  @Test(dataProvider = "tagging")
  public void testSets(boolean tagging) {
    Loader loader = newLoader();
    serDeCheck(loader, new HashSet<>(Arrays.asList(1, "a", 3L)), tagging);
    LinkedHashSet<Object> ordered = new LinkedHashSet<>(Arrays.asList("c", "a", "b"));
    LinkedHashSet<Object> result = serDe(loader, ordered, tagging);
    assertEquals(new ArrayList<>(result), List.of("c", "a", "b"));
  }

  @Test(dataProvider = "tagging")
  public void testMaps(boolean tagging) {
    Loader loader = newRegisteredLoader();
    Map<Object, Object> map = new HashMap<>();
    map.put("a", 1);
    map.put(2, new Point(3, 4));
    map.put(5L, new ArrayList<>(List.of("x")));
    serDeCheck(loader, map, tagging);
    LinkedHashMap<Object, Object> ordered = new LinkedHashMap<>();
    ordered.put("z", 1);
    ordered.put("a", 2);
    LinkedHashMap<Object, Object> result = serDe(loader, ordered, tagging);
    assertEquals(new ArrayList<>(result.keySet()), List.of("z", "a"));
  }

  @Test
  public void testImmutableCollectionsDecodeToWireType() {
    Loader loader = newLoader();
    Object list = loader.deserialize(loader.serialize(List.of(1, 2, 3), true));
    assertEquals(list.getClass(), ArrayList.class);
    assertEquals(list, List.of(1, 2, 3));
    Object set = loader.deserialize(loader.serialize(Set.of("a"), true));
    assertEquals(set.getClass(), HashSet.class);
    Object map = loader.deserialize(loader.serialize(Map.of("k", "v"), true));
    assertEquals(map.getClass(), HashMap.class);
    assertEquals(map, Map.of("k", "v"));
    Object empty = loader.deserialize(loader.serialize(Collections.emptyList(), true));
    assertEquals(empty, new ArrayList<>());
  }

  @Test
  public void testListEncoding() {
    Loader loader = newLoader();
    int intTag = loader.getTypeTagRegistry().tagOf(Integer.class);
    int stringTag = loader.getTypeTagRegistry().tagOf(String.class);
    byte[] bytes = loader.serialize(new ArrayList<>(List.of(1, "a")));
    assertEquals(bytes, bytes(2, intTag, 0, 0, 0, 1, stringTag, 1, 'a'));
  }

  @Test
  public void testTuple() {
    Loader loader = newRegisteredLoader();
    Object[] tuple = {1, "two", new Point(3, 4), new Object[] {5L}};
    Object[] result = serDe(loader, tuple, false);
    assertEquals(result.length, 4);
    assertEquals(result[0], 1);
    assertEquals(result[1], "two");
    assertEquals(result[2], new Point(3, 4));
    assertEquals((Object[]) result[3], new Object[] {5L});
    assertEquals(serDe(loader, new Object[0], true), new Object[0]);
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Bag {
    private List<Object> items;
    private Map<String, Object> index;
  }

  @Test
  public void testContainerFields() {
    Loader loader = newLoader();
    loader.registerClass(Bag.class, ImmutableMap.of("items", List.class, "index", Map.class));
    Bag bag = new Bag(List.of(1, "a"), Map.of("k", 2.0));
    Bag result = serDe(loader, bag, false);
    assertEquals(result, bag);
    assertEquals(result.getItems().getClass(), ArrayList.class);
  }

  @Test
  public void testNullElements() {
    Loader loader = newLoader();
    assertThrows(
        SerializationException.class, () -> loader.serialize(Arrays.asList(1, null)));
    Map<String, Object> map = new HashMap<>();
    map.put("a", null);
    assertThrows(SerializationException.class, () -> loader.serialize(map));
    assertThrows(SerializationException.class, () -> loader.serialize(new Object[] {null}));
  }

  @Test
  public void testCountBeyondStream() {
    Loader loader = newLoader();
    // count of 100 elements with a single byte following
    assertThrows(
        MalformedStreamException.class, () -> loader.deserialize(bytes(100, 1), ArrayList.class));
    assertThrows(
        MalformedStreamException.class, () -> loader.deserialize(bytes(100, 1), HashMap.class));
    assertThrows(
        MalformedStreamException.class, () -> loader.deserialize(bytes(100, 1), Object[].class));
  }
}
