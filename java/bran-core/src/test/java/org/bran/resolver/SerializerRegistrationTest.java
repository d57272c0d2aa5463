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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.util.List;
import java.util.UUID;
import org.bran.Loader;
import org.bran.exception.UnregisteredTypeException;
import org.testng.annotations.Test;

public class SerializerRegistrationTest {

  @Test
  public void testServiceRegistration() {
    Loader loader = Loader.builder().withServiceRegistrations(true).build();
    assertTrue(loader.getSerializerRegistry().contains(UUID.class));
    UUID uuid = new UUID(1, -2);
    byte[] bytes = loader.serialize(uuid);
    assertEquals(bytes.length, 16);
    assertEquals(loader.deserialize(bytes, UUID.class), uuid);
    // Elements of containers carry the tag assigned at registration.
    assertEquals(loader.deserialize(loader.serialize(List.of(uuid), true)), List.of(uuid));
  }

  @Test
  public void testNotApplicable() {
    Loader loader = Loader.builder().withServiceRegistrations(true).withMaxDepth(1).build();
    assertFalse(loader.getSerializerRegistry().contains(UUID.class));
  }

  @Test
  public void testDisabledByDefault() {
    Loader loader = Loader.builder().build();
    assertNull(loader.getSerializerRegistry().get(UUID.class));
    assertThrows(UnregisteredTypeException.class, () -> loader.serialize(UUID.randomUUID()));
  }

  @Test
  public void testExactClassLookup() {
    SerializerRegistry registry = new SerializerRegistry();
    registry.register(UUID.class, new UuidSerializerRegistration.UuidSerializer());
    assertTrue(registry.contains(UUID.class));
    assertNull(registry.get(Object.class));
    assertFalse(registry.contains(Integer.class));
  }
}
