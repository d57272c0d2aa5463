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

package org.bran;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import org.bran.config.CallOptions;
import org.bran.exception.MalformedStreamException;
import org.bran.exception.SerializationException;
import org.bran.exception.UnknownTypeTagException;
import org.bran.exception.UnregisteredTypeException;
import org.bran.memory.MemoryBuffer;
import org.bran.resolver.SchemaRegistry;
import org.bran.resolver.TypeTagRegistry;
import org.bran.serializer.Serializer;
import org.testng.annotations.Test;

public class LoaderTest extends BranTestBase {

  @Test(dataProvider = "tagging")
  public void testPrimitives(boolean tagging) {
    Loader loader = newLoader();
    serDeCheck(loader, true, tagging);
    serDeCheck(loader, false, tagging);
    serDeCheck(loader, (byte) -128, tagging);
    serDeCheck(loader, (short) -1, tagging);
    serDeCheck(loader, 0, tagging);
    serDeCheck(loader, Integer.MIN_VALUE, tagging);
    serDeCheck(loader, Integer.MAX_VALUE, tagging);
    serDeCheck(loader, Long.MIN_VALUE, tagging);
    serDeCheck(loader, -1.5f, tagging);
    serDeCheck(loader, Double.MAX_VALUE, tagging);
    serDeCheck(loader, Double.NaN, tagging);
    serDeCheck(loader, "", tagging);
    serDeCheck(loader, "abc", tagging);
    serDeCheck(loader, "中文 ünïcödé 😀", tagging);
  }

  @Test
  public void testIntEncoding() {
    Loader loader = newLoader();
    assertEquals(loader.serialize(1), bytes(0, 0, 0, 1));
    assertEquals(loader.serialize(-2), bytes(0xff, 0xff, 0xff, 0xfe));
    assertEquals(loader.serialize(258L), bytes(0, 0, 0, 0, 0, 0, 1, 2));
    assertEquals(loader.serialize(true), bytes(1));
    assertEquals(loader.serialize("hi"), bytes(2, 'h', 'i'));
    int value =
        loader.deserialize(
            new ByteArrayInputStream(bytes(0, 0, 0, 0)), int.class, CallOptions.DEFAULT);
    assertEquals(value, 0);
  }

  @Test
  public void testTaggedEncoding() {
    Loader loader = newLoader();
    int intTag = loader.getTypeTagRegistry().tagOf(Integer.class);
    byte[] bytes = loader.serialize(1, true);
    assertEquals(bytes, bytes(intTag, 0, 0, 0, 1));
    assertEquals(loader.deserialize(bytes), 1);
    assertEquals(loader.deserialize(bytes, Integer.class, true), Integer.valueOf(1));
    // A supertype of the tagged type is accepted.
    assertEquals(loader.deserialize(bytes, Object.class, true), 1);
    assertThrows(
        SerializationException.class, () -> loader.deserialize(bytes, String.class, true));
  }

  @Test
  public void testTaggingByDefault() {
    Loader loader = Loader.builder().withTagging(true).build();
    byte[] bytes = loader.serialize("x");
    assertEquals(bytes[0], loader.getTypeTagRegistry().tagOf(String.class));
    assertEquals(loader.deserialize(bytes, String.class), "x");
    // Per call options override the configured default.
    assertEquals(loader.serialize("x", false), bytes(1, 'x'));
  }

  @Test
  public void testUnknownTag() {
    Loader loader = newLoader();
    UnknownTypeTagException e =
        expectThrows(UnknownTypeTagException.class, () -> loader.deserialize(bytes(120, 0)));
    assertEquals(e.getTag(), 120);
  }

  @Test
  public void testSchemaObject() {
    Loader loader = newRegisteredLoader();
    serDeCheck(loader, new Point(1, -2), false);
    serDeCheck(loader, new Point(0, 0), true);
    serDeCheck(loader, new Outer("name", new Inner(7)), false);
    serDeCheck(loader, new Outer("", new Inner(0)), true);
  }

  @Test
  public void testUnregisteredType() {
    Loader loader = newLoader();
    UnregisteredTypeException e =
        expectThrows(UnregisteredTypeException.class, () -> loader.serialize(new Point(1, 2)));
    assertEquals(e.getType(), Point.class);
    assertThrows(
        UnregisteredTypeException.class, () -> loader.deserialize(bytes(0, 0), Point.class));
    assertThrows(SerializationException.class, () -> loader.serialize(new StringBuilder("a")));
  }

  @Test
  public void testInvalidUtf8() {
    Loader loader = newLoader();
    assertThrows(
        MalformedStreamException.class,
        () -> loader.deserialize(bytes(2, 0xc3, 0x28), String.class));
  }

  @Test
  public void testNullRejected() {
    Loader loader = newRegisteredLoader();
    assertThrows(SerializationException.class, () -> loader.serialize(null));
    assertThrows(SerializationException.class, () -> loader.serialize(new Outer(null, null)));
  }

  @Test
  public void testTypeRequiredWithoutTagging() {
    Loader loader = newLoader();
    assertThrows(IllegalArgumentException.class, () -> loader.deserialize(bytes(1), null, false));
    assertThrows(IllegalArgumentException.class, () -> loader.deserialize(bytes(1), false));
  }

  public static class Node {
    int value;
    Node next;
  }

  @Test
  public void testCyclicGraphFailsFast() {
    Loader loader = Loader.builder().withMaxDepth(64).build();
    loader.registerClass(Node.class, ImmutableMap.of("value", int.class, "next", Node.class));
    Node node = new Node();
    node.next = node;
    SerializationException e =
        expectThrows(SerializationException.class, () -> loader.serialize(node));
    assertTrue(e.getMessage().contains("cyclic"), e.getMessage());
    assertEquals(loader.getDepth(), 0);
    // The loader stays usable after the failure.
    assertEquals(loader.serialize(1), bytes(0, 0, 0, 1));
  }

  @Test
  public void testDepthLimit() {
    Loader loader = Loader.builder().withMaxDepth(3).build();
    List<Object> nested = new ArrayList<>();
    nested.add(new ArrayList<>(List.of(1)));
    // list -> list -> int is three levels.
    serDeCheck(loader, nested, false);
    List<Object> deeper = new ArrayList<>();
    deeper.add(nested);
    assertThrows(SerializationException.class, () -> loader.serialize(deeper));
  }

  static final class RegisteringSerializer extends Serializer<StringBuilder> {
    RegisteringSerializer() {
      super(StringBuilder.class);
    }

    @Override
    public void write(
        Loader loader, MemoryBuffer buffer, StringBuilder value, CallOptions options) {
      loader.registerClass(Point.class, POINT_FIELDS);
    }

    @Override
    public StringBuilder read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      loader.registerTypeTag(Point.class, 1000);
      return new StringBuilder();
    }
  }

  @Test
  public void testRegisterDuringSerialization() {
    Loader loader = newLoader();
    loader.register(StringBuilder.class, new RegisteringSerializer());
    assertThrows(IllegalStateException.class, () -> loader.serialize(new StringBuilder()));
    assertThrows(
        IllegalStateException.class, () -> loader.deserialize(new byte[0], StringBuilder.class));
    // Allowed again once the call is over.
    loader.registerClass(Point.class, POINT_FIELDS);
    assertTrue(loader.getSchemaRegistry().contains(Point.class));
  }

  static final class UpperCaseSerializer extends Serializer<String> {
    UpperCaseSerializer() {
      super(String.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, String value, CallOptions options) {
      buffer.writeUtf8String(value.toUpperCase());
    }

    @Override
    public String read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readUtf8String();
    }
  }

  @Test
  public void testCustomSerializerReplacesBuiltin() {
    Loader loader = newLoader();
    loader.register(String.class, new UpperCaseSerializer());
    assertEquals(loader.deserialize(loader.serialize("abc"), String.class), "ABC");
    assertEquals(loader.getSerializer(String.class).getClass(), UpperCaseSerializer.class);
  }

  static final class SuffixSerializer extends Serializer<String> {
    SuffixSerializer() {
      super(String.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, String value, CallOptions options) {
      Object suffix = options.getAttribute("suffix");
      buffer.writeUtf8String(suffix == null ? value : value + suffix);
    }

    @Override
    public String read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readUtf8String();
    }
  }

  @Test
  public void testCallOptionsReachNestedSerializers() {
    Loader loader = newRegisteredLoader();
    loader.register(String.class, new SuffixSerializer());
    CallOptions options = CallOptions.DEFAULT.withAttribute("suffix", "!");
    byte[] bytes = loader.serialize(new Outer("a", new Inner(1)), options);
    assertEquals(loader.deserialize(bytes, Outer.class), new Outer("a!", new Inner(1)));
  }

  @Test
  public void testStreams() {
    Loader loader = newRegisteredLoader();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    loader.serialize(out, new Point(3, 4), CallOptions.TAGGED);
    Point point =
        loader.deserialize(
            new ByteArrayInputStream(out.toByteArray()), Point.class, CallOptions.TAGGED);
    assertEquals(point, new Point(3, 4));
  }

  @Test
  public void testBufferApi() {
    Loader loader = newRegisteredLoader();
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(8);
    loader.serialize(buffer, new Point(1, 2), CallOptions.DEFAULT);
    loader.serialize(buffer, "tail", CallOptions.TAGGED);
    assertEquals(loader.deserialize(buffer, Point.class, CallOptions.DEFAULT), new Point(1, 2));
    assertEquals(loader.deserialize(buffer, null, CallOptions.TAGGED), "tail");
    assertEquals(buffer.remaining(), 0);
  }

  @Test
  public void testSharedRegistries() {
    SchemaRegistry schemas = new SchemaRegistry(new TypeTagRegistry());
    Loader writer = Loader.builder().withSchemaRegistry(schemas).build();
    Loader reader = Loader.builder().withSchemaRegistry(schemas).build();
    writer.registerClass(Point.class, POINT_FIELDS);
    assertSame(reader.getTypeTagRegistry(), writer.getTypeTagRegistry());
    byte[] bytes = writer.serialize(new Point(5, 6), true);
    assertEquals(reader.deserialize(bytes), new Point(5, 6));
  }

  @Test
  public void testIndependentLoadersAgree() {
    Loader writer = newRegisteredLoader();
    Loader reader = newRegisteredLoader();
    Object[] values = {1, "two", 3.0, new Point(4, 5), List.of("six")};
    byte[] bytes = writer.serialize(values, true);
    Object[] result = (Object[]) reader.deserialize(bytes);
    assertEquals(result, values);
  }
}
