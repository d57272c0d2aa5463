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

package org.bran.memory;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import org.bran.exception.MalformedStreamException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class MemoryBufferTest {

  @Test
  public void testBigEndian() {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(0);
    buffer.writeInt16((short) 0x0102);
    buffer.writeInt32(0x03040506);
    buffer.writeInt64(0x0708090a0b0c0d0eL);
    byte[] bytes = buffer.toByteArray();
    assertEquals(bytes.length, 14);
    for (int i = 0; i < bytes.length; i++) {
      assertEquals(bytes[i], i + 1);
    }
    assertEquals(buffer.readInt16(), (short) 0x0102);
    assertEquals(buffer.readInt32(), 0x03040506);
    assertEquals(buffer.readInt64(), 0x0708090a0b0c0d0eL);
    assertEquals(buffer.remaining(), 0);
  }

  @Test
  public void testFloats() {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(4);
    buffer.writeFloat32(1.0f);
    buffer.writeFloat64(-0.0d);
    assertEquals(buffer.getBytes(0, 4), new byte[] {0x3f, (byte) 0x80, 0, 0});
    assertEquals(buffer.readFloat32(), 1.0f, 0.0f);
    assertEquals(Double.doubleToRawLongBits(buffer.readFloat64()), Long.MIN_VALUE);
  }

  @DataProvider
  public static Object[][] varints() {
    return new Object[][] {
      {0, 1}, {1, 1}, {127, 1}, {128, 2}, {16383, 2}, {16384, 3}, {Integer.MAX_VALUE, 5}, {-1, 5}
    };
  }

  @Test(dataProvider = "varints")
  public void testVarUint32(int value, int size) {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(1);
    assertEquals(buffer.writeVarUint32(value), size);
    assertEquals(buffer.writerIndex(), size);
    assertEquals(buffer.readVarUint32(), value);
  }

  @Test
  public void testSmallVarintIsVerbatim() {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(1);
    buffer.writeVarUint32(5);
    assertEquals(buffer.toByteArray(), new byte[] {5});
  }

  @Test
  public void testStrings() {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(2);
    buffer.writeUtf8String("");
    buffer.writeUtf8String("é");
    assertEquals(buffer.toByteArray(), new byte[] {0, 2, (byte) 0xc3, (byte) 0xa9});
    assertEquals(buffer.readUtf8String(), "");
    assertEquals(buffer.readUtf8String(), "é");
  }

  @Test
  public void testTruncation() {
    MemoryBuffer buffer = MemoryBuffer.wrap(new byte[] {0, 0, 0});
    MalformedStreamException e =
        expectThrows(MalformedStreamException.class, buffer::readInt32);
    assertTrue(e.getMessage().contains("truncated"), e.getMessage());
    // A failed read leaves the reader index untouched.
    assertEquals(buffer.readerIndex(), 0);
    assertEquals(buffer.readInt16(), (short) 0);
    MemoryBuffer shortString = MemoryBuffer.wrap(new byte[] {5, 'a'});
    assertThrows(MalformedStreamException.class, shortString::readUtf8String);
  }

  @Test
  public void testMalformed() {
    assertThrows(
        MalformedStreamException.class, () -> MemoryBuffer.wrap(new byte[] {2}).readBoolean());
    byte[] longVarint = {(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 1};
    assertThrows(
        MalformedStreamException.class, () -> MemoryBuffer.wrap(longVarint).readVarUint32());
    byte[] negative = {(byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff, 0x0f};
    assertThrows(MalformedStreamException.class, () -> MemoryBuffer.wrap(negative).readLength());
    // 0xc3 starts a two byte sequence, 0x28 is not a continuation byte.
    MemoryBuffer invalidUtf8 = MemoryBuffer.wrap(new byte[] {2, (byte) 0xc3, 0x28});
    assertThrows(MalformedStreamException.class, invalidUtf8::readUtf8String);
    MemoryBuffer truncatedUtf8 = MemoryBuffer.wrap(new byte[] {1, (byte) 0xe4});
    assertThrows(MalformedStreamException.class, truncatedUtf8::readUtf8String);
  }

  @Test
  public void testGrow() {
    MemoryBuffer buffer = MemoryBuffer.newHeapBuffer(1);
    for (int i = 0; i < 1000; i++) {
      buffer.writeInt32(i);
    }
    assertTrue(buffer.size() >= 4000);
    for (int i = 0; i < 1000; i++) {
      assertEquals(buffer.readInt32(), i);
    }
    buffer.writerIndex(0);
    assertThrows(IndexOutOfBoundsException.class, () -> buffer.writerIndex(-1));
  }
}
