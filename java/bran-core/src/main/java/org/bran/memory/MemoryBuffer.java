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

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bran.exception.MalformedStreamException;

/**
 * A growable heap byte buffer with independent reader and writer indices, used as both the byte
 * sink and the byte source of bran serialization.
 *
 * <p>Differences from {@link java.nio.ByteBuffer}:
 *
 * <ul>
 *   <li>big-endian fixed-width access, matching the bran wire format.
 *   <li>independent read/write index, no flip.
 *   <li>unsigned LEB128 varint encoding for lengths, aliases and tags.
 *   <li>auto grow on write.
 *   <li>reads past the writer index raise {@link MalformedStreamException} instead of an
 *       index error, so a truncated stream always surfaces as bad data.
 * </ul>
 *
 * <p>Not thread safe.
 */
public final class MemoryBuffer {
  public static final int BUFFER_GROW_STEP_THRESHOLD = 100 * 1024 * 1024;

  private byte[] heapMemory;
  private int readerIndex;
  private int writerIndex;

  private MemoryBuffer(byte[] heapMemory, int writerIndex) {
    this.heapMemory = heapMemory;
    this.writerIndex = writerIndex;
  }

  /** Creates a buffer whose readable content is the given bytes. */
  public static MemoryBuffer wrap(byte[] bytes) {
    Preconditions.checkNotNull(bytes, "bytes");
    return new MemoryBuffer(bytes, bytes.length);
  }

  /**
   * Create a heap buffer of specified initial size. The buffer will grow automatically if not
   * enough.
   */
  public static MemoryBuffer newHeapBuffer(int initialSize) {
    Preconditions.checkArgument(initialSize >= 0, "Negative buffer size %s", initialSize);
    return new MemoryBuffer(new byte[initialSize], 0);
  }

  /** Gets the capacity of the backing array, in bytes. */
  public int size() {
    return heapMemory.length;
  }

  // -------------------------------------------------------------------------
  //                          Write Methods
  // -------------------------------------------------------------------------

  public int writerIndex() {
    return writerIndex;
  }

  /** Sets the writer index, e.g. 0 to reuse the buffer for a new value. */
  public void writerIndex(int writerIndex) {
    if (writerIndex < 0 || writerIndex > heapMemory.length) {
      throw new IndexOutOfBoundsException(
          String.format(
              "writerIndex: %d (expected: 0 <= writerIndex <= size(%d))",
              writerIndex, heapMemory.length));
    }
    this.writerIndex = writerIndex;
  }

  public void writeBoolean(boolean value) {
    writeByte(value ? 1 : 0);
  }

  public void writeByte(byte value) {
    grow(1);
    heapMemory[writerIndex++] = value;
  }

  public void writeByte(int value) {
    writeByte((byte) value);
  }

  public void writeInt16(short value) {
    grow(2);
    byte[] mem = heapMemory;
    int idx = writerIndex;
    mem[idx] = (byte) (value >>> 8);
    mem[idx + 1] = (byte) value;
    writerIndex = idx + 2;
  }

  public void writeInt32(int value) {
    grow(4);
    byte[] mem = heapMemory;
    int idx = writerIndex;
    mem[idx] = (byte) (value >>> 24);
    mem[idx + 1] = (byte) (value >>> 16);
    mem[idx + 2] = (byte) (value >>> 8);
    mem[idx + 3] = (byte) value;
    writerIndex = idx + 4;
  }

  public void writeInt64(long value) {
    grow(8);
    byte[] mem = heapMemory;
    int idx = writerIndex;
    for (int shift = 56; shift >= 0; shift -= 8) {
      mem[idx++] = (byte) (value >>> shift);
    }
    writerIndex = idx;
  }

  public void writeFloat32(float value) {
    writeInt32(Float.floatToRawIntBits(value));
  }

  public void writeFloat64(double value) {
    writeInt64(Double.doubleToRawLongBits(value));
  }

  /**
   * Writes an unsigned varint: 7 bits per byte, low group first, high bit set on every byte but the
   * last. Values in [0, 127] take a single byte equal to the value.
   *
   * @return the number of bytes written
   */
  public int writeVarUint32(int value) {
    grow(5);
    byte[] mem = heapMemory;
    int idx = writerIndex;
    int start = idx;
    while ((value & ~0x7F) != 0) {
      mem[idx++] = (byte) ((value & 0x7F) | 0x80);
      value >>>= 7;
    }
    mem[idx++] = (byte) value;
    writerIndex = idx;
    return idx - start;
  }

  public void writeBytes(byte[] bytes) {
    writeBytes(bytes, 0, bytes.length);
  }

  public void writeBytes(byte[] bytes, int offset, int length) {
    grow(length);
    System.arraycopy(bytes, offset, heapMemory, writerIndex, length);
    writerIndex += length;
  }

  /** Writes the varint byte length followed by the UTF-8 bytes of {@code value}. */
  public void writeUtf8String(String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    writeVarUint32(bytes.length);
    writeBytes(bytes);
  }

  /** Make sure at least {@code neededSize} bytes can be written after the writer index. */
  public void grow(int neededSize) {
    int length = writerIndex + neededSize;
    if (length > heapMemory.length) {
      growBuffer(length);
    }
  }

  private void growBuffer(int length) {
    int newSize =
        length < BUFFER_GROW_STEP_THRESHOLD
            ? length << 1
            : (int) Math.min(length * 1.5d, Integer.MAX_VALUE - 8);
    heapMemory = Arrays.copyOf(heapMemory, newSize);
  }

  // -------------------------------------------------------------------------
  //                          Read Methods
  // -------------------------------------------------------------------------

  /** Returns the {@code readerIndex} of this buffer. */
  public int readerIndex() {
    return readerIndex;
  }

  public void readerIndex(int readerIndex) {
    if (readerIndex < 0 || readerIndex > writerIndex) {
      throw new IndexOutOfBoundsException(
          String.format(
              "readerIndex: %d (expected: 0 <= readerIndex <= writerIndex(%d))",
              readerIndex, writerIndex));
    }
    this.readerIndex = readerIndex;
  }

  /** Number of bytes between the reader index and the writer index. */
  public int remaining() {
    return writerIndex - readerIndex;
  }

  /**
   * Fails with {@link MalformedStreamException} unless {@code length} bytes remain. Check should be
   * done before touching memory so a truncated stream never yields garbage.
   */
  public void checkReadableBytes(int length) {
    if (length < 0 || readerIndex > writerIndex - length) {
      throw new MalformedStreamException(
          String.format(
              "Stream truncated: need %d bytes at readerIndex %d but only %d remain",
              length, readerIndex, writerIndex - readerIndex));
    }
  }

  public boolean readBoolean() {
    byte b = readByte();
    if (b == 0) {
      return false;
    }
    if (b == 1) {
      return true;
    }
    throw new MalformedStreamException(
        String.format("Invalid boolean byte 0x%02x at readerIndex %d", b, readerIndex - 1));
  }

  public byte readByte() {
    checkReadableBytes(1);
    return heapMemory[readerIndex++];
  }

  public short readInt16() {
    checkReadableBytes(2);
    byte[] mem = heapMemory;
    int idx = readerIndex;
    readerIndex = idx + 2;
    return (short) (((mem[idx] & 0xFF) << 8) | (mem[idx + 1] & 0xFF));
  }

  public int readInt32() {
    checkReadableBytes(4);
    byte[] mem = heapMemory;
    int idx = readerIndex;
    readerIndex = idx + 4;
    return ((mem[idx] & 0xFF) << 24)
        | ((mem[idx + 1] & 0xFF) << 16)
        | ((mem[idx + 2] & 0xFF) << 8)
        | (mem[idx + 3] & 0xFF);
  }

  public long readInt64() {
    checkReadableBytes(8);
    byte[] mem = heapMemory;
    int idx = readerIndex;
    long result = 0;
    for (int i = 0; i < 8; i++) {
      result = (result << 8) | (mem[idx + i] & 0xFFL);
    }
    readerIndex = idx + 8;
    return result;
  }

  public float readFloat32() {
    return Float.intBitsToFloat(readInt32());
  }

  public double readFloat64() {
    return Double.longBitsToDouble(readInt64());
  }

  /** Reads an unsigned varint written by {@link #writeVarUint32(int)}. */
  public int readVarUint32() {
    int result = 0;
    for (int shift = 0; shift < 35; shift += 7) {
      byte b = readByte();
      result |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new MalformedStreamException(
        String.format("Varint longer than 5 bytes ending at readerIndex %d", readerIndex));
  }

  /**
   * Reads a varint used as a length or count. Lengths are non-negative, a value with the sign bit
   * set can only come from a corrupted stream.
   */
  public int readLength() {
    int length = readVarUint32();
    if (length < 0) {
      throw new MalformedStreamException(
          String.format("Negative length %d before readerIndex %d", length, readerIndex));
    }
    return length;
  }

  public byte[] readBytes(int length) {
    checkReadableBytes(length);
    byte[] bytes = Arrays.copyOfRange(heapMemory, readerIndex, readerIndex + length);
    readerIndex += length;
    return bytes;
  }

  public String readUtf8String() {
    int length = readLength();
    checkReadableBytes(length);
    String value;
    try {
      value =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(heapMemory, readerIndex, length))
              .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedStreamException(
          String.format("Invalid UTF-8 in %d bytes at readerIndex %d", length, readerIndex), e);
    }
    readerIndex += length;
    return value;
  }

  // -------------------------------------------------------------------------

  /** Copies {@code [index, index + length)} of the written content into a new array. */
  public byte[] getBytes(int index, int length) {
    if (index < 0 || length < 0 || index + length > writerIndex) {
      throw new IndexOutOfBoundsException(
          String.format(
              "index(%d) + length(%d) exceeds writerIndex(%d)", index, length, writerIndex));
    }
    return Arrays.copyOfRange(heapMemory, index, index + length);
  }

  /** Copies everything written so far. */
  public byte[] toByteArray() {
    return getBytes(0, writerIndex);
  }

  @Override
  public String toString() {
    return "MemoryBuffer{"
        + "size="
        + heapMemory.length
        + ", readerIndex="
        + readerIndex
        + ", writerIndex="
        + writerIndex
        + '}';
  }
}
