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

import org.bran.Loader;
import org.bran.config.CallOptions;
import org.bran.memory.MemoryBuffer;

/** Serializers for boxed primitives. Multi-byte values are big-endian, fixed width. */
public class PrimitiveSerializers {

  public static final class BooleanSerializer extends Serializer<Boolean> {
    public BooleanSerializer() {
      super(Boolean.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Boolean value, CallOptions options) {
      buffer.writeBoolean(value);
    }

    @Override
    public Boolean read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readBoolean();
    }
  }

  public static final class ByteSerializer extends Serializer<Byte> {
    public ByteSerializer() {
      super(Byte.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Byte value, CallOptions options) {
      buffer.writeByte(value);
    }

    @Override
    public Byte read(Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readByte();
    }
  }

  public static final class ShortSerializer extends Serializer<Short> {
    public ShortSerializer() {
      super(Short.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Short value, CallOptions options) {
      buffer.writeInt16(value);
    }

    @Override
    public Short read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readInt16();
    }
  }

  public static final class IntSerializer extends Serializer<Integer> {
    public IntSerializer() {
      super(Integer.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Integer value, CallOptions options) {
      buffer.writeInt32(value);
    }

    @Override
    public Integer read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readInt32();
    }
  }

  public static final class LongSerializer extends Serializer<Long> {
    public LongSerializer() {
      super(Long.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Long value, CallOptions options) {
      buffer.writeInt64(value);
    }

    @Override
    public Long read(Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readInt64();
    }
  }

  public static final class FloatSerializer extends Serializer<Float> {
    public FloatSerializer() {
      super(Float.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Float value, CallOptions options) {
      buffer.writeFloat32(value);
    }

    @Override
    public Float read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readFloat32();
    }
  }

  public static final class DoubleSerializer extends Serializer<Double> {
    public DoubleSerializer() {
      super(Double.class);
    }

    @Override
    public void write(Loader loader, MemoryBuffer buffer, Double value, CallOptions options) {
      buffer.writeFloat64(value);
    }

    @Override
    public Double read(
        Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
      return buffer.readFloat64();
    }
  }
}
