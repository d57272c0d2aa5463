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
import org.bran.exception.SerializationException;
import org.bran.memory.MemoryBuffer;

/**
 * Fixed-length heterogeneous sequences ({@code Object[]}). Each element carries its own type tag,
 * so arrays decode without knowing the element types up front.
 */
public final class ObjectArraySerializer extends Serializer<Object[]> {

  public ObjectArraySerializer() {
    super(Object[].class);
  }

  @Override
  public void write(Loader loader, MemoryBuffer buffer, Object[] value, CallOptions options) {
    buffer.writeVarUint32(value.length);
    for (int i = 0; i < value.length; i++) {
      Object element = value[i];
      if (element == null) {
        throw new SerializationException(
            String.format("Element %d of array is null, null can't be serialized", i));
      }
      loader.writeTagged(buffer, element, options);
    }
  }

  @Override
  public Object[] read(
      Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
    int length = buffer.readLength();
    // every element takes at least one byte, reject lengths the stream can't hold before allocating
    buffer.checkReadableBytes(length);
    Object[] array = new Object[length];
    for (int i = 0; i < length; i++) {
      array[i] = loader.readTagged(buffer, null, options);
    }
    return array;
  }
}
