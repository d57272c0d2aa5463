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

import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.function.IntFunction;
import org.bran.Loader;
import org.bran.config.CallOptions;
import org.bran.exception.SerializationException;
import org.bran.memory.MemoryBuffer;
import org.bran.serializer.Serializer;

/**
 * Serializer for maps: an entry count followed by the tagged key and tagged value of every entry.
 *
 * @param <T> the map type created on read
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public class MapSerializer<T extends Map> extends Serializer<T> {
  private final IntFunction<T> factory;

  public MapSerializer(Class<T> type, IntFunction<T> factory) {
    super(type);
    this.factory = Preconditions.checkNotNull(factory, "factory");
  }

  @Override
  public void write(Loader loader, MemoryBuffer buffer, T value, CallOptions options) {
    buffer.writeVarUint32(value.size());
    for (Object o : value.entrySet()) {
      Map.Entry entry = (Map.Entry) o;
      if (entry.getKey() == null || entry.getValue() == null) {
        throw new SerializationException(
            String.format(
                "%s contains a null key or value, null can't be serialized", value.getClass()));
      }
      loader.writeTagged(buffer, entry.getKey(), options);
      loader.writeTagged(buffer, entry.getValue(), options);
    }
  }

  @Override
  public T read(Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
    int size = buffer.readLength();
    // an entry takes at least two bytes
    buffer.checkReadableBytes(size);
    T map = factory.apply(size);
    for (int i = 0; i < size; i++) {
      Object key = loader.readTagged(buffer, null, options);
      Object value = loader.readTagged(buffer, null, options);
      map.put(key, value);
    }
    return map;
  }
}
