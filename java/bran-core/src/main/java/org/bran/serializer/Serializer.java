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

/**
 * Encodes and decodes values of one wire type.
 *
 * <p>Serializers hold no per-call state, the {@link Loader} driving a call is passed to every
 * method so nested values can be dispatched back to it. One instance may be registered for several
 * classes, e.g. a list serializer for {@code List}, {@code ArrayList} and immutable lists; the
 * values it decodes are always instances of {@link #getType()}.
 *
 * @param <T> the wire type
 */
public abstract class Serializer<T> {
  protected final Class<T> type;

  public Serializer(Class<T> type) {
    this.type = type;
  }

  /** Appends the encoding of {@code value} to {@code buffer}. {@code value} is never null. */
  public abstract void write(Loader loader, MemoryBuffer buffer, T value, CallOptions options);

  /**
   * Consumes exactly the bytes of one encoded value from {@code buffer}.
   *
   * @param targetType the class the caller asked for, one of the classes this serializer is
   *     registered for
   */
  public abstract T read(
      Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options);

  /** The wire type, whose tag identifies values written by this serializer. */
  public Class<T> getType() {
    return type;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{type=" + type.getName() + '}';
  }
}
