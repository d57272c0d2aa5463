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

package org.bran.reflect;

import com.google.common.base.Preconditions;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import org.bran.exception.SerializationException;

/** Reads and writes one instance field through reflection. */
public final class FieldAccessor {
  private final Field field;

  private FieldAccessor(Field field) {
    this.field = field;
  }

  /**
   * Locates the instance field {@code name} on {@code type} or its superclasses.
   *
   * @throws IllegalArgumentException if there is no such instance field
   */
  public static FieldAccessor of(Class<?> type, String name) {
    Preconditions.checkNotNull(type, "type");
    Preconditions.checkNotNull(name, "name");
    for (Class<?> cls = type; cls != null && cls != Object.class; cls = cls.getSuperclass()) {
      Field field;
      try {
        field = cls.getDeclaredField(name);
      } catch (NoSuchFieldException e) {
        continue;
      }
      Preconditions.checkArgument(
          !Modifier.isStatic(field.getModifiers()),
          "Field %s of %s is static and can't be serialized",
          name,
          type.getName());
      field.setAccessible(true);
      return new FieldAccessor(field);
    }
    throw new IllegalArgumentException(
        String.format("%s has no field named %s", type.getName(), name));
  }

  public Field getField() {
    return field;
  }

  public Object get(Object target) {
    try {
      return field.get(target);
    } catch (IllegalAccessException e) {
      throw new SerializationException(
          String.format("Can't read field %s of %s", field.getName(), field.getDeclaringClass()),
          e);
    }
  }

  public void set(Object target, Object value) {
    try {
      field.set(target, value);
    } catch (IllegalAccessException | IllegalArgumentException e) {
      throw new SerializationException(
          String.format(
              "Can't assign %s to field %s of %s",
              value == null ? null : value.getClass().getName(),
              field.getName(),
              field.getDeclaringClass()),
          e);
    }
  }

  @Override
  public String toString() {
    return "FieldAccessor{" + field + '}';
  }
}
