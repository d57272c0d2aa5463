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

import com.google.common.base.Defaults;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Map;
import org.bran.exception.SerializationException;

/**
 * Creates instances of a schema type while decoding.
 *
 * <p>Records are built through their canonical constructor once all field values are known. Other
 * classes need a no-arg constructor, of any visibility, and get their fields assigned afterwards.
 */
public abstract class ObjectCreator<T> {
  protected final Class<T> type;

  protected ObjectCreator(Class<T> type) {
    this.type = type;
  }

  public static <T> ObjectCreator<T> of(Class<T> type) {
    if (type.isRecord()) {
      return new RecordCreator<>(type);
    }
    return new DeclaredConstructorCreator<>(type);
  }

  public Class<T> getType() {
    return type;
  }

  /** Whether field values must be collected first and passed to {@link #newRecord(Map)}. */
  public abstract boolean isRecord();

  public abstract T newInstance();

  /**
   * Builds a record from component values keyed by component name. Missing components get the
   * default value of their type.
   */
  public abstract T newRecord(Map<String, Object> componentValues);

  static SerializationException creationFailure(Class<?> type, Throwable cause) {
    return new SerializationException(
        String.format("Failed to create instance of %s", type.getName()), cause);
  }

  private static final class DeclaredConstructorCreator<T> extends ObjectCreator<T> {
    private Constructor<T> constructor;

    DeclaredConstructorCreator(Class<T> type) {
      super(type);
    }

    @Override
    public boolean isRecord() {
      return false;
    }

    @Override
    public T newInstance() {
      try {
        if (constructor == null) {
          Constructor<T> ctr = type.getDeclaredConstructor();
          ctr.setAccessible(true);
          constructor = ctr;
        }
        return constructor.newInstance();
      } catch (NoSuchMethodException e) {
        throw new SerializationException(
            String.format("%s has no no-arg constructor to decode into", type.getName()), e);
      } catch (InstantiationException | IllegalAccessException e) {
        throw creationFailure(type, e);
      } catch (InvocationTargetException e) {
        throw creationFailure(type, e.getCause());
      }
    }

    @Override
    public T newRecord(Map<String, Object> componentValues) {
      throw new UnsupportedOperationException(type + " is not a record");
    }
  }

  private static final class RecordCreator<T> extends ObjectCreator<T> {
    private final RecordComponent[] components;
    private final Constructor<T> constructor;

    RecordCreator(Class<T> type) {
      super(type);
      components = type.getRecordComponents();
      Class<?>[] parameterTypes = new Class<?>[components.length];
      for (int i = 0; i < components.length; i++) {
        parameterTypes[i] = components[i].getType();
      }
      try {
        constructor = type.getDeclaredConstructor(parameterTypes);
        constructor.setAccessible(true);
      } catch (NoSuchMethodException e) {
        throw new IllegalStateException("Record without canonical constructor: " + type, e);
      }
    }

    @Override
    public boolean isRecord() {
      return true;
    }

    @Override
    public T newInstance() {
      throw new UnsupportedOperationException(type + " is a record, use newRecord");
    }

    @Override
    public T newRecord(Map<String, Object> componentValues) {
      Object[] args = new Object[components.length];
      for (int i = 0; i < components.length; i++) {
        RecordComponent component = components[i];
        Object value = componentValues.get(component.getName());
        args[i] = value != null ? value : Defaults.defaultValue(component.getType());
      }
      try {
        return constructor.newInstance(args);
      } catch (InstantiationException | IllegalAccessException | IllegalArgumentException e) {
        throw creationFailure(type, e);
      } catch (InvocationTargetException e) {
        throw creationFailure(type, e.getCause());
      }
    }
  }
}
