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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.bran.Loader;
import org.bran.config.CallOptions;
import org.bran.exception.MalformedStreamException;
import org.bran.exception.SerializationException;
import org.bran.memory.MemoryBuffer;
import org.bran.meta.ClassDefinition;
import org.bran.meta.FieldDefinition;
import org.bran.reflect.ObjectCreator;

/**
 * Default serializer for types registered in the {@link org.bran.resolver.SchemaRegistry}.
 *
 * <p>Each field is written as its alias token followed by its value, in declaration order. The
 * field count comes from the class definition and is not written, so the reader consumes exactly
 * as many field entries as the definition declares and never reads past the object.
 *
 * <p>The class definition is looked up on every call, so re-registering a type takes effect for
 * the next call without replacing this serializer.
 */
@SuppressWarnings("unchecked")
public final class ObjectSerializer<T> extends Serializer<T> {

  public ObjectSerializer(Class<T> type) {
    super(type);
  }

  @Override
  public void write(Loader loader, MemoryBuffer buffer, T value, CallOptions options) {
    ClassDefinition definition = loader.getSchemaRegistry().get(type);
    for (FieldDefinition field : definition.getFields()) {
      Object fieldValue = field.getAccessor().get(value);
      if (fieldValue == null) {
        throw new SerializationException(
            String.format(
                "Field %s of %s is null, null can't be serialized",
                field.getName(),
                type.getName()));
      }
      buffer.writeVarUint32(definition.aliasOf(field));
      loader.write(buffer, fieldValue, options);
    }
  }

  @Override
  public T read(Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
    ClassDefinition definition = loader.getSchemaRegistry().get(type);
    ObjectCreator<T> creator = (ObjectCreator<T>) definition.getObjectCreator();
    List<FieldDefinition> fields = definition.getFields();
    Map<String, Object> values = new HashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      int alias = buffer.readVarUint32();
      FieldDefinition field = definition.fieldOf(alias);
      if (field == null) {
        throw new MalformedStreamException(
            String.format("Unknown field alias %d for %s", alias, type.getName()));
      }
      if (values.containsKey(field.getName())) {
        throw new MalformedStreamException(
            String.format(
                "Field %s of %s appears twice in stream", field.getName(), type.getName()));
      }
      values.put(field.getName(), loader.read(buffer, field.getDeclaredType(), options));
    }
    if (creator.isRecord()) {
      return creator.newRecord(values);
    }
    T obj = creator.newInstance();
    for (FieldDefinition field : fields) {
      field.getAccessor().set(obj, values.get(field.getName()));
    }
    return obj;
  }
}
