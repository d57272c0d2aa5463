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

package org.bran.resolver;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bran.annotation.BranField;
import org.bran.annotation.BranSchema;
import org.bran.exception.SchemaNotFoundException;
import org.bran.meta.ClassDefinition;
import org.bran.meta.FieldDefinition;
import org.bran.reflect.FieldAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the {@link ClassDefinition} of every registered type.
 *
 * <p>Registering a type again replaces its definition (last write wins). Registration also assigns
 * type tags to the registered type and its declared field types, and registers field types
 * annotated with {@link BranSchema} that are not known yet.
 */
public class SchemaRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

  private final Map<Class<?>, ClassDefinition> definitions = new LinkedHashMap<>();
  private final TypeTagRegistry typeTagRegistry;
  // avoid recursive registration for self-referential field types.
  // ex. A->field1: B, B.field1: A
  private final Set<Class<?>> registering = new HashSet<>();
  private IdentifierGenerator<String> aliasGenerator =
      IdentifierGenerators.counter(FieldAliasRegistry.DEFAULT_ALIAS_BASE);

  public SchemaRegistry(TypeTagRegistry typeTagRegistry) {
    this.typeTagRegistry = Preconditions.checkNotNull(typeTagRegistry, "typeTagRegistry");
  }

  public TypeTagRegistry getTypeTagRegistry() {
    return typeTagRegistry;
  }

  /** Registers {@code type} with generated aliases for all fields. */
  public ClassDefinition register(Class<?> type, Map<String, Class<?>> fields) {
    return register(type, fields, ImmutableMap.of());
  }

  /**
   * Registers the field layout of {@code type}.
   *
   * @param type the class to register
   * @param fields field name to declared type, iterated in declaration order
   * @param aliasOverrides field name to explicit wire alias; other fields get generated aliases
   * @return the stored definition
   * @throws org.bran.exception.FieldAliasConflictException if two fields share an explicit alias
   * @throws IllegalArgumentException if a field doesn't exist on {@code type} or an override names
   *     an undeclared field
   */
  public ClassDefinition register(
      Class<?> type, Map<String, Class<?>> fields, Map<String, Integer> aliasOverrides) {
    Preconditions.checkNotNull(type, "type");
    Preconditions.checkNotNull(fields, "fields");
    Preconditions.checkNotNull(aliasOverrides, "aliasOverrides");
    Preconditions.checkArgument(
        !type.isPrimitive() && !type.isArray() && !type.isInterface(),
        "Can't register a schema for %s",
        type);
    for (String name : aliasOverrides.keySet()) {
      Preconditions.checkArgument(
          fields.containsKey(name),
          "Alias override for %s but %s declares no such field",
          name,
          type.getName());
    }
    List<FieldDefinition> fieldDefinitions = new ArrayList<>(fields.size());
    for (Map.Entry<String, Class<?>> entry : fields.entrySet()) {
      String name = entry.getKey();
      Class<?> declaredType = Preconditions.checkNotNull(entry.getValue(), "type of %s", name);
      fieldDefinitions.add(
          new FieldDefinition(name, Primitives.wrap(declaredType), FieldAccessor.of(type, name)));
    }
    FieldAliasRegistry aliases = new FieldAliasRegistry(aliasGenerator);
    // Overrides first so that generated aliases step over them.
    for (FieldDefinition field : fieldDefinitions) {
      Integer alias = aliasOverrides.get(field.getName());
      if (alias != null) {
        aliases.put(field.getName(), alias);
      }
    }
    for (FieldDefinition field : fieldDefinitions) {
      aliases.get(field.getName());
    }
    ClassDefinition definition = new ClassDefinition(type, fieldDefinitions, aliases);
    registering.add(type);
    try {
      ClassDefinition previous = definitions.put(type, definition);
      if (previous != null) {
        LOG.warn("Class definition of {} replaced: {} -> {}", type, previous, definition);
      } else {
        LOG.debug("Registered class definition {}", definition);
      }
      typeTagRegistry.tagOf(type);
      for (FieldDefinition field : fieldDefinitions) {
        typeTagRegistry.tagOf(field.getDeclaredType());
      }
      for (FieldDefinition field : fieldDefinitions) {
        Class<?> fieldType = field.getDeclaredType();
        if (fieldType.isAnnotationPresent(BranSchema.class)
            && !definitions.containsKey(fieldType)
            && !registering.contains(fieldType)) {
          LOG.debug(
              "Discovered schema {} through field {} of {}", fieldType, field.getName(), type);
          register(fieldType);
        }
      }
    } finally {
      registering.remove(type);
    }
    return definition;
  }

  /**
   * Registers {@code type} from its {@link BranField} annotated fields, superclass fields first.
   */
  public ClassDefinition register(Class<?> type) {
    Preconditions.checkNotNull(type, "type");
    Map<String, Class<?>> fields = new LinkedHashMap<>();
    Map<String, Integer> overrides = new LinkedHashMap<>();
    for (Class<?> cls : hierarchy(type)) {
      for (Field field : cls.getDeclaredFields()) {
        BranField annotation = field.getAnnotation(BranField.class);
        if (annotation == null || Modifier.isStatic(field.getModifiers())) {
          continue;
        }
        Preconditions.checkArgument(
            !fields.containsKey(field.getName()),
            "Field %s of %s hides an annotated superclass field",
            field.getName(),
            type.getName());
        fields.put(field.getName(), field.getType());
        if (annotation.alias() != BranField.AUTO) {
          overrides.put(field.getName(), annotation.alias());
        }
      }
    }
    return register(type, fields, overrides);
  }

  private static Deque<Class<?>> hierarchy(Class<?> type) {
    Deque<Class<?>> classes = new ArrayDeque<>();
    for (Class<?> cls = type; cls != null && cls != Object.class; cls = cls.getSuperclass()) {
      classes.addFirst(cls);
    }
    return classes;
  }

  /**
   * Returns the definition of {@code type}.
   *
   * @throws SchemaNotFoundException if {@code type} was never registered
   */
  public ClassDefinition get(Class<?> type) {
    ClassDefinition definition = definitions.get(type);
    if (definition == null) {
      throw new SchemaNotFoundException(type);
    }
    return definition;
  }

  public boolean contains(Class<?> type) {
    return definitions.containsKey(type);
  }

  /** Registered types in registration order. */
  public Set<Class<?>> registeredTypes() {
    return Collections.unmodifiableSet(definitions.keySet());
  }

  /**
   * Generator for the aliases of types registered from now on. Call {@link #rebuild()} to apply it
   * to existing definitions.
   */
  public void setAliasGenerator(IdentifierGenerator<String> aliasGenerator) {
    this.aliasGenerator = Preconditions.checkNotNull(aliasGenerator, "aliasGenerator");
  }

  /**
   * Regenerates the generated aliases of every definition with the current alias generator. Either
   * all definitions are rebuilt or, if the generator fails, none is.
   */
  public void rebuild() {
    List<FieldAliasRegistry> registries = new ArrayList<>(definitions.size());
    List<IdentifierRegistry<String>> rebuilt = new ArrayList<>(definitions.size());
    for (ClassDefinition definition : definitions.values()) {
      registries.add(definition.getAliasRegistry());
      rebuilt.add(definition.getAliasRegistry().prepareRebuild(aliasGenerator));
    }
    for (int i = 0; i < registries.size(); i++) {
      registries.get(i).commitRebuild(rebuilt.get(i));
    }
    LOG.info("Rebuilt field aliases of {} class definitions", definitions.size());
  }
}
