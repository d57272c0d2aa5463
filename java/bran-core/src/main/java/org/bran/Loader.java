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

package org.bran;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.Primitives;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;
import org.bran.config.CallOptions;
import org.bran.config.Config;
import org.bran.config.LoaderBuilder;
import org.bran.exception.FileAccessException;
import org.bran.exception.SerializationException;
import org.bran.exception.UnregisteredTypeException;
import org.bran.memory.MemoryBuffer;
import org.bran.meta.ClassDefinition;
import org.bran.resolver.IdentifierGenerator;
import org.bran.resolver.SchemaRegistry;
import org.bran.resolver.SerializerRegistration;
import org.bran.resolver.SerializerRegistry;
import org.bran.resolver.TypeTagRegistry;
import org.bran.serializer.ObjectSerializer;
import org.bran.serializer.Serializer;
import org.bran.serializer.Serializers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for serialization. A loader dispatches every value to the serializer registered for
 * its exact class, falling back to the schema-driven {@link ObjectSerializer} for types with a
 * class definition.
 *
 * <p>In tagging mode the top-level value is prefixed with its type tag, so it can be decoded
 * without naming its type. Nested values are never tagged, except container elements, which always
 * carry their tag.
 *
 * <p>Loader is not thread safe. Registries may be shared between loaders through {@link
 * LoaderBuilder}, as long as they are used from one thread at a time.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public final class Loader {
  private static final Logger LOG = LoggerFactory.getLogger(Loader.class);

  private final Config config;
  private final CallOptions defaultOptions;
  private final SchemaRegistry schemaRegistry;
  private final TypeTagRegistry typeTagRegistry;
  private final SerializerRegistry serializerRegistry = new SerializerRegistry();
  private final Map<Class<?>, ObjectSerializer<?>> objectSerializers = new HashMap<>();
  private final MemoryBuffer buffer;
  // Nesting of the value being processed, 0 when no call is active.
  private int depth;

  public Loader(LoaderBuilder builder) {
    config = builder.buildConfig();
    defaultOptions = CallOptions.of(config.isTagging());
    schemaRegistry = builder.buildSchemaRegistry();
    typeTagRegistry = schemaRegistry.getTypeTagRegistry();
    buffer = MemoryBuffer.newHeapBuffer(config.getBufferSize());
    Serializers.registerDefaults(serializerRegistry);
    if (config.isServiceRegistrationsEnabled()) {
      loadSerializerRegistrations();
    }
  }

  public static LoaderBuilder builder() {
    return new LoaderBuilder();
  }

  private void loadSerializerRegistrations() {
    for (SerializerRegistration registration : ServiceLoader.load(SerializerRegistration.class)) {
      if (registration.isApplicable(this)) {
        registration.registerIfEnabled(this);
        LOG.info("Applied serializer registration {}", registration.getClass().getName());
      } else {
        LOG.debug("Skipped serializer registration {}", registration.getClass().getName());
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Registration

  private void checkRegisterAllowed() {
    if (depth > 0) {
      throw new IllegalStateException(
          "Cannot register class/serializer after serialization/deserialization has started");
    }
  }

  /**
   * Registers a serializer for {@code type}, replacing any previous serializer of that exact class.
   * The wire type of the serializer gets a type tag.
   */
  public <T> void register(Class<T> type, Serializer<? super T> serializer) {
    checkRegisterAllowed();
    serializerRegistry.register(type, serializer);
    typeTagRegistry.tagOf(serializer.getType());
  }

  /** Same as {@link #register(Class, Serializer)}. */
  public <T> void registerSerializer(Class<T> type, Serializer<? super T> serializer) {
    register(type, serializer);
  }

  /** Registers a class definition from field names and declared types. */
  public ClassDefinition registerClass(Class<?> type, Map<String, Class<?>> fields) {
    return registerClass(type, fields, ImmutableMap.of());
  }

  public ClassDefinition registerClass(
      Class<?> type, Map<String, Class<?>> fields, Map<String, Integer> aliasOverrides) {
    checkRegisterAllowed();
    return schemaRegistry.register(type, fields, aliasOverrides);
  }

  /** Registers a class definition from the {@link org.bran.annotation.BranField} fields. */
  public ClassDefinition registerClass(Class<?> type) {
    checkRegisterAllowed();
    return schemaRegistry.register(type);
  }

  /** Binds {@code type} to an explicit type tag. */
  public void registerTypeTag(Class<?> type, int tag) {
    checkRegisterAllowed();
    typeTagRegistry.register(type, tag);
  }

  /**
   * Replaces the type tag generator. Existing tags stay until {@link #rebuildTagRegistry()} is
   * called.
   */
  public void setTagGenerator(IdentifierGenerator<Class<?>> generator) {
    checkRegisterAllowed();
    typeTagRegistry.setGenerator(generator);
  }

  /** Regenerates all generated type tags; explicit tags are kept. */
  public void rebuildTagRegistry() {
    checkRegisterAllowed();
    typeTagRegistry.rebuild();
  }

  // ---------------------------------------------------------------------------------------------
  // Serialization

  public byte[] serialize(Object value) {
    return serialize(value, defaultOptions);
  }

  public byte[] serialize(Object value, boolean tagging) {
    return serialize(value, defaultOptions.withTagging(tagging));
  }

  public byte[] serialize(Object value, CallOptions options) {
    // A serializer may start a nested top-level call, which must not clobber the shared buffer.
    MemoryBuffer buf = depth == 0 ? buffer : MemoryBuffer.newHeapBuffer(config.getBufferSize());
    buf.writerIndex(0);
    serialize(buf, value, options);
    return buf.toByteArray();
  }

  /** Appends the encoding of {@code value} to {@code buffer}. */
  public void serialize(MemoryBuffer buffer, Object value, CallOptions options) {
    Preconditions.checkNotNull(buffer, "buffer");
    Preconditions.checkNotNull(options, "options");
    if (options.isTagging()) {
      writeTagged(buffer, value, options);
    } else {
      write(buffer, value, options);
    }
  }

  public void serialize(OutputStream outputStream, Object value, CallOptions options) {
    byte[] bytes = serialize(value, options);
    try {
      outputStream.write(bytes);
    } catch (IOException e) {
      throw new FileAccessException("Failed to write serialized value to stream", e);
    }
  }

  /** Writes {@code value} untagged with the serializer of its class. Used for nested values. */
  public void write(MemoryBuffer buffer, Object value, CallOptions options) {
    if (value == null) {
      throw new SerializationException("Null can't be serialized");
    }
    Serializer serializer = getSerializer(value.getClass());
    enter(value.getClass());
    try {
      serializer.write(this, buffer, value, options);
    } finally {
      depth--;
    }
  }

  /** Writes the type tag of {@code value}'s wire type, then {@code value}. */
  public void writeTagged(MemoryBuffer buffer, Object value, CallOptions options) {
    if (value == null) {
      throw new SerializationException("Null can't be serialized");
    }
    Serializer<?> serializer = getSerializer(value.getClass());
    buffer.writeVarUint32(typeTagRegistry.tagOf(serializer.getType()));
    write(buffer, value, options);
  }

  // ---------------------------------------------------------------------------------------------
  // Deserialization

  public <T> T deserialize(byte[] bytes, Class<T> type) {
    return deserialize(MemoryBuffer.wrap(bytes), type, defaultOptions);
  }

  public <T> T deserialize(byte[] bytes, Class<T> type, boolean tagging) {
    return deserialize(MemoryBuffer.wrap(bytes), type, defaultOptions.withTagging(tagging));
  }

  /** Decodes a tagged value of any type. */
  public Object deserialize(byte[] bytes) {
    return deserialize(bytes, true);
  }

  /**
   * Decodes a value whose type comes from its tag.
   *
   * @throws IllegalArgumentException if {@code tagging} is false, since no type is given
   */
  public Object deserialize(byte[] bytes, boolean tagging) {
    return deserialize(MemoryBuffer.wrap(bytes), null, defaultOptions.withTagging(tagging));
  }

  public <T> T deserialize(byte[] bytes, Class<T> type, CallOptions options) {
    return deserialize(MemoryBuffer.wrap(bytes), type, options);
  }

  /**
   * Decodes one value from {@code buffer}, leaving the reader index right after it.
   *
   * @param type the expected type; may be null in tagging mode, where the tag decides the type
   */
  public <T> T deserialize(MemoryBuffer buffer, Class<T> type, CallOptions options) {
    Preconditions.checkNotNull(buffer, "buffer");
    Preconditions.checkNotNull(options, "options");
    if (options.isTagging()) {
      return (T) readTagged(buffer, type, options);
    }
    Preconditions.checkArgument(type != null, "A target type is required without tagging");
    return read(buffer, type, options);
  }

  public <T> T deserialize(InputStream inputStream, Class<T> type, CallOptions options) {
    byte[] bytes;
    try {
      bytes = ByteStreams.toByteArray(inputStream);
    } catch (IOException e) {
      throw new FileAccessException("Failed to read serialized value from stream", e);
    }
    return deserialize(bytes, type, options);
  }

  /** Reads an untagged value of {@code type}. Used for nested values. */
  public <T> T read(MemoryBuffer buffer, Class<T> type, CallOptions options) {
    Serializer<?> serializer = getSerializer(type);
    enter(type);
    try {
      return (T) serializer.read(this, type, buffer, options);
    } finally {
      depth--;
    }
  }

  /**
   * Reads a type tag and the value it announces.
   *
   * @param expectedType if not null, the tagged type must be assignable to it
   */
  public Object readTagged(MemoryBuffer buffer, Class<?> expectedType, CallOptions options) {
    int tag = buffer.readVarUint32();
    Class<?> type = typeTagRegistry.typeOf(tag);
    if (expectedType != null && !Primitives.wrap(expectedType).isAssignableFrom(type)) {
      throw new SerializationException(
          String.format("Stream holds %s (tag %d) but %s was requested", type, tag, expectedType));
    }
    return read(buffer, type, options);
  }

  private void enter(Class<?> type) {
    if (++depth > config.getMaxDepth()) {
      depth--;
      throw new SerializationException(
          String.format(
              "Max depth %d exceeded at %s, the value graph is probably cyclic",
              config.getMaxDepth(),
              type.getName()));
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Files

  /** Serializes {@code value} into {@code path}, creating or truncating the file. */
  public void write(Path path, Object value) {
    write(path, value, defaultOptions);
  }

  public void write(Path path, Object value, CallOptions options) {
    Preconditions.checkNotNull(path, "path");
    // Encode first, a value that can't be encoded leaves the file untouched.
    byte[] bytes = serialize(value, options);
    try {
      Files.write(path, bytes);
    } catch (IOException e) {
      throw new FileAccessException("Failed to write file", path, e);
    }
    LOG.debug("Wrote {} bytes to {}", bytes.length, path);
  }

  public <T> T read(Path path, Class<T> type) {
    return read(path, type, defaultOptions);
  }

  /** Reads a tagged value of any type from {@code path}. */
  public Object read(Path path) {
    return read(path, null, defaultOptions.withTagging(true));
  }

  public <T> T read(Path path, Class<T> type, CallOptions options) {
    Preconditions.checkNotNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new FileAccessException("Not an existing regular file", path);
    }
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new FileAccessException("Failed to read file", path, e);
    }
    return deserialize(MemoryBuffer.wrap(bytes), type, options);
  }

  // ---------------------------------------------------------------------------------------------

  /**
   * Returns the serializer for {@code type}: the registered one, else the default object
   * serializer if {@code type} has a class definition.
   *
   * @throws UnregisteredTypeException if neither exists
   */
  public Serializer<?> getSerializer(Class<?> type) {
    Class<?> cls = Primitives.wrap(type);
    Serializer<?> serializer = serializerRegistry.get(cls);
    if (serializer != null) {
      return serializer;
    }
    if (schemaRegistry.contains(cls)) {
      return objectSerializers.computeIfAbsent(cls, c -> new ObjectSerializer(c));
    }
    throw new UnregisteredTypeException(cls);
  }

  public Config getConfig() {
    return config;
  }

  public SchemaRegistry getSchemaRegistry() {
    return schemaRegistry;
  }

  public TypeTagRegistry getTypeTagRegistry() {
    return typeTagRegistry;
  }

  public SerializerRegistry getSerializerRegistry() {
    return serializerRegistry;
  }

  /** Nesting depth of the active call, 0 between calls. */
  public int getDepth() {
    return depth;
  }
}
