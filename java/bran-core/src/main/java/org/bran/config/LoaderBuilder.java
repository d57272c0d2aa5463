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

package org.bran.config;

import com.google.common.base.Preconditions;
import org.bran.Loader;
import org.bran.resolver.IdentifierGenerator;
import org.bran.resolver.SchemaRegistry;
import org.bran.resolver.TypeTagRegistry;

/** Builder for {@link Loader}. */
public final class LoaderBuilder {
  public static final int DEFAULT_MAX_DEPTH = 512;
  public static final int DEFAULT_BUFFER_SIZE = 256;

  boolean tagging = false;
  int maxDepth = DEFAULT_MAX_DEPTH;
  int bufferSize = DEFAULT_BUFFER_SIZE;
  boolean serviceRegistrationsEnabled = false;
  private SchemaRegistry schemaRegistry;
  private TypeTagRegistry typeTagRegistry;
  private IdentifierGenerator<Class<?>> tagGenerator;

  public LoaderBuilder() {}

  /** Whether calls without explicit {@link CallOptions} write and read a type tag. */
  public LoaderBuilder withTagging(boolean tagging) {
    this.tagging = tagging;
    return this;
  }

  /** Set max nesting depth of a value graph. */
  public LoaderBuilder withMaxDepth(int maxDepth) {
    Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
    this.maxDepth = maxDepth;
    return this;
  }

  public LoaderBuilder withBufferSize(int bufferSize) {
    Preconditions.checkArgument(bufferSize >= 0, "bufferSize must be >= 0, got %s", bufferSize);
    this.bufferSize = bufferSize;
    return this;
  }

  /**
   * Share a schema registry, and the type tag registry it references, with other loaders. A fresh
   * pair is created when unset.
   */
  public LoaderBuilder withSchemaRegistry(SchemaRegistry schemaRegistry) {
    this.schemaRegistry = Preconditions.checkNotNull(schemaRegistry);
    return this;
  }

  /** Share a type tag registry. A schema registry created by the builder will use it too. */
  public LoaderBuilder withTypeTagRegistry(TypeTagRegistry typeTagRegistry) {
    this.typeTagRegistry = Preconditions.checkNotNull(typeTagRegistry);
    return this;
  }

  /** Tag generator of the type tag registry created by this builder. */
  public LoaderBuilder withTagGenerator(IdentifierGenerator<Class<?>> tagGenerator) {
    this.tagGenerator = Preconditions.checkNotNull(tagGenerator);
    return this;
  }

  /**
   * Whether {@link org.bran.resolver.SerializerRegistration} implementations found by {@link
   * java.util.ServiceLoader} register their serializers on the new loader.
   */
  public LoaderBuilder withServiceRegistrations(boolean enabled) {
    this.serviceRegistrationsEnabled = enabled;
    return this;
  }

  /**
   * Returns the shared schema registry if one was supplied, else a new one. Every {@link #build()}
   * without shared registries gets registries of its own.
   */
  public SchemaRegistry buildSchemaRegistry() {
    TypeTagRegistry tags = buildTypeTagRegistry();
    return schemaRegistry != null ? schemaRegistry : new SchemaRegistry(tags);
  }

  private TypeTagRegistry buildTypeTagRegistry() {
    Preconditions.checkArgument(
        tagGenerator == null || (schemaRegistry == null && typeTagRegistry == null),
        "Tag generator only applies to a type tag registry created by the builder");
    if (schemaRegistry != null) {
      Preconditions.checkArgument(
          typeTagRegistry == null || typeTagRegistry == schemaRegistry.getTypeTagRegistry(),
          "The shared schema registry uses a different type tag registry");
      return schemaRegistry.getTypeTagRegistry();
    }
    if (typeTagRegistry != null) {
      return typeTagRegistry;
    }
    return tagGenerator == null ? new TypeTagRegistry() : new TypeTagRegistry(tagGenerator);
  }

  public Config buildConfig() {
    return new Config(this);
  }

  public Loader build() {
    return new Loader(this);
  }
}
