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

package org.bran.meta;

import com.google.common.base.MoreObjects;
import org.bran.reflect.FieldAccessor;

/** One field of a {@link ClassDefinition}: its name, declared type and accessor. */
public final class FieldDefinition {
  private final String name;
  private final Class<?> declaredType;
  private final FieldAccessor accessor;

  public FieldDefinition(String name, Class<?> declaredType, FieldAccessor accessor) {
    this.name = name;
    this.declaredType = declaredType;
    this.accessor = accessor;
  }

  public String getName() {
    return name;
  }

  /** The wrapper type for primitive fields. */
  public Class<?> getDeclaredType() {
    return declaredType;
  }

  public FieldAccessor getAccessor() {
    return accessor;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("declaredType", declaredType.getName())
        .toString();
  }
}
