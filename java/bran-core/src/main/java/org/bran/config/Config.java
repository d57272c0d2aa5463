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

import com.google.common.base.MoreObjects;

/** Immutable settings of a {@link org.bran.Loader}, created by {@link LoaderBuilder}. */
public final class Config {
  private final boolean tagging;
  private final int maxDepth;
  private final int bufferSize;
  private final boolean serviceRegistrationsEnabled;

  Config(LoaderBuilder builder) {
    tagging = builder.tagging;
    maxDepth = builder.maxDepth;
    bufferSize = builder.bufferSize;
    serviceRegistrationsEnabled = builder.serviceRegistrationsEnabled;
  }

  /** Whether calls without explicit {@link CallOptions} use tagging mode. */
  public boolean isTagging() {
    return tagging;
  }

  /**
   * Maximum nesting of values inside one call. Deeper graphs fail fast instead of exhausting the
   * stack, which is how a cyclic graph shows up.
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /** Initial size of the buffer reused by byte array serialization. */
  public int getBufferSize() {
    return bufferSize;
  }

  public boolean isServiceRegistrationsEnabled() {
    return serviceRegistrationsEnabled;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tagging", tagging)
        .add("maxDepth", maxDepth)
        .add("bufferSize", bufferSize)
        .add("serviceRegistrationsEnabled", serviceRegistrationsEnabled)
        .toString();
  }
}
