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

/** Built-in {@link IdentifierGenerator} strategies. */
public final class IdentifierGenerators {

  private IdentifierGenerators() {}

  /** Monotonic counter: the n-th generated identifier is {@code base + n}. */
  public static <K> IdentifierGenerator<K> counter(int base) {
    Preconditions.checkArgument(base >= 0, "Counter base must be non-negative, got %s", base);
    return (key, ordinal) -> base + ordinal;
  }

  /** Counter advancing by {@code step}, e.g. to leave gaps for hand-assigned identifiers. */
  public static <K> IdentifierGenerator<K> stepping(int base, int step) {
    Preconditions.checkArgument(base >= 0, "Counter base must be non-negative, got %s", base);
    Preconditions.checkArgument(step > 0, "Step must be positive, got %s", step);
    return (key, ordinal) -> Math.addExact(base, Math.multiplyExact(step, ordinal));
  }
}
