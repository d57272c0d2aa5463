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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options of one serialize or deserialize call, handed to every serializer the call reaches.
 *
 * <p>Besides the tagging flag, free-form attributes let user serializers receive call-time
 * settings without changing the {@link org.bran.serializer.Serializer} contract.
 */
public final class CallOptions {
  public static final CallOptions DEFAULT = new CallOptions(false, ImmutableMap.of());
  public static final CallOptions TAGGED = new CallOptions(true, ImmutableMap.of());

  private final boolean tagging;
  private final ImmutableMap<String, Object> attributes;

  private CallOptions(boolean tagging, ImmutableMap<String, Object> attributes) {
    this.tagging = tagging;
    this.attributes = attributes;
  }

  public static CallOptions of(boolean tagging) {
    return tagging ? TAGGED : DEFAULT;
  }

  /** Whether the top-level value is prefixed with its type tag. */
  public boolean isTagging() {
    return tagging;
  }

  public CallOptions withTagging(boolean tagging) {
    return tagging == this.tagging ? this : new CallOptions(tagging, attributes);
  }

  /** Returns a copy carrying {@code key -> value}, replacing a previous value of {@code key}. */
  public CallOptions withAttribute(String key, Object value) {
    Preconditions.checkNotNull(key, "key");
    Preconditions.checkNotNull(value, "value");
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (Map.Entry<String, Object> entry : attributes.entrySet()) {
      if (!entry.getKey().equals(key)) {
        builder.put(entry);
      }
    }
    builder.put(key, value);
    return new CallOptions(tagging, builder.build());
  }

  /** Returns the attribute {@code key}, or null. */
  public Object getAttribute(String key) {
    return attributes.get(key);
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CallOptions that = (CallOptions) o;
    return tagging == that.tagging && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tagging, attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tagging", tagging)
        .add("attributes", attributes)
        .toString();
  }
}
