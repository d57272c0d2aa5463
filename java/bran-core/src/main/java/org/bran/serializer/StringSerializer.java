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

import org.bran.Loader;
import org.bran.config.CallOptions;
import org.bran.memory.MemoryBuffer;

/** UTF-8 strings prefixed with their byte length as varuint32. */
public final class StringSerializer extends Serializer<String> {

  public StringSerializer() {
    super(String.class);
  }

  @Override
  public void write(Loader loader, MemoryBuffer buffer, String value, CallOptions options) {
    buffer.writeUtf8String(value);
  }

  @Override
  public String read(Loader loader, Class<?> targetType, MemoryBuffer buffer, CallOptions options) {
    return buffer.readUtf8String();
  }
}
