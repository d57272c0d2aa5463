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

package org.bran.exception;

/** An explicit identifier is already bound to another key. */
public class IdentifierConflictException extends RegistrationException {
  private final Object key;
  private final int identifier;
  private final Object boundKey;

  public IdentifierConflictException(Object key, int identifier, Object boundKey) {
    this("Identifier", key, identifier, boundKey);
  }

  protected IdentifierConflictException(
      String kind, Object key, int identifier, Object boundKey) {
    super(
        String.format(
            "%s %s for %s is already bound to %s", kind, identifier, key, boundKey));
    this.key = key;
    this.identifier = identifier;
    this.boundKey = boundKey;
  }

  public Object getKey() {
    return key;
  }

  public int getIdentifier() {
    return identifier;
  }

  public Object getBoundKey() {
    return boundKey;
  }
}
