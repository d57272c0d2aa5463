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

import java.nio.file.Path;

/** Storage-level failure while reading or writing serialized files. */
public class FileAccessException extends BranException {
  private final Path path;

  public FileAccessException(String message, Path path) {
    super(String.format("%s: %s", message, path));
    this.path = path;
  }

  public FileAccessException(String message, Path path, Throwable cause) {
    super(String.format("%s: %s", message, path), cause);
    this.path = path;
  }

  /** Failure of a stream that isn't backed by a known path. */
  public FileAccessException(String message, Throwable cause) {
    super(message, cause);
    this.path = null;
  }

  /** Returns the file involved, or null for streams. */
  public Path getPath() {
    return path;
  }
}
