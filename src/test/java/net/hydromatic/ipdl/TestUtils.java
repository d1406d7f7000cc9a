/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ipdl;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Utilities for writing tests. */
public abstract class TestUtils {
  private TestUtils() {}

  /** Opens a reader on a resource on the test class path. */
  public static Reader reader(String path) {
    final InputStream stream =
        requireNonNull(
            TestUtils.class.getResourceAsStream("/" + path),
            () -> "resource not found: " + path);
    return new InputStreamReader(stream, StandardCharsets.UTF_8);
  }

  /**
   * Reads a resource on the test class path as a string, removing the line
   * break at the end of the file, if any.
   */
  public static String resource(String path) {
    final StringBuilder b = new StringBuilder();
    try (Reader r = reader(path)) {
      final char[] buf = new char[4096];
      for (int n; (n = r.read(buf)) >= 0; ) {
        b.append(buf, 0, n);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    if (b.length() > 0 && b.charAt(b.length() - 1) == '\n') {
      b.setLength(b.length() - 1);
    }
    return b.toString();
  }
}

// End TestUtils.java
