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
package net.hydromatic.ipdl.compile;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/** Utilities for {@link SymbolGenerator}. */
public abstract class SymbolGenerators {
  private SymbolGenerators() {}

  /**
   * Returns a generator whose suffixes are random UUIDs.
   *
   * <p>The UUID's dashes become underscores, so that the symbol is a valid
   * Epilog constant.
   */
  public static SymbolGenerator random() {
    return RandomSymbolGenerator.INSTANCE;
  }

  /**
   * Returns a generator whose suffixes are 0, 1, 2, and so forth. The counter
   * is shared among all prefixes. Output is reproducible.
   */
  public static SymbolGenerator sequential() {
    return new SequentialSymbolGenerator();
  }

  /** Returns a generator of the given mode. */
  public static SymbolGenerator of(Prop.SymbolMode mode) {
    switch (mode) {
      case RANDOM:
        return random();
      case SEQUENTIAL:
        return sequential();
      default:
        throw new AssertionError(mode);
    }
  }

  /** Generator that uses random UUIDs. */
  private static class RandomSymbolGenerator implements SymbolGenerator {
    static final SymbolGenerator INSTANCE = new RandomSymbolGenerator();

    @Override
    public String next(String prefix) {
      return prefix + "_" + UUID.randomUUID().toString().replace('-', '_');
    }
  }

  /** Generator that uses a counter. */
  private static class SequentialSymbolGenerator implements SymbolGenerator {
    private final AtomicInteger id = new AtomicInteger();

    @Override
    public String next(String prefix) {
      return prefix + "_" + id.getAndIncrement();
    }
  }
}

// End SymbolGenerators.java
