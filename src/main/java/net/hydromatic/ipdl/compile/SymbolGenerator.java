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

/**
 * Generates unique names for the heads of synthesized rules and for the
 * variables that link causes to effects.
 *
 * <p>Every name returned by one generator is distinct from every other name
 * it returns. Implementations must be safe to call from several threads.
 *
 * @see SymbolGenerators
 */
public interface SymbolGenerator {
  /** Returns a new name that starts with {@code prefix + "_"}. */
  String next(String prefix);
}

// End SymbolGenerator.java
