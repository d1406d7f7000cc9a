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
package net.hydromatic.ipdl.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link Ipdl.Situation}. */
public enum Op {
  /** Wildcard; matches every situation. */
  ANY("any", null),
  BLOCK("block", null),
  /** Inert placeholder; generates no rules. */
  LOGIC_BLOCK("logic_block", null),
  CAUSAL("operation", "causal"),
  OR("operation", "or"),
  RULE_CALL("rule_call", null),
  VARIABLE("variable", null);

  /** Value of the "type" member in the JSON form of a situation. */
  public final String type;

  /** Value of the "operator" member, or null if the type alone suffices. */
  public final @Nullable String operator;

  private static final ImmutableMap<String, Op> BY_KEY;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      b.put(key(op.type, op.operator), op);
    }
    BY_KEY = b.build();
  }

  Op(String type, @Nullable String operator) {
    this.type = type;
    this.operator = operator;
  }

  private static String key(String type, @Nullable String operator) {
    return operator == null ? type : type + "/" + operator;
  }

  /**
   * Looks up an op by its JSON type and operator; returns null if there is no
   * such op.
   */
  public static @Nullable Op lookup(
      @Nullable String type, @Nullable String operator) {
    if (type == null) {
      return null;
    }
    return BY_KEY.get(key(type, "operation".equals(type) ? operator : null));
  }

  @Override
  public String toString() {
    return key(type, operator);
  }
}

// End Op.java
