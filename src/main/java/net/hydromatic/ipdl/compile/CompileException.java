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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred during compilation.
 *
 * <p>Compilation stops at the first error; no partial output is produced.
 * Callers should inspect {@link #kind} rather than the message.
 */
public class CompileException extends RuntimeException {
  public final Kind kind;
  /** Name of the declaration, annotation or chain at fault; may be null. */
  public final @Nullable String name;
  /** Description of the rejected node. */
  public final String node;

  public CompileException(Kind kind, @Nullable String name, Object node) {
    super(message(kind, name, node));
    this.kind = requireNonNull(kind);
    this.name = name;
    this.node = String.valueOf(node);
  }

  private static String message(
      Kind kind, @Nullable String name, Object node) {
    final StringBuilder b = new StringBuilder(kind.description);
    if (name != null) {
      b.append(" \"").append(name).append('"');
    }
    return b.append(": ").append(node).toString();
  }

  /** Kinds of compilation error. */
  public enum Kind {
    /** Declaration is neither a dictionary nor an object. */
    UNRECOGNIZED_DECLARATION("Unrecognized declaration"),
    /** Situation type is not one of the known variants. */
    UNPARSABLE_SITUATION("Unparsable situation"),
    /** Property of an object is itself an object. */
    NESTED_OBJECT("Nested object"),
    /** Annotation has no target. */
    ORPHAN_ANNOTATION("Orphan annotation"),
    /** Value has a type that is not allowed in its context. */
    UNKNOWN_VALUE("Unknown IPDL item type"),
    /** Event expression has an operator other than "or". */
    UNSUPPORTED_EXPRESSION("Unsupported expression");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End CompileException.java
