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

import net.hydromatic.ipdl.epilog.EpilogAst;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of compiling a program: either the whole program, or the error that
 * stopped compilation.
 *
 * @see ProgramCompiler#tryCompile
 */
public class Compilation {
  private final EpilogAst.@Nullable Program program;
  private final @Nullable CompileException error;

  private Compilation(
      EpilogAst.@Nullable Program program, @Nullable CompileException error) {
    this.program = program;
    this.error = error;
  }

  static Compilation success(EpilogAst.Program program) {
    return new Compilation(requireNonNull(program), null);
  }

  static Compilation failure(CompileException error) {
    return new Compilation(null, requireNonNull(error));
  }

  /** Returns whether compilation succeeded. */
  public boolean succeeded() {
    return program != null;
  }

  /**
   * Returns the compiled program.
   *
   * @throws CompileException if compilation failed
   */
  public EpilogAst.Program program() {
    if (program == null) {
      throw requireNonNull(error);
    }
    return program;
  }

  /** Returns the error, or null if compilation succeeded. */
  public @Nullable CompileException error() {
    return error;
  }

  /** Returns the kind of error, or null if compilation succeeded. */
  public CompileException.@Nullable Kind errorKind() {
    return error == null ? null : error.kind;
  }

  @Override
  public String toString() {
    return program != null ? program.toString() : String.valueOf(error);
  }
}

// End Compilation.java
