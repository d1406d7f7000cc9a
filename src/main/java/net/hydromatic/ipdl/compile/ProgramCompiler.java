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
import static net.hydromatic.ipdl.epilog.EpilogBuilder.epilog;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Compiles an IPDL program to an Epilog program.
 *
 * <p>Declarations are compiled first, then chains, each in the order they
 * occur in the program. Compilation is all or nothing: the first error
 * stops it.
 *
 * <p>For example,
 *
 * <pre>{@code
 * EpilogAst.Program epilog =
 *     ProgramCompiler.create(propMap, Tracers.empty()).compile(program);
 * System.out.println(epilog);
 * }</pre>
 */
public class ProgramCompiler {
  private final DeclarationCompiler declarationCompiler;
  private final ChainCompiler chainCompiler;
  private final Tracer tracer;

  /** Creates a ProgramCompiler. */
  public ProgramCompiler(
      SymbolGenerator symbols, String situationVariable, Tracer tracer) {
    final AnnotationCompiler annotationCompiler = new AnnotationCompiler();
    final SituationCompiler situationCompiler =
        new SituationCompiler(symbols, situationVariable, annotationCompiler);
    this.declarationCompiler = new DeclarationCompiler();
    this.chainCompiler =
        new ChainCompiler(situationCompiler, annotationCompiler);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a ProgramCompiler configured by a map of properties. */
  public static ProgramCompiler create(
      Map<Prop, Object> propMap, Tracer tracer) {
    final Prop.SymbolMode mode =
        Prop.SYMBOL_GENERATOR.enumValue(propMap, Prop.SymbolMode.class);
    return new ProgramCompiler(
        SymbolGenerators.of(mode),
        Prop.SITUATION_VARIABLE.stringValue(propMap),
        tracer);
  }

  /**
   * Compiles a program.
   *
   * @throws CompileException if the program is invalid
   */
  public EpilogAst.Program compile(Ipdl.Program program) {
    try {
      final ImmutableList.Builder<EpilogAst.Block> declarations =
          ImmutableList.builder();
      program.declarations.forEach(
          (name, declaration) -> {
            final List<EpilogAst.Block> blocks =
                declarationCompiler.compile(name, declaration);
            tracer.onDeclaration(name, blocks);
            declarations.addAll(blocks);
          });

      final ImmutableList.Builder<EpilogAst.Block> chains =
          ImmutableList.builder();
      program.chains.forEach(
          (name, chain) -> {
            final EpilogAst.Block block = chainCompiler.compile(name, chain);
            tracer.onChain(name, block);
            chains.add(block);
          });
      return epilog.program(declarations.build(), chains.build());
    } catch (CompileException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /**
   * Compiles a program, returning the error rather than throwing it.
   *
   * <p>Callers should check {@link Compilation#succeeded()}.
   */
  public Compilation tryCompile(Ipdl.Program program) {
    try {
      return Compilation.success(compile(program));
    } catch (CompileException e) {
      return Compilation.failure(e);
    }
  }

  /** Compiles a single declaration. */
  public List<EpilogAst.Block> compileDeclaration(
      String name, Ipdl.Declaration declaration) {
    return declarationCompiler.compile(name, declaration);
  }

  /** Compiles a single chain. */
  public EpilogAst.Block compileChain(String name, Ipdl.Chain chain) {
    return chainCompiler.compile(name, chain);
  }
}

// End ProgramCompiler.java
