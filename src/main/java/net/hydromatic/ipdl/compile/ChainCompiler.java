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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Compiles a chain.
 *
 * <p>Chain {@code greet} becomes a fact {@code chain(chain_greet)}, the rules
 * of its situations, and a rule
 *
 * <pre>{@code
 * matches_chain(chain_greet,Situation) :-
 *   situation(Situation) &
 *   matches_situation(situation_0,Situation) &
 *   situation(Situation) &
 *   matches_situation(situation_1,Situation)
 * }</pre>
 *
 * <p>followed by the facts of the chain's annotations.
 *
 * <p>Note that every child is matched against the same variable, so the rule
 * does not order the children relative to each other. Only a causal
 * operation orders its operands.
 */
public class ChainCompiler {
  private final SituationCompiler situationCompiler;
  private final AnnotationCompiler annotationCompiler;

  public ChainCompiler(
      SituationCompiler situationCompiler,
      AnnotationCompiler annotationCompiler) {
    this.situationCompiler = requireNonNull(situationCompiler);
    this.annotationCompiler = requireNonNull(annotationCompiler);
  }

  /** Compiles a chain called {@code name}. */
  public EpilogAst.Block compile(String name, Ipdl.Chain chain) {
    final String chainSymbol = Predicates.chainSymbol(name);
    final List<EpilogAst.Statement> statements = new ArrayList<>();
    statements.add(epilog.fact(Predicates.CHAIN, epilog.symbol(chainSymbol)));

    final EpilogAst.Variable s = situationCompiler.variable();
    final List<EpilogAst.Atom> body = new ArrayList<>();
    for (Ipdl.Situation child : chain.children) {
      final CompiledSituation compiled = situationCompiler.compile(child);
      statements.addAll(compiled.statements);
      body.add(Predicates.situation(s));
      body.add(Predicates.matchesSituation(compiled.symbol, s));
    }
    statements.add(epilog.rule(Predicates.matchesChain(name, s), body));

    statements.addAll(
        annotationCompiler.compileAll(chain.annotations, chainSymbol));
    return epilog.block(statements);
  }
}

// End ChainCompiler.java
