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

import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Compiles a causal operation, a sequence of situations each of which causes
 * the next.
 *
 * <p>The generated rule matches the situation under test against the last
 * operand, then walks backwards. Each operand that is not a wildcard gets a
 * fresh variable, is matched against its own rule, and is linked to the
 * position of the nearest later operand that has a position. The link is
 * {@code direct_cause} if the two operands are adjacent, and {@code
 * indirect_cause} if one or more wildcards separate them. For example, {@code
 * [A, any, B]} becomes
 *
 * <pre>{@code
 * matches_situation(situation_0,Situation) :-
 *   matches_situation(situation_3,Situation) &
 *   matches_situation(situation_1,Situation_4) &
 *   indirect_cause(Situation_4,Situation)
 * }</pre>
 *
 * <p>Wildcards get no variable of their own. The first operand is not linked
 * to anything that precedes it; first causes are of no interest.
 */
class CausalLinkCompiler {
  private final SituationCompiler situationCompiler;

  CausalLinkCompiler(SituationCompiler situationCompiler) {
    this.situationCompiler = requireNonNull(situationCompiler);
  }

  CompiledSituation compile(Ipdl.Causal causal) {
    if (causal.children.isEmpty()) {
      throw new CompileException(
          CompileException.Kind.UNPARSABLE_SITUATION, null, causal);
    }
    final String symbol = situationCompiler.newSymbol();
    final List<EpilogAst.Statement> statements = new ArrayList<>();
    final List<String> operandSymbols = new ArrayList<>();
    for (Ipdl.Situation child : causal.children) {
      final CompiledSituation operand = situationCompiler.compile(child);
      statements.addAll(operand.statements);
      operandSymbols.add(operand.symbol);
    }

    final List<EpilogAst.Atom> body = new ArrayList<>();
    EpilogAst.Variable current = situationCompiler.variable();
    final String lastSymbol = Iterables.getLast(operandSymbols);
    body.add(Predicates.matchesSituation(lastSymbol, current));

    // Position of the operand that "current" is bound to.
    int currentIndex = causal.children.size() - 1;
    for (int i = currentIndex - 1; i >= 0; i--) {
      if (causal.children.get(i).isWildcard()) {
        continue;
      }
      final boolean direct = i == currentIndex - 1;
      final EpilogAst.Variable cause = situationCompiler.newVariable();
      body.add(Predicates.matchesSituation(operandSymbols.get(i), cause));
      body.add(
          epilog.atom(
              direct ? Predicates.DIRECT_CAUSE : Predicates.INDIRECT_CAUSE,
              cause,
              current));
      current = cause;
      currentIndex = i;
    }

    statements.add(epilog.rule(situationCompiler.head(symbol), body));
    return new CompiledSituation(statements, symbol);
  }
}

// End CausalLinkCompiler.java
