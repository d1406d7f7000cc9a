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
 * Compiles alternatives into several rules with the same head, one rule per
 * alternative.
 *
 * <p>The operands' own rules come first, then the alternatives.
 */
class DisjunctionCompiler {
  static final String OR = "or";

  private final SituationCompiler situationCompiler;

  DisjunctionCompiler(SituationCompiler situationCompiler) {
    this.situationCompiler = requireNonNull(situationCompiler);
  }

  /**
   * Compiles an "or" operation. Each alternative requires that the situation
   * under test is a situation and that it matches the operand.
   */
  CompiledSituation compile(Ipdl.Or or) {
    return compile(or.children, true);
  }

  /**
   * Compiles the expression that is the value of a block's "event" property.
   *
   * <p>Only "or" expressions are supported.
   */
  CompiledSituation compileEvent(Ipdl.Expression expression) {
    if (!expression.operator.equals(OR)) {
      throw new CompileException(
          CompileException.Kind.UNSUPPORTED_EXPRESSION,
          expression.operator,
          expression);
    }
    return compile(expression.children, false);
  }

  private CompiledSituation compile(
      List<Ipdl.Situation> operands, boolean requireSituation) {
    final String symbol = situationCompiler.newSymbol();
    final EpilogAst.Variable s = situationCompiler.variable();
    final List<EpilogAst.Statement> statements = new ArrayList<>();
    final List<String> operandSymbols = new ArrayList<>();
    for (Ipdl.Situation operand : operands) {
      final CompiledSituation compiled = situationCompiler.compile(operand);
      statements.addAll(compiled.statements);
      operandSymbols.add(compiled.symbol);
    }
    for (String operandSymbol : operandSymbols) {
      final List<EpilogAst.Atom> body = new ArrayList<>();
      if (requireSituation) {
        body.add(Predicates.situation(s));
      }
      body.add(Predicates.matchesSituation(operandSymbol, s));
      statements.add(epilog.rule(situationCompiler.head(symbol), body));
    }
    return new CompiledSituation(statements, symbol);
  }
}

// End DisjunctionCompiler.java
