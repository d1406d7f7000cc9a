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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.ast.SituationVisitor;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Compiles a situation into rules that define {@code matches_situation(S,
 * Situation)}, where {@code S} is a fresh symbol.
 *
 * <p>Each kind of situation compiles as follows ({@code Situation} is the
 * situation under test):
 *
 * <ul>
 *   <li>any: {@code situation(Situation)}, that is, always true;
 *   <li>block: {@code situation(Situation)} plus a {@code prop} condition on
 *       its event;
 *   <li>logic block: no rules;
 *   <li>causal operation: see {@link CausalLinkCompiler};
 *   <li>or operation: see {@link DisjunctionCompiler};
 *   <li>rule call: {@code matches_chain(chain_name, Situation)};
 *   <li>variable: {@code matches_situation(matches_situation_value,
 *       Situation)}.
 * </ul>
 *
 * <p>Annotations on a situation become facts about its symbol.
 */
public class SituationCompiler
    implements SituationVisitor<CompiledSituation> {
  static final String EVENT = "event";

  private final SymbolGenerator symbols;
  private final String variableName;
  private final AnnotationCompiler annotationCompiler;
  private final CausalLinkCompiler causalLinkCompiler;
  private final DisjunctionCompiler disjunctionCompiler;

  public SituationCompiler(
      SymbolGenerator symbols,
      String variableName,
      AnnotationCompiler annotationCompiler) {
    this.symbols = requireNonNull(symbols);
    this.variableName = requireNonNull(variableName);
    this.annotationCompiler = requireNonNull(annotationCompiler);
    this.causalLinkCompiler = new CausalLinkCompiler(this);
    this.disjunctionCompiler = new DisjunctionCompiler(this);
  }

  /** Compiles a situation, including its annotations. */
  public CompiledSituation compile(Ipdl.Situation situation) {
    final CompiledSituation compiled = situation.accept(this);
    if (situation.annotations.isEmpty()) {
      return compiled;
    }
    final List<EpilogAst.Statement> statements =
        new ArrayList<>(compiled.statements);
    statements.addAll(
        annotationCompiler.compileAll(situation.annotations, compiled.symbol));
    return new CompiledSituation(statements, compiled.symbol);
  }

  /** Returns the variable that stands for the situation under test. */
  EpilogAst.Variable variable() {
    return epilog.var(variableName);
  }

  /** Returns a fresh variable, such as {@code Situation_3}. */
  EpilogAst.Variable newVariable() {
    return epilog.var(symbols.next(variableName));
  }

  /** Returns a fresh situation symbol, such as {@code situation_3}. */
  String newSymbol() {
    return symbols.next(Predicates.SITUATION_PREFIX);
  }

  /** Returns {@code matches_situation(symbol, Situation)}. */
  EpilogAst.Atom head(String symbol) {
    return Predicates.matchesSituation(symbol, variable());
  }

  @Override
  public CompiledSituation visit(Ipdl.AnySituation any) {
    final String symbol = newSymbol();
    return new CompiledSituation(
        ImmutableList.of(
            epilog.rule(head(symbol), Predicates.situation(variable()))),
        symbol);
  }

  @Override
  public CompiledSituation visit(Ipdl.Block block) {
    final String symbol = newSymbol();
    final EpilogAst.Variable s = variable();
    final List<EpilogAst.Statement> statements = new ArrayList<>();
    final List<EpilogAst.Atom> body = new ArrayList<>();
    body.add(Predicates.situation(s));
    for (Map.Entry<String, Ipdl.Value> e : block.properties.entrySet()) {
      if (!e.getKey().equals(EVENT)) {
        continue; // only "event" is recognized
      }
      final Ipdl.Value value = e.getValue();
      if (value instanceof Ipdl.ExpressionValue) {
        final CompiledSituation event =
            disjunctionCompiler.compileEvent(
                ((Ipdl.ExpressionValue) value).expression);
        statements.addAll(event.statements);
        final EpilogAst.Variable eventVar =
            epilog.var(variableName + "." + EVENT);
        body.add(
            epilog.atom(Predicates.PROP, s, epilog.string(EVENT), eventVar));
        body.add(Predicates.matchesSituation(event.symbol, eventVar));
      } else {
        body.add(
            epilog.atom(
                Predicates.PROP,
                s,
                epilog.string(EVENT),
                epilog.string(eventLiteral(block, value))));
      }
    }
    statements.add(epilog.rule(head(symbol), body));
    return new CompiledSituation(statements, symbol);
  }

  private static String eventLiteral(Ipdl.Block block, Ipdl.Value value) {
    if (value instanceof Ipdl.StringValue) {
      return ((Ipdl.StringValue) value).value;
    }
    if (value instanceof Ipdl.RawValue) {
      return ((Ipdl.RawValue) value).text;
    }
    throw new CompileException(
        CompileException.Kind.UNKNOWN_VALUE, EVENT, block);
  }

  @Override
  public CompiledSituation visit(Ipdl.LogicBlock logicBlock) {
    return new CompiledSituation(ImmutableList.of(), newSymbol());
  }

  @Override
  public CompiledSituation visit(Ipdl.Causal causal) {
    return causalLinkCompiler.compile(causal);
  }

  @Override
  public CompiledSituation visit(Ipdl.Or or) {
    return disjunctionCompiler.compile(or);
  }

  @Override
  public CompiledSituation visit(Ipdl.RuleCall ruleCall) {
    final String symbol = newSymbol();
    final EpilogAst.Variable s = variable();
    return new CompiledSituation(
        ImmutableList.of(
            epilog.rule(
                head(symbol),
                Predicates.situation(s),
                Predicates.matchesChain(ruleCall.name, s))),
        symbol);
  }

  @Override
  public CompiledSituation visit(Ipdl.VariableRef variableRef) {
    final String symbol = newSymbol();
    return new CompiledSituation(
        ImmutableList.of(
            epilog.rule(
                head(symbol),
                Predicates.matchesSituation(
                    Predicates.externalMatcherSymbol(variableRef.value),
                    variable()))),
        symbol);
  }
}

// End SituationCompiler.java
