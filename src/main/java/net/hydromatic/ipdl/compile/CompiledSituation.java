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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Result of compiling a situation: the rules that define it, and the symbol
 * that identifies it in {@code matches_situation(symbol, S)}.
 *
 * <p>The rules of nested situations come first.
 */
public class CompiledSituation {
  public final ImmutableList<EpilogAst.Statement> statements;
  public final String symbol;

  CompiledSituation(
      List<? extends EpilogAst.Statement> statements, String symbol) {
    this.statements = ImmutableList.copyOf(statements);
    this.symbol = requireNonNull(symbol);
  }

  /** Returns the rules; those that are not facts. */
  public ImmutableList<EpilogAst.Rule> rules() {
    final ImmutableList.Builder<EpilogAst.Rule> b = ImmutableList.builder();
    for (EpilogAst.Statement statement : statements) {
      if (statement instanceof EpilogAst.Rule) {
        b.add((EpilogAst.Rule) statement);
      }
    }
    return b.build();
  }

  /** Returns the rules whose head is {@code matches_situation(symbol, _)}. */
  public ImmutableList<EpilogAst.Rule> ownRules() {
    final ImmutableList.Builder<EpilogAst.Rule> b = ImmutableList.builder();
    for (EpilogAst.Rule rule : rules()) {
      if (rule.head.name.equals(Predicates.MATCHES_SITUATION)
          && rule.head.terms.get(0).unparse().equals(symbol)) {
        b.add(rule);
      }
    }
    return b.build();
  }

  @Override
  public String toString() {
    return symbol + ": " + new EpilogAst.Block(statements);
  }
}

// End CompiledSituation.java
