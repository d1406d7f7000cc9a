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

import static net.hydromatic.ipdl.ast.IpdlBuilder.ipdl;
import static net.hydromatic.ipdl.compile.SituationCompilerTest.compiler;
import static net.hydromatic.ipdl.compile.SituationCompilerTest.text;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.ipdl.epilog.EpilogAst;
import org.junit.jupiter.api.Test;

/** Tests for {@link DisjunctionCompiler}. */
public class DisjunctionCompilerTest {
  /** Each operand yields one rule; all rules share the same head. */
  @Test
  void testOr() {
    final CompiledSituation compiled =
        compiler()
            .compile(
                ipdl.or(ipdl.event("a"), ipdl.event("b"), ipdl.event("c")));
    assertThat(compiled.symbol, is("situation_0"));
    assertThat(compiled.statements.size(), is(6));

    final ImmutableList<EpilogAst.Rule> ownRules = compiled.ownRules();
    assertThat(ownRules.size(), is(3));
    for (int i = 0; i < ownRules.size(); i++) {
      final EpilogAst.Rule rule = ownRules.get(i);
      assertThat(
          rule.head, hasToString("matches_situation(situation_0,Situation)"));
      assertThat(
          rule,
          hasToString(
              "matches_situation(situation_0,Situation) :-\n"
                  + "  situation(Situation) &\n"
                  + "  matches_situation(situation_" + (i + 1)
                  + ",Situation)"));
    }
  }

  @Test
  void testOrOfWildcard() {
    final CompiledSituation compiled =
        compiler().compile(ipdl.or(ipdl.any(), ipdl.ruleCall("greet")));
    assertThat(
        text(compiled),
        is("matches_situation(situation_1,Situation) :-\n"
            + "  situation(Situation)\n"
            + "matches_situation(situation_2,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  matches_chain(chain_greet,Situation)\n"
            + "matches_situation(situation_0,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  matches_situation(situation_1,Situation)\n"
            + "matches_situation(situation_0,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  matches_situation(situation_2,Situation)"));
  }

  /** An "or" with no operands matches nothing. */
  @Test
  void testEmptyOr() {
    final CompiledSituation compiled = compiler().compile(ipdl.or());
    assertThat(compiled.symbol, is("situation_0"));
    assertThat(compiled.statements.isEmpty(), is(true));
  }

  @Test
  void testNestedOr() {
    final CompiledSituation compiled =
        compiler()
            .compile(
                ipdl.or(ipdl.event("a"), ipdl.or(ipdl.event("b"), ipdl.any())));
    // situation_0 is the outer "or", situation_2 the inner
    assertThat(compiled.ownRules().size(), is(2));
    assertThat(
        compiled.ownRules().get(1),
        hasToString(
            "matches_situation(situation_0,Situation) :-\n"
                + "  situation(Situation) &\n"
                + "  matches_situation(situation_2,Situation)"));
  }
}

// End DisjunctionCompilerTest.java
