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
package net.hydromatic.ipdl.epilog;

import static net.hydromatic.ipdl.epilog.EpilogBuilder.epilog;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link EpilogWriter} and the {@link EpilogAst} nodes. */
public class EpilogWriterTest {
  @Test
  void testQuote() {
    assertThat(EpilogWriter.quote("abc"), is("\"abc\""));
    assertThat(EpilogWriter.quote(""), is("\"\""));
    assertThat(EpilogWriter.quote("a\"b"), is("\"a\\\"b\""));
    assertThat(EpilogWriter.quote("a\\b"), is("\"a\\\\b\""));
    assertThat(EpilogWriter.quote("a\nb"), is("\"a\\nb\""));
    assertThat(EpilogWriter.quote("a\rb\tc"), is("\"a\\rb\\tc\""));
    assertThat(EpilogWriter.quote("a\0b\033c"), is("\"a\\u0000b\\u001bc\""));
  }

  @Test
  void testTerms() {
    assertThat(epilog.symbol("chain_greet"), hasToString("chain_greet"));
    assertThat(epilog.var("Situation"), hasToString("Situation"));
    assertThat(epilog.string("hello"), hasToString("\"hello\""));

    // A symbol and a string with the same text are different terms
    assertThat(epilog.symbol("x"), is(epilog.symbol("x")));
    assertThat(epilog.symbol("x"), not(is(epilog.string("x"))));
    assertThat(epilog.symbol("X"), not(is(epilog.var("X"))));
  }

  @Test
  void testAtom() {
    final EpilogAst.Atom atom =
        epilog.atom(
            "prop",
            epilog.var("Situation"),
            epilog.string("event"),
            epilog.string("hello"));
    assertThat(atom.arity(), is(3));
    assertThat(atom, hasToString("prop(Situation,\"event\",\"hello\")"));
    assertThat(epilog.atom("done").arity(), is(0));
    assertThat(epilog.atom("done"), hasToString("done"));
    assertThat(
        epilog.atom("p", epilog.symbol("a")),
        is(epilog.atom("p", epilog.symbol("a"))));
    assertThat(
        epilog.atom("p", epilog.symbol("a")),
        not(is(epilog.atom("q", epilog.symbol("a")))));
  }

  @Test
  void testFact() {
    assertThat(
        epilog.fact("object", epilog.string("Foo")),
        hasToString("object(\"Foo\")"));
  }

  @Test
  void testRule() {
    final EpilogAst.Variable s = epilog.var("Situation");
    final EpilogAst.Rule rule =
        epilog.rule(
            epilog.atom("matches_situation", epilog.symbol("situation_0"), s),
            epilog.atom("situation", s),
            epilog.atom("prop", s, epilog.string("event"), epilog.string("a")));
    final String expected =
        "matches_situation(situation_0,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  prop(Situation,\"event\",\"a\")";
    assertThat(rule, hasToString(expected));

    // A rule with no body is written as just its head
    final EpilogAst.Rule emptyRule =
        epilog.rule(epilog.atom("matches_chain", epilog.symbol("c"), s));
    assertThat(emptyRule, hasToString("matches_chain(c,Situation)"));
  }

  @Test
  void testBlock() {
    final EpilogAst.Block block =
        epilog.block(
            ImmutableList.of(
                epilog.fact("object", epilog.string("Foo")),
                epilog.fact(
                    "prop",
                    epilog.string("Foo"),
                    epilog.string("bar"),
                    epilog.string("baz"))));
    assertThat(
        block, hasToString("object(\"Foo\")\nprop(\"Foo\",\"bar\",\"baz\")"));
    assertThat(epilog.block(ImmutableList.of()), hasToString(""));
  }

  @Test
  void testProgram() {
    final EpilogAst.Block foo =
        epilog.block(
            ImmutableList.of(epilog.fact("object", epilog.string("Foo"))));
    final EpilogAst.Block bar =
        epilog.block(
            ImmutableList.of(epilog.fact("object", epilog.string("Bar"))));
    final EpilogAst.Block chain =
        epilog.block(
            ImmutableList.of(epilog.fact("chain", epilog.symbol("chain_c"))));

    assertThat(
        epilog.program(ImmutableList.of(), ImmutableList.of()),
        hasToString("% Declarations\n\n\n\n% Chains\n\n"));
    assertThat(
        epilog.program(ImmutableList.of(foo, bar), ImmutableList.of(chain)),
        hasToString(
            "% Declarations\n\n"
                + "object(\"Foo\")\n\n"
                + "object(\"Bar\")\n\n"
                + "% Chains\n\n"
                + "chain(chain_c)"));
  }

  @Test
  void testStringLiteralIsEscaped() {
    assertThat(
        epilog.fact("prop", epilog.string("say \"hi\"")),
        hasToString("prop(\"say \\\"hi\\\"\")"));
  }
}

// End EpilogWriterTest.java
