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
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;
import org.junit.jupiter.api.Test;

/** Tests for {@link ProgramCompiler}. */
public class ProgramCompilerTest {
  private static ProgramCompiler compiler(Tracer tracer) {
    return new ProgramCompiler(
        SymbolGenerators.sequential(), "Situation", tracer);
  }

  private static ProgramCompiler compiler() {
    return compiler(Tracers.empty());
  }

  private static Ipdl.Program foo() {
    return ipdl.program(
        ImmutableMap.of(
            "Foo", ipdl.object(ImmutableMap.of("bar", ipdl.string("baz")))),
        ImmutableMap.of());
  }

  private static Ipdl.Program greet() {
    return ipdl.program(
        ImmutableMap.of(
            "Foo", ipdl.object(ImmutableMap.of("bar", ipdl.string("baz")))),
        ImmutableMap.of("greet", ipdl.chain(ipdl.event("hello"))));
  }

  private static Ipdl.Program invalid() {
    return ipdl.program(
        ImmutableMap.of(
            "Foo",
            ipdl.object(
                ImmutableMap.of("bar", ipdl.objectValue(ImmutableMap.of())))),
        ImmutableMap.of("greet", ipdl.chain(ipdl.event("hello"))));
  }

  @Test
  void testDeclarationsOnly() {
    final EpilogAst.Program program = compiler().compile(foo());
    assertThat(program.declarations.size(), is(1));
    assertThat(program.chains.size(), is(0));
    assertThat(
        program,
        hasToString(
            "% Declarations\n\n"
                + "object(\"Foo\")\n"
                + "prop(\"Foo\",\"bar\",\"baz\")\n\n"
                + "% Chains\n\n"));
  }

  @Test
  void testEmptyProgram() {
    final EpilogAst.Program program =
        compiler().compile(ipdl.program(ImmutableMap.of(), ImmutableMap.of()));
    assertThat(program, hasToString("% Declarations\n\n\n\n% Chains\n\n"));
  }

  @Test
  void testProgram() {
    final EpilogAst.Program program = compiler().compile(greet());
    final String expected =
        "% Declarations\n\n"
            + "object(\"Foo\")\n"
            + "prop(\"Foo\",\"bar\",\"baz\")\n\n"
            + "% Chains\n\n"
            + "chain(chain_greet)\n"
            + "matches_situation(situation_0,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  prop(Situation,\"event\",\"hello\")\n"
            + "matches_chain(chain_greet,Situation) :-\n"
            + "  situation(Situation) &\n"
            + "  matches_situation(situation_0,Situation)";
    assertThat(program, hasToString(expected));
  }

  /** Dictionaries contribute one block per object. */
  @Test
  void testDictionaryBlocks() {
    final Ipdl.Program program =
        ipdl.program(
            ImmutableMap.of(
                "Shapes",
                ipdl.dictionary(
                    ImmutableMap.of(
                        "Circle", ipdl.object(ImmutableMap.of()),
                        "Square", ipdl.object(ImmutableMap.of()))),
                "Foo",
                ipdl.object(ImmutableMap.of())),
            ImmutableMap.of());
    final EpilogAst.Program epilog = compiler().compile(program);
    assertThat(epilog.declarations.size(), is(3));
    assertThat(
        epilog,
        hasToString(
            "% Declarations\n\n"
                + "object(\"Shapes.Circle\")\n\n"
                + "object(\"Shapes.Square\")\n\n"
                + "object(\"Foo\")\n\n"
                + "% Chains\n\n"));
  }

  @Test
  void testCompileFails() {
    CompileException e =
        assertThrows(
            CompileException.class, () -> compiler().compile(invalid()));
    assertThat(e.kind, is(CompileException.Kind.NESTED_OBJECT));
  }

  @Test
  void testTryCompile() {
    final Compilation success = compiler().tryCompile(foo());
    assertThat(success.succeeded(), is(true));
    assertThat(success.error(), nullValue());
    assertThat(success.errorKind(), nullValue());
    assertThat(success.program().declarations.size(), is(1));

    final Compilation failure = compiler().tryCompile(invalid());
    assertThat(failure.succeeded(), is(false));
    assertThat(failure.errorKind(), is(CompileException.Kind.NESTED_OBJECT));
    assertThat(failure.toString(), containsString("Nested object \"Foo\""));
    CompileException e = assertThrows(CompileException.class, failure::program);
    assertThat(e, is(failure.error()));
  }

  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer =
        Tracers.withOnDeclaration(
            tracer,
            (name, blocks) ->
                events.add("declaration " + name + " " + blocks.size()));
    tracer =
        Tracers.withOnChain(
            tracer,
            (name, block) ->
                events.add("chain " + name + " " + block.statements.size()));
    tracer =
        Tracers.withOnException(tracer, e -> events.add("error " + e.kind));

    compiler(tracer).compile(greet());
    assertThat(events.toString(), is("[declaration Foo 1, chain greet 3]"));

    events.clear();
    compiler(tracer).tryCompile(invalid());
    assertThat(events.toString(), is("[error NESTED_OBJECT]"));
  }

  @Test
  void testPrintingTracer() {
    final StringWriter sw = new StringWriter();
    final Tracer tracer =
        Tracers.printing(Tracers.empty(), new PrintWriter(sw));
    compiler(tracer).compile(greet());
    compiler(tracer).tryCompile(invalid());
    final String nl = System.lineSeparator();
    final String[] lines = sw.toString().split(nl);
    assertThat(lines.length, is(3));
    assertThat(lines[0], is("declaration Foo: 1 object(s), 2 statement(s)"));
    assertThat(lines[1], is("chain greet: 3 statement(s)"));
    assertThat(
        lines[2].startsWith("error NESTED_OBJECT: Nested object \"Foo\": "),
        is(true));
  }

  @Test
  void testCreate() {
    final Map<Prop, Object> propMap = new HashMap<>();
    Prop.SYMBOL_GENERATOR.set(propMap, Prop.SymbolMode.SEQUENTIAL);
    Prop.SITUATION_VARIABLE.set(propMap, "S");
    final EpilogAst.Program program =
        ProgramCompiler.create(propMap, Tracers.empty()).compile(greet());
    assertThat(
        program.toString(),
        containsString(
            "matches_chain(chain_greet,S) :-\n"
                + "  situation(S) &\n"
                + "  matches_situation(situation_0,S)"));

    // By default, symbols are random
    final EpilogAst.Program program2 =
        ProgramCompiler.create(new HashMap<>(), Tracers.empty())
            .compile(greet());
    assertThat(program2.toString(), not(containsString("situation_0,")));
    assertThat(program2.toString(), containsString("(Situation)"));
  }

  @Test
  void testCompileChain() {
    final EpilogAst.Block block =
        compiler().compileChain("c", ipdl.chain(ipdl.any()));
    assertThat(block.statements.size(), is(3));
    assertThat(
        compiler()
            .compileDeclaration("X", ipdl.object(ImmutableMap.of()))
            .size(),
        is(1));
  }
}

// End ProgramCompilerTest.java
