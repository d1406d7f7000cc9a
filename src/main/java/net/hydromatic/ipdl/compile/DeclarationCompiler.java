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

import static net.hydromatic.ipdl.epilog.EpilogBuilder.epilog;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipdl.ast.DeclarationVisitor;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Compiles declarations into {@code object} and {@code prop} facts.
 *
 * <p>An object declaration yields one block. A dictionary yields the blocks
 * of its entries, recursively, each named "outer.inner"; the dictionary
 * itself yields no facts.
 */
public class DeclarationCompiler
    implements DeclarationVisitor<List<EpilogAst.Block>> {

  /** Compiles a declaration that is bound to {@code name}. */
  public List<EpilogAst.Block> compile(
      String name, Ipdl.Declaration declaration) {
    return declaration.accept(name, this);
  }

  @Override
  public List<EpilogAst.Block> visit(
      String name, Ipdl.ObjectDeclaration objectDeclaration) {
    final ImmutableList.Builder<EpilogAst.Fact> facts = ImmutableList.builder();
    facts.add(epilog.fact(Predicates.OBJECT, epilog.string(name)));
    for (Map.Entry<String, Ipdl.Value> e
        : objectDeclaration.properties.entrySet()) {
      facts.add(
          epilog.fact(
              Predicates.PROP,
              epilog.string(name),
              epilog.string(e.getKey()),
              literal(name, objectDeclaration, e.getValue())));
    }
    return ImmutableList.of(epilog.block(facts.build()));
  }

  @Override
  public List<EpilogAst.Block> visit(String name, Ipdl.Dictionary dictionary) {
    final ImmutableList.Builder<EpilogAst.Block> blocks =
        ImmutableList.builder();
    dictionary.entries.forEach(
        (innerName, inner) ->
            blocks.addAll(compile(name + "." + innerName, inner)));
    return blocks.build();
  }

  /**
   * Converts the value of a property to a literal. Only strings are allowed;
   * at this level, objects cannot nest.
   */
  private static EpilogAst.Term literal(
      String name, Ipdl.ObjectDeclaration declaration, Ipdl.Value value) {
    if (value instanceof Ipdl.StringValue) {
      return epilog.string(((Ipdl.StringValue) value).value);
    }
    if (value instanceof Ipdl.ObjectValue) {
      throw new CompileException(
          CompileException.Kind.NESTED_OBJECT, name, declaration);
    }
    throw new CompileException(
        CompileException.Kind.UNKNOWN_VALUE, name, value);
  }
}

// End DeclarationCompiler.java
