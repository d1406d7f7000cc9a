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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds Epilog tree nodes. */
public enum EpilogBuilder {
  /**
   * The singleton instance of the Epilog builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  epilog;

  public EpilogAst.Symbol symbol(String name) {
    return new EpilogAst.Symbol(name);
  }

  public EpilogAst.Variable var(String name) {
    return new EpilogAst.Variable(name);
  }

  public EpilogAst.StringLiteral string(String value) {
    return new EpilogAst.StringLiteral(value);
  }

  public EpilogAst.Atom atom(String name, EpilogAst.Term... terms) {
    return new EpilogAst.Atom(name, ImmutableList.copyOf(terms));
  }

  public EpilogAst.Fact fact(String name, EpilogAst.Term... terms) {
    return new EpilogAst.Fact(atom(name, terms));
  }

  public EpilogAst.Rule rule(EpilogAst.Atom head, EpilogAst.Atom... body) {
    return new EpilogAst.Rule(head, ImmutableList.copyOf(body));
  }

  public EpilogAst.Rule rule(EpilogAst.Atom head, List<EpilogAst.Atom> body) {
    return new EpilogAst.Rule(head, body);
  }

  public EpilogAst.Block block(List<? extends EpilogAst.Statement> statements) {
    return new EpilogAst.Block(statements);
  }

  public EpilogAst.Program program(
      List<EpilogAst.Block> declarations, List<EpilogAst.Block> chains) {
    return new EpilogAst.Program(declarations, chains);
  }
}

// End EpilogBuilder.java
