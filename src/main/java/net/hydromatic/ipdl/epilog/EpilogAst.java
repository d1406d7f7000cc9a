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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Abstract syntax tree nodes for Epilog programs.
 *
 * <p>An Epilog program is a collection of facts and rules. This tree groups
 * them into blocks, one per compiled declaration or chain, and the blocks into
 * two sections.
 *
 * <p>{@code toString()} returns Epilog source, as generated by {@link
 * EpilogWriter}.
 */
public class EpilogAst {
  private EpilogAst() {
    // Utility class
  }

  /** A complete Epilog program, as generated from an IPDL program. */
  public static class Program {
    public final List<Block> declarations;
    public final List<Block> chains;

    public Program(List<Block> declarations, List<Block> chains) {
      this.declarations = ImmutableList.copyOf(declarations);
      this.chains = ImmutableList.copyOf(chains);
    }

    @Override
    public String toString() {
      return new EpilogWriter().write(this).toString();
    }
  }

  /** A sequence of statements that were generated together. */
  public static class Block {
    public final List<Statement> statements;

    public Block(List<? extends Statement> statements) {
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public String toString() {
      return new EpilogWriter().write(this).toString();
    }
  }

  /** Base class for all statements in an Epilog program. */
  public abstract static class Statement {
    abstract EpilogWriter unparse(EpilogWriter w);

    @Override
    public final String toString() {
      return unparse(new EpilogWriter()).toString();
    }
  }

  /** A fact: {@code relation(value, ...)}. */
  public static class Fact extends Statement {
    public final Atom atom;

    public Fact(Atom atom) {
      this.atom = requireNonNull(atom);
    }

    @Override
    EpilogWriter unparse(EpilogWriter w) {
      return w.atom(atom);
    }
  }

  /** A rule: {@code head :- body & ...}. */
  public static class Rule extends Statement {
    public final Atom head;
    public final List<Atom> body;

    public Rule(Atom head, List<Atom> body) {
      this.head = requireNonNull(head);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    EpilogWriter unparse(EpilogWriter w) {
      return w.rule(this);
    }
  }

  /** An atom: {@code relation(term, ...)}. */
  public static class Atom {
    public final String name;
    public final List<Term> terms;

    public Atom(String name, List<? extends Term> terms) {
      this.name = requireNonNull(name);
      this.terms = ImmutableList.copyOf(terms);
    }

    public int arity() {
      return terms.size();
    }

    @Override
    public String toString() {
      return new EpilogWriter().atom(this).toString();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
              && name.equals(((Atom) o).name)
              && terms.equals(((Atom) o).terms);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + terms.hashCode();
    }
  }

  /** Base class for terms in atoms. */
  public abstract static class Term {
    /** Text of the term in Epilog syntax. */
    public abstract String unparse();

    @Override
    public String toString() {
      return unparse();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o != null
              && o.getClass() == getClass()
              && unparse().equals(((Term) o).unparse());
    }

    @Override
    public int hashCode() {
      return unparse().hashCode();
    }
  }

  /** A constant symbol, such as {@code chain_greet}. */
  public static class Symbol extends Term {
    public final String name;

    public Symbol(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public String unparse() {
      return name;
    }
  }

  /** A variable, such as {@code Situation}. */
  public static class Variable extends Term {
    public final String name;

    public Variable(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public String unparse() {
      return name;
    }
  }

  /** A string literal; unparsed in double quotes. */
  public static class StringLiteral extends Term {
    public final String value;

    public StringLiteral(String value) {
      this.value = requireNonNull(value);
    }

    @Override
    public String unparse() {
      return EpilogWriter.quote(value);
    }
  }
}

// End EpilogAst.java
