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

import java.util.List;

/**
 * Converts Epilog trees to source text.
 *
 * <p>Atoms are written without spaces between arguments, and rules have one
 * body atom per line:
 *
 * <pre>{@code
 * matches_situation(situation_0,Situation) :-
 *   situation(Situation) &
 *   prop(Situation,"event","hello")
 * }</pre>
 */
public class EpilogWriter {
  static final String DECLARATIONS_HEADER = "% Declarations";
  static final String CHAINS_HEADER = "% Chains";

  private final StringBuilder b = new StringBuilder();

  /**
   * Quotes a string, escaping quotes, backslashes and control characters.
   * Control characters without a short escape become four-digit unicode
   * escapes.
   */
  public static String quote(String s) {
    final StringBuilder buf = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
        case '\\':
          buf.append('\\').append(c);
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        default:
          if (Character.isISOControl(c)) {
            buf.append(String.format("\\u%04x", (int) c));
          } else {
            buf.append(c);
          }
      }
    }
    return buf.append('"').toString();
  }

  /** Writes an atom. */
  public EpilogWriter atom(EpilogAst.Atom atom) {
    b.append(atom.name);
    if (atom.arity() > 0) {
      b.append('(');
      for (int i = 0; i < atom.terms.size(); i++) {
        if (i > 0) {
          b.append(',');
        }
        b.append(atom.terms.get(i).unparse());
      }
      b.append(')');
    }
    return this;
  }

  /** Writes a rule. A rule with an empty body is written as a fact. */
  public EpilogWriter rule(EpilogAst.Rule rule) {
    atom(rule.head);
    if (!rule.body.isEmpty()) {
      b.append(" :-\n  ");
      for (int i = 0; i < rule.body.size(); i++) {
        if (i > 0) {
          b.append(" &\n  ");
        }
        atom(rule.body.get(i));
      }
    }
    return this;
  }

  /** Writes a statement. */
  public EpilogWriter statement(EpilogAst.Statement statement) {
    return statement.unparse(this);
  }

  /** Writes a block, one statement per line. */
  public EpilogWriter write(EpilogAst.Block block) {
    for (int i = 0; i < block.statements.size(); i++) {
      if (i > 0) {
        b.append('\n');
      }
      statement(block.statements.get(i));
    }
    return this;
  }

  /**
   * Writes a program: a section of declarations and a section of chains, each
   * preceded by a comment. Blocks are separated by blank lines.
   */
  public EpilogWriter write(EpilogAst.Program program) {
    b.append(DECLARATIONS_HEADER).append("\n\n");
    blocks(program.declarations);
    b.append("\n\n").append(CHAINS_HEADER).append("\n\n");
    blocks(program.chains);
    return this;
  }

  private void blocks(List<EpilogAst.Block> blocks) {
    for (int i = 0; i < blocks.size(); i++) {
      if (i > 0) {
        b.append("\n\n");
      }
      write(blocks.get(i));
    }
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End EpilogWriter.java
