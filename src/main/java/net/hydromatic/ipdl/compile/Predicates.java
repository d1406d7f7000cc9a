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

import net.hydromatic.ipdl.epilog.EpilogAst.Atom;
import net.hydromatic.ipdl.epilog.EpilogAst.Term;

/**
 * The predicates of the generated program, and atoms built from them.
 *
 * <p>The downstream evaluator defines {@code situation}, {@code direct_cause}
 * and {@code indirect_cause} over the situations of a trace; the compiler
 * defines the rest.
 */
public abstract class Predicates {
  private Predicates() {}

  public static final String OBJECT = "object";
  public static final String PROP = "prop";
  public static final String SITUATION = "situation";
  public static final String CHAIN = "chain";
  public static final String MATCHES_SITUATION = "matches_situation";
  public static final String MATCHES_CHAIN = "matches_chain";
  public static final String DIRECT_CAUSE = "direct_cause";
  public static final String INDIRECT_CAUSE = "indirect_cause";
  public static final String ANNOTATION = "annotation";

  /** Prefix of the symbols of compiled situations. */
  public static final String SITUATION_PREFIX = "situation";

  /** Returns the symbol that stands for a chain, "chain_name". */
  public static String chainSymbol(String chainName) {
    return "chain_" + chainName;
  }

  /**
   * Returns the symbol of a matcher that is defined outside the program,
   * "matches_situation_value".
   */
  public static String externalMatcherSymbol(String value) {
    return MATCHES_SITUATION + "_" + value;
  }

  /** Returns the symbol of an annotation, "target_annotation_name". */
  public static String annotationSymbol(String target, String name) {
    return target + "_annotation_" + name;
  }

  /** Creates {@code situation(s)}. */
  public static Atom situation(Term s) {
    return epilog.atom(SITUATION, s);
  }

  /** Creates {@code matches_situation(symbol, s)}. */
  public static Atom matchesSituation(String symbol, Term s) {
    return epilog.atom(MATCHES_SITUATION, epilog.symbol(symbol), s);
  }

  /** Creates {@code matches_chain(chain_name, s)}. */
  public static Atom matchesChain(String chainName, Term s) {
    return epilog.atom(MATCHES_CHAIN, epilog.symbol(chainSymbol(chainName)), s);
  }
}

// End Predicates.java
