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

/**
 * Compiler from IPDL to Epilog.
 *
 * <p>Every compiled situation is identified by a fresh symbol {@code S}, and
 * is defined by rules whose head is {@code matches_situation(S, Situation)}.
 * A chain called {@code c} is defined by a fact {@code chain(chain_c)} and a
 * rule whose head is {@code matches_chain(chain_c, Situation)}.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.ipdl.compile.ProgramCompiler} - Main entry
 *       point. Compiles declarations, then chains.
 *   <li>{@link net.hydromatic.ipdl.compile.DeclarationCompiler} - Converts
 *       objects and dictionaries to {@code object} and {@code prop} facts.
 *   <li>{@link net.hydromatic.ipdl.compile.SituationCompiler} - Compiles a
 *       situation tree recursively; delegates causal sequences to
 *       {@code CausalLinkCompiler} and disjunctions to
 *       {@code DisjunctionCompiler}.
 *   <li>{@link net.hydromatic.ipdl.compile.ChainCompiler} - Compiles a named
 *       chain.
 *   <li>{@link net.hydromatic.ipdl.compile.AnnotationCompiler} - Attaches
 *       annotations to chains and situations.
 *   <li>{@link net.hydromatic.ipdl.compile.SymbolGenerators} - Sources of
 *       fresh symbols, random or sequential.
 * </ul>
 *
 * <h2>Causation</h2>
 *
 * <p>In a causal sequence, each operand that is not a wildcard is linked to
 * the nearest following operand that is not a wildcard. If the two are
 * adjacent the link is {@code direct_cause}, otherwise
 * {@code indirect_cause}. The last operand is always bound to the situation
 * under test.
 */
package net.hydromatic.ipdl.compile;

// End package-info.java
