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
package net.hydromatic.ipdl.ast;

/**
 * Visitor over {@link Ipdl.Situation} objects.
 *
 * <p>There is one method per variant, and none has a default, so a new
 * variant will not compile until every visitor handles it.
 *
 * @param <R> return type from {@code visit} methods
 * @see Ipdl.Situation#accept(SituationVisitor)
 */
public interface SituationVisitor<R> {
  R visit(Ipdl.AnySituation any);

  R visit(Ipdl.Block block);

  R visit(Ipdl.LogicBlock logicBlock);

  R visit(Ipdl.Causal causal);

  R visit(Ipdl.Or or);

  R visit(Ipdl.RuleCall ruleCall);

  R visit(Ipdl.VariableRef variableRef);
}

// End SituationVisitor.java
