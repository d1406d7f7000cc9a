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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/** Builds IPDL tree nodes. */
public enum IpdlBuilder {
  /**
   * The singleton instance of the IPDL builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ipdl;

  public Ipdl.Program program(
      Map<String, ? extends Ipdl.Declaration> declarations,
      Map<String, Ipdl.Chain> chains) {
    return new Ipdl.Program(declarations, chains);
  }

  public Ipdl.ObjectDeclaration object(
      Map<String, ? extends Ipdl.Value> properties) {
    return new Ipdl.ObjectDeclaration(properties);
  }

  public Ipdl.Dictionary dictionary(
      Map<String, ? extends Ipdl.Declaration> entries) {
    return new Ipdl.Dictionary(entries);
  }

  public Ipdl.StringValue string(String value) {
    return new Ipdl.StringValue(value);
  }

  public Ipdl.ObjectValue objectValue(
      Map<String, ? extends Ipdl.Value> properties) {
    return new Ipdl.ObjectValue(properties);
  }

  public Ipdl.RawValue raw(String type, String text) {
    return new Ipdl.RawValue(type, text);
  }

  /** Creates an expression value whose operator is "or". */
  public Ipdl.ExpressionValue orExpression(Ipdl.Situation... children) {
    return expression("or", ImmutableList.copyOf(children));
  }

  public Ipdl.ExpressionValue expression(
      String operator, List<? extends Ipdl.Situation> children) {
    return new Ipdl.ExpressionValue(new Ipdl.Expression(operator, children));
  }

  public Ipdl.Chain chain(Ipdl.Situation... children) {
    return chain(ImmutableList.copyOf(children), ImmutableList.of());
  }

  public Ipdl.Chain chain(
      List<? extends Ipdl.Situation> children,
      List<Ipdl.Annotation> annotations) {
    return new Ipdl.Chain(children, annotations);
  }

  public Ipdl.Annotation annotation(
      String name, Map<String, ? extends Ipdl.Value> properties) {
    return new Ipdl.Annotation(name, properties);
  }

  public Ipdl.AnySituation any() {
    return new Ipdl.AnySituation(ImmutableList.of());
  }

  public Ipdl.Block block(Map<String, ? extends Ipdl.Value> properties) {
    return new Ipdl.Block(properties, ImmutableList.of());
  }

  /** Creates a block that matches situations whose event is a literal. */
  public Ipdl.Block event(String event) {
    return block(ImmutableMap.of("event", string(event)));
  }

  /** Creates a block whose event matches one of several situations. */
  public Ipdl.Block event(Ipdl.ExpressionValue expression) {
    return block(ImmutableMap.of("event", expression));
  }

  public Ipdl.LogicBlock logicBlock() {
    return new Ipdl.LogicBlock(ImmutableList.of());
  }

  public Ipdl.Causal causal(Ipdl.Situation... children) {
    return new Ipdl.Causal(ImmutableList.copyOf(children), ImmutableList.of());
  }

  public Ipdl.Or or(Ipdl.Situation... children) {
    return new Ipdl.Or(ImmutableList.copyOf(children), ImmutableList.of());
  }

  public Ipdl.RuleCall ruleCall(String name) {
    return new Ipdl.RuleCall(name, ImmutableList.of());
  }

  public Ipdl.VariableRef variable(String value) {
    return new Ipdl.VariableRef(value, ImmutableList.of());
  }
}

// End IpdlBuilder.java
