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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Tree of an IPDL program, as produced by the IPDL parser.
 *
 * <p>A program consists of named declarations and named chains. A chain is a
 * list of situations; situations nest via causal and disjunctive operations.
 *
 * <p>Nodes are immutable. Maps preserve the order of the source document.
 */
public class Ipdl {
  private Ipdl() {
    // Utility class
  }

  /** A complete IPDL program. */
  public static class Program {
    public final ImmutableMap<String, Declaration> declarations;
    public final ImmutableMap<String, Chain> chains;

    public Program(
        Map<String, ? extends Declaration> declarations,
        Map<String, Chain> chains) {
      this.declarations = ImmutableMap.copyOf(declarations);
      this.chains = ImmutableMap.copyOf(chains);
    }

    @Override
    public String toString() {
      return "{declarations: " + declarations + ", chains: " + chains + "}";
    }
  }

  /**
   * A declaration. Its name is the key under which it is bound, and is not
   * part of the node.
   */
  public abstract static class Declaration {
    /**
     * Accepts a visitor, calling the method appropriate to the type of this
     * declaration, and returning the result.
     */
    public abstract <R> R accept(String name, DeclarationVisitor<R> visitor);
  }

  /** A declaration of an object with a flat list of properties. */
  public static class ObjectDeclaration extends Declaration {
    public final ImmutableMap<String, Value> properties;

    public ObjectDeclaration(Map<String, ? extends Value> properties) {
      this.properties = ImmutableMap.copyOf(properties);
    }

    @Override
    public <R> R accept(String name, DeclarationVisitor<R> visitor) {
      return visitor.visit(name, this);
    }

    @Override
    public String toString() {
      return "{type: object, properties: " + properties + "}";
    }
  }

  /** A dictionary of nested declarations. */
  public static class Dictionary extends Declaration {
    public final ImmutableMap<String, Declaration> entries;

    public Dictionary(Map<String, ? extends Declaration> entries) {
      this.entries = ImmutableMap.copyOf(entries);
    }

    @Override
    public <R> R accept(String name, DeclarationVisitor<R> visitor) {
      return visitor.visit(name, this);
    }

    @Override
    public String toString() {
      return "{class: Dictionary, properties: " + entries + "}";
    }
  }

  /** A typed value of a property. */
  public abstract static class Value {
    /** Type tag, as it occurs in the source document. */
    public abstract String type();
  }

  /** A string value. */
  public static class StringValue extends Value {
    public final String value;

    public StringValue(String value) {
      this.value = requireNonNull(value);
    }

    @Override
    public String type() {
      return "string";
    }

    @Override
    public String toString() {
      return "{type: string, value: \"" + value + "\"}";
    }
  }

  /** An object value, with properties of its own. */
  public static class ObjectValue extends Value {
    public final ImmutableMap<String, Value> properties;

    public ObjectValue(Map<String, ? extends Value> properties) {
      this.properties = ImmutableMap.copyOf(properties);
    }

    @Override
    public String type() {
      return "object";
    }

    @Override
    public String toString() {
      return "{type: object, properties: " + properties + "}";
    }
  }

  /** A value that is an expression over situations. */
  public static class ExpressionValue extends Value {
    public final Expression expression;

    public ExpressionValue(Expression expression) {
      this.expression = requireNonNull(expression);
    }

    @Override
    public String type() {
      return "expression";
    }

    @Override
    public String toString() {
      return expression.toString();
    }
  }

  /**
   * A value of some other type, held as text. Variable references arrive in
   * this form.
   */
  public static class RawValue extends Value {
    public final String type;
    public final String text;

    public RawValue(String type, String text) {
      this.type = requireNonNull(type);
      this.text = requireNonNull(text);
    }

    @Override
    public String type() {
      return type;
    }

    @Override
    public String toString() {
      return "{type: " + type + ", value: " + text + "}";
    }
  }

  /** An expression, such as the alternatives for an event. */
  public static class Expression {
    public final String operator;
    public final ImmutableList<Situation> children;

    public Expression(String operator, List<? extends Situation> children) {
      this.operator = requireNonNull(operator);
      this.children = ImmutableList.copyOf(children);
    }

    @Override
    public String toString() {
      return "{type: expression, operator: " + operator
          + ", children: " + children + "}";
    }
  }

  /** A chain: an ordered list of situations, plus annotations. */
  public static class Chain {
    public final ImmutableList<Situation> children;
    public final ImmutableList<Annotation> annotations;

    public Chain(
        List<? extends Situation> children,
        List<Annotation> annotations) {
      this.children = ImmutableList.copyOf(children);
      this.annotations = ImmutableList.copyOf(annotations);
    }

    @Override
    public String toString() {
      return "{children: " + children + ", annotations: " + annotations + "}";
    }
  }

  /** Named metadata attached to a chain or a situation. */
  public static class Annotation {
    public final String name;
    public final ImmutableMap<String, Value> properties;

    public Annotation(String name, Map<String, ? extends Value> properties) {
      this.name = requireNonNull(name);
      this.properties = ImmutableMap.copyOf(properties);
    }

    @Override
    public String toString() {
      return "{name: " + name + ", properties: " + properties + "}";
    }
  }

  /** Base class for all situations. */
  public abstract static class Situation {
    public final Op op;
    public final ImmutableList<Annotation> annotations;

    protected Situation(Op op, List<Annotation> annotations) {
      this.op = requireNonNull(op);
      this.annotations = ImmutableList.copyOf(annotations);
    }

    /**
     * Accepts a visitor, calling the method appropriate to the type of this
     * situation, and returning the result.
     */
    public abstract <R> R accept(SituationVisitor<R> visitor);

    /** Returns whether this situation is the {@link Op#ANY} wildcard. */
    public boolean isWildcard() {
      return op == Op.ANY;
    }

    /** Appends the members of this situation other than its type. */
    void describeMembers(StringBuilder buf) {}

    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder("{type: ").append(op.type);
      if (op.operator != null) {
        buf.append(", operator: ").append(op.operator);
      }
      describeMembers(buf);
      if (!annotations.isEmpty()) {
        buf.append(", annotations: ").append(annotations);
      }
      return buf.append('}').toString();
    }
  }

  /** Wildcard situation. */
  public static class AnySituation extends Situation {
    public AnySituation(List<Annotation> annotations) {
      super(Op.ANY, annotations);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Situation that constrains the properties of the situation under test. */
  public static class Block extends Situation {
    public final ImmutableMap<String, Value> properties;

    public Block(
        Map<String, ? extends Value> properties,
        List<Annotation> annotations) {
      super(Op.BLOCK, annotations);
      this.properties = ImmutableMap.copyOf(properties);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    void describeMembers(StringBuilder buf) {
      buf.append(", properties: ").append(properties);
    }
  }

  /** Placeholder situation. */
  public static class LogicBlock extends Situation {
    public LogicBlock(List<Annotation> annotations) {
      super(Op.LOGIC_BLOCK, annotations);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Situation that combines child situations with an operator. */
  public abstract static class Operation extends Situation {
    public final ImmutableList<Situation> children;

    protected Operation(
        Op op,
        List<? extends Situation> children,
        List<Annotation> annotations) {
      super(op, annotations);
      this.children = ImmutableList.copyOf(children);
    }

    @Override
    void describeMembers(StringBuilder buf) {
      buf.append(", children: ").append(children);
    }
  }

  /** Sequence of situations, each of which causes the next. */
  public static class Causal extends Operation {
    public Causal(
        List<? extends Situation> children,
        List<Annotation> annotations) {
      super(Op.CAUSAL, children, annotations);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Set of alternative situations. */
  public static class Or extends Operation {
    public Or(
        List<? extends Situation> children,
        List<Annotation> annotations) {
      super(Op.OR, children, annotations);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** Reference to another chain. */
  public static class RuleCall extends Situation {
    public final String name;

    public RuleCall(String name, List<Annotation> annotations) {
      super(Op.RULE_CALL, annotations);
      this.name = requireNonNull(name);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    void describeMembers(StringBuilder buf) {
      buf.append(", name: ").append(name);
    }
  }

  /** Reference to a matcher that is defined outside the program. */
  public static class VariableRef extends Situation {
    public final String value;

    public VariableRef(String value, List<Annotation> annotations) {
      super(Op.VARIABLE, annotations);
      this.value = requireNonNull(value);
    }

    @Override
    public <R> R accept(SituationVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    void describeMembers(StringBuilder buf) {
      buf.append(", value: ").append(value);
    }
  }
}

// End Ipdl.java
