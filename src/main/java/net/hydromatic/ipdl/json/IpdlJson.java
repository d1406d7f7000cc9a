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
package net.hydromatic.ipdl.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.Map;
import java.util.function.BiFunction;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.ast.Op;
import net.hydromatic.ipdl.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads an IPDL program from the JSON document that the IPDL parser writes.
 *
 * <p>The document has the form
 *
 * <pre>{@code
 * {
 *   "declarations": {
 *     "Foo": {
 *       "type": "object",
 *       "properties": {"bar": {"type": "string", "value": "baz"}}
 *     }
 *   },
 *   "chains": {
 *     "greet": {
 *       "children": [{"type": "block", "properties": {...}}],
 *       "annotations": []
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>A node that cannot be converted causes a {@link CompileException};
 * malformed JSON causes an {@link IOException}.
 */
public class IpdlJson {
  private static final ObjectMapper MAPPER = JsonMapper.builder().build();

  private IpdlJson() {}

  /** Reads a program from a reader. */
  public static Ipdl.Program read(Reader reader) throws IOException {
    return toProgram(MAPPER.readTree(reader));
  }

  /** Reads a program from a string. */
  public static Ipdl.Program parse(String json) throws IOException {
    return toProgram(MAPPER.readTree(json));
  }

  /** Converts a JSON tree to a program. */
  public static Ipdl.Program toProgram(JsonNode node) {
    return new Ipdl.Program(
        map(node.get("declarations"), IpdlJson::toDeclaration),
        map(node.get("chains"), IpdlJson::toChain));
  }

  static Ipdl.Declaration toDeclaration(String name, JsonNode node) {
    if ("Dictionary".equals(text(node, "class"))) {
      return new Ipdl.Dictionary(
          map(node.get("properties"), IpdlJson::toDeclaration));
    }
    if ("object".equals(text(node, "type"))) {
      return new Ipdl.ObjectDeclaration(
          map(node.get("properties"), IpdlJson::toValue));
    }
    throw new CompileException(
        CompileException.Kind.UNRECOGNIZED_DECLARATION, name, node);
  }

  static Ipdl.Chain toChain(String name, JsonNode node) {
    return new Ipdl.Chain(
        situations(node.get("children")), annotations(node.get("annotations")));
  }

  static Ipdl.Value toValue(String name, JsonNode node) {
    final @Nullable String type = text(node, "type");
    if (type == null) {
      throw new CompileException(
          CompileException.Kind.UNKNOWN_VALUE, name, node);
    }
    switch (type) {
      case "string":
        return new Ipdl.StringValue(valueText(node));
      case "object":
        return new Ipdl.ObjectValue(
            map(node.get("properties"), IpdlJson::toValue));
      case "expression":
        return new Ipdl.ExpressionValue(
            new Ipdl.Expression(
                String.valueOf(text(node, "operator")),
                situations(node.get("children"))));
      default:
        // A raw value is written verbatim, so it must have text
        if (!node.hasNonNull("value")) {
          throw new CompileException(
              CompileException.Kind.UNKNOWN_VALUE, name, node);
        }
        return new Ipdl.RawValue(type, valueText(node));
    }
  }

  static Ipdl.Situation toSituation(JsonNode node) {
    final @Nullable Op op =
        Op.lookup(text(node, "type"), text(node, "operator"));
    if (op == null) {
      throw new CompileException(
          CompileException.Kind.UNPARSABLE_SITUATION, null, node);
    }
    final ImmutableList<Ipdl.Annotation> annotations =
        annotations(node.get("annotations"));
    switch (op) {
      case ANY:
        return new Ipdl.AnySituation(annotations);
      case BLOCK:
        return new Ipdl.Block(
            map(node.get("properties"), IpdlJson::toValue), annotations);
      case LOGIC_BLOCK:
        return new Ipdl.LogicBlock(annotations);
      case CAUSAL:
        return new Ipdl.Causal(situations(node.get("children")), annotations);
      case OR:
        return new Ipdl.Or(situations(node.get("children")), annotations);
      case RULE_CALL:
        return new Ipdl.RuleCall(required(node, "name"), annotations);
      case VARIABLE:
        return new Ipdl.VariableRef(required(node, "value"), annotations);
      default:
        throw new AssertionError(op);
    }
  }

  static Ipdl.Annotation toAnnotation(JsonNode node) {
    return new Ipdl.Annotation(
        String.valueOf(text(node, "name")),
        map(node.get("properties"), IpdlJson::toValue));
  }

  private static ImmutableList<Ipdl.Situation> situations(
      @Nullable JsonNode node) {
    final ImmutableList.Builder<Ipdl.Situation> b = ImmutableList.builder();
    if (node != null) {
      node.forEach(child -> b.add(toSituation(child)));
    }
    return b.build();
  }

  private static ImmutableList<Ipdl.Annotation> annotations(
      @Nullable JsonNode node) {
    final ImmutableList.Builder<Ipdl.Annotation> b = ImmutableList.builder();
    if (node != null) {
      node.forEach(child -> b.add(toAnnotation(child)));
    }
    return b.build();
  }

  /**
   * Converts each field of a JSON object, preserving order. A missing or null
   * node yields an empty map.
   */
  private static <V> ImmutableMap<String, V> map(
      @Nullable JsonNode node, BiFunction<String, JsonNode, V> fn) {
    final ImmutableMap.Builder<String, V> b = ImmutableMap.builder();
    if (node != null && node.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
          fields.hasNext(); ) {
        final Map.Entry<String, JsonNode> field = fields.next();
        b.put(field.getKey(), fn.apply(field.getKey(), field.getValue()));
      }
    }
    return b.build();
  }

  private static @Nullable String text(JsonNode node, String field) {
    final JsonNode child = node.get(field);
    return child == null || child.isNull() ? null : child.asText();
  }

  private static String required(JsonNode node, String field) {
    final @Nullable String s = text(node, field);
    if (s == null) {
      throw new CompileException(
          CompileException.Kind.UNPARSABLE_SITUATION, field, node);
    }
    return s;
  }

  /** Returns the "value" field as text; non-scalar values as JSON. */
  private static String valueText(JsonNode node) {
    final JsonNode value = node.get("value");
    if (value == null || value.isNull()) {
      return "";
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }
}

// End IpdlJson.java
