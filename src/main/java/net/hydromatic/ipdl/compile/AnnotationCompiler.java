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
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.epilog.EpilogAst;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles annotations into facts.
 *
 * <p>An annotation {@code priority} on target {@code chain_greet} with
 * property {@code level = "high"} becomes
 *
 * <pre>{@code
 * annotation(chain_greet,"priority",chain_greet_annotation_priority)
 * prop(chain_greet_annotation_priority,"level","high")
 * }</pre>
 */
public class AnnotationCompiler {
  /** Compiles an annotation that is attached to {@code target}. */
  public List<EpilogAst.Fact> compile(
      Ipdl.Annotation annotation, @Nullable String target) {
    if (target == null || target.isEmpty()) {
      throw new CompileException(
          CompileException.Kind.ORPHAN_ANNOTATION, annotation.name, annotation);
    }
    final String symbol = Predicates.annotationSymbol(target, annotation.name);
    final ImmutableList.Builder<EpilogAst.Fact> facts = ImmutableList.builder();
    facts.add(
        epilog.fact(
            Predicates.ANNOTATION,
            epilog.symbol(target),
            epilog.string(annotation.name),
            epilog.symbol(symbol)));
    for (Map.Entry<String, Ipdl.Value> e : annotation.properties.entrySet()) {
      facts.add(
          epilog.fact(
              Predicates.PROP,
              epilog.symbol(symbol),
              epilog.string(e.getKey()),
              term(annotation, e.getValue())));
    }
    return facts.build();
  }

  /** Compiles each of a list of annotations on the same target. */
  public List<EpilogAst.Fact> compileAll(
      List<Ipdl.Annotation> annotations, @Nullable String target) {
    final ImmutableList.Builder<EpilogAst.Fact> facts = ImmutableList.builder();
    for (Ipdl.Annotation annotation : annotations) {
      facts.addAll(compile(annotation, target));
    }
    return facts.build();
  }

  /** Strings are quoted; other values, such as variables, are not. */
  private static EpilogAst.Term term(
      Ipdl.Annotation annotation, Ipdl.Value value) {
    if (value instanceof Ipdl.StringValue) {
      return epilog.string(((Ipdl.StringValue) value).value);
    }
    if (value instanceof Ipdl.RawValue
        && !((Ipdl.RawValue) value).text.isEmpty()) {
      return epilog.symbol(((Ipdl.RawValue) value).text);
    }
    if (value instanceof Ipdl.ObjectValue) {
      throw new CompileException(
          CompileException.Kind.NESTED_OBJECT, annotation.name, annotation);
    }
    throw new CompileException(
        CompileException.Kind.UNKNOWN_VALUE, annotation.name, value);
  }
}

// End AnnotationCompiler.java
