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

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.ipdl.epilog.EpilogAst;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a compiled
   * declaration, then calls the underlying tracer.
   */
  public static Tracer withOnDeclaration(
      Tracer tracer, BiConsumer<String, List<EpilogAst.Block>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDeclaration(String name, List<EpilogAst.Block> blocks) {
        consumer.accept(name, blocks);
        super.onDeclaration(name, blocks);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a compiled chain, then
   * calls the underlying tracer.
   */
  public static Tracer withOnChain(
      Tracer tracer, BiConsumer<String, EpilogAst.Block> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onChain(String name, EpilogAst.Block block) {
        consumer.accept(name, block);
        super.onChain(name, block);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a compilation error,
   * then calls the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(CompileException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /**
   * Returns a tracer that writes one line per compiled declaration or chain,
   * and one line per error, to a writer.
   */
  public static Tracer printing(Tracer tracer, PrintWriter w) {
    Tracer t =
        withOnDeclaration(
            tracer,
            (name, blocks) -> {
              int count = 0;
              for (EpilogAst.Block block : blocks) {
                count += block.statements.size();
              }
              w.println(
                  "declaration " + name + ": " + blocks.size() + " object(s), "
                      + count + " statement(s)");
              w.flush();
            });
    t =
        withOnChain(
            t,
            (name, block) -> {
              w.println(
                  "chain " + name + ": " + block.statements.size()
                      + " statement(s)");
              w.flush();
            });
    return withOnException(
        t,
        e -> {
          w.println("error " + e.kind + ": " + e.getMessage());
          w.flush();
        });
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onDeclaration(String name, List<EpilogAst.Block> blocks) {}

    @Override
    public void onChain(String name, EpilogAst.Block block) {}

    @Override
    public void onException(CompileException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onDeclaration(String name, List<EpilogAst.Block> blocks) {
      tracer.onDeclaration(name, blocks);
    }

    @Override
    public void onChain(String name, EpilogAst.Block block) {
      tracer.onChain(name, block);
    }

    @Override
    public void onException(CompileException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
