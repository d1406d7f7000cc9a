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
package net.hydromatic.ipdl;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ipdl.ast.Ipdl;
import net.hydromatic.ipdl.compile.Compilation;
import net.hydromatic.ipdl.compile.CompileException;
import net.hydromatic.ipdl.compile.ProgramCompiler;
import net.hydromatic.ipdl.compile.Prop;
import net.hydromatic.ipdl.compile.Tracer;
import net.hydromatic.ipdl.compile.Tracers;
import net.hydromatic.ipdl.json.IpdlJson;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command-line compiler from IPDL to Epilog.
 *
 * <p>Usage: {@code ipdl [--property=value ...] [file.json]}. Reads the JSON
 * form of an IPDL program from the file, or from standard input if no file
 * is given, and writes Epilog to standard output. Properties are those of
 * {@link Prop}, for example {@code --symbolGenerator=sequential}.
 */
public class Main {
  private final Reader in;
  private final PrintWriter out;
  private final PrintWriter err;
  private final Map<Prop, Object> propMap = new LinkedHashMap<>();
  private final @Nullable String fileName;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(
            ImmutableList.copyOf(args),
            new InputStreamReader(System.in, StandardCharsets.UTF_8),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8));
    final int status;
    try {
      status = main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
      return;
    }
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out, Writer err) {
    this.in = in;
    this.out = buffer(out);
    this.err = buffer(err);
    String fileName = null;
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        final String name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
        final String value = eq < 0 ? "true" : arg.substring(eq + 1);
        Prop.lookup(name).setLenient(propMap, value);
      } else if (fileName == null) {
        fileName = arg;
      } else {
        throw new IllegalArgumentException("more than one input file: " + arg);
      }
    }
    this.fileName = fileName;
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /**
   * Reads, compiles and prints a program.
   *
   * @return exit status: 0 on success, 1 if the program is invalid
   */
  public int run() throws IOException {
    Tracer tracer = Tracers.empty();
    if (Prop.TRACE.booleanValue(propMap)) {
      tracer = Tracers.printing(tracer, err);
    }

    final Ipdl.Program program;
    try {
      program = read();
    } catch (CompileException e) {
      tracer.onException(e);
      return fail(e);
    }
    final Compilation compilation =
        ProgramCompiler.create(propMap, tracer).tryCompile(program);
    if (!compilation.succeeded()) {
      return fail(requireNonNull(compilation.error()));
    }
    out.println(compilation.program());
    out.flush();
    return 0;
  }

  private Ipdl.Program read() throws IOException {
    if (fileName == null) {
      return IpdlJson.read(new BufferedReader(in));
    }
    try (Reader r =
        Files.newBufferedReader(Paths.get(fileName), StandardCharsets.UTF_8)) {
      return IpdlJson.read(r);
    }
  }

  private int fail(CompileException e) {
    err.println(e.getMessage());
    err.flush();
    return 1;
  }
}

// End Main.java
