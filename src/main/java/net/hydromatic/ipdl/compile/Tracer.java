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

import java.util.List;
import net.hydromatic.ipdl.epilog.EpilogAst;

/**
 * Called at various points during compilation.
 *
 * @see Tracers
 */
public interface Tracer {
  /**
   * Called when a top-level declaration has been compiled. A dictionary yields
   * one block per object it contains.
   */
  void onDeclaration(String name, List<EpilogAst.Block> blocks);

  /** Called when a chain has been compiled. */
  void onChain(String name, EpilogAst.Block block);

  /**
   * Called when reading or compiling a program fails. The caller still throws
   * or reports the exception.
   */
  void onException(CompileException e);
}

// End Tracer.java
