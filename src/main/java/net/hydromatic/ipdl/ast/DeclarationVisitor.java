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
 * Visitor over {@link Ipdl.Declaration} objects.
 *
 * @param <R> return type from {@code visit} methods
 * @see Ipdl.Declaration#accept(String, DeclarationVisitor)
 */
public interface DeclarationVisitor<R> {
  /** Visits an object declaration that is bound to {@code name}. */
  R visit(String name, Ipdl.ObjectDeclaration objectDeclaration);

  /** Visits a dictionary that is bound to {@code name}. */
  R visit(String name, Ipdl.Dictionary dictionary);
}

// End DeclarationVisitor.java
