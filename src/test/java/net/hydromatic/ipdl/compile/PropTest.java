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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("symbolGenerator"), is(Prop.SYMBOL_GENERATOR));
    assertThat(Prop.lookup("SYMBOL_GENERATOR"), is(Prop.SYMBOL_GENERATOR));
    assertThat(Prop.lookup("trace"), is(Prop.TRACE));
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
    assertThat(e.getMessage(), is("property foo not found"));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.SITUATION_VARIABLE.stringValue(map), is("Situation"));
    assertThat(
        Prop.SYMBOL_GENERATOR.enumValue(map, Prop.SymbolMode.class),
        is(Prop.SymbolMode.RANDOM));
    assertThat(Prop.TRACE.booleanValue(map), is(false));
  }

  @Test
  void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SYMBOL_GENERATOR.setLenient(map, "sequential");
    assertThat(
        Prop.SYMBOL_GENERATOR.enumValue(map, Prop.SymbolMode.class),
        is(Prop.SymbolMode.SEQUENTIAL));
    Prop.TRACE.setLenient(map, "true");
    assertThat(Prop.TRACE.booleanValue(map), is(true));
    Prop.SITUATION_VARIABLE.setLenient(map, "Event");
    assertThat(Prop.SITUATION_VARIABLE.stringValue(map), is("Event"));

    // Setting null reverts to the default
    Prop.TRACE.set(map, null);
    assertThat(Prop.TRACE.booleanValue(map), is(false));
  }

  @Test
  void testInvalidValues() {
    final Map<Prop, Object> map = new HashMap<>();
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.SYMBOL_GENERATOR.setLenient(map, "shuffled"));
    assertThat(
        e.getMessage(), is("value must be one of: 'RANDOM', 'SEQUENTIAL'"));

    e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.SITUATION_VARIABLE.set(map, "situation"));
    assertThat(e.getMessage(), containsString("upper-case"));

    assertThrows(
        IllegalArgumentException.class, () -> Prop.TRACE.set(map, "yes"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.TRACE.stringValue(map));
  }
}

// End PropTest.java
