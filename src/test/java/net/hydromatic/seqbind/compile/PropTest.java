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
package net.hydromatic.seqbind.compile;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("enabled"), is(Prop.ENABLED));
    assertThat(Prop.lookup("ENABLED"), is(Prop.ENABLED));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("verbose"));
    assertThat(e.getMessage(), is("property verbose not found"));
  }

  @Test void testEnabled() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.ENABLED.booleanValue(map), is(true));
    Prop.ENABLED.set(map, false);
    assertThat(Prop.ENABLED.booleanValue(map), is(false));
    Prop.ENABLED.set(map, true);
    assertThat(Prop.ENABLED.booleanValue(map), is(true));
  }

  @Test void testSetInvalid() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.ENABLED.set(map, "yes"));
    assertThat(e.getMessage(),
        is("value for property enabled must have type "
            + "class java.lang.Boolean"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.ENABLED.set(map, null));
    assertThat(e2.getMessage(), is("property enabled is required"));
    assertThat(map.isEmpty(), is(true));
  }
}

// End PropTest.java
