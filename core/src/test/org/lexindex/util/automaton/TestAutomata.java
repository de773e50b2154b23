package org.lexindex.util.automaton;

/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestAutomata extends LexTestCase {

  public void testString() {
    Automaton a = Automata.makeString("foobar");
    assertTrue(Operations.run(a, new BytesRef("foobar")));
    assertFalse(Operations.run(a, new BytesRef("foo")));
    assertFalse(Operations.run(a, new BytesRef("foobarx")));
    assertTrue(Operations.isFinite(a));
    assertEquals(new BytesRef("foobar"), Operations.getSingleton(a));
  }

  public void testPrefix() {
    Automaton a = Automata.makeBinaryPrefix(new BytesRef("ab"));
    assertTrue(Operations.run(a, new BytesRef("ab")));
    assertTrue(Operations.run(a, new BytesRef("abzzz")));
    assertFalse(Operations.run(a, new BytesRef("a")));
    assertFalse(Operations.isFinite(a));
    assertNull(Operations.getSingleton(a));
  }

  public void testEmptyAndTotal() {
    assertTrue(Operations.isEmpty(Operations.removeDeadStates(Automata.makeEmpty())));
    assertTrue(Operations.isTotal(Automata.makeAnyBinary()));
    Automaton emptyString = Automata.makeEmptyString();
    assertTrue(Operations.run(emptyString, new BytesRef("")));
    assertFalse(Operations.run(emptyString, new BytesRef("a")));
    assertEquals(new BytesRef(""), Operations.getSingleton(emptyString));
  }

  public void testCompiledTypes() {
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NONE, new CompiledAutomaton(Automata.makeEmpty()).type);
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.ALL, new CompiledAutomaton(Automata.makeAnyBinary()).type);
    CompiledAutomaton single = new CompiledAutomaton(Automata.makeString("x"));
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.SINGLE, single.type);
    assertEquals(new BytesRef("x"), single.term);
    assertEquals(CompiledAutomaton.AUTOMATON_TYPE.NORMAL,
        new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef("x"))).type);
  }

  public void testNonDeterministicRejected() {
    Automaton a = new Automaton();
    int s0 = a.createState();
    int s1 = a.createState();
    int s2 = a.createState();
    a.addTransition(s0, s1, 'a');
    a.addTransition(s0, s2, 'a');
    a.setAccept(s1, true);
    assertFalse(a.isDeterministic());
    try {
      new CompiledAutomaton(a);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }

  public void testRandomStringUnion() {
    final int iters = atLeast(20);
    for(int iter=0;iter<iters;iter++) {
      TreeSet<BytesRef> terms = new TreeSet<BytesRef>();
      final int numTerms = _TestUtil.nextInt(random, 1, 50);
      for(int i=0;i<numTerms;i++) {
        terms.add(new BytesRef(_TestUtil.randomUnicodeString(random, 10)));
      }
      Automaton a = Automata.makeStringUnion(terms);
      assertTrue(a.isDeterministic());
      assertTrue(Operations.isFinite(a));
      for (BytesRef term : terms) {
        assertTrue(Operations.run(a, term));
      }
      List<BytesRef> others = new ArrayList<BytesRef>();
      for(int i=0;i<20;i++) {
        others.add(new BytesRef(_TestUtil.randomUnicodeString(random, 10)));
      }
      for (BytesRef other : others) {
        assertEquals(terms.contains(other), Operations.run(a, other));
      }
    }
  }
}
