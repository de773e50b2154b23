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

import java.util.Collection;

import org.lexindex.util.BytesRef;

/**
 * Construction of basic automata.
 * 
 */
public final class Automata {

  private Automata() {}

  /** Returns a new (deterministic) automaton with the empty language. */
  public static Automaton makeEmpty() {
    Automaton a = new Automaton();
    a.createState();
    return a;
  }

  /** Returns a new (deterministic) automaton that accepts only the empty string. */
  public static Automaton makeEmptyString() {
    Automaton a = new Automaton();
    a.createState();
    a.setAccept(0, true);
    return a;
  }

  /** Returns a new (deterministic) automaton that accepts all binary terms. */
  public static Automaton makeAnyBinary() {
    Automaton a = new Automaton();
    int s = a.createState();
    a.setAccept(s, true);
    a.addTransition(s, s, 0, Automaton.MAX_LABEL);
    return a;
  }

  /** Returns a new (deterministic) automaton that accepts the single given
   *  binary term. */
  public static Automaton makeBinary(BytesRef term) {
    Automaton a = new Automaton();
    int lastState = a.createState();
    for (int i=0;i<term.length;i++) {
      int state = a.createState();
      int label = term.bytes[term.offset+i] & 0xff;
      a.addTransition(lastState, state, label);
      lastState = state;
    }
    a.setAccept(lastState, true);
    return a;
  }

  /** Returns a new (deterministic) automaton that accepts the UTF-8 bytes
   *  of the single given string. */
  public static Automaton makeString(String s) {
    return makeBinary(new BytesRef(s));
  }

  /** Returns a new (deterministic) automaton that accepts all terms
   *  starting with the given prefix. */
  public static Automaton makeBinaryPrefix(BytesRef prefix) {
    Automaton a = new Automaton();
    int lastState = a.createState();
    for (int i=0;i<prefix.length;i++) {
      int state = a.createState();
      a.addTransition(lastState, state, prefix.bytes[prefix.offset+i] & 0xff);
      lastState = state;
    }
    a.setAccept(lastState, true);
    a.addTransition(lastState, lastState, 0, Automaton.MAX_LABEL);
    return a;
  }

  /**
   * Returns a new (deterministic and minimal) automaton that accepts the
   * union of the given collection of binary terms, which must be in
   * sorted, unsigned byte order.
   */
  public static Automaton makeStringUnion(Collection<BytesRef> utf8Strings) {
    if (utf8Strings.isEmpty()) {
      return makeEmpty();
    } else {
      return DaciukMihovAutomatonBuilder.build(utf8Strings);
    }
  }
}
