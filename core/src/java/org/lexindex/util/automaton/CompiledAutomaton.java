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

import java.io.IOException;

import org.lexindex.index.SingleTermsEnum;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.util.BytesRef;

/**
 * Immutable class holding compiled details for a given
 * Automaton.  The Automaton must be deterministic, and must not
 * contain any transition to a dead state.  Construct once and reuse
 * across many segments.
 *
 */
public class CompiledAutomaton {

  /** Automata are compiled into different internal forms for the
   *  most efficient execution depending upon the language they accept. */
  public enum AUTOMATON_TYPE {
    /** Automaton that accepts no strings. */
    NONE,
    /** Automaton that accepts all possible strings. */
    ALL,
    /** Automaton that accepts only a single fixed string. */
    SINGLE,
    /** Catch-all for any other automata. */
    NORMAL
  };

  public final AUTOMATON_TYPE type;

  /** For {@link AUTOMATON_TYPE#SINGLE} this is the singleton term. */
  public final BytesRef term;

  /** Matcher for quickly determining if a byte[] is accepted. */
  public final ByteRunAutomaton runAutomaton;

  /** Indicates if the automaton accepts a finite set of strings. */
  public final boolean finite;

  /** The automaton after dead states were removed. */
  public final Automaton automaton;

  /**
   * @throws IllegalArgumentException if the automaton is not deterministic
   */
  public CompiledAutomaton(Automaton automaton) {
    if (!automaton.isDeterministic()) {
      throw new IllegalArgumentException("automaton must be deterministic");
    }
    automaton = Operations.removeDeadStates(automaton);
    this.automaton = automaton;

    if (Operations.isEmpty(automaton)) {
      type = AUTOMATON_TYPE.NONE;
      term = null;
    } else if (Operations.isTotal(automaton)) {
      type = AUTOMATON_TYPE.ALL;
      term = null;
    } else {
      final BytesRef singleton = Operations.getSingleton(automaton);
      if (singleton != null) {
        type = AUTOMATON_TYPE.SINGLE;
        term = singleton;
      } else {
        type = AUTOMATON_TYPE.NORMAL;
        term = null;
      }
    }

    finite = Operations.isFinite(automaton);
    runAutomaton = new ByteRunAutomaton(automaton);
  }

  /** Return a {@link TermsEnum} intersecting the provided {@link Terms}
   *  with the terms accepted by this automaton. */
  public TermsEnum getTermsEnum(Terms terms) throws IOException {
    switch(type) {
    case NONE:
      return TermsEnum.EMPTY;
    case ALL:
      return terms.iterator(null);
    case SINGLE:
      return new SingleTermsEnum(terms.iterator(null), term);
    case NORMAL:
      return terms.intersect(this, null);
    default:
      // unreachable
      throw new RuntimeException("unhandled case");
    }
  }

  @Override
  public String toString() {
    return "CompiledAutomaton(type=" + type + (term == null ? "" : " term=" + term) + ")";
  }
}
