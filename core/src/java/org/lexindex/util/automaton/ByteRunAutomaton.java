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

/**
 * Finite-state automaton with fast run operation over byte labels. The
 * transition function is tableized: one row of 256 destinations per state.
 * 
 */
public class ByteRunAutomaton {
  private final int size;
  private final boolean[] accept;
  private final int[] transitions; // delta(state,c) = transitions[state*256+c]

  /**
   * Constructs a new run automaton from a deterministic automaton.
   * @throws IllegalArgumentException if the automaton is not deterministic
   */
  public ByteRunAutomaton(Automaton a) {
    if (!a.isDeterministic()) {
      throw new IllegalArgumentException("automaton must be deterministic");
    }
    size = Math.max(1, a.getNumStates());
    accept = new boolean[size];
    transitions = new int[size * 256];
    java.util.Arrays.fill(transitions, -1);
    for (int s = 0; s < a.getNumStates(); s++) {
      accept[s] = a.isAccept(s);
      for (Transition t : a.getSortedTransitions(s)) {
        for (int c = t.min; c <= t.max; c++) {
          transitions[s * 256 + c] = t.dest;
        }
      }
    }
  }

  /** Returns number of states in automaton. */
  public final int getSize() {
    return size;
  }

  /** Returns acceptance status for given state. */
  public final boolean isAccept(int state) {
    return accept[state];
  }

  /** Returns initial state. */
  public final int getInitialState() {
    return 0;
  }

  /**
   * Returns the state obtained by reading the given byte label from the
   * given state. Returns -1 if no matching transition.
   */
  public final int step(int state, int c) {
    return transitions[state * 256 + c];
  }

  /** Returns true if the given byte array is accepted by this automaton. */
  public boolean run(byte[] s, int offset, int length) {
    int p = 0;
    int l = offset + length;
    for (int i = offset; i < l; i++) {
      p = step(p, s[i] & 0xFF);
      if (p == -1) return false;
    }
    return accept[p];
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append("initial state: 0\n");
    for (int i = 0; i < size; i++) {
      b.append("state ").append(i);
      if (accept[i]) b.append(" [accept]:\n");
      else b.append(" [reject]:\n");
      for (int c = 0; c < 256; c++) {
        int dest = transitions[i * 256 + c];
        if (dest != -1) {
          b.append("  ").append(Integer.toHexString(c)).append(" -> ").append(dest).append('\n');
        }
      }
    }
    return b.toString();
  }
}
