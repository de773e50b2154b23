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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

import org.lexindex.util.ArrayUtil;

/**
 * Finite-state automaton over byte labels (0-255).  States are
 * numbered from 0, and state 0 is always the initial state.
 *
 * <p>Build one by calling {@link #createState}, {@link #setAccept} and
 * {@link #addTransition}.  Once built, {@link #getSortedTransitions}
 * returns for every state its outgoing transitions sorted by label.
 *
 * <p>Term dictionary intersection requires the automaton to be
 * deterministic; see {@link #isDeterministic}.
 *
 */
public class Automaton {

  /** Largest byte label. */
  public static final int MAX_LABEL = 0xff;

  /** Per-state transitions, flattened as dest,min,max triples. */
  private int[][] transitions = new int[4][];
  private int[] numTransitions = new int[4];
  private final BitSet isAccept = new BitSet(4);
  private int numStates;

  /** Create a new state. */
  public int createState() {
    if (numStates == numTransitions.length) {
      numTransitions = ArrayUtil.grow(numTransitions, numStates+1);
      transitions = Arrays.copyOf(transitions, numTransitions.length);
    }
    transitions[numStates] = new int[0];
    numTransitions[numStates] = 0;
    return numStates++;
  }

  /** Set or clear this state as an accept state. */
  public void setAccept(int state, boolean accept) {
    checkState(state);
    isAccept.set(state, accept);
  }

  /** Returns true if this state is an accept state. */
  public boolean isAccept(int state) {
    return isAccept.get(state);
  }

  /** How many states this automaton has. */
  public int getNumStates() {
    return numStates;
  }

  /** How many transitions leave this state. */
  public int getNumTransitions(int state) {
    checkState(state);
    return numTransitions[state];
  }

  /** Add a new transition with min = max = label. */
  public void addTransition(int source, int dest, int label) {
    addTransition(source, dest, label, label);
  }

  /** Add a new transition with the specified source, dest, min, max. */
  public void addTransition(int source, int dest, int min, int max) {
    checkState(source);
    checkState(dest);
    if (min < 0 || max > MAX_LABEL || min > max) {
      throw new IllegalArgumentException("invalid label range " + min + "-" + max);
    }
    final int upto = 3*numTransitions[source];
    transitions[source] = ArrayUtil.grow(transitions[source], upto+3);
    transitions[source][upto] = dest;
    transitions[source][upto+1] = min;
    transitions[source][upto+2] = max;
    numTransitions[source]++;
  }

  private void checkState(int state) {
    if (state < 0 || state >= numStates) {
      throw new IllegalArgumentException("state=" + state + " is out of bounds (numStates=" + numStates + ")");
    }
  }

  private static final Comparator<Transition> BY_MIN = new Comparator<Transition>() {
    public int compare(Transition a, Transition b) {
      if (a.min != b.min) {
        return a.min - b.min;
      }
      if (a.max != b.max) {
        return a.max - b.max;
      }
      return a.dest - b.dest;
    }
  };

  /** Returns the transitions of one state, sorted by min label. */
  public Transition[] getSortedTransitions(int state) {
    checkState(state);
    final int count = numTransitions[state];
    final Transition[] result = new Transition[count];
    final int[] t = transitions[state];
    for(int i=0;i<count;i++) {
      result[i] = new Transition(t[3*i], t[3*i+1], t[3*i+2]);
    }
    Arrays.sort(result, BY_MIN);
    return result;
  }

  /** True if no state has two transitions with overlapping label ranges. */
  public boolean isDeterministic() {
    for(int s=0;s<numStates;s++) {
      final Transition[] ts = getSortedTransitions(s);
      for(int i=1;i<ts.length;i++) {
        if (ts[i].min <= ts[i-1].max) {
          return false;
        }
      }
    }
    return true;
  }

  /** Performs lookup in transitions, assuming determinism.
   *  @return destination state, -1 if no matching outgoing transition */
  public int step(int state, int label) {
    checkState(state);
    final int[] t = transitions[state];
    final int count = numTransitions[state];
    for(int i=0;i<count;i++) {
      if (t[3*i+1] <= label && label <= t[3*i+2]) {
        return t[3*i];
      }
    }
    return -1;
  }

  /** Returns every label at which some transition starts or ends, sorted
   *  and including 0; used to build run tables. */
  public int[] getStartPoints() {
    final BitSet points = new BitSet(MAX_LABEL+2);
    points.set(0);
    for(int s=0;s<numStates;s++) {
      final int[] t = transitions[s];
      for(int i=0;i<numTransitions[s];i++) {
        points.set(t[3*i+1]);
        if (t[3*i+2] < MAX_LABEL) {
          points.set(t[3*i+2]+1);
        }
      }
    }
    final List<Integer> list = new ArrayList<Integer>();
    for(int p=points.nextSetBit(0);p>=0;p=points.nextSetBit(p+1)) {
      list.add(p);
    }
    final int[] result = new int[list.size()];
    for(int i=0;i<result.length;i++) {
      result[i] = list.get(i);
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    for(int s=0;s<numStates;s++) {
      b.append("state ").append(s);
      b.append(isAccept(s) ? " [accept]:\n" : " [reject]:\n");
      for (Transition t : getSortedTransitions(s)) {
        b.append("  ").append(t).append('\n');
      }
    }
    return b.toString();
  }
}
