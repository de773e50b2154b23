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
import java.util.BitSet;
import java.util.LinkedList;
import java.util.List;

import org.lexindex.util.BytesRef;

/**
 * Automata operations.
 * 
 */
public final class Operations {

  private Operations() {}

  /** Returns true if the given deterministic automaton accepts the term. */
  public static boolean run(Automaton a, BytesRef term) {
    if (a.getNumStates() == 0) {
      return false;
    }
    int state = 0;
    for(int i=0;i<term.length;i++) {
      state = a.step(state, term.bytes[term.offset+i] & 0xff);
      if (state == -1) {
        return false;
      }
    }
    return a.isAccept(state);
  }

  /** Returns the states reachable from the initial state. */
  static BitSet getLiveStatesFromInitial(Automaton a) {
    final int numStates = a.getNumStates();
    final BitSet live = new BitSet(numStates);
    if (numStates == 0) {
      return live;
    }
    final LinkedList<Integer> workList = new LinkedList<Integer>();
    live.set(0);
    workList.add(0);

    while (workList.isEmpty() == false) {
      final int s = workList.removeFirst();
      for (Transition t : a.getSortedTransitions(s)) {
        if (live.get(t.dest) == false) {
          live.set(t.dest);
          workList.add(t.dest);
        }
      }
    }

    return live;
  }

  /** Returns the states that can reach an accept state. */
  static BitSet getLiveStatesToAccept(Automaton a) {
    final int numStates = a.getNumStates();
    // build reverse graph
    final List<List<Integer>> reverse = new ArrayList<List<Integer>>(numStates);
    for(int s=0;s<numStates;s++) {
      reverse.add(new ArrayList<Integer>());
    }
    for(int s=0;s<numStates;s++) {
      for (Transition t : a.getSortedTransitions(s)) {
        reverse.get(t.dest).add(s);
      }
    }
    final BitSet live = new BitSet(numStates);
    final LinkedList<Integer> workList = new LinkedList<Integer>();
    for(int s=0;s<numStates;s++) {
      if (a.isAccept(s)) {
        live.set(s);
        workList.add(s);
      }
    }
    while (workList.isEmpty() == false) {
      final int s = workList.removeFirst();
      for (int p : reverse.get(s)) {
        if (live.get(p) == false) {
          live.set(p);
          workList.add(p);
        }
      }
    }
    return live;
  }

  /**
   * Removes transitions to dead states (states that are not reachable from
   * the initial state or cannot reach an accept state), returning a new
   * automaton whose state 0 is still the initial state.
   */
  public static Automaton removeDeadStates(Automaton a) {
    final int numStates = a.getNumStates();
    final Automaton result = new Automaton();
    if (numStates == 0) {
      result.createState();
      return result;
    }
    final BitSet liveSet = getLiveStatesFromInitial(a);
    liveSet.and(getLiveStatesToAccept(a));

    final int[] map = new int[numStates];
    // initial state is always kept, even if it is dead, so state 0 remains initial:
    map[0] = result.createState();
    for(int s=1;s<numStates;s++) {
      if (liveSet.get(s)) {
        map[s] = result.createState();
      } else {
        map[s] = -1;
      }
    }
    for(int s=0;s<numStates;s++) {
      if (s != 0 && liveSet.get(s) == false) {
        continue;
      }
      result.setAccept(map[s], a.isAccept(s));
      if (liveSet.get(s) == false) {
        continue;
      }
      for (Transition t : a.getSortedTransitions(s)) {
        if (liveSet.get(t.dest)) {
          result.addTransition(map[s], map[t.dest], t.min, t.max);
        }
      }
    }

    return result;
  }

  /** Returns true if the language of this automaton is empty. */
  public static boolean isEmpty(Automaton a) {
    if (a.getNumStates() == 0) {
      return true;
    }
    final BitSet live = getLiveStatesFromInitial(a);
    for(int s=live.nextSetBit(0);s>=0;s=live.nextSetBit(s+1)) {
      if (a.isAccept(s)) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if the automaton accepts every byte string. */
  public static boolean isTotal(Automaton a) {
    if (a.getNumStates() == 0 || a.isAccept(0) == false) {
      return false;
    }
    for (Transition t : a.getSortedTransitions(0)) {
      if (t.dest == 0 && t.min == 0 && t.max == Automaton.MAX_LABEL) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if the language of this automaton is finite.  The
   * automaton must not have any dead states.
   */
  public static boolean isFinite(Automaton a) {
    if (a.getNumStates() == 0) {
      return true;
    }
    return isFinite(a, 0, new BitSet(a.getNumStates()), new BitSet(a.getNumStates()));
  }

  // checks whether there is a loop containing s. (this is sufficient since
  // there are never transitions to dead states.)
  private static boolean isFinite(Automaton a, int state, BitSet path, BitSet visited) {
    path.set(state);
    for (Transition t : a.getSortedTransitions(state)) {
      if (path.get(t.dest) || (!visited.get(t.dest) && !isFinite(a, t.dest, path, visited))) {
        return false;
      }
    }
    path.clear(state);
    visited.set(state);
    return true;
  }

  /**
   * If the automaton accepts exactly one string, returns it, else null.
   * The automaton must not have any dead states.
   */
  public static BytesRef getSingleton(Automaton a) {
    if (a.getNumStates() == 0) {
      return null;
    }
    final BytesRef result = new BytesRef(10);
    final BitSet visited = new BitSet(a.getNumStates());
    int s = 0;
    while (true) {
      visited.set(s);
      final Transition[] ts = a.getSortedTransitions(s);
      if (a.isAccept(s)) {
        return ts.length == 0 ? result : null;
      }
      if (ts.length != 1 || ts[0].min != ts[0].max || visited.get(ts[0].dest)) {
        return null;
      }
      result.grow(result.length+1);
      result.bytes[result.length++] = (byte) ts[0].min;
      s = ts[0].dest;
    }
  }
}
