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
 * Holds one transition from an {@link Automaton}: a label range
 * <code>[min..max]</code> (inclusive, byte values 0-255) leading to
 * state <code>dest</code>.
 *
 */
public final class Transition {

  /** Destination state. */
  public final int dest;

  /** Minimum accepted label (inclusive). */
  public final int min;

  /** Maximum accepted label (inclusive). */
  public final int max;

  public Transition(int dest, int min, int max) {
    assert min <= max: "min=" + min + " max=" + max;
    this.dest = dest;
    this.min = min;
    this.max = max;
  }

  @Override
  public String toString() {
    return min + "-" + max + " -> " + dest;
  }
}
