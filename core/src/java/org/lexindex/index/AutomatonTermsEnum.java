package org.lexindex.index;

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

import org.lexindex.util.ArrayUtil;
import org.lexindex.util.BytesRef;
import org.lexindex.util.automaton.ByteRunAutomaton;
import org.lexindex.util.automaton.CompiledAutomaton;

/**
 * Filters any {@link TermsEnum} down to the terms a {@link CompiledAutomaton}
 * accepts.  Codecs without a native intersection fall back to this.
 * <p>
 * Terms are read in order; the automaton resumes from the state reached
 * on the prefix a term shares with the previous one.  When a term leads
 * to a dead state after <code>d</code> bytes, no term starting with those
 * bytes can match, so the enum seeks to the first term past that prefix.
 */
class AutomatonTermsEnum extends FilteredTermsEnum {
  private final ByteRunAutomaton runAutomaton;
  private final BytesRef startTerm;

  // states[i] is the state after the first i bytes of prevTerm
  private int[] states = new int[16];
  private final BytesRef prevTerm = new BytesRef(16);
  // how many leading bytes of prevTerm reached a live state
  private int liveDepth;

  private final BytesRef seekTerm = new BytesRef(16);

  /** Only terms greater than <code>startTerm</code> are returned, if it
   *  is not null; it need not exist. */
  AutomatonTermsEnum(TermsEnum tenum, CompiledAutomaton compiled, BytesRef startTerm) {
    super(tenum);
    this.runAutomaton = compiled.runAutomaton;
    this.startTerm = startTerm == null ? null : BytesRef.deepCopyOf(startTerm);
    states[0] = runAutomaton.getInitialState();
  }

  @Override
  protected BytesRef nextSeekTerm(BytesRef currentTerm) {
    if (currentTerm == null) {
      if (startTerm != null) {
        seekTerm.copyBytes(startTerm);
      }
      // else the empty term, the smallest there is
    }
    return seekTerm;
  }

  @Override
  protected AcceptStatus accept(BytesRef term) {
    if (startTerm != null && startTerm.bytesEquals(term)) {
      return AcceptStatus.NO;
    }
    int depth = Math.min(liveDepth, sharedPrefix(prevTerm, term));
    int state = states[depth];
    prevTerm.copyBytes(term);
    for (; depth < term.length; depth++) {
      state = runAutomaton.step(state, term.bytes[term.offset + depth] & 0xff);
      if (state == -1) {
        liveDepth = depth;
        return nextPrefix(term, depth + 1) ? AcceptStatus.NO_AND_SEEK : AcceptStatus.END;
      }
      if (depth + 1 >= states.length) {
        states = ArrayUtil.grow(states, depth + 2);
      }
      states[depth + 1] = state;
    }
    liveDepth = term.length;
    return runAutomaton.isAccept(state) ? AcceptStatus.YES : AcceptStatus.NO;
  }

  private static int sharedPrefix(BytesRef a, BytesRef b) {
    final int limit = Math.min(a.length, b.length);
    int i = 0;
    while (i < limit && a.bytes[a.offset + i] == b.bytes[b.offset + i]) {
      i++;
    }
    return i;
  }

  /**
   * Sets seekTerm to the smallest term that sorts after every term
   * starting with the first <code>length</code> bytes of
   * <code>term</code>.  Returns false if there is none.
   */
  private boolean nextPrefix(BytesRef term, int length) {
    seekTerm.copyBytes(term);
    for (int i = length - 1; i >= 0; i--) {
      final int b = seekTerm.bytes[i] & 0xff;
      if (b != 0xff) {
        seekTerm.bytes[i] = (byte) (b + 1);
        seekTerm.length = i + 1;
        return true;
      }
    }
    return false;
  }
}
