package org.lexindex.analysis;

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

import org.lexindex.util.BytesRef;

/** A single token replayed by {@link CannedTokenStream}. */
public final class Token {
  final String term;
  final int startOffset;
  final int endOffset;
  int positionIncrement = 1;
  BytesRef payload;

  public Token(String term, int startOffset, int endOffset) {
    this.term = term;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public Token(String term, int positionIncrement, int startOffset, int endOffset) {
    this(term, startOffset, endOffset);
    this.positionIncrement = positionIncrement;
  }

  public void setPayload(BytesRef payload) {
    this.payload = payload;
  }

  public void setPositionIncrement(int positionIncrement) {
    this.positionIncrement = positionIncrement;
  }

  @Override
  public String toString() {
    return "(" + term + "," + startOffset + "," + endOffset + ",posInc=" + positionIncrement + ")";
  }
}
