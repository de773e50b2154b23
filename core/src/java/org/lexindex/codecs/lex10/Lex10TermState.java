package org.lexindex.codecs.lex10;

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

import org.lexindex.index.OrdTermState;
import org.lexindex.index.TermState;

/**
 * Metadata of one term in the Lex10 terms dictionary.  Holds
 * everything needed to pull the term's postings without
 * touching the terms dictionary again, so a TermsEnum can be
 * repositioned from it in constant time.
 */
public final class Lex10TermState extends OrdTermState {
  /** how many docs have this term */
  public int docFreq;
  /** total number of occurrences of this term, or -1 if freqs are omitted */
  public long totalTermFreq;
  /** file pointer of the first doc entry in the .doc file */
  public long docStartFP;
  /** file pointer of the first position in the .pos file */
  public long posStartFP;
  /** offset of the skip data relative to {@link #docStartFP}, or -1 */
  public long skipOffset;

  /** Sole constructor. */
  public Lex10TermState() {
  }

  @Override
  public Lex10TermState clone() {
    Lex10TermState other = new Lex10TermState();
    other.copyFrom(this);
    return other;
  }

  @Override
  public void copyFrom(TermState _other) {
    super.copyFrom(_other);
    Lex10TermState other = (Lex10TermState) _other;
    docFreq = other.docFreq;
    totalTermFreq = other.totalTermFreq;
    docStartFP = other.docStartFP;
    posStartFP = other.posStartFP;
    skipOffset = other.skipOffset;
  }

  @Override
  public String toString() {
    return super.toString() + " docFreq=" + docFreq + " totalTermFreq=" + totalTermFreq
      + " docStartFP=" + docStartFP + " posStartFP=" + posStartFP + " skipOffset=" + skipOffset;
  }
}
