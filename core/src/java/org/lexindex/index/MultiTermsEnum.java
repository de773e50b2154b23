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
import java.util.Arrays;
import java.util.Comparator;

import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.PriorityQueue;

/**
 * Merges the {@link TermsEnum}s of several sub-readers into one, in term
 * order.  A term present in more than one sub-reader is returned once;
 * its postings concatenate those of every sub-reader holding it, each
 * shifted by the start of that sub-reader's slice.
 * <p>
 * Seeking by ord is not supported.
 */
public final class MultiTermsEnum extends TermsEnum {

  /** One sub-reader: its slice of the composite docID space and
   *  its enum, positioned on <code>term</code>. */
  static final class Sub {
    final int index;
    final ReaderSlice slice;
    final TermsEnum terms;
    // null once exhausted or after a seek that missed
    BytesRef term;

    Sub(int index, ReaderSlice slice, TermsEnum terms) {
      this.index = index;
      this.slice = slice;
      this.terms = terms;
    }

    @Override
    public String toString() {
      return slice + ":" + terms;
    }
  }

  private final int numSlices;
  private final Sub[] subs;
  private final Comparator<BytesRef> termComp;
  private final SubQueue queue;

  // subs positioned on the current term
  private final Sub[] matches;
  private int numMatches;
  private BytesRef current;
  // after seekExact only the matching subs moved; the rest must seek before next()
  private boolean realign;

  private final MultiDocsEnum.EnumWithSlice[] subDocs;
  private final MultiDocsAndPositionsEnum.EnumWithSlice[] subPostings;

  /**
   * Returns an enum over the union of <code>perSlice</code>, which holds
   * one freshly created enum per slice (null where a sub-reader has no
   * terms), or {@link TermsEnum#EMPTY} if none of them has a term.
   *
   * @throws IllegalStateException if the sub enums sort terms differently
   */
  public static TermsEnum merge(ReaderSlice[] slices, TermsEnum[] perSlice) throws IOException {
    assert slices.length == perSlice.length;
    Comparator<BytesRef> termComp = null;
    int count = 0;
    for(int i=0;i<perSlice.length;i++) {
      if (perSlice[i] == null) {
        continue;
      }
      count++;
      final Comparator<BytesRef> subComp = perSlice[i].getComparator();
      if (termComp == null) {
        termComp = subComp;
      } else if (subComp != null && !subComp.equals(termComp)) {
        throw new IllegalStateException("sub-readers have different BytesRef.Comparators: " + subComp + " vs " + termComp + "; cannot merge");
      }
    }
    if (count == 0) {
      return TermsEnum.EMPTY;
    }
    final MultiTermsEnum merged = new MultiTermsEnum(slices, perSlice, count, termComp);
    return merged.queue.size() == 0 ? TermsEnum.EMPTY : merged;
  }

  private MultiTermsEnum(ReaderSlice[] slices, TermsEnum[] perSlice, int count, Comparator<BytesRef> termComp) throws IOException {
    this.numSlices = slices.length;
    this.termComp = termComp;
    subs = new Sub[count];
    matches = new Sub[count];
    queue = new SubQueue(count, termComp);
    subDocs = new MultiDocsEnum.EnumWithSlice[count];
    subPostings = new MultiDocsAndPositionsEnum.EnumWithSlice[count];
    int upto = 0;
    for(int i=0;i<perSlice.length;i++) {
      if (perSlice[i] != null) {
        final Sub sub = new Sub(i, slices[i], perSlice[i]);
        sub.term = sub.terms.next();
        if (sub.term != null) {
          queue.add(sub);
        }
        subs[upto] = sub;
        subDocs[upto] = new MultiDocsEnum.EnumWithSlice();
        subPostings[upto] = new MultiDocsAndPositionsEnum.EnumWithSlice();
        upto++;
      }
    }
  }

  @Override
  public BytesRef term() {
    return current;
  }

  @Override
  public Comparator<BytesRef> getComparator() {
    return termComp;
  }

  @Override
  public boolean seekExact(BytesRef target) throws IOException {
    queue.clear();
    numMatches = 0;
    for (Sub sub : subs) {
      if (sub.terms.seekExact(target)) {
        sub.term = sub.terms.term();
        matches[numMatches++] = sub;
      } else {
        sub.term = null;
      }
    }
    if (numMatches > 0) {
      realign = true;
      current = matches[0].term;
      return true;
    }
    // unpositioned: next() returns null
    realign = false;
    current = null;
    return false;
  }

  @Override
  public SeekStatus seekCeil(BytesRef target) throws IOException {
    queue.clear();
    numMatches = 0;
    realign = false;
    for (Sub sub : subs) {
      final SeekStatus status = sub.terms.seekCeil(target);
      if (status == SeekStatus.END) {
        sub.term = null;
      } else {
        sub.term = sub.terms.term();
        if (status == SeekStatus.FOUND) {
          matches[numMatches++] = sub;
        } else {
          queue.add(sub);
        }
      }
    }
    if (numMatches > 0) {
      current = matches[0].term;
      return SeekStatus.FOUND;
    }
    if (queue.size() > 0) {
      popMatches();
      return SeekStatus.NOT_FOUND;
    }
    current = null;
    return SeekStatus.END;
  }

  @Override
  public void seekExact(long ord) {
    throw new UnsupportedOperationException();
  }

  @Override
  public long ord() {
    throw new UnsupportedOperationException();
  }

  @Override
  public BytesRef next() throws IOException {
    if (realign) {
      final SeekStatus status = seekCeil(BytesRef.deepCopyOf(current));
      assert status == SeekStatus.FOUND;
    }
    for(int i=0;i<numMatches;i++) {
      final Sub sub = matches[i];
      sub.term = sub.terms.next();
      if (sub.term != null) {
        queue.add(sub);
      }
    }
    numMatches = 0;
    if (queue.size() == 0) {
      current = null;
    } else {
      popMatches();
    }
    return current;
  }

  /** Moves every sub on the smallest queued term into matches. */
  private void popMatches() {
    assert numMatches == 0;
    do {
      matches[numMatches++] = queue.pop();
    } while (queue.size() > 0 && queue.top().term.bytesEquals(matches[0].term));
    current = matches[0].term;
  }

  @Override
  public int docFreq() throws IOException {
    int sum = 0;
    for(int i=0;i<numMatches;i++) {
      sum += matches[i].terms.docFreq();
    }
    return sum;
  }

  @Override
  public long totalTermFreq() throws IOException {
    long sum = 0;
    for(int i=0;i<numMatches;i++) {
      final long v = matches[i].terms.totalTermFreq();
      if (v == -1) {
        return -1;
      }
      sum += v;
    }
    return sum;
  }

  /** Live docs of one slice, taken straight from the sub-reader when
   *  <code>liveDocs</code> is the composite reader's own. */
  private static Bits sliceLiveDocs(Bits liveDocs, ReaderSlice slice) {
    if (liveDocs == null) {
      return null;
    }
    if (liveDocs instanceof MultiBits) {
      final MultiBits.SubResult sub = ((MultiBits) liveDocs).getMatchingSub(slice);
      if (sub.matches) {
        return sub.result;
      }
    }
    return new BitsSlice(liveDocs, slice);
  }

  @Override
  public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) throws IOException {
    MultiDocsEnum docsEnum;
    if (reuse instanceof MultiDocsEnum && ((MultiDocsEnum) reuse).canReuse(this)) {
      docsEnum = (MultiDocsEnum) reuse;
    } else {
      docsEnum = new MultiDocsEnum(this, numSlices);
    }
    int upto = 0;
    for(int i=0;i<numMatches;i++) {
      final Sub sub = matches[i];
      final DocsEnum subEnum = sub.terms.docs(sliceLiveDocs(liveDocs, sub.slice), docsEnum.subDocsEnum[sub.index], flags);
      assert subEnum != null : "sub " + sub + " cannot provide a DocsEnum";
      docsEnum.subDocsEnum[sub.index] = subEnum;
      subDocs[upto].docsEnum = subEnum;
      subDocs[upto].slice = sub.slice;
      upto++;
    }
    return upto == 0 ? null : docsEnum.reset(subDocs, upto);
  }

  @Override
  public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) throws IOException {
    MultiDocsAndPositionsEnum postingsEnum;
    if (reuse instanceof MultiDocsAndPositionsEnum && ((MultiDocsAndPositionsEnum) reuse).canReuse(this)) {
      postingsEnum = (MultiDocsAndPositionsEnum) reuse;
    } else {
      postingsEnum = new MultiDocsAndPositionsEnum(this, numSlices);
    }
    int upto = 0;
    for(int i=0;i<numMatches;i++) {
      final Sub sub = matches[i];
      final DocsAndPositionsEnum subEnum = sub.terms.docsAndPositions(sliceLiveDocs(liveDocs, sub.slice),
                                                                      postingsEnum.subDocsAndPositionsEnum[sub.index], flags);
      if (subEnum == null) {
        // a sub without positions: no merged positions either
        return null;
      }
      postingsEnum.subDocsAndPositionsEnum[sub.index] = subEnum;
      subPostings[upto].docsAndPositionsEnum = subEnum;
      subPostings[upto].slice = sub.slice;
      upto++;
    }
    return upto == 0 ? null : postingsEnum.reset(subPostings, upto);
  }

  private static final class SubQueue extends PriorityQueue<Sub> {
    private final Comparator<BytesRef> termComp;

    SubQueue(int size, Comparator<BytesRef> termComp) {
      super(size);
      this.termComp = termComp;
    }

    // equal terms come out in slice order
    @Override
    protected boolean lessThan(Sub a, Sub b) {
      final int cmp = termComp.compare(a.term, b.term);
      return cmp != 0 ? cmp < 0 : a.slice.start < b.slice.start;
    }
  }

  @Override
  public String toString() {
    return "MultiTermsEnum(" + Arrays.toString(subs) + ")";
  }
}
