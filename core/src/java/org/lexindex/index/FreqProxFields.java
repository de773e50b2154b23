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
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;

/** Implements {@link Fields} over the postings buffered in
 *  RAM by {@link FreqProxTermsWriterPerField}, so the codec
 *  consumes freshly indexed documents through the same API
 *  it uses when merging.  Also used to hand a single
 *  document's term vectors to the codec. */
final class FreqProxFields extends Fields {
  private final Map<String,FreqProxTermsWriterPerField> fields = new TreeMap<String,FreqProxTermsWriterPerField>();

  FreqProxFields(Iterable<FreqProxTermsWriterPerField> fieldList) {
    for (FreqProxTermsWriterPerField field : fieldList) {
      if (!field.isEmpty()) {
        fields.put(field.fieldName, field);
      }
    }
  }

  @Override
  public Iterator<String> iterator() {
    return Collections.unmodifiableSet(fields.keySet()).iterator();
  }

  @Override
  public Terms terms(String field) {
    FreqProxTermsWriterPerField perField = fields.get(field);
    return perField == null ? null : new FreqProxTerms(perField);
  }

  @Override
  public int size() {
    return fields.size();
  }

  private static class FreqProxTerms extends Terms {
    final FreqProxTermsWriterPerField terms;

    public FreqProxTerms(FreqProxTermsWriterPerField terms) {
      this.terms = terms;
    }

    @Override
    public TermsEnum iterator(TermsEnum reuse) {
      FreqProxTermsEnum termsEnum;
      if (reuse instanceof FreqProxTermsEnum && ((FreqProxTermsEnum) reuse).terms == this.terms) {
        termsEnum = (FreqProxTermsEnum) reuse;
      } else {
        termsEnum = new FreqProxTermsEnum(terms);
      }
      termsEnum.reset();
      return termsEnum;
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return BytesRef.getUTF8SortedAsUnicodeComparator();
    }

    @Override
    public long size() {
      return terms.numTerms();
    }

    @Override
    public long getSumTotalTermFreq() {
      return terms.hasFreqs ? terms.sumTotalTermFreq : -1;
    }

    @Override
    public long getSumDocFreq() {
      return terms.sumDocFreq;
    }

    @Override
    public int getDocCount() {
      return terms.docCount;
    }
  
    @Override
    public boolean hasFreqs() {
      return terms.hasFreqs;
    }

    @Override
    public boolean hasOffsets() {
      return terms.hasOffsets;
    }
  
    @Override
    public boolean hasPositions() {
      return terms.hasProx;
    }
  
    @Override
    public boolean hasPayloads() {
      return terms.hasPayloads;
    }
  }

  private static class FreqProxTermsEnum extends TermsEnum {
    final FreqProxTermsWriterPerField terms;
    final BytesRef[] sortedTerms;
    final FreqProxTermsWriterPerField.PostingList[] postings;
    final int numTerms;
    int ord;

    public FreqProxTermsEnum(FreqProxTermsWriterPerField terms) {
      this.terms = terms;
      this.sortedTerms = terms.sortedTerms();
      this.postings = terms.sortedPostings();
      this.numTerms = sortedTerms.length;
    }

    public void reset() {
      ord = -1;
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return BytesRef.getUTF8SortedAsUnicodeComparator();
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      // binary search:
      int lo = 0;
      int hi = numTerms - 1;
      final Comparator<BytesRef> comp = getComparator();
      while (hi >= lo) {
        int mid = (lo + hi) >>> 1;
        int cmp = comp.compare(sortedTerms[mid], text);
        if (cmp < 0) {
          lo = mid + 1;
        } else if (cmp > 0) {
          hi = mid - 1;
        } else {
          // found:
          ord = mid;
          return SeekStatus.FOUND;
        }
      }

      // not found:
      ord = lo;
      if (ord >= numTerms) {
        return SeekStatus.END;
      } else {
        return SeekStatus.NOT_FOUND;
      }
    }

    @Override
    public void seekExact(long ord) {
      if (ord < 0 || ord >= numTerms) {
        throw new IllegalArgumentException("ord must be >= 0 and < " + numTerms + " (got ord=" + ord + ")");
      }
      this.ord = (int) ord;
    }

    @Override
    public void seekExact(BytesRef term, TermState state) {
      assert state instanceof OrdTermState;
      seekExact(((OrdTermState) state).ord);
      assert sortedTerms[this.ord].bytesEquals(term);
    }

    @Override
    public TermState termState() {
      final OrdTermState state = new OrdTermState();
      state.ord = ord;
      return state;
    }

    @Override
    public BytesRef next() {
      ord++;
      if (ord >= numTerms) {
        ord = numTerms;
        return null;
      } else {
        return sortedTerms[ord];
      }
    }

    @Override
    public BytesRef term() {
      return sortedTerms[ord];
    }

    @Override
    public int docFreq() {
      return postings[ord].numDocs;
    }

    @Override
    public long totalTermFreq() {
      if (!terms.hasFreqs) {
        return -1;
      }
      return postings[ord].numOccurrences;
    }

    @Override
    public long ord() {
      return ord;
    }

    @Override
    public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) {
      FreqProxDocsEnum docsEnum;

      if (reuse instanceof FreqProxDocsEnum) {
        docsEnum = (FreqProxDocsEnum) reuse;
        if (docsEnum.terms != this.terms) {
          docsEnum = new FreqProxDocsEnum(terms);
        }
      } else {
        docsEnum = new FreqProxDocsEnum(terms);
      }

      docsEnum.reset(postings[ord], liveDocs);
      return docsEnum;
    }

    @Override
    public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) {
      if (!terms.hasProx && !terms.hasOffsets) {
        // Caller wants positions but we didn't index them;
        // don't lie:
        return null;
      }

      FreqProxDocsAndPositionsEnum posEnum;

      if (reuse instanceof FreqProxDocsAndPositionsEnum) {
        posEnum = (FreqProxDocsAndPositionsEnum) reuse;
        if (posEnum.terms != this.terms) {
          posEnum = new FreqProxDocsAndPositionsEnum(terms);
        }
      } else {
        posEnum = new FreqProxDocsAndPositionsEnum(terms);
      }

      posEnum.reset(postings[ord], liveDocs);
      return posEnum;
    }
  }

  private static class FreqProxDocsEnum extends DocsEnum {

    final FreqProxTermsWriterPerField terms;
    FreqProxTermsWriterPerField.PostingList postings;
    Bits liveDocs;
    int upto;
    int docID;

    public FreqProxDocsEnum(FreqProxTermsWriterPerField terms) {
      this.terms = terms;
    }

    public void reset(FreqProxTermsWriterPerField.PostingList postings, Bits liveDocs) {
      this.postings = postings;
      this.liveDocs = liveDocs;
      upto = -1;
      docID = -1;
    }

    @Override
    public int docID() {
      return docID;
    }

    @Override
    public int freq() {
      // Don't lie here ... don't want codecs writings lots
      // of wasted 1s into the index:
      if (!terms.hasFreqs) {
        return 1;
      }
      return postings.freqs[upto];
    }

    @Override
    public int nextDoc() {
      while (true) {
        upto++;
        if (upto >= postings.numDocs) {
          upto = postings.numDocs;
          return docID = NO_MORE_DOCS;
        }
        final int doc = postings.docIDs[upto];
        if (liveDocs == null || liveDocs.get(doc)) {
          return docID = doc;
        }
      }
    }

    @Override
    public int advance(int target) throws IOException {
      return slowAdvance(target);
    }
  }

  private static class FreqProxDocsAndPositionsEnum extends DocsAndPositionsEnum {

    final FreqProxTermsWriterPerField terms;
    FreqProxTermsWriterPerField.PostingList postings;
    Bits liveDocs;
    int upto;
    int docID;
    int posUpto;
    int posEnd;
    int occurrence;

    public FreqProxDocsAndPositionsEnum(FreqProxTermsWriterPerField terms) {
      this.terms = terms;
    }

    public void reset(FreqProxTermsWriterPerField.PostingList postings, Bits liveDocs) {
      this.postings = postings;
      this.liveDocs = liveDocs;
      upto = -1;
      docID = -1;
      posUpto = posEnd = 0;
      occurrence = -1;
    }

    @Override
    public int docID() {
      return docID;
    }

    @Override
    public int freq() {
      return postings.freqs[upto];
    }

    @Override
    public int nextDoc() {
      while (true) {
        upto++;
        if (upto >= postings.numDocs) {
          upto = postings.numDocs;
          posUpto = posEnd = 0;
          occurrence = -1;
          return docID = NO_MORE_DOCS;
        }
        final int doc = postings.docIDs[upto];
        if (liveDocs == null || liveDocs.get(doc)) {
          posUpto = postings.posStarts[upto];
          posEnd = posUpto + postings.freqs[upto];
          occurrence = -1;
          return docID = doc;
        }
      }
    }

    @Override
    public int advance(int target) throws IOException {
      return slowAdvance(target);
    }

    @Override
    public int nextPosition() {
      assert posUpto < posEnd;
      occurrence = posUpto++;
      return postings.positions[occurrence];
    }

    @Override
    public int startOffset() {
      if (!terms.hasOffsets) {
        return -1;
      }
      return postings.startOffsets[occurrence];
    }

    @Override
    public int endOffset() {
      if (!terms.hasOffsets) {
        return -1;
      }
      return postings.endOffsets[occurrence];
    }

    @Override
    public BytesRef getPayload() {
      if (!terms.hasPayloads) {
        return null;
      }
      return postings.payload(occurrence);
    }
  }
}
