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

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;

import org.lexindex.util.ArrayUtil;
import org.lexindex.util.BytesRef;

/** Buffers the postings of one field in RAM: for every
 *  term, the documents it occurs in and, per occurrence,
 *  position, offsets and payload.  The buffer is kept
 *  until the segment is written so a failed flush can be
 *  retried.  The same structure holds the per-document
 *  term vectors. */
final class FreqProxTermsWriterPerField {

  final FieldInfo fieldInfo;
  final String fieldName;

  private final Map<BytesRef,PostingList> postings = new HashMap<BytesRef,PostingList>();
  private BytesRef[] sortedTerms;
  private PostingList[] sortedPostings;

  // what the Fields view exposes; set before flushing
  boolean hasFreqs = true;
  boolean hasProx = true;
  boolean hasOffsets = true;
  boolean hasPayloads = false;

  int sumDocFreq;
  long sumTotalTermFreq;
  private int lastDocID = -1;
  int docCount;

  FreqProxTermsWriterPerField(FieldInfo fieldInfo) {
    this.fieldInfo = fieldInfo;
    this.fieldName = fieldInfo.name;
  }

  /** Records one occurrence of {@code term} in {@code docID}. */
  void addOccurrence(BytesRef term, int docID, int position, int startOffset, int endOffset, BytesRef payload) {
    PostingList postingList = postings.get(term);
    if (postingList == null) {
      postingList = new PostingList();
      postings.put(BytesRef.deepCopyOf(term), postingList);
      sortedTerms = null;
    }
    if (postingList.lastDocID != docID) {
      sumDocFreq++;
    }
    if (lastDocID != docID) {
      lastDocID = docID;
      docCount++;
    }
    sumTotalTermFreq++;
    postingList.add(docID, position, startOffset, endOffset, payload);
    if (payload != null && payload.length > 0) {
      hasPayloads = true;
    }
  }

  int numTerms() {
    return postings.size();
  }

  boolean isEmpty() {
    return postings.isEmpty();
  }

  BytesRef[] sortedTerms() {
    sortTerms();
    return sortedTerms;
  }

  PostingList[] sortedPostings() {
    sortTerms();
    return sortedPostings;
  }

  private void sortTerms() {
    if (sortedTerms == null) {
      final Comparator<BytesRef> comp = BytesRef.getUTF8SortedAsUnicodeComparator();
      final BytesRef[] terms = postings.keySet().toArray(new BytesRef[postings.size()]);
      Arrays.sort(terms, comp);
      final PostingList[] lists = new PostingList[terms.length];
      for (int i = 0; i < terms.length; i++) {
        lists[i] = postings.get(terms[i]);
      }
      sortedPostings = lists;
      sortedTerms = terms;
    }
  }

  /** In-memory postings for a single term. */
  static final class PostingList {
    int numDocs;
    int[] docIDs = new int[2];
    int[] freqs = new int[2];
    // index of each document's first occurrence
    int[] posStarts = new int[2];

    int numOccurrences;
    int[] positions = new int[2];
    int[] startOffsets = new int[2];
    int[] endOffsets = new int[2];
    BytesRef[] payloads;

    int lastDocID = -1;

    void add(int docID, int position, int startOffset, int endOffset, BytesRef payload) {
      if (docID != lastDocID) {
        assert docID > lastDocID;
        if (numDocs == docIDs.length) {
          final int newSize = ArrayUtil.oversize(numDocs+1, 4);
          docIDs = ArrayUtil.grow(docIDs, newSize);
          freqs = ArrayUtil.grow(freqs, newSize);
          posStarts = ArrayUtil.grow(posStarts, newSize);
        }
        docIDs[numDocs] = docID;
        freqs[numDocs] = 0;
        posStarts[numDocs] = numOccurrences;
        numDocs++;
        lastDocID = docID;
      }
      freqs[numDocs-1]++;

      if (numOccurrences == positions.length) {
        final int newSize = ArrayUtil.oversize(numOccurrences+1, 4);
        positions = ArrayUtil.grow(positions, newSize);
        startOffsets = ArrayUtil.grow(startOffsets, newSize);
        endOffsets = ArrayUtil.grow(endOffsets, newSize);
        if (payloads != null) {
          payloads = Arrays.copyOf(payloads, newSize);
        }
      }
      positions[numOccurrences] = position;
      startOffsets[numOccurrences] = startOffset;
      endOffsets[numOccurrences] = endOffset;
      if (payload != null && payload.length > 0) {
        if (payloads == null) {
          payloads = new BytesRef[positions.length];
        }
        payloads[numOccurrences] = BytesRef.deepCopyOf(payload);
      }
      numOccurrences++;
    }

    BytesRef payload(int occurrence) {
      return payloads == null ? null : payloads[occurrence];
    }
  }
}
