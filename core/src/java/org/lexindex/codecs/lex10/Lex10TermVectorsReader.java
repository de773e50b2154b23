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

import java.io.IOException;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.TreeMap;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.TermVectorsReader;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.DocsAndPositionsEnum;
import org.lexindex.index.DocsEnum;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.Fields;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentInfo;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexInput;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;

import static org.lexindex.codecs.lex10.Lex10TermVectorsFormat.*;

/**
 * Reads term vectors written by {@link Lex10TermVectorsWriter}.  A
 * document's vectors are decoded completely on {@link #get}; each
 * field is exposed as a single document (doc 0) index.
 *
 * @see Lex10TermVectorsFormat
 */
final class Lex10TermVectorsReader extends TermVectorsReader {

  private final FieldInfos fieldInfos;
  private final IndexInput tvx;
  private final IndexInput tvd;
  private final long indexStart;
  private final int numTotalDocs;
  private final boolean isOriginal;

  private Lex10TermVectorsReader(FieldInfos fieldInfos, IndexInput tvx, IndexInput tvd, long indexStart, int numTotalDocs) {
    this.fieldInfos = fieldInfos;
    this.tvx = tvx;
    this.tvd = tvd;
    this.indexStart = indexStart;
    this.numTotalDocs = numTotalDocs;
    this.isOriginal = false;
  }

  Lex10TermVectorsReader(Directory d, SegmentInfo si, FieldInfos fieldInfos) throws IOException {
    final String segment = si.name;
    this.fieldInfos = fieldInfos;
    this.isOriginal = true;
    IndexInput tvx = null;
    IndexInput tvd = null;
    boolean success = false;
    try {
      tvx = d.openInput(IndexFileNames.segmentFileName(segment, "", VECTORS_INDEX_EXTENSION));
      CodecUtil.checkHeader(tvx, CODEC_NAME_INDEX, VERSION_START, VERSION_CURRENT);
      tvd = d.openInput(IndexFileNames.segmentFileName(segment, "", VECTORS_EXTENSION));
      CodecUtil.checkHeader(tvd, CODEC_NAME_DATA, VERSION_START, VERSION_CURRENT);
      indexStart = tvx.getFilePointer();
      numTotalDocs = (int) ((tvx.length() - indexStart - CodecUtil.footerLength()) >> 3);
      if (numTotalDocs != si.getDocCount()) {
        throw new CorruptIndexException("doc counts differ for segment " + segment + ": vectors index shows " + numTotalDocs + " but segmentInfo shows " + si.getDocCount());
      }
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(tvx, tvd);
      }
    }
    this.tvx = tvx;
    this.tvd = tvd;
  }

  @Override
  public Fields get(int docID) throws IOException {
    if (docID < 0 || docID >= numTotalDocs) {
      throw new IllegalArgumentException("docID=" + docID + " is out of bounds [0.." + (numTotalDocs-1) + "]");
    }
    tvx.seek(indexStart + ((long) docID << 3));
    tvd.seek(tvx.readLong());

    final int numFields = tvd.readVInt();
    if (numFields == 0) {
      return null;
    }
    final TreeMap<String,TVTerms> fields = new TreeMap<String,TVTerms>();
    for (int i = 0; i < numFields; i++) {
      final int fieldNumber = tvd.readVInt();
      final FieldInfo fieldInfo = fieldInfos.fieldInfo(fieldNumber);
      if (fieldInfo == null) {
        throw new CorruptIndexException("invalid field number " + fieldNumber + " (resource=" + tvd + ")");
      }
      fields.put(fieldInfo.name, readField());
    }
    return new TVFields(fields);
  }

  private TVTerms readField() throws IOException {
    final byte bits = tvd.readByte();
    final boolean positions = (bits & STORE_POSITIONS) != 0;
    final boolean offsets = (bits & STORE_OFFSETS) != 0;
    final boolean payloads = (bits & STORE_PAYLOADS) != 0;
    final int numTerms = tvd.readVInt();

    final TVTerms terms = new TVTerms(numTerms, positions, offsets, payloads);
    BytesRef lastTerm = new BytesRef();
    for (int t = 0; t < numTerms; t++) {
      final int prefix = tvd.readVInt();
      final int suffix = tvd.readVInt();
      final BytesRef term = new BytesRef(prefix + suffix);
      System.arraycopy(lastTerm.bytes, lastTerm.offset, term.bytes, 0, prefix);
      tvd.readBytes(term.bytes, prefix, suffix);
      term.length = prefix + suffix;
      terms.terms[t] = term;
      lastTerm = term;

      final int freq = tvd.readVInt();
      terms.freqs[t] = freq;
      terms.sumTotalTermFreq += freq;
      if (positions || offsets) {
        final int[] pos = positions ? new int[freq] : null;
        final int[] startOffsets = offsets ? new int[freq] : null;
        final int[] endOffsets = offsets ? new int[freq] : null;
        final BytesRef[] payloadBytes = payloads ? new BytesRef[freq] : null;
        int position = 0;
        int startOffset = 0;
        for (int i = 0; i < freq; i++) {
          if (positions) {
            position += tvd.readVInt();
            pos[i] = position;
            if (payloads) {
              final int length = tvd.readVInt();
              if (length > 0) {
                final BytesRef payload = new BytesRef(length);
                tvd.readBytes(payload.bytes, 0, length);
                payload.length = length;
                payloadBytes[i] = payload;
              }
            }
          }
          if (offsets) {
            startOffset += tvd.readVInt();
            startOffsets[i] = startOffset;
            endOffsets[i] = startOffset + tvd.readVInt();
          }
        }
        terms.positions[t] = pos;
        terms.startOffsets[t] = startOffsets;
        terms.endOffsets[t] = endOffsets;
        terms.payloads[t] = payloadBytes;
      }
    }
    return terms;
  }

  @Override
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(tvx);
    CodecUtil.checksumEntireFile(tvd);
  }

  @Override
  public Lex10TermVectorsReader clone() {
    return new Lex10TermVectorsReader(fieldInfos, tvx.clone(), tvd.clone(), indexStart, numTotalDocs);
  }

  @Override
  public void close() throws IOException {
    if (isOriginal) {
      IOUtils.close(tvx, tvd);
    }
  }

  private static final class TVFields extends Fields {
    private final TreeMap<String,TVTerms> fields;

    TVFields(TreeMap<String,TVTerms> fields) {
      this.fields = fields;
    }

    @Override
    public Iterator<String> iterator() {
      return Collections.unmodifiableSet(fields.keySet()).iterator();
    }

    @Override
    public Terms terms(String field) {
      return fields.get(field);
    }

    @Override
    public int size() {
      return fields.size();
    }
  }

  private static final class TVTerms extends Terms {
    final BytesRef[] terms;
    final int[] freqs;
    final int[][] positions;
    final int[][] startOffsets;
    final int[][] endOffsets;
    final BytesRef[][] payloads;
    final boolean hasPositions;
    final boolean hasOffsets;
    final boolean hasPayloads;
    long sumTotalTermFreq;

    TVTerms(int numTerms, boolean hasPositions, boolean hasOffsets, boolean hasPayloads) {
      terms = new BytesRef[numTerms];
      freqs = new int[numTerms];
      positions = new int[numTerms][];
      startOffsets = new int[numTerms][];
      endOffsets = new int[numTerms][];
      payloads = new BytesRef[numTerms][];
      this.hasPositions = hasPositions;
      this.hasOffsets = hasOffsets;
      this.hasPayloads = hasPayloads;
    }

    @Override
    public TermsEnum iterator(TermsEnum reuse) {
      final TVTermsEnum termsEnum;
      if (reuse instanceof TVTermsEnum && ((TVTermsEnum) reuse).terms == this) {
        termsEnum = (TVTermsEnum) reuse;
      } else {
        termsEnum = new TVTermsEnum(this);
      }
      termsEnum.ord = -1;
      return termsEnum;
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return BytesRef.getUTF8SortedAsUnicodeComparator();
    }

    @Override
    public long size() {
      return terms.length;
    }

    @Override
    public long getSumTotalTermFreq() {
      return sumTotalTermFreq;
    }

    @Override
    public long getSumDocFreq() {
      return terms.length;
    }

    @Override
    public int getDocCount() {
      return 1;
    }

    @Override
    public boolean hasFreqs() {
      return true;
    }

    @Override
    public boolean hasOffsets() {
      return hasOffsets;
    }

    @Override
    public boolean hasPositions() {
      return hasPositions;
    }

    @Override
    public boolean hasPayloads() {
      return hasPayloads;
    }
  }

  private static final class TVTermsEnum extends TermsEnum {
    final TVTerms terms;
    int ord = -1;

    TVTermsEnum(TVTerms terms) {
      this.terms = terms;
    }

    @Override
    public BytesRef next() {
      if (ord + 1 >= terms.terms.length) {
        ord = terms.terms.length;
        return null;
      }
      return terms.terms[++ord];
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return BytesRef.getUTF8SortedAsUnicodeComparator();
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      final Comparator<BytesRef> comp = getComparator();
      int lo = 0;
      int hi = terms.terms.length - 1;
      while (lo <= hi) {
        final int mid = (lo + hi) >>> 1;
        final int cmp = comp.compare(terms.terms[mid], text);
        if (cmp < 0) {
          lo = mid + 1;
        } else if (cmp > 0) {
          hi = mid - 1;
        } else {
          ord = mid;
          return SeekStatus.FOUND;
        }
      }
      ord = lo;
      return lo >= terms.terms.length ? SeekStatus.END : SeekStatus.NOT_FOUND;
    }

    @Override
    public void seekExact(long ord) {
      if (ord < 0 || ord >= terms.terms.length) {
        throw new IllegalArgumentException("ord must be >= 0 and < " + terms.terms.length + " (got ord=" + ord + ")");
      }
      this.ord = (int) ord;
    }

    @Override
    public BytesRef term() {
      return terms.terms[ord];
    }

    @Override
    public long ord() {
      return ord;
    }

    @Override
    public int docFreq() {
      return 1;
    }

    @Override
    public long totalTermFreq() {
      return terms.freqs[ord];
    }

    @Override
    public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) {
      final TVDocsAndPositionsEnum docsEnum = reuse instanceof TVDocsAndPositionsEnum
          ? (TVDocsAndPositionsEnum) reuse : new TVDocsAndPositionsEnum();
      docsEnum.reset(liveDocs, terms, ord);
      return docsEnum;
    }

    @Override
    public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) {
      if (!terms.hasPositions && !terms.hasOffsets) {
        return null;
      }
      final TVDocsAndPositionsEnum docsEnum = reuse instanceof TVDocsAndPositionsEnum
          ? (TVDocsAndPositionsEnum) reuse : new TVDocsAndPositionsEnum();
      docsEnum.reset(liveDocs, terms, ord);
      return docsEnum;
    }
  }

  private static final class TVDocsAndPositionsEnum extends DocsAndPositionsEnum {
    private boolean didNext;
    private int doc = -1;
    private int freq;
    private int[] positions;
    private int[] startOffsets;
    private int[] endOffsets;
    private BytesRef[] payloads;
    private int nextPos;
    private Bits liveDocs;

    void reset(Bits liveDocs, TVTerms terms, int ord) {
      this.liveDocs = liveDocs;
      this.freq = terms.freqs[ord];
      this.positions = terms.positions[ord];
      this.startOffsets = terms.startOffsets[ord];
      this.endOffsets = terms.endOffsets[ord];
      this.payloads = terms.payloads[ord];
      doc = -1;
      didNext = false;
      nextPos = 0;
    }

    @Override
    public int freq() {
      return freq;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      if (!didNext && (liveDocs == null || liveDocs.get(0))) {
        didNext = true;
        return (doc = 0);
      } else {
        return (doc = NO_MORE_DOCS);
      }
    }

    @Override
    public int advance(int target) {
      if (target == 0) {
        return nextDoc();
      }
      return (doc = NO_MORE_DOCS);
    }

    @Override
    public int nextPosition() {
      assert nextPos < freq;
      final int upto = nextPos++;
      return positions == null ? -1 : positions[upto];
    }

    @Override
    public int startOffset() {
      return startOffsets == null ? -1 : startOffsets[nextPos-1];
    }

    @Override
    public int endOffset() {
      return endOffsets == null ? -1 : endOffsets[nextPos-1];
    }

    @Override
    public BytesRef getPayload() {
      return payloads == null ? null : payloads[nextPos-1];
    }
  }
}
