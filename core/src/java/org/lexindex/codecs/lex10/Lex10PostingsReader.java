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
import org.lexindex.codecs.FieldsProducer;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.DocsAndPositionsEnum;
import org.lexindex.index.DocsEnum;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentReadState;
import org.lexindex.index.TermState;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.IndexInput;
import org.lexindex.util.ArrayUtil;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;
import org.lexindex.util.automaton.ByteRunAutomaton;
import org.lexindex.util.automaton.CompiledAutomaton;

/**
 * Reads the files written by {@link Lex10PostingsWriter}.  The terms
 * index is held in RAM; blocks of the terms dictionary are decoded on
 * demand by each {@link TermsEnum}.
 *
 * @see Lex10PostingsFormat
 */
final class Lex10PostingsReader extends FieldsProducer {

  private final IndexInput termsIn;
  private final IndexInput docIn;
  private final IndexInput posIn;

  private final TreeMap<String,FieldReader> fields = new TreeMap<String,FieldReader>();

  private final String segment;

  Lex10PostingsReader(SegmentReadState state) throws IOException {
    segment = state.segmentInfo.name;
    IndexInput termsIn = null;
    IndexInput docIn = null;
    IndexInput posIn = null;
    boolean success = false;
    try {
      termsIn = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.TERMS_EXTENSION));
      CodecUtil.checkHeader(termsIn, Lex10PostingsFormat.TERMS_CODEC, Lex10PostingsFormat.VERSION_START, Lex10PostingsFormat.VERSION_CURRENT);
      docIn = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.DOC_EXTENSION));
      CodecUtil.checkHeader(docIn, Lex10PostingsFormat.DOC_CODEC, Lex10PostingsFormat.VERSION_START, Lex10PostingsFormat.VERSION_CURRENT);
      if (state.fieldInfos.hasProx()) {
        posIn = state.directory.openInput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.POS_EXTENSION));
        CodecUtil.checkHeader(posIn, Lex10PostingsFormat.POS_CODEC, Lex10PostingsFormat.VERSION_START, Lex10PostingsFormat.VERSION_CURRENT);
      }

      final String indexFile = IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.TERMS_INDEX_EXTENSION);
      final ChecksumIndexInput indexIn = new ChecksumIndexInput(state.directory.openInput(indexFile));
      try {
        CodecUtil.checkHeader(indexIn, Lex10PostingsFormat.TERMS_INDEX_CODEC, Lex10PostingsFormat.VERSION_START, Lex10PostingsFormat.VERSION_CURRENT);
        final int numFields = indexIn.readVInt();
        if (numFields < 0) {
          throw new CorruptIndexException("invalid numFields: " + numFields + " (resource=" + indexIn + ")");
        }
        for (int i = 0; i < numFields; i++) {
          final int fieldNumber = indexIn.readVInt();
          final FieldInfo fieldInfo = state.fieldInfos.fieldInfo(fieldNumber);
          if (fieldInfo == null) {
            throw new CorruptIndexException("invalid field number: " + fieldNumber + " (resource=" + indexIn + ")");
          }
          final long numTerms = indexIn.readVLong();
          final long sumTotalTermFreq = fieldInfo.getIndexOptions() == IndexOptions.DOCS_ONLY ? -1 : indexIn.readVLong();
          final long sumDocFreq = indexIn.readVLong();
          final int docCount = indexIn.readVInt();
          final int numBlocks = indexIn.readVInt();
          if (numTerms <= 0 || numBlocks != (int) ((numTerms + Lex10PostingsFormat.BLOCK_SIZE - 1) / Lex10PostingsFormat.BLOCK_SIZE)) {
            throw new CorruptIndexException("field=" + fieldInfo.name + ": numTerms=" + numTerms + " does not match numBlocks=" + numBlocks + " (resource=" + indexIn + ")");
          }
          if (docCount < 0 || docCount > state.segmentInfo.getDocCount()) {
            throw new CorruptIndexException("invalid docCount: " + docCount + " maxDoc: " + state.segmentInfo.getDocCount() + " (resource=" + indexIn + ")");
          }
          final BytesRef[] blockFirstTerms = new BytesRef[numBlocks];
          final long[] blockFPs = new long[numBlocks];
          long fp = 0;
          for (int b = 0; b < numBlocks; b++) {
            final int length = indexIn.readVInt();
            final BytesRef first = new BytesRef(length);
            indexIn.readBytes(first.bytes, 0, length);
            first.length = length;
            blockFirstTerms[b] = first;
            fp += indexIn.readVLong();
            blockFPs[b] = fp;
          }
          final FieldReader previous = fields.put(fieldInfo.name, new FieldReader(fieldInfo, numTerms, sumTotalTermFreq, sumDocFreq, docCount, blockFirstTerms, blockFPs));
          if (previous != null) {
            throw new CorruptIndexException("duplicate field: " + fieldInfo.name + " (resource=" + indexIn + ")");
          }
        }
        CodecUtil.checkFooter(indexIn);
      } finally {
        indexIn.close();
      }
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(termsIn, docIn, posIn);
      }
    }
    this.termsIn = termsIn;
    this.docIn = docIn;
    this.posIn = posIn;
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

  @Override
  public void close() throws IOException {
    try {
      IOUtils.close(termsIn, docIn, posIn);
    } finally {
      fields.clear();
    }
  }

  @Override
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(termsIn);
    CodecUtil.checksumEntireFile(docIn);
    if (posIn != null) {
      CodecUtil.checksumEntireFile(posIn);
    }
  }

  @Override
  public String toString() {
    return "Lex10PostingsReader(segment=" + segment + " fields=" + fields.size() + ")";
  }

  final class FieldReader extends Terms {
    final FieldInfo fieldInfo;
    final long numTerms;
    final long sumTotalTermFreq;
    final long sumDocFreq;
    final int docCount;
    final BytesRef[] blockFirstTerms;
    final long[] blockFPs;
    final boolean hasFreqs;
    final boolean hasPositions;
    final boolean hasOffsets;
    final boolean hasPayloads;

    FieldReader(FieldInfo fieldInfo, long numTerms, long sumTotalTermFreq, long sumDocFreq, int docCount,
                BytesRef[] blockFirstTerms, long[] blockFPs) {
      this.fieldInfo = fieldInfo;
      this.numTerms = numTerms;
      this.sumTotalTermFreq = sumTotalTermFreq;
      this.sumDocFreq = sumDocFreq;
      this.docCount = docCount;
      this.blockFirstTerms = blockFirstTerms;
      this.blockFPs = blockFPs;
      final IndexOptions indexOptions = fieldInfo.getIndexOptions();
      hasFreqs = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
      hasPositions = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
      hasOffsets = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
      hasPayloads = fieldInfo.hasPayloads();
    }

    @Override
    public TermsEnum iterator(TermsEnum reuse) {
      if (reuse instanceof SegmentTermsEnum && ((SegmentTermsEnum) reuse).field == this) {
        final SegmentTermsEnum termsEnum = (SegmentTermsEnum) reuse;
        termsEnum.reset();
        return termsEnum;
      }
      return new SegmentTermsEnum(this);
    }

    @Override
    public TermsEnum intersect(CompiledAutomaton compiled, BytesRef startTerm) {
      if (compiled.type == CompiledAutomaton.AUTOMATON_TYPE.NONE) {
        return TermsEnum.EMPTY;
      }
      return new IntersectTermsEnum(this, compiled, startTerm);
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return BytesRef.getUTF8SortedAsUnicodeComparator();
    }

    @Override
    public long size() {
      return numTerms;
    }

    @Override
    public long getSumTotalTermFreq() {
      return sumTotalTermFreq;
    }

    @Override
    public long getSumDocFreq() {
      return sumDocFreq;
    }

    @Override
    public int getDocCount() {
      return docCount;
    }

    @Override
    public boolean hasFreqs() {
      return hasFreqs;
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

    /** Index of the last block whose first term is &lt;= target, or -1. */
    int findBlock(BytesRef target) {
      final Comparator<BytesRef> comp = getComparator();
      int lo = 0;
      int hi = blockFirstTerms.length - 1;
      while (lo <= hi) {
        final int mid = (lo + hi) >>> 1;
        final int cmp = comp.compare(blockFirstTerms[mid], target);
        if (cmp < 0) {
          lo = mid + 1;
        } else if (cmp > 0) {
          hi = mid - 1;
        } else {
          return mid;
        }
      }
      return hi;
    }
  }

  /**
   * Iterates the terms of one field.  The current block is decoded
   * completely into parallel arrays; seeking by term binary searches
   * the in-RAM index and scans one block.
   */
  final class SegmentTermsEnum extends TermsEnum {
    final FieldReader field;
    private final IndexInput in;
    private final Comparator<BytesRef> comparator = BytesRef.getUTF8SortedAsUnicodeComparator();

    private final BytesRef term = new BytesRef();
    private final Lex10TermState state = new Lex10TermState();

    // decoded block
    private int blockIndex = -1;
    private int blockCount;
    private final BytesRef[] blockTerms = new BytesRef[Lex10PostingsFormat.BLOCK_SIZE];
    private final Lex10TermState[] blockStates = new Lex10TermState[Lex10PostingsFormat.BLOCK_SIZE];
    // bytes each term shares with the one before it
    private final int[] blockPrefixes = new int[Lex10PostingsFormat.BLOCK_SIZE];

    // -1 before the first term, numTerms once exhausted
    private long ord;

    SegmentTermsEnum(FieldReader field) {
      this.field = field;
      this.in = termsIn.clone();
      for (int i = 0; i < blockTerms.length; i++) {
        blockTerms[i] = new BytesRef();
        blockStates[i] = new Lex10TermState();
      }
      reset();
    }

    void reset() {
      ord = -1;
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return comparator;
    }

    private void loadBlock(int block) throws IOException {
      in.seek(field.blockFPs[block]);
      final int count = in.readVInt();
      if (count <= 0 || count > Lex10PostingsFormat.BLOCK_SIZE) {
        throw new CorruptIndexException("invalid block term count: " + count + " (resource=" + in + ")");
      }
      in.readVInt(); // block length in bytes
      long docFP = 0;
      long posFP = 0;
      final long baseOrd = (long) block * Lex10PostingsFormat.BLOCK_SIZE;
      for (int i = 0; i < count; i++) {
        final BytesRef t = blockTerms[i];
        final int prefix = in.readVInt();
        final int suffix = in.readVInt();
        final int length = prefix + suffix;
        if (i == 0 ? prefix != 0 : prefix > blockTerms[i-1].length) {
          throw new CorruptIndexException("invalid term prefix: " + prefix + " (resource=" + in + ")");
        }
        if (t.bytes.length < length) {
          t.bytes = ArrayUtil.grow(t.bytes, length);
        }
        if (prefix > 0) {
          System.arraycopy(blockTerms[i-1].bytes, 0, t.bytes, 0, prefix);
        }
        in.readBytes(t.bytes, prefix, suffix);
        t.offset = 0;
        t.length = length;
        blockPrefixes[i] = prefix;

        final Lex10TermState s = blockStates[i];
        s.ord = baseOrd + i;
        s.docFreq = in.readVInt();
        s.totalTermFreq = field.hasFreqs ? s.docFreq + in.readVLong() : -1;
        docFP += in.readVLong();
        s.docStartFP = docFP;
        if (field.hasPositions) {
          posFP += in.readVLong();
          s.posStartFP = posFP;
        } else {
          s.posStartFP = 0;
        }
        s.skipOffset = s.docFreq > Lex10PostingsFormat.SKIP_INTERVAL ? in.readVLong() : -1;
      }
      blockIndex = block;
      blockCount = count;
    }

    private void position(long newOrd) throws IOException {
      final int block = (int) (newOrd / Lex10PostingsFormat.BLOCK_SIZE);
      if (block != blockIndex) {
        loadBlock(block);
      }
      final int upto = (int) (newOrd % Lex10PostingsFormat.BLOCK_SIZE);
      assert upto < blockCount;
      term.copyBytes(blockTerms[upto]);
      state.copyFrom(blockStates[upto]);
      ord = newOrd;
    }

    @Override
    public BytesRef next() throws IOException {
      if (ord >= field.numTerms - 1) {
        ord = field.numTerms;
        return null;
      }
      position(ord + 1);
      return term;
    }

    @Override
    public boolean seekExact(BytesRef target) throws IOException {
      return seekCeil(target) == SeekStatus.FOUND;
    }

    @Override
    public SeekStatus seekCeil(BytesRef target) throws IOException {
      if (ord >= 0 && ord < field.numTerms && term.bytesEquals(target)) {
        return SeekStatus.FOUND;
      }
      int block = field.findBlock(target);
      if (block < 0) {
        // target sorts before the first term
        position(0);
        return SeekStatus.NOT_FOUND;
      }
      if (block != blockIndex) {
        loadBlock(block);
      }
      final long baseOrd = (long) block * Lex10PostingsFormat.BLOCK_SIZE;
      for (int i = 0; i < blockCount; i++) {
        final int cmp = comparator.compare(blockTerms[i], target);
        if (cmp >= 0) {
          position(baseOrd + i);
          return cmp == 0 ? SeekStatus.FOUND : SeekStatus.NOT_FOUND;
        }
      }
      final long nextOrd = baseOrd + blockCount;
      if (nextOrd >= field.numTerms) {
        ord = field.numTerms;
        return SeekStatus.END;
      }
      position(nextOrd);
      return SeekStatus.NOT_FOUND;
    }

    @Override
    public void seekExact(long targetOrd) throws IOException {
      if (targetOrd < 0 || targetOrd >= field.numTerms) {
        throw new IllegalArgumentException("ord must be >= 0 and < " + field.numTerms + " (got ord=" + targetOrd + ")");
      }
      position(targetOrd);
    }

    @Override
    public void seekExact(BytesRef target, TermState otherState) {
      assert otherState instanceof Lex10TermState;
      state.copyFrom(otherState);
      term.copyBytes(target);
      ord = state.ord;
    }

    @Override
    public TermState termState() {
      return state.clone();
    }

    @Override
    public BytesRef term() {
      return term;
    }

    @Override
    public long ord() {
      return ord;
    }

    @Override
    public int docFreq() {
      return state.docFreq;
    }

    @Override
    public long totalTermFreq() {
      return state.totalTermFreq;
    }

    @Override
    public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) throws IOException {
      BlockDocsEnum docsEnum;
      if (reuse instanceof BlockDocsEnum && ((BlockDocsEnum) reuse).canReuse(docIn)) {
        docsEnum = (BlockDocsEnum) reuse;
      } else {
        docsEnum = new BlockDocsEnum();
      }
      return docsEnum.reset(liveDocs, state, field.hasFreqs);
    }

    @Override
    public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) throws IOException {
      if (!field.hasPositions) {
        return null;
      }
      BlockDocsAndPositionsEnum posEnum;
      if (reuse instanceof BlockDocsAndPositionsEnum && ((BlockDocsAndPositionsEnum) reuse).canReuse(docIn)) {
        posEnum = (BlockDocsAndPositionsEnum) reuse;
      } else {
        posEnum = new BlockDocsAndPositionsEnum();
      }
      return posEnum.reset(liveDocs, state, field.hasOffsets, field.hasPayloads);
    }
  }

  /**
   * Intersects the terms of one field with an automaton.  A block is
   * passed over without being read when the prefix its first term
   * shares with the next block's first term already leads the
   * automaton to a dead state.  Inside a block the automaton only
   * steps over the bytes a term does not share with the previous one.
   */
  final class IntersectTermsEnum extends TermsEnum {
    private final FieldReader field;
    private final SegmentTermsEnum blocks;
    private final ByteRunAutomaton runAutomaton;

    // states[d] is the state reached after the first d bytes of the
    // last term the automaton stepped over
    private int[] states = new int[16];
    // how many leading bytes of that term reached a live state
    private int liveDepth;

    private int block;
    private int upto = -1;
    private long ord = -1;
    // only terms after this one are returned; null once passed
    private BytesRef startTerm;

    // blocks passed over without being read
    int blocksSkipped;

    IntersectTermsEnum(FieldReader field, CompiledAutomaton compiled, BytesRef startTerm) {
      this.field = field;
      this.blocks = new SegmentTermsEnum(field);
      this.runAutomaton = compiled.runAutomaton;
      states[0] = runAutomaton.getInitialState();
      if (startTerm != null) {
        this.startTerm = BytesRef.deepCopyOf(startTerm);
        block = Math.max(0, field.findBlock(startTerm));
      }
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return blocks.getComparator();
    }

    @Override
    public BytesRef next() throws IOException {
      final int numBlocks = field.blockFPs.length;
      while (block < numBlocks) {
        if (upto == -1) {
          if (!blockMayMatch(block)) {
            blocksSkipped++;
            block++;
            continue;
          }
          blocks.loadBlock(block);
          liveDepth = 0;
        }
        upto++;
        if (upto >= blocks.blockCount) {
          block++;
          upto = -1;
          continue;
        }
        final BytesRef candidate = blocks.blockTerms[upto];
        final int shared = upto == 0 ? 0 : blocks.blockPrefixes[upto];
        if (startTerm != null) {
          if (blocks.getComparator().compare(candidate, startTerm) <= 0) {
            // not stepped: keep only the states this term shares with the last stepped one
            liveDepth = Math.min(liveDepth, shared);
            continue;
          }
          startTerm = null;
        }
        if (accept(candidate, shared)) {
          ord = (long) block * Lex10PostingsFormat.BLOCK_SIZE + upto;
          blocks.position(ord);
          return blocks.term();
        }
      }
      ord = field.numTerms;
      return null;
    }

    /** Every term of a block that is not the last starts with the
     *  prefix shared by its first term and the next block's first term. */
    private boolean blockMayMatch(int b) {
      if (b == field.blockFirstTerms.length - 1) {
        return true;
      }
      final BytesRef first = field.blockFirstTerms[b];
      final BytesRef next = field.blockFirstTerms[b+1];
      final int limit = Math.min(first.length, next.length);
      int state = runAutomaton.getInitialState();
      for (int i = 0; i < limit; i++) {
        final byte label = first.bytes[first.offset + i];
        if (label != next.bytes[next.offset + i]) {
          break;
        }
        state = runAutomaton.step(state, label & 0xff);
        if (state == -1) {
          return false;
        }
      }
      return true;
    }

    private boolean accept(BytesRef candidate, int shared) {
      int depth = Math.min(shared, liveDepth);
      int state = states[depth];
      for (; depth < candidate.length; depth++) {
        state = runAutomaton.step(state, candidate.bytes[candidate.offset + depth] & 0xff);
        if (state == -1) {
          liveDepth = depth;
          return false;
        }
        if (depth + 1 >= states.length) {
          states = ArrayUtil.grow(states, depth + 2);
        }
        states[depth + 1] = state;
      }
      liveDepth = candidate.length;
      return runAutomaton.isAccept(state);
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void seekExact(long ord) {
      throw new UnsupportedOperationException();
    }

    @Override
    public BytesRef term() {
      return blocks.term();
    }

    @Override
    public long ord() {
      return ord;
    }

    @Override
    public int docFreq() {
      return blocks.docFreq();
    }

    @Override
    public long totalTermFreq() {
      return blocks.totalTermFreq();
    }

    @Override
    public TermState termState() {
      return blocks.termState();
    }

    @Override
    public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) throws IOException {
      return blocks.docs(liveDocs, reuse, flags);
    }

    @Override
    public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) throws IOException {
      return blocks.docsAndPositions(liveDocs, reuse, flags);
    }
  }

  /** Skip entries of the current term, loaded on the first advance. */
  private static final class SkipData {
    int count;
    int[] docs = new int[4];
    long[] docFPs = new long[4];
    long[] posFPs = new long[4];

    void load(IndexInput in, Lex10TermState termState, boolean hasPositions) throws IOException {
      count = termState.docFreq / Lex10PostingsFormat.SKIP_INTERVAL;
      if (docs.length < count) {
        docs = ArrayUtil.grow(docs, count);
        docFPs = ArrayUtil.grow(docFPs, count);
        posFPs = ArrayUtil.grow(posFPs, count);
      }
      in.seek(termState.docStartFP + termState.skipOffset);
      int doc = 0;
      long docFP = termState.docStartFP;
      long posFP = termState.posStartFP;
      for (int i = 0; i < count; i++) {
        doc += in.readVInt();
        docFP += in.readVLong();
        docs[i] = doc;
        docFPs[i] = docFP;
        if (hasPositions) {
          posFP += in.readVLong();
          posFPs[i] = posFP;
        }
      }
    }

    /** Returns the entry to jump to in order to reach target, or -1. */
    int find(int target, int docUpto) {
      int entry = -1;
      for (int i = 0; i < count; i++) {
        if (docs[i] >= target) {
          break;
        }
        if ((i + 1) * Lex10PostingsFormat.SKIP_INTERVAL > docUpto) {
          entry = i;
        }
      }
      return entry;
    }
  }

  final class BlockDocsEnum extends DocsEnum {
    private final IndexInput startDocIn;
    private final IndexInput in;
    private final SkipData skipData = new SkipData();

    private Bits liveDocs;
    private boolean hasFreqs;
    private final Lex10TermState termState = new Lex10TermState();
    private boolean skipLoaded;

    private int docUpto;
    private int accum;
    private int doc;
    private int freq;

    BlockDocsEnum() {
      startDocIn = docIn;
      in = docIn.clone();
    }

    boolean canReuse(IndexInput docIn) {
      return startDocIn == docIn;
    }

    DocsEnum reset(Bits liveDocs, Lex10TermState state, boolean hasFreqs) throws IOException {
      this.liveDocs = liveDocs;
      this.hasFreqs = hasFreqs;
      termState.copyFrom(state);
      in.seek(termState.docStartFP);
      skipLoaded = false;
      docUpto = 0;
      accum = 0;
      doc = -1;
      freq = 1;
      return this;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int freq() {
      return freq;
    }

    private void readDoc() throws IOException {
      final int code = in.readVInt();
      if (hasFreqs) {
        accum += code >>> 1;
        freq = (code & 1) != 0 ? 1 : in.readVInt();
      } else {
        accum += code;
        freq = 1;
      }
      docUpto++;
    }

    @Override
    public int nextDoc() throws IOException {
      while (true) {
        if (docUpto == termState.docFreq) {
          return doc = NO_MORE_DOCS;
        }
        readDoc();
        if (liveDocs == null || liveDocs.get(accum)) {
          return doc = accum;
        }
      }
    }

    @Override
    public int advance(int target) throws IOException {
      if (termState.skipOffset > 0) {
        if (!skipLoaded) {
          final long fp = in.getFilePointer();
          skipData.load(in, termState, false);
          in.seek(fp);
          skipLoaded = true;
        }
        final int entry = skipData.find(target, docUpto);
        if (entry != -1) {
          in.seek(skipData.docFPs[entry]);
          docUpto = (entry + 1) * Lex10PostingsFormat.SKIP_INTERVAL;
          accum = skipData.docs[entry];
        }
      }
      return slowAdvance(target);
    }
  }

  final class BlockDocsAndPositionsEnum extends DocsAndPositionsEnum {
    private final IndexInput startDocIn;
    private final IndexInput in;
    private final IndexInput posIn;
    private final SkipData skipData = new SkipData();

    private Bits liveDocs;
    private boolean hasOffsets;
    private boolean hasPayloads;
    private final Lex10TermState termState = new Lex10TermState();
    private boolean skipLoaded;

    private int docUpto;
    private int accum;
    private int doc;
    private int freq;

    // positions of previous docs not consumed yet, plus those of the current doc
    private int posPendingCount;
    private int position;
    private int startOffset;
    private int endOffset;
    private final BytesRef payload = new BytesRef();

    BlockDocsAndPositionsEnum() {
      startDocIn = docIn;
      in = docIn.clone();
      posIn = Lex10PostingsReader.this.posIn.clone();
    }

    boolean canReuse(IndexInput docIn) {
      return startDocIn == docIn;
    }

    DocsAndPositionsEnum reset(Bits liveDocs, Lex10TermState state, boolean hasOffsets, boolean hasPayloads) throws IOException {
      this.liveDocs = liveDocs;
      this.hasOffsets = hasOffsets;
      this.hasPayloads = hasPayloads;
      termState.copyFrom(state);
      in.seek(termState.docStartFP);
      posIn.seek(termState.posStartFP);
      skipLoaded = false;
      docUpto = 0;
      accum = 0;
      doc = -1;
      freq = 0;
      posPendingCount = 0;
      position = 0;
      startOffset = endOffset = -1;
      payload.length = 0;
      return this;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int freq() {
      return freq;
    }

    @Override
    public int nextDoc() throws IOException {
      while (true) {
        if (docUpto == termState.docFreq) {
          return doc = NO_MORE_DOCS;
        }
        final int code = in.readVInt();
        accum += code >>> 1;
        freq = (code & 1) != 0 ? 1 : in.readVInt();
        docUpto++;
        posPendingCount += freq;
        if (liveDocs == null || liveDocs.get(accum)) {
          position = 0;
          startOffset = endOffset = -1;
          payload.length = 0;
          return doc = accum;
        }
      }
    }

    @Override
    public int advance(int target) throws IOException {
      if (termState.skipOffset > 0) {
        if (!skipLoaded) {
          final long fp = in.getFilePointer();
          skipData.load(in, termState, true);
          in.seek(fp);
          skipLoaded = true;
        }
        final int entry = skipData.find(target, docUpto);
        if (entry != -1) {
          in.seek(skipData.docFPs[entry]);
          posIn.seek(skipData.posFPs[entry]);
          docUpto = (entry + 1) * Lex10PostingsFormat.SKIP_INTERVAL;
          accum = skipData.docs[entry];
          posPendingCount = 0;
        }
      }
      return slowAdvance(target);
    }

    private void skipPositions(int count) throws IOException {
      for (int i = 0; i < count; i++) {
        posIn.readVInt();
        if (hasPayloads) {
          posIn.skipBytes(posIn.readVInt());
        }
        if (hasOffsets) {
          posIn.readVInt();
          posIn.readVInt();
        }
      }
    }

    @Override
    public int nextPosition() throws IOException {
      if (posPendingCount > freq) {
        skipPositions(posPendingCount - freq);
        posPendingCount = freq;
      }
      if (posPendingCount == freq) {
        position = 0;
        startOffset = 0;
      }
      assert posPendingCount > 0: "nextPosition called too many times";

      position += posIn.readVInt();
      if (hasPayloads) {
        final int length = posIn.readVInt();
        if (payload.bytes.length < length) {
          payload.grow(length);
        }
        posIn.readBytes(payload.bytes, 0, length);
        payload.offset = 0;
        payload.length = length;
      }
      if (hasOffsets) {
        startOffset += posIn.readVInt();
        endOffset = startOffset + posIn.readVInt();
      } else {
        startOffset = endOffset = -1;
      }
      posPendingCount--;
      return position;
    }

    @Override
    public int startOffset() {
      return startOffset;
    }

    @Override
    public int endOffset() {
      return endOffset;
    }

    @Override
    public BytesRef getPayload() {
      return payload.length == 0 ? null : payload;
    }
  }
}
