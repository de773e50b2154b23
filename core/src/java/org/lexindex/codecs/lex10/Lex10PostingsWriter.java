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
import java.util.ArrayList;
import java.util.List;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.FieldsConsumer;
import org.lexindex.index.DocsAndPositionsEnum;
import org.lexindex.index.DocsEnum;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.index.Fields;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentWriteState;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.IndexOutput;
import org.lexindex.store.RAMOutputStream;
import org.lexindex.util.BitVector;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;

/**
 * Writes the Lex10 terms dictionary, terms index and postings.
 * Terms are pulled from the {@link Fields} handed to {@link #write};
 * a term whose postings turn out empty (all of its documents were
 * deleted before a merge) is skipped and statistics are computed from
 * the postings actually written.
 *
 * @see Lex10PostingsFormat
 */
final class Lex10PostingsWriter extends FieldsConsumer {

  private final SegmentWriteState state;
  private final IndexOutput termsOut;
  private final IndexOutput docOut;
  private final IndexOutput posOut;

  private final List<FieldMetaData> fields = new ArrayList<FieldMetaData>();

  private final RAMOutputStream blockBuffer = new RAMOutputStream();
  private final RAMOutputStream skipBuffer = new RAMOutputStream();

  private static final class FieldMetaData {
    final FieldInfo fieldInfo;
    final long numTerms;
    final long sumTotalTermFreq;
    final long sumDocFreq;
    final int docCount;
    final List<BytesRef> blockFirstTerms;
    final List<Long> blockFPs;

    FieldMetaData(FieldInfo fieldInfo, long numTerms, long sumTotalTermFreq, long sumDocFreq, int docCount,
                  List<BytesRef> blockFirstTerms, List<Long> blockFPs) {
      this.fieldInfo = fieldInfo;
      this.numTerms = numTerms;
      this.sumTotalTermFreq = sumTotalTermFreq;
      this.sumDocFreq = sumDocFreq;
      this.docCount = docCount;
      this.blockFirstTerms = blockFirstTerms;
      this.blockFPs = blockFPs;
    }
  }

  /** One term waiting to be written as part of the current block. */
  private static final class PendingTerm {
    final BytesRef term;
    final Lex10TermState state;

    PendingTerm(BytesRef term, Lex10TermState state) {
      this.term = term;
      this.state = state;
    }
  }

  Lex10PostingsWriter(SegmentWriteState state) throws IOException {
    this.state = state;
    final String segment = state.segmentInfo.name;
    IndexOutput termsOut = null;
    IndexOutput docOut = null;
    IndexOutput posOut = null;
    boolean success = false;
    try {
      termsOut = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.TERMS_EXTENSION));
      CodecUtil.writeHeader(termsOut, Lex10PostingsFormat.TERMS_CODEC, Lex10PostingsFormat.VERSION_CURRENT);
      docOut = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.DOC_EXTENSION));
      CodecUtil.writeHeader(docOut, Lex10PostingsFormat.DOC_CODEC, Lex10PostingsFormat.VERSION_CURRENT);
      if (state.fieldInfos.hasProx()) {
        posOut = state.directory.createOutput(IndexFileNames.segmentFileName(segment, "", Lex10PostingsFormat.POS_EXTENSION));
        CodecUtil.writeHeader(posOut, Lex10PostingsFormat.POS_CODEC, Lex10PostingsFormat.VERSION_CURRENT);
      }
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(termsOut, docOut, posOut);
      }
    }
    this.termsOut = termsOut;
    this.docOut = docOut;
    this.posOut = posOut;
  }

  @Override
  public void write(Fields fields) throws IOException {
    String lastField = null;
    for (String field : fields) {
      assert lastField == null || lastField.compareTo(field) < 0: "fields out of order: " + lastField + " then " + field;
      lastField = field;
      final FieldInfo fieldInfo = state.fieldInfos.fieldInfo(field);
      if (fieldInfo == null || !fieldInfo.isIndexed()) {
        continue;
      }
      final Terms terms = fields.terms(field);
      if (terms != null) {
        writeField(fieldInfo, terms);
      }
    }
  }

  private void writeField(FieldInfo fieldInfo, Terms terms) throws IOException {
    final IndexOptions indexOptions = fieldInfo.getIndexOptions();
    final boolean hasFreqs = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
    final boolean hasPositions = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    final boolean hasOffsets = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
    final boolean hasPayloads = fieldInfo.hasPayloads();

    int enumFlags;
    if (hasPositions) {
      enumFlags = 0;
      if (hasPayloads) {
        enumFlags |= DocsAndPositionsEnum.FLAG_PAYLOADS;
      }
      if (hasOffsets) {
        enumFlags |= DocsAndPositionsEnum.FLAG_OFFSETS;
      }
    } else if (hasFreqs) {
      enumFlags = DocsEnum.FLAG_FREQS;
    } else {
      enumFlags = DocsEnum.FLAG_NONE;
    }

    final BitVector docsSeen = new BitVector(state.segmentInfo.getDocCount());
    final List<BytesRef> blockFirstTerms = new ArrayList<BytesRef>();
    final List<Long> blockFPs = new ArrayList<Long>();
    final List<PendingTerm> pending = new ArrayList<PendingTerm>();

    long numTerms = 0;
    long sumTotalTermFreq = 0;
    long sumDocFreq = 0;

    final TermsEnum termsEnum = terms.iterator(null);
    DocsEnum docsEnum = null;
    DocsAndPositionsEnum posEnum = null;

    BytesRef term;
    while ((term = termsEnum.next()) != null) {
      final DocsEnum postings;
      if (hasPositions) {
        posEnum = termsEnum.docsAndPositions(null, posEnum, enumFlags);
        postings = posEnum;
      } else {
        docsEnum = termsEnum.docs(null, docsEnum, enumFlags);
        postings = docsEnum;
      }
      if (postings == null) {
        continue;
      }

      final Lex10TermState termState = writePostings(postings, hasPositions ? posEnum : null,
                                                      hasFreqs, hasOffsets, hasPayloads, docsSeen);
      if (termState.docFreq == 0) {
        continue;
      }

      if (pending.size() == Lex10PostingsFormat.BLOCK_SIZE) {
        flushBlock(pending, blockFirstTerms, blockFPs, hasFreqs, hasPositions);
      }
      pending.add(new PendingTerm(BytesRef.deepCopyOf(term), termState));
      numTerms++;
      sumDocFreq += termState.docFreq;
      sumTotalTermFreq += termState.totalTermFreq;
    }

    if (!pending.isEmpty()) {
      flushBlock(pending, blockFirstTerms, blockFPs, hasFreqs, hasPositions);
    }

    if (numTerms > 0) {
      fields.add(new FieldMetaData(fieldInfo, numTerms, hasFreqs ? sumTotalTermFreq : -1, sumDocFreq,
                                   docsSeen.count(), blockFirstTerms, blockFPs));
    }
  }

  private Lex10TermState writePostings(DocsEnum postings, DocsAndPositionsEnum posEnum, boolean hasFreqs,
                                       boolean hasOffsets, boolean hasPayloads, BitVector docsSeen) throws IOException {
    final Lex10TermState termState = new Lex10TermState();
    termState.docStartFP = docOut.getFilePointer();
    termState.posStartFP = posOut == null ? 0 : posOut.getFilePointer();
    termState.skipOffset = -1;

    int docFreq = 0;
    long totalTermFreq = 0;
    int lastDocID = 0;

    int lastSkipDoc = 0;
    long lastSkipDocFP = termState.docStartFP;
    long lastSkipPosFP = termState.posStartFP;
    skipBuffer.reset();

    int docID;
    while ((docID = postings.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
      assert docID >= lastDocID: "docs out of order: " + docID + " after " + lastDocID;
      final int delta = docID - lastDocID;
      lastDocID = docID;
      docsSeen.set(docID);

      if (hasFreqs) {
        final int freq = postings.freq();
        assert freq > 0;
        if (freq == 1) {
          docOut.writeVInt((delta << 1) | 1);
        } else {
          docOut.writeVInt(delta << 1);
          docOut.writeVInt(freq);
        }
        totalTermFreq += freq;
        if (posEnum != null) {
          writePositions(posEnum, freq, hasOffsets, hasPayloads);
        }
      } else {
        docOut.writeVInt(delta);
        totalTermFreq++;
      }
      docFreq++;

      if (docFreq % Lex10PostingsFormat.SKIP_INTERVAL == 0) {
        final long docFP = docOut.getFilePointer();
        skipBuffer.writeVInt(docID - lastSkipDoc);
        skipBuffer.writeVLong(docFP - lastSkipDocFP);
        lastSkipDoc = docID;
        lastSkipDocFP = docFP;
        if (posEnum != null) {
          final long posFP = posOut.getFilePointer();
          skipBuffer.writeVLong(posFP - lastSkipPosFP);
          lastSkipPosFP = posFP;
        }
      }
    }

    if (docFreq > Lex10PostingsFormat.SKIP_INTERVAL) {
      termState.skipOffset = docOut.getFilePointer() - termState.docStartFP;
      skipBuffer.writeTo(docOut);
    }

    termState.docFreq = docFreq;
    termState.totalTermFreq = hasFreqs ? totalTermFreq : -1;
    return termState;
  }

  private void writePositions(DocsAndPositionsEnum posEnum, int freq, boolean hasOffsets, boolean hasPayloads) throws IOException {
    int lastPosition = 0;
    int lastStartOffset = 0;
    for (int i = 0; i < freq; i++) {
      final int position = posEnum.nextPosition();
      assert position >= lastPosition: "position=" + position + " lastPosition=" + lastPosition;
      posOut.writeVInt(position - lastPosition);
      lastPosition = position;
      if (hasPayloads) {
        final BytesRef payload = posEnum.getPayload();
        if (payload == null || payload.length == 0) {
          posOut.writeVInt(0);
        } else {
          posOut.writeVInt(payload.length);
          posOut.writeBytes(payload.bytes, payload.offset, payload.length);
        }
      }
      if (hasOffsets) {
        final int startOffset = posEnum.startOffset();
        final int endOffset = posEnum.endOffset();
        assert startOffset >= lastStartOffset && endOffset >= startOffset;
        posOut.writeVInt(startOffset - lastStartOffset);
        posOut.writeVInt(endOffset - startOffset);
        lastStartOffset = startOffset;
      }
    }
  }

  private static int sharedPrefix(BytesRef term1, BytesRef term2) {
    final int limit = Math.min(term1.length, term2.length);
    int i = 0;
    while (i < limit && term1.bytes[term1.offset + i] == term2.bytes[term2.offset + i]) {
      i++;
    }
    return i;
  }

  private void flushBlock(List<PendingTerm> pending, List<BytesRef> blockFirstTerms, List<Long> blockFPs,
                          boolean hasFreqs, boolean hasPositions) throws IOException {
    blockFirstTerms.add(pending.get(0).term);
    blockFPs.add(termsOut.getFilePointer());

    BytesRef lastTerm = null;
    long lastDocFP = 0;
    long lastPosFP = 0;
    for (PendingTerm entry : pending) {
      final BytesRef term = entry.term;
      final Lex10TermState termState = entry.state;
      final int prefix = lastTerm == null ? 0 : sharedPrefix(lastTerm, term);
      final int suffix = term.length - prefix;
      blockBuffer.writeVInt(prefix);
      blockBuffer.writeVInt(suffix);
      blockBuffer.writeBytes(term.bytes, term.offset + prefix, suffix);
      blockBuffer.writeVInt(termState.docFreq);
      if (hasFreqs) {
        blockBuffer.writeVLong(termState.totalTermFreq - termState.docFreq);
      }
      blockBuffer.writeVLong(termState.docStartFP - lastDocFP);
      lastDocFP = termState.docStartFP;
      if (hasPositions) {
        blockBuffer.writeVLong(termState.posStartFP - lastPosFP);
        lastPosFP = termState.posStartFP;
      }
      if (termState.docFreq > Lex10PostingsFormat.SKIP_INTERVAL) {
        blockBuffer.writeVLong(termState.skipOffset);
      }
      lastTerm = term;
    }

    termsOut.writeVInt(pending.size());
    termsOut.writeVInt((int) blockBuffer.getFilePointer());
    blockBuffer.writeTo(termsOut);
    blockBuffer.reset();
    pending.clear();
  }

  private void writeIndex() throws IOException {
    final String indexFile = IndexFileNames.segmentFileName(state.segmentInfo.name, "", Lex10PostingsFormat.TERMS_INDEX_EXTENSION);
    final IndexOutput indexOut = state.directory.createOutput(indexFile);
    boolean success = false;
    try {
      CodecUtil.writeHeader(indexOut, Lex10PostingsFormat.TERMS_INDEX_CODEC, Lex10PostingsFormat.VERSION_CURRENT);
      indexOut.writeVInt(fields.size());
      for (FieldMetaData field : fields) {
        indexOut.writeVInt(field.fieldInfo.number);
        indexOut.writeVLong(field.numTerms);
        if (field.fieldInfo.getIndexOptions() != IndexOptions.DOCS_ONLY) {
          indexOut.writeVLong(field.sumTotalTermFreq);
        }
        indexOut.writeVLong(field.sumDocFreq);
        indexOut.writeVInt(field.docCount);
        indexOut.writeVInt(field.blockFPs.size());
        long lastFP = 0;
        for (int i = 0; i < field.blockFPs.size(); i++) {
          final BytesRef first = field.blockFirstTerms.get(i);
          indexOut.writeVInt(first.length);
          indexOut.writeBytes(first.bytes, first.offset, first.length);
          final long fp = field.blockFPs.get(i);
          indexOut.writeVLong(fp - lastFP);
          lastFP = fp;
        }
      }
      CodecUtil.writeFooter(indexOut);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(indexOut);
      } else {
        IOUtils.closeWhileHandlingException(indexOut);
      }
    }
  }

  @Override
  public void close() throws IOException {
    boolean success = false;
    try {
      writeIndex();
      CodecUtil.writeFooter(termsOut);
      CodecUtil.writeFooter(docOut);
      if (posOut != null) {
        CodecUtil.writeFooter(posOut);
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(termsOut, docOut, posOut);
      } else {
        IOUtils.closeWhileHandlingException(termsOut, docOut, posOut);
      }
    }
  }
}
