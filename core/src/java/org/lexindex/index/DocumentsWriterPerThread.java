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
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.lexindex.analysis.Analyzer;
import org.lexindex.analysis.TokenStream;
import org.lexindex.codecs.Codec;
import org.lexindex.codecs.DocValuesConsumer;
import org.lexindex.codecs.FieldsConsumer;
import org.lexindex.codecs.StoredFieldsWriter;
import org.lexindex.codecs.TermVectorsWriter;
import org.lexindex.document.StoredField;
import org.lexindex.index.FieldInfo.DocValuesType;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.store.Directory;
import org.lexindex.store.TrackingDirectoryWrapper;
import org.lexindex.util.ArrayUtil;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;
import org.lexindex.util.InfoStream;
import org.lexindex.util.MutableBits;

/** Buffers documents in RAM until they are written as one
 *  new segment.  Each instance is used by one indexing
 *  thread at a time (the {@link DocumentsWriter} hands it
 *  out under a lock).
 *
 *  <p>Nothing is written to the directory before {@link
 *  #flush}; if the flush fails the buffered documents stay
 *  intact and the flush can be retried. */
final class DocumentsWriterPerThread {

  /** Longest term, in UTF-8 bytes, that may be indexed. */
  static final int MAX_TERM_LENGTH_UTF8 = 32766;

  // rough RAM cost of the buffered structures
  private static final int BYTES_PER_OCCURRENCE = 20;
  private static final int BYTES_PER_NEW_TERM = 80;
  private static final int BYTES_PER_DOC = 48;
  private static final int RAM_PER_REF = 8;

  /** A segment written by {@link #flush}. */
  static final class FlushedSegment {
    final SegmentInfoPerCommit segmentInfo;
    final int delCount;

    FlushedSegment(SegmentInfoPerCommit segmentInfo, int delCount) {
      this.segmentInfo = segmentInfo;
      this.delCount = delCount;
    }
  }

  final String segment;
  final Directory directory;
  final Codec codec;
  final InfoStream infoStream;
  private final FieldInfos.Builder fieldInfos;

  // Deletes made while this segment accepted documents:
  final BufferedDeletes pendingDeletes = new BufferedDeletes();

  // Set, under the DocumentsWriter lock, once this segment
  // was handed off for flushing; the generation stamped on
  // the segment it becomes
  boolean flushPending;
  long flushGen = -1;

  private final Map<String,FreqProxTermsWriterPerField> postings = new HashMap<String,FreqProxTermsWriterPerField>();
  private final List<List<IndexableField>> storedDocs = new ArrayList<List<IndexableField>>();
  private final List<Fields> termVectors = new ArrayList<Fields>();
  private final Map<String,DocValuesWriter> docValues = new LinkedHashMap<String,DocValuesWriter>();
  private final Set<Integer> failedDocs = new HashSet<Integer>();

  private long[] docSeqs = new long[16];
  private int numDocsInRAM;
  private long bytesUsed;
  private final NumberFormat nf = NumberFormat.getInstance();

  DocumentsWriterPerThread(String segment, Directory directory, FieldInfos.FieldNumbers globalFieldNumbers, Codec codec, InfoStream infoStream) {
    this.segment = segment;
    this.directory = directory;
    this.codec = codec;
    this.infoStream = infoStream;
    this.fieldInfos = new FieldInfos.Builder(globalFieldNumbers);
  }

  int getNumDocsInRAM() {
    return numDocsInRAM;
  }

  long bytesUsed() {
    return bytesUsed + pendingDeletes.bytesUsed;
  }

  /** Verifies, before a docID is spent on it, that the
   *  document's doc values agree with the index: a field
   *  may carry one value per document and never change its
   *  doc values type. */
  void checkDocValues(Iterable<? extends IndexableField> doc) {
    Set<String> seen = null;
    for (IndexableField field : doc) {
      final DocValuesType dvType = field.fieldType().docValueType();
      if (dvType == null) {
        continue;
      }
      if (seen == null) {
        seen = new HashSet<String>();
      }
      if (!seen.add(field.name())) {
        throw new IllegalArgumentException("DocValuesField \"" + field.name() + "\" appears more than once in this document (only one value is allowed per field)");
      }
      fieldInfos.globalFieldNumbers.checkDocValuesType(field.name(), dvType);
      final FieldInfo fi = fieldInfos.fieldInfo(field.name());
      if (fi != null && fi.hasDocValues() && fi.getDocValuesType() != dvType) {
        throw new IllegalArgumentException("cannot change DocValues type from " + fi.getDocValuesType() + " to " + dvType + " for field \"" + field.name() + "\"");
      }
      if (dvType == DocValuesType.NUMERIC && field.numericValue() == null) {
        throw new IllegalArgumentException("field \"" + field.name() + "\": NUMERIC doc values require a numeric value");
      }
      if (dvType == DocValuesType.BINARY && field.binaryValue() == null) {
        throw new IllegalArgumentException("field \"" + field.name() + "\": BINARY doc values require a binary value");
      }
    }
  }

  /** Adds a block of documents, the first stamped with
   *  sequence number {@code firstSeq} and the rest with the
   *  numbers that follow.  If any document fails, every
   *  document of the block already added is marked
   *  deleted. */
  void addDocuments(List<? extends Iterable<? extends IndexableField>> docs, Analyzer analyzer, long firstSeq) throws IOException {
    final int startDocID = numDocsInRAM;
    boolean success = false;
    try {
      long docSeq = firstSeq;
      for (Iterable<? extends IndexableField> doc : docs) {
        addDocument(doc, analyzer, docSeq++);
      }
      success = true;
    } finally {
      if (!success) {
        for (int docID = startDocID; docID < numDocsInRAM; docID++) {
          failedDocs.add(Integer.valueOf(docID));
        }
      }
    }
  }

  /** Adds one document stamped with sequence number
   *  {@code seq}.  If an exception is thrown while the
   *  document is inverted, the document still consumes its
   *  docID but is marked deleted. */
  void addDocument(Iterable<? extends IndexableField> doc, Analyzer analyzer, long seq) throws IOException {
    final int docID = numDocsInRAM;
    if (docID == docSeqs.length) {
      docSeqs = ArrayUtil.grow(docSeqs, docID + 1);
    }
    docSeqs[docID] = seq;
    final List<IndexableField> stored = new ArrayList<IndexableField>();
    final Map<String,FreqProxTermsWriterPerField> vectors = new LinkedHashMap<String,FreqProxTermsWriterPerField>();
    boolean success = false;
    try {
      processDocument(doc, analyzer, docID, stored, vectors);
      success = true;
    } finally {
      if (!success) {
        failedDocs.add(Integer.valueOf(docID));
        if (infoStream.isEnabled("DW")) {
          infoStream.message("DW", "hit exception indexing docID=" + docID + " seg=" + segment + "; document will be deleted");
        }
      }
      // the document always occupies its slot in the
      // per-document files
      storedDocs.add(success ? stored : new ArrayList<IndexableField>());
      termVectors.add(success && !vectors.isEmpty() ? newVectorFields(vectors) : null);
      bytesUsed += BYTES_PER_DOC;
      numDocsInRAM++;
    }
  }

  private Fields newVectorFields(Map<String,FreqProxTermsWriterPerField> vectors) {
    return new FreqProxFields(vectors.values());
  }

  private void processDocument(Iterable<? extends IndexableField> doc, Analyzer analyzer, int docID,
                               List<IndexableField> stored, Map<String,FreqProxTermsWriterPerField> vectors) throws IOException {
    // per field invert state, for fields repeated within the document
    final Map<String,FieldInvertState> invertStates = new HashMap<String,FieldInvertState>();

    for (IndexableField field : doc) {
      final IndexableFieldType fieldType = field.fieldType();
      final String name = field.name();
      final FieldInfo fi = fieldInfos.addOrUpdate(name, fieldType);

      if (fieldType.indexed()) {
        if (fieldType.storeTermVectors()) {
          fi.setStoreTermVectors();
        }
        FieldInvertState state = invertStates.get(name);
        if (state == null) {
          state = new FieldInvertState();
          invertStates.put(name, state);
        }
        FreqProxTermsWriterPerField perField = postings.get(name);
        if (perField == null) {
          perField = new FreqProxTermsWriterPerField(fi);
          postings.put(name, perField);
        }
        FreqProxTermsWriterPerField vectorField = null;
        if (fieldType.storeTermVectors()) {
          vectorField = vectors.get(name);
          if (vectorField == null) {
            vectorField = new FreqProxTermsWriterPerField(fi);
            vectorField.hasFreqs = true;
            vectorField.hasProx = fieldType.storeTermVectorPositions();
            vectorField.hasOffsets = fieldType.storeTermVectorOffsets();
            vectors.put(name, vectorField);
          }
        }
        invertField(field, analyzer, docID, fi, state, perField, vectorField);
      }

      if (fieldType.stored()) {
        stored.add(copyStoredValue(field));
      }

      final DocValuesType dvType = fieldType.docValueType();
      if (dvType != null) {
        DocValuesWriter dvWriter = docValues.get(name);
        if (dvWriter == null) {
          dvWriter = new DocValuesWriter(fi, dvType);
          docValues.put(name, dvWriter);
        }
        if (dvType == DocValuesType.NUMERIC) {
          dvWriter.addValue(docID, field.numericValue().longValue());
        } else {
          dvWriter.addValue(docID, field.binaryValue());
          bytesUsed += field.binaryValue().length;
        }
      }
    }

    for (FreqProxTermsWriterPerField vectorField : vectors.values()) {
      vectorField.hasPayloads = vectorField.hasProx && vectorField.hasPayloads;
    }
  }

  /** Position and offset state of one field across its
   *  instances within a document. */
  private static final class FieldInvertState {
    int lastPosition = -1;
    int offsetBase;
    int lastStartOffset;
    int length;
  }

  private void invertField(IndexableField field, Analyzer analyzer, int docID, FieldInfo fi, FieldInvertState state,
                           FreqProxTermsWriterPerField perField, FreqProxTermsWriterPerField vectorField) throws IOException {
    final String name = field.name();
    if (state.length > 0) {
      state.lastPosition += analyzer.getPositionIncrementGap(name);
    }

    final TokenStream stream = field.tokenStream(analyzer);
    final BytesRef termBytes = new BytesRef(10);
    boolean success = false;
    int tokens = 0;
    try {
      stream.reset();
      while (stream.incrementToken()) {
        final int posIncr = stream.positionIncrement();
        int position = state.lastPosition + posIncr;
        if (position < 0) {
          // first token of the field stacked at position 0
          position = 0;
        }
        if (position < state.lastPosition) {
          throw new IllegalArgumentException("position overflow for field '" + name + "'");
        }
        state.lastPosition = position;

        final int startOffset = state.offsetBase + stream.startOffset();
        final int endOffset = state.offsetBase + stream.endOffset();
        if (startOffset < state.lastStartOffset) {
          throw new IllegalArgumentException("startOffset must be non-negative, and endOffset must be >= startOffset, and offsets must not go backwards "
              + "startOffset=" + startOffset + ",endOffset=" + endOffset + ",lastStartOffset=" + state.lastStartOffset + " for field '" + name + "'");
        }
        state.lastStartOffset = startOffset;

        termBytes.copyChars(stream.term());
        if (termBytes.length > MAX_TERM_LENGTH_UTF8) {
          throw new IllegalArgumentException("Document contains at least one immense term in field=\"" + name
              + "\" (whose UTF8 encoding is longer than the max length " + MAX_TERM_LENGTH_UTF8 + ")");
        }

        final BytesRef payload = stream.payload();
        if (payload != null && payload.length > 0) {
          fi.setStorePayloads();
        }
        final int numTerms = perField.numTerms();
        perField.addOccurrence(termBytes, docID, position, startOffset, endOffset, payload);
        bytesUsed += BYTES_PER_OCCURRENCE;
        if (perField.numTerms() != numTerms) {
          bytesUsed += BYTES_PER_NEW_TERM + termBytes.length;
        }
        if (vectorField != null) {
          vectorField.addOccurrence(termBytes, 0, position, startOffset, endOffset, payload);
        }
        tokens++;
        state.length++;
      }
      stream.end();
      if (tokens > 0) {
        state.offsetBase += stream.endOffset() + analyzer.getOffsetGap(name);
        state.lastStartOffset = state.offsetBase;
      }
      success = true;
    } finally {
      if (success) {
        stream.close();
      } else {
        IOUtils.closeWhileHandlingException(stream);
      }
    }
  }

  private static IndexableField copyStoredValue(IndexableField field) {
    final String name = field.name();
    final Number number = field.numericValue();
    if (number != null) {
      if (number instanceof Integer) {
        return new StoredField(name, number.intValue());
      } else if (number instanceof Long) {
        return new StoredField(name, number.longValue());
      } else if (number instanceof Float) {
        return new StoredField(name, number.floatValue());
      } else if (number instanceof Double) {
        return new StoredField(name, number.doubleValue());
      } else {
        throw new IllegalArgumentException("cannot store numeric type " + number.getClass() + " for field \"" + name + "\"");
      }
    }
    final BytesRef bytes = field.binaryValue();
    if (bytes != null) {
      return new StoredField(name, BytesRef.deepCopyOf(bytes));
    }
    final String string = field.stringValue();
    if (string == null) {
      throw new IllegalArgumentException("stored field \"" + name + "\" has no String, binary or numeric value");
    }
    return new StoredField(name, string);
  }

  /** Buffers one field's doc values; documents without a
   *  value read 0 or empty bytes. */
  private static final class DocValuesWriter {
    final FieldInfo fieldInfo;
    final DocValuesType type;
    long[] numbers = new long[0];
    BytesRef[] bytes = new BytesRef[0];

    DocValuesWriter(FieldInfo fieldInfo, DocValuesType type) {
      this.fieldInfo = fieldInfo;
      this.type = type;
    }

    void addValue(int docID, long value) {
      if (docID >= numbers.length) {
        numbers = ArrayUtil.grow(numbers, docID + 1);
      }
      numbers[docID] = value;
    }

    void addValue(int docID, BytesRef value) {
      if (docID >= bytes.length) {
        bytes = Arrays.copyOf(bytes, ArrayUtil.oversize(docID + 1, RAM_PER_REF));
      }
      bytes[docID] = BytesRef.deepCopyOf(value);
    }

    void flush(DocValuesConsumer consumer, final int maxDoc) throws IOException {
      if (type == DocValuesType.NUMERIC) {
        consumer.addNumericField(fieldInfo, new Iterable<Number>() {
          @Override
          public Iterator<Number> iterator() {
            return new ValuesIterator<Number>(maxDoc) {
              @Override
              Number value(int docID) {
                return Long.valueOf(docID < numbers.length ? numbers[docID] : 0L);
              }
            };
          }
        });
      } else {
        final BytesRef empty = new BytesRef();
        consumer.addBinaryField(fieldInfo, new Iterable<BytesRef>() {
          @Override
          public Iterator<BytesRef> iterator() {
            return new ValuesIterator<BytesRef>(maxDoc) {
              @Override
              BytesRef value(int docID) {
                final BytesRef v = docID < bytes.length ? bytes[docID] : null;
                return v == null ? empty : v;
              }
            };
          }
        });
      }
    }
  }

  private abstract static class ValuesIterator<T> implements Iterator<T> {
    private final int maxDoc;
    private int upto;

    ValuesIterator(int maxDoc) {
      this.maxDoc = maxDoc;
    }

    abstract T value(int docID);

    @Override
    public boolean hasNext() {
      return upto < maxDoc;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return value(upto++);
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  /** Flush all pending docs to a new segment.  Returns null
   *  if every document of the segment ended up deleted, in
   *  which case no file is left behind.  On exception the
   *  files written so far are removed and the buffered
   *  state is kept. */
  FlushedSegment flush() throws IOException {
    assert numDocsInRAM > 0;
    final TrackingDirectoryWrapper trackingDir = new TrackingDirectoryWrapper(directory);
    final Map<String,String> diagnostics = new HashMap<String,String>();
    diagnostics.put("source", "flush");
    diagnostics.put("os", System.getProperty("os.name"));
    diagnostics.put("java.version", System.getProperty("java.version"));
    final SegmentInfo si = new SegmentInfo(directory, segment, numDocsInRAM, codec, diagnostics);

    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "flush postings as segment " + segment + " numDocs=" + numDocsInRAM);
    }

    boolean success = false;
    SegmentReader reader = null;
    try {
      // postings first: they settle the payload flags
      final List<FreqProxTermsWriterPerField> fieldsToFlush = new ArrayList<FreqProxTermsWriterPerField>();
      for (FreqProxTermsWriterPerField perField : postings.values()) {
        final IndexOptions indexOptions = perField.fieldInfo.getIndexOptions();
        perField.hasFreqs = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
        perField.hasProx = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
        perField.hasOffsets = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
        perField.hasPayloads = perField.hasProx && perField.fieldInfo.hasPayloads();
        fieldsToFlush.add(perField);
      }
      final FieldInfos finalFieldInfos = fieldInfos.finish();
      final SegmentWriteState state = new SegmentWriteState(infoStream, trackingDir, si, finalFieldInfos);

      final FieldsConsumer fieldsConsumer = codec.postingsFormat().fieldsConsumer(state);
      boolean success2 = false;
      try {
        fieldsConsumer.write(new FreqProxFields(fieldsToFlush));
        success2 = true;
      } finally {
        if (success2) {
          IOUtils.close(fieldsConsumer);
        } else {
          IOUtils.closeWhileHandlingException(fieldsConsumer);
        }
      }

      writeStoredFields(trackingDir, si, finalFieldInfos);
      if (finalFieldInfos.hasVectors()) {
        writeTermVectors(trackingDir, si, finalFieldInfos);
      }
      if (finalFieldInfos.hasDocValues()) {
        final DocValuesConsumer dvConsumer = codec.docValuesFormat().fieldsConsumer(state);
        success2 = false;
        try {
          for (DocValuesWriter dvWriter : docValues.values()) {
            dvWriter.flush(dvConsumer, numDocsInRAM);
          }
          success2 = true;
        } finally {
          if (success2) {
            IOUtils.close(dvConsumer);
          } else {
            IOUtils.closeWhileHandlingException(dvConsumer);
          }
        }
      }

      codec.fieldInfosFormat().write(trackingDir, segment, finalFieldInfos);
      si.setFiles(new HashSet<String>(trackingDir.getCreatedFiles()));
      codec.segmentInfoFormat().write(trackingDir, si);

      final SegmentInfoPerCommit newSegment = new SegmentInfoPerCommit(si, 0, -1);

      // Resolve deletes that target this segment: documents
      // that failed during indexing, plus deletes buffered
      // after a document was added.
      final MutableBits liveDocs = codec.liveDocsFormat().newLiveDocs(numDocsInRAM);
      int delCount = 0;
      for (Integer docID : failedDocs) {
        if (liveDocs.get(docID.intValue())) {
          liveDocs.clear(docID.intValue());
          delCount++;
        }
      }
      if (pendingDeletes.any()) {
        reader = new SegmentReader(newSegment);
        delCount += BufferedDeletesStream.applyPrivateDeletes(pendingDeletes, docSeqs, reader, liveDocs);
        reader.decRef();
        reader = null;
      }

      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "new segment has " + delCount + " deleted docs");
        infoStream.message("DW", "flushedFiles=" + si.files());
      }

      if (delCount == numDocsInRAM) {
        if (infoStream.isEnabled("DW")) {
          infoStream.message("DW", "drop 100% deleted segment " + segment);
        }
        IOUtils.deleteFilesIgnoringExceptions(directory, trackingDir.getCreatedFiles());
        success = true;
        return null;
      }

      if (delCount > 0) {
        codec.liveDocsFormat().writeLiveDocs(liveDocs, trackingDir, newSegment, delCount);
        newSegment.advanceDelGen();
        newSegment.setDelCount(delCount);
      }

      if (infoStream.isEnabled("DW")) {
        final double newSegmentSize = newSegment.sizeInBytes()/1024./1024.;
        infoStream.message("DW", "flushed: segment=" + newSegment +
                " ramUsed=" + nf.format(bytesUsed()/1024./1024.) + " MB" +
                " newFlushedSize=" + nf.format(newSegmentSize) + " MB");
      }
      success = true;
      return new FlushedSegment(newSegment, delCount);
    } finally {
      if (!success) {
        if (reader != null) {
          IOUtils.closeWhileHandlingException(reader);
        }
        IOUtils.deleteFilesIgnoringExceptions(directory, trackingDir.getCreatedFiles());
        if (infoStream.isEnabled("DW")) {
          infoStream.message("DW", "hit exception flushing segment " + segment + "; buffered documents are kept");
        }
      }
    }
  }

  private void writeStoredFields(Directory dir, SegmentInfo si, FieldInfos finalFieldInfos) throws IOException {
    final StoredFieldsWriter writer = codec.storedFieldsFormat().fieldsWriter(dir, si);
    boolean success = false;
    try {
      for (List<IndexableField> doc : storedDocs) {
        writer.startDocument(doc.size());
        for (IndexableField field : doc) {
          writer.writeField(finalFieldInfos.fieldInfo(field.name()), field);
        }
      }
      writer.finish(finalFieldInfos, numDocsInRAM);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(writer);
      } else {
        writer.abort();
      }
    }
  }

  private void writeTermVectors(Directory dir, SegmentInfo si, FieldInfos finalFieldInfos) throws IOException {
    final TermVectorsWriter writer = codec.termVectorsFormat().vectorsWriter(dir, si);
    boolean success = false;
    try {
      for (Fields vectors : termVectors) {
        writer.addDocument(vectors, finalFieldInfos);
      }
      writer.finish(finalFieldInfos, numDocsInRAM);
      success = true;
    } finally {
      if (success) {
        IOUtils.close(writer);
      } else {
        writer.abort();
      }
    }
  }

  @Override
  public String toString() {
    return "DocumentsWriterPerThread [pendingDeletes=" + pendingDeletes
        + ", segment=" + segment + ", numDocsInRAM=" + numDocsInRAM
        + ", flushPending=" + flushPending + "]";
  }
}
