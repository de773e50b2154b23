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

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.TermVectorsWriter;
import org.lexindex.index.DocsAndPositionsEnum;
import org.lexindex.index.DocsEnum;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.Fields;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;

import static org.lexindex.codecs.lex10.Lex10TermVectorsFormat.*;

/**
 * Writes term vectors in the Lex10 format, one document at a time.
 *
 * @see Lex10TermVectorsFormat
 */
final class Lex10TermVectorsWriter extends TermVectorsWriter {
  private final Directory directory;
  private final String segment;
  private IndexOutput tvx;
  private IndexOutput tvd;
  private int numDocsWritten;

  private final BytesRef lastTerm = new BytesRef(10);

  Lex10TermVectorsWriter(Directory directory, String segment) throws IOException {
    this.directory = directory;
    this.segment = segment;
    boolean success = false;
    try {
      tvx = directory.createOutput(IndexFileNames.segmentFileName(segment, "", VECTORS_INDEX_EXTENSION));
      CodecUtil.writeHeader(tvx, CODEC_NAME_INDEX, VERSION_CURRENT);
      tvd = directory.createOutput(IndexFileNames.segmentFileName(segment, "", VECTORS_EXTENSION));
      CodecUtil.writeHeader(tvd, CODEC_NAME_DATA, VERSION_CURRENT);
      success = true;
    } finally {
      if (!success) {
        abort();
      }
    }
  }

  @Override
  public void addDocument(Fields vectors, FieldInfos fieldInfos) throws IOException {
    tvx.writeLong(tvd.getFilePointer());
    numDocsWritten++;
    if (vectors == null) {
      tvd.writeVInt(0);
      return;
    }

    int numFields = 0;
    for (String field : vectors) {
      if (vectors.terms(field) != null) {
        numFields++;
      }
    }
    tvd.writeVInt(numFields);

    TermsEnum termsEnum = null;
    DocsEnum docsEnum = null;
    DocsAndPositionsEnum posEnum = null;
    for (String field : vectors) {
      final Terms terms = vectors.terms(field);
      if (terms == null) {
        continue;
      }
      final FieldInfo fieldInfo = fieldInfos.fieldInfo(field);
      if (fieldInfo == null) {
        throw new IllegalArgumentException("term vectors for unknown field \"" + field + "\"");
      }
      final boolean positions = terms.hasPositions();
      final boolean offsets = terms.hasOffsets();
      final boolean payloads = positions && terms.hasPayloads();

      byte bits = 0;
      if (positions) {
        bits |= STORE_POSITIONS;
      }
      if (offsets) {
        bits |= STORE_OFFSETS;
      }
      if (payloads) {
        bits |= STORE_PAYLOADS;
      }

      tvd.writeVInt(fieldInfo.number);
      tvd.writeByte(bits);
      tvd.writeVInt((int) terms.size());

      lastTerm.length = 0;
      termsEnum = terms.iterator(termsEnum);
      BytesRef term;
      while ((term = termsEnum.next()) != null) {
        final int prefix = sharedPrefix(lastTerm, term);
        final int suffix = term.length - prefix;
        tvd.writeVInt(prefix);
        tvd.writeVInt(suffix);
        tvd.writeBytes(term.bytes, term.offset + prefix, suffix);
        lastTerm.copyBytes(term);

        if (positions || offsets) {
          posEnum = termsEnum.docsAndPositions(null, posEnum);
          if (posEnum == null) {
            throw new IllegalStateException("field \"" + field + "\" claims positions but none were found");
          }
          final int doc = posEnum.nextDoc();
          assert doc != DocIdSetIterator.NO_MORE_DOCS;
          final int freq = posEnum.freq();
          tvd.writeVInt(freq);
          int lastPosition = 0;
          int lastStartOffset = 0;
          for (int i = 0; i < freq; i++) {
            final int position = posEnum.nextPosition();
            if (positions) {
              tvd.writeVInt(position - lastPosition);
              lastPosition = position;
              if (payloads) {
                final BytesRef payload = posEnum.getPayload();
                if (payload == null) {
                  tvd.writeVInt(0);
                } else {
                  tvd.writeVInt(payload.length);
                  tvd.writeBytes(payload.bytes, payload.offset, payload.length);
                }
              }
            }
            if (offsets) {
              final int startOffset = posEnum.startOffset();
              tvd.writeVInt(startOffset - lastStartOffset);
              tvd.writeVInt(posEnum.endOffset() - startOffset);
              lastStartOffset = startOffset;
            }
          }
        } else {
          docsEnum = termsEnum.docs(null, docsEnum, DocsEnum.FLAG_FREQS);
          final int doc = docsEnum.nextDoc();
          assert doc != DocIdSetIterator.NO_MORE_DOCS;
          tvd.writeVInt(docsEnum.freq());
        }
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

  @Override
  public void abort() {
    IOUtils.closeWhileHandlingException(this);
    IOUtils.deleteFilesIgnoringExceptions(directory,
        IndexFileNames.segmentFileName(segment, "", VECTORS_INDEX_EXTENSION),
        IndexFileNames.segmentFileName(segment, "", VECTORS_EXTENSION));
  }

  @Override
  public void finish(FieldInfos fis, int numDocs) throws IOException {
    if (numDocsWritten != numDocs) {
      throw new RuntimeException("term vectors wrote " + numDocsWritten + " docs but segment has " + numDocs + "; now aborting this merge to prevent index corruption");
    }
    CodecUtil.writeFooter(tvx);
    CodecUtil.writeFooter(tvd);
  }

  @Override
  public void close() throws IOException {
    try {
      IOUtils.close(tvx, tvd);
    } finally {
      tvx = tvd = null;
    }
  }
}
