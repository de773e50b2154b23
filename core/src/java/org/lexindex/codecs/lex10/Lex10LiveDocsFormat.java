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
import java.util.Collection;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.LiveDocsFormat;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentInfoPerCommit;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.BitVector;
import org.lexindex.util.Bits;
import org.lexindex.util.IOUtils;
import org.lexindex.util.MutableBits;

/**
 * Lex10 live docs format: a {@link BitVector} with one set bit per
 * live document, written to <tt>_N_&lt;delGen&gt;.liv</tt>.  A new
 * generation is written for every change, so files referenced by an
 * older commit or an open reader are never overwritten.
 */
public final class Lex10LiveDocsFormat extends LiveDocsFormat {

  static final String DELETES_EXTENSION = "liv";
  static final String CODEC_NAME = "Lex10LiveDocs";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  /** Sole constructor. */
  public Lex10LiveDocsFormat() {
  }

  @Override
  public MutableBits newLiveDocs(int size) throws IOException {
    BitVector bitVector = new BitVector(size);
    bitVector.setAll();
    return bitVector;
  }

  @Override
  public MutableBits newLiveDocs(Bits existing) throws IOException {
    final BitVector liveDocs = (BitVector) existing;
    return liveDocs.clone();
  }

  @Override
  public Bits readLiveDocs(Directory dir, SegmentInfoPerCommit info) throws IOException {
    final String filename = IndexFileNames.fileNameFromGeneration(info.info.name, DELETES_EXTENSION, info.getDelGen());
    final ChecksumIndexInput input = new ChecksumIndexInput(dir.openInput(filename));
    boolean success = false;
    try {
      CodecUtil.checkHeader(input, CODEC_NAME, VERSION_START, VERSION_CURRENT);
      final int size = input.readInt();
      if (size != info.info.getDocCount()) {
        throw new CorruptIndexException("live docs size=" + size + " but segment has " + info.info.getDocCount() + " docs (resource=" + input + ")");
      }
      final BitVector liveDocs = new BitVector(input, size);
      CodecUtil.checkFooter(input);
      if (liveDocs.count() != info.info.getDocCount() - info.getDelCount()) {
        throw new CorruptIndexException("live docs count mismatch: info=" + (info.info.getDocCount() - info.getDelCount()) + " vs bits=" + liveDocs.count() + " (resource=" + input + ")");
      }
      success = true;
      return liveDocs;
    } finally {
      if (success) {
        input.close();
      } else {
        IOUtils.closeWhileHandlingException(input);
      }
    }
  }

  @Override
  public void writeLiveDocs(MutableBits bits, Directory dir, SegmentInfoPerCommit info, int newDelCount) throws IOException {
    final String filename = IndexFileNames.fileNameFromGeneration(info.info.name, DELETES_EXTENSION, info.getNextDelGen());
    final BitVector liveDocs = (BitVector) bits;
    assert liveDocs.count() == info.info.getDocCount() - info.getDelCount() - newDelCount;
    assert liveDocs.length() == info.info.getDocCount();
    final IndexOutput output = dir.createOutput(filename);
    boolean success = false;
    try {
      CodecUtil.writeHeader(output, CODEC_NAME, VERSION_CURRENT);
      output.writeInt(liveDocs.size());
      liveDocs.writeBits(output);
      CodecUtil.writeFooter(output);
      success = true;
    } finally {
      if (success) {
        output.close();
      } else {
        IOUtils.closeWhileHandlingException(output);
      }
    }
  }

  @Override
  public void files(SegmentInfoPerCommit info, Collection<String> files) throws IOException {
    if (info.hasDeletions()) {
      files.add(IndexFileNames.fileNameFromGeneration(info.info.name, DELETES_EXTENSION, info.getDelGen()));
    }
  }
}
