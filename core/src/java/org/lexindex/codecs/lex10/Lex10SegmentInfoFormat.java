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
import java.util.Map;
import java.util.Set;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.SegmentInfoFormat;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentInfo;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.IOUtils;

/**
 * Lex10 segment info format: the <tt>.si</tt> file holds the document
 * count, the diagnostics map and the set of files of the segment.
 * The codec itself is recorded in the commit, so the returned
 * {@link SegmentInfo} has no codec set yet.
 */
public final class Lex10SegmentInfoFormat extends SegmentInfoFormat {

  static final String SI_EXTENSION = "si";
  static final String CODEC_NAME = "Lex10SegmentInfo";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  /** Sole constructor. */
  public Lex10SegmentInfoFormat() {
  }

  @Override
  public SegmentInfo read(Directory dir, String segment) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(segment, "", SI_EXTENSION);
    final ChecksumIndexInput input = new ChecksumIndexInput(dir.openInput(fileName));
    boolean success = false;
    try {
      CodecUtil.checkHeader(input, CODEC_NAME, VERSION_START, VERSION_CURRENT);
      final int docCount = input.readInt();
      if (docCount < 0) {
        throw new CorruptIndexException("invalid docCount: " + docCount + " (resource=" + input + ")");
      }
      final Map<String,String> diagnostics = input.readStringStringMap();
      final Set<String> files = input.readStringSet();
      CodecUtil.checkFooter(input);

      final SegmentInfo si = new SegmentInfo(dir, segment, docCount, null, diagnostics);
      si.setFiles(files);

      success = true;

      return si;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(input);
      } else {
        input.close();
      }
    }
  }

  @Override
  public void write(Directory dir, SegmentInfo si) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(si.name, "", SI_EXTENSION);
    si.addFile(fileName);

    final IndexOutput output = dir.createOutput(fileName);

    boolean success = false;
    try {
      CodecUtil.writeHeader(output, CODEC_NAME, VERSION_CURRENT);
      output.writeInt(si.getDocCount());
      output.writeStringStringMap(si.getDiagnostics());
      output.writeStringSet(si.files());
      CodecUtil.writeFooter(output);
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(output);
        si.dir.deleteFile(fileName);
      } else {
        output.close();
      }
    }
  }
}
