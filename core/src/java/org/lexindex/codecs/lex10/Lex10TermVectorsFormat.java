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

import org.lexindex.codecs.TermVectorsFormat;
import org.lexindex.codecs.TermVectorsReader;
import org.lexindex.codecs.TermVectorsWriter;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.SegmentInfo;
import org.lexindex.store.Directory;

/**
 * Lex10 term vectors format.
 * <p>
 * <tt>.tvx</tt> holds a fixed width pointer per document into
 * <tt>.tvd</tt>.  A document's entry in <tt>.tvd</tt> lists its fields
 * with vectors; per field a flags byte says whether positions, offsets
 * and payloads follow, then the terms in order with their frequency
 * and occurrences.
 */
public final class Lex10TermVectorsFormat extends TermVectorsFormat {

  static final String VECTORS_INDEX_EXTENSION = "tvx";
  static final String VECTORS_EXTENSION = "tvd";

  static final String CODEC_NAME_INDEX = "Lex10TermVectorsIndex";
  static final String CODEC_NAME_DATA = "Lex10TermVectorsData";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final byte STORE_POSITIONS = 0x1;
  static final byte STORE_OFFSETS = 0x2;
  static final byte STORE_PAYLOADS = 0x4;

  /** Sole constructor. */
  public Lex10TermVectorsFormat() {
  }

  @Override
  public TermVectorsReader vectorsReader(Directory directory, SegmentInfo segmentInfo, FieldInfos fieldInfos) throws IOException {
    return new Lex10TermVectorsReader(directory, segmentInfo, fieldInfos);
  }

  @Override
  public TermVectorsWriter vectorsWriter(Directory directory, SegmentInfo segmentInfo) throws IOException {
    return new Lex10TermVectorsWriter(directory, segmentInfo.name);
  }
}
