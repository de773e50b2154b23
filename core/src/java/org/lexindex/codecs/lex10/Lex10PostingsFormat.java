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

import org.lexindex.codecs.FieldsConsumer;
import org.lexindex.codecs.FieldsProducer;
import org.lexindex.codecs.PostingsFormat;
import org.lexindex.index.SegmentReadState;
import org.lexindex.index.SegmentWriteState;

/**
 * Lex10 postings format.
 * <p>
 * Four files per segment:
 * <ul>
 *   <li><tt>.tim</tt>: the terms dictionary.  Terms of each field are
 *       written in blocks of {@link #BLOCK_SIZE}; each entry carries the
 *       term suffix (prefix shared with the previous term in the block
 *       is not repeated), docFreq, totalTermFreq and file pointers into
 *       <tt>.doc</tt> and <tt>.pos</tt>.</li>
 *   <li><tt>.tip</tt>: the terms index, loaded fully in RAM: per field
 *       its statistics and the first term and file pointer of every
 *       block.  Since every block but the last is full, a term's
 *       ordinal is <code>block * BLOCK_SIZE + indexInBlock</code>.</li>
 *   <li><tt>.doc</tt>: per term the delta coded doc ids, with the
 *       frequency folded in the low bit when it is 1, followed by
 *       skip data with one entry every {@link #SKIP_INTERVAL} docs.</li>
 *   <li><tt>.pos</tt>: positions, payloads and offsets.</li>
 * </ul>
 * Every file starts with a codec header and ends with a checksum footer.
 */
public final class Lex10PostingsFormat extends PostingsFormat {

  static final String TERMS_EXTENSION = "tim";
  static final String TERMS_INDEX_EXTENSION = "tip";
  static final String DOC_EXTENSION = "doc";
  static final String POS_EXTENSION = "pos";

  static final String TERMS_CODEC = "Lex10TermsDict";
  static final String TERMS_INDEX_CODEC = "Lex10TermsIndex";
  static final String DOC_CODEC = "Lex10PostingsDoc";
  static final String POS_CODEC = "Lex10PostingsPos";

  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  /** Number of terms per block in the terms dictionary. */
  public static final int BLOCK_SIZE = 32;

  /** A skip entry is written after every this many docs. */
  public static final int SKIP_INTERVAL = 16;

  /** Sole constructor. */
  public Lex10PostingsFormat() {
  }

  @Override
  public FieldsConsumer fieldsConsumer(SegmentWriteState state) throws IOException {
    return new Lex10PostingsWriter(state);
  }

  @Override
  public FieldsProducer fieldsProducer(SegmentReadState state) throws IOException {
    return new Lex10PostingsReader(state);
  }

  @Override
  public String toString() {
    return "Lex10PostingsFormat(blocksize=" + BLOCK_SIZE + " skipInterval=" + SKIP_INTERVAL + ")";
  }
}
