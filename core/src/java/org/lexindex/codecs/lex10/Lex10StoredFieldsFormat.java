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

import org.lexindex.codecs.StoredFieldsFormat;
import org.lexindex.codecs.StoredFieldsReader;
import org.lexindex.codecs.StoredFieldsWriter;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.SegmentInfo;
import org.lexindex.store.Directory;

/**
 * Lex10 stored fields format.
 * <p>
 * The <tt>.fdx</tt> file holds, per document, a fixed width pointer
 * into the <tt>.fdt</tt> file.  Each <tt>.fdt</tt> entry is the number
 * of stored fields followed, per field, by the field number, a type
 * byte and the value.
 */
public final class Lex10StoredFieldsFormat extends StoredFieldsFormat {

  static final String FIELDS_INDEX_EXTENSION = "fdx";
  static final String FIELDS_EXTENSION = "fdt";

  static final String CODEC_NAME_IDX = "Lex10FieldsIndex";
  static final String CODEC_NAME_DAT = "Lex10FieldsData";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final byte TYPE_STRING = 0;
  static final byte TYPE_BINARY = 1;
  static final byte TYPE_INT = 2;
  static final byte TYPE_LONG = 3;
  static final byte TYPE_FLOAT = 4;
  static final byte TYPE_DOUBLE = 5;

  /** Sole constructor. */
  public Lex10StoredFieldsFormat() {
  }

  @Override
  public StoredFieldsReader fieldsReader(Directory directory, SegmentInfo si, FieldInfos fn) throws IOException {
    return new Lex10StoredFieldsReader(directory, si, fn);
  }

  @Override
  public StoredFieldsWriter fieldsWriter(Directory directory, SegmentInfo si) throws IOException {
    return new Lex10StoredFieldsWriter(directory, si.name);
  }
}
