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
import org.lexindex.codecs.FieldInfosFormat;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfo.DocValuesType;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.IndexFileNames;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.IOUtils;

/**
 * Lex10 field infos format: the <tt>.fnm</tt> file lists, per field,
 * its name, number, a bit set of flags, its {@link IndexOptions} and
 * its {@link DocValuesType}.
 */
public final class Lex10FieldInfosFormat extends FieldInfosFormat {

  static final String EXTENSION = "fnm";
  static final String CODEC_NAME = "Lex10FieldInfos";
  static final int FORMAT_START = 0;
  static final int FORMAT_CURRENT = FORMAT_START;

  static final byte IS_INDEXED = 0x1;
  static final byte STORE_TERMVECTOR = 0x2;
  static final byte OMIT_NORMS = 0x10;
  static final byte STORE_PAYLOADS = 0x20;

  /** Sole constructor. */
  public Lex10FieldInfosFormat() {
  }

  @Override
  public FieldInfos read(Directory directory, String segmentName) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(segmentName, "", EXTENSION);
    final ChecksumIndexInput input = new ChecksumIndexInput(directory.openInput(fileName));

    boolean success = false;
    try {
      CodecUtil.checkHeader(input, CODEC_NAME, FORMAT_START, FORMAT_CURRENT);

      final int size = input.readVInt();
      if (size < 0) {
        throw new CorruptIndexException("invalid field count: " + size + " (resource=" + input + ")");
      }
      FieldInfo infos[] = new FieldInfo[size];

      for (int i = 0; i < size; i++) {
        String name = input.readString();
        final int fieldNumber = input.readVInt();
        byte bits = input.readByte();
        boolean isIndexed = (bits & IS_INDEXED) != 0;
        boolean storeTermVector = (bits & STORE_TERMVECTOR) != 0;
        boolean omitNorms = (bits & OMIT_NORMS) != 0;
        boolean storePayloads = (bits & STORE_PAYLOADS) != 0;
        final IndexOptions indexOptions;
        if (isIndexed) {
          indexOptions = byteToIndexOptions(input.readByte(), input);
        } else {
          indexOptions = null;
        }
        final DocValuesType docValuesType = byteToDocValuesType(input.readByte(), input);
        infos[i] = new FieldInfo(name, isIndexed, fieldNumber, storeTermVector,
          omitNorms, storePayloads, indexOptions, docValuesType);
      }
      CodecUtil.checkFooter(input);
      FieldInfos fieldInfos = new FieldInfos(infos);
      success = true;
      return fieldInfos;
    } finally {
      if (success) {
        input.close();
      } else {
        IOUtils.closeWhileHandlingException(input);
      }
    }
  }

  @Override
  public void write(Directory directory, String segmentName, FieldInfos infos) throws IOException {
    final String fileName = IndexFileNames.segmentFileName(segmentName, "", EXTENSION);
    IndexOutput output = directory.createOutput(fileName);
    boolean success = false;
    try {
      CodecUtil.writeHeader(output, CODEC_NAME, FORMAT_CURRENT);
      output.writeVInt(infos.size());
      for (FieldInfo fi : infos) {
        byte bits = 0x0;
        if (fi.isIndexed()) bits |= IS_INDEXED;
        if (fi.hasVectors()) bits |= STORE_TERMVECTOR;
        if (fi.omitsNorms()) bits |= OMIT_NORMS;
        if (fi.hasPayloads()) bits |= STORE_PAYLOADS;
        output.writeString(fi.name);
        output.writeVInt(fi.number);
        output.writeByte(bits);
        if (fi.isIndexed()) {
          output.writeByte((byte) fi.getIndexOptions().ordinal());
        }
        output.writeByte(docValuesByte(fi.getDocValuesType()));
      }
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

  private static byte docValuesByte(DocValuesType type) {
    if (type == null) {
      return 0;
    } else if (type == DocValuesType.NUMERIC) {
      return 1;
    } else {
      assert type == DocValuesType.BINARY;
      return 2;
    }
  }

  private static DocValuesType byteToDocValuesType(byte b, ChecksumIndexInput input) throws IOException {
    switch (b) {
      case 0:
        return null;
      case 1:
        return DocValuesType.NUMERIC;
      case 2:
        return DocValuesType.BINARY;
      default:
        throw new CorruptIndexException("invalid docvalues byte: " + b + " (resource=" + input + ")");
    }
  }

  private static IndexOptions byteToIndexOptions(byte b, ChecksumIndexInput input) throws IOException {
    final IndexOptions[] values = IndexOptions.values();
    if (b < 0 || b >= values.length) {
      throw new CorruptIndexException("invalid index options byte: " + b + " (resource=" + input + ")");
    }
    return values[b];
  }
}
