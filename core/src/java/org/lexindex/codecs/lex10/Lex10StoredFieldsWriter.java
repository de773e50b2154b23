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
import org.lexindex.codecs.StoredFieldsWriter;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.IndexableField;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;

import static org.lexindex.codecs.lex10.Lex10StoredFieldsFormat.*;

/**
 * Writes stored fields in the Lex10 format.
 *
 * @see Lex10StoredFieldsFormat
 */
final class Lex10StoredFieldsWriter extends StoredFieldsWriter {

  private final Directory directory;
  private final String segment;
  private IndexOutput fieldsStream;
  private IndexOutput indexStream;
  private int numDocsWritten;

  Lex10StoredFieldsWriter(Directory directory, String segment) throws IOException {
    assert directory != null;
    this.directory = directory;
    this.segment = segment;

    boolean success = false;
    try {
      fieldsStream = directory.createOutput(IndexFileNames.segmentFileName(segment, "", FIELDS_EXTENSION));
      indexStream = directory.createOutput(IndexFileNames.segmentFileName(segment, "", FIELDS_INDEX_EXTENSION));

      CodecUtil.writeHeader(fieldsStream, CODEC_NAME_DAT, VERSION_CURRENT);
      CodecUtil.writeHeader(indexStream, CODEC_NAME_IDX, VERSION_CURRENT);
      success = true;
    } finally {
      if (!success) {
        abort();
      }
    }
  }

  @Override
  public void startDocument(int numStoredFields) throws IOException {
    indexStream.writeLong(fieldsStream.getFilePointer());
    fieldsStream.writeVInt(numStoredFields);
    numDocsWritten++;
  }

  @Override
  public void writeField(FieldInfo info, IndexableField field) throws IOException {
    fieldsStream.writeVInt(info.number);

    final BytesRef bytes;
    final String string;
    final Number number = field.numericValue();
    if (number != null) {
      if (number instanceof Byte || number instanceof Short || number instanceof Integer) {
        fieldsStream.writeByte(TYPE_INT);
        fieldsStream.writeInt(number.intValue());
      } else if (number instanceof Long) {
        fieldsStream.writeByte(TYPE_LONG);
        fieldsStream.writeLong(number.longValue());
      } else if (number instanceof Float) {
        fieldsStream.writeByte(TYPE_FLOAT);
        fieldsStream.writeInt(Float.floatToIntBits(number.floatValue()));
      } else if (number instanceof Double) {
        fieldsStream.writeByte(TYPE_DOUBLE);
        fieldsStream.writeLong(Double.doubleToLongBits(number.doubleValue()));
      } else {
        throw new IllegalArgumentException("cannot store numeric type " + number.getClass());
      }
    } else if ((bytes = field.binaryValue()) != null) {
      fieldsStream.writeByte(TYPE_BINARY);
      fieldsStream.writeVInt(bytes.length);
      fieldsStream.writeBytes(bytes.bytes, bytes.offset, bytes.length);
    } else if ((string = field.stringValue()) != null) {
      fieldsStream.writeByte(TYPE_STRING);
      fieldsStream.writeString(string);
    } else {
      throw new IllegalArgumentException("field " + field.name() + " is stored but does not have binaryValue, stringValue nor numericValue");
    }
  }

  @Override
  public void abort() {
    IOUtils.closeWhileHandlingException(this);
    IOUtils.deleteFilesIgnoringExceptions(directory,
        IndexFileNames.segmentFileName(segment, "", FIELDS_EXTENSION),
        IndexFileNames.segmentFileName(segment, "", FIELDS_INDEX_EXTENSION));
  }

  @Override
  public void finish(FieldInfos fis, int numDocs) throws IOException {
    if (numDocsWritten != numDocs) {
      throw new RuntimeException("stored fields wrote " + numDocsWritten + " docs but segment has " + numDocs + "; now aborting this merge to prevent index corruption");
    }
    CodecUtil.writeFooter(indexStream);
    CodecUtil.writeFooter(fieldsStream);
  }

  @Override
  public void close() throws IOException {
    try {
      IOUtils.close(fieldsStream, indexStream);
    } finally {
      fieldsStream = indexStream = null;
    }
  }
}
