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
import org.lexindex.codecs.StoredFieldsReader;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.FieldInfos;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.SegmentInfo;
import org.lexindex.index.StoredFieldVisitor;
import org.lexindex.store.AlreadyClosedException;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexInput;
import org.lexindex.util.IOUtils;

import static org.lexindex.codecs.lex10.Lex10StoredFieldsFormat.*;

/**
 * Reads stored fields written by {@link Lex10StoredFieldsWriter}.
 * Clones share the underlying files; only the instance created by
 * the constructor closes them.
 *
 * @see Lex10StoredFieldsFormat
 */
final class Lex10StoredFieldsReader extends StoredFieldsReader {
  private final FieldInfos fieldInfos;
  private final IndexInput fieldsStream;
  private final IndexInput indexStream;
  private final long indexStart;
  private final int numTotalDocs;
  private final boolean isOriginal;
  private boolean closed;

  private Lex10StoredFieldsReader(FieldInfos fieldInfos, int numTotalDocs, long indexStart,
                                  IndexInput fieldsStream, IndexInput indexStream) {
    this.fieldInfos = fieldInfos;
    this.numTotalDocs = numTotalDocs;
    this.indexStart = indexStart;
    this.fieldsStream = fieldsStream;
    this.indexStream = indexStream;
    this.isOriginal = false;
  }

  Lex10StoredFieldsReader(Directory d, SegmentInfo si, FieldInfos fn) throws IOException {
    final String segment = si.name;
    boolean success = false;
    fieldInfos = fn;
    isOriginal = true;
    IndexInput fieldsStream = null;
    IndexInput indexStream = null;
    try {
      fieldsStream = d.openInput(IndexFileNames.segmentFileName(segment, "", FIELDS_EXTENSION));
      indexStream = d.openInput(IndexFileNames.segmentFileName(segment, "", FIELDS_INDEX_EXTENSION));

      CodecUtil.checkHeader(indexStream, CODEC_NAME_IDX, VERSION_START, VERSION_CURRENT);
      CodecUtil.checkHeader(fieldsStream, CODEC_NAME_DAT, VERSION_START, VERSION_CURRENT);
      indexStart = indexStream.getFilePointer();
      final long indexSize = indexStream.length() - indexStart - CodecUtil.footerLength();
      this.numTotalDocs = (int) (indexSize >> 3);
      // Verify two sources of "maxDoc" agree:
      if (this.numTotalDocs != si.getDocCount()) {
        throw new CorruptIndexException("doc counts differ for segment " + segment + ": fieldsReader shows " + this.numTotalDocs + " but segmentInfo shows " + si.getDocCount());
      }
      success = true;
    } finally {
      if (!success) {
        IOUtils.closeWhileHandlingException(fieldsStream, indexStream);
      }
    }
    this.fieldsStream = fieldsStream;
    this.indexStream = indexStream;
  }

  private void ensureOpen() throws AlreadyClosedException {
    if (closed) {
      throw new AlreadyClosedException("this FieldsReader is closed");
    }
  }

  @Override
  public Lex10StoredFieldsReader clone() {
    ensureOpen();
    return new Lex10StoredFieldsReader(fieldInfos, numTotalDocs, indexStart, fieldsStream.clone(), indexStream.clone());
  }

  @Override
  public void close() throws IOException {
    if (!closed) {
      if (isOriginal) {
        IOUtils.close(fieldsStream, indexStream);
      }
      closed = true;
    }
  }

  @Override
  public void visitDocument(int n, StoredFieldVisitor visitor) throws IOException {
    ensureOpen();
    indexStream.seek(indexStart + ((long) n << 3));
    fieldsStream.seek(indexStream.readLong());

    final int numFields = fieldsStream.readVInt();
    for (int fieldIDX = 0; fieldIDX < numFields; fieldIDX++) {
      final int fieldNumber = fieldsStream.readVInt();
      final FieldInfo fieldInfo = fieldInfos.fieldInfo(fieldNumber);
      if (fieldInfo == null) {
        throw new CorruptIndexException("invalid field number " + fieldNumber + " in doc " + n + " (resource=" + fieldsStream + ")");
      }
      final byte type = fieldsStream.readByte();

      switch (visitor.needsField(fieldInfo)) {
        case YES:
          readField(visitor, fieldInfo, type);
          break;
        case NO:
          skipField(type);
          break;
        case STOP:
          return;
      }
    }
  }

  private void readField(StoredFieldVisitor visitor, FieldInfo info, byte type) throws IOException {
    switch (type) {
      case TYPE_STRING:
        visitor.stringField(info, fieldsStream.readString());
        return;
      case TYPE_BINARY:
        final byte[] bytes = new byte[fieldsStream.readVInt()];
        fieldsStream.readBytes(bytes, 0, bytes.length);
        visitor.binaryField(info, bytes);
        return;
      case TYPE_INT:
        visitor.intField(info, fieldsStream.readInt());
        return;
      case TYPE_LONG:
        visitor.longField(info, fieldsStream.readLong());
        return;
      case TYPE_FLOAT:
        visitor.floatField(info, Float.intBitsToFloat(fieldsStream.readInt()));
        return;
      case TYPE_DOUBLE:
        visitor.doubleField(info, Double.longBitsToDouble(fieldsStream.readLong()));
        return;
      default:
        throw new CorruptIndexException("unknown stored field type " + type + " (resource=" + fieldsStream + ")");
    }
  }

  private void skipField(byte type) throws IOException {
    switch (type) {
      case TYPE_STRING:
      case TYPE_BINARY:
        fieldsStream.skipBytes(fieldsStream.readVInt());
        return;
      case TYPE_INT:
      case TYPE_FLOAT:
        fieldsStream.readInt();
        return;
      case TYPE_LONG:
      case TYPE_DOUBLE:
        fieldsStream.readLong();
        return;
      default:
        throw new CorruptIndexException("unknown stored field type " + type + " (resource=" + fieldsStream + ")");
    }
  }

  @Override
  public void checkIntegrity() throws IOException {
    CodecUtil.checksumEntireFile(indexStream);
    CodecUtil.checksumEntireFile(fieldsStream);
  }
}
