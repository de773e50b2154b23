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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.codecs.DocValuesConsumer;
import org.lexindex.codecs.DocValuesFormat;
import org.lexindex.codecs.DocValuesProducer;
import org.lexindex.index.BinaryDocValues;
import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.FieldInfo;
import org.lexindex.index.IndexFileNames;
import org.lexindex.index.NumericDocValues;
import org.lexindex.index.SegmentReadState;
import org.lexindex.index.SegmentWriteState;
import org.lexindex.store.IndexInput;
import org.lexindex.store.IndexOutput;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;

/**
 * Lex10 doc values format: one <tt>.dvd</tt> file per segment.
 * <p>
 * Values of each field are written one after the other: numeric
 * fields as one long per document, binary fields as a length prefixed
 * byte sequence per document.  A trailing directory lists, per field,
 * its number, type and start pointer; the long just before the footer
 * points to that directory.  Values of a field are loaded in RAM the
 * first time the field is requested.
 */
public final class Lex10DocValuesFormat extends DocValuesFormat {

  static final String DATA_EXTENSION = "dvd";
  static final String DATA_CODEC = "Lex10DocValuesData";
  static final int VERSION_START = 0;
  static final int VERSION_CURRENT = VERSION_START;

  static final byte NUMERIC = 0;
  static final byte BINARY = 1;

  /** Sole constructor. */
  public Lex10DocValuesFormat() {
  }

  @Override
  public DocValuesConsumer fieldsConsumer(SegmentWriteState state) throws IOException {
    return new Writer(state);
  }

  @Override
  public DocValuesProducer fieldsProducer(SegmentReadState state) throws IOException {
    return new Reader(state);
  }

  private static final class FieldEntry {
    final int number;
    final byte type;
    final long fp;

    FieldEntry(int number, byte type, long fp) {
      this.number = number;
      this.type = type;
      this.fp = fp;
    }
  }

  private static final class Writer extends DocValuesConsumer {
    private final IndexOutput data;
    private final int maxDoc;
    private final List<FieldEntry> entries = new ArrayList<FieldEntry>();

    Writer(SegmentWriteState state) throws IOException {
      maxDoc = state.segmentInfo.getDocCount();
      final String dataName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", DATA_EXTENSION);
      data = state.directory.createOutput(dataName);
      boolean success = false;
      try {
        CodecUtil.writeHeader(data, DATA_CODEC, VERSION_CURRENT);
        success = true;
      } finally {
        if (!success) {
          IOUtils.closeWhileHandlingException(data);
        }
      }
    }

    @Override
    public void addNumericField(FieldInfo field, Iterable<Number> values) throws IOException {
      entries.add(new FieldEntry(field.number, NUMERIC, data.getFilePointer()));
      int count = 0;
      for (Number value : values) {
        data.writeLong(value == null ? 0 : value.longValue());
        count++;
      }
      if (count != maxDoc) {
        throw new IllegalStateException("field \"" + field.name + "\" has " + count + " values but segment has " + maxDoc + " docs");
      }
    }

    @Override
    public void addBinaryField(FieldInfo field, Iterable<BytesRef> values) throws IOException {
      entries.add(new FieldEntry(field.number, BINARY, data.getFilePointer()));
      int count = 0;
      for (BytesRef value : values) {
        if (value == null) {
          data.writeVInt(0);
        } else {
          data.writeVInt(value.length);
          data.writeBytes(value.bytes, value.offset, value.length);
        }
        count++;
      }
      if (count != maxDoc) {
        throw new IllegalStateException("field \"" + field.name + "\" has " + count + " values but segment has " + maxDoc + " docs");
      }
    }

    @Override
    public void close() throws IOException {
      boolean success = false;
      try {
        final long dirStart = data.getFilePointer();
        data.writeVInt(maxDoc);
        data.writeVInt(entries.size());
        for (FieldEntry entry : entries) {
          data.writeVInt(entry.number);
          data.writeByte(entry.type);
          data.writeVLong(entry.fp);
        }
        data.writeLong(dirStart);
        CodecUtil.writeFooter(data);
        success = true;
      } finally {
        if (success) {
          IOUtils.close(data);
        } else {
          IOUtils.closeWhileHandlingException(data);
        }
      }
    }
  }

  private static final class Reader extends DocValuesProducer {
    private final IndexInput data;
    private final int maxDoc;
    private final Map<Integer,FieldEntry> entries = new HashMap<Integer,FieldEntry>();
    private final Map<Integer,NumericDocValues> numericInstances = new HashMap<Integer,NumericDocValues>();
    private final Map<Integer,BinaryDocValues> binaryInstances = new HashMap<Integer,BinaryDocValues>();

    Reader(SegmentReadState state) throws IOException {
      final String dataName = IndexFileNames.segmentFileName(state.segmentInfo.name, "", DATA_EXTENSION);
      data = state.directory.openInput(dataName);
      boolean success = false;
      try {
        CodecUtil.checkHeader(data, DATA_CODEC, VERSION_START, VERSION_CURRENT);
        data.seek(data.length() - CodecUtil.footerLength() - 8);
        data.seek(data.readLong());
        maxDoc = data.readVInt();
        if (maxDoc != state.segmentInfo.getDocCount()) {
          throw new CorruptIndexException("doc values maxDoc=" + maxDoc + " but segment has " + state.segmentInfo.getDocCount() + " docs (resource=" + data + ")");
        }
        final int numFields = data.readVInt();
        for (int i = 0; i < numFields; i++) {
          final int number = data.readVInt();
          final byte type = data.readByte();
          if (type != NUMERIC && type != BINARY) {
            throw new CorruptIndexException("invalid doc values type " + type + " (resource=" + data + ")");
          }
          final FieldInfo info = state.fieldInfos.fieldInfo(number);
          if (info == null || !info.hasDocValues()) {
            throw new CorruptIndexException("field number " + number + " has no doc values (resource=" + data + ")");
          }
          entries.put(number, new FieldEntry(number, type, data.readVLong()));
        }
        success = true;
      } finally {
        if (!success) {
          IOUtils.closeWhileHandlingException(data);
        }
      }
    }

    private FieldEntry entry(FieldInfo field, byte type) {
      final FieldEntry entry = entries.get(field.number);
      if (entry == null || entry.type != type) {
        throw new IllegalArgumentException("field \"" + field.name + "\" has no " + (type == NUMERIC ? "numeric" : "binary") + " doc values");
      }
      return entry;
    }

    @Override
    public synchronized NumericDocValues getNumeric(FieldInfo field) throws IOException {
      NumericDocValues instance = numericInstances.get(field.number);
      if (instance == null) {
        final FieldEntry entry = entry(field, NUMERIC);
        final IndexInput in = data.clone();
        in.seek(entry.fp);
        final long[] values = new long[maxDoc];
        for (int i = 0; i < maxDoc; i++) {
          values[i] = in.readLong();
        }
        instance = new NumericDocValues() {
          @Override
          public long get(int docID) {
            return values[docID];
          }
        };
        numericInstances.put(field.number, instance);
      }
      return instance;
    }

    @Override
    public synchronized BinaryDocValues getBinary(FieldInfo field) throws IOException {
      BinaryDocValues instance = binaryInstances.get(field.number);
      if (instance == null) {
        final FieldEntry entry = entry(field, BINARY);
        final IndexInput in = data.clone();
        in.seek(entry.fp);
        final int[] starts = new int[maxDoc + 1];
        final List<byte[]> chunks = new ArrayList<byte[]>();
        int total = 0;
        for (int i = 0; i < maxDoc; i++) {
          final byte[] value = new byte[in.readVInt()];
          in.readBytes(value, 0, value.length);
          chunks.add(value);
          starts[i] = total;
          total += value.length;
        }
        starts[maxDoc] = total;
        final byte[] bytes = new byte[total];
        for (int i = 0; i < maxDoc; i++) {
          final byte[] value = chunks.get(i);
          System.arraycopy(value, 0, bytes, starts[i], value.length);
        }
        instance = new BinaryDocValues() {
          @Override
          public void get(int docID, BytesRef result) {
            result.bytes = bytes;
            result.offset = starts[docID];
            result.length = starts[docID+1] - starts[docID];
          }
        };
        binaryInstances.put(field.number, instance);
      }
      return instance;
    }

    @Override
    public void checkIntegrity() throws IOException {
      CodecUtil.checksumEntireFile(data);
    }

    @Override
    public void close() throws IOException {
      data.close();
    }
  }
}
