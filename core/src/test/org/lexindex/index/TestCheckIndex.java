package org.lexindex.index;

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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.Field;
import org.lexindex.document.FieldType;
import org.lexindex.document.NumericDocValuesField;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexInput;
import org.lexindex.store.IndexOutput;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.LexTestCase;

public class TestCheckIndex extends LexTestCase {

  private IndexWriter newWriter(Directory dir) throws IOException {
    return new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(2)
        .setMergePolicy(NoMergePolicy.INSTANCE));
  }

  private static Document newDoc(int id) {
    FieldType vectors = new FieldType(TextField.TYPE_STORED);
    vectors.setStoreTermVectors(true);
    vectors.setStoreTermVectorPositions(true);
    vectors.setStoreTermVectorOffsets(true);
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new Field("body", "aaa bbb ccc " + id, vectors));
    doc.add(new NumericDocValuesField("number", id));
    return doc;
  }

  public void testCleanIndex() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(2)
        .setMergePolicy(newLogMergePolicy(2)));
    for (int i = 0; i < 19; i++) {
      writer.addDocument(newDoc(i));
    }
    writer.forceMerge(1);
    writer.commit();
    writer.deleteDocuments(new Term("id", "5"));
    writer.close();

    ByteArrayOutputStream bos = new ByteArrayOutputStream(1024);
    CheckIndex checker = new CheckIndex(dir);
    checker.setInfoStream(new PrintStream(bos, false, "UTF-8"));
    CheckIndex.Status status = checker.checkIndex();
    if (!status.clean) {
      System.out.println(bos.toString("UTF-8"));
      fail("index is not clean");
    }
    assertTrue(bos.toString("UTF-8").indexOf("No problems were detected") != -1);
    assertFalse(status.missingSegments);
    assertFalse(status.partial);
    assertTrue(status.validCounter);
    assertEquals(1, status.numSegments);
    assertEquals(0, status.numBadSegments);

    CheckIndex.Status.SegmentInfoStatus seg = status.segmentInfos.get(0);
    assertEquals("Lex10", seg.codec);
    assertEquals(19, seg.docCount);
    assertTrue(seg.hasDeletions);
    assertEquals(1, seg.numDeleted);
    assertTrue(seg.checksumsPassed);
    assertTrue(seg.openReaderPassed);
    assertEquals(3, seg.numFields);

    assertNull(seg.termIndexStatus.error);
    assertTrue(seg.termIndexStatus.termCount > 0);
    assertNull(seg.storedFieldStatus.error);
    assertEquals(18, seg.storedFieldStatus.docCount);
    assertEquals(36, seg.storedFieldStatus.totFields);
    assertNull(seg.termVectorStatus.error);
    assertEquals(18, seg.termVectorStatus.docCount);
    assertEquals(18, seg.termVectorStatus.totVectors);
    assertNull(seg.docValuesStatus.error);
    assertEquals(1, seg.docValuesStatus.totalValueFields);
    dir.close();
  }

  public void testMissingSegmentsFile() throws Exception {
    Directory dir = newDirectory();
    CheckIndex.Status status = new CheckIndex(dir).checkIndex();
    assertTrue(status.missingSegments);
    assertFalse(status.clean);
    dir.close();
  }

  public void testOnlySelectedSegments() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    for (int i = 0; i < 6; i++) {
      writer.addDocument(newDoc(i));
    }
    writer.close();

    SegmentInfos sis = new SegmentInfos();
    sis.read(dir);
    assertEquals(3, sis.size());
    String name = sis.info(1).info.name;

    CheckIndex.Status status = new CheckIndex(dir).checkIndex(Arrays.asList(name));
    assertTrue(status.clean);
    assertTrue(status.partial);
    assertEquals(3, status.numSegments);
    assertEquals(1, status.segmentInfos.size());
    assertEquals(name, status.segmentInfos.get(0).name);
    assertEquals(Arrays.asList(name), status.segmentsChecked);
    dir.close();
  }

  public void testCorruptedFileIsDetected() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    // the index is deliberately broken below
    dir.setCheckIndexOnClose(false);
    dir.setPreventDoubleWrite(false);
    IndexWriter writer = newWriter(dir);
    for (int i = 0; i < 4; i++) {
      writer.addDocument(newDoc(i));
    }
    writer.close();

    SegmentInfos sis = new SegmentInfos();
    sis.read(dir);
    assertEquals(2, sis.size());
    List<String> files = new ArrayList<String>();
    for (String file : sis.info(0).files()) {
      // segment info files are read with the commit itself
      if (!file.endsWith(".si")) {
        files.add(file);
      }
    }
    String victim = files.get(random.nextInt(files.size()));
    flipByte(dir, victim);

    CheckIndex.Status status = new CheckIndex(dir).checkIndex();
    assertFalse(status.clean);
    assertFalse(status.missingSegments);
    assertEquals(1, status.numBadSegments);
    assertEquals(2, status.totLoseDocCount);
    assertFalse(status.segmentInfos.get(0).checksumsPassed);
    assertTrue(status.segmentInfos.get(1).checksumsPassed);
    dir.close();
  }

  private static void flipByte(Directory dir, String name) throws IOException {
    IndexInput in = dir.openInput(name);
    byte[] bytes = new byte[(int) in.length()];
    in.readBytes(bytes, 0, bytes.length);
    in.close();

    bytes[bytes.length / 2] ^= 0x5a;

    dir.deleteFile(name);
    IndexOutput out = dir.createOutput(name);
    out.writeBytes(bytes, 0, bytes.length);
    out.close();
  }
}
