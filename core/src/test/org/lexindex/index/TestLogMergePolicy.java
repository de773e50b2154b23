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

import java.io.IOException;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.Directory;
import org.lexindex.util.LexTestCase;

public class TestLogMergePolicy extends LexTestCase {

  private static void addDoc(IndexWriter writer, int id) throws IOException {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("content", "aaa " + id, StringField.Store.NO));
    writer.addDocument(doc);
  }

  private static IndexWriterConfig newConfig(LogMergePolicy mp, int maxBufferedDocs) {
    return newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(maxBufferedDocs)
        .setMergeScheduler(new SerialMergeScheduler())
        .setMergePolicy(mp);
  }

  public void testInvalidSettings() throws Exception {
    LogDocMergePolicy mp = new LogDocMergePolicy();
    assertEquals(LogMergePolicy.DEFAULT_MERGE_FACTOR, mp.getMergeFactor());
    assertEquals(LogDocMergePolicy.DEFAULT_MIN_MERGE_DOCS, mp.getMinMergeDocs());
    assertEquals(LogMergePolicy.DEFAULT_MAX_MERGE_DOCS, mp.getMaxMergeDocs());
    try {
      mp.setMergeFactor(1);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      mp.setForceMergeDeletesPctAllowed(-1.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      mp.setForceMergeDeletesPctAllowed(100.5);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    mp.setForceMergeDeletesPctAllowed(0.0);
    assertEquals(0.0, mp.getForceMergeDeletesPctAllowed(), 0.0);
  }

  public void testPolicyCannotBeShared() throws Exception {
    Directory dir1 = newDirectory();
    Directory dir2 = newDirectory();
    LogDocMergePolicy mp = new LogDocMergePolicy();
    IndexWriter writer = new IndexWriter(dir1, newConfig(mp, 10));
    try {
      new IndexWriter(dir2, newConfig(mp, 10));
      fail("did not hit expected exception");
    } catch (IllegalStateException e) {
      // expected
    }
    writer.close();
    dir1.close();
    dir2.close();
  }

  public void testMergeFactorBoundsSegmentCount() throws Exception {
    Directory dir = newDirectory();
    LogDocMergePolicy mp = new LogDocMergePolicy();
    mp.setMergeFactor(10);
    mp.setMinMergeDocs(10);
    IndexWriter writer = new IndexWriter(dir, newConfig(mp, 10));
    for (int i = 0; i < 1000; i++) {
      addDoc(writer, i);
      // serial merges run inside addDocument, so at most
      // mergeFactor-1 segments pile up on each level
      assertTrue("segmentCount=" + writer.getSegmentCount() + " after doc " + i,
                 writer.getSegmentCount() < 3 * mp.getMergeFactor());
    }
    writer.commit();
    assertTrue(writer.getSegmentCount() < mp.getMergeFactor());
    assertEquals(1000, writer.maxDoc());
    writer.close();
    dir.close();
  }

  public void testMaxMergeDocs() throws Exception {
    Directory dir = newDirectory();
    LogDocMergePolicy mp = new LogDocMergePolicy();
    mp.setMergeFactor(2);
    mp.setMinMergeDocs(1);
    mp.setMaxMergeDocs(20);
    IndexWriter writer = new IndexWriter(dir, newConfig(mp, 10));
    for (int i = 0; i < 100; i++) {
      addDoc(writer, i);
    }
    writer.close();

    SegmentInfos sis = new SegmentInfos();
    sis.read(dir);
    assertEquals(100, sis.totalDocCount());
    for (SegmentInfoPerCommit info : sis) {
      assertTrue(info.info.name + " has " + info.info.getDocCount() + " docs",
                 info.info.getDocCount() <= 20);
    }
    dir.close();
  }

  public void testCalibrateSizeByDeletes() throws Exception {
    Directory dir = newDirectory();
    LogDocMergePolicy mp = new LogDocMergePolicy();
    mp.setCalibrateSizeByDeletes(true);
    assertTrue(mp.getCalibrateSizeByDeletes());
    mp.setMergeFactor(2);
    IndexWriter writer = new IndexWriter(dir, newConfig(mp, 10));
    for (int i = 0; i < 30; i++) {
      addDoc(writer, i);
    }
    writer.commit();
    for (int i = 0; i < 30; i += 2) {
      writer.deleteDocuments(new Term("id", Integer.toString(i)));
    }
    writer.forceMerge(1);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.leaves().size());
    assertEquals(15, reader.numDocs());
    assertEquals(15, reader.maxDoc());
    reader.close();
    dir.close();
  }
}
