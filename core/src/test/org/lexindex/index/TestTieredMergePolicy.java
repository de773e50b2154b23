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

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.Directory;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestTieredMergePolicy extends LexTestCase {

  private static Document newDoc(int id) {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("content", "aaa " + (id%4), StringField.Store.NO));
    return doc;
  }

  public void testInvalidSettings() throws Exception {
    TieredMergePolicy tmp = new TieredMergePolicy();
    assertEquals(10, tmp.getMaxMergeAtOnce());
    assertEquals(30, tmp.getMaxMergeAtOnceExplicit());
    assertEquals(10.0, tmp.getSegmentsPerTier(), 0.0);
    assertEquals(2.0, tmp.getFloorSegmentMB(), 0.0);
    try {
      tmp.setMaxMergeAtOnce(1);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      tmp.setSegmentsPerTier(1.5);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      tmp.setFloorSegmentMB(0.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      tmp.setForceMergeDeletesPctAllowed(101.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      tmp.setReclaimDeletesWeight(-1.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertTrue(tmp.toString().contains("segmentsPerTier=10.0"));
  }

  public void testIsDefault() throws Exception {
    Directory dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, new IndexWriterConfig(new MockAnalyzer(random)));
    assertTrue(w.getConfig().getMergePolicy() instanceof TieredMergePolicy);
    for(int i=0;i<20;i++) {
      w.addDocument(newDoc(i));
    }
    w.close();
    DirectoryReader r = DirectoryReader.open(dir);
    assertEquals(20, r.numDocs());
    r.close();
    dir.close();
  }

  public void testForceMergeDeletes() throws Exception {
    Directory dir = newDirectory();
    IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random));
    TieredMergePolicy tmp = newTieredMergePolicy();
    conf.setMergePolicy(tmp);
    conf.setMaxBufferedDocs(4);
    tmp.setMaxMergeAtOnce(100);
    tmp.setSegmentsPerTier(100);
    tmp.setForceMergeDeletesPctAllowed(30.0);
    IndexWriter w = new IndexWriter(dir, conf);
    for(int i=0;i<80;i++) {
      w.addDocument(newDoc(i));
    }
    assertEquals(80, w.maxDoc());
    assertEquals(80, w.numDocs());

    if (VERBOSE) {
      System.out.println("\nTEST: delete docs");
    }
    // one of four docs in every segment: 25% < 30%
    w.deleteDocuments(new Term("content", "0"));
    w.forceMergeDeletes();

    assertEquals(80, w.maxDoc());
    assertEquals(60, w.numDocs());

    if (VERBOSE) {
      System.out.println("\nTEST: forceMergeDeletes2");
    }
    tmp.setForceMergeDeletesPctAllowed(10.0);
    w.forceMergeDeletes();
    assertEquals(60, w.maxDoc());
    assertEquals(60, w.numDocs());
    w.close();
    dir.close();
  }

  public void testPartialForceMerge() throws Exception {
    int num = atLeast(10);
    for(int iter=0;iter<num;iter++) {
      if (VERBOSE) {
        System.out.println("TEST: iter=" + iter);
      }
      Directory dir = newDirectory();
      IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random));
      conf.setMergeScheduler(new SerialMergeScheduler());
      TieredMergePolicy tmp = newTieredMergePolicy();
      conf.setMergePolicy(tmp);
      conf.setMaxBufferedDocs(2);
      tmp.setMaxMergeAtOnce(3);
      tmp.setSegmentsPerTier(6);

      IndexWriter w = new IndexWriter(dir, conf);
      int maxCount = 0;
      final int numDocs = _TestUtil.nextInt(random, 20, 100);
      for(int i=0;i<numDocs;i++) {
        w.addDocument(newDoc(i));
        int count = w.getSegmentCount();
        maxCount = Math.max(count, maxCount);
        assertTrue("count=" + count + " maxCount=" + maxCount, count >= maxCount-3);
      }

      w.flush(true, true);

      int segmentCount = w.getSegmentCount();
      int targetCount = _TestUtil.nextInt(random, 1, segmentCount);
      if (VERBOSE) {
        System.out.println("TEST: forceMerge to " + targetCount + " segs (current count=" + segmentCount + ")");
      }
      w.forceMerge(targetCount);
      assertEquals(targetCount, w.getSegmentCount());

      w.close();
      dir.close();
    }
  }

  public void testForceMergeDeletesMaxSegSize() throws Exception {
    final Directory dir = newDirectory();
    final IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random));
    final TieredMergePolicy tmp = new TieredMergePolicy();
    tmp.setMaxMergedSegmentMB(0.01);
    tmp.setForceMergeDeletesPctAllowed(0.0);
    conf.setMergePolicy(tmp);

    final IndexWriter w = new IndexWriter(dir, conf);

    final int numDocs = atLeast(200);
    for(int i=0;i<numDocs;i++) {
      w.addDocument(newDoc(i));
    }

    w.forceMerge(1);
    DirectoryReader r = DirectoryReader.open(w, true);
    assertEquals(numDocs, r.maxDoc());
    assertEquals(numDocs, r.numDocs());
    r.close();

    w.deleteDocuments(new Term("id", ""+(42+17)));

    r = DirectoryReader.open(w, true);
    assertEquals(numDocs, r.maxDoc());
    assertEquals(numDocs-1, r.numDocs());
    r.close();

    w.forceMergeDeletes();

    r = DirectoryReader.open(w, true);
    assertEquals(numDocs-1, r.maxDoc());
    assertEquals(numDocs-1, r.numDocs());
    r.close();

    w.close();

    dir.close();
  }
}
