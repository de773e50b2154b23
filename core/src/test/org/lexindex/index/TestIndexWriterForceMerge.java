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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.FieldType;
import org.lexindex.document.Field;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestIndexWriterForceMerge extends LexTestCase {

  public void testPartialMerge() throws IOException {

    MockDirectoryWrapper dir = newDirectory();

    final Document doc = new Document();
    doc.add(new StringField("content", "aaa", StringField.Store.NO));
    final int incrMin = 40;
    for(int numDocs=10;numDocs<500;numDocs += _TestUtil.nextInt(random, incrMin, 5*incrMin)) {
      LogDocMergePolicy ldmp = new LogDocMergePolicy();
      ldmp.setMinMergeDocs(1);
      ldmp.setMergeFactor(5);
      IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random))
        .setOpenMode(OpenMode.CREATE).setMaxBufferedDocs(2).setMergePolicy(
            ldmp));
      for(int j=0;j<numDocs;j++)
        writer.addDocument(doc);
      writer.close();

      SegmentInfos sis = new SegmentInfos();
      sis.read(dir);
      final int segCount = sis.size();

      ldmp = new LogDocMergePolicy();
      ldmp.setMergeFactor(5);
      writer = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random)).setMergePolicy(ldmp));
      writer.forceMerge(3);
      writer.close();

      sis = new SegmentInfos();
      sis.read(dir);
      final int optSegCount = sis.size();

      if (segCount < 3)
        assertEquals(segCount, optSegCount);
      else
        assertEquals(3, optSegCount);
    }
    dir.close();
  }

  public void testMaxNumSegments2() throws IOException {
    MockDirectoryWrapper dir = newDirectory();

    final Document doc = new Document();
    doc.add(new StringField("content", "aaa", StringField.Store.NO));

    LogDocMergePolicy ldmp = new LogDocMergePolicy();
    ldmp.setMinMergeDocs(1);
    ldmp.setMergeFactor(4);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(
      new MockAnalyzer(random))
      .setMaxBufferedDocs(2).setMergePolicy(ldmp).setMergeScheduler(new ConcurrentMergeScheduler()));

    for(int iter=0;iter<10;iter++) {
      for(int i=0;i<19;i++)
        writer.addDocument(doc);

      writer.commit();
      writer.waitForMerges();
      writer.commit();

      SegmentInfos sis = new SegmentInfos();
      sis.read(dir);

      final int segCount = sis.size();
      writer.forceMerge(7);
      writer.commit();
      writer.waitForMerges();

      sis = new SegmentInfos();
      sis.read(dir);
      final int optSegCount = sis.size();

      if (segCount < 7)
        assertEquals(segCount, optSegCount);
      else
        assertEquals("seg: " + segCount, 7, optSegCount);
    }
    writer.close();
    dir.close();
  }

  public void testInvalidMaxNumSegments() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    try {
      writer.forceMerge(0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    writer.close();
    dir.close();
  }

  // five segments with deletes interleaved: merging down to one
  // keeps exactly the live documents and passes CheckIndex
  public void testForceMergeFiveSegmentsWithDeletes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(100)
        .setMergePolicy(NoMergePolicy.INSTANCE));
    int id = 0;
    for (int seg = 0; seg < 5; seg++) {
      for (int i = 0; i < 20; i++) {
        Document doc = new Document();
        doc.add(new StringField("id", String.valueOf(id), StringField.Store.YES));
        doc.add(new TextField("body", "segment" + seg + " doc" + id + " common", StringField.Store.NO));
        writer.addDocument(doc);
        id++;
      }
      // delete one document of every previous segment as well
      for (int prev = 0; prev <= seg; prev++) {
        writer.deleteDocuments(new Term("id", String.valueOf(prev * 20 + seg * 3)));
      }
      writer.commit();
    }
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(5, reader.leaves().size());
    final int liveBefore = reader.numDocs();
    assertEquals(100 - 15, liveBefore);
    reader.close();

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.forceMerge(1);
    writer.close();

    reader = DirectoryReader.open(dir);
    assertEquals(1, reader.leaves().size());
    assertEquals(liveBefore, reader.numDocs());
    assertEquals(liveBefore, reader.maxDoc());
    assertFalse(reader.hasDeletions());
    reader.close();

    CheckIndex.Status status = _TestUtil.checkIndex(dir);
    assertTrue(status.clean);
    assertEquals(1, status.numSegments);
    assertEquals(0, status.numBadSegments);
    dir.close();
  }

  // the postings of a merged index equal those of the
  // multi-segment index it came from, once documents are
  // identified by their stored id
  public void testMergeEquivalence() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(_TestUtil.nextInt(random, 2, 20))
        .setMergePolicy(NoMergePolicy.INSTANCE));
    final String[] vocab = new String[] {"alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta"};
    final int numDocs = atLeast(150);
    for (int i = 0; i < numDocs; i++) {
      StringBuilder sb = new StringBuilder();
      final int len = _TestUtil.nextInt(random, 1, 12);
      for (int j = 0; j < len; j++) {
        sb.append(vocab[random.nextInt(vocab.length)]).append(' ');
      }
      Document doc = new Document();
      doc.add(new StringField("id", String.valueOf(i), StringField.Store.YES));
      doc.add(new TextField("body", sb.toString(), StringField.Store.NO));
      writer.addDocument(doc);
      if (random.nextInt(10) == 7) {
        writer.deleteDocuments(new Term("id", String.valueOf(random.nextInt(i+1))));
      }
    }
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    final Map<String,List<String>> before = postingsById(reader);
    final int liveBefore = reader.numDocs();
    reader.close();

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.forceMerge(1);
    writer.close();

    reader = DirectoryReader.open(dir);
    assertEquals(1, reader.leaves().size());
    assertEquals(liveBefore, reader.numDocs());
    assertEquals(before, postingsById(reader));
    reader.close();
    dir.close();
  }

  // term -> sorted "id:freq:positions" entries over live docs
  private static Map<String,List<String>> postingsById(IndexReader reader) throws IOException {
    final Map<String,List<String>> result = new HashMap<String,List<String>>();
    final Bits liveDocs = MultiFields.getLiveDocs(reader);
    final Terms terms = MultiFields.getTerms(reader, "body");
    final TermsEnum termsEnum = terms.iterator(null);
    BytesRef term;
    DocsAndPositionsEnum postings = null;
    while ((term = termsEnum.next()) != null) {
      final List<String> entries = new ArrayList<String>();
      postings = termsEnum.docsAndPositions(liveDocs, postings);
      int doc;
      while ((doc = postings.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
        StringBuilder sb = new StringBuilder(reader.document(doc).get("id"));
        sb.append(':').append(postings.freq());
        for (int i = 0; i < postings.freq(); i++) {
          sb.append(':').append(postings.nextPosition());
        }
        entries.add(sb.toString());
      }
      if (!entries.isEmpty()) {
        java.util.Collections.sort(entries);
        result.put(term.utf8ToString(), entries);
      }
    }
    return result;
  }

  public void testForceMergeDeletes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(2)
        .setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH)
        .setMergePolicy(NoMergePolicy.INSTANCE));
    FieldType customType = new FieldType();
    customType.setStored(true);
    FieldType customType1 = new FieldType(TextField.TYPE_NOT_STORED);
    customType1.setTokenized(false);
    customType1.setStoreTermVectors(true);
    customType1.setStoreTermVectorPositions(true);
    customType1.setStoreTermVectorOffsets(true);
    for (int i = 0; i < 10; i++) {
      Document document = new Document();
      document.add(new Field("stored", "stored", customType));
      document.add(new Field("termVector", "termVector", customType1));
      document.add(new StringField("id", "" + i, StringField.Store.NO));
      writer.addDocument(document);
    }
    writer.close();

    IndexReader ir = DirectoryReader.open(dir);
    assertEquals(10, ir.maxDoc());
    assertEquals(10, ir.numDocs());
    ir.close();

    IndexWriterConfig dontMergeConfig = new IndexWriterConfig(new MockAnalyzer(random))
      .setMergePolicy(NoMergePolicy.INSTANCE);
    writer = new IndexWriter(dir, dontMergeConfig);
    writer.deleteDocuments(new Term("id", "0"));
    writer.deleteDocuments(new Term("id", "7"));
    writer.close();

    ir = DirectoryReader.open(dir);
    assertEquals(8, ir.numDocs());
    ir.close();

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMergePolicy(newLogMergePolicy()));
    assertEquals(8, writer.numDocs());
    assertEquals(10, writer.maxDoc());
    writer.forceMergeDeletes();
    assertEquals(8, writer.numDocs());
    writer.close();
    ir = DirectoryReader.open(dir);
    assertEquals(8, ir.maxDoc());
    assertEquals(8, ir.numDocs());
    for (int i = 0; i < ir.maxDoc(); i++) {
      assertNotNull(ir.getTermVector(i, "termVector"));
      assertEquals("stored", ir.document(i).get("stored"));
    }
    ir.close();
    dir.close();
  }

  // a background forceMerge can be waited for afterwards
  public void testBackgroundForceMerge() throws IOException {
    Directory dir = newDirectory();
    for(int pass=0;pass<2;pass++) {
      IndexWriter writer = new IndexWriter(
          dir,
          newIndexWriterConfig(new MockAnalyzer(random)).
              setOpenMode(OpenMode.CREATE).
              setMaxBufferedDocs(2).
              setMergePolicy(newLogMergePolicy(51))
      );
      Document doc = new Document();
      doc.add(new StringField("field", "aaa", StringField.Store.NO));
      for(int i=0;i<100;i++)
        writer.addDocument(doc);
      writer.forceMerge(1, false);

      if (0 == pass) {
        writer.close();
        DirectoryReader reader = DirectoryReader.open(dir);
        assertEquals(1, reader.leaves().size());
        reader.close();
      } else {
        // Get another segment to flush so we can verify it is
        // NOT included in the merging
        writer.addDocument(doc);
        writer.addDocument(doc);
        writer.close();

        DirectoryReader reader = DirectoryReader.open(dir);
        assertTrue(reader.leaves().size() > 1);
        reader.close();

        SegmentInfos infos = new SegmentInfos();
        infos.read(dir);
        assertEquals(2, infos.size());
      }
    }

    dir.close();
  }
}
