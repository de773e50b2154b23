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
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.search.IndexSearcher;
import org.lexindex.search.Query;
import org.lexindex.search.TermQuery;
import org.lexindex.store.AlreadyClosedException;
import org.lexindex.store.Directory;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestIndexWriterReader extends LexTestCase {

  public static int count(Term t, IndexReader r) throws IOException {
    int count = 0;
    DocsEnum td = MultiFields.getTermDocsEnum(r,
                                              MultiFields.getLiveDocs(r),
                                              t.field(), new BytesRef(t.text()));

    if (td != null) {
      while (td.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
        td.docID();
        count++;
      }
    }
    return count;
  }

  public void testAddCloseOpen() throws IOException {
    Directory dir1 = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));

    IndexWriter writer = new IndexWriter(dir1, iwc);
    int expected = 0;
    for (int i = 0; i < 97 ; i++) {
      DirectoryReader reader = DirectoryReader.open(writer, true);
      assertEquals(expected, reader.numDocs());
      if (i == 0) {
        writer.addDocument(createDocument(i, "x", 1 + random.nextInt(5)));
        expected++;
      } else {
        int previous = random.nextInt(i);
        // a check if the reader is current here could fail since there might be
        // merges going on.
        switch (random.nextInt(5)) {
        case 0:
        case 1:
        case 2:
          writer.addDocument(createDocument(i, "x", 1 + random.nextInt(5)));
          expected++;
          break;
        case 3:
          writer.updateDocument(new Term("id", "" + previous), createDocument(
              previous, "x", 1 + random.nextInt(5)));
          if (count(new Term("id", "" + previous), reader) == 0) {
            expected++;
          }
          break;
        case 4:
          if (count(new Term("id", "" + previous), reader) == 1) {
            expected--;
          }
          writer.deleteDocuments(new Term("id", "" + previous));
        }
      }
      assertFalse(reader.isCurrent());
      reader.close();
    }
    writer.forceMerge(1); // make sure all merging is done etc.
    DirectoryReader reader = DirectoryReader.open(writer, true);
    assertEquals(expected, reader.numDocs());
    writer.commit(); // no changes that are not visible to the reader
    assertTrue(reader.isCurrent());
    writer.close();
    assertTrue(reader.isCurrent()); // all changes are visible to the reader
    iwc = newIndexWriterConfig(new MockAnalyzer(random));
    writer = new IndexWriter(dir1, iwc);
    assertTrue(reader.isCurrent());
    writer.addDocument(createDocument(1, "x", 1+random.nextInt(5)));
    assertTrue(reader.isCurrent()); // segments in ram but IW is different to the readers one
    writer.close();
    assertFalse(reader.isCurrent()); // segments written
    reader.close();
    dir1.close();
  }

  public void testUpdateDocument() throws Exception {
    Directory dir1 = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));
    if (iwc.getMaxBufferedDocs() < 20) {
      iwc.setMaxBufferedDocs(20);
    }
    // no merging
    iwc.setMergePolicy(NoMergePolicy.INSTANCE);
    IndexWriter writer = new IndexWriter(dir1, iwc);

    // create the index
    createIndexNoClose(true, "index1", writer);

    // get a reader
    DirectoryReader r1 = DirectoryReader.open(writer, true);
    assertTrue(r1.isCurrent());

    String id10 = r1.document(10).getField("id").stringValue();

    Document newDoc = r1.document(10);
    newDoc.removeField("id");
    newDoc.add(new StringField("id", Integer.toString(8000), StringField.Store.YES));
    writer.updateDocument(new Term("id", id10), newDoc);
    assertFalse(r1.isCurrent());

    DirectoryReader r2 = DirectoryReader.open(writer, true);
    assertTrue(r2.isCurrent());
    assertEquals(0, count(new Term("id", id10), r2));
    assertEquals(1, count(new Term("id", Integer.toString(8000)), r2));
    // the older reader still sees its point in time
    assertEquals(1, count(new Term("id", id10), r1));

    r1.close();
    writer.close();
    assertTrue(r2.isCurrent());

    DirectoryReader r3 = DirectoryReader.open(dir1);
    assertTrue(r3.isCurrent());
    assertTrue(r2.isCurrent());
    assertEquals(0, count(new Term("id", id10), r3));
    assertEquals(1, count(new Term("id", Integer.toString(8000)), r3));

    writer = new IndexWriter(dir1, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new TextField("field", "a b c", StringField.Store.NO));
    writer.addDocument(doc);
    assertTrue(r2.isCurrent());
    assertTrue(r3.isCurrent());

    writer.close();

    assertFalse(r2.isCurrent());
    assertTrue(!r3.isCurrent());

    r2.close();
    r3.close();

    dir1.close();
  }

  public void testIsCurrent() throws IOException {
    Directory dir = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));

    IndexWriter writer = new IndexWriter(dir, iwc);
    Document doc = new Document();
    doc.add(new TextField("field", "a b c", StringField.Store.NO));
    writer.addDocument(doc);
    writer.close();

    iwc = newIndexWriterConfig(new MockAnalyzer(random));
    writer = new IndexWriter(dir, iwc);
    doc = new Document();
    doc.add(new TextField("field", "a b c", StringField.Store.NO));
    DirectoryReader nrtReader = DirectoryReader.open(writer, true);
    assertTrue(nrtReader.isCurrent());
    writer.addDocument(doc);
    assertFalse(nrtReader.isCurrent()); // should see the changes
    writer.forceMerge(1); // make sure we don't have a merge going on
    assertFalse(nrtReader.isCurrent());
    nrtReader.close();

    DirectoryReader dirReader = DirectoryReader.open(dir);
    nrtReader = DirectoryReader.open(writer, true);

    assertTrue(dirReader.isCurrent());
    assertTrue(nrtReader.isCurrent()); // nothing was committed yet so we are still current
    assertEquals(2, nrtReader.maxDoc()); // sees the actual document added
    assertEquals(1, dirReader.maxDoc());
    writer.close(); // close is actually a commit both should see the changes
    assertTrue(nrtReader.isCurrent());
    assertFalse(dirReader.isCurrent()); // this reader has been opened before the writer was closed / committed

    dirReader.close();
    nrtReader.close();
    dir.close();
  }

  public void testDeleteFromIndexWriter() throws Exception {
    Directory dir1 = newDirectory();
    IndexWriter writer = new IndexWriter(dir1, newIndexWriterConfig(new MockAnalyzer(random)).setReaderPooling(true));
    // create the index
    createIndexNoClose(true, "index1", writer);
    writer.flush();
    // get a reader
    DirectoryReader r1 = DirectoryReader.open(writer, true);

    String id10 = r1.document(10).getField("id").stringValue();

    // deleted IW docs should not show up in the next getReader
    writer.deleteDocuments(new Term("id", id10));
    DirectoryReader r2 = DirectoryReader.open(writer, true);
    assertEquals(1, count(new Term("id", id10), r1));
    assertEquals(0, count(new Term("id", id10), r2));

    String id50 = r1.document(50).getField("id").stringValue();
    assertEquals(1, count(new Term("id", id50), r1));

    writer.deleteDocuments(new Term("id", id50));

    DirectoryReader r3 = DirectoryReader.open(writer, true);
    assertEquals(0, count(new Term("id", id10), r3));
    assertEquals(0, count(new Term("id", id50), r3));

    String id75 = r1.document(75).getField("id").stringValue();
    writer.deleteDocuments(new TermQuery(new Term("id", id75)));
    DirectoryReader r4 = DirectoryReader.open(writer, true);
    assertEquals(1, count(new Term("id", id75), r3));
    assertEquals(0, count(new Term("id", id75), r4));

    r1.close();
    r2.close();
    r3.close();
    r4.close();
    writer.close();

    // reopen the writer to verify the delete made it to the directory
    writer = new IndexWriter(dir1, newIndexWriterConfig(new MockAnalyzer(random)));
    DirectoryReader w2r1 = DirectoryReader.open(writer, true);
    assertEquals(0, count(new Term("id", id10), w2r1));
    w2r1.close();
    writer.close();
    dir1.close();
  }

  // a reader that skips applying deletes still shows the
  // deleted docs; one that applies them does not
  public void testApplyAllDeletesFalse() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(100).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 10; i++) {
      writer.addDocument(createDocument(i, "x", 2));
    }
    writer.commit();
    writer.deleteDocuments(new Term("id", "3"));

    DirectoryReader withoutDeletes = DirectoryReader.open(writer, false);
    assertEquals(10, withoutDeletes.numDocs());

    DirectoryReader withDeletes = DirectoryReader.openIfChanged(withoutDeletes, writer, true);
    assertNotNull(withDeletes);
    assertEquals(9, withDeletes.numDocs());
    assertEquals(0, count(new Term("id", "3"), withDeletes));
    withoutDeletes.close();
    withDeletes.close();
    writer.close();
    dir.close();
  }

  public void testOpenIfChangedFromWriter() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.addDocument(createDocument(0, "x", 2));
    DirectoryReader r1 = DirectoryReader.open(writer, true);
    assertEquals(1, r1.numDocs());

    // nothing changed
    assertNull(DirectoryReader.openIfChanged(r1));

    writer.addDocument(createDocument(1, "x", 2));
    DirectoryReader r2 = DirectoryReader.openIfChanged(r1);
    assertNotNull(r2);
    assertEquals(1, r1.numDocs());
    assertEquals(2, r2.numDocs());

    // the directory has seen no commit yet
    try {
      DirectoryReader.open(dir);
      fail("did not hit expected exception");
    } catch (IndexNotFoundException infe) {
      // expected
    }
    r1.close();
    r2.close();
    writer.close();
    dir.close();
  }

  public void testAfterCommit() throws Exception {
    Directory dir1 = newDirectory();
    IndexWriter writer = new IndexWriter(dir1, newIndexWriterConfig(new MockAnalyzer(random)).setMergeScheduler(new ConcurrentMergeScheduler()));
    writer.commit();

    // create the index
    createIndexNoClose(false, "test", writer);

    // get a reader to put writer into near real-time mode
    DirectoryReader r1 = DirectoryReader.open(writer, true);
    _TestUtil.checkIndex(dir1);
    writer.commit();
    _TestUtil.checkIndex(dir1);
    assertEquals(100, r1.numDocs());

    for (int i = 0; i < 10; i++) {
      writer.addDocument(createDocument(i, "test", 4));
    }
    ((ConcurrentMergeScheduler) writer.getConfig().getMergeScheduler()).sync();

    DirectoryReader r2 = DirectoryReader.openIfChanged(r1);
    if (r2 != null) {
      r1.close();
      r1 = r2;
    }
    assertEquals(110, r1.numDocs());
    writer.close();
    r1.close();
    dir1.close();
  }

  // Make sure reader remains usable even if IndexWriter closes
  public void testAfterClose() throws Exception {
    Directory dir1 = newDirectory();
    IndexWriter writer = new IndexWriter(dir1, newIndexWriterConfig(new MockAnalyzer(random)));

    // create the index
    createIndexNoClose(false, "test", writer);

    DirectoryReader r = DirectoryReader.open(writer, true);
    writer.close();

    _TestUtil.checkIndex(dir1);

    // reader should remain usable even after IndexWriter is closed:
    assertEquals(100, r.numDocs());
    Query q = new TermQuery(new Term("indexname", "test"));
    IndexSearcher searcher = new IndexSearcher(r);
    assertEquals(100, searcher.search(q, 10).totalHits);
    try {
      DirectoryReader.openIfChanged(r);
      fail("failed to hit AlreadyClosedException");
    } catch (AlreadyClosedException ace) {
      // expected
    }
    r.close();
    dir1.close();
  }

  public void testDeletesNumDocs() throws Throwable {
    Directory dir = newDirectory();
    final IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new TextField("field", "a b c", StringField.Store.NO));
    StringField id = new StringField("id", "", StringField.Store.NO);
    doc.add(id);
    id.setStringValue("0");
    w.addDocument(doc);
    id.setStringValue("1");
    w.addDocument(doc);
    DirectoryReader r = DirectoryReader.open(w, true);
    assertEquals(2, r.numDocs());
    r.close();

    w.deleteDocuments(new Term("id", "0"));
    r = DirectoryReader.open(w, true);
    assertEquals(1, r.numDocs());
    r.close();

    w.deleteDocuments(new Term("id", "1"));
    r = DirectoryReader.open(w, true);
    assertEquals(0, r.numDocs());
    r.close();

    w.close();
    dir.close();
  }

  public void testEmptyIndex() throws Exception {
    // Ensures that getReader works on an empty index, which hasn't been committed yet.
    Directory dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    DirectoryReader r = DirectoryReader.open(w, true);
    assertEquals(0, r.numDocs());
    r.close();
    w.close();
    dir.close();
  }

  private static Document idDoc(int id) {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("body", "text " + id, StringField.Store.NO));
    return doc;
  }

  // Each id is owned by one thread, so every point in time sees
  // exactly one live copy once all deletes are applied.
  public void testConcurrentUpdatesKeepOneLiveCopy() throws Exception {
    Directory dir = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));
    iwc.setMaxBufferedDocs(_TestUtil.nextInt(random, 2, 10));
    final IndexWriter writer = new IndexWriter(dir, iwc);
    final int numThreads = 3;
    final int numIds = 10 * numThreads;
    for (int id = 0; id < numIds; id++) {
      writer.addDocument(idDoc(id));
    }

    final AtomicBoolean stop = new AtomicBoolean();
    final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
    Thread[] threads = new Thread[numThreads];
    for (int t = 0; t < numThreads; t++) {
      final int owner = t;
      final Random r = new Random(random.nextLong());
      threads[t] = new Thread() {
        @Override
        public void run() {
          try {
            while (!stop.get()) {
              final int id = owner + numThreads * r.nextInt(numIds / numThreads);
              writer.updateDocument(new Term("id", Integer.toString(id)), idDoc(id));
            }
          } catch (Throwable th) {
            failure.compareAndSet(null, th);
          }
        }
      };
      threads[t].start();
    }

    try {
      final int iters = atLeast(30);
      for (int iter = 0; iter < iters && failure.get() == null; iter++) {
        final boolean applyAllDeletes = random.nextBoolean();
        DirectoryReader r = DirectoryReader.open(writer, applyAllDeletes);
        try {
          for (int id = 0; id < numIds; id++) {
            final int live = count(new Term("id", Integer.toString(id)), r);
            if (applyAllDeletes) {
              assertEquals("iter=" + iter + " id=" + id, 1, live);
            } else {
              assertTrue("iter=" + iter + " id=" + id + " live=" + live, live >= 1);
            }
          }
        } finally {
          r.close();
        }
      }
    } finally {
      stop.set(true);
      for (Thread thread : threads) {
        thread.join();
      }
    }
    if (failure.get() != null) {
      throw new RuntimeException("indexing thread failed", failure.get());
    }

    writer.close();
    DirectoryReader r = DirectoryReader.open(dir);
    assertEquals(numIds, r.numDocs());
    r.close();
    dir.close();
  }

  // Every update leaves the previous segment fully deleted while the
  // writer's reader pool still holds it; closing the directory fails
  // if any of those segments were left open.
  public void testUpdateAndReopenReleasesDroppedSegments() throws Exception {
    MockDirectoryWrapper dir = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));
    iwc.setMergePolicy(NoMergePolicy.INSTANCE);
    IndexWriter writer = new IndexWriter(dir, iwc);
    writer.addDocument(idDoc(0));
    DirectoryReader held = DirectoryReader.open(writer, true);
    final int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      writer.updateDocument(new Term("id", "0"), idDoc(0));
      DirectoryReader r = DirectoryReader.open(writer, true);
      assertEquals(1, r.numDocs());
      assertEquals(1, count(new Term("id", "0"), r));
      if (random.nextBoolean()) {
        held.close();
        held = r;
      } else {
        r.close();
      }
    }
    // the held reader still sees its own point in time
    assertEquals(1, held.numDocs());
    held.close();
    writer.close();
    dir.close();
  }

  public static void createIndexNoClose(boolean singleSegment, String indexName,
      IndexWriter w) throws IOException {
    for (int i = 0; i < 100; i++) {
      w.addDocument(createDocument(i, indexName, 4));
    }
    if (singleSegment) {
      w.forceMerge(1);
    }
  }

  public static Document createDocument(int n, String indexName, int numFields) {
    StringBuilder sb = new StringBuilder();
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(n), StringField.Store.YES));
    doc.add(new StringField("indexname", indexName, StringField.Store.YES));
    sb.append("a");
    sb.append(n);
    doc.add(new TextField("field1", sb.toString(), StringField.Store.YES));
    sb.append(" b");
    sb.append(n);
    for (int i = 1; i < numFields; i++) {
      doc.add(new TextField("field" + (i + 1), sb.toString(), StringField.Store.YES));
    }
    return doc;
  }
}
