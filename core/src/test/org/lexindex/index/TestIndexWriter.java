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
import java.util.HashMap;
import java.util.Map;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.search.IndexSearcher;
import org.lexindex.search.TermQuery;
import org.lexindex.store.AlreadyClosedException;
import org.lexindex.store.Directory;
import org.lexindex.store.LockObtainFailedException;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.store.RAMDirectory;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestIndexWriter extends LexTestCase {

  public void testDocCount() throws IOException {
    Directory dir = newDirectory();

    IndexWriter writer = null;
    IndexReader reader = null;
    int i;

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setWriteLockTimeout(2000));
    assertEquals(2000, writer.getConfig().getWriteLockTimeout());

    // add 100 documents
    for (i = 0; i < 100; i++) {
      addDocWithIndex(writer, i);
    }
    assertEquals(100, writer.maxDoc());
    writer.close();

    // delete 40 documents
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMergePolicy(NoMergePolicy.INSTANCE));
    for (i = 0; i < 40; i++) {
      writer.deleteDocuments(new Term("id", ""+i));
    }
    writer.close();

    reader = DirectoryReader.open(dir);
    assertEquals(60, reader.numDocs());
    assertEquals(100, reader.maxDoc());
    assertEquals(40, reader.numDeletedDocs());
    reader.close();

    // merge the index down and check that the new doc count is correct
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertEquals(60, writer.numDocs());
    writer.forceMerge(1);
    assertEquals(60, writer.maxDoc());
    assertEquals(60, writer.numDocs());
    writer.close();

    // check that the index reader gives the same numbers.
    reader = DirectoryReader.open(dir);
    assertEquals(60, reader.maxDoc());
    assertEquals(60, reader.numDocs());
    reader.close();

    // make sure opening a new index for create over
    // this existing one works correctly:
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setOpenMode(OpenMode.CREATE));
    assertEquals(0, writer.maxDoc());
    assertEquals(0, writer.numDocs());
    writer.close();
    dir.close();
  }

  static void addDoc(IndexWriter writer) throws IOException {
    Document doc = new Document();
    doc.add(new TextField("content", "aaa", StringField.Store.NO));
    writer.addDocument(doc);
  }

  static void addDocWithIndex(IndexWriter writer, int index) throws IOException {
    Document doc = new Document();
    doc.add(new TextField("content", "aaa " + index, StringField.Store.YES));
    doc.add(new StringField("id", "" + index, StringField.Store.YES));
    writer.addDocument(doc);
  }

  // Make sure we can open an index for create even when a
  // reader holds it open (this fails pre lock-less
  // commits on windows):
  public void testCreateWithReader() throws IOException {
    Directory dir = newDirectory();

    // add one document & close writer
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDoc(writer);
    writer.close();

    // now open reader:
    IndexReader reader = DirectoryReader.open(dir);
    assertEquals("should be one document", reader.numDocs(), 1);

    // now open index for create:
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setOpenMode(OpenMode.CREATE));
    assertEquals("should be zero documents", writer.maxDoc(), 0);
    addDoc(writer);
    writer.close();

    assertEquals("should be one document", reader.numDocs(), 1);
    IndexReader reader2 = DirectoryReader.open(dir);
    assertEquals("should be one document", reader2.numDocs(), 1);
    reader.close();
    reader2.close();

    dir.close();
  }

  public void testIndexNotFound() throws IOException {
    Directory dir = newDirectory();
    assertFalse(DirectoryReader.indexExists(dir));
    try {
      DirectoryReader.open(dir);
      fail("did not hit expected exception");
    } catch (IndexNotFoundException e) {
      // expected
    }
    try {
      new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setOpenMode(OpenMode.APPEND));
      fail("did not hit expected exception");
    } catch (IndexNotFoundException e) {
      // expected
    }
    // the failed open released the write lock
    assertFalse(IndexWriter.isLocked(dir));
    dir.close();
  }

  public void testEmptyIndexIsCommittedOnClose() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.close();
    assertTrue(DirectoryReader.indexExists(dir));
    IndexReader reader = DirectoryReader.open(dir);
    assertEquals(0, reader.maxDoc());
    assertEquals(0, reader.leaves().size());
    reader.close();
    dir.close();
  }

  public void testChangesAfterClose() throws IOException {
    Directory dir = newDirectory();

    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDoc(writer);

    // close
    writer.close();
    try {
      addDoc(writer);
      fail("did not hit AlreadyClosedException");
    } catch (AlreadyClosedException e) {
      // expected
    }
    try {
      writer.commit();
      fail("did not hit AlreadyClosedException");
    } catch (AlreadyClosedException e) {
      // expected
    }
    // closing twice is a no-op
    writer.close();
    dir.close();
  }

  public void testSecondWriterCannotObtainLock() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertTrue(IndexWriter.isLocked(dir));
    try {
      new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setWriteLockTimeout(0));
      fail("did not hit expected exception");
    } catch (LockObtainFailedException e) {
      // expected
    }
    writer.close();
    assertFalse(IndexWriter.isLocked(dir));
    dir.close();
  }

  public void testUnlockAbandonedWriter() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDoc(writer);
    writer.commit();
    // simulate a writer whose process went away
    IndexWriter.unlock(dir);
    assertFalse(IndexWriter.isLocked(dir));
    IndexWriter writer2 = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertEquals(1, writer2.numDocs());
    writer2.close();
    writer.rollback();
    dir.close();
  }

  public void testHasUncommittedChanges() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertTrue(writer.hasUncommittedChanges());  // this will be true because a commit will create an empty index
    Document doc = new Document();
    doc.add(new TextField("myfield", "a b c", StringField.Store.NO));
    writer.addDocument(doc);
    assertTrue(writer.hasUncommittedChanges());

    // Must commit, waitForMerges, commit again, to be
    // certain that hasUncommittedChanges returns false:
    writer.commit();
    writer.waitForMerges();
    writer.commit();
    assertFalse(writer.hasUncommittedChanges());
    writer.addDocument(doc);
    assertTrue(writer.hasUncommittedChanges());
    writer.commit();
    doc = new Document();
    doc.add(new StringField("id", "xyz", StringField.Store.YES));
    writer.addDocument(doc);
    assertTrue(writer.hasUncommittedChanges());

    // Must commit, waitForMerges, commit again, to be
    // certain that hasUncommittedChanges returns false:
    writer.commit();
    writer.waitForMerges();
    writer.commit();
    assertFalse(writer.hasUncommittedChanges());
    writer.deleteDocuments(new Term("id", "xyz"));
    assertTrue(writer.hasUncommittedChanges());

    // Must commit, waitForMerges, commit again, to be
    // certain that hasUncommittedChanges returns false:
    writer.commit();
    writer.waitForMerges();
    writer.commit();
    assertFalse(writer.hasUncommittedChanges());
    writer.close();

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertFalse(writer.hasUncommittedChanges());
    writer.addDocument(doc);
    assertTrue(writer.hasUncommittedChanges());

    writer.close();
    dir.close();
  }

  public void testCommitUserData() throws IOException {
    Directory dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(2));
    for (int j = 0; j < 17; j++) {
      addDoc(w);
    }
    w.close();

    DirectoryReader r = DirectoryReader.open(dir);
    // commit(Map) never called for this index
    assertEquals(0, r.getIndexCommit().getUserData().size());
    r.close();

    w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(2));
    for (int j = 0; j < 17; j++) {
      addDoc(w);
    }
    Map<String,String> data = new HashMap<String,String>();
    data.put("label", "test1");
    w.setCommitData(data);
    w.close();

    r = DirectoryReader.open(dir);
    assertEquals("test1", r.getIndexCommit().getUserData().get("label"));
    r.close();

    w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    // the committed user data is visible to a new writer
    assertEquals("test1", w.getCommitData().get("label"));
    w.forceMerge(1);
    w.close();

    dir.close();
  }

  public void testDeleteAll() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(2));
    for (int i = 0; i < 10; i++) {
      addDocWithIndex(writer, i);
    }
    writer.commit();
    for (int i = 10; i < 15; i++) {
      addDocWithIndex(writer, i);
    }
    writer.deleteAll();
    assertEquals(0, writer.maxDoc());
    assertEquals(0, writer.numDocs());

    // the old commit is still visible until the next one
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(10, reader.numDocs());
    reader.close();

    addDocWithIndex(writer, 99);
    writer.commit();
    reader = DirectoryReader.open(dir);
    assertEquals(1, reader.numDocs());
    assertEquals("99", reader.document(0).get("id"));
    reader.close();
    writer.close();
    dir.close();
  }

  public void testDeleteAllRollback() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(2));
    for (int i = 0; i < 7; i++) {
      addDocWithIndex(writer, i);
    }
    writer.commit();
    writer.deleteAll();
    writer.rollback();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(7, reader.numDocs());
    reader.close();
    dir.close();
  }

  public void testRollbackDiscardsUncommitted() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(2));
    for (int i = 0; i < 5; i++) {
      addDocWithIndex(writer, i);
    }
    writer.commit();
    for (int i = 5; i < 20; i++) {
      addDocWithIndex(writer, i);
    }
    writer.deleteDocuments(new Term("id", "0"));
    writer.rollback();
    try {
      addDoc(writer);
      fail("did not hit AlreadyClosedException");
    } catch (AlreadyClosedException e) {
      // expected
    }
    assertFalse(IndexWriter.isLocked(dir));

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(5, reader.numDocs());
    assertEquals(1, reader.docFreq(new Term("id", "0")));
    reader.close();

    // flushed but uncommitted segments were removed
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    assertEquals(5, writer.numDocs());
    writer.close();
    dir.close();
  }

  public void testFlushByMaxBufferedDocs() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(10)
        .setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH)
        .setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 35; i++) {
      addDoc(writer);
    }
    assertEquals(3, writer.getFlushCount());
    assertEquals(3, writer.getSegmentCount());
    assertEquals(5, writer.getNumBufferedDocuments());
    assertTrue(writer.ramSizeInBytes() > 0);
    writer.commit();
    assertEquals(4, writer.getSegmentCount());
    assertEquals(0, writer.getNumBufferedDocuments());
    writer.close();
    dir.close();
  }

  public void testEmptyDocument() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.addDocument(new Document());
    writer.close();
    IndexReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.numDocs());
    assertEquals(0, reader.document(0).getFields().size());
    reader.close();
    dir.close();
  }

  public void testAddDocumentsBlock() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    java.util.List<Document> block = new java.util.ArrayList<Document>();
    for (int i = 0; i < 5; i++) {
      Document doc = new Document();
      doc.add(new StringField("id", "" + i, StringField.Store.YES));
      doc.add(new StringField("group", "g1", StringField.Store.NO));
      block.add(doc);
    }
    writer.addDocuments(block);
    addDocWithIndex(writer, 100);
    writer.commit();

    // the block replaces itself atomically
    for (Document doc : block) {
      doc.removeFields("id");
      doc.add(new StringField("id", "new", StringField.Store.YES));
    }
    writer.updateDocuments(new Term("group", "g1"), block);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    IndexSearcher searcher = new IndexSearcher(reader);
    assertEquals(6, reader.numDocs());
    assertEquals(5, searcher.count(new TermQuery(new Term("id", "new"))));
    assertEquals(0, searcher.count(new TermQuery(new Term("id", "0"))));
    assertEquals(1, searcher.count(new TermQuery(new Term("id", "100"))));
    reader.close();
    dir.close();
  }

  public void testWriterOnFSDirectory() throws IOException {
    java.io.File indexDir = _TestUtil.getTempDir("testWriterOnFSDirectory");
    MockDirectoryWrapper dir = newFSDirectory(indexDir);
    try {
      IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(3));
      for (int i = 0; i < 20; i++) {
        addDocWithIndex(writer, i);
      }
      writer.close();
      IndexReader reader = DirectoryReader.open(dir);
      assertEquals(20, reader.numDocs());
      reader.close();
      dir.close();
    } finally {
      _TestUtil.rmDir(indexDir);
    }
  }

  public void testGetConfigIsPrivateClone() throws IOException {
    Directory dir = new RAMDirectory();
    IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random));
    IndexWriter writer = new IndexWriter(dir, conf);
    assertNotSame(conf, writer.getConfig());
    assertSame(dir, writer.getDirectory());
    final int maxBufferedDocs = writer.getConfig().getMaxBufferedDocs();
    conf.setMaxBufferedDocs(maxBufferedDocs == 123 ? 124 : 123);
    assertEquals(maxBufferedDocs, writer.getConfig().getMaxBufferedDocs());
    writer.close();
    dir.close();
  }

  public void testDeleteUnusedFiles() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    // emulate a platform that cannot delete open files
    dir.setNoDeleteOpenFile(true);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMergePolicy(newLogMergePolicy(10)));
    addDoc(writer);
    writer.commit();
    addDoc(writer);
    writer.commit();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(2, reader.leaves().size());

    writer.forceMerge(1);
    writer.commit();
    // still searchable: its open files could not be deleted
    assertEquals(2, reader.numDocs());
    assertEquals(2, reader.docFreq(new Term("content", "aaa")));
    reader.close();
    writer.deleteUnusedFiles();

    java.util.List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertEquals(1, commits.size());
    java.util.Collection<String> live = commits.get(0).getFileNames();
    for (String file : dir.listAll()) {
      if (!file.equals(IndexWriter.WRITE_LOCK_NAME) && !file.equals(IndexFileNames.SEGMENTS_GEN)) {
        assertTrue("unreferenced file " + file + " was not deleted", live.contains(file));
      }
    }
    writer.close();
    dir.close();
  }
}
