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
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.AlreadyClosedException;
import org.lexindex.store.Directory;
import org.lexindex.util.LexTestCase;

public class TestDirectoryReader extends LexTestCase {

  private static void addDoc(IndexWriter writer, int id) throws IOException {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("body", "common " + (id % 2 == 0 ? "even" : "odd"), StringField.Store.NO));
    writer.addDocument(doc);
  }

  private IndexWriter newWriter(Directory dir) throws IOException {
    return new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(100)
        .setMergePolicy(NoMergePolicy.INSTANCE));
  }

  public void testIndexExists() throws Exception {
    Directory dir = newDirectory();
    assertFalse(DirectoryReader.indexExists(dir));
    try {
      DirectoryReader.open(dir);
      fail("did not hit expected exception");
    } catch (IndexNotFoundException e) {
      // expected
    }

    IndexWriter writer = newWriter(dir);
    // nothing committed yet
    assertFalse(DirectoryReader.indexExists(dir));
    writer.commit();
    assertTrue(DirectoryReader.indexExists(dir));
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(0, reader.maxDoc());
    assertEquals(0, reader.leaves().size());
    reader.close();
    dir.close();
  }

  public void testRefCounting() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    addDoc(writer, 0);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.getRefCount());
    reader.incRef();
    assertEquals(2, reader.getRefCount());
    reader.close();
    assertEquals(1, reader.getRefCount());
    // still usable with one reference left
    assertEquals(1, reader.numDocs());
    reader.decRef();
    assertEquals(0, reader.getRefCount());
    assertFalse(reader.tryIncRef());

    try {
      reader.incRef();
      fail("did not hit expected exception");
    } catch (AlreadyClosedException e) {
      // expected
    }
    try {
      reader.docFreq(new Term("id", "0"));
      fail("did not hit expected exception");
    } catch (AlreadyClosedException e) {
      // expected
    }
    try {
      reader.decRef();
      fail("did not hit expected exception");
    } catch (AlreadyClosedException e) {
      // expected
    }
    dir.close();
  }

  public void testReaderClosedListeners() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    addDoc(writer, 0);
    writer.commit();
    addDoc(writer, 1);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(2, reader.leaves().size());
    final AtomicInteger closeCount = new AtomicInteger();
    IndexReader.ReaderClosedListener listener = new IndexReader.ReaderClosedListener() {
      @Override
      public void onClose(IndexReader r) {
        closeCount.incrementAndGet();
      }
    };
    reader.addReaderClosedListener(listener);
    for (AtomicReaderContext ctx : reader.leaves()) {
      ctx.reader().addReaderClosedListener(listener);
    }
    IndexReader.ReaderClosedListener removed = new IndexReader.ReaderClosedListener() {
      @Override
      public void onClose(IndexReader r) {
        fail("removed listener must not be notified");
      }
    };
    reader.addReaderClosedListener(removed);
    reader.removeReaderClosedListener(removed);

    reader.close();
    assertEquals(3, closeCount.get());
    dir.close();
  }

  public void testOpenIfChangedSharesUnchangedSegments() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    for (int i = 0; i < 4; i++) {
      addDoc(writer, i);
    }
    writer.commit();
    addDoc(writer, 4);
    addDoc(writer, 5);
    writer.commit();

    DirectoryReader r1 = DirectoryReader.open(dir);
    assertEquals(2, r1.leaves().size());
    assertNull(DirectoryReader.openIfChanged(r1));

    // delete from the second segment, add a third one
    writer.deleteDocuments(new Term("id", "4"));
    addDoc(writer, 6);
    writer.commit();

    DirectoryReader r2 = DirectoryReader.openIfChanged(r1);
    assertNotNull(r2);
    assertTrue(r2.getVersion() > r1.getVersion());
    assertEquals(3, r2.leaves().size());
    assertEquals(6, r2.numDocs());
    assertEquals(7, r2.maxDoc());

    AtomicReader first1 = r1.leaves().get(0).reader();
    AtomicReader first2 = r2.leaves().get(0).reader();
    // untouched segment is the very same reader
    assertSame(first1, first2);
    assertEquals(2, first1.getRefCount());

    AtomicReader second1 = r1.leaves().get(1).reader();
    AtomicReader second2 = r2.leaves().get(1).reader();
    // new deletions: new reader over the shared core
    assertNotSame(second1, second2);
    assertSame(second1.getCoreCacheKey(), second2.getCoreCacheKey());
    assertFalse(second1.hasDeletions());
    assertTrue(second2.hasDeletions());

    r1.close();
    assertEquals(1, first2.getRefCount());
    assertEquals(6, r2.numDocs());
    r2.close();
    writer.close();
    dir.close();
  }

  public void testOpenPriorCommit() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setIndexDeletionPolicy(NoDeletionPolicy.INSTANCE));
    for (int i = 0; i < 3; i++) {
      addDoc(writer, i);
      writer.commit();
    }
    writer.close();

    List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertEquals(3, commits.size());
    List<DirectoryReader> readers = new ArrayList<DirectoryReader>();
    for (int i = 0; i < commits.size(); i++) {
      DirectoryReader reader = DirectoryReader.open(commits.get(i));
      assertEquals(i + 1, reader.numDocs());
      assertEquals(commits.get(i), reader.getIndexCommit());
      readers.add(reader);
    }

    DirectoryReader moved = DirectoryReader.openIfChanged(readers.get(2), commits.get(0));
    assertNotNull(moved);
    assertEquals(1, moved.numDocs());
    assertNull(DirectoryReader.openIfChanged(readers.get(0), commits.get(0)));
    moved.close();

    for (DirectoryReader reader : readers) {
      reader.close();
    }
    dir.close();
  }

  public void testMultiReader() throws Exception {
    Directory dir1 = newDirectory();
    Directory dir2 = newDirectory();
    IndexWriter writer = newWriter(dir1);
    for (int i = 0; i < 3; i++) {
      addDoc(writer, i);
    }
    writer.close();
    writer = newWriter(dir2);
    for (int i = 3; i < 7; i++) {
      addDoc(writer, i);
    }
    writer.deleteDocuments(new Term("id", "6"));
    writer.close();

    DirectoryReader r1 = DirectoryReader.open(dir1);
    DirectoryReader r2 = DirectoryReader.open(dir2);
    MultiReader multi = new MultiReader(new IndexReader[] {r1, r2}, false);
    assertEquals(2, r1.getRefCount());
    assertEquals(7, multi.maxDoc());
    assertEquals(6, multi.numDocs());
    assertEquals(1, multi.numDeletedDocs());
    // docFreq does not account for deletions
    assertEquals(7, multi.docFreq(new Term("body", "common")));
    assertEquals(4, multi.docFreq(new Term("body", "even")));
    assertEquals("4", multi.document(4).get("id"));
    assertEquals(r1.leaves().size() + r2.leaves().size(), multi.leaves().size());

    multi.close();
    // sub readers survive since the multi reader only held a reference
    assertEquals(1, r1.getRefCount());
    assertEquals(3, r1.numDocs());

    MultiReader owning = new MultiReader(r1, r2);
    owning.close();
    assertEquals(0, r1.getRefCount());
    assertEquals(0, r2.getRefCount());
    dir1.close();
    dir2.close();
  }
}
