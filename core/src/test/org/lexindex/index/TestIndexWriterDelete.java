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
import org.lexindex.analysis.MockTokenizer;
import org.lexindex.document.Document;
import org.lexindex.document.StoredField;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.search.IndexSearcher;
import org.lexindex.search.MatchAllDocsQuery;
import org.lexindex.search.PrefixQuery;
import org.lexindex.search.TermQuery;
import org.lexindex.store.Directory;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.LexTestCase;

public class TestIndexWriterDelete extends LexTestCase {

  // test the simple case
  public void testSimpleCase() throws IOException {
    String[] keywords = { "1", "2" };
    String[] unindexed = { "Netherlands", "Italy" };
    String[] unstored = { "Amsterdam has lots of bridges",
        "Venice has lots of canals" };
    String[] text = { "Amsterdam", "Venice" };

    Directory dir = newDirectory();
    IndexWriter modifier = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDeleteTerms(1));

    for (int i = 0; i < keywords.length; i++) {
      Document doc = new Document();
      doc.add(new StringField("id", keywords[i], StringField.Store.YES));
      doc.add(new StoredField("country", unindexed[i]));
      doc.add(new TextField("contents", unstored[i], StringField.Store.NO));
      doc.add(new TextField("city", text[i], StringField.Store.YES));
      modifier.addDocument(doc);
    }
    modifier.forceMerge(1);
    modifier.commit();

    Term term = new Term("city", "Amsterdam");
    int hitCount = getHitCount(dir, term);
    assertEquals(1, hitCount);
    if (VERBOSE) {
      System.out.println("\nTEST: now delete by term=" + term);
    }
    modifier.deleteDocuments(term);
    modifier.commit();

    if (VERBOSE) {
      System.out.println("\nTEST: now getHitCount");
    }
    hitCount = getHitCount(dir, term);
    assertEquals(0, hitCount);

    modifier.close();
    dir.close();
  }

  // 100 docs with ids 0..99; delete id 50, commit, reopen: exactly
  // the other 99 ids are each found once
  public void testDeleteOneOfHundred() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    for (int i = 0; i < 100; i++) {
      addDoc(writer, i, i);
    }
    writer.deleteDocuments(new Term("id", "50"));
    writer.commit();

    DirectoryReader reader = DirectoryReader.open(dir);
    IndexSearcher searcher = new IndexSearcher(reader);
    assertEquals(99, reader.numDocs());
    assertEquals(0, searcher.search(new TermQuery(new Term("id", "50")), 10).totalHits);
    for (int i = 0; i < 100; i++) {
      if (i != 50) {
        assertEquals("id=" + i, 1, searcher.search(new TermQuery(new Term("id", String.valueOf(i))), 10).totalHits);
      }
    }
    reader.close();
    writer.close();
    dir.close();
  }

  // test when delete terms only apply to disk segments
  public void testNonRAMDelete() throws IOException {

    Directory dir = newDirectory();
    IndexWriter modifier = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDocs(2)
        .setMaxBufferedDeleteTerms(2));
    int id = 0;
    int value = 100;

    for (int i = 0; i < 7; i++) {
      addDoc(modifier, ++id, value);
    }
    modifier.commit();

    assertEquals(0, modifier.getNumBufferedDocuments());
    assertTrue(0 < modifier.getSegmentCount());

    modifier.commit();

    IndexReader reader = DirectoryReader.open(dir);
    assertEquals(7, reader.numDocs());
    reader.close();

    modifier.deleteDocuments(new Term("value", String.valueOf(value)));

    modifier.commit();

    reader = DirectoryReader.open(dir);
    assertEquals(0, reader.numDocs());
    reader.close();
    modifier.close();
    dir.close();
  }

  public void testMaxBufferedDeletes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDeleteTerms(1));

    writer.addDocument(new Document());
    writer.deleteDocuments(new Term("foobar", "1"));
    writer.deleteDocuments(new Term("foobar", "1"));
    writer.deleteDocuments(new Term("foobar", "1"));
    assertEquals(3, writer.getFlushDeletesCount());
    writer.close();
    dir.close();
  }

  // test when delete terms only apply to ram segments
  public void testRAMDeletes() throws IOException {
    for(int t=0;t<2;t++) {
      if (VERBOSE) {
        System.out.println("TEST: t=" + t);
      }
      Directory dir = newDirectory();
      IndexWriter modifier = new IndexWriter(dir, newIndexWriterConfig(
          new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDocs(4)
          .setMaxBufferedDeleteTerms(4));
      int id = 0;
      int value = 100;

      addDoc(modifier, ++id, value);
      if (0 == t)
        modifier.deleteDocuments(new Term("value", String.valueOf(value)));
      else
        modifier.deleteDocuments(new TermQuery(new Term("value", String.valueOf(value))));
      addDoc(modifier, ++id, value);
      if (0 == t) {
        modifier.deleteDocuments(new Term("value", String.valueOf(value)));
        assertEquals(2, modifier.getNumBufferedDocuments());
      }
      else
        modifier.deleteDocuments(new TermQuery(new Term("value", String.valueOf(value))));

      addDoc(modifier, ++id, value);
      assertEquals(0, modifier.getSegmentCount());
      modifier.commit();

      IndexReader reader = DirectoryReader.open(dir);
      assertEquals(1, reader.numDocs());

      int hitCount = getHitCount(dir, new Term("id", String.valueOf(id)));
      assertEquals(1, hitCount);
      reader.close();
      modifier.close();
      dir.close();
    }
  }

  // test when delete terms apply to both disk and ram segments
  public void testBothDeletes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter modifier = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDocs(100)
        .setMaxBufferedDeleteTerms(100));

    int id = 0;
    int value = 100;

    for (int i = 0; i < 5; i++) {
      addDoc(modifier, ++id, value);
    }

    value = 200;
    for (int i = 0; i < 5; i++) {
      addDoc(modifier, ++id, value);
    }
    modifier.commit();

    for (int i = 0; i < 5; i++) {
      addDoc(modifier, ++id, value);
    }
    modifier.deleteDocuments(new Term("value", String.valueOf(value)));

    modifier.commit();

    IndexReader reader = DirectoryReader.open(dir);
    assertEquals(5, reader.numDocs());
    modifier.close();
    reader.close();
    dir.close();
  }

  // test that batched delete terms are flushed together
  public void testBatchDeletes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter modifier = new IndexWriter(dir, newIndexWriterConfig(
        new MockAnalyzer(random, MockTokenizer.WHITESPACE, false)).setMaxBufferedDocs(2)
        .setMaxBufferedDeleteTerms(2));

    int id = 0;
    int value = 100;

    for (int i = 0; i < 7; i++) {
      addDoc(modifier, ++id, value);
    }
    modifier.commit();

    IndexReader reader = DirectoryReader.open(dir);
    assertEquals(7, reader.numDocs());
    reader.close();

    id = 0;
    modifier.deleteDocuments(new Term("id", String.valueOf(++id)));
    modifier.deleteDocuments(new Term("id", String.valueOf(++id)));

    modifier.commit();

    reader = DirectoryReader.open(dir);
    assertEquals(5, reader.numDocs());
    reader.close();

    Term[] terms = new Term[3];
    for (int i = 0; i < terms.length; i++) {
      terms[i] = new Term("id", String.valueOf(++id));
    }
    modifier.deleteDocuments(terms);
    modifier.commit();
    reader = DirectoryReader.open(dir);
    assertEquals(2, reader.numDocs());
    reader.close();

    modifier.close();
    dir.close();
  }

  public void testDeleteByQuery() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    for (int i = 0; i < 30; i++) {
      addDoc(writer, i, i % 3);
    }
    writer.commit();
    // ids 1x and 2x: 1, 2, 10..29
    writer.deleteDocuments(new PrefixQuery(new Term("id", "1")), new PrefixQuery(new Term("id", "2")));
    writer.commit();
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(8, reader.numDocs());
    reader.close();

    writer.deleteDocuments(new MatchAllDocsQuery());
    writer.close();
    reader = DirectoryReader.open(dir);
    assertEquals(0, reader.numDocs());
    reader.close();
    dir.close();
  }

  // a delete-by-query only affects documents added before it
  public void testDeleteByQueryDoesNotAffectLaterDocs() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDoc(writer, 1, 7);
    writer.deleteDocuments(new TermQuery(new Term("value", "7")));
    addDoc(writer, 2, 7);
    writer.commit();
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.numDocs());
    assertEquals(0, new IndexSearcher(reader).count(new TermQuery(new Term("id", "1"))));
    assertEquals(1, new IndexSearcher(reader).count(new TermQuery(new Term("id", "2"))));
    reader.close();
    writer.close();
    dir.close();
  }

  public void testUpdateDocument() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(3));
    for (int i = 0; i < 10; i++) {
      addDoc(writer, i, 1);
    }
    writer.commit();
    // replace each doc several times, some in flushed segments,
    // some still buffered
    for (int round = 0; round < 3; round++) {
      for (int i = 0; i < 10; i++) {
        Document doc = new Document();
        doc.add(new StringField("id", String.valueOf(i), StringField.Store.YES));
        doc.add(new StringField("value", "round" + round, StringField.Store.NO));
        writer.updateDocument(new Term("id", String.valueOf(i)), doc);
      }
    }
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    IndexSearcher searcher = new IndexSearcher(reader);
    assertEquals(10, reader.numDocs());
    assertEquals(10, searcher.count(new TermQuery(new Term("value", "round2"))));
    assertEquals(0, searcher.count(new TermQuery(new Term("value", "round1"))));
    for (int i = 0; i < 10; i++) {
      assertEquals(1, searcher.count(new TermQuery(new Term("id", String.valueOf(i)))));
    }
    reader.close();
    dir.close();
  }

  // deleting a term that matches nothing commits nothing but
  // still counts as a change
  public void testDeleteMissingTerm() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDoc(writer, 1, 1);
    writer.commit();
    writer.deleteDocuments(new Term("id", "does-not-exist"));
    assertTrue(writer.hasUncommittedChanges());
    writer.commit();
    assertFalse(writer.hasDeletions());
    assertEquals(1, writer.numDocs());
    writer.close();
    dir.close();
  }

  // a segment whose documents are all deleted is dropped
  public void testFullyDeletedSegmentIsDropped() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 5; i++) {
      addDoc(writer, i, 100);
    }
    writer.commit();
    for (int i = 5; i < 10; i++) {
      addDoc(writer, i, 200);
    }
    writer.commit();
    assertEquals(2, writer.getSegmentCount());
    writer.deleteDocuments(new Term("value", "100"));
    writer.commit();
    assertEquals(1, writer.getSegmentCount());
    assertEquals(5, writer.maxDoc());
    writer.close();
    dir.close();
  }

  public void testDeletesOnDiskFullRetry() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler()).setMergePolicy(NoMergePolicy.INSTANCE));
    for (int i = 0; i < 20; i++) {
      addDoc(writer, i, i % 2);
    }
    writer.commit();

    // the live docs write fails the first time
    final boolean[] failed = new boolean[1];
    dir.failOn(new MockDirectoryWrapper.Failure() {
      @Override
      public void eval(MockDirectoryWrapper dir) throws IOException {
        if (!failed[0]) {
          for (StackTraceElement frame : new Exception().getStackTrace()) {
            if ("writeLiveDocs".equals(frame.getMethodName())) {
              failed[0] = true;
              throw new IOException("now failing on purpose during writeLiveDocs");
            }
          }
        }
      }
    });
    writer.deleteDocuments(new Term("value", "0"));
    try {
      writer.commit();
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }
    assertTrue(failed[0]);
    writer.commit();
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(10, reader.numDocs());
    reader.close();
    dir.close();
  }

  private void addDoc(IndexWriter modifier, int id, int value)
      throws IOException {
    Document doc = new Document();
    doc.add(new TextField("content", "aaa", StringField.Store.NO));
    doc.add(new StringField("id", String.valueOf(id), StringField.Store.YES));
    doc.add(new StringField("value", String.valueOf(value), StringField.Store.NO));
    modifier.addDocument(doc);
  }

  private int getHitCount(Directory dir, Term term) throws IOException {
    IndexReader reader = DirectoryReader.open(dir);
    IndexSearcher searcher = new IndexSearcher(reader);
    int hitCount = searcher.search(new TermQuery(term), 1000).totalHits;
    reader.close();
    return hitCount;
  }
}
