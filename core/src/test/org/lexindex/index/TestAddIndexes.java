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
import org.lexindex.document.BinaryDocValuesField;
import org.lexindex.document.Document;
import org.lexindex.document.NumericDocValuesField;
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

public class TestAddIndexes extends LexTestCase {

  private static IndexWriter newWriter(Directory dir, IndexWriterConfig conf) throws IOException {
    conf.setMergePolicy(new LogDocMergePolicy());
    return new IndexWriter(dir, conf);
  }

  private static void addDocs(IndexWriter writer, int start, int numDocs) throws IOException {
    for (int i = start; i < start + numDocs; i++) {
      Document doc = new Document();
      doc.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
      doc.add(new TextField("content", "aaa " + i, StringField.Store.NO));
      doc.add(new NumericDocValuesField("number", 3L * i));
      writer.addDocument(doc);
    }
  }

  private static void verifyNumDocs(Directory dir, int numDocs) throws IOException {
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(numDocs, reader.numDocs());
    reader.close();
  }

  // every live document carries number == 3 * id
  private static void verifyDocValues(Directory dir) throws IOException {
    DirectoryReader reader = DirectoryReader.open(dir);
    for (AtomicReaderContext ctx : reader.leaves()) {
      AtomicReader leaf = ctx.reader();
      NumericDocValues numbers = leaf.getNumericDocValues("number");
      assertNotNull(numbers);
      Bits liveDocs = leaf.getLiveDocs();
      for (int docID = 0; docID < leaf.maxDoc(); docID++) {
        if (liveDocs == null || liveDocs.get(docID)) {
          final long id = Long.parseLong(leaf.document(docID).get("id"));
          assertEquals(3L * id, numbers.get(docID));
        }
      }
    }
    reader.close();
  }

  public void testSimpleCase() throws IOException {
    // main directory
    Directory dir = newDirectory();
    // two auxiliary directories
    Directory aux = newDirectory();
    Directory aux2 = newDirectory();

    IndexWriter writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setOpenMode(OpenMode.CREATE));
    addDocs(writer, 0, 100);
    assertEquals(100, writer.maxDoc());
    writer.close();

    writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random))
        .setOpenMode(OpenMode.CREATE));
    addDocs(writer, 100, 40);
    writer.deleteDocuments(new Term("id", "105"));
    writer.close();

    writer = newWriter(aux2, newIndexWriterConfig(new MockAnalyzer(random))
        .setOpenMode(OpenMode.CREATE));
    addDocs(writer, 140, 50);
    writer.close();

    DirectoryReader auxReader = DirectoryReader.open(aux);
    final int auxMaxDoc = auxReader.maxDoc();
    auxReader.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setOpenMode(OpenMode.APPEND));
    writer.addIndexes(aux, aux2);

    // copied segments keep their deletions
    assertEquals(150 + auxMaxDoc, writer.maxDoc());
    assertEquals(189, writer.numDocs());

    // not visible until committed
    verifyNumDocs(dir, 100);
    writer.close();

    _TestUtil.checkIndex(dir);
    verifyNumDocs(dir, 189);
    verifyDocValues(dir);

    DirectoryReader reader = DirectoryReader.open(dir);
    DocsEnum docs = MultiFields.getTermDocsEnum(reader, MultiFields.getLiveDocs(reader), "id", new BytesRef("105"));
    assertTrue(docs == null || docs.nextDoc() == DocIdSetIterator.NO_MORE_DOCS);
    assertEquals(1, reader.docFreq(new Term("id", "104")));
    reader.close();

    // sources are untouched
    verifyNumDocs(aux, 39);
    verifyNumDocs(aux2, 50);

    dir.close();
    aux.close();
    aux2.close();
  }

  public void testAddIndexesWithReaders() throws IOException {
    Directory dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 0, 30);
    writer.close();

    writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(5));
    addDocs(writer, 30, 40);
    for (int i = 30; i < 70; i += 4) {
      writer.deleteDocuments(new Term("id", Integer.toString(i)));
    }
    writer.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setOpenMode(OpenMode.APPEND));
    DirectoryReader auxReader = DirectoryReader.open(aux);
    assertEquals(30, auxReader.numDocs());
    writer.addIndexes(auxReader);
    // the readers are merged into one new segment and
    // deleted documents are dropped
    assertEquals(60, writer.maxDoc());
    assertEquals(60, writer.numDocs());
    writer.close();
    assertEquals(1, auxReader.getRefCount());
    auxReader.close();

    _TestUtil.checkIndex(dir);
    verifyNumDocs(dir, 60);
    verifyDocValues(dir);

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(0, reader.docFreq(new Term("id", "30")));
    assertEquals(1, reader.docFreq(new Term("id", "31")));
    reader.close();

    dir.close();
    aux.close();
  }

  public void testAddNoLiveDocs() throws IOException {
    Directory dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 0, 5);
    writer.deleteDocuments(new Term("content", "aaa"));
    writer.commit();
    DirectoryReader auxReader = DirectoryReader.open(writer, true);
    writer.close();
    assertEquals(0, auxReader.numDocs());

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 10, 3);
    writer.addIndexes(auxReader);
    assertEquals(3, writer.maxDoc());
    writer.close();
    auxReader.close();

    verifyNumDocs(dir, 3);
    dir.close();
    aux.close();
  }

  public void testAddSelfOrDuplicate() throws IOException {
    Directory dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 0, 10);
    writer.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 10, 10);
    writer.commit();

    try {
      writer.addIndexes(dir);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
    try {
      writer.addIndexes(aux, aux);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
    assertEquals(10, writer.maxDoc());
    writer.close();

    verifyNumDocs(dir, 10);
    dir.close();
    aux.close();
  }

  public void testDocValuesTypeConflict() throws IOException {
    Directory dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StringField("id", "aux", StringField.Store.YES));
    doc.add(new BinaryDocValuesField("number", new BytesRef("not a number")));
    writer.addDocument(doc);
    writer.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 0, 10);
    writer.commit();

    try {
      writer.addIndexes(aux);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }

    DirectoryReader auxReader = DirectoryReader.open(aux);
    try {
      writer.addIndexes(auxReader);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
    auxReader.close();

    // nothing was added and the writer is still usable
    assertEquals(10, writer.maxDoc());
    addDocs(writer, 10, 1);
    writer.close();
    verifyNumDocs(dir, 11);
    verifyDocValues(dir);
    TestIndexFileDeleter.assertNoUnreferencedFiles(dir, "conflicting addIndexes left files behind");

    dir.close();
    aux.close();
  }

  public void testRollbackDiscardsCopiedSegments() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(7));
    addDocs(writer, 0, 30);
    writer.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    addDocs(writer, 30, 5);
    writer.commit();
    writer.addIndexes(aux);
    DirectoryReader auxReader = DirectoryReader.open(aux);
    writer.addIndexes(auxReader);
    auxReader.close();
    assertEquals(65, writer.maxDoc());
    writer.rollback();

    verifyNumDocs(dir, 5);
    TestIndexFileDeleter.assertNoUnreferencedFiles(dir, "rollback after addIndexes left files behind");

    dir.close();
    aux.close();
  }

  public void testAddIndexesThenMerge() throws IOException {
    Directory dir = newDirectory();
    Directory aux = newDirectory();

    IndexWriter writer = newWriter(aux, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(4));
    addDocs(writer, 0, 25);
    writer.deleteDocuments(new Term("id", "3"));
    writer.close();

    writer = newWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(4));
    addDocs(writer, 25, 25);
    writer.addIndexes(aux);
    writer.forceMerge(1);
    assertEquals(49, writer.maxDoc());
    writer.close();

    _TestUtil.checkIndex(dir);
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.leaves().size());
    assertFalse(reader.hasDeletions());
    reader.close();
    verifyDocValues(dir);

    dir.close();
    aux.close();
  }
}
