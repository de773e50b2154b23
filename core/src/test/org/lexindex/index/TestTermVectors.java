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
import org.lexindex.analysis.MockTokenizer;
import org.lexindex.document.Document;
import org.lexindex.document.Field;
import org.lexindex.document.FieldType;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestTermVectors extends LexTestCase {

  private static FieldType vectorType(boolean positions, boolean offsets) {
    FieldType type = new FieldType(TextField.TYPE_NOT_STORED);
    type.setStoreTermVectors(true);
    type.setStoreTermVectorPositions(positions);
    type.setStoreTermVectorOffsets(offsets);
    type.freeze();
    return type;
  }

  private IndexWriter newWriter(Directory dir) throws IOException {
    // no payloads, so vectors compare exactly
    return new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random, MockTokenizer.WHITESPACE, true, false)));
  }

  private static void assertNextPosition(DocsAndPositionsEnum dpe, int position, int startOffset, int endOffset) throws IOException {
    assertEquals(position, dpe.nextPosition());
    assertEquals(startOffset, dpe.startOffset());
    assertEquals(endOffset, dpe.endOffset());
  }

  public void testPositionsAndOffsets() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    Document doc = new Document();
    doc.add(new Field("content", "a b a c", vectorType(true, true)));
    doc.add(new TextField("plain", "x y z", StringField.Store.NO));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    Fields vectors = reader.getTermVectors(0);
    assertNotNull(vectors);
    assertEquals(1, vectors.size());
    assertNull(vectors.terms("plain"));

    Terms terms = reader.getTermVector(0, "content");
    assertEquals(3, terms.size());
    assertTrue(terms.hasPositions());
    assertTrue(terms.hasOffsets());
    TermsEnum termsEnum = terms.iterator(null);

    assertEquals(new BytesRef("a"), termsEnum.next());
    assertEquals(2, termsEnum.totalTermFreq());
    DocsAndPositionsEnum dpe = termsEnum.docsAndPositions(null, null);
    assertEquals(0, dpe.nextDoc());
    assertEquals(2, dpe.freq());
    assertNextPosition(dpe, 0, 0, 1);
    assertNextPosition(dpe, 2, 4, 5);
    assertEquals(DocIdSetIterator.NO_MORE_DOCS, dpe.nextDoc());

    assertEquals(new BytesRef("b"), termsEnum.next());
    dpe = termsEnum.docsAndPositions(null, dpe);
    assertEquals(0, dpe.nextDoc());
    assertEquals(1, dpe.freq());
    assertNextPosition(dpe, 1, 2, 3);

    assertEquals(new BytesRef("c"), termsEnum.next());
    dpe = termsEnum.docsAndPositions(null, dpe);
    assertEquals(0, dpe.nextDoc());
    assertNextPosition(dpe, 3, 6, 7);
    assertNull(termsEnum.next());

    reader.close();
    dir.close();
  }

  public void testFreqsOnly() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    Document doc = new Document();
    doc.add(new Field("content", "one two one three one", vectorType(false, false)));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    Terms terms = reader.getTermVector(0, "content");
    assertFalse(terms.hasPositions());
    assertFalse(terms.hasOffsets());
    TermsEnum termsEnum = terms.iterator(null);
    assertEquals(TermsEnum.SeekStatus.FOUND, termsEnum.seekCeil(new BytesRef("one")));
    assertNull(termsEnum.docsAndPositions(null, null));
    DocsEnum docs = termsEnum.docs(null, null);
    assertEquals(0, docs.nextDoc());
    assertEquals(3, docs.freq());
    assertEquals(DocIdSetIterator.NO_MORE_DOCS, docs.nextDoc());
    reader.close();
    dir.close();
  }

  public void testOffsetsWithoutPositions() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    Document doc = new Document();
    doc.add(new Field("content", "abc de", vectorType(false, true)));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    TermsEnum termsEnum = reader.getTermVector(0, "content").iterator(null);
    assertEquals(new BytesRef("abc"), termsEnum.next());
    DocsAndPositionsEnum dpe = termsEnum.docsAndPositions(null, null);
    assertNotNull(dpe);
    assertEquals(0, dpe.nextDoc());
    assertNextPosition(dpe, -1, 0, 3);
    assertEquals(new BytesRef("de"), termsEnum.next());
    dpe = termsEnum.docsAndPositions(null, dpe);
    assertEquals(0, dpe.nextDoc());
    assertNextPosition(dpe, -1, 4, 6);
    reader.close();
    dir.close();
  }

  public void testMultiValuedField() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    Document doc = new Document();
    FieldType type = vectorType(true, true);
    doc.add(new Field("content", "a b", type));
    doc.add(new Field("content", "a c", type));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    TermsEnum termsEnum = reader.getTermVector(0, "content").iterator(null);
    assertEquals(new BytesRef("a"), termsEnum.next());
    DocsAndPositionsEnum dpe = termsEnum.docsAndPositions(null, null);
    assertEquals(0, dpe.nextDoc());
    assertEquals(2, dpe.freq());
    assertNextPosition(dpe, 0, 0, 1);
    // second value continues after the first value's end
    // plus the offset gap
    assertNextPosition(dpe, 2, 4, 5);
    reader.close();
    dir.close();
  }

  public void testDocsWithoutVectors() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = newWriter(dir);
    Document doc = new Document();
    doc.add(new TextField("content", "no vectors here", StringField.Store.NO));
    writer.addDocument(doc);
    doc = new Document();
    doc.add(new Field("content", "vectors here", vectorType(true, false)));
    writer.addDocument(doc);
    writer.forceMerge(1);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertNull(reader.getTermVectors(0));
    assertNull(reader.getTermVector(0, "content"));
    assertNotNull(reader.getTermVector(1, "content"));
    assertEquals(2, reader.getTermVector(1, "content").size());
    assertNull(reader.getTermVector(1, "missing"));
    reader.close();
    dir.close();
  }

  public void testVectorsRequireIndexedField() {
    FieldType type = new FieldType();
    type.setStored(true);
    type.setStoreTermVectors(true);
    try {
      new Field("content", "value", type);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }

  public void testVectorsSurviveMerges() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random, MockTokenizer.WHITESPACE, true, false))
        .setMaxBufferedDocs(_TestUtil.nextInt(random, 2, 20)));
    final FieldType type = vectorType(true, true);
    final int numDocs = atLeast(100);
    final Map<String,String> contents = new HashMap<String,String>();
    for (int i = 0; i < numDocs; i++) {
      final String id = Integer.toString(i);
      final StringBuilder sb = new StringBuilder();
      final int numTokens = 1 + random.nextInt(8);
      for (int j = 0; j < numTokens; j++) {
        if (j > 0) {
          sb.append(' ');
        }
        sb.append((char) ('a' + random.nextInt(6)));
      }
      contents.put(id, sb.toString());
      Document doc = new Document();
      doc.add(new StringField("id", id, StringField.Store.YES));
      doc.add(new Field("content", sb.toString(), type));
      writer.addDocument(doc);
      if (random.nextInt(10) == 3) {
        writer.deleteDocuments(new Term("id", Integer.toString(random.nextInt(i+1))));
      }
    }
    writer.forceMerge(1);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    final Bits liveDocs = MultiFields.getLiveDocs(reader);
    for (int docID = 0; docID < reader.maxDoc(); docID++) {
      if (liveDocs != null && !liveDocs.get(docID)) {
        continue;
      }
      final String content = contents.get(reader.document(docID).get("id"));
      final String[] tokens = content.split(" ");
      final TermsEnum termsEnum = reader.getTermVector(docID, "content").iterator(null);
      int totalFreq = 0;
      BytesRef term;
      while ((term = termsEnum.next()) != null) {
        final DocsAndPositionsEnum dpe = termsEnum.docsAndPositions(null, null);
        assertEquals(0, dpe.nextDoc());
        final int freq = dpe.freq();
        for (int i = 0; i < freq; i++) {
          final int position = dpe.nextPosition();
          assertEquals(term.utf8ToString(), tokens[position]);
          assertEquals(2 * position, dpe.startOffset());
          assertEquals(2 * position + 1, dpe.endOffset());
        }
        totalFreq += freq;
      }
      assertEquals(tokens.length, totalFreq);
    }
    reader.close();
    dir.close();
  }
}
