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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StoredField;
import org.lexindex.document.StringField;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestMultiFields extends LexTestCase {

  public void testRandom() throws Exception {
    final int numIters = atLeast(2);
    for (int iter = 0; iter < numIters; iter++) {
      Directory dir = newDirectory();
      IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
          .setMaxBufferedDocs(_TestUtil.nextInt(random, 2, 10))
          .setMergePolicy(NoMergePolicy.INSTANCE));

      Map<String,Set<String>> idsByTerm = new HashMap<String,Set<String>>();
      Set<String> deleted = new HashSet<String>();
      List<String> terms = new ArrayList<String>();

      final int numDocs = _TestUtil.nextInt(random, 1, 100 * RANDOM_MULTIPLIER);
      for (int i = 0; i < numDocs; i++) {
        final String id = Integer.toString(i);
        Document doc = new Document();
        doc.add(new StringField("id", id, StringField.Store.YES));
        final int termCount = _TestUtil.nextInt(random, 0, 3);
        for (int j = 0; j < termCount; j++) {
          String term;
          if (terms.size() == 0 || random.nextBoolean()) {
            term = _TestUtil.randomUnicodeString(random, 10);
            terms.add(term);
          } else {
            term = terms.get(random.nextInt(terms.size()));
          }
          Set<String> ids = idsByTerm.get(term);
          if (ids == null) {
            ids = new HashSet<String>();
            idsByTerm.put(term, ids);
          }
          ids.add(id);
          doc.add(new StringField("field", term, StringField.Store.NO));
        }
        w.addDocument(doc);
        if (i > 0 && random.nextInt(10) == 7) {
          // delete a random earlier document
          final String delID = Integer.toString(random.nextInt(i));
          deleted.add(delID);
          w.deleteDocuments(new Term("id", delID));
        }
      }

      DirectoryReader reader = DirectoryReader.open(w, true);
      w.close();

      Bits liveDocs = MultiFields.getLiveDocs(reader);
      assertEquals(reader.hasDeletions(), liveDocs != null);
      assertEquals(numDocs - deleted.size(), reader.numDocs());

      Terms fieldTerms = MultiFields.getTerms(reader, "field");
      TreeSet<BytesRef> allTerms = new TreeSet<BytesRef>(BytesRef.getUTF8SortedAsUnicodeComparator());
      TreeSet<BytesRef> liveTerms = new TreeSet<BytesRef>(BytesRef.getUTF8SortedAsUnicodeComparator());
      for (Map.Entry<String,Set<String>> ent : idsByTerm.entrySet()) {
        allTerms.add(new BytesRef(ent.getKey()));
        if (!deleted.containsAll(ent.getValue())) {
          liveTerms.add(new BytesRef(ent.getKey()));
        }
      }
      List<BytesRef> actual = new ArrayList<BytesRef>();
      if (fieldTerms != null) {
        TermsEnum te = fieldTerms.iterator(null);
        BytesRef term;
        while ((term = te.next()) != null) {
          if (actual.size() > 0) {
            // merged terms are sorted and unique
            assertTrue(BytesRef.getUTF8SortedAsUnicodeComparator().compare(actual.get(actual.size() - 1), term) < 0);
          }
          actual.add(BytesRef.deepCopyOf(term));
        }
      }
      // terms of dropped, fully deleted segments may be gone
      assertTrue(allTerms.containsAll(actual));
      assertTrue(actual.containsAll(liveTerms));

      for (Map.Entry<String,Set<String>> ent : idsByTerm.entrySet()) {
        Set<String> expected = new HashSet<String>(ent.getValue());
        expected.removeAll(deleted);
        DocsEnum docs = MultiFields.getTermDocsEnum(reader, liveDocs, "field", new BytesRef(ent.getKey()));
        Set<String> actualIds = new HashSet<String>();
        if (docs != null) {
          int last = -1;
          int doc;
          while ((doc = docs.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
            assertTrue(doc > last);
            last = doc;
            actualIds.add(reader.document(doc).get("id"));
          }
        }
        assertEquals("term=" + ent.getKey(), expected, actualIds);
      }

      reader.close();
      dir.close();
    }
  }

  public void testSeparateEnums() throws Exception {
    Directory dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document d = new Document();
    d.add(new StringField("f", "j", StringField.Store.NO));
    w.addDocument(d);
    w.commit();
    w.addDocument(d);
    IndexReader r = DirectoryReader.open(w, true);
    w.close();
    DocsEnum d1 = MultiFields.getTermDocsEnum(r, null, "f", new BytesRef("j"));
    DocsEnum d2 = MultiFields.getTermDocsEnum(r, null, "f", new BytesRef("j"));
    assertEquals(0, d1.nextDoc());
    assertEquals(0, d2.nextDoc());
    assertEquals(1, d1.nextDoc());
    assertEquals(1, d2.nextDoc());
    assertEquals(DocIdSetIterator.NO_MORE_DOCS, d1.nextDoc());
    r.close();
    dir.close();
  }

  public void testFieldInfosAndIndexedFields() throws Exception {
    Directory dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergePolicy(NoMergePolicy.INSTANCE));
    Document d = new Document();
    d.add(new StringField("a", "x", StringField.Store.NO));
    w.addDocument(d);
    w.commit();
    d = new Document();
    d.add(new StringField("b", "y", StringField.Store.NO));
    d.add(new StoredField("stored", "only stored"));
    w.addDocument(d);
    IndexReader r = DirectoryReader.open(w, true);
    w.close();

    assertEquals(2, r.leaves().size());
    FieldInfos infos = MultiFields.getMergedFieldInfos(r);
    assertEquals(3, infos.size());
    assertTrue(infos.fieldInfo("a").isIndexed());
    assertFalse(infos.fieldInfo("stored").isIndexed());

    Set<String> indexed = new HashSet<String>(MultiFields.getIndexedFields(r));
    Set<String> expected = new HashSet<String>();
    expected.add("a");
    expected.add("b");
    assertEquals(expected, indexed);

    Fields fields = MultiFields.getFields(r);
    Set<String> names = new HashSet<String>();
    for (String field : fields) {
      names.add(field);
    }
    assertEquals(expected, names);
    assertNull(MultiFields.getTerms(r, "stored"));
    assertNull(MultiFields.getLiveDocs(r));
    r.close();
    dir.close();
  }
}
