package org.lexindex.search;

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

import java.util.HashSet;
import java.util.Set;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.analysis.MockTokenizer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.IndexReader;
import org.lexindex.index.RandomIndexWriter;
import org.lexindex.index.Term;
import org.lexindex.store.Directory;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestIndexSearcher extends LexTestCase {
  private static final String[] BODIES = new String[] {
    "apple banana",
    "apricot",
    "banana cherry",
    "blueberry apple",
    "cherry",
    "apple"
  };

  private Directory dir;
  private IndexReader reader;
  private IndexSearcher searcher;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    dir = newDirectory();
    RandomIndexWriter writer = new RandomIndexWriter(random, dir,
        newIndexWriterConfig(new MockAnalyzer(random, MockTokenizer.WHITESPACE, true, false))
            .setMaxBufferedDocs(_TestUtil.nextInt(random, 2, 4)));
    for (int i = 0; i < BODIES.length; i++) {
      Document doc = new Document();
      doc.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
      doc.add(new TextField("body", BODIES[i], StringField.Store.NO));
      writer.addDocument(doc);
    }
    writer.deleteDocuments(new Term("id", "5"));
    reader = writer.getReader();
    writer.close();
    searcher = new IndexSearcher(reader);
  }

  @Override
  public void tearDown() throws Exception {
    reader.close();
    dir.close();
    super.tearDown();
  }

  private Set<String> ids(Query query) throws Exception {
    TopDocs hits = searcher.search(query, 100);
    assertEquals(hits.totalHits, hits.scoreDocs.length);
    Set<String> ids = new HashSet<String>();
    int last = -1;
    for (ScoreDoc hit : hits.scoreDocs) {
      assertTrue("hits must be in docID order", hit.doc > last);
      last = hit.doc;
      ids.add(searcher.doc(hit.doc).get("id"));
    }
    assertEquals(hits.totalHits, searcher.count(query));
    return ids;
  }

  private static Set<String> set(String... values) {
    Set<String> s = new HashSet<String>();
    for (String v : values) {
      s.add(v);
    }
    return s;
  }

  public void testTermQuery() throws Exception {
    // the deleted document is never returned
    assertEquals(set("0", "3"), ids(new TermQuery(new Term("body", "apple"))));
    assertEquals(set("2", "4"), ids(new TermQuery(new Term("body", "cherry"))));
    assertEquals(set(), ids(new TermQuery(new Term("body", "durian"))));
    assertEquals(set(), ids(new TermQuery(new Term("nofield", "apple"))));
    assertEquals(set("1"), ids(new TermQuery(new Term("id", "1"))));
  }

  public void testMatchAllDocs() throws Exception {
    assertEquals(set("0", "1", "2", "3", "4"), ids(new MatchAllDocsQuery()));
  }

  public void testTopNLimitsHitsNotTotal() throws Exception {
    TopDocs hits = searcher.search(new MatchAllDocsQuery(), 2);
    assertEquals(5, hits.totalHits);
    assertEquals(2, hits.scoreDocs.length);
    assertTrue(hits.scoreDocs[0].doc < hits.scoreDocs[1].doc);

    hits = searcher.search(new MatchAllDocsQuery(), 0);
    assertEquals(5, hits.totalHits);
    assertEquals(0, hits.scoreDocs.length);

    try {
      searcher.search(new MatchAllDocsQuery(), -1);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testQueryToStringAndEquality() throws Exception {
    TermQuery tq = new TermQuery(new Term("body", "apple"));
    assertEquals("body:apple", tq.toString());
    assertEquals("apple", tq.toString("body"));
    assertEquals(tq, new TermQuery(new Term("body", "apple")));
    assertEquals(tq.hashCode(), new TermQuery(new Term("body", "apple")).hashCode());
    assertFalse(tq.equals(new TermQuery(new Term("body", "banana"))));

    PrefixQuery pq = new PrefixQuery(new Term("body", "ap"));
    assertEquals("body:ap*", pq.toString());
    assertEquals("ap*", pq.toString("body"));
    assertEquals(pq, new PrefixQuery(new Term("body", "ap")));
    assertEquals(new MatchAllDocsQuery(), new MatchAllDocsQuery());
  }
}
