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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.analysis.MockTokenizer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.index.IndexReader;
import org.lexindex.index.RandomIndexWriter;
import org.lexindex.index.Term;
import org.lexindex.store.Directory;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;
import org.lexindex.util.automaton.Automata;
import org.lexindex.util.automaton.Automaton;

public class TestAutomatonQuery extends LexTestCase {
  private Directory dir;
  private IndexReader reader;
  private IndexSearcher searcher;
  private List<String> terms;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    dir = newDirectory();
    RandomIndexWriter writer = new RandomIndexWriter(random, dir,
        newIndexWriterConfig(new MockAnalyzer(random, MockTokenizer.KEYWORD, false, false)));
    terms = new ArrayList<String>();
    final int numDocs = atLeast(200);
    for (int i = 0; i < numDocs; i++) {
      String term = "a" + _TestUtil.randomSimpleString(random);
      terms.add(term);
      Document doc = new Document();
      doc.add(new StringField("field", term, StringField.Store.YES));
      writer.addDocument(doc);
    }
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

  private int expectedWithPrefix(String prefix) {
    int count = 0;
    for (String term : terms) {
      if (term.startsWith(prefix)) {
        count++;
      }
    }
    return count;
  }

  private int expectedIn(List<String> accepted) {
    int count = 0;
    for (String term : terms) {
      if (accepted.contains(term)) {
        count++;
      }
    }
    return count;
  }

  public void testPrefixQuery() throws Exception {
    final int iters = atLeast(20);
    for (int i = 0; i < iters; i++) {
      String prefix = "a" + _TestUtil.randomSimpleString(random);
      prefix = prefix.substring(0, Math.min(prefix.length(), _TestUtil.nextInt(random, 1, 3)));
      PrefixQuery query = new PrefixQuery(new Term("field", prefix));
      assertEquals("prefix=" + prefix, expectedWithPrefix(prefix), searcher.count(query));
    }
  }

  public void testEmptyPrefixMatchesEveryTerm() throws Exception {
    assertEquals(terms.size(), searcher.count(new PrefixQuery(new Term("field", ""))));
  }

  public void testStringUnion() throws Exception {
    List<String> picked = new ArrayList<String>();
    final int count = _TestUtil.nextInt(random, 1, 10);
    for (int i = 0; i < count; i++) {
      picked.add(terms.get(random.nextInt(terms.size())));
    }
    // a term that is not indexed
    picked.add("zzzzzzzzzzzzzzzzzzzzzzzzzz");
    Collections.sort(picked);
    List<BytesRef> sorted = new ArrayList<BytesRef>();
    for (String s : picked) {
      BytesRef b = new BytesRef(s);
      if (sorted.isEmpty() || !sorted.get(sorted.size() - 1).equals(b)) {
        sorted.add(b);
      }
    }
    Automaton a = Automata.makeStringUnion(sorted);
    assertEquals(expectedIn(picked), searcher.count(new AutomatonQuery(new Term("field", ""), a)));
  }

  public void testEmptyAndAnyAutomaton() throws Exception {
    assertEquals(0, searcher.count(new AutomatonQuery(new Term("field", ""), Automata.makeEmpty())));
    assertEquals(terms.size(), searcher.count(new AutomatonQuery(new Term("field", ""), Automata.makeAnyBinary())));
    // no such field
    assertEquals(0, searcher.count(new AutomatonQuery(new Term("other", ""), Automata.makeAnyBinary())));
  }

  public void testSingleTerm() throws Exception {
    String term = terms.get(random.nextInt(terms.size()));
    Automaton a = Automata.makeString(term);
    assertEquals(expectedIn(Collections.singletonList(term)),
                 searcher.count(new AutomatonQuery(new Term("field", ""), a)));
    assertEquals(searcher.count(new TermQuery(new Term("field", term))),
                 searcher.count(new AutomatonQuery(new Term("field", ""), a)));
  }
}
