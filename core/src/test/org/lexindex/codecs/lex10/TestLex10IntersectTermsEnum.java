package org.lexindex.codecs.lex10;

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
import java.util.Locale;
import java.util.TreeSet;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.index.DirectoryReader;
import org.lexindex.index.DocsEnum;
import org.lexindex.index.IndexWriter;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;
import org.lexindex.util.automaton.Automata;
import org.lexindex.util.automaton.CompiledAutomaton;

public class TestLex10IntersectTermsEnum extends LexTestCase {
  private Directory dir;
  private DirectoryReader reader;
  private Terms terms;
  private TreeSet<String> indexed;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    dir = newDirectory();
    IndexWriter w = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    indexed = new TreeSet<String>();
    // zero padded so that every block shares a prefix with the next one
    for (int i = 0; i < 1000; i++) {
      final String id = String.format(Locale.ROOT, "%04d", i);
      indexed.add(id);
      Document doc = new Document();
      doc.add(new StringField("id", id, StringField.Store.NO));
      w.addDocument(doc);
    }
    final int extra = atLeast(100);
    for (int i = 0; i < extra; i++) {
      final String s = "x" + _TestUtil.randomSimpleString(random);
      indexed.add(s);
      Document doc = new Document();
      doc.add(new StringField("id", s, StringField.Store.NO));
      w.addDocument(doc);
    }
    w.forceMerge(1);
    w.close();
    reader = DirectoryReader.open(dir);
    assertEquals(1, reader.leaves().size());
    terms = reader.leaves().get(0).reader().terms("id");
  }

  @Override
  public void tearDown() throws Exception {
    reader.close();
    dir.close();
    super.tearDown();
  }

  private List<String> expected(CompiledAutomaton compiled, String startTerm) {
    List<String> result = new ArrayList<String>();
    for (String s : indexed) {
      if (startTerm != null && s.compareTo(startTerm) <= 0) {
        continue;
      }
      BytesRef b = new BytesRef(s);
      if (compiled.runAutomaton.run(b.bytes, b.offset, b.length)) {
        result.add(s);
      }
    }
    return result;
  }

  private List<String> actual(TermsEnum te) throws Exception {
    List<String> result = new ArrayList<String>();
    BytesRef term;
    while ((term = te.next()) != null) {
      result.add(term.utf8ToString());
    }
    return result;
  }

  public void testUsesBlockAwareEnum() throws Exception {
    CompiledAutomaton compiled = new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef("05")));
    TermsEnum te = terms.intersect(compiled, null);
    assertTrue(te instanceof Lex10PostingsReader.IntersectTermsEnum);
    assertEquals(expected(compiled, null), actual(te));
    assertEquals(100, expected(compiled, null).size());
    // all blocks of 00xx-04xx and 06xx-09xx share a dead prefix
    assertTrue("skipped=" + ((Lex10PostingsReader.IntersectTermsEnum) te).blocksSkipped,
               ((Lex10PostingsReader.IntersectTermsEnum) te).blocksSkipped >= 20);
  }

  public void testPrefixes() throws Exception {
    final int iters = atLeast(20);
    for (int i = 0; i < iters; i++) {
      final String prefix;
      if (random.nextBoolean()) {
        prefix = String.format(Locale.ROOT, "%04d", random.nextInt(1000)).substring(0, _TestUtil.nextInt(random, 1, 4));
      } else {
        prefix = "x" + (char) ('a' + random.nextInt(26));
      }
      CompiledAutomaton compiled = new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef(prefix)));
      assertEquals("prefix=" + prefix, expected(compiled, null), actual(terms.intersect(compiled, null)));
    }
  }

  public void testStringUnion() throws Exception {
    List<String> all = new ArrayList<String>(indexed);
    final int iters = atLeast(10);
    for (int iter = 0; iter < iters; iter++) {
      TreeSet<String> picked = new TreeSet<String>();
      final int count = _TestUtil.nextInt(random, 1, 20);
      for (int i = 0; i < count; i++) {
        picked.add(all.get(random.nextInt(all.size())));
      }
      // not indexed
      picked.add("0500x");
      picked.add("y");
      List<BytesRef> sorted = new ArrayList<BytesRef>();
      for (String s : picked) {
        sorted.add(new BytesRef(s));
      }
      CompiledAutomaton compiled = new CompiledAutomaton(Automata.makeStringUnion(sorted));
      assertEquals(expected(compiled, null), actual(terms.intersect(compiled, null)));
    }
  }

  public void testStartTerm() throws Exception {
    List<String> all = new ArrayList<String>(indexed);
    final int iters = atLeast(20);
    for (int i = 0; i < iters; i++) {
      final String startTerm;
      if (random.nextBoolean()) {
        startTerm = all.get(random.nextInt(all.size()));
      } else {
        // need not exist
        startTerm = String.format(Locale.ROOT, "%03d", random.nextInt(1000)) + "z";
      }
      final String prefix = String.format(Locale.ROOT, "%d", random.nextInt(10));
      CompiledAutomaton compiled = new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef(prefix)));
      assertEquals("start=" + startTerm + " prefix=" + prefix,
                   expected(compiled, startTerm), actual(terms.intersect(compiled, new BytesRef(startTerm))));
    }
    CompiledAutomaton any = new CompiledAutomaton(Automata.makeAnyBinary());
    assertEquals(Collections.<String>emptyList(), actual(terms.intersect(any, new BytesRef("zzz"))));
    assertEquals(expected(any, "0999"), actual(terms.intersect(any, new BytesRef("0999"))));
  }

  public void testPostingsOfIntersectedTerms() throws Exception {
    CompiledAutomaton compiled = new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef("07")));
    TermsEnum te = terms.intersect(compiled, null);
    int count = 0;
    DocsEnum docs = null;
    while (te.next() != null) {
      assertEquals(1, te.docFreq());
      docs = te.docs(null, docs, 0);
      assertEquals(Integer.parseInt(te.term().utf8ToString()), docs.nextDoc());
      assertEquals(DocIdSetIterator.NO_MORE_DOCS, docs.nextDoc());
      count++;
    }
    assertEquals(100, count);
  }

  public void testCannotSeek() throws Exception {
    TermsEnum te = terms.intersect(new CompiledAutomaton(Automata.makeAnyBinary()), null);
    try {
      te.seekCeil(new BytesRef("0500"));
      fail("did not hit expected exception");
    } catch (UnsupportedOperationException e) {
      // expected
    }
  }
}
