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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;
import org.lexindex.util.automaton.Automata;
import org.lexindex.util.automaton.Automaton;
import org.lexindex.util.automaton.CompiledAutomaton;
import org.lexindex.util.automaton.Operations;

public class TestTermsEnum extends LexTestCase {

  private Directory d;
  private IndexReader r;

  private final String FIELD = "field";

  private IndexReader makeIndex(boolean singleSegment, String... terms) throws Exception {
    d = newDirectory();
    IndexWriterConfig iwc = newIndexWriterConfig(new MockAnalyzer(random));
    final RandomIndexWriter w = new RandomIndexWriter(random, d, iwc);
    for(String term : terms) {
      Document doc = new Document();
      doc.add(new StringField(FIELD, term, StringField.Store.NO));
      w.addDocument(doc);
    }
    if (singleSegment) {
      w.forceMerge(1);
    }
    r = w.getReader();
    w.close();
    return r;
  }

  private void close() throws Exception {
    r.close();
    d.close();
    r = null;
  }

  private int docFreq(IndexReader r, String term) throws Exception {
    return r.docFreq(new Term(FIELD, term));
  }

  public void testEasy() throws Exception {
    r = makeIndex(false, "aa0", "aa1", "aa2", "aa3", "bb0", "bb1", "bb2", "bb3", "aa");

    // First term:
    assertEquals(1, docFreq(r, "aa0"));

    // Scan forward
    assertEquals(1, docFreq(r, "aa2"));

    assertEquals(1, docFreq(r, "aa"));

    // Seek backwards
    assertEquals(1, docFreq(r, "aa1"));

    // Not found, in the middle
    assertEquals(0, docFreq(r, "aa5"));

    // Not found, before all terms
    assertEquals(0, docFreq(r, "a"));

    // Not found, after all terms
    assertEquals(0, docFreq(r, "bb5"));

    final TermsEnum te = MultiFields.getTerms(r, FIELD).iterator(null);
    assertEquals(TermsEnum.SeekStatus.FOUND, te.seekCeil(new BytesRef("aa1")));
    assertEquals("aa1", te.term().utf8ToString());
    assertEquals(TermsEnum.SeekStatus.NOT_FOUND, te.seekCeil(new BytesRef("aa4")));
    assertEquals("bb0", te.term().utf8ToString());
    assertEquals(TermsEnum.SeekStatus.NOT_FOUND, te.seekCeil(new BytesRef("")));
    assertEquals("aa", te.term().utf8ToString());
    assertEquals(TermsEnum.SeekStatus.END, te.seekCeil(new BytesRef("c")));

    assertFalse(te.seekExact(new BytesRef("ab")));
    assertTrue(te.seekExact(new BytesRef("bb3")));
    assertNull(te.next());
    // stays exhausted
    assertNull(te.next());
    close();
  }

  public void testZeroTerms() throws Exception {
    d = newDirectory();
    final RandomIndexWriter w = new RandomIndexWriter(random, d);
    Document doc = new Document();
    doc.add(new StringField(FIELD, "one", StringField.Store.NO));
    w.addDocument(doc);
    doc = new Document();
    doc.add(new StringField("other", "two", StringField.Store.NO));
    w.addDocument(doc);
    w.deleteDocuments(new Term(FIELD, "one"));
    w.forceMerge(1);
    r = w.getReader();
    w.close();
    assertEquals(1, r.numDocs());
    assertEquals(1, r.maxDoc());
    // the merged segment no longer has the field's terms
    Terms terms = MultiFields.getTerms(r, FIELD);
    if (terms != null) {
      assertNull(terms.iterator(null).next());
    }
    assertEquals(0, docFreq(r, "one"));
    close();
  }

  public void testSeekByOrd() throws Exception {
    final String[] terms = new String[atLeast(50)];
    final Set<String> seen = new TreeSet<String>();
    int upto = 0;
    while (upto < terms.length) {
      final String t = randomTerm();
      if (seen.add(t)) {
        terms[upto++] = t;
      }
    }
    r = makeIndex(true, terms);
    final BytesRef[] sorted = sortedTerms(terms);

    final AtomicReader reader = r.leaves().get(0).reader();
    final TermsEnum te = reader.terms(FIELD).iterator(null);
    assertEquals(sorted.length, reader.terms(FIELD).size());
    final int iters = atLeast(100);
    for (int iter = 0; iter < iters; iter++) {
      final int ord = random.nextInt(sorted.length);
      te.seekExact(ord);
      assertEquals(sorted[ord], te.term());
      assertEquals(ord, te.ord());
      assertEquals(1, te.docFreq());
      if (ord + 1 < sorted.length) {
        assertEquals(sorted[ord + 1], te.next());
        assertEquals(ord + 1, te.ord());
      } else {
        assertNull(te.next());
      }
    }
    close();
  }

  // a saved TermState repositions an enum without a lookup
  public void testTermStateReseek() throws Exception {
    r = makeIndex(true, "apple", "banana", "cherry", "date", "elder");
    final AtomicReader reader = r.leaves().get(0).reader();
    final TermsEnum te = reader.terms(FIELD).iterator(null);
    assertTrue(te.seekExact(new BytesRef("cherry")));
    final TermState state = te.termState();
    final int docFreq = te.docFreq();

    final TermsEnum te2 = reader.terms(FIELD).iterator(null);
    te2.seekExact(new BytesRef("cherry"), state);
    assertEquals("cherry", te2.term().utf8ToString());
    assertEquals(docFreq, te2.docFreq());
    DocsEnum docs = te2.docs(null, null);
    assertTrue(docs.nextDoc() != DocIdSetIterator.NO_MORE_DOCS);
    assertEquals(DocIdSetIterator.NO_MORE_DOCS, docs.nextDoc());
    assertEquals("date", te2.next().utf8ToString());
    close();
  }

  public void testRandomSeeks() throws Exception {
    final String[] terms = new String[_TestUtil.nextInt(random, 1, atLeast(500))];
    final Set<String> seen = new TreeSet<String>();
    int upto = 0;
    while (upto < terms.length) {
      final String t = _TestUtil.randomUnicodeString(random);
      if (t.length() > 0 && seen.add(t)) {
        terms[upto++] = t;
      }
    }
    r = makeIndex(random.nextBoolean(), terms);
    final BytesRef[] validTerms = sortedTerms(terms);
    final TermsEnum te = MultiFields.getTerms(r, FIELD).iterator(null);

    for(int iter=0;iter<100*RANDOM_MULTIPLIER;iter++) {
      final BytesRef t;
      int loc;
      if (random.nextInt(6) == 4) {
        // pick term that doesn't exist:
        t = getNonExistTerm(validTerms);
        loc = Arrays.binarySearch(validTerms, t);
      } else {
        loc = random.nextInt(validTerms.length);
        t = BytesRef.deepCopyOf(validTerms[loc]);
      }

      final TermsEnum.SeekStatus status = te.seekCeil(t);
      if (loc >= 0) {
        assertEquals(TermsEnum.SeekStatus.FOUND, status);
        assertEquals(t, te.term());
      } else if (-loc-1 == validTerms.length) {
        assertEquals(TermsEnum.SeekStatus.END, status);
        continue;
      } else {
        loc = -loc-1;
        assertEquals(TermsEnum.SeekStatus.NOT_FOUND, status);
        assertEquals(validTerms[loc], te.term());
      }

      // Do a bunch of next's after the seek
      final int numNext = random.nextInt(validTerms.length);
      for(int nextCount=0;nextCount<numNext;nextCount++) {
        final BytesRef actual = te.next();
        loc++;
        if (loc == validTerms.length) {
          assertNull(actual);
          break;
        } else {
          assertEquals(validTerms[loc], actual);
        }
      }
    }
    close();
  }

  public void testIntersectBasics() throws Exception {
    r = makeIndex(random.nextBoolean(), "aaa", "aab", "abc", "bcd", "bce", "cab");
    final Terms terms = MultiFields.getTerms(r, FIELD);

    CompiledAutomaton prefix = new CompiledAutomaton(Automata.makeBinaryPrefix(new BytesRef("bc")));
    assertEquals(Arrays.asList("bcd", "bce"), intersect(terms, prefix, null));
    // start term need not exist, nor be accepted
    assertEquals(Arrays.asList("bce"), intersect(terms, prefix, new BytesRef("bcd")));
    assertEquals(Arrays.asList("bcd", "bce"), intersect(terms, prefix, new BytesRef("a")));
    assertEquals(Collections.<String>emptyList(), intersect(terms, prefix, new BytesRef("bce")));
    assertEquals(Collections.<String>emptyList(), intersect(terms, prefix, new BytesRef("zzz")));

    CompiledAutomaton all = new CompiledAutomaton(Automata.makeAnyBinary());
    assertEquals(Arrays.asList("abc", "bcd", "bce", "cab"), intersect(terms, all, new BytesRef("aab")));

    CompiledAutomaton none = new CompiledAutomaton(Automata.makeEmpty());
    assertEquals(Collections.<String>emptyList(), intersect(terms, none, null));

    CompiledAutomaton single = new CompiledAutomaton(Automata.makeString("abc"));
    assertEquals(Arrays.asList("abc"), intersect(terms, single, null));
    assertEquals(Collections.<String>emptyList(), intersect(terms, single, new BytesRef("abc")));

    // the same through the generic filtering enum
    final Terms filtered = filterOnly(terms);
    assertEquals(Arrays.asList("bcd", "bce"), intersect(filtered, prefix, null));
    assertEquals(Arrays.asList("bce"), intersect(filtered, prefix, new BytesRef("bcd")));
    assertEquals(Collections.<String>emptyList(), intersect(filtered, prefix, new BytesRef("zzz")));
    assertEquals(Arrays.asList("abc", "bcd", "bce", "cab"), intersect(filtered, all, new BytesRef("aab")));
    assertEquals(Arrays.asList("aaa", "aab", "abc", "bcd", "bce", "cab"), intersect(filtered, all, null));
    assertEquals(Arrays.asList("abc"), intersect(filtered, single, null));
    close();
  }

  public void testIntersectRandom() throws Exception {
    final int numTerms = atLeast(300);
    final Set<String> seen = new TreeSet<String>();
    while (seen.size() < numTerms) {
      final String t = randomTerm();
      seen.add(t);
    }
    final String[] terms = seen.toArray(new String[seen.size()]);
    r = makeIndex(random.nextBoolean(), terms);
    final BytesRef[] sorted = sortedTerms(terms);
    final Terms fieldTerms = MultiFields.getTerms(r, FIELD);

    final int iters = atLeast(100);
    for (int iter = 0; iter < iters; iter++) {
      final Automaton a = randomAutomaton(sorted);
      final CompiledAutomaton compiled = new CompiledAutomaton(a);

      final BytesRef startTerm;
      switch (random.nextInt(5)) {
      case 0:
        startTerm = null;
        break;
      case 1:
        // an indexed term
        startTerm = BytesRef.deepCopyOf(sorted[random.nextInt(sorted.length)]);
        break;
      case 2:
        // before every term
        startTerm = new BytesRef("");
        break;
      case 3:
        // after every term
        startTerm = new BytesRef(new byte[] {(byte) 0xff, (byte) 0xff});
        break;
      default:
        startTerm = new BytesRef(randomTerm());
      }

      final List<String> expected = new ArrayList<String>();
      for (BytesRef term : sorted) {
        if ((startTerm == null || term.compareTo(startTerm) > 0) && Operations.run(a, term)) {
          expected.add(term.utf8ToString());
        }
      }
      if (VERBOSE) {
        System.out.println("TEST: iter=" + iter + " " + compiled + " startTerm=" + startTerm + " expected=" + expected.size());
      }
      assertEquals("startTerm=" + startTerm, expected, intersect(fieldTerms, compiled, startTerm));
      assertEquals("startTerm=" + startTerm, expected, intersect(filterOnly(fieldTerms), compiled, startTerm));
    }
    close();
  }

  // Hides any codec specific intersect so that Terms.intersect filters the plain iterator
  private static Terms filterOnly(final Terms in) {
    return new Terms() {
      @Override
      public TermsEnum iterator(TermsEnum reuse) throws IOException {
        return in.iterator(null);
      }

      @Override
      public Comparator<BytesRef> getComparator() {
        return in.getComparator();
      }

      @Override
      public long size() throws IOException {
        return in.size();
      }

      @Override
      public long getSumTotalTermFreq() throws IOException {
        return in.getSumTotalTermFreq();
      }

      @Override
      public long getSumDocFreq() throws IOException {
        return in.getSumDocFreq();
      }

      @Override
      public int getDocCount() throws IOException {
        return in.getDocCount();
      }

      @Override
      public boolean hasFreqs() {
        return in.hasFreqs();
      }

      @Override
      public boolean hasOffsets() {
        return in.hasOffsets();
      }

      @Override
      public boolean hasPositions() {
        return in.hasPositions();
      }

      @Override
      public boolean hasPayloads() {
        return in.hasPayloads();
      }
    };
  }

  private List<String> intersect(Terms terms, CompiledAutomaton compiled, BytesRef startTerm) throws IOException {
    final List<String> actual = new ArrayList<String>();
    final TermsEnum te = terms.intersect(compiled, startTerm);
    BytesRef term;
    BytesRef last = null;
    while ((term = te.next()) != null) {
      if (last != null) {
        assertTrue("terms out of order", last.compareTo(term) < 0);
      }
      if (startTerm != null) {
        assertTrue(term.utf8ToString() + " is not after the start term", term.compareTo(startTerm) > 0);
      }
      last = BytesRef.deepCopyOf(term);
      actual.add(term.utf8ToString());
    }
    return actual;
  }

  private Automaton randomAutomaton(BytesRef[] sorted) {
    switch (random.nextInt(4)) {
    case 0: {
      // some indexed terms plus some that may not exist
      final TreeSet<BytesRef> strings = new TreeSet<BytesRef>();
      final int count = _TestUtil.nextInt(random, 1, 20);
      for (int i = 0; i < count; i++) {
        if (random.nextBoolean()) {
          strings.add(BytesRef.deepCopyOf(sorted[random.nextInt(sorted.length)]));
        } else {
          strings.add(new BytesRef(randomTerm()));
        }
      }
      return Automata.makeStringUnion(strings);
    }
    case 1:
      return Automata.makeBinaryPrefix(new BytesRef(randomTerm().substring(0, 1)));
    case 2:
      return Automata.makeAnyBinary();
    default: {
      // strings over a..c ending with b
      final Automaton a = new Automaton();
      final int s0 = a.createState();
      final int s1 = a.createState();
      a.addTransition(s0, s0, 'a');
      a.addTransition(s0, s1, 'b');
      a.addTransition(s0, s0, 'c');
      a.addTransition(s1, s0, 'a');
      a.addTransition(s1, s1, 'b');
      a.addTransition(s1, s0, 'c');
      a.setAccept(s1, true);
      return a;
    }
    }
  }

  private static BytesRef[] sortedTerms(String[] terms) {
    final BytesRef[] sorted = new BytesRef[terms.length];
    for (int i = 0; i < terms.length; i++) {
      sorted[i] = new BytesRef(terms[i]);
    }
    Arrays.sort(sorted);
    return sorted;
  }

  private BytesRef getNonExistTerm(BytesRef[] terms) {
    while(true) {
      final BytesRef t = new BytesRef(_TestUtil.randomUnicodeString(random));
      if (Arrays.binarySearch(terms, t) < 0) {
        return t;
      }
    }
  }

  // non-empty, over a small alphabet so automata hit often
  private String randomTerm() {
    final int len = _TestUtil.nextInt(random, 1, 6);
    final char[] chars = new char[len];
    for (int i = 0; i < len; i++) {
      chars[i] = (char) _TestUtil.nextInt(random, 'a', 'd');
    }
    return new String(chars);
  }
}
