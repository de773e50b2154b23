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
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.lexindex.analysis.CannedTokenStream;
import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.analysis.Token;
import org.lexindex.document.Document;
import org.lexindex.document.Field;
import org.lexindex.document.FieldType;
import org.lexindex.document.StringField;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.Directory;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

/**
 * Indexes random token streams under every {@link IndexOptions}
 * and checks that docs, freqs, positions, offsets and payloads
 * read back exactly as they were produced.
 */
public class TestPostingsRoundTrip extends LexTestCase {

  private static final String FIELD = "body";

  private static class Occurrence {
    final int position;
    final int startOffset;
    final int endOffset;
    final BytesRef payload;

    Occurrence(int position, int startOffset, int endOffset, BytesRef payload) {
      this.position = position;
      this.startOffset = startOffset;
      this.endOffset = endOffset;
      this.payload = payload;
    }
  }

  // term -> id -> occurrences, in position order
  private final Map<String,TreeMap<Integer,List<Occurrence>>> expected = new TreeMap<String,TreeMap<Integer,List<Occurrence>>>();

  public void testDocsOnly() throws Exception {
    doTest(IndexOptions.DOCS_ONLY);
  }

  public void testDocsAndFreqs() throws Exception {
    doTest(IndexOptions.DOCS_AND_FREQS);
  }

  public void testDocsAndFreqsAndPositions() throws Exception {
    doTest(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS);
  }

  public void testDocsAndFreqsAndPositionsAndOffsets() throws Exception {
    doTest(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS);
  }

  private void doTest(IndexOptions options) throws Exception {
    expected.clear();
    final Directory dir = newDirectory();
    final RandomIndexWriter w = new RandomIndexWriter(random, dir, newIndexWriterConfig(new MockAnalyzer(random)));

    final FieldType ft = new FieldType();
    ft.setIndexed(true);
    ft.setTokenized(true);
    ft.setIndexOptions(options);
    ft.freeze();

    // a small vocabulary, with one very common term so that
    // some posting lists span skip entries
    final int vocab = _TestUtil.nextInt(random, 3, 30);
    final int numDocs = atLeast(300);
    for (int id = 0; id < numDocs; id++) {
      final int numTokens = _TestUtil.nextInt(random, 1, 20);
      final Token[] tokens = new Token[numTokens];
      int position = -1;
      int offset = 0;
      for (int i = 0; i < numTokens; i++) {
        final String term = random.nextInt(3) == 0 ? "common" : "t" + random.nextInt(vocab);
        final int posInc = i == 0 ? 1 : random.nextInt(3);
        position += posInc;
        offset += random.nextInt(4);
        final Token token = new Token(term, posInc, offset, offset + term.length());
        BytesRef payload = null;
        if (random.nextInt(3) == 0) {
          final byte[] bytes = new byte[_TestUtil.nextInt(random, 1, 5)];
          random.nextBytes(bytes);
          payload = new BytesRef(bytes);
          token.setPayload(payload);
        }
        tokens[i] = token;
        addExpected(term, id, new Occurrence(position, offset, offset + term.length(), payload));
      }
      Document doc = new Document();
      doc.add(new StringField("id", String.valueOf(id), StringField.Store.YES));
      doc.add(new Field(FIELD, new CannedTokenStream(tokens), ft));
      w.addDocument(doc);
    }

    DirectoryReader r = w.getReader();
    verify(r, options, new HashSet<Integer>());
    r.close();

    // now delete some and check that the live docs hide them
    final Set<Integer> deleted = new HashSet<Integer>();
    final int numDeletes = numDocs / 10;
    for (int i = 0; i < numDeletes; i++) {
      final int id = random.nextInt(numDocs);
      deleted.add(id);
      w.deleteDocuments(new Term("id", String.valueOf(id)));
    }
    r = w.getReader();
    assertEquals(numDocs - deleted.size(), r.numDocs());
    verify(r, options, deleted);
    r.close();

    w.close();
    dir.close();
  }

  private void addExpected(String term, int id, Occurrence occ) {
    TreeMap<Integer,List<Occurrence>> docs = expected.get(term);
    if (docs == null) {
      docs = new TreeMap<Integer,List<Occurrence>>();
      expected.put(term, docs);
    }
    List<Occurrence> occs = docs.get(id);
    if (occs == null) {
      occs = new ArrayList<Occurrence>();
      docs.put(id, occs);
    }
    occs.add(occ);
  }

  private void verify(IndexReader r, IndexOptions options, Set<Integer> deleted) throws IOException {
    final boolean hasFreqs = options.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
    final boolean hasPositions = options.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    final boolean hasOffsets = options.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;

    final int[] docToId = new int[r.maxDoc()];
    final Bits liveDocs = MultiFields.getLiveDocs(r);
    for (int docID = 0; docID < r.maxDoc(); docID++) {
      if (liveDocs == null || liveDocs.get(docID)) {
        docToId[docID] = Integer.parseInt(r.document(docID).get("id"));
      } else {
        docToId[docID] = -1;
      }
    }

    final Terms terms = MultiFields.getTerms(r, FIELD);
    assertNotNull(terms);
    assertEquals(hasFreqs, terms.hasFreqs());
    assertEquals(hasPositions, terms.hasPositions());
    assertEquals(hasOffsets, terms.hasOffsets());
    final TermsEnum te = terms.iterator(null);

    final Iterator<Map.Entry<String,TreeMap<Integer,List<Occurrence>>>> it = expected.entrySet().iterator();
    DocsEnum docs = null;
    DocsAndPositionsEnum postings = null;
    while (it.hasNext()) {
      final Map.Entry<String,TreeMap<Integer,List<Occurrence>>> ent = it.next();
      final BytesRef term = te.next();
      assertNotNull("missing term " + ent.getKey(), term);
      assertEquals(ent.getKey(), term.utf8ToString());
      final TreeMap<Integer,List<Occurrence>> expectedDocs = ent.getValue();

      if (deleted.isEmpty()) {
        assertEquals(expectedDocs.size(), te.docFreq());
        if (hasFreqs) {
          long ttf = 0;
          for (List<Occurrence> occs : expectedDocs.values()) {
            ttf += occs.size();
          }
          assertEquals(ttf, te.totalTermFreq());
        } else {
          assertEquals(-1, te.totalTermFreq());
        }
      }

      // collect live ids in docID order
      docs = te.docs(liveDocs, docs, hasFreqs ? DocsEnum.FLAG_FREQS : DocsEnum.FLAG_NONE);
      final Set<Integer> seenIds = new HashSet<Integer>();
      int doc;
      int lastDoc = -1;
      while ((doc = docs.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
        assertTrue(doc > lastDoc);
        lastDoc = doc;
        final int id = docToId[doc];
        assertTrue("deleted doc returned", id != -1);
        final List<Occurrence> occs = expectedDocs.get(id);
        assertNotNull("term " + ent.getKey() + " should not be in id=" + id, occs);
        if (hasFreqs) {
          assertEquals(occs.size(), docs.freq());
        }
        seenIds.add(id);
      }
      final Set<Integer> expectedIds = new HashSet<Integer>(expectedDocs.keySet());
      expectedIds.removeAll(deleted);
      assertEquals("term " + ent.getKey(), expectedIds, seenIds);

      postings = te.docsAndPositions(liveDocs, postings);
      if (!hasPositions) {
        assertNull(postings);
        continue;
      }
      assertNotNull(postings);
      while ((doc = postings.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
        final List<Occurrence> occs = expectedDocs.get(docToId[doc]);
        assertEquals(occs.size(), postings.freq());
        // positions read back in order; consume only some of
        // them at random to exercise skipping the rest
        final int toRead = random.nextInt(4) == 0 ? random.nextInt(occs.size()) : occs.size();
        for (int i = 0; i < toRead; i++) {
          final Occurrence occ = occs.get(i);
          assertEquals(occ.position, postings.nextPosition());
          if (hasOffsets) {
            assertEquals(occ.startOffset, postings.startOffset());
            assertEquals(occ.endOffset, postings.endOffset());
          } else {
            assertEquals(-1, postings.startOffset());
            assertEquals(-1, postings.endOffset());
          }
          final BytesRef payload = postings.getPayload();
          if (occ.payload == null) {
            assertTrue(payload == null || payload.length == 0);
          } else {
            assertEquals(occ.payload, payload);
          }
        }
      }
    }
    assertNull("unexpected extra term", te.next());

    // advance lands on the first matching doc at or after the target
    if (te.seekCeil(new BytesRef("common")) == TermsEnum.SeekStatus.FOUND) {
      final TreeMap<Integer,List<Occurrence>> commonDocs = expected.get("common");
      final int target = random.nextInt(r.maxDoc());
      docs = te.docs(liveDocs, null, DocsEnum.FLAG_NONE);
      final int found = docs.advance(target);
      int expectedDoc = DocIdSetIterator.NO_MORE_DOCS;
      for (int docID = target; docID < r.maxDoc(); docID++) {
        if (docToId[docID] != -1 && commonDocs.containsKey(docToId[docID])) {
          expectedDoc = docID;
          break;
        }
      }
      assertEquals(expectedDoc, found);
    }
  }
}
