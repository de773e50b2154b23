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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.lexindex.document.Document;
import org.lexindex.index.AtomicReaderContext;
import org.lexindex.index.IndexReader;

/** Implements search over a single IndexReader.
 *
 * <p>Every segment of the reader is searched in turn and
 * hits come back in increasing docID order; there is no
 * relevance ranking, every hit has score 1.
 *
 * <p><b>NOTE</b>: <code>{@link
 * IndexSearcher}</code> instances are completely
 * thread safe, meaning multiple threads can call any of its
 * methods, concurrently.  To see changes made to the index,
 * reopen the reader ({@link
 * org.lexindex.index.DirectoryReader#openIfChanged}) and
 * create a new IndexSearcher from it.</p>
 */
public class IndexSearcher {
  final IndexReader reader;

  // NOTE: these members might change in incompatible ways
  // in the next release
  protected final List<AtomicReaderContext> leafContexts;

  /** Creates a searcher searching the provided index. */
  public IndexSearcher(IndexReader r) {
    this.reader = r;
    this.leafContexts = r.leaves();
  }

  /** Return the {@link IndexReader} this searches. */
  public IndexReader getIndexReader() {
    return reader;
  }

  /** Sugar for <code>.getIndexReader().document(docID)</code> */
  public Document doc(int docID) throws IOException {
    return reader.document(docID);
  }

  /** Finds the first <code>n</code> hits for <code>query</code>,
   *  in docID order.  {@link TopDocs#totalHits} counts every
   *  match. */
  public TopDocs search(Query query, int n) throws IOException {
    if (n < 0) {
      throw new IllegalArgumentException("n must be >= 0 (got " + n + ")");
    }
    final List<ScoreDoc> hits = new ArrayList<ScoreDoc>();
    int totalHits = 0;
    for (AtomicReaderContext ctx : leafContexts) {
      final DocIdSetIterator it = query.iterator(ctx, ctx.reader().getLiveDocs());
      if (it == null) {
        continue;
      }
      int doc;
      while ((doc = it.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
        if (hits.size() < n) {
          hits.add(new ScoreDoc(ctx.docBase + doc, 1.0f));
        }
        totalHits++;
      }
    }
    return new TopDocs(totalHits, hits.toArray(new ScoreDoc[hits.size()]));
  }

  /** Returns the number of live documents matching
   *  <code>query</code>. */
  public int count(Query query) throws IOException {
    int count = 0;
    for (AtomicReaderContext ctx : leafContexts) {
      final DocIdSetIterator it = query.iterator(ctx, ctx.reader().getLiveDocs());
      if (it != null) {
        while (it.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
          count++;
        }
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return "IndexSearcher(" + reader + ")";
  }
}
