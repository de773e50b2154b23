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

import org.lexindex.index.AtomicReaderContext;
import org.lexindex.util.Bits;

/**
 * A query that matches all documents.
 *
 */
public class MatchAllDocsQuery extends Query {

  private static class MatchAllIterator extends DocIdSetIterator {
    private int doc = -1;
    private final int maxDoc;
    private final Bits acceptDocs;

    MatchAllIterator(int maxDoc, Bits acceptDocs) {
      this.acceptDocs = acceptDocs;
      this.maxDoc = maxDoc;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() throws IOException {
      doc++;
      while(acceptDocs != null && doc < maxDoc && !acceptDocs.get(doc)) {
        doc++;
      }
      if (doc >= maxDoc) {
        doc = NO_MORE_DOCS;
      }
      return doc;
    }

    @Override
    public int advance(int target) throws IOException {
      doc = target-1;
      return nextDoc();
    }
  }

  @Override
  public DocIdSetIterator iterator(AtomicReaderContext context, Bits acceptDocs) {
    return new MatchAllIterator(context.reader().maxDoc(), acceptDocs);
  }

  @Override
  public String toString(String field) {
    return "*:*";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MatchAllDocsQuery;
  }

  @Override
  public int hashCode() {
    return 0x1AA71190;
  }
}
