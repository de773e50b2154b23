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
import org.lexindex.index.DocsEnum;
import org.lexindex.index.Term;
import org.lexindex.index.Terms;
import org.lexindex.index.TermsEnum;
import org.lexindex.util.Bits;

/** A Query that matches documents containing a term.
 */
public class TermQuery extends Query {
  private final Term term;

  /** Constructs a query for the term <code>t</code>. */
  public TermQuery(Term t) {
    if (t == null) {
      throw new IllegalArgumentException("term must not be null");
    }
    term = t;
  }

  /** Returns the term of this query. */
  public Term getTerm() { return term; }

  @Override
  public DocIdSetIterator iterator(AtomicReaderContext context, Bits acceptDocs) throws IOException {
    final Terms terms = context.reader().terms(term.field());
    if (terms == null) {
      return null;
    }
    final TermsEnum termsEnum = terms.iterator(null);
    if (!termsEnum.seekExact(term.bytes())) {
      return null;
    }
    return termsEnum.docs(acceptDocs, null, DocsEnum.FLAG_NONE);
  }

  /** Prints a user-readable version of this query. */
  @Override
  public String toString(String field) {
    StringBuilder buffer = new StringBuilder();
    if (!term.field().equals(field)) {
      buffer.append(term.field());
      buffer.append(":");
    }
    buffer.append(term.text());
    return buffer.toString();
  }

  /** Returns true iff <code>o</code> is equal to this. */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TermQuery))
      return false;
    TermQuery other = (TermQuery)o;
    return this.term.equals(other.term);
  }

  /** Returns a hash code value for this object.*/
  @Override
  public int hashCode() {
    return 0x3c9e1b5d ^ term.hashCode();
  }
}
