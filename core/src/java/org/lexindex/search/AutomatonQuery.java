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
import org.lexindex.util.BitVector;
import org.lexindex.util.Bits;
import org.lexindex.util.automaton.Automaton;
import org.lexindex.util.automaton.CompiledAutomaton;

/**
 * A {@link Query} that will match terms against a finite-state machine.
 * <p>
 * This query will match documents that contain terms accepted by a given
 * deterministic automaton over term bytes. The term dictionary is walked
 * with {@link Terms#intersect}, so only the parts of the dictionary the
 * automaton can accept are visited.
 * </p>
 */
public class AutomatonQuery extends Query {
  /** the automaton to match index terms against */
  protected final Automaton automaton;
  /** term containing the field, and possibly some pattern structure */
  protected final Term term;

  private final CompiledAutomaton compiled;

  /**
   * Create a new AutomatonQuery from an {@link Automaton}.
   * 
   * @param term Term containing field and possibly some pattern structure. The
   *        term text is ignored.
   * @param automaton Automaton to run, terms that are accepted are considered a
   *        match.
   */
  public AutomatonQuery(final Term term, Automaton automaton) {
    this.term = term;
    this.automaton = automaton;
    this.compiled = new CompiledAutomaton(automaton);
  }

  /** Returns the field this query runs against. */
  public String getField() {
    return term.field();
  }

  @Override
  public DocIdSetIterator iterator(AtomicReaderContext context, Bits acceptDocs) throws IOException {
    final Terms terms = context.reader().terms(term.field());
    if (terms == null) {
      return null;
    }
    final TermsEnum termsEnum = compiled.getTermsEnum(terms);
    final int maxDoc = context.reader().maxDoc();
    BitVector matches = null;
    DocsEnum docsEnum = null;
    while (termsEnum.next() != null) {
      docsEnum = termsEnum.docs(acceptDocs, docsEnum, DocsEnum.FLAG_NONE);
      int doc;
      while ((doc = docsEnum.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
        if (matches == null) {
          matches = new BitVector(maxDoc);
        }
        matches.set(doc);
      }
    }
    return matches == null ? null : new BitsIterator(matches);
  }

  /** Iterates the set bits of a {@link BitVector}. */
  static final class BitsIterator extends DocIdSetIterator {
    private final BitVector bits;
    private int doc = -1;

    BitsIterator(BitVector bits) {
      this.bits = bits;
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int nextDoc() {
      return advance(doc + 1);
    }

    @Override
    public int advance(int target) {
      final int size = bits.size();
      int d = target;
      while (d < size && !bits.get(d)) {
        d++;
      }
      doc = d >= size ? NO_MORE_DOCS : d;
      return doc;
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = getClass().hashCode();
    result = prime * result + System.identityHashCode(automaton);
    result = prime * result + ((term == null) ? 0 : term.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    AutomatonQuery other = (AutomatonQuery) obj;
    if (automaton != other.automaton)
      return false;
    if (term == null) {
      if (other.term != null)
        return false;
    } else if (!term.equals(other.term))
      return false;
    return true;
  }

  @Override
  public String toString(String field) {
    StringBuilder buffer = new StringBuilder();
    if (!term.field().equals(field)) {
      buffer.append(term.field());
      buffer.append(":");
    }
    buffer.append(getClass().getSimpleName());
    buffer.append(" {");
    buffer.append('\n');
    buffer.append(automaton.toString());
    buffer.append("}");
    return buffer.toString();
  }
}
