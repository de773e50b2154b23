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

import java.util.HashMap;
import java.util.Map;

import org.lexindex.search.Query;

/** Holds buffered deletes by term or query, each mapped to
 *  the sequence number of the latest delete call that
 *  named it.  A delete with sequence number {@code s}
 *  affects exactly those buffered documents whose sequence
 *  number is below {@code s}.
 *
 *  <p>{@link DocumentsWriter} keeps one global instance,
 *  collecting every delete since the last freeze, and one
 *  private instance per in-RAM segment, collecting the
 *  deletes made while that segment was accepting
 *  documents.  Not thread safe; callers hold the
 *  DocumentsWriter lock. */
class BufferedDeletes {

  /* Rough per-entry RAM cost: the map entry, the boxed
   * sequence number and the object header of the key. */
  final static int BYTES_PER_DEL_TERM = 96;
  final static int BYTES_PER_DEL_QUERY = 64;

  final Map<Term,Long> terms = new HashMap<Term,Long>();
  final Map<Query,Long> queries = new HashMap<Query,Long>();

  // Counts every term delete call, even for a term that
  // is already buffered, so that flushing by delete count
  // sees repeated deletes
  int numTermDeletes;
  long bytesUsed;

  void addTerm(Term term, long seq) {
    final Long current = terms.put(term, Long.valueOf(seq));
    if (current == null) {
      bytesUsed += BYTES_PER_DEL_TERM + term.bytes().length + 2 * term.field().length();
    } else if (current.longValue() > seq) {
      // a later delete of the same term was recorded first
      terms.put(term, current);
    }
    numTermDeletes++;
  }

  void addQuery(Query query, long seq) {
    final Long current = queries.put(query, Long.valueOf(seq));
    if (current == null) {
      bytesUsed += BYTES_PER_DEL_QUERY;
    } else if (current.longValue() > seq) {
      queries.put(query, current);
    }
  }

  void clear() {
    terms.clear();
    queries.clear();
    numTermDeletes = 0;
    bytesUsed = 0;
  }

  boolean any() {
    return terms.size() > 0 || queries.size() > 0;
  }

  @Override
  public String toString() {
    String s = "gen";
    if (numTermDeletes != 0) {
      s += " " + numTermDeletes + " deleted terms (unique count=" + terms.size() + ")";
    }
    if (queries.size() != 0) {
      s += " " + queries.size() + " deleted queries";
    }
    if (bytesUsed != 0) {
      s += " bytesUsed=" + bytesUsed;
    }
    return s;
  }
}
