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

import java.util.Arrays;

import org.lexindex.search.Query;

/** Holds buffered deletes by term or query, once pushed.
 *  Pushed deletes are write-once and apply in full to
 *  every segment older than the packet, so the sequence
 *  numbers are dropped and the terms are kept sorted for
 *  a single pass over each segment's terms dictionary. */
class FrozenBufferedDeletes {

  // Terms, in sorted order:
  final Term[] terms;
  final Query[] queries;
  final long bytesUsed;
  final int numTermDeletes;
  private long gen = -1; // assigned by BufferedDeletesStream once pushed

  FrozenBufferedDeletes(BufferedDeletes deletes) {
    terms = deletes.terms.keySet().toArray(new Term[deletes.terms.size()]);
    Arrays.sort(terms);
    queries = deletes.queries.keySet().toArray(new Query[deletes.queries.size()]);
    bytesUsed = deletes.bytesUsed;
    numTermDeletes = deletes.numTermDeletes;
  }

  void setDelGen(long gen) {
    assert this.gen == -1;
    this.gen = gen;
  }

  long delGen() {
    assert gen != -1;
    return gen;
  }

  @Override
  public String toString() {
    String s = "";
    if (numTermDeletes != 0) {
      s += " " + numTermDeletes + " deleted terms (unique count=" + terms.length + ")";
    }
    if (queries.length != 0) {
      s += " " + queries.length + " deleted queries";
    }
    if (bytesUsed != 0) {
      s += " bytesUsed=" + bytesUsed;
    }

    return s;
  }

  boolean any() {
    return terms.length > 0 || queries.length > 0;
  }
}
