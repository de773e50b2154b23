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

/**
 * Iterates a set of docIDs in increasing order.  An iterator starts
 * unpositioned, with {@link #docID()} returning -1, and ends on
 * {@link #NO_MORE_DOCS}; once exhausted it must not be advanced again.
 */
public abstract class DocIdSetIterator {

  /** docID of an exhausted iterator, larger than any real docID. */
  public static final int NO_MORE_DOCS = Integer.MAX_VALUE;

  /** -1 before the first call to {@link #nextDoc()} or {@link #advance(int)},
   *  {@link #NO_MORE_DOCS} once exhausted, otherwise the current docID. */
  public abstract int docID();

  /** Moves to the next docID and returns it, or {@link #NO_MORE_DOCS}. */
  public abstract int nextDoc() throws IOException;

  /**
   * Moves to the first docID &gt;= <code>target</code> and returns it, or
   * {@link #NO_MORE_DOCS} if there is none.  <code>target</code> must be
   * greater than the current docID.
   */
  public abstract int advance(int target) throws IOException;

  /** {@link #advance(int)} by stepping through {@link #nextDoc()}. */
  protected final int slowAdvance(int target) throws IOException {
    int doc;
    do {
      doc = nextDoc();
    } while (doc < target);
    return doc;
  }
}
