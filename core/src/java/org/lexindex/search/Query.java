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

/** The abstract base class for queries.
 *  <p>A query matches documents leaf by leaf: {@link
 *  #iterator} enumerates, in increasing docID order, the
 *  documents of one segment that match.  There is no
 *  scoring; every match is equally good.
 *  <p>Queries are also used by {@link
 *  org.lexindex.index.IndexWriter#deleteDocuments(Query...)},
 *  so implementations must implement {@link #equals} and
 *  {@link #hashCode}.
 */
public abstract class Query {

  /** Returns the documents of this leaf that match, skipping
   *  documents that {@code acceptDocs} rejects, or null if
   *  no document can match.
   *  @param acceptDocs documents to consider; null means all */
  public abstract DocIdSetIterator iterator(AtomicReaderContext context, Bits acceptDocs) throws IOException;

  /** Prints a query to a string, with <code>field</code> assumed to be the 
   * default field and omitted.
   */
  public abstract String toString(String field);

  /** Prints a query to a string. */
  @Override
  public String toString() {
    return toString("");
  }
}
