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

import org.lexindex.index.Term;
import org.lexindex.util.automaton.Automata;

/** A Query that matches documents containing terms with a specified prefix. */
public class PrefixQuery extends AutomatonQuery {
  private final Term prefix;

  /** Constructs a query for terms starting with <code>prefix</code>. */
  public PrefixQuery(Term prefix) {
    super(prefix, Automata.makeBinaryPrefix(prefix.bytes()));
    this.prefix = prefix;
  }

  /** Returns the prefix of this query. */
  public Term getPrefix() {
    return prefix;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return prefix.equals(((PrefixQuery) obj).prefix);
  }

  @Override
  public int hashCode() {
    return 31 * getClass().hashCode() + prefix.hashCode();
  }

  /** Prints a user-readable version of this query. */
  @Override
  public String toString(String field) {
    StringBuilder buffer = new StringBuilder();
    if (!prefix.field().equals(field)) {
      buffer.append(prefix.field());
      buffer.append(":");
    }
    buffer.append(prefix.text());
    buffer.append('*');
    return buffer.toString();
  }
}
