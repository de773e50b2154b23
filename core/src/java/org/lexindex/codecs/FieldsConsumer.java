package org.lexindex.codecs;

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

import java.io.Closeable;
import java.io.IOException;

import org.lexindex.index.Fields;

/** 
 * Abstract API that consumes terms, doc, freq, prox, offset and
 * payloads postings.  Concrete implementations of this
 * actually do "something" with the postings (write it into
 * the index in a specific format).
 * <p>
 * The same API is used when flushing a newly written
 * segment and when merging segments: in the merge case the
 * provided {@link Fields} already hides deleted documents
 * and remaps document numbers.
 *
 */
public abstract class FieldsConsumer implements Closeable {

  /** Sole constructor. (For invocation by subclass 
   *  constructors, typically implicit.) */
  protected FieldsConsumer() {
  }

  /** Write all fields, terms and postings.  Each field is
   *  visited in sorted order, terms in the order of the
   *  field's comparator.  The consumer decides from the
   *  segment's field infos which of freqs, positions,
   *  payloads and offsets to record. */
  public abstract void write(Fields fields) throws IOException;

  @Override
  public abstract void close() throws IOException;
}
