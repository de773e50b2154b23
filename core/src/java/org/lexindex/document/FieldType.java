package org.lexindex.document;

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

import org.lexindex.index.FieldInfo.DocValuesType;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.index.IndexableFieldType;

/**
 * Mutable description of how a {@link Field} is indexed and stored.
 * Shared instances, such as {@link TextField#TYPE_STORED}, are
 * {@link #freeze() frozen}; copy one with {@link #FieldType(FieldType)}
 * to derive a variant.  Consistency between the properties (term vectors
 * need an indexed field, for example) is checked when a {@link Field}
 * is created.
 */
public class FieldType implements IndexableFieldType {

  private boolean index;
  private boolean store;
  private boolean tokenize = true;
  private boolean vectors;
  private boolean vectorOffsets;
  private boolean vectorPositions;
  private boolean normsOmitted;
  private IndexOptions options = IndexOptions.DOCS_AND_FREQS_AND_POSITIONS;
  private DocValuesType docValues;
  private boolean frozen;

  /** A type that is neither indexed nor stored, tokenized once indexed. */
  public FieldType() {
  }

  /** A mutable copy of <code>other</code>; the copy is never frozen. */
  public FieldType(FieldType other) {
    index = other.index;
    store = other.store;
    tokenize = other.tokenize;
    vectors = other.vectors;
    vectorOffsets = other.vectorOffsets;
    vectorPositions = other.vectorPositions;
    normsOmitted = other.normsOmitted;
    options = other.options;
    docValues = other.docValues;
  }

  private void ensureMutable() {
    if (frozen) {
      throw new IllegalStateException("this FieldType is already frozen and cannot be changed");
    }
  }

  /** Makes every setter throw {@link IllegalStateException} from now on. */
  public void freeze() {
    frozen = true;
  }

  @Override
  public boolean indexed() {
    return index;
  }

  public void setIndexed(boolean value) {
    ensureMutable();
    index = value;
  }

  @Override
  public boolean stored() {
    return store;
  }

  public void setStored(boolean value) {
    ensureMutable();
    store = value;
  }

  @Override
  public boolean tokenized() {
    return tokenize;
  }

  /** If false an indexed value becomes a single term as is. */
  public void setTokenized(boolean value) {
    ensureMutable();
    tokenize = value;
  }

  @Override
  public boolean storeTermVectors() {
    return vectors;
  }

  public void setStoreTermVectors(boolean value) {
    ensureMutable();
    vectors = value;
  }

  @Override
  public boolean storeTermVectorOffsets() {
    return vectorOffsets;
  }

  public void setStoreTermVectorOffsets(boolean value) {
    ensureMutable();
    vectorOffsets = value;
  }

  @Override
  public boolean storeTermVectorPositions() {
    return vectorPositions;
  }

  public void setStoreTermVectorPositions(boolean value) {
    ensureMutable();
    vectorPositions = value;
  }

  @Override
  public boolean omitNorms() {
    return normsOmitted;
  }

  public void setOmitNorms(boolean value) {
    ensureMutable();
    normsOmitted = value;
  }

  @Override
  public IndexOptions indexOptions() {
    return options;
  }

  /** What the postings record for each term; positions by default. */
  public void setIndexOptions(IndexOptions value) {
    ensureMutable();
    options = value;
  }

  @Override
  public DocValuesType docValueType() {
    return docValues;
  }

  /** null, the default, for a field without doc values. */
  public void setDocValueType(DocValuesType type) {
    ensureMutable();
    docValues = type;
  }

  @Override
  public final String toString() {
    final StringBuilder b = new StringBuilder();
    flag(b, store, "stored");
    if (index) {
      flag(b, true, "indexed");
      flag(b, tokenize, "tokenized");
      flag(b, vectors, "termVector");
      flag(b, vectorOffsets, "termVectorOffsets");
      flag(b, vectorPositions, "termVectorPosition");
      flag(b, normsOmitted, "omitNorms");
      flag(b, options != IndexOptions.DOCS_AND_FREQS_AND_POSITIONS, "indexOptions=" + options);
    }
    flag(b, docValues != null, "docValueType=" + docValues);
    return b.toString();
  }

  private static void flag(StringBuilder b, boolean set, String name) {
    if (set) {
      if (b.length() > 0) {
        b.append(',');
      }
      b.append(name);
    }
  }
}
