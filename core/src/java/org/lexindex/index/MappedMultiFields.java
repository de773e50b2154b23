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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;

/** A {@link Fields} implementation that merges multiple
 *  Fields into one, and maps around deleted documents.
 *  This is used for merging. */
final class MappedMultiFields extends Fields {
  final MergeState mergeState;
  final MultiFields in;
  final List<String> fieldNames = new ArrayList<String>();

  /** Create a new MappedMultiFields for merging, based on the supplied
   * mergestate and merged view of terms. */
  MappedMultiFields(MergeState mergeState, MultiFields multiFields) {
    this.mergeState = mergeState;
    this.in = multiFields;
    for (String field : multiFields) {
      fieldNames.add(field);
    }
  }

  @Override
  public Iterator<String> iterator() {
    return fieldNames.iterator();
  }

  @Override
  public int size() {
    return fieldNames.size();
  }

  @Override
  public Terms terms(String field) throws IOException {
    MultiTerms terms = (MultiTerms) in.terms(field);
    if (terms == null) {
      return null;
    } else {
      return new MappedMultiTerms(mergeState, terms);
    }
  }

  private static class MappedMultiTerms extends Terms {
    final MergeState mergeState;
    final MultiTerms in;

    MappedMultiTerms(MergeState mergeState, MultiTerms multiTerms) {
      this.mergeState = mergeState;
      this.in = multiTerms;
    }

    @Override
    public TermsEnum iterator(TermsEnum reuse) throws IOException {
      final TermsEnum termsEnum = in.iterator(null);
      if (!(termsEnum instanceof MultiTermsEnum)) {
        // no sub has a term
        return termsEnum;
      }
      return new MappedMultiTermsEnum(mergeState, (MultiTermsEnum) termsEnum);
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return in.getComparator();
    }

    @Override
    public long size() {
      return -1;
    }

    @Override
    public long getSumTotalTermFreq() {
      return -1;
    }

    @Override
    public long getSumDocFreq() {
      return -1;
    }

    @Override
    public int getDocCount() {
      return -1;
    }

    @Override
    public boolean hasFreqs() {
      return in.hasFreqs();
    }

    @Override
    public boolean hasOffsets() {
      return in.hasOffsets();
    }

    @Override
    public boolean hasPositions() {
      return in.hasPositions();
    }

    @Override
    public boolean hasPayloads() {
      return in.hasPayloads();
    }
  }

  private static class MappedMultiTermsEnum extends TermsEnum {
    final MergeState mergeState;
    final MultiTermsEnum in;

    MappedMultiTermsEnum(MergeState mergeState, MultiTermsEnum multiTermsEnum) {
      this.mergeState = mergeState;
      this.in = multiTermsEnum;
    }

    @Override
    public BytesRef next() throws IOException {
      return in.next();
    }

    @Override
    public Comparator<BytesRef> getComparator() {
      return in.getComparator();
    }

    @Override
    public SeekStatus seekCeil(BytesRef text) {
      throw new UnsupportedOperationException();
    }

    @Override
    public void seekExact(long ord) {
      throw new UnsupportedOperationException();
    }

    @Override
    public BytesRef term() throws IOException {
      return in.term();
    }

    @Override
    public long ord() {
      throw new UnsupportedOperationException();
    }

    @Override
    public int docFreq() {
      throw new UnsupportedOperationException();
    }

    @Override
    public long totalTermFreq() {
      throw new UnsupportedOperationException();
    }

    @Override
    public DocsEnum docs(Bits liveDocs, DocsEnum reuse, int flags) throws IOException {
      if (liveDocs != null) {
        throw new IllegalArgumentException("liveDocs must be null");
      }
      final MultiDocsEnum docsEnum = (MultiDocsEnum) in.docs(null, null, flags);
      if (docsEnum == null) {
        return null;
      }
      final MappingMultiDocsEnum mappingDocsEnum;
      if (reuse instanceof MappingMultiDocsEnum) {
        mappingDocsEnum = (MappingMultiDocsEnum) reuse;
      } else {
        mappingDocsEnum = new MappingMultiDocsEnum(mergeState);
      }
      return mappingDocsEnum.reset(docsEnum);
    }

    @Override
    public DocsAndPositionsEnum docsAndPositions(Bits liveDocs, DocsAndPositionsEnum reuse, int flags) throws IOException {
      if (liveDocs != null) {
        throw new IllegalArgumentException("liveDocs must be null");
      }
      final MultiDocsAndPositionsEnum postingsEnum = (MultiDocsAndPositionsEnum) in.docsAndPositions(null, null, flags);
      if (postingsEnum == null) {
        return null;
      }
      final MappingMultiDocsAndPositionsEnum mappingEnum;
      if (reuse instanceof MappingMultiDocsAndPositionsEnum) {
        mappingEnum = (MappingMultiDocsAndPositionsEnum) reuse;
      } else {
        mappingEnum = new MappingMultiDocsAndPositionsEnum(mergeState);
      }
      return mappingEnum.reset(postingsEnum);
    }
  }
}
