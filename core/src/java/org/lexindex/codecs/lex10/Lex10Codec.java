package org.lexindex.codecs.lex10;

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

import org.lexindex.codecs.Codec;
import org.lexindex.codecs.DocValuesFormat;
import org.lexindex.codecs.FieldInfosFormat;
import org.lexindex.codecs.LiveDocsFormat;
import org.lexindex.codecs.PostingsFormat;
import org.lexindex.codecs.SegmentInfoFormat;
import org.lexindex.codecs.StoredFieldsFormat;
import org.lexindex.codecs.TermVectorsFormat;

/**
 * The default codec.  See the individual formats for the layout of
 * each file.
 */
public class Lex10Codec extends Codec {
  private final StoredFieldsFormat fieldsFormat = new Lex10StoredFieldsFormat();
  private final TermVectorsFormat vectorsFormat = new Lex10TermVectorsFormat();
  private final FieldInfosFormat fieldInfosFormat = new Lex10FieldInfosFormat();
  private final SegmentInfoFormat segmentInfoFormat = new Lex10SegmentInfoFormat();
  private final LiveDocsFormat liveDocsFormat = new Lex10LiveDocsFormat();
  private final PostingsFormat postingsFormat = new Lex10PostingsFormat();
  private final DocValuesFormat docValuesFormat = new Lex10DocValuesFormat();

  /** Sole constructor. */
  public Lex10Codec() {
    super("Lex10");
  }

  @Override
  public final StoredFieldsFormat storedFieldsFormat() {
    return fieldsFormat;
  }

  @Override
  public final TermVectorsFormat termVectorsFormat() {
    return vectorsFormat;
  }

  @Override
  public final PostingsFormat postingsFormat() {
    return postingsFormat;
  }

  @Override
  public final FieldInfosFormat fieldInfosFormat() {
    return fieldInfosFormat;
  }

  @Override
  public final SegmentInfoFormat segmentInfoFormat() {
    return segmentInfoFormat;
  }

  @Override
  public final LiveDocsFormat liveDocsFormat() {
    return liveDocsFormat;
  }

  @Override
  public final DocValuesFormat docValuesFormat() {
    return docValuesFormat;
  }
}
