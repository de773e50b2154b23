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

import java.util.Map;

/**
 * A {@link MergePolicy} which never returns merges to execute (hence it's
 * name). It is a singleton and can be accessed through
 * {@link NoMergePolicy#INSTANCE}. Use it if you want to prevent an {@link
 * IndexWriter} from ever executing merges, without going through the hassle
 * of tweaking a merge policy's settings to achieve that, such as changing
 * its merge factor.
 */
public final class NoMergePolicy extends MergePolicy {

  /** The singleton instance. */
  public static final MergePolicy INSTANCE = new NoMergePolicy();

  private NoMergePolicy() {
    // prevent instantiation
  }

  @Override
  public void close() {}

  @Override
  public MergeSpecification findMerges(SegmentInfos segmentInfos) { return null; }

  @Override
  public MergeSpecification findForcedMerges(SegmentInfos segmentInfos,
             int maxSegmentCount, Map<SegmentInfoPerCommit,Boolean> segmentsToMerge) { return null; }

  @Override
  public MergeSpecification findForcedDeletesMerges(SegmentInfos segmentInfos) { return null; }

  @Override
  public void setIndexWriter(IndexWriter writer) {}

  @Override
  public String toString() {
    return "NoMergePolicy";
  }
}
