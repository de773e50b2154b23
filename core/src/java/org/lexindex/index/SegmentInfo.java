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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import org.lexindex.codecs.Codec;
import org.lexindex.store.Directory;
import org.lexindex.store.TrackingDirectoryWrapper;

/**
 * Information about a segment such as it's name, directory, and files related
 * to the segment.
 * <p>
 * Everything here is written once, when the segment is
 * flushed or merged; per-commit state (deletions) lives in
 * {@link SegmentInfoPerCommit}.
 *
 */
public final class SegmentInfo {
  
  /** Used by some member fields to mean not present (e.g.,
   *  norms, deletions). */
  public static final int NO = -1;          // e.g. no norms; no deletes;

  /** Used by some member fields to mean present (e.g.,
   *  norms, deletions). */
  public static final int YES = 1;          // e.g. have norms; have deletes;

  /** Unique segment name in the directory. */
  public final String name;

  private int docCount;                     // number of docs in seg

  /** Where this segment resides. */
  public final Directory dir;

  private Codec codec;

  private Map<String,String> diagnostics;
  
  private Set<String> setFiles;

  void setDiagnostics(Map<String, String> diagnostics) {
    this.diagnostics = diagnostics;
  }

  /** Returns diagnostics saved into the segment when it was
   *  written. */
  public Map<String, String> getDiagnostics() {
    return diagnostics;
  }

  /**
   * Construct a new complete SegmentInfo instance from input.
   * <p>Note: this is public only to allow access from
   * the codecs package.</p>
   */
  public SegmentInfo(Directory dir, String name, int docCount, Codec codec, Map<String,String> diagnostics) {
    assert !(dir instanceof TrackingDirectoryWrapper);
    this.dir = dir;
    this.name = name;
    this.docCount = docCount;
    this.codec = codec;
    this.diagnostics = diagnostics == null ? Collections.<String,String>emptyMap() : diagnostics;
  }

  /**
   * Returns total size in bytes of all files used by this
   * segment.  Note that this will not include any live
   * docs for the segment; to include that use {@link
   * SegmentInfoPerCommit#sizeInBytes()} instead.
   */
  public long sizeInBytes() throws IOException {
    long sum = 0;
    for (final String fileName : files()) {
      sum += dir.fileLength(fileName);
    }
    return sum;
  }

  /** Can only be called once. */
  public void setCodec(Codec codec) {
    assert this.codec == null;
    if (codec == null) {
      throw new IllegalArgumentException("segmentCodecs must be non-null");
    }
    this.codec = codec;
  }

  /** Return {@link Codec} that wrote this segment. */
  public Codec getCodec() {
    return codec;
  }

  /** Returns number of documents in this segment (deletions
   *  are not taken into account). */
  public int getDocCount() {
    if (this.docCount == -1) {
      throw new IllegalStateException("docCount isn't set yet");
    }
    return docCount;
  }

  // NOTE: leave package private
  void setDocCount(int docCount) {
    if (this.docCount != -1) {
      throw new IllegalStateException("docCount was already set");
    }
    this.docCount = docCount;
  }

  /** Return all files referenced by this SegmentInfo. */
  public Set<String> files() {
    if (setFiles == null) {
      throw new IllegalStateException("files were not computed yet");
    }
    return Collections.unmodifiableSet(setFiles);
  }

  @Override
  public String toString() {
    return toString(dir, 0);
  }

  /** Used for debugging.  Format may suddenly change.
   *
   *  <p>Current format looks like
   *  <code>_a(Lex10):1000/4</code>, which means the segment's
   *  name is <code>_a</code>; it was created with the Lex10
   *  codec, and has 1000 documents of which 4 are deleted.
   *  A segment held in a foreign directory adds an
   *  <code>x</code> after the doc count.
   */
  public String toString(Directory dir, int delCount) {

    StringBuilder s = new StringBuilder();
    s.append(name).append('(').append(codec == null ? "?" : codec.getName()).append(')').append(':');
    s.append(docCount);

    if (this.dir != dir) {
      s.append('x');
    }

    if (delCount != 0) {
      s.append('/').append(delCount);
    }

    return s.toString();
  }

  /** We consider another SegmentInfo instance equal if it
   *  has the same dir and same name. */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj instanceof SegmentInfo) {
      final SegmentInfo other = (SegmentInfo) obj;
      return other.dir == dir && other.name.equals(name);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return dir.hashCode() + name.hashCode();
  }

  /** Sets the files written for this segment. */
  public void setFiles(Collection<String> files) {
    checkFileNames(files);
    setFiles = new HashSet<String>(files);
  }

  /** Add these files to the set of files written for this
   *  segment. */
  public void addFiles(Collection<String> files) {
    checkFileNames(files);
    setFiles.addAll(files);
  }

  /** Add this file to the set of files written for this
   *  segment. */
  public void addFile(String file) {
    checkFileNames(Collections.singleton(file));
    setFiles.add(file);
  }
  
  private void checkFileNames(Collection<String> files) {
    Matcher m = IndexFileNames.CODEC_FILE_PATTERN.matcher("");
    for (String file : files) {
      m.reset(file);
      if (!m.matches()) {
        throw new IllegalArgumentException("invalid codec filename '" + file + "', must match: " + IndexFileNames.CODEC_FILE_PATTERN.pattern());
      }
    }
  }
}
