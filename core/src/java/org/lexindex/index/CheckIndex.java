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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.lexindex.codecs.CodecUtil;
import org.lexindex.document.Document;
import org.lexindex.index.FieldInfo.IndexOptions;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.search.IndexSearcher;
import org.lexindex.search.TermQuery;
import org.lexindex.store.Directory;
import org.lexindex.store.FSDirectory;
import org.lexindex.store.IndexInput;
import org.lexindex.util.Bits;
import org.lexindex.util.BytesRef;
import org.lexindex.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Basic tool and API to check the health of an index and
 * report per-segment findings.  It only reads; the index is
 * never modified.
 *
 * <p>As this tool checks every byte in the index, on a large
 * index it can take quite a long time to run.
 */
public class CheckIndex {

  private static final Logger log = LoggerFactory.getLogger(CheckIndex.class);

  private PrintStream infoStream;
  private final Directory dir;

  /**
   * Returned from {@link #checkIndex()} detailing the health and status of the index.
   */
  public static class Status {

    /** True if no problems were found with the index. */
    public boolean clean;

    /** True if we were unable to locate and load the segments_N file. */
    public boolean missingSegments;

    /** Name of latest segments_N file in the index. */
    public String segmentsFileName;

    /** Number of segments in the index. */
    public int numSegments;

    /** Empty unless you passed specific segments list to check as optional 3rd argument.
     *  @see CheckIndex#checkIndex(List) */
    public List<String> segmentsChecked = new ArrayList<String>();

    /** List of {@link SegmentInfoStatus} instances, detailing status of each segment. */
    public List<SegmentInfoStatus> segmentInfos = new ArrayList<SegmentInfoStatus>();

    /** Directory index is in. */
    public Directory dir;

    /** How many documents would be lost if the broken segments were removed. */
    public int totLoseDocCount;

    /** How many bad segments were found. */
    public int numBadSegments;

    /** True if we checked only specific segments ({@link
     * #checkIndex(List)}) was called with non-null
     * argument). */
    public boolean partial;

    /** The greatest segment name. */
    public int maxSegmentName;

    /** Whether the SegmentInfos.counter is greater than any of the segments' names. */
    public boolean validCounter;

    /** Holds the userData of the last commit in the index */
    public Map<String, String> userData;

    /** Holds the status of each segment in the index. */
    public static class SegmentInfoStatus {
      /** Name of the segment. */
      public String name;

      /** Codec used to read this segment. */
      public String codec;

      /** Document count (deleted documents included). */
      public int docCount;

      /** Number of files referenced by this segment. */
      public int numFiles;

      /** Net size (MB) of the files referenced by this segment. */
      public double sizeMB;

      /** True if every file's footer checksum matched. */
      public boolean checksumsPassed;

      /** True if this segment has pending deletions. */
      public boolean hasDeletions;

      /** Current deletions generation. */
      public long deletionsGen;

      /** Number of deleted documents. */
      public int numDeleted;

      /** True if we were able to open a SegmentReader on this segment. */
      public boolean openReaderPassed;

      /** Number of fields in this segment. */
      public int numFields;

      /** Map that includes certain debugging details that
       *  IndexWriter records into each segment it creates */
      public Map<String,String> diagnostics;

      /** Status for testing of the terms and postings (null if not checked). */
      public TermIndexStatus termIndexStatus;

      /** Status for testing of stored fields (null if not checked). */
      public StoredFieldStatus storedFieldStatus;

      /** Status for testing of term vectors (null if not checked). */
      public TermVectorStatus termVectorStatus;

      /** Status for testing of doc values (null if not checked). */
      public DocValuesStatus docValuesStatus;
    }

    /** Status from testing the terms and postings. */
    public static final class TermIndexStatus {
      /** Total term count */
      public long termCount = 0L;

      /** Total frequency across all terms. */
      public long totFreq = 0L;

      /** Total number of positions. */
      public long totPos = 0L;

      /** Exception thrown during term index test (null on success) */
      public Throwable error = null;
    }

    /** Status from testing stored fields. */
    public static final class StoredFieldStatus {
      /** Number of documents tested. */
      public int docCount = 0;

      /** Total number of stored fields tested. */
      public long totFields = 0;

      /** Exception thrown during stored fields test (null on success) */
      public Throwable error = null;
    }

    /** Status from testing term vectors. */
    public static final class TermVectorStatus {
      /** Number of documents tested. */
      public int docCount = 0;

      /** Total number of term vectors tested. */
      public long totVectors = 0;

      /** Exception thrown during term vector test (null on success) */
      public Throwable error = null;
    }

    /** Status from testing doc values. */
    public static final class DocValuesStatus {
      /** Total number of doc values fields tested. */
      public long totalValueFields;

      /** Exception thrown during doc values test (null on success) */
      public Throwable error = null;
    }
  }

  /** Create a new CheckIndex on the directory. */
  public CheckIndex(Directory dir) {
    this.dir = dir;
    infoStream = null;
  }

  /** Set infoStream where messages should go.  If null, no
   * messages are printed */
  public void setInfoStream(PrintStream out) {
    infoStream = out;
  }

  private void msg(String msg) {
    if (infoStream != null)
      infoStream.println(msg);
  }

  private void print(String msg) {
    if (infoStream != null)
      infoStream.print(msg);
  }

  private void printStackTrace(Throwable t) {
    if (infoStream != null)
      t.printStackTrace(infoStream);
  }

  /** Returns a {@link Status} instance detailing
   *  the state of the index.
   *
   *  <p>As this method checks every byte in the index, on a large
   *  index it can take quite a long time to run.
   *
   *  <p><b>WARNING</b>: make sure
   *  you only call this when the index is not opened by any
   *  writer. */
  public Status checkIndex() throws IOException {
    return checkIndex(null);
  }

  /** Returns a {@link Status} instance detailing
   *  the state of the index.
   * 
   *  @param onlySegments list of specific segment names to check
   *
   *  <p>As this method checks every byte in the specified
   *  segments, on a large index it can take quite a long
   *  time to run. */
  public Status checkIndex(List<String> onlySegments) throws IOException {
    final NumberFormat nf = NumberFormat.getInstance(Locale.ROOT);
    final SegmentInfos sis = new SegmentInfos();
    final Status result = new Status();
    result.dir = dir;
    try {
      sis.read(dir);
    } catch (Throwable t) {
      msg("ERROR: could not read any segments file in directory");
      printStackTrace(t);
      log.warn("could not read any segments file in {}", dir, t);
      result.missingSegments = true;
      return result;
    }

    final int numSegments = sis.size();
    final String segmentsFileName = sis.getSegmentsFileName();

    result.segmentsFileName = segmentsFileName;
    result.numSegments = numSegments;
    result.userData = sis.getUserData();
    String userDataString;
    if (sis.getUserData().size() > 0) {
      userDataString = " userData=" + sis.getUserData();
    } else {
      userDataString = "";
    }

    msg("Segments file=" + segmentsFileName + " numSegments=" + numSegments + userDataString);

    if (onlySegments != null) {
      result.partial = true;
      print("\nChecking only these segments:");
      for (String s : onlySegments) {
        print(" " + s);
      }
      result.segmentsChecked.addAll(onlySegments);
      msg(":");
    }

    result.maxSegmentName = -1;

    for(int i=0;i<numSegments;i++) {
      final SegmentInfoPerCommit info = sis.info(i);
      int segmentName = Integer.parseInt(info.info.name.substring(1), Character.MAX_RADIX);
      if (segmentName > result.maxSegmentName) {
        result.maxSegmentName = segmentName;
      }
      if (onlySegments != null && !onlySegments.contains(info.info.name)) {
        continue;
      }
      Status.SegmentInfoStatus segInfoStat = new Status.SegmentInfoStatus();
      result.segmentInfos.add(segInfoStat);
      msg("  " + (1+i) + " of " + numSegments + ": name=" + info.info.name + " docCount=" + info.info.getDocCount());
      segInfoStat.name = info.info.name;
      segInfoStat.docCount = info.info.getDocCount();

      int toLoseDocCount = info.info.getDocCount();

      SegmentReader reader = null;

      try {
        segInfoStat.codec = info.info.getCodec().getName();
        msg("    codec=" + segInfoStat.codec);
        segInfoStat.numFiles = info.files().size();
        msg("    numFiles=" + segInfoStat.numFiles);
        segInfoStat.sizeMB = info.sizeInBytes()/(1024.*1024.);
        msg("    size (MB)=" + nf.format(segInfoStat.sizeMB));
        Map<String,String> diagnostics = info.info.getDiagnostics();
        segInfoStat.diagnostics = diagnostics;
        if (diagnostics.size() > 0) {
          msg("    diagnostics = " + diagnostics);
        }

        if (!info.hasDeletions()) {
          msg("    no deletions");
          segInfoStat.hasDeletions = false;
        } else {
          msg("    has deletions [delGen=" + info.getDelGen() + "]");
          segInfoStat.hasDeletions = true;
          segInfoStat.deletionsGen = info.getDelGen();
        }

        print("    test: checksums...........");
        testChecksums(info);
        segInfoStat.checksumsPassed = true;
        msg("OK");

        print("    test: open reader.........");
        reader = new SegmentReader(info);

        segInfoStat.openReaderPassed = true;

        final int numDocs = reader.numDocs();
        toLoseDocCount = numDocs;
        if (reader.hasDeletions()) {
          if (reader.numDocs() != info.info.getDocCount() - info.getDelCount()) {
            throw new RuntimeException("delete count mismatch: info=" + (info.info.getDocCount() - info.getDelCount()) + " vs reader=" + reader.numDocs());
          }
          if ((info.info.getDocCount()-reader.numDocs()) > reader.maxDoc()) {
            throw new RuntimeException("too many deleted docs: maxDoc()=" + reader.maxDoc() + " vs del count=" + (info.info.getDocCount()-reader.numDocs()));
          }
          if (info.info.getDocCount() - numDocs != info.getDelCount()) {
            throw new RuntimeException("delete count mismatch: info=" + info.getDelCount() + " vs reader=" + (info.info.getDocCount() - numDocs));
          }
          final Bits liveDocs = reader.getLiveDocs();
          if (liveDocs == null) {
            throw new RuntimeException("segment should have deletions, but liveDocs is null");
          } else {
            int numLive = 0;
            for (int j = 0; j < liveDocs.length(); j++) {
              if (liveDocs.get(j)) {
                numLive++;
              }
            }
            if (numLive != numDocs) {
              throw new RuntimeException("liveDocs count mismatch: info=" + numDocs + ", vs bits=" + numLive);
            }
          }

          segInfoStat.numDeleted = info.info.getDocCount() - numDocs;
          msg("OK [" + (segInfoStat.numDeleted) + " deleted docs]");
        } else {
          if (info.getDelCount() != 0) {
            throw new RuntimeException("delete count mismatch: info=" + info.getDelCount() + " vs reader=" + (info.info.getDocCount() - numDocs));
          }
          if (reader.getLiveDocs() != null) {
            throw new RuntimeException("segment should not have deletions, but liveDocs is not null");
          }
          msg("OK");
        }
        if (reader.maxDoc() != info.info.getDocCount()) {
          throw new RuntimeException("SegmentReader.maxDoc() " + reader.maxDoc() + " != SegmentInfos.docCount " + info.info.getDocCount());
        }

        // Test getFieldInfos()
        print("    test: fields..............");
        FieldInfos fieldInfos = reader.getFieldInfos();
        msg("OK [" + fieldInfos.size() + " fields]");
        segInfoStat.numFields = fieldInfos.size();

        // Test the Term Index
        segInfoStat.termIndexStatus = testPostings(reader);

        // Test Stored Fields
        segInfoStat.storedFieldStatus = testStoredFields(reader, nf);

        // Test Term Vectors
        segInfoStat.termVectorStatus = testTermVectors(reader, nf);

        segInfoStat.docValuesStatus = testDocValues(reader);

        // Rethrow the first exception we encountered
        //  This will cause stats for failed segments to be incremented properly
        if (segInfoStat.termIndexStatus.error != null) {
          throw new RuntimeException("Term Index test failed");
        } else if (segInfoStat.storedFieldStatus.error != null) {
          throw new RuntimeException("Stored Field test failed");
        } else if (segInfoStat.termVectorStatus.error != null) {
          throw new RuntimeException("Term Vector test failed");
        } else if (segInfoStat.docValuesStatus.error != null) {
          throw new RuntimeException("DocValues test failed");
        }

        msg("");

      } catch (Throwable t) {
        msg("FAILED");
        msg("    WARNING: removing this segment would lose " + toLoseDocCount + " docs; full exception:");
        printStackTrace(t);
        msg("");
        log.warn("segment {} of {} is broken", info.info.name, dir, t);
        result.totLoseDocCount += toLoseDocCount;
        result.numBadSegments++;
        continue;
      } finally {
        if (reader != null)
          reader.close();
      }
    }

    if (0 == result.numBadSegments) {
      result.clean = true;
    } else {
      msg("WARNING: " + result.numBadSegments + " broken segments (containing " + result.totLoseDocCount + " documents) detected");
    }

    if ( ! (result.validCounter = (result.maxSegmentName < sis.counter))) {
      result.clean = false;
      msg("ERROR: Next segment name counter " + sis.counter + " is not greater than max segment name " + result.maxSegmentName);
    }

    if (result.clean) {
      msg("No problems were detected with this index.\n");
    } else {
      log.warn("index in {} is not clean: {} broken segments, validCounter={}", dir, result.numBadSegments, result.validCounter);
    }

    return result;
  }

  /**
   * Verifies the footer checksum of every file the segment references.
   */
  private void testChecksums(SegmentInfoPerCommit info) throws IOException {
    for (String file : info.files()) {
      final IndexInput in = dir.openInput(file);
      boolean success = false;
      try {
        CodecUtil.checksumEntireFile(in);
        success = true;
      } finally {
        if (success) {
          IOUtils.close(in);
        } else {
          IOUtils.closeWhileHandlingException(in);
        }
      }
    }
  }

  /**
   * Test the term index.
   */
  private Status.TermIndexStatus testPostings(SegmentReader reader) {
    final Status.TermIndexStatus status = new Status.TermIndexStatus();

    final int maxDoc = reader.maxDoc();
    final Bits liveDocs = reader.getLiveDocs();
    final IndexSearcher is = new IndexSearcher(reader);

    try {

      print("    test: terms, freq, prox...");

      final Fields fields = reader.fields();
      if (fields == null) {
        msg("OK [no fields/terms]");
        return status;
      }

      DocsEnum docs = null;
      DocsEnum docsAndFreqs = null;
      DocsAndPositionsEnum postings = null;

      for (String field : fields) {
        final FieldInfo fieldInfo = reader.getFieldInfos().fieldInfo(field);
        if (fieldInfo == null) {
          throw new RuntimeException("fieldsEnum inconsistent with fieldInfos, no fieldInfos for: " + field);
        }
        if (!fieldInfo.isIndexed()) {
          throw new RuntimeException("fieldsEnum inconsistent with fieldInfos, isIndexed == false for: " + field);
        }

        final Terms terms = fields.terms(field);
        if (terms == null) {
          continue;
        }

        final boolean hasFreqs = terms.hasFreqs();
        final boolean hasPositions = terms.hasPositions();
        if (hasPositions != (fieldInfo.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0)) {
          throw new RuntimeException("field \"" + field + "\" hasPositions=" + hasPositions + " but indexOptions=" + fieldInfo.getIndexOptions());
        }

        final TermsEnum termsEnum = terms.iterator(null);

        boolean hasOrd = true;
        final long termCountStart = status.termCount;

        BytesRef lastTerm = null;

        Comparator<BytesRef> termComp = terms.getComparator();

        long sumTotalTermFreq = 0;
        long sumDocFreq = 0;
        final FixedVisitedDocs visitedDocs = new FixedVisitedDocs(maxDoc);

        while(true) {

          final BytesRef term = termsEnum.next();
          if (term == null) {
            break;
          }

          // make sure terms arrive in order according to
          // the comp
          if (lastTerm == null) {
            lastTerm = BytesRef.deepCopyOf(term);
          } else {
            if (termComp.compare(lastTerm, term) >= 0) {
              throw new RuntimeException("terms out of order: lastTerm=" + lastTerm + " term=" + term);
            }
            lastTerm.copyBytes(term);
          }

          final int docFreq = termsEnum.docFreq();
          if (docFreq <= 0) {
            throw new RuntimeException("docfreq: " + docFreq + " is out of bounds");
          }
          status.totFreq += docFreq;
          sumDocFreq += docFreq;

          docs = termsEnum.docs(liveDocs, docs, DocsEnum.FLAG_NONE);
          docsAndFreqs = termsEnum.docs(liveDocs, docsAndFreqs, DocsEnum.FLAG_FREQS);
          postings = hasPositions ? termsEnum.docsAndPositions(liveDocs, postings) : null;

          if (hasOrd) {
            long ord = -1;
            try {
              ord = termsEnum.ord();
            } catch (UnsupportedOperationException uoe) {
              hasOrd = false;
            }

            if (hasOrd) {
              final long ordExpected = status.termCount - termCountStart;
              if (ord != ordExpected) {
                throw new RuntimeException("ord mismatch: TermsEnum has ord=" + ord + " vs actual=" + ordExpected);
              }
            }
          }

          status.termCount++;

          final DocsEnum docs2;
          if (postings != null) {
            docs2 = postings;
          } else if (hasFreqs) {
            docs2 = docsAndFreqs;
          } else {
            docs2 = docs;
          }

          int lastDoc = -1;
          long totalTermFreq = 0;
          while(true) {
            final int doc = docs2.nextDoc();
            if (doc == DocIdSetIterator.NO_MORE_DOCS) {
              break;
            }
            visitedDocs.set(doc);
            int freq = -1;
            if (hasFreqs) {
              freq = docs2.freq();
              if (freq <= 0) {
                throw new RuntimeException("term " + term + ": doc " + doc + ": freq " + freq + " is out of bounds");
              }
              status.totPos += freq;
              totalTermFreq += freq;
            }

            if (doc <= lastDoc) {
              throw new RuntimeException("term " + term + ": doc " + doc + " <= lastDoc " + lastDoc);
            }
            if (doc >= maxDoc) {
              throw new RuntimeException("term " + term + ": doc " + doc + " >= maxDoc " + maxDoc);
            }

            lastDoc = doc;

            int lastPos = -1;
            int lastOffset = 0;
            if (postings != null) {
              for(int j=0;j<freq;j++) {
                final int pos = postings.nextPosition();
                if (pos < 0) {
                  throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + " is out of bounds");
                }
                if (pos < lastPos) {
                  throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + " < lastPos " + lastPos);
                }
                lastPos = pos;
                if (terms.hasOffsets()) {
                  final int startOffset = postings.startOffset();
                  final int endOffset = postings.endOffset();
                  if (startOffset < 0) {
                    throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + ": startOffset " + startOffset + " is out of bounds");
                  }
                  if (startOffset < lastOffset) {
                    throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + ": startOffset " + startOffset + " < lastStartOffset " + lastOffset);
                  }
                  if (endOffset < startOffset) {
                    throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + ": endOffset " + endOffset + " < startOffset " + startOffset);
                  }
                  lastOffset = startOffset;
                }
                final BytesRef payload = postings.getPayload();
                if (payload != null && payload.length < 1) {
                  throw new RuntimeException("term " + term + ": doc " + doc + ": pos " + pos + " payload length is out of bounds " + payload.length);
                }
              }
            }
          }

          // Re-count if there are deleted docs:
          final DocsEnum docsNoDel = termsEnum.docs(null, docsAndFreqs, hasFreqs ? DocsEnum.FLAG_FREQS : DocsEnum.FLAG_NONE);
          int docCount = 0;
          long totalTermFreqNoDel = 0;
          while(docsNoDel.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
            docCount++;
            if (hasFreqs) {
              totalTermFreqNoDel += docsNoDel.freq();
            }
          }
          if (liveDocs == null && hasFreqs && totalTermFreqNoDel != totalTermFreq) {
            throw new RuntimeException("term " + term + " totalTermFreq=" + totalTermFreq + " != totalTermFreq w/o deletions " + totalTermFreqNoDel);
          }

          if (docCount != docFreq) {
            throw new RuntimeException("term " + term + " docFreq=" + docFreq + " != tot docs w/o deletions " + docCount);
          }
          final long totalTermFreq2 = termsEnum.totalTermFreq();
          if (hasFreqs) {
            sumTotalTermFreq += totalTermFreqNoDel;
            if (totalTermFreq2 != totalTermFreqNoDel) {
              throw new RuntimeException("term " + term + " totalTermFreq=" + totalTermFreq2 + " != recomputed totalTermFreq=" + totalTermFreqNoDel);
            }
          }

          // Test skipping
          if (docFreq >= 16) {
            for(int idx=0;idx<7;idx++) {
              final int skipDocID = (int) (((idx+1)*(long) maxDoc)/8);
              docs = termsEnum.docs(liveDocs, docs, DocsEnum.FLAG_NONE);
              final int docID = docs.advance(skipDocID);
              if (docID == DocIdSetIterator.NO_MORE_DOCS) {
                break;
              } else {
                if (docID < skipDocID) {
                  throw new RuntimeException("term " + term + ": advance(docID=" + skipDocID + ") returned docID=" + docID);
                }
                final int nextDocID = docs.nextDoc();
                if (nextDocID == DocIdSetIterator.NO_MORE_DOCS) {
                  break;
                }
                if (nextDocID <= docID) {
                  throw new RuntimeException("term " + term + ": advance(docID=" + skipDocID + "), then .next() returned docID=" + nextDocID + " vs prev docID=" + docID);
                }
              }
            }
          }
        }

        if (sumTotalTermFreq != 0) {
          final long v = terms.getSumTotalTermFreq();
          if (v != -1 && sumTotalTermFreq != v) {
            throw new RuntimeException("sumTotalTermFreq for field " + field + "=" + v + " != recomputed sumTotalTermFreq=" + sumTotalTermFreq);
          }
        }

        if (sumDocFreq != 0) {
          final long v = terms.getSumDocFreq();
          if (v != -1 && sumDocFreq != v) {
            throw new RuntimeException("sumDocFreq for field " + field + "=" + v + " != recomputed sumDocFreq=" + sumDocFreq);
          }
        }

        final int v = terms.getDocCount();
        if (v != -1 && visitedDocs.cardinality() != v) {
          throw new RuntimeException("docCount for field " + field + "=" + v + " != recomputed docCount=" + visitedDocs.cardinality());
        }

        // Test seek to last term:
        if (lastTerm != null) {
          if (termsEnum.seekCeil(lastTerm) != TermsEnum.SeekStatus.FOUND) {
            throw new RuntimeException("seek to last term " + lastTerm + " failed");
          }
          if (!termsEnum.seekExact(lastTerm)) {
            throw new RuntimeException("seekExact to last term " + lastTerm + " failed");
          }

          is.search(new TermQuery(new Term(field, lastTerm)), 1);
        }

        // check unique term count
        final long termCount = status.termCount - termCountStart;
        final long uniqueTermCount = terms.size();
        if (uniqueTermCount != -1 && uniqueTermCount != termCount) {
          throw new RuntimeException("termCount mismatch " + uniqueTermCount + " vs " + termCount);
        }

        // Test seeking by ord
        if (hasOrd && termCount > 0) {
          int seekCount = (int) Math.min(10000L, termCount);
          if (seekCount > 0) {
            BytesRef[] seekTerms = new BytesRef[seekCount];

            // Seek by ord
            for(int i=seekCount-1;i>=0;i--) {
              long ord = i*(termCount/seekCount);
              termsEnum.seekExact(ord);
              seekTerms[i] = BytesRef.deepCopyOf(termsEnum.term());
            }

            // Seek by term
            long totDocCount = 0;
            for(int i=seekCount-1;i>=0;i--) {
              if (termsEnum.seekCeil(seekTerms[i]) != TermsEnum.SeekStatus.FOUND) {
                throw new RuntimeException("seek to existing term " + seekTerms[i] + " failed");
              }

              docs = termsEnum.docs(liveDocs, docs, DocsEnum.FLAG_NONE);
              if (docs == null) {
                throw new RuntimeException("null DocsEnum from to existing term " + seekTerms[i]);
              }

              while(docs.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
                totDocCount++;
              }
            }

            // TermQuery
            long totDocCount2 = 0;
            for(int i=0;i<seekCount;i++) {
              totDocCount2 += is.search(new TermQuery(new Term(field, seekTerms[i])), 1).totalHits;
            }

            if (totDocCount != totDocCount2) {
              throw new RuntimeException("search to seek terms produced wrong number of hits: " + totDocCount + " vs " + totDocCount2);
            }
          }
        }
      }

      msg("OK [" + status.termCount + " terms; " + status.totFreq + " terms/docs pairs; " + status.totPos + " tokens]");

    } catch (Throwable e) {
      msg("ERROR: " + e);
      status.error = e;
      printStackTrace(e);
    }

    return status;
  }

  // tracks which docs a field's postings touched
  private static final class FixedVisitedDocs {
    private final boolean[] bits;
    private int count;

    FixedVisitedDocs(int maxDoc) {
      bits = new boolean[maxDoc];
    }

    void set(int doc) {
      if (!bits[doc]) {
        bits[doc] = true;
        count++;
      }
    }

    int cardinality() {
      return count;
    }
  }

  /**
   * Test stored fields for a segment.
   */
  private Status.StoredFieldStatus testStoredFields(SegmentReader reader, NumberFormat format) {
    final Status.StoredFieldStatus status = new Status.StoredFieldStatus();

    try {
      print("    test: stored fields.......");

      // Scan stored fields for all documents
      final Bits liveDocs = reader.getLiveDocs();
      for (int j = 0; j < reader.maxDoc(); ++j) {
        // Intentionally pull even deleted documents to
        // make sure they too are not corrupt:
        Document doc = reader.document(j);
        if (liveDocs == null || liveDocs.get(j)) {
          status.docCount++;
          for (IndexableField field : doc) {
            status.totFields++;
          }
        }
      }

      // Validate docCount
      if (status.docCount != reader.numDocs()) {
        throw new RuntimeException("docCount=" + status.docCount + " but saw " + status.docCount + " undeleted docs");
      }

      msg("OK [" + status.totFields + " total field count; avg " +
          format.format((((float) status.totFields)/Math.max(1, status.docCount))) + " fields per doc]");
    } catch (Throwable e) {
      msg("ERROR [" + String.valueOf(e.getMessage()) + "]");
      status.error = e;
      printStackTrace(e);
    }

    return status;
  }

  /**
   * Test doc values for a segment: every document's value is
   * readable for each doc values field.
   */
  private Status.DocValuesStatus testDocValues(SegmentReader reader) {
    final Status.DocValuesStatus status = new Status.DocValuesStatus();
    try {
      print("    test: docvalues...........");
      final BytesRef scratch = new BytesRef();
      for (FieldInfo fieldInfo : reader.getFieldInfos()) {
        if (!fieldInfo.hasDocValues()) {
          if (reader.getNumericDocValues(fieldInfo.name) != null ||
              reader.getBinaryDocValues(fieldInfo.name) != null) {
            throw new RuntimeException("field: " + fieldInfo.name + " has docvalues but should omit them!");
          }
          continue;
        }
        status.totalValueFields++;
        switch (fieldInfo.getDocValuesType()) {
          case NUMERIC:
            final NumericDocValues numeric = reader.getNumericDocValues(fieldInfo.name);
            if (numeric == null) {
              throw new RuntimeException("field: " + fieldInfo.name + " omits docvalues but should have them!");
            }
            for (int doc = 0; doc < reader.maxDoc(); doc++) {
              numeric.get(doc);
            }
            break;
          case BINARY:
            final BinaryDocValues binary = reader.getBinaryDocValues(fieldInfo.name);
            if (binary == null) {
              throw new RuntimeException("field: " + fieldInfo.name + " omits docvalues but should have them!");
            }
            for (int doc = 0; doc < reader.maxDoc(); doc++) {
              binary.get(doc, scratch);
              if (scratch.length < 0 || scratch.offset < 0) {
                throw new RuntimeException("field: " + fieldInfo.name + " doc: " + doc + " has an invalid value " + scratch);
              }
            }
            break;
          default:
            throw new AssertionError();
        }
      }

      msg("OK [" + status.totalValueFields + " docvalues fields]");
    } catch (Throwable e) {
      msg("ERROR [" + String.valueOf(e.getMessage()) + "]");
      status.error = e;
      printStackTrace(e);
    }
    return status;
  }

  /**
   * Test term vectors for a segment.
   */
  private Status.TermVectorStatus testTermVectors(SegmentReader reader, NumberFormat format) {
    final Status.TermVectorStatus status = new Status.TermVectorStatus();

    try {
      print("    test: term vectors........");

      final Bits liveDocs = reader.getLiveDocs();
      for (int j = 0; j < reader.maxDoc(); ++j) {
        // Intentionally pull/visit (but don't count in
        // stats) deleted documents to make sure they too
        // are not corrupt:
        final Fields tfv = reader.getTermVectors(j);
        if (tfv == null) {
          continue;
        }
        for (String field : tfv) {
          final FieldInfo fieldInfo = reader.getFieldInfos().fieldInfo(field);
          if (fieldInfo == null || !fieldInfo.hasVectors()) {
            throw new RuntimeException("docID=" + j + " has term vectors for field=" + field + " but FieldInfo has storeTermVector=false");
          }
          final Terms terms = tfv.terms(field);
          final TermsEnum termsEnum = terms.iterator(null);
          BytesRef lastTerm = null;
          BytesRef term;
          while ((term = termsEnum.next()) != null) {
            if (lastTerm == null) {
              lastTerm = BytesRef.deepCopyOf(term);
            } else {
              if (terms.getComparator().compare(lastTerm, term) >= 0) {
                throw new RuntimeException("vector terms out of order for doc " + j + ": lastTerm=" + lastTerm + " term=" + term);
              }
              lastTerm.copyBytes(term);
            }
            if (termsEnum.totalTermFreq() <= 0) {
              throw new RuntimeException("vector term " + term + " for doc " + j + " has totalTermFreq " + termsEnum.totalTermFreq());
            }
          }
        }
        if (liveDocs == null || liveDocs.get(j)) {
          status.docCount++;
          status.totVectors += tfv.size();
        }
      }

      final float vectorAvg = status.docCount == 0 ? 0 : status.totVectors / (float)status.docCount;
      msg("OK [" + status.totVectors + " total vector count; avg " +
          format.format(vectorAvg) + " term/freq vector fields per doc]");
    } catch (Throwable e) {
      msg("ERROR [" + String.valueOf(e.getMessage()) + "]");
      status.error = e;
      printStackTrace(e);
    }

    return status;
  }

  /** Command-line interface to check an index.

    <p>
    Run it like this:
    <pre>
    java -ea:org.lexindex... org.lexindex.index.CheckIndex pathToIndex [-segment X] [-segment Y]
    </pre>
    <ul>
    <li><code>-segment X</code>: only check the specified
    segment(s).  This can be specified multiple times,
    to check more than one segment, eg <code>-segment _2
    -segment _a</code>.
    </ul>

    <p>The tool exits with code 0 when the index is clean
    and 1 otherwise.
  */
  public static void main(String[] args) throws IOException {

    List<String> onlySegments = new ArrayList<String>();
    String indexPath = null;
    int i = 0;
    while(i < args.length) {
      String arg = args[i];
      if ("-segment".equals(arg)) {
        if (i == args.length-1) {
          System.out.println("ERROR: missing name for -segment option");
          System.exit(1);
        }
        i++;
        onlySegments.add(args[i]);
      } else {
        if (indexPath != null) {
          System.out.println("ERROR: unexpected extra argument '" + args[i] + "'");
          System.exit(1);
        }
        indexPath = args[i];
      }
      i++;
    }

    if (indexPath == null) {
      System.out.println("\nUsage: java org.lexindex.index.CheckIndex pathToIndex [-segment X] [-segment Y]\n" +
                         "\n" +
                         "  -segment X: only check the specified segments.  This can be specified\n" +
                         "              multiple times, to check more than one segment, eg '-segment _2 -segment _a'.\n" +
                         "\n" +
                         "This tool never modifies the index.\n");
      System.exit(1);
    }

    if (onlySegments.size() == 0)
      onlySegments = null;

    System.out.println("\nOpening index @ " + indexPath + "\n");
    Directory dir = null;
    try {
      dir = FSDirectory.open(new File(indexPath));
    } catch (Throwable t) {
      System.out.println("ERROR: could not open directory \"" + indexPath + "\"; exiting");
      t.printStackTrace(System.out);
      System.exit(1);
    }

    CheckIndex checker = new CheckIndex(dir);
    checker.setInfoStream(System.out);

    Status result = checker.checkIndex(onlySegments);
    if (result.missingSegments) {
      System.exit(1);
    }

    dir.close();
    System.exit(result.clean ? 0 : 1);
  }
}
