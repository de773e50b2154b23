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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.lexindex.search.DocIdSetIterator;
import org.lexindex.search.Query;
import org.lexindex.util.InfoStream;
import org.lexindex.util.MutableBits;

/* Tracks the stream of {@link FrozenBufferedDeletes}.
 * Every time DocumentsWriter hands off an in-RAM segment
 * for flushing, the global buffered deletes are frozen
 * into a packet and appended to this stream.  We later
 * apply these deletes (resolve them to the actual
 * docIDs, per segment) when a merge is started
 * (only to the to-be-merged segments).  We
 * also apply to all segments when NRT reader is pulled,
 * commit/close is called, or when too many deletes are
 * buffered.
 *
 * Each packet is assigned a generation, and each flushed or
 * merged segment is also assigned a generation, so we can
 * track which packets to apply to any given segment: a
 * packet applies to every segment whose generation is
 * lower than its own. */

class BufferedDeletesStream {

  private final List<FrozenBufferedDeletes> deletes = new ArrayList<FrozenBufferedDeletes>();

  // Starts at 1 so that SegmentInfos that have never had
  // deletes applied (whose bufferedDelGen defaults to 0)
  // will be correct:
  private long nextGen = 1;

  // Generations of segments that are being flushed and are
  // not yet in the writer's SegmentInfos, with a count per
  // generation.  Packets they still need must not be
  // pruned.
  private final TreeMap<Long,Integer> inFlight = new TreeMap<Long,Integer>();

  private final InfoStream infoStream;
  private long bytesUsed;
  private int numTerms;

  public BufferedDeletesStream(InfoStream infoStream) {
    this.infoStream = infoStream;
  }

  // Appends a new packet of buffered deletes to the stream,
  // setting its generation.  An empty packet only consumes
  // a generation.
  public synchronized long push(FrozenBufferedDeletes packet) {
    packet.setDelGen(nextGen++);
    assert deletes.isEmpty() || deletes.get(deletes.size()-1).delGen() < packet.delGen() : "Delete packets must be in order";
    if (packet.any()) {
      deletes.add(packet);
      numTerms += packet.numTermDeletes;
      bytesUsed += packet.bytesUsed;
      if (infoStream.isEnabled("BD")) {
        infoStream.message("BD", "push deletes " + packet + " delGen=" + packet.delGen() + " packetCount=" + deletes.size());
      }
    }
    return packet.delGen();
  }

  /** Returns a new generation, greater than that of every
   *  packet pushed so far. */
  public synchronized long getNextGen() {
    return nextGen++;
  }

  /** Records that a segment stamped with {@code gen} is
   *  being flushed. */
  synchronized void registerFlush(long gen) {
    final Long key = Long.valueOf(gen);
    final Integer count = inFlight.get(key);
    inFlight.put(key, Integer.valueOf(count == null ? 1 : count.intValue() + 1));
  }

  /** Records that a flush registered with {@link
   *  #registerFlush} was published or discarded. */
  synchronized void finishFlush(long gen) {
    final Long key = Long.valueOf(gen);
    final Integer count = inFlight.get(key);
    assert count != null : "gen=" + gen + " was not registered";
    if (count.intValue() == 1) {
      inFlight.remove(key);
    } else {
      inFlight.put(key, Integer.valueOf(count.intValue() - 1));
    }
  }

  // Generations keep growing: segments restored by a
  // rollback still carry theirs.
  public synchronized void clear() {
    deletes.clear();
    inFlight.clear();
    numTerms = 0;
    bytesUsed = 0;
  }

  public synchronized boolean any() {
    return !deletes.isEmpty();
  }

  public synchronized int numTerms() {
    return numTerms;
  }

  public synchronized long bytesUsed() {
    return bytesUsed;
  }

  public static class ApplyDeletesResult {
    // True if any actual deletes took place:
    public final boolean anyDeletes;

    // Current gen, for the merged segment:
    public final long gen;

    // If non-null, contains segments that are 100% deleted
    public final List<SegmentInfoPerCommit> allDeleted;

    ApplyDeletesResult(boolean anyDeletes, long gen, List<SegmentInfoPerCommit> allDeleted) {
      this.anyDeletes = anyDeletes;
      this.gen = gen;
      this.allDeleted = allDeleted;
    }
  }

  // Sorts SegmentInfos from smallest to biggest bufferedDelGen:
  private static final Comparator<SegmentInfoPerCommit> sortSegInfoByDelGen = new Comparator<SegmentInfoPerCommit>() {
    @Override
    public int compare(SegmentInfoPerCommit si1, SegmentInfoPerCommit si2) {
      final long cmp = si1.getBufferedDeletesGen() - si2.getBufferedDeletesGen();
      if (cmp > 0) {
        return 1;
      } else if (cmp < 0) {
        return -1;
      } else {
        return 0;
      }
    }
  };

  /** Resolves the buffered deleted Term/Query into actual
   *  deleted docIDs in the live docs of each segment's
   *  pooled reader.  Every segment in {@code infos} ends up
   *  stamped with the returned generation. */
  public synchronized ApplyDeletesResult applyDeletes(IndexWriter.ReaderPool readerPool, List<SegmentInfoPerCommit> infos) throws IOException {
    final long t0 = System.currentTimeMillis();

    if (infos.size() == 0) {
      return new ApplyDeletesResult(false, nextGen++, null);
    }

    if (!any()) {
      if (infoStream.isEnabled("BD")) {
        infoStream.message("BD", "applyDeletes: no deletes; skipping");
      }
      return new ApplyDeletesResult(false, nextGen++, null);
    }

    if (infoStream.isEnabled("BD")) {
      infoStream.message("BD", "applyDeletes: infos=" + infos + " packetCount=" + deletes.size());
    }

    final List<SegmentInfoPerCommit> infos2 = new ArrayList<SegmentInfoPerCommit>(infos);
    Collections.sort(infos2, sortSegInfoByDelGen);

    final long gen = nextGen++;
    boolean anyNewDeletes = false;
    List<SegmentInfoPerCommit> allDeleted = null;

    // Walk segments from the newest generation down; each
    // one needs every packet newer than itself, so the
    // coalesced set only grows.
    final Set<Term> coalescedTerms = new HashSet<Term>();
    final Set<Query> coalescedQueries = new HashSet<Query>();
    int delIDX = deletes.size()-1;

    for (int infosIDX = infos2.size()-1; infosIDX >= 0; infosIDX--) {
      final SegmentInfoPerCommit info = infos2.get(infosIDX);
      final long segGen = info.getBufferedDeletesGen();

      while (delIDX >= 0 && deletes.get(delIDX).delGen() > segGen) {
        final FrozenBufferedDeletes packet = deletes.get(delIDX);
        Collections.addAll(coalescedTerms, packet.terms);
        Collections.addAll(coalescedQueries, packet.queries);
        delIDX--;
      }

      if (!coalescedTerms.isEmpty() || !coalescedQueries.isEmpty()) {
        final ReadersAndLiveDocs rld = readerPool.get(info, true);
        int delCount = 0;
        final boolean segAllDeletes;
        try {
          final SegmentReader reader = rld.getReader();
          try {
            delCount += applyTermDeletes(coalescedTerms, rld, reader);
            delCount += applyQueryDeletes(coalescedQueries, rld, reader);
          } finally {
            rld.release(reader);
          }
          segAllDeletes = rld.info.getDelCount() + rld.getPendingDeleteCount() == rld.info.info.getDocCount();
        } finally {
          readerPool.release(rld);
        }
        anyNewDeletes |= delCount > 0;

        if (segAllDeletes) {
          if (allDeleted == null) {
            allDeleted = new ArrayList<SegmentInfoPerCommit>();
          }
          allDeleted.add(info);
        }

        if (infoStream.isEnabled("BD")) {
          infoStream.message("BD", "seg=" + info + " segGen=" + segGen + " coalesced deletes=[terms=" + coalescedTerms.size()
              + " queries=" + coalescedQueries.size() + "] newDelCount=" + delCount + (segAllDeletes ? " 100% deleted" : ""));
        }
      }
      info.setBufferedDeletesGen(gen);
    }

    if (infoStream.isEnabled("BD")) {
      infoStream.message("BD", "applyDeletes took " + (System.currentTimeMillis()-t0) + " msec");
    }

    return new ApplyDeletesResult(anyNewDeletes, gen, allDeleted);
  }

  /** Drops packets that no segment, live or in flight,
   *  still needs. */
  public synchronized void prune(SegmentInfos segmentInfos) {
    long minGen = Long.MAX_VALUE;
    for(SegmentInfoPerCommit info : segmentInfos) {
      minGen = Math.min(info.getBufferedDeletesGen(), minGen);
    }
    if (!inFlight.isEmpty()) {
      minGen = Math.min(inFlight.firstKey().longValue(), minGen);
    }

    if (infoStream.isEnabled("BD")) {
      infoStream.message("BD", "prune sis=" + segmentInfos.size() + " minGen=" + minGen + " packetCount=" + deletes.size());
    }
    final int limit = deletes.size();
    for(int delIDX=0;delIDX<limit;delIDX++) {
      if (deletes.get(delIDX).delGen() > minGen) {
        prune(delIDX);
        return;
      }
    }

    // All deletes pruned
    prune(limit);
  }

  private synchronized void prune(int count) {
    if (count > 0) {
      if (infoStream.isEnabled("BD")) {
        infoStream.message("BD", "pruneDeletes: prune " + count + " packets; " + (deletes.size() - count) + " packets remain");
      }
      for(int delIDX=0;delIDX<count;delIDX++) {
        final FrozenBufferedDeletes packet = deletes.get(delIDX);
        numTerms -= packet.numTermDeletes;
        assert numTerms >= 0;
        bytesUsed -= packet.bytesUsed;
        assert bytesUsed >= 0;
      }
      deletes.subList(0, count).clear();
    }
  }

  // Delete by Term
  private static int applyTermDeletes(Iterable<Term> termsIter, ReadersAndLiveDocs rld, SegmentReader reader) throws IOException {
    int delCount = 0;
    final Fields fields = reader.fields();
    if (fields == null) {
      // This reader has no postings
      return 0;
    }

    String currentField = null;
    TermsEnum termsEnum = null;
    DocsEnum docs = null;

    // a field's terms come together in sorted order, which
    // lets each term reuse the field's enum
    final Term[] sorted = toSortedArray(termsIter);
    for (Term term : sorted) {
      if (!term.field().equals(currentField)) {
        currentField = term.field();
        final Terms terms = fields.terms(currentField);
        termsEnum = terms == null ? null : terms.iterator(null);
      }

      if (termsEnum == null) {
        continue;
      }

      if (termsEnum.seekExact(term.bytes())) {
        // we don't need term frequencies for this
        docs = termsEnum.docs(rld.getLiveDocs(), docs, DocsEnum.FLAG_NONE);
        int docID;
        while ((docID = docs.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
          if (rld.delete(docID)) {
            delCount++;
          }
        }
      }
    }

    return delCount;
  }

  private static Term[] toSortedArray(Iterable<Term> terms) {
    final List<Term> list = new ArrayList<Term>();
    for (Term term : terms) {
      list.add(term);
    }
    final Term[] array = list.toArray(new Term[list.size()]);
    Arrays.sort(array);
    return array;
  }

  // Delete by query
  private static int applyQueryDeletes(Iterable<Query> queries, ReadersAndLiveDocs rld, SegmentReader reader) throws IOException {
    int delCount = 0;
    final AtomicReaderContext readerContext = reader.getContext();
    for (Query query : queries) {
      final DocIdSetIterator it = query.iterator(readerContext, rld.getLiveDocs());
      if (it != null) {
        int doc;
        while ((doc = it.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
          if (rld.delete(doc)) {
            delCount++;
          }
        }
      }
    }

    return delCount;
  }

  /** Applies segment-private deletes to a freshly flushed
   *  segment: a delete only removes documents whose
   *  sequence number is below its own. */
  static int applyPrivateDeletes(BufferedDeletes deletes, long[] docSeqs, SegmentReader reader, MutableBits liveDocs) throws IOException {
    int delCount = 0;
    final Fields fields = reader.fields();
    if (fields != null) {
      DocsEnum docs = null;
      for (Map.Entry<Term,Long> ent : deletes.terms.entrySet()) {
        final Term term = ent.getKey();
        final long delSeq = ent.getValue().longValue();
        final Terms terms = fields.terms(term.field());
        if (terms == null) {
          continue;
        }
        final TermsEnum termsEnum = terms.iterator(null);
        if (termsEnum.seekExact(term.bytes())) {
          docs = termsEnum.docs(null, docs, DocsEnum.FLAG_NONE);
          int docID;
          while ((docID = docs.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
            if (docSeqs[docID] < delSeq && liveDocs.get(docID)) {
              liveDocs.clear(docID);
              delCount++;
            }
          }
        }
      }
    }
    final AtomicReaderContext readerContext = reader.getContext();
    for (Map.Entry<Query,Long> ent : deletes.queries.entrySet()) {
      final long delSeq = ent.getValue().longValue();
      final DocIdSetIterator it = ent.getKey().iterator(readerContext, null);
      if (it != null) {
        int doc;
        while ((doc = it.nextDoc()) != DocIdSetIterator.NO_MORE_DOCS) {
          if (docSeqs[doc] < delSeq && liveDocs.get(doc)) {
            liveDocs.clear(doc);
            delCount++;
          }
        }
      }
    }
    return delCount;
  }
}
