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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.lexindex.analysis.Analyzer;
import org.lexindex.search.Query;
import org.lexindex.store.AlreadyClosedException;
import org.lexindex.store.Directory;
import org.lexindex.util.InfoStream;

/**
 * This class accepts multiple added documents and directly
 * writes segment files.
 *
 * Each added document is passed to the indexing chain of a
 * {@link DocumentsWriterPerThread}, which buffers the
 * inverted document in RAM.  Up to {@link
 * IndexWriterConfig#getMaxThreadStates()} threads index at
 * once, each holding one {@link ThreadState}.  When a
 * per-thread buffer hits the document count or RAM limit
 * it is written as a new segment by the thread that filled
 * it; {@link #flushAllThreads} writes every buffer.
 *
 * <p>Every add and delete is stamped with a sequence
 * number, taken under this object's lock together with the
 * choice of the buffer the document goes to.  Deletes are
 * buffered twice: in a global buffer that is pushed to the
 * {@link BufferedDeletesStream} for segments already
 * written, and in each open per-thread buffer where they
 * only hit documents with an older sequence number.  This
 * keeps the delete and add of an update atomic to any
 * reader.  While a full flush runs, from freezing its
 * buffers until the caller has opened its reader or cloned
 * its commit ({@link #finishFullFlush}), no other thread
 * freezes a buffer or pushes deletes: a packet pushed in that
 * window could carry the delete of an update whose document
 * sits in a buffer the full flush did not take.
 *
 * <p>Locks are taken in this order: the writer's full flush
 * lock, the thread states, the writer, this object.
 */
final class DocumentsWriter {

  private final IndexWriter writer;
  private final Directory directory;
  private final IndexWriterConfig config;
  private final InfoStream infoStream;
  private final FieldInfos.FieldNumbers globalFieldNumbers;
  private final BufferedDeletesStream bufferedDeletesStream;

  private final ThreadState[] threadStates;

  // per-thread buffers still accepting documents:
  private final Set<DocumentsWriterPerThread> active = new LinkedHashSet<DocumentsWriterPerThread>();
  // frozen by a full flush, waiting to be written:
  private final List<DocumentsWriterPerThread> flushQueue = new ArrayList<DocumentsWriterPerThread>();
  // flushes that hit an exception; retried by the next full flush:
  private final List<DocumentsWriterPerThread> failedFlushes = new ArrayList<DocumentsWriterPerThread>();

  private final BufferedDeletes globalDeletes = new BufferedDeletes();
  private long seq;
  private volatile boolean closed;
  private boolean fullFlush;

  /** A lock a thread holds while it adds to (or flushes)
   *  the per-thread buffer it carries. */
  @SuppressWarnings("serial")
  static final class ThreadState extends ReentrantLock {
    DocumentsWriterPerThread dwpt;
  }

  DocumentsWriter(IndexWriter writer, IndexWriterConfig config, Directory directory,
                  FieldInfos.FieldNumbers globalFieldNumbers, BufferedDeletesStream bufferedDeletesStream) {
    this.writer = writer;
    this.config = config;
    this.directory = directory;
    this.infoStream = config.getInfoStream();
    this.globalFieldNumbers = globalFieldNumbers;
    this.bufferedDeletesStream = bufferedDeletesStream;
    threadStates = new ThreadState[config.getMaxThreadStates()];
    for (int i = 0; i < threadStates.length; i++) {
      threadStates[i] = new ThreadState();
    }
  }

  private void ensureOpen() throws AlreadyClosedException {
    if (closed) {
      throw new AlreadyClosedException("this IndexWriter is closed");
    }
  }

  private ThreadState obtainAndLock() {
    for (ThreadState ts : threadStates) {
      if (ts.tryLock()) {
        return ts;
      }
    }
    // all busy: wait on one picked by thread
    final ThreadState ts = threadStates[(Thread.currentThread().hashCode() & 0x7fffffff) % threadStates.length];
    ts.lock();
    return ts;
  }

  // Must hold the thread state's lock and this object's
  private DocumentsWriterPerThread ensureBuffer(ThreadState ts) {
    assert ts.isHeldByCurrentThread() && Thread.holdsLock(this);
    if (ts.dwpt == null || ts.dwpt.flushPending) {
      ts.dwpt = new DocumentsWriterPerThread(writer.newSegmentName(), directory, globalFieldNumbers, config.getCodec(), infoStream);
      active.add(ts.dwpt);
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "new buffer " + ts.dwpt.segment + " activeCount=" + active.size());
      }
    }
    return ts.dwpt;
  }

  // Must hold this object's lock
  private void bufferDeleteTerm(Term term, long delSeq) {
    globalDeletes.addTerm(term, delSeq);
    for (DocumentsWriterPerThread dwpt : active) {
      dwpt.pendingDeletes.addTerm(term, delSeq);
    }
  }

  /** Adds (or, when {@code delTerm} is non-null, replaces)
   *  one document.  Returns true if a segment was flushed. */
  boolean updateDocument(Iterable<? extends IndexableField> doc, Analyzer analyzer, Term delTerm) throws IOException {
    return updateDocuments(Collections.<Iterable<? extends IndexableField>>singletonList(doc), analyzer, delTerm);
  }

  /** Adds a block of documents with sequentially assigned
   *  docIDs, after deleting the documents matching {@code
   *  delTerm} (if non-null). */
  boolean updateDocuments(Iterable<? extends Iterable<? extends IndexableField>> docs, Analyzer analyzer, Term delTerm) throws IOException {
    final List<Iterable<? extends IndexableField>> block = new ArrayList<Iterable<? extends IndexableField>>();
    for (Iterable<? extends IndexableField> doc : docs) {
      block.add(doc);
    }

    final ThreadState ts = obtainAndLock();
    try {
      final DocumentsWriterPerThread dwpt;
      final long firstDocSeq;
      synchronized (this) {
        ensureOpen();
        dwpt = ensureBuffer(ts);
        for (Iterable<? extends IndexableField> doc : block) {
          dwpt.checkDocValues(doc);
        }
        if (delTerm != null) {
          bufferDeleteTerm(delTerm, ++seq);
        }
        firstDocSeq = seq + 1;
        seq += block.size();
      }

      // invert outside our lock: the thread state keeps a
      // full flush from taking dwpt until we are done
      dwpt.addDocuments(block, analyzer, firstDocSeq);

      DocumentsWriterPerThread toFlush = null;
      synchronized (this) {
        if (!fullFlush && !dwpt.flushPending && needsFlush(dwpt)) {
          freeze(Collections.singletonList(dwpt));
          ts.dwpt = null;
          toFlush = dwpt;
        }
      }
      if (toFlush != null) {
        flushOne(toFlush);
        return true;
      }
      return false;
    } finally {
      ts.unlock();
    }
  }

  /** Buffers deletes by term.  Returns true if the buffered
   *  deletes should be applied now. */
  synchronized boolean deleteTerms(Term... terms) {
    ensureOpen();
    final long delSeq = ++seq;
    for (Term term : terms) {
      bufferDeleteTerm(term, delSeq);
    }
    return deletesFull();
  }

  /** Buffers deletes by query.  Returns true if the buffered
   *  deletes should be applied now. */
  synchronized boolean deleteQueries(Query... queries) {
    ensureOpen();
    final long delSeq = ++seq;
    for (Query query : queries) {
      globalDeletes.addQuery(query, delSeq);
      for (DocumentsWriterPerThread dwpt : active) {
        dwpt.pendingDeletes.addQuery(query, delSeq);
      }
    }
    return deletesFull();
  }

  private boolean deletesFull() {
    final int maxBufferedDeleteTerms = config.getMaxBufferedDeleteTerms();
    if (maxBufferedDeleteTerms != IndexWriterConfig.DISABLE_AUTO_FLUSH && globalDeletes.numTermDeletes >= maxBufferedDeleteTerms) {
      return true;
    }
    final double ramBufferSizeMB = config.getRAMBufferSizeMB();
    return ramBufferSizeMB != IndexWriterConfig.DISABLE_AUTO_FLUSH
        && globalDeletes.bytesUsed >= (long) (ramBufferSizeMB * 1024 * 1024);
  }

  private boolean needsFlush(DocumentsWriterPerThread dwpt) {
    final int maxBufferedDocs = config.getMaxBufferedDocs();
    if (maxBufferedDocs != IndexWriterConfig.DISABLE_AUTO_FLUSH && dwpt.getNumDocsInRAM() >= maxBufferedDocs) {
      return true;
    }
    final double ramBufferSizeMB = config.getRAMBufferSizeMB();
    if (ramBufferSizeMB != IndexWriterConfig.DISABLE_AUTO_FLUSH) {
      if (ramBytesUsed() >= (long) (ramBufferSizeMB * 1024 * 1024)) {
        if (infoStream.isEnabled("DW")) {
          infoStream.message("DW", "RAM buffer full: ramUsed=" + ramBytesUsed() + " flush " + dwpt.segment);
        }
        return true;
      }
    }
    return false;
  }

  /** Pushes the buffered global deletes to the deletes
   *  stream, without flushing documents.  Returns false, and
   *  keeps the deletes buffered, while a full flush is
   *  running. */
  synchronized boolean pushDeletes() {
    if (fullFlush) {
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "full flush running: keep " + globalDeletes.numTermDeletes + " delete terms buffered");
      }
      return false;
    }
    freezeGlobalDeletes();
    return true;
  }

  // Moves the buffered global deletes into a new packet of
  // the deletes stream; returns the packet's generation.
  private long freezeGlobalDeletes() {
    assert Thread.holdsLock(this);
    final long gen = bufferedDeletesStream.push(new FrozenBufferedDeletes(globalDeletes));
    globalDeletes.clear();
    return gen;
  }

  // Must hold this object's lock.  The global deletes go
  // out in a packet whose generation becomes the segment
  // generation of every buffer in dwpts, so the packet never
  // applies to those segments.
  private void freeze(Collection<DocumentsWriterPerThread> dwpts) {
    assert Thread.holdsLock(this);
    final long gen = freezeGlobalDeletes();
    for (DocumentsWriterPerThread dwpt : dwpts) {
      assert !dwpt.flushPending;
      dwpt.flushPending = true;
      dwpt.flushGen = gen;
      active.remove(dwpt);
      bufferedDeletesStream.registerFlush(gen);
    }
  }

  // Returns true if a segment was written
  private boolean flushOne(DocumentsWriterPerThread dwpt) throws IOException {
    if (dwpt.getNumDocsInRAM() == 0) {
      writer.publishFlushedSegment(null, dwpt.flushGen);
      return false;
    }
    boolean success = false;
    try {
      final DocumentsWriterPerThread.FlushedSegment newSegment = dwpt.flush();
      success = true;
      writer.publishFlushedSegment(newSegment, dwpt.flushGen);
      return true;
    } finally {
      if (!success) {
        synchronized (this) {
          failedFlushes.add(dwpt);
        }
        if (infoStream.isEnabled("DW")) {
          infoStream.message("DW", "flush of " + dwpt.segment + " failed; numDocs=" + dwpt.getNumDocsInRAM() + " kept for retry");
        }
      }
    }
  }

  /** Writes every buffered document (including buffers whose
   *  previous flush failed) and pushes the buffered global
   *  deletes.  The caller holds the writer's full flush lock
   *  and not the writer's monitor, and must call {@link
   *  #finishFullFlush} once it has published the result, even
   *  if this method throws.  Returns true if any segment was
   *  written. */
  boolean flushAllThreads() throws IOException {
    synchronized (this) {
      ensureOpen();
      assert !fullFlush;
      fullFlush = true;
      // Buffers still empty are frozen too: a thread may be
      // inverting an update whose delete goes out with this
      // flush.
      final List<DocumentsWriterPerThread> toFreeze = new ArrayList<DocumentsWriterPerThread>(active);
      freeze(toFreeze);
      flushQueue.addAll(toFreeze);
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "full flush: " + toFreeze.size() + " buffers frozen; " + failedFlushes.size() + " failed flushes to retry");
      }
    }

    // wait for in-progress adds to frozen buffers
    for (ThreadState ts : threadStates) {
      ts.lock();
      try {
        if (ts.dwpt != null && ts.dwpt.flushPending) {
          ts.dwpt = null;
        }
      } finally {
        ts.unlock();
      }
    }

    final List<DocumentsWriterPerThread> toFlush;
    synchronized (this) {
      toFlush = new ArrayList<DocumentsWriterPerThread>(failedFlushes);
      toFlush.addAll(flushQueue);
      failedFlushes.clear();
      flushQueue.clear();
    }

    boolean anyFlushed = false;
    for (int i = 0; i < toFlush.size(); i++) {
      boolean success = false;
      try {
        anyFlushed |= flushOne(toFlush.get(i));
        success = true;
      } finally {
        if (!success) {
          // flushOne already re-queued the failed one
          synchronized (this) {
            failedFlushes.addAll(toFlush.subList(i+1, toFlush.size()));
          }
        }
      }
    }
    return anyFlushed;
  }

  /** Ends the full flush started by {@link
   *  #flushAllThreads}: other threads may flush their buffers
   *  and push deletes again. */
  synchronized void finishFullFlush() {
    fullFlush = false;
  }

  /** True if a flush failed and its documents are still
   *  buffered. */
  synchronized boolean hasFailedFlushes() {
    return !failedFlushes.isEmpty();
  }

  /** True if there are buffered documents or deletes. */
  synchronized boolean anyChanges() {
    if (globalDeletes.any() || !failedFlushes.isEmpty() || !flushQueue.isEmpty()) {
      return true;
    }
    for (DocumentsWriterPerThread dwpt : active) {
      if (dwpt.getNumDocsInRAM() > 0) {
        return true;
      }
    }
    return false;
  }

  /** Number of documents buffered and not yet flushed. */
  synchronized int getNumDocs() {
    int numDocs = 0;
    for (DocumentsWriterPerThread dwpt : active) {
      numDocs += dwpt.getNumDocsInRAM();
    }
    for (DocumentsWriterPerThread dwpt : flushQueue) {
      numDocs += dwpt.getNumDocsInRAM();
    }
    for (DocumentsWriterPerThread dwpt : failedFlushes) {
      numDocs += dwpt.getNumDocsInRAM();
    }
    return numDocs;
  }

  synchronized long ramBytesUsed() {
    long bytes = globalDeletes.bytesUsed;
    for (DocumentsWriterPerThread dwpt : active) {
      bytes += dwpt.bytesUsed();
    }
    return bytes;
  }

  /** Locks every thread state so no document can be added;
   *  release with {@link #unlockAll}.  The caller holds the
   *  writer's full flush lock. */
  void lockAll() {
    for (ThreadState ts : threadStates) {
      ts.lock();
    }
  }

  void unlockAll() {
    for (ThreadState ts : threadStates) {
      if (ts.isHeldByCurrentThread()) {
        ts.unlock();
      }
    }
  }

  /** Discards every buffered document and delete.  All
   *  thread states must be locked by the caller. */
  synchronized void abort() {
    int numDocs = 0;
    final List<DocumentsWriterPerThread> discarded = new ArrayList<DocumentsWriterPerThread>(active);
    discarded.addAll(flushQueue);
    discarded.addAll(failedFlushes);
    for (DocumentsWriterPerThread dwpt : discarded) {
      numDocs += dwpt.getNumDocsInRAM();
      if (dwpt.flushPending) {
        bufferedDeletesStream.finishFlush(dwpt.flushGen);
      }
    }
    for (ThreadState ts : threadStates) {
      assert ts.isHeldByCurrentThread();
      ts.dwpt = null;
    }
    active.clear();
    flushQueue.clear();
    failedFlushes.clear();
    globalDeletes.clear();
    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "abort: discarded " + numDocs + " buffered docs");
    }
  }

  void close() {
    closed = true;
  }
}
