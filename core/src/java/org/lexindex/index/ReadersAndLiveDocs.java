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
import java.util.concurrent.atomic.AtomicInteger;

import org.lexindex.codecs.LiveDocsFormat;
import org.lexindex.store.Directory;
import org.lexindex.store.TrackingDirectoryWrapper;
import org.lexindex.util.Bits;
import org.lexindex.util.IOUtils;
import org.lexindex.util.MutableBits;

/** Used by {@link IndexWriter} to hold open the
 *  SegmentReader for one segment, together with the
 *  segment's in-memory live docs, which carry deletes that
 *  are not yet written to the directory.
 *
 *  <p>Live docs handed to a reader are never modified
 *  afterwards: the next delete works on a private copy. */
class ReadersAndLiveDocs {

  public final SegmentInfoPerCommit info;

  // Tracks how many consumers are using this instance:
  private final AtomicInteger refCount = new AtomicInteger(1);

  // Set once (null, and then maybe set, and never set again):
  private SegmentReader reader;

  // Holds the current shared (readable and writable)
  // liveDocs.  This is null when there are no deleted
  // docs, and it's copy-on-write (cloned whenever we need
  // to change it but it's been shared to an external NRT
  // reader).
  private Bits liveDocs;

  // How many further deletions we've done against
  // liveDocs vs when we loaded it or last wrote it:
  private int pendingDeleteCount;

  // True if the current liveDocs is referenced by an
  // external NRT reader:
  private boolean shared;

  // The last read-only clone we handed out, reused while no
  // delete happened since.  We hold one ref on it until it
  // is replaced or the readers are dropped.
  private SegmentReader lastClone;

  // True once a delete made lastClone's live docs stale
  private boolean lastCloneStale;

  ReadersAndLiveDocs(SegmentInfoPerCommit info) {
    this.info = info;
    shared = true;
  }

  void incRef() {
    final int rc = refCount.incrementAndGet();
    assert rc > 1;
  }

  void decRef() {
    final int rc = refCount.decrementAndGet();
    assert rc >= 0;
  }

  int refCount() {
    final int rc = refCount.get();
    assert rc >= 0;
    return rc;
  }

  synchronized int getPendingDeleteCount() {
    return pendingDeleteCount;
  }

  // Call only from assert!
  synchronized boolean verifyDocCounts() {
    int count;
    if (liveDocs != null) {
      count = 0;
      for(int docID=0;docID<info.info.getDocCount();docID++) {
        if (liveDocs.get(docID)) {
          count++;
        }
      }
    } else {
      count = info.info.getDocCount();
    }

    assert info.info.getDocCount() - info.getDelCount() - pendingDeleteCount == count: "info.docCount=" + info.info.getDocCount() + " info.getDelCount()=" + info.getDelCount() + " pendingDeleteCount=" + pendingDeleteCount + " count=" + count;
    return true;
  }

  /** Returns a ref to the writer's private reader on this
   *  segment; release it with {@link #release}. */
  public synchronized SegmentReader getReader() throws IOException {
    if (reader == null) {
      // We steal returned ref:
      reader = new SegmentReader(info);
      if (liveDocs == null) {
        liveDocs = reader.getLiveDocs();
      }
    }

    // Ref for caller
    reader.incRef();
    return reader;
  }

  public synchronized void release(SegmentReader sr) throws IOException {
    assert info == sr.getSegmentInfo();
    sr.decRef();
  }

  /** Marks a document deleted; returns true if it was
   *  live. */
  public synchronized boolean delete(int docID) {
    assert liveDocs != null || reader != null : "call getReader first";
    initWritableLiveDocs();
    assert docID >= 0 && docID < liveDocs.length() : "out of bounds: docid=" + docID + " liveDocsLength=" + liveDocs.length() + " seg=" + info.info.name + " docCount=" + info.info.getDocCount();
    assert !shared;
    final boolean didDelete = liveDocs.get(docID);
    if (didDelete) {
      ((MutableBits) liveDocs).clear(docID);
      pendingDeleteCount++;
      lastCloneStale = true;
    }
    return didDelete;
  }

  /** Discards pending deletes.  Used on the sources of a
   *  committed merge: the merge already carried those
   *  deletes over to the merged segment. */
  public synchronized void dropChanges() {
    pendingDeleteCount = 0;
  }

  /** NOTE: removes caller's ref */
  public synchronized void dropReaders() throws IOException {
    if (reader != null) {
      try {
        reader.decRef();
      } finally {
        reader = null;
      }
    }
    if (lastClone != null) {
      final SegmentReader clone = lastClone;
      lastClone = null;
      lastCloneStale = false;
      clone.decRef();
    }
    decRef();
  }

  /**
   * Returns a ref to a clone.  NOTE: you should decRef() the reader when you're
   * done (ie do not call close()).  As long as no document
   * of this segment was deleted since, the same instance is
   * returned again.
   */
  public synchronized SegmentReader getReadOnlyClone() throws IOException {
    if (reader == null) {
      getReader().decRef();
      assert reader != null;
    }
    shared = true;
    if (lastClone != null && !lastCloneStale && lastClone.getSegmentInfo() == info && lastClone.tryIncRef()) {
      return lastClone;
    }
    final SegmentReader clone;
    if (liveDocs != null) {
      clone = new SegmentReader(reader.getSegmentInfo(), reader.core, liveDocs, info.info.getDocCount() - info.getDelCount() - pendingDeleteCount);
    } else {
      assert reader.getLiveDocs() == liveDocs;
      reader.incRef();
      clone = reader;
    }
    // our ref for reuse, plus the caller's
    clone.incRef();
    final SegmentReader previous = lastClone;
    lastClone = clone;
    lastCloneStale = false;
    if (previous != null) {
      previous.decRef();
    }
    return clone;
  }

  public synchronized void initWritableLiveDocs() {
    assert Thread.holdsLock(this);
    assert info.info.getDocCount() > 0;
    if (shared) {
      // Copy on write: this means we've cloned a
      // SegmentReader sharing the current liveDocs
      // instance; must now make a private clone so we can
      // change it:
      final LiveDocsFormat liveDocsFormat = info.info.getCodec().liveDocsFormat();
      try {
        if (liveDocs == null) {
          liveDocs = liveDocsFormat.newLiveDocs(info.info.getDocCount());
        } else {
          liveDocs = liveDocsFormat.newLiveDocs(liveDocs);
        }
      } catch (IOException ioe) {
        throw new RuntimeException(ioe);
      }
      shared = false;
    } else {
      assert liveDocs != null;
    }
  }

  public synchronized Bits getLiveDocs() {
    return liveDocs;
  }

  // Commit live docs to the directory (writes new
  // _X_N.liv files); returns true if it wrote the file
  // and false if there were no new deletes to write:
  public synchronized boolean writeLiveDocs(Directory dir) throws IOException {
    if (pendingDeleteCount != 0) {
      // We have new deletes
      assert liveDocs.length() == info.info.getDocCount();

      // Do this so we can delete any created files on
      // exception; this saves all codecs from having to do
      // it:
      final TrackingDirectoryWrapper trackingDir = new TrackingDirectoryWrapper(dir);

      // We can write directly to the actual name (vs to a
      // .tmp & renaming it) because the file is not live
      // until segments file is written:
      boolean success = false;
      try {
        info.info.getCodec().liveDocsFormat().writeLiveDocs((MutableBits)liveDocs, trackingDir, info, pendingDeleteCount);
        success = true;
      } finally {
        if (!success) {
          // Advance only the nextWriteDelGen so that a 2nd
          // attempt to write will write to a new file
          info.advanceNextWriteDelGen();

          // Delete any partially created file(s):
          IOUtils.deleteFilesIgnoringExceptions(dir, trackingDir.getCreatedFiles());
        }
      }

      // If we hit an exc in the line above (eg disk full)
      // then info's delGen remains pointing to the previous
      // (successfully written) del docs:
      info.advanceDelGen();
      info.setDelCount(info.getDelCount() + pendingDeleteCount);

      pendingDeleteCount = 0;
      return true;
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return "ReadersAndLiveDocs(seg=" + info + " pendingDeleteCount=" + pendingDeleteCount + " shared=" + shared + ")";
  }
}
