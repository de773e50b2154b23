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

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.search.IndexSearcher;
import org.lexindex.search.TermQuery;
import org.lexindex.store.Directory;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestAtomicUpdate extends LexTestCase {

  private static final int NUM_IDS = 100;

  private static abstract class TimedThread extends Thread {
    volatile boolean failed;
    int count;
    private static final int RUN_TIME_MSEC = atLeast(500);
    private final TimedThread[] allThreads;

    abstract public void doWork() throws Throwable;

    TimedThread(TimedThread[] threads) {
      this.allThreads = threads;
    }

    @Override
    public void run() {
      final long stopTime = System.currentTimeMillis() + RUN_TIME_MSEC;

      count = 0;

      try {
        do {
          if (anyErrors()) break;
          doWork();
          count++;
        } while(System.currentTimeMillis() < stopTime);
      } catch (Throwable e) {
        System.out.println(Thread.currentThread().getName() + ": exc");
        e.printStackTrace(System.out);
        failed = true;
      }
    }

    private boolean anyErrors() {
      for(int i=0;i<allThreads.length;i++)
        if (allThreads[i] != null && allThreads[i].failed)
          return true;
      return false;
    }
  }

  private static class IndexerThread extends TimedThread {
    final IndexWriter writer;

    public IndexerThread(IndexWriter writer, TimedThread[] threads) {
      super(threads);
      this.writer = writer;
    }

    @Override
    public void doWork() throws Exception {
      // Update all 100 docs...
      for(int i=0; i<NUM_IDS; i++) {
        Document d = new Document();
        d.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
        d.add(new TextField("contents", "doc " + (i + 10 * count), StringField.Store.NO));
        writer.updateDocument(new Term("id", Integer.toString(i)), d);
      }
      if (count % 3 == 0) {
        writer.commit();
      }
    }
  }

  private static class SearcherThread extends TimedThread {
    private final Directory directory;
    private final IndexWriter writer;

    public SearcherThread(Directory directory, IndexWriter writer, TimedThread[] threads) {
      super(threads);
      this.directory = directory;
      this.writer = writer;
    }

    @Override
    public void doWork() throws Throwable {
      final DirectoryReader r;
      if (writer != null) {
        r = DirectoryReader.open(writer, true);
      } else {
        r = DirectoryReader.open(directory);
      }
      try {
        assertEquals(NUM_IDS, r.numDocs());
        final IndexSearcher searcher = new IndexSearcher(r);
        final String id = Integer.toString(random.nextInt(NUM_IDS));
        assertEquals("id=" + id, 1, searcher.count(new TermQuery(new Term("id", id))));
      } finally {
        r.close();
      }
    }
  }

  /*
    Run two indexers and two searchers against a single index
    as a stress test: no reader may ever see an update's
    delete without its add, or the reverse.
  */
  public void runTest(Directory directory) throws Exception {

    TimedThread[] threads = new TimedThread[4];

    IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random)).setMaxBufferedDocs(7);
    ((LogMergePolicy) conf.getMergePolicy()).setMergeFactor(3);
    IndexWriter writer = new IndexWriter(directory, conf);

    // Establish a base index of 100 docs:
    for(int i=0;i<NUM_IDS;i++) {
      Document d = new Document();
      d.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
      d.add(new TextField("contents", "doc " + i, StringField.Store.NO));
      if ((i-1)%7 == 0) {
        writer.commit();
      }
      writer.addDocument(d);
    }
    writer.commit();

    IndexReader r = DirectoryReader.open(directory);
    assertEquals(NUM_IDS, r.numDocs());
    r.close();

    IndexerThread indexerThread = new IndexerThread(writer, threads);
    threads[0] = indexerThread;
    indexerThread.start();

    IndexerThread indexerThread2 = new IndexerThread(writer, threads);
    threads[1] = indexerThread2;
    indexerThread2.start();

    SearcherThread searcherThread1 = new SearcherThread(directory, null, threads);
    threads[2] = searcherThread1;
    searcherThread1.start();

    // this one searches near-real-time readers
    SearcherThread searcherThread2 = new SearcherThread(directory, writer, threads);
    threads[3] = searcherThread2;
    searcherThread2.start();

    indexerThread.join();
    indexerThread2.join();
    searcherThread1.join();
    searcherThread2.join();

    writer.close();

    assertTrue("hit unexpected exception in indexer", !indexerThread.failed);
    assertTrue("hit unexpected exception in indexer2", !indexerThread2.failed);
    assertTrue("hit unexpected exception in search1", !searcherThread1.failed);
    assertTrue("hit unexpected exception in search2", !searcherThread2.failed);
    if (VERBOSE) {
      System.out.println("    Writer: " + indexerThread.count + " iterations");
      System.out.println("Searcher 1: " + searcherThread1.count + " searchers created");
      System.out.println("Searcher 2: " + searcherThread2.count + " searchers created");
    }

    r = DirectoryReader.open(directory);
    assertEquals(NUM_IDS, r.numDocs());
    r.close();
  }

  /*
    Run above stress test against a RAM directory and then
    an FSDirectory.
  */
  public void testAtomicUpdates() throws Exception {
    Directory directory;

    // First in a RAM directory:
    directory = newDirectory();
    runTest(directory);
    directory.close();

    // Second in an FSDirectory:
    File dirPath = _TestUtil.getTempDir("atomicupdates");
    directory = newFSDirectory(dirPath);
    runTest(directory);
    directory.close();
    _TestUtil.rmDir(dirPath);
  }
}
