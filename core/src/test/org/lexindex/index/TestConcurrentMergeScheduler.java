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

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.Field;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestConcurrentMergeScheduler extends LexTestCase {

  private static class FailOnlyOnMethod extends MockDirectoryWrapper.Failure {
    private final String methodName;
    volatile boolean hitExc;

    FailOnlyOnMethod(String methodName) {
      this.methodName = methodName;
    }

    @Override
    public void setDoFail() {
      doFail = true;
      hitExc = false;
    }

    @Override
    public void eval(MockDirectoryWrapper dir) throws IOException {
      if (doFail) {
        StackTraceElement[] trace = new Exception().getStackTrace();
        for (int i = 0; i < trace.length; i++) {
          if (methodName.equals(trace[i].getMethodName())) {
            hitExc = true;
            throw new IOException("now failing during " + methodName);
          }
        }
      }
    }
  }

  private IndexWriterConfig newCMSConfig() {
    ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
    cms.setSuppressExceptions();
    return newIndexWriterConfig(new MockAnalyzer(random)).setMergeScheduler(cms);
  }

  // Background merges keep running while flushes fail; the
  // failed segment is kept and retried so no document is lost
  public void testFlushExceptions() throws IOException {
    MockDirectoryWrapper directory = newDirectory();
    directory.setPreventDoubleWrite(false);
    FailOnlyOnMethod failure = new FailOnlyOnMethod("doFlush");
    directory.failOn(failure);

    IndexWriter writer = new IndexWriter(directory, newCMSConfig().setMaxBufferedDocs(2));
    Document doc = new Document();
    Field idField = new StringField("id", "", StringField.Store.YES);
    doc.add(idField);
    int extraCount = 0;

    for(int i=0;i<10;i++) {
      for(int j=0;j<20;j++) {
        idField.setStringValue(Integer.toString(i*20+j));
        writer.addDocument(doc);
      }

      // the last add may already have been flushed by
      // addDocument itself, leaving nothing for the
      // explicit flush to fail on
      while(true) {
        writer.addDocument(doc);
        extraCount++;
        failure.setDoFail();
        try {
          writer.flush(true, true);
          if (failure.hitExc) {
            fail("failed to hit IOException");
          }
        } catch (IOException ioe) {
          failure.clearDoFail();
          break;
        }
      }

      try {
        writer.addDocument(doc);
        fail("did not hit expected exception");
      } catch (IllegalStateException ise) {
        // expected: the failed flush must be retried first
      }
      writer.flush();
    }

    writer.close();
    DirectoryReader reader = DirectoryReader.open(directory);
    assertEquals(200+extraCount, reader.numDocs());
    reader.close();
    directory.close();
  }

  // Deletes committed after a merge started and before it
  // finishes are carried over to the merged segment
  public void testDeleteMerging() throws IOException {
    MockDirectoryWrapper directory = newDirectory();

    LogDocMergePolicy mp = new LogDocMergePolicy();
    // Degenerate merging yields a mix of segments with and
    // without deletes
    mp.setMinMergeDocs(1000);
    IndexWriter writer = new IndexWriter(directory, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new ConcurrentMergeScheduler())
        .setMergePolicy(mp));

    Document doc = new Document();
    Field idField = new StringField("id", "", StringField.Store.YES);
    doc.add(idField);
    for(int i=0;i<10;i++) {
      for(int j=0;j<100;j++) {
        idField.setStringValue(Integer.toString(i*100+j));
        writer.addDocument(doc);
      }

      int delID = i;
      while(delID < 100*(1+i)) {
        writer.deleteDocuments(new Term("id", ""+delID));
        delID += 10;
      }

      writer.commit();
    }

    writer.close();
    DirectoryReader reader = DirectoryReader.open(directory);
    assertEquals(450, reader.numDocs());
    reader.close();
    directory.close();
  }

  public void testNoExtraFiles() throws IOException {
    MockDirectoryWrapper directory = newDirectory();
    IndexWriter writer = new IndexWriter(directory, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new ConcurrentMergeScheduler())
        .setMaxBufferedDocs(2));

    for(int iter=0;iter<7;iter++) {

      for(int j=0;j<21;j++) {
        Document doc = new Document();
        doc.add(new TextField("content", "a b c", StringField.Store.NO));
        writer.addDocument(doc);
      }

      writer.close();
      TestIndexFileDeleter.assertNoUnreferencedFiles(directory, "testNoExtraFiles");

      writer = new IndexWriter(directory, newIndexWriterConfig(new MockAnalyzer(random))
          .setMergeScheduler(new ConcurrentMergeScheduler())
          .setOpenMode(OpenMode.APPEND).setMaxBufferedDocs(2));
    }

    writer.close();
    directory.close();
  }

  public void testNoWaitClose() throws IOException {
    MockDirectoryWrapper directory = newDirectory();
    Document doc = new Document();
    Field idField = new StringField("id", "", StringField.Store.YES);
    doc.add(idField);

    IndexWriter writer = new IndexWriter(directory, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new ConcurrentMergeScheduler())
        .setMergePolicy(newLogMergePolicy(100))
        .setMaxBufferedDocs(2));

    for(int iter=0;iter<10;iter++) {

      for(int j=0;j<201;j++) {
        idField.setStringValue(Integer.toString(iter*201+j));
        writer.addDocument(doc);
      }

      int delID = iter*201;
      for(int j=0;j<20;j++) {
        writer.deleteDocuments(new Term("id", Integer.toString(delID)));
        delID += 5;
      }

      // kick off a bunch of merge threads so close has
      // something to abort
      ((LogMergePolicy) writer.getConfig().getMergePolicy()).setMergeFactor(3);
      writer.addDocument(doc);
      writer.commit();

      writer.close(false);

      DirectoryReader reader = DirectoryReader.open(directory);
      assertEquals((1+iter)*182, reader.numDocs());
      reader.close();

      writer = new IndexWriter(directory, newIndexWriterConfig(new MockAnalyzer(random))
          .setMergeScheduler(new ConcurrentMergeScheduler())
          .setMergePolicy(newLogMergePolicy(100))
          .setOpenMode(OpenMode.APPEND));
    }
    writer.close();

    directory.close();
  }

  public void testMergeExceptionForwardedToForceMerge() throws IOException {
    MockDirectoryWrapper directory = newDirectory();
    directory.setPreventDoubleWrite(false);
    FailOnlyOnMethod failure = new FailOnlyOnMethod("mergeMiddle");
    directory.failOn(failure);

    IndexWriter writer = new IndexWriter(directory, newCMSConfig()
        .setMaxBufferedDocs(2)
        .setMergePolicy(newLogMergePolicy(1000)));
    for(int i=0;i<20;i++) {
      Document doc = new Document();
      doc.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
      doc.add(new TextField("content", "aaa bbb " + i, StringField.Store.NO));
      writer.addDocument(doc);
    }
    writer.commit();
    assertTrue(writer.getSegmentCount() > 1);

    failure.setDoFail();
    try {
      writer.forceMerge(1);
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      assertTrue(failure.hitExc);
      assertNotNull(ioe.getCause());
    }
    failure.clearDoFail();

    writer.forceMerge(1);
    assertEquals(1, writer.getSegmentCount());
    writer.close();

    _TestUtil.checkIndex(directory);
    DirectoryReader reader = DirectoryReader.open(directory);
    assertEquals(20, reader.numDocs());
    assertEquals(1, reader.leaves().size());
    reader.close();
    directory.close();
  }
}
