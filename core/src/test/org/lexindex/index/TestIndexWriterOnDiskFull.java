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
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

/**
 * Tests for IndexWriter when the disk runs full during
 * flush, commit or close.
 */
public class TestIndexWriterOnDiskFull extends LexTestCase {

  private static void addDoc(IndexWriter writer, int id) throws IOException {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("content", "aaa bbb ccc ddd " + id, StringField.Store.YES));
    writer.addDocument(doc);
  }

  // Starts with a tiny disk and grows it until 100 docs fit.
  // A failed add keeps its document buffered, so a retried
  // close commits every document added so far.
  public void testAddDocumentOnDiskFull() throws IOException {

    for(int pass=0;pass<2;pass++) {
      if (VERBOSE) {
        System.out.println("TEST: pass=" + pass);
      }
      final boolean doAbort = pass == 1;
      long diskFree = _TestUtil.nextInt(random, 100, 300);
      while(true) {
        if (VERBOSE) {
          System.out.println("TEST: cycle: diskFree=" + diskFree);
        }
        MockDirectoryWrapper dir = newDirectory();
        dir.setPreventDoubleWrite(false);
        dir.setMaxSizeInBytes(diskFree);
        IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
            .setMergeScheduler(new SerialMergeScheduler()));

        boolean hitError = false;
        int added = 0;
        boolean committing = false;
        try {
          for(int i=0;i<100;i++) {
            addDoc(writer, i);
            added++;
          }
          committing = true;
          writer.commit();
        } catch (IOException e) {
          if (!committing) {
            // the document was buffered before its flush failed
            added++;
          }
          if (VERBOSE) {
            System.out.println("TEST: exception on addDoc");
            e.printStackTrace(System.out);
          }
          hitError = true;
        }

        if (hitError) {
          if (doAbort) {
            writer.rollback();
          } else {
            try {
              writer.close();
            } catch (IOException e) {
              if (VERBOSE) {
                System.out.println("TEST: exception on close; retry w/ no disk space limit");
                e.printStackTrace(System.out);
              }
              dir.setMaxSizeInBytes(0);
              writer.close();
            }
          }

          if (DirectoryReader.indexExists(dir)) {
            _TestUtil.checkIndex(dir);
            DirectoryReader reader = DirectoryReader.open(dir);
            if (doAbort) {
              // rollback never exposes a partial commit
              assertTrue(reader.numDocs() == 0 || reader.numDocs() == 100);
            } else {
              assertEquals(added, reader.numDocs());
            }
            reader.close();
          } else {
            assertTrue("a retried close must commit", doAbort);
          }

          dir.close();
          // Now try again w/ more space:
          diskFree += _TestUtil.nextInt(random, 400, 600);
        } else {
          writer.close();
          dir.setMaxSizeInBytes(0);
          DirectoryReader reader = DirectoryReader.open(dir);
          assertEquals(100, reader.numDocs());
          reader.close();
          dir.close();
          break;
        }
      }
    }
  }

  public void testCommitOnDiskFullKeepsPreviousCommit() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setPreventDoubleWrite(false);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMergePolicy(NoMergePolicy.INSTANCE)
        .setMaxBufferedDocs(1000)
        .setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH));
    for(int i=0;i<20;i++) {
      addDoc(writer, i);
    }
    writer.commit();
    final long lastGen = SegmentInfos.getLastCommitGeneration(dir);

    // buffered in RAM; nothing hits the disk until commit
    for(int i=20;i<120;i++) {
      addDoc(writer, i);
    }
    dir.setMaxSizeInBytes(dir.getRecomputedActualSizeInBytes() + 50);
    try {
      writer.commit();
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }

    assertEquals(lastGen, SegmentInfos.getLastCommitGeneration(dir));
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(20, reader.numDocs());
    reader.close();

    dir.setMaxSizeInBytes(0);
    writer.commit();
    assertTrue(SegmentInfos.getLastCommitGeneration(dir) > lastGen);
    reader = DirectoryReader.open(dir);
    assertEquals(120, reader.numDocs());
    reader.close();
    writer.close();
    dir.close();
  }

  public void testMaxUsedSizeTracksForceMerge() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setTrackDiskUsage(true);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMaxBufferedDocs(10)
        .setMergePolicy(newLogMergePolicy(1000)));
    for(int i=0;i<200;i++) {
      addDoc(writer, i);
    }
    writer.close();

    final long startDiskUsage = dir.getRecomputedActualSizeInBytes();
    dir.resetMaxUsedSizeInBytes();
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMergePolicy(newLogMergePolicy(1000)));
    writer.forceMerge(1);
    writer.close();
    final long maxDiskUsage = dir.getMaxUsedSizeInBytes();
    assertTrue("forceMerge used too much temporary space: starting usage was "
        + startDiskUsage + " bytes; max temp usage was " + maxDiskUsage + " but should have been "
        + (4*startDiskUsage) + " (= 4X starting usage)",
        maxDiskUsage <= 4*startDiskUsage);
    dir.close();
  }
}
