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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.store.Directory;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.LexTestCase;

/*
  Verify we can read the pre-existing commit points of an
  index through custom deletion policies, and open readers
  and writers against older commits.
*/
public class TestDeletionPolicy extends LexTestCase {

  private static void verifyCommitOrder(List<? extends IndexCommit> commits) {
    if (commits.isEmpty()) {
      return;
    }
    final IndexCommit firstCommit = commits.get(0);
    long last = SegmentInfos.generationFromSegmentsFileName(firstCommit.getSegmentsFileName());
    assertEquals(last, firstCommit.getGeneration());
    for(int i=1;i<commits.size();i++) {
      final IndexCommit commit = commits.get(i);
      long now = SegmentInfos.generationFromSegmentsFileName(commit.getSegmentsFileName());
      assertTrue("SegmentInfos commits are out-of-order", now > last);
      assertEquals(now, commit.getGeneration());
      last = now;
    }
  }

  static class KeepAllDeletionPolicy extends IndexDeletionPolicy {
    int numOnInit;
    int numOnCommit;

    @Override
    public void onInit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      numOnInit++;
    }

    @Override
    public void onCommit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      numOnCommit++;
    }
  }

  /**
   * Drops every commit point on init; useful when adding to
   * a big index no reader is using.
   */
  static class KeepNoneOnInitDeletionPolicy extends IndexDeletionPolicy {
    int numOnInit;
    int numOnCommit;

    @Override
    public void onInit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      numOnInit++;
      for (final IndexCommit commit : commits) {
        commit.delete();
        assertTrue(commit.isDeleted());
      }
    }

    @Override
    public void onCommit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      int size = commits.size();
      // Delete all but last one:
      for(int i=0;i<size-1;i++) {
        commits.get(i).delete();
      }
      numOnCommit++;
    }
  }

  static class KeepLastNDeletionPolicy extends IndexDeletionPolicy {
    int numOnInit;
    int numOnCommit;
    final int numToKeep;
    int numDelete;
    final Set<String> seen = new HashSet<String>();

    KeepLastNDeletionPolicy(int numToKeep) {
      this.numToKeep = numToKeep;
    }

    @Override
    public void onInit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      numOnInit++;
      // do no deletions on init
      doDeletes(commits, false);
    }

    @Override
    public void onCommit(List<? extends IndexCommit> commits) throws IOException {
      verifyCommitOrder(commits);
      doDeletes(commits, true);
    }

    private void doDeletes(List<? extends IndexCommit> commits, boolean isCommit) {
      if (isCommit) {
        String fileName = commits.get(commits.size()-1).getSegmentsFileName();
        if (seen.contains(fileName)) {
          throw new RuntimeException("onCommit was called twice on the same commit point: " + fileName);
        }
        seen.add(fileName);
        numOnCommit++;
      }
      int size = commits.size();
      for(int i=0;i<size-numToKeep;i++) {
        commits.get(i).delete();
        numDelete++;
      }
    }
  }

  private static void addDoc(IndexWriter writer, int id) throws IOException {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), StringField.Store.YES));
    doc.add(new TextField("content", "aaa", StringField.Store.NO));
    writer.addDocument(doc);
  }

  private static IndexWriterConfig newConfig(IndexDeletionPolicy policy) {
    return newIndexWriterConfig(new MockAnalyzer(random))
        .setIndexDeletionPolicy(policy)
        .setMergeScheduler(new SerialMergeScheduler());
  }

  public void testKeepAllDeletionPolicy() throws IOException {
    Directory dir = newDirectory();
    KeepAllDeletionPolicy policy = new KeepAllDeletionPolicy();
    IndexWriter writer = new IndexWriter(dir, newConfig(policy).setMaxBufferedDocs(10));
    final int numCommits = 5;
    for(int i=0;i<numCommits;i++) {
      for(int j=0;j<17;j++) {
        addDoc(writer, i*17+j);
      }
      Map<String,String> userData = new HashMap<String,String>();
      userData.put("commit", Integer.toString(i));
      writer.setCommitData(userData);
      writer.commit();
    }
    writer.close();

    assertEquals(1, policy.numOnInit);
    assertTrue(policy.numOnCommit >= numCommits);

    List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertTrue(commits.size() >= numCommits);
    verifyCommitOrder(commits);

    // every commit is still readable and sees its own docs
    int lastNumDocs = -1;
    for (IndexCommit commit : commits) {
      DirectoryReader reader = DirectoryReader.open(commit);
      assertEquals(commit, reader.getIndexCommit());
      assertTrue(reader.numDocs() >= lastNumDocs);
      String label = commit.getUserData().get("commit");
      if (label != null) {
        assertEquals(17*(Integer.parseInt(label)+1), reader.numDocs());
      }
      lastNumDocs = reader.numDocs();
      reader.close();
    }
    assertEquals(17*numCommits, lastNumDocs);
    dir.close();
  }

  public void testOpenWriterAtPriorCommit() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newConfig(NoDeletionPolicy.INSTANCE));
    for(int i=0;i<10;i++) {
      addDoc(writer, i);
    }
    writer.commit();
    for(int i=10;i<20;i++) {
      addDoc(writer, i);
    }
    writer.deleteDocuments(new Term("id", "3"));
    writer.close();

    List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertEquals(2, commits.size());
    IndexCommit first = commits.get(0);

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(19, reader.numDocs());
    reader.close();

    // Roll the index back to the first commit; keep-only-last
    // removes the later one once the writer commits
    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setIndexCommit(first));
    addDoc(writer, 100);
    writer.close();

    commits = DirectoryReader.listCommits(dir);
    assertEquals(1, commits.size());
    reader = DirectoryReader.open(dir);
    assertEquals(11, reader.numDocs());
    reader.close();
    dir.close();
  }

  public void testKeepNoneOnInitDeletionPolicy() throws IOException {
    Directory dir = newDirectory();
    KeepNoneOnInitDeletionPolicy policy = new KeepNoneOnInitDeletionPolicy();
    IndexWriter writer = new IndexWriter(dir, newConfig(policy)
        .setOpenMode(OpenMode.CREATE).setMaxBufferedDocs(10));
    for(int i=0;i<107;i++) {
      addDoc(writer, i);
    }
    writer.close();

    writer = new IndexWriter(dir, newConfig(policy)
        .setOpenMode(OpenMode.APPEND).setMaxBufferedDocs(10));
    writer.forceMerge(1);
    writer.close();

    assertEquals(2, policy.numOnInit);
    // one commit per close
    assertEquals(2, policy.numOnCommit);

    // the init-time deletes leave exactly one commit
    List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertEquals(1, commits.size());
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(107, reader.numDocs());
    assertEquals(1, reader.leaves().size());
    reader.close();
    dir.close();
  }

  public void testKeepLastNDeletionPolicy() throws IOException {
    final int N = 5;

    Directory dir = newDirectory();
    KeepLastNDeletionPolicy policy = new KeepLastNDeletionPolicy(N);
    for(int j=0;j<N+1;j++) {
      IndexWriter writer = new IndexWriter(dir, newConfig(policy)
          .setOpenMode(j == 0 ? OpenMode.CREATE : OpenMode.APPEND).setMaxBufferedDocs(10));
      for(int i=0;i<17;i++) {
        addDoc(writer, j*17+i);
      }
      writer.close();
    }

    assertEquals(N+1, policy.numOnInit);
    assertEquals(N+1, policy.numOnCommit);
    assertEquals(1, policy.numDelete);

    List<IndexCommit> commits = DirectoryReader.listCommits(dir);
    assertEquals(N, commits.size());

    // the oldest commit is gone, the N newest remain
    long gen = SegmentInfos.getLastCommitGeneration(dir);
    assertFalse(dir.fileExists(IndexFileNames.fileNameFromGeneration(IndexFileNames.SEGMENTS, "", gen-N)));
    int expectedDocs = 17*(N+1);
    for(int i=commits.size()-1;i>=0;i--) {
      IndexCommit commit = commits.get(i);
      assertEquals(gen, commit.getGeneration());
      DirectoryReader reader = DirectoryReader.open(commit);
      assertEquals(expectedDocs, reader.numDocs());
      reader.close();
      gen--;
      expectedDocs -= 17;
    }
    dir.close();
  }

  public void testSnapshotDeletionPolicy() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    SnapshotDeletionPolicy sdp = new SnapshotDeletionPolicy(new KeepOnlyLastCommitDeletionPolicy());
    IndexWriter writer = new IndexWriter(dir, newConfig(sdp).setMaxBufferedDocs(2));

    try {
      sdp.snapshot();
      fail("did not hit expected exception");
    } catch (IllegalStateException ise) {
      // expected: nothing committed yet
    }

    for(int i=0;i<7;i++) {
      addDoc(writer, i);
    }
    writer.commit();
    IndexCommit snapshot = sdp.snapshot();
    assertEquals(1, sdp.getSnapshotCount());
    assertSame(snapshot, sdp.getIndexCommit(snapshot.getGeneration()));
    final Collection<String> snapshotFiles = snapshot.getFileNames();
    assertTrue(snapshotFiles.contains(snapshot.getSegmentsFileName()));

    // later commits, deletes and a full merge must not touch
    // the snapshotted files
    for(int i=7;i<20;i++) {
      addDoc(writer, i);
    }
    writer.deleteDocuments(new Term("id", "0"));
    writer.commit();
    writer.forceMerge(1);
    writer.commit();

    for (String fileName : snapshotFiles) {
      assertTrue("snapshot file " + fileName + " was deleted", dir.fileExists(fileName));
    }
    assertEquals(2, DirectoryReader.listCommits(dir).size());

    DirectoryReader reader = DirectoryReader.open(snapshot);
    assertEquals(7, reader.numDocs());
    reader.close();

    // snapshotting the same commit twice needs two releases
    IndexCommit last = sdp.snapshot();
    IndexCommit again = sdp.snapshot();
    assertEquals(last.getGeneration(), again.getGeneration());
    assertEquals(3, sdp.getSnapshotCount());
    assertEquals(2, sdp.getSnapshots().size());
    sdp.release(last);
    sdp.release(again);

    sdp.release(snapshot);
    assertEquals(0, sdp.getSnapshotCount());
    assertNull(sdp.getIndexCommit(snapshot.getGeneration()));
    writer.deleteUnusedFiles();
    assertFalse(dir.fileExists(snapshot.getSegmentsFileName()));
    assertEquals(1, DirectoryReader.listCommits(dir).size());

    try {
      sdp.release(snapshot);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }

    writer.close();
    dir.close();
  }

  public void testSnapshotRequiresWriter() throws IOException {
    SnapshotDeletionPolicy sdp = new SnapshotDeletionPolicy(new KeepOnlyLastCommitDeletionPolicy());
    try {
      sdp.snapshot();
      fail("did not hit expected exception");
    } catch (IllegalStateException ise) {
      // expected
    }
  }

  public void testSnapshotSurvivesWriterReopen() throws IOException {
    Directory dir = newDirectory();
    SnapshotDeletionPolicy sdp = new SnapshotDeletionPolicy(new KeepOnlyLastCommitDeletionPolicy());
    IndexWriter writer = new IndexWriter(dir, newConfig(sdp));
    addDoc(writer, 0);
    writer.commit();
    IndexCommit snapshot = sdp.snapshot();
    writer.close();

    // the same policy instance keeps protecting the commit
    writer = new IndexWriter(dir, newConfig(sdp));
    addDoc(writer, 1);
    writer.commit();
    assertNotNull(sdp.getIndexCommit(snapshot.getGeneration()));
    assertTrue(dir.fileExists(snapshot.getSegmentsFileName()));

    sdp.release(snapshot);
    writer.close();
    writer = new IndexWriter(dir, newConfig(sdp));
    assertFalse(dir.fileExists(snapshot.getSegmentsFileName()));
    writer.close();
    dir.close();
  }
}
