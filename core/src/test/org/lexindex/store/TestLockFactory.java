package org.lexindex.store;

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
import org.lexindex.index.IndexWriter;
import org.lexindex.index.IndexWriterConfig;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestLockFactory extends LexTestCase {

  private void assertExclusive(LockFactory factory) throws IOException {
    Lock l1 = factory.makeLock("test.lock");
    Lock l2 = factory.makeLock("test.lock");
    assertTrue(l1.obtain());
    assertTrue(l1.isLocked());
    assertFalse("second lock must not be obtainable", l2.obtain());
    l1.release();
    assertTrue(l2.obtain());
    l2.release();
    assertFalse(l1.isLocked());
  }

  public void testSingleInstanceLockFactory() throws IOException {
    assertExclusive(new SingleInstanceLockFactory());
  }

  public void testSimpleFSLockFactory() throws IOException {
    File lockDir = _TestUtil.getTempDir("simpleFSLock");
    try {
      assertExclusive(new SimpleFSLockFactory(lockDir));
    } finally {
      _TestUtil.rmDir(lockDir);
    }
  }

  public void testNativeFSLockFactory() throws IOException {
    File lockDir = _TestUtil.getTempDir("nativeFSLock");
    try {
      assertExclusive(new NativeFSLockFactory(lockDir));
    } finally {
      _TestUtil.rmDir(lockDir);
    }
  }

  public void testObtainTimeout() throws IOException {
    Lock l1 = new SingleInstanceLockFactory().makeLock("timeout.lock");
    assertTrue(l1.obtain());
    LockFactory other = new SingleInstanceLockFactory();
    // distinct factories do not share state
    assertTrue(other.makeLock("timeout.lock").obtain());

    final long savedPoll = Lock.LOCK_POLL_INTERVAL;
    Lock.LOCK_POLL_INTERVAL = 10;
    try {
      SingleInstanceLockFactory factory = new SingleInstanceLockFactory();
      Lock held = factory.makeLock("x.lock");
      assertTrue(held.obtain());
      try {
        factory.makeLock("x.lock").obtain(50);
        fail("did not hit expected exception");
      } catch (LockObtainFailedException e) {
        // expected
      }
      try {
        factory.makeLock("x.lock").obtain(-7);
        fail("did not hit expected exception");
      } catch (IllegalArgumentException e) {
        // expected
      }
      held.release();
    } finally {
      Lock.LOCK_POLL_INTERVAL = savedPoll;
    }
  }

  // A second writer on the same directory must fail fast
  // with a LockObtainFailedException:
  public void testSecondWriterFails() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StringField("id", "1", StringField.Store.NO));
    writer.addDocument(doc);

    IndexWriter writer2 = null;
    try {
      writer2 = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
          .setOpenMode(OpenMode.APPEND).setWriteLockTimeout(0));
      fail("Should have hit an IOException with two IndexWriters on default SingleInstanceLockFactory");
    } catch (LockObtainFailedException e) {
      // expected
    }
    assertTrue(IndexWriter.isLocked(dir));
    writer.close();
    assertFalse(IndexWriter.isLocked(dir));
    if (writer2 != null) {
      writer2.close();
    }
    dir.close();
  }

  public void testWriterOnFSDirectory() throws IOException {
    File indexDir = _TestUtil.getTempDir("nativeLockWriter");
    Directory dir = newFSDirectory(indexDir);
    IndexWriterConfig conf = newIndexWriterConfig(new MockAnalyzer(random));
    IndexWriter writer = new IndexWriter(dir, conf);
    try {
      new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)).setWriteLockTimeout(0));
      fail("did not hit expected exception");
    } catch (LockObtainFailedException e) {
      // expected
    }
    writer.close();
    dir.close();
    _TestUtil.rmDir(indexDir);
  }
}
