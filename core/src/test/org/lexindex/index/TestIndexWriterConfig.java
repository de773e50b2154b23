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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.codecs.Codec;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.index.IndexWriterConfig.OpenMode;
import org.lexindex.store.Directory;
import org.lexindex.util.InfoStream;
import org.lexindex.util.LexTestCase;
import org.lexindex.util.LoggingInfoStream;

public class TestIndexWriterConfig extends LexTestCase {

  private static final class CollectingInfoStream extends InfoStream {
    final List<String> messages = Collections.synchronizedList(new ArrayList<String>());

    @Override
    public void message(String component, String message) {
      messages.add(component + ": " + message);
    }

    @Override
    public boolean isEnabled(String component) {
      return "IW".equals(component);
    }

    @Override
    public void close() {
    }
  }

  public void testDefaults() throws Exception {
    IndexWriterConfig conf = new IndexWriterConfig(new MockAnalyzer(random));
    assertEquals(MockAnalyzer.class, conf.getAnalyzer().getClass());
    assertNull(conf.getIndexCommit());
    assertEquals(KeepOnlyLastCommitDeletionPolicy.class, conf.getIndexDeletionPolicy().getClass());
    assertEquals(ConcurrentMergeScheduler.class, conf.getMergeScheduler().getClass());
    assertEquals(OpenMode.CREATE_OR_APPEND, conf.getOpenMode());
    assertEquals(IndexWriterConfig.WRITE_LOCK_TIMEOUT, conf.getWriteLockTimeout());
    assertEquals(IndexWriterConfig.DEFAULT_MAX_BUFFERED_DELETE_TERMS, conf.getMaxBufferedDeleteTerms());
    assertEquals(IndexWriterConfig.DEFAULT_RAM_BUFFER_SIZE_MB, conf.getRAMBufferSizeMB(), 0.0);
    assertEquals(IndexWriterConfig.DEFAULT_MAX_BUFFERED_DOCS, conf.getMaxBufferedDocs());
    assertEquals(TieredMergePolicy.class, conf.getMergePolicy().getClass());
    assertEquals(IndexWriterConfig.DEFAULT_MAX_THREAD_STATES, conf.getMaxThreadStates());
    assertEquals(IndexWriterConfig.DEFAULT_READER_POOLING, conf.getReaderPooling());
    assertSame(Codec.getDefault(), conf.getCodec());
    assertEquals("Lex10", conf.getCodec().getName());
    assertEquals(LoggingInfoStream.class, conf.getInfoStream().getClass());
  }

  public void testToString() throws Exception {
    String str = new IndexWriterConfig(new MockAnalyzer(random)).toString();
    for (String name : new String[] {"analyzer", "delPolicy", "commit", "openMode", "mergeScheduler",
                                     "writeLockTimeout", "maxBufferedDeleteTerms", "ramBufferSizeMB",
                                     "maxBufferedDocs", "mergePolicy", "maxThreadStates", "readerPooling",
                                     "codec", "infoStream"}) {
      assertTrue(name + " not found in toString", str.indexOf(name + "=") != -1);
    }
  }

  public void testClone() throws Exception {
    IndexWriterConfig conf = new IndexWriterConfig(new MockAnalyzer(random));
    IndexWriterConfig clone = conf.clone();

    // shallow: the clone shares the heavy collaborators
    assertSame(conf.getMergePolicy(), clone.getMergePolicy());
    assertSame(conf.getIndexDeletionPolicy(), clone.getIndexDeletionPolicy());

    conf.setMaxBufferedDocs(3);
    assertEquals(IndexWriterConfig.DEFAULT_MAX_BUFFERED_DOCS, clone.getMaxBufferedDocs());
  }

  public void testInvalidValues() throws Exception {
    IndexWriterConfig conf = new IndexWriterConfig(new MockAnalyzer(random));

    try {
      conf.setMaxBufferedDocs(1);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      // both auto flush triggers disabled
      conf.setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH);
      conf.setMaxBufferedDocs(IndexWriterConfig.DISABLE_AUTO_FLUSH);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
    conf.setRAMBufferSizeMB(IndexWriterConfig.DEFAULT_RAM_BUFFER_SIZE_MB);

    try {
      conf.setRAMBufferSizeMB(0.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setRAMBufferSizeMB(4096.0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setMaxBufferedDeleteTerms(0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setMaxThreadStates(0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setWriteLockTimeout(-1);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setMergePolicy(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setMergeScheduler(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setIndexDeletionPolicy(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setOpenMode(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setInfoStream(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }

    try {
      conf.setCodec(null);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testUnknownCodec() throws Exception {
    assertTrue(Codec.availableCodecs().contains("Lex10"));
    try {
      Codec.forName("NoSuchCodec");
      fail("did not hit expected exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testInfoStreamReceivesWriterMessages() throws Exception {
    Directory dir = newDirectory();
    CollectingInfoStream infoStream = new CollectingInfoStream();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setInfoStream(infoStream));
    Document doc = new Document();
    doc.add(new StringField("id", "0", StringField.Store.NO));
    writer.addDocument(doc);
    writer.commit();
    writer.close();

    boolean sawCommit = false;
    synchronized (infoStream.messages) {
      for (String message : infoStream.messages) {
        if (message.startsWith("IW: ") && message.indexOf("commit") != -1) {
          sawCommit = true;
        }
      }
    }
    assertTrue(sawCommit);
    dir.close();
  }
}
