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
import java.io.Reader;

import org.lexindex.analysis.Analyzer;
import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.analysis.TokenStream;
import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.search.DocIdSetIterator;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestIndexWriterExceptions extends LexTestCase {

  // Throws on the fifth token of the "crash" field
  private static class CrashingTokenStream extends TokenStream {
    private final TokenStream input;
    private int count;

    CrashingTokenStream(TokenStream input) {
      this.input = input;
    }

    @Override
    public boolean incrementToken() throws IOException {
      if (count++ == 4) {
        throw new IOException("now failing on purpose");
      }
      if (!input.incrementToken()) {
        return false;
      }
      clearToken();
      termBuffer.append(input.term());
      setPositionIncrement(input.positionIncrement());
      setOffset(input.startOffset(), input.endOffset());
      setPayload(input.payload());
      return true;
    }

    @Override
    public void reset() throws IOException {
      input.reset();
      count = 0;
    }

    @Override
    public void end() throws IOException {
      input.end();
      setOffset(input.startOffset(), input.endOffset());
    }

    @Override
    public void close() throws IOException {
      input.close();
    }
  }

  private static class CrashingAnalyzer extends Analyzer {
    private final Analyzer delegate = new MockAnalyzer(random);

    @Override
    public TokenStream tokenStream(String fieldName, Reader reader) throws IOException {
      final TokenStream stream = delegate.tokenStream(fieldName, reader);
      if ("crash".equals(fieldName)) {
        return new CrashingTokenStream(stream);
      }
      return stream;
    }
  }

  private static class FailOnlyInMethod extends MockDirectoryWrapper.Failure {
    private final String methodName;
    boolean hitExc;

    FailOnlyInMethod(String methodName) {
      this.methodName = methodName;
    }

    @Override
    public void eval(MockDirectoryWrapper dir) throws IOException {
      if (doFail) {
        StackTraceElement[] trace = new Exception().getStackTrace();
        for (int i = 0; i < trace.length; i++) {
          if (methodName.equals(trace[i].getMethodName())) {
            hitExc = true;
            throw new IOException("now failing in " + methodName);
          }
        }
      }
    }
  }

  private static Document newDoc(String id, String content) {
    Document doc = new Document();
    doc.add(new StringField("id", id, StringField.Store.YES));
    doc.add(new TextField("content", content, StringField.Store.NO));
    return doc;
  }

  private static int liveHits(DirectoryReader reader, String field, String text) throws IOException {
    DocsEnum docs = MultiFields.getTermDocsEnum(reader, MultiFields.getLiveDocs(reader), field, new BytesRef(text));
    if (docs == null) {
      return 0;
    }
    int count = 0;
    while (docs.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
      count++;
    }
    return count;
  }

  public void testDocumentFailureDeletesOnlyThatDocument() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new CrashingAnalyzer()).setMaxBufferedDocs(2));

    writer.addDocument(newDoc("0", "aaa bbb"));

    Document bad = newDoc("1", "aaa ccc");
    bad.add(new TextField("crash", "this doc will crash after five tokens", StringField.Store.NO));
    try {
      writer.addDocument(bad);
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }

    writer.addDocument(newDoc("2", "aaa ddd"));
    writer.addDocument(newDoc("3", "aaa eee"));
    writer.close();

    _TestUtil.checkIndex(dir);
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(3, reader.numDocs());
    assertEquals(3, liveHits(reader, "content", "aaa"));
    assertEquals(0, liveHits(reader, "id", "1"));
    assertEquals(0, liveHits(reader, "content", "ccc"));
    assertEquals(0, liveHits(reader, "crash", "will"));
    reader.close();
    dir.close();
  }

  public void testFlushFailureBlocksChangesUntilRetried() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setPreventDoubleWrite(false);
    FailOnlyInMethod failure = new FailOnlyInMethod("doFlush");
    dir.failOn(failure);

    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMaxBufferedDocs(100));
    for(int i=0;i<5;i++) {
      writer.addDocument(newDoc(Integer.toString(i), "aaa"));
    }

    failure.setDoFail();
    try {
      writer.flush();
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }
    assertTrue(failure.hitExc);
    failure.clearDoFail();

    try {
      writer.addDocument(newDoc("5", "aaa"));
      fail("did not hit expected exception");
    } catch (IllegalStateException ise) {
      // expected
    }
    try {
      writer.updateDocument(new Term("id", "0"), newDoc("0", "bbb"));
      fail("did not hit expected exception");
    } catch (IllegalStateException ise) {
      // expected
    }
    try {
      writer.deleteDocuments(new Term("id", "1"));
      fail("did not hit expected exception");
    } catch (IllegalStateException ise) {
      // expected
    }

    // commit retries the failed flush
    writer.commit();
    writer.addDocument(newDoc("5", "aaa"));
    writer.deleteDocuments(new Term("id", "1"));
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(5, reader.numDocs());
    assertEquals(0, liveHits(reader, "id", "1"));
    assertEquals(1, liveHits(reader, "id", "5"));
    reader.close();
    dir.close();
  }

  public void testFlushFailureThenRollback() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setPreventDoubleWrite(false);
    FailOnlyInMethod failure = new FailOnlyInMethod("doFlush");
    dir.failOn(failure);

    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMaxBufferedDocs(100));
    for(int i=0;i<3;i++) {
      writer.addDocument(newDoc(Integer.toString(i), "aaa"));
    }
    writer.commit();

    for(int i=3;i<7;i++) {
      writer.addDocument(newDoc(Integer.toString(i), "aaa"));
    }
    writer.deleteDocuments(new Term("id", "0"));
    failure.setDoFail();
    try {
      writer.flush();
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }
    failure.clearDoFail();
    writer.rollback();

    _TestUtil.checkIndex(dir);
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(3, reader.numDocs());
    assertEquals(1, liveHits(reader, "id", "0"));
    reader.close();

    writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    writer.addDocument(newDoc("3", "aaa"));
    writer.close();
    reader = DirectoryReader.open(dir);
    assertEquals(4, reader.numDocs());
    reader.close();
    dir.close();
  }

  public void testMergeFailureWithSerialScheduler() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setPreventDoubleWrite(false);
    FailOnlyInMethod failure = new FailOnlyInMethod("mergeMiddle");
    dir.failOn(failure);

    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMergePolicy(newLogMergePolicy(1000))
        .setMaxBufferedDocs(2));
    for(int i=0;i<10;i++) {
      writer.addDocument(newDoc(Integer.toString(i), "aaa bbb"));
    }
    writer.commit();
    final int segCount = writer.getSegmentCount();
    assertTrue(segCount > 1);

    failure.setDoFail();
    try {
      writer.forceMerge(1);
      fail("did not hit expected exception");
    } catch (IOException ioe) {
      // expected
    }
    assertTrue(failure.hitExc);
    failure.clearDoFail();
    assertEquals(segCount, writer.getSegmentCount());

    // the writer is still usable
    writer.addDocument(newDoc("10", "aaa"));
    writer.forceMerge(1);
    assertEquals(1, writer.getSegmentCount());
    writer.close();

    _TestUtil.checkIndex(dir);
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(11, reader.numDocs());
    reader.close();
    dir.close();
  }

  public void testRandomIOExceptionsThenRollback() throws IOException {
    MockDirectoryWrapper dir = newDirectory();
    dir.setPreventDoubleWrite(false);
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random))
        .setMergeScheduler(new SerialMergeScheduler())
        .setMergePolicy(newLogMergePolicy(2))
        .setMaxBufferedDocs(3));
    for(int i=0;i<10;i++) {
      writer.addDocument(newDoc(Integer.toString(i), "aaa"));
    }
    writer.commit();

    dir.setRandomIOExceptionRate(0.1);
    final int numIters = atLeast(100);
    int hits = 0;
    for(int i=0;i<numIters;i++) {
      try {
        if (random.nextInt(5) == 2) {
          writer.deleteDocuments(new Term("id", Integer.toString(random.nextInt(10))));
        } else {
          writer.addDocument(newDoc(Integer.toString(10+i), "bbb"));
        }
      } catch (IOException ioe) {
        hits++;
        if (VERBOSE) {
          System.out.println("TEST: hit expected exception: " + ioe);
        }
      } catch (IllegalStateException ise) {
        // a failed flush is pending; retry it
        try {
          writer.flush();
        } catch (IOException ioe) {
          hits++;
        }
      }
    }
    dir.setRandomIOExceptionRate(0.0);
    if (VERBOSE) {
      System.out.println("TEST: " + hits + " exceptions in " + numIters + " iterations");
    }

    writer.rollback();

    _TestUtil.checkIndex(dir);
    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(10, reader.numDocs());
    assertEquals(10, liveHits(reader, "content", "aaa"));
    assertEquals(0, liveHits(reader, "content", "bbb"));
    reader.close();
    dir.close();
  }
}
