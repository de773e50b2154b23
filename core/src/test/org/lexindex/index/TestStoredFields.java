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
import java.util.Collections;
import java.util.List;

import org.lexindex.analysis.MockAnalyzer;
import org.lexindex.document.Document;
import org.lexindex.document.StoredField;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.store.Directory;
import org.lexindex.util.BytesRef;
import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestStoredFields extends LexTestCase {

  public void testAllValueTypes() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StringField("id", "0", StringField.Store.YES));
    doc.add(new TextField("text", "some analyzed text", StringField.Store.YES));
    doc.add(new StoredField("int", 42));
    doc.add(new StoredField("long", Long.MIN_VALUE));
    doc.add(new StoredField("float", 1.5f));
    doc.add(new StoredField("double", -0.25d));
    doc.add(new StoredField("bytes", new byte[] {0, (byte) 0xff, 7}));
    doc.add(new StoredField("emptyString", ""));
    doc.add(new TextField("unstored", "not kept", StringField.Store.NO));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    Document stored = reader.document(0);
    assertEquals("0", stored.get("id"));
    assertEquals("some analyzed text", stored.get("text"));
    assertEquals(Integer.valueOf(42), stored.getField("int").numericValue());
    assertEquals(Long.valueOf(Long.MIN_VALUE), stored.getField("long").numericValue());
    assertEquals(Float.valueOf(1.5f), stored.getField("float").numericValue());
    assertEquals(Double.valueOf(-0.25d), stored.getField("double").numericValue());
    assertEquals(new BytesRef(new byte[] {0, (byte) 0xff, 7}), stored.getBinaryValue("bytes"));
    assertEquals("", stored.get("emptyString"));
    assertNull(stored.getField("unstored"));
    assertEquals(8, stored.getFields().size());

    // the unstored field is still searchable
    assertEquals(1, reader.docFreq(new Term("unstored", "kept")));
    reader.close();
    dir.close();
  }

  public void testMultiValuedFieldKeepsOrder() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StoredField("value", "first"));
    doc.add(new StringField("other", "between", StringField.Store.YES));
    doc.add(new StoredField("value", "second"));
    doc.add(new StoredField("value", 3));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    Document stored = reader.document(0);
    String[] values = stored.getValues("value");
    assertEquals(3, values.length);
    assertEquals("first", values[0]);
    assertEquals("second", values[1]);
    assertEquals("3", values[2]);
    IndexableField[] fields = stored.getFields("value");
    assertEquals(3, fields.length);
    assertEquals(Integer.valueOf(3), fields[2].numericValue());
    assertEquals("between", stored.get("other"));
    reader.close();
    dir.close();
  }

  public void testLoadSelectedFields() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StoredField("a", "1"));
    doc.add(new StoredField("b", "2"));
    doc.add(new StoredField("c", "3"));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    Document stored = reader.document(0, Collections.singleton("b"));
    assertEquals(1, stored.getFields().size());
    assertEquals("2", stored.get("b"));

    // a visitor can stop early
    final List<String> seen = new ArrayList<String>();
    reader.document(0, new StoredFieldVisitor() {
      @Override
      public void stringField(FieldInfo fieldInfo, String value) {
        seen.add(fieldInfo.name + "=" + value);
      }

      @Override
      public Status needsField(FieldInfo fieldInfo) {
        return "c".equals(fieldInfo.name) ? Status.STOP : Status.YES;
      }
    });
    assertEquals(2, seen.size());
    assertEquals("a=1", seen.get(0));
    assertEquals("b=2", seen.get(1));
    reader.close();
    dir.close();
  }

  public void testOutOfBoundsDocID() throws IOException {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, newIndexWriterConfig(new MockAnalyzer(random)));
    Document doc = new Document();
    doc.add(new StoredField("a", "1"));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    try {
      reader.document(1);
      fail("did not hit expected exception");
    } catch (IndexOutOfBoundsException ioobe) {
      // expected
    }
    reader.close();
    dir.close();
  }

  public void testStoredFieldsAfterMerge() throws IOException {
    Directory dir = newDirectory();
    RandomIndexWriter w = new RandomIndexWriter(random, dir);
    final int numDocs = atLeast(200);
    final List<String> values = new ArrayList<String>();
    for (int i = 0; i < numDocs; i++) {
      final String value = _TestUtil.randomUnicodeString(random);
      values.add(value);
      Document doc = new Document();
      doc.add(new StringField("id", Integer.toString(i), StringField.Store.YES));
      doc.add(new StoredField("value", value));
      if (random.nextBoolean()) {
        doc.add(new StoredField("number", (long) i * 1000));
      }
      w.addDocument(doc);
      if (random.nextInt(20) == 7) {
        w.deleteDocuments(new Term("id", Integer.toString(random.nextInt(i+1))));
      }
    }
    w.forceMerge(1);
    DirectoryReader reader = w.getReader();
    w.close();

    for (int docID = 0; docID < reader.maxDoc(); docID++) {
      if (reader.hasDeletions() && !MultiFields.getLiveDocs(reader).get(docID)) {
        continue;
      }
      final Document stored = reader.document(docID);
      final int id = Integer.parseInt(stored.get("id"));
      assertEquals(values.get(id), stored.get("value"));
      final IndexableField number = stored.getField("number");
      if (number != null) {
        assertEquals(Long.valueOf((long) id * 1000), number.numericValue());
      }
    }
    reader.close();
    dir.close();
  }
}
