package org.lexindex.analysis;

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

import java.io.StringReader;

import org.lexindex.document.Document;
import org.lexindex.document.StringField;
import org.lexindex.document.TextField;
import org.lexindex.index.DirectoryReader;
import org.lexindex.index.IndexWriter;
import org.lexindex.index.IndexWriterConfig;
import org.lexindex.index.Term;
import org.lexindex.store.Directory;

public class TestAnalyzers extends BaseTokenStreamTestCase {

  public void testWhitespaceAnalyzer() throws Exception {
    Analyzer a = new WhitespaceAnalyzer();
    assertAnalyzesTo(a, "foo bar FOO BAR",
        new String[] {"foo", "bar", "FOO", "BAR"},
        new int[] {0, 4, 8, 12},
        new int[] {3, 7, 11, 15},
        new int[] {1, 1, 1, 1});
    assertAnalyzesTo(a, "  foo\t bar \n ",
        new String[] {"foo", "bar"},
        new int[] {2, 7},
        new int[] {5, 10},
        null);
    assertAnalyzesTo(a, "", new String[0]);
    assertAnalyzesTo(a, "   ", new String[0]);
  }

  public void testWhitespaceAnalyzerLowerCase() throws Exception {
    assertAnalyzesTo(new WhitespaceAnalyzer(true), "Quick BROWN fox",
        new String[] {"quick", "brown", "fox"});
  }

  public void testSupplementaryCharacters() throws Exception {
    // U+1D11E is two chars; offsets count chars
    String s = "a\uD834\uDD1Eb c";
    assertAnalyzesTo(new WhitespaceAnalyzer(), s,
        new String[] {"a\uD834\uDD1Eb", "c"},
        new int[] {0, 5},
        new int[] {4, 6},
        null);
  }

  public void testLongTokenIsSplit() throws Exception {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 300; i++) {
      sb.append('x');
    }
    TokenStream ts = new WhitespaceAnalyzer().tokenStream("f", new StringReader(sb.toString()));
    ts.reset();
    assertTrue(ts.incrementToken());
    assertEquals(255, ts.term().length());
    assertTrue(ts.incrementToken());
    assertEquals(45, ts.term().length());
    assertFalse(ts.incrementToken());
    ts.end();
    ts.close();
  }

  public void testKeywordAnalyzer() throws Exception {
    Analyzer a = new KeywordAnalyzer();
    assertAnalyzesTo(a, "Q36 and Q37",
        new String[] {"Q36 and Q37"},
        new int[] {0},
        new int[] {11},
        new int[] {1});
    assertAnalyzesTo(a, "", new String[] {""});
  }

  public void testKeywordAnalyzerIndexesWholeValue() throws Exception {
    Directory dir = newDirectory();
    IndexWriter writer = new IndexWriter(dir, new IndexWriterConfig(new KeywordAnalyzer()));
    Document doc = new Document();
    doc.add(new StringField("id", "1", StringField.Store.YES));
    doc.add(new TextField("partnum", "Q36 and Q37", StringField.Store.YES));
    writer.addDocument(doc);
    writer.close();

    DirectoryReader reader = DirectoryReader.open(dir);
    assertEquals(1, reader.docFreq(new Term("partnum", "Q36 and Q37")));
    assertEquals(0, reader.docFreq(new Term("partnum", "Q36")));
    reader.close();
    dir.close();
  }
}
