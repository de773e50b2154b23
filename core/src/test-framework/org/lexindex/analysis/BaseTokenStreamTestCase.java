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

import java.io.IOException;
import java.io.StringReader;

import org.lexindex.util.LexTestCase;

/** 
 * Base class for tests of {@link TokenStream}s and {@link Analyzer}s. 
 * <p>
 * The helpers here check every token's text, offsets and position
 * increment, and the final offset reported by {@link TokenStream#end()}.
 */
public abstract class BaseTokenStreamTestCase extends LexTestCase {

  public static void assertTokenStreamContents(TokenStream ts, String[] output, int startOffsets[], int endOffsets[], int posIncrements[], Integer finalOffset) throws IOException {
    assertNotNull(output);
    ts.reset();
    for (int i = 0; i < output.length; i++) {
      assertTrue("token "+i+" does not exist", ts.incrementToken());
      assertEquals("term "+i, output[i], ts.term().toString());
      if (startOffsets != null)
        assertEquals("startOffset "+i, startOffsets[i], ts.startOffset());
      if (endOffsets != null)
        assertEquals("endOffset "+i, endOffsets[i], ts.endOffset());
      if (posIncrements != null)
        assertEquals("posIncrement "+i, posIncrements[i], ts.positionIncrement());

      // basic sanity even if the caller doesn't check:
      assertTrue("startOffset must be >= 0", ts.startOffset() >= 0);
      assertTrue("endOffset must be >= startOffset", ts.endOffset() >= ts.startOffset());
      assertTrue("posIncrement must be >= 0", ts.positionIncrement() >= 0);
    }
    assertFalse("end of stream", ts.incrementToken());
    ts.end();
    if (finalOffset != null)
      assertEquals("finalOffset ", finalOffset.intValue(), ts.endOffset());
    ts.close();
  }

  public static void assertTokenStreamContents(TokenStream ts, String[] output) throws IOException {
    assertTokenStreamContents(ts, output, null, null, null, null);
  }

  public static void assertTokenStreamContents(TokenStream ts, String[] output, int startOffsets[], int endOffsets[]) throws IOException {
    assertTokenStreamContents(ts, output, startOffsets, endOffsets, null, null);
  }

  public static void assertAnalyzesTo(Analyzer a, String input, String[] output, int startOffsets[], int endOffsets[], int posIncrements[]) throws IOException {
    assertTokenStreamContents(a.tokenStream("dummy", new StringReader(input)), output, startOffsets, endOffsets, posIncrements, Integer.valueOf(input.length()));
  }

  public static void assertAnalyzesTo(Analyzer a, String input, String[] output) throws IOException {
    assertAnalyzesTo(a, input, output, null, null, null);
  }
}
