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

import java.io.Reader;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Analyzer for testing
 */
public final class MockAnalyzer extends Analyzer {
  private final boolean lowerCase;
  private final int tokenizer;
  private final boolean payloads;
  private final Random random;
  private int positionIncrementGap;
  private final Map<String,Integer> previousMappings = new HashMap<String,Integer>();
  
  public MockAnalyzer(Random random) {
    this(random, MockTokenizer.WHITESPACE, true);
  }

  public MockAnalyzer(Random random, int tokenizer, boolean lowercase) {
    this(random, tokenizer, lowercase, true);
  }

  /**
   * @param payloads if true, each field is randomly assigned no payloads,
   *   fixed length payloads or variable length payloads
   */
  public MockAnalyzer(Random random, int tokenizer, boolean lowercase, boolean payloads) {
    // private random so field payload choices don't depend on test thread interleaving
    this.random = new Random(random.nextLong());
    this.tokenizer = tokenizer;
    this.lowerCase = lowercase;
    this.payloads = payloads;
  }

  @Override
  public TokenStream tokenStream(String fieldName, Reader reader) {
    final MockTokenizer result = new MockTokenizer(reader, tokenizer, lowerCase);
    if (payloads) {
      maybePayload(result, fieldName);
    }
    return result;
  }

  private synchronized void maybePayload(MockTokenizer stream, String fieldName) {
    Integer val = previousMappings.get(fieldName);
    if (val == null) {
      switch(random.nextInt(3)) {
        case 0: val = -1; // no payloads
                break;
        case 1: val = MockTokenizer.VARIABLE_LENGTH_PAYLOAD;
                break;
        default: val = random.nextInt(12); // fixed length payload
                break;
      }
      previousMappings.put(fieldName, val); // save it so we are consistent for this field
    }
    
    if (val != -1) {
      stream.setPayloads(new Random(random.nextLong()), val);
    }
  }

  public void setPositionIncrementGap(int positionIncrementGap) {
    this.positionIncrementGap = positionIncrementGap;
  }

  @Override
  public int getPositionIncrementGap(String fieldName) {
    return positionIncrementGap;
  }
}
