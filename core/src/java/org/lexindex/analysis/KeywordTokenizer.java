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
import java.io.Reader;

/**
 * Emits the entire input as a single token.
 */
public final class KeywordTokenizer extends Tokenizer {
  
  private boolean done = false;
  private int finalOffset;

  public KeywordTokenizer(Reader input) {
    super(input);
  }
  
  @Override
  public final boolean incrementToken() throws IOException {
    if (!done) {
      clearToken();
      done = true;
      final char[] buffer = new char[256];
      int upto = 0;
      while (true) {
        final int length = input.read(buffer, 0, buffer.length);
        if (length == -1) break;
        termBuffer.append(buffer, 0, length);
        upto += length;
      }
      finalOffset = upto;
      setOffset(0, finalOffset);
      return true;
    }
    return false;
  }
  
  @Override
  public final void end() {
    // set final offset 
    setOffset(finalOffset, finalOffset);
  }

  @Override
  public void reset() throws IOException {
    this.done = false;
  }
}
