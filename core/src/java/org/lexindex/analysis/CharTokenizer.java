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
 * An abstract base class for simple, character-oriented tokenizers. Tokens
 * are maximal runs of code points accepted by {@link #isTokenChar(int)},
 * each normalized with {@link #normalize(int)}.
 */
public abstract class CharTokenizer extends Tokenizer {

  private static final int MAX_WORD_LEN = 255;

  private int off = 0;
  private int finalOffset = 0;

  public CharTokenizer(Reader input) {
    super(input);
  }

  /**
   * Returns true iff a codepoint should be included in a token.
   */
  protected abstract boolean isTokenChar(int c);

  /**
   * Called on each token character to normalize it before it is added to the
   * token. The default implementation does nothing.
   */
  protected int normalize(int c) {
    return c;
  }

  @Override
  public final boolean incrementToken() throws IOException {
    clearToken();
    for (;;) {
      final int startOffset = off;
      int cp = readCodePoint();
      if (cp < 0) {
        finalOffset = off;
        return false;
      } else if (isTokenChar(cp)) {
        int endOffset;
        do {
          termBuffer.appendCodePoint(normalize(cp));
          endOffset = off;
          if (termBuffer.length() >= MAX_WORD_LEN) {
            break;
          }
          cp = readCodePoint();
        } while (cp >= 0 && isTokenChar(cp));
        setOffset(startOffset, endOffset);
        return true;
      }
    }
  }

  private int readCodePoint() throws IOException {
    int ch = input.read();
    if (ch < 0) {
      return ch;
    }
    off++;
    if (Character.isHighSurrogate((char) ch)) {
      int ch2 = input.read();
      if (ch2 >= 0) {
        off++;
        return Character.toCodePoint((char) ch, (char) ch2);
      }
    }
    return ch;
  }

  @Override
  public void end() throws IOException {
    setOffset(finalOffset, finalOffset);
  }

  @Override
  public void reset() throws IOException {
    off = 0;
    finalOffset = 0;
  }

  @Override
  public void reset(Reader input) throws IOException {
    super.reset(input);
    reset();
  }
}
