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
import java.util.Random;

import org.lexindex.util.BytesRef;

/**
 * Tokenizer for testing. Splits on whitespace, on non-letters, or not at
 * all, and optionally lowercases and attaches random payloads.
 * <p>
 * Asserts that consumers follow the reset/increment/end/close workflow.
 */
public class MockTokenizer extends Tokenizer {
  /** Acts Similar to WhitespaceTokenizer */
  public static final int WHITESPACE = 0;
  /** Acts Similar to KeywordTokenizer. */
  public static final int KEYWORD = 1;
  /** Acts like LetterTokenizer. */
  public static final int SIMPLE = 2;

  /** Payload length marking variable length payloads. */
  public static final int VARIABLE_LENGTH_PAYLOAD = Integer.MAX_VALUE;

  private final int kind;
  private final boolean lowerCase;
  private Random payloadRandom;
  private int payloadLength = -1;
  int off = 0;

  private static enum State { 
    SETREADER,       // consumer set a reader input either via ctor or via reset(Reader)
    RESET,           // consumer has called reset()
    INCREMENT,       // consumer is consuming, has called incrementToken() == true
    INCREMENT_FALSE, // consumer has called incrementToken() which returned false
    END,             // consumer has called end() to perform end of stream operations
    CLOSE            // consumer has called close() to release any resources
  };
  
  private State streamState = State.CLOSE;
  private boolean enableChecks = true;

  public MockTokenizer(Reader input, int kind, boolean lowerCase) {
    super(input);
    if (kind != WHITESPACE && kind != KEYWORD && kind != SIMPLE) {
      throw new IllegalArgumentException("unknown tokenizer kind: " + kind);
    }
    this.kind = kind;
    this.lowerCase = lowerCase;
    this.streamState = State.SETREADER;
  }

  /**
   * Attaches a payload to every token: fixed length payloads of
   * <code>length</code> random bytes, or variable length ones if
   * <code>length</code> is {@link #VARIABLE_LENGTH_PAYLOAD}.
   */
  public void setPayloads(Random random, int length) {
    this.payloadRandom = random;
    this.payloadLength = length;
  }
  
  @Override
  public final boolean incrementToken() throws IOException {
    assert !enableChecks || (streamState == State.RESET || streamState == State.INCREMENT) 
                            : "incrementToken() called while in wrong state: " + streamState;
    clearToken();
    for (;;) {
      int startOffset = off;
      int cp = readCodePoint();
      if (cp < 0) {
        break;
      } else if (isTokenChar(cp)) {
        int endOffset;
        do {
          termBuffer.appendCodePoint(normalize(cp));
          endOffset = off;
          cp = readCodePoint();
        } while (cp >= 0 && isTokenChar(cp));
        setOffset(startOffset, endOffset);
        if (payloadLength != -1) {
          setPayload(nextPayload());
        }
        streamState = State.INCREMENT;
        return true;
      }
    }
    streamState = State.INCREMENT_FALSE;
    return false;
  }

  private BytesRef nextPayload() {
    final int length = payloadLength == VARIABLE_LENGTH_PAYLOAD ? payloadRandom.nextInt(12) : payloadLength;
    final byte[] bytes = new byte[length];
    payloadRandom.nextBytes(bytes);
    return new BytesRef(bytes);
  }

  protected int readCodePoint() throws IOException {
    int ch = input.read();
    if (ch < 0) {
      return ch;
    } else {
      assert !Character.isLowSurrogate((char) ch);
      off++;
      if (Character.isHighSurrogate((char) ch)) {
        int ch2 = input.read();
        if (ch2 >= 0) {
          off++;
          assert Character.isLowSurrogate((char) ch2);
          return Character.toCodePoint((char) ch, (char) ch2);
        }
      }
      return ch;
    }
  }

  protected boolean isTokenChar(int c) {
    switch (kind) {
      case KEYWORD:
        return true;
      case SIMPLE:
        return Character.isLetter(c);
      default:
        return c != ' ' && c != '\t' && c != '\r' && c != '\n';
    }
  }
  
  protected int normalize(int c) {
    return lowerCase ? Character.toLowerCase(c) : c;
  }

  @Override
  public void reset() throws IOException {
    super.reset();
    off = 0;
    assert !enableChecks || streamState != State.RESET : "double reset()";
    streamState = State.RESET;
  }
  
  @Override
  public void close() throws IOException {
    super.close();
    // tests that abort a document mid-stream close early and should disable this check
    assert !enableChecks || streamState == State.END || streamState == State.CLOSE : "close() called in wrong state: " + streamState;
    streamState = State.CLOSE;
  }

  @Override
  public void reset(Reader input) throws IOException {
    super.reset(input);
    assert !enableChecks || streamState == State.CLOSE : "setReader() called in wrong state: " + streamState;
    streamState = State.SETREADER;
  }

  @Override
  public void end() throws IOException {
    setOffset(off, off);
    assert !enableChecks || streamState == State.INCREMENT_FALSE : "end() called before incrementToken() returned false!";
    streamState = State.END;
  }

  /** 
   * Toggle consumer workflow checking: if your test consumes tokenstreams normally you
   * should leave this enabled.
   */
  public void setEnableChecks(boolean enableChecks) {
    this.enableChecks = enableChecks;
  }
}
