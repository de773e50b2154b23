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

import java.io.Closeable;
import java.io.IOException;

import org.lexindex.util.BytesRef;

/**
 * A <code>TokenStream</code> enumerates the sequence of tokens, either from
 * fields of a document or from query text.
 * <p>
 * The workflow is: {@link #reset()}, then {@link #incrementToken()} until it
 * returns false, then {@link #end()} and {@link #close()}. After each
 * successful {@link #incrementToken()} the current token is available
 * through {@link #term()}, {@link #positionIncrement()},
 * {@link #startOffset()}, {@link #endOffset()} and {@link #payload()}.
 */
public abstract class TokenStream implements Closeable {

  /** Text of the current token. */
  protected final StringBuilder termBuffer = new StringBuilder();
  private int positionIncrement = 1;
  private int startOffset;
  private int endOffset;
  private BytesRef payload;

  /**
   * Consumers use this method to advance the stream to the next token.
   * Implementations must call {@link #clearToken()} before setting the
   * new token's state.
   * 
   * @return false for end of stream; true otherwise
   */
  public abstract boolean incrementToken() throws IOException;

  /** Resets the current token to its defaults. */
  protected final void clearToken() {
    termBuffer.setLength(0);
    positionIncrement = 1;
    startOffset = endOffset = 0;
    payload = null;
  }

  public final CharSequence term() {
    return termBuffer;
  }

  /** Position of this token relative to the previous one; 0 stacks the
   *  token on the previous position. */
  public final int positionIncrement() {
    return positionIncrement;
  }

  protected final void setPositionIncrement(int positionIncrement) {
    if (positionIncrement < 0) {
      throw new IllegalArgumentException("Increment must be zero or greater: got " + positionIncrement);
    }
    this.positionIncrement = positionIncrement;
  }

  public final int startOffset() {
    return startOffset;
  }

  public final int endOffset() {
    return endOffset;
  }

  protected final void setOffset(int startOffset, int endOffset) {
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException("startOffset must be non-negative, and endOffset must be >= startOffset, "
          + "startOffset=" + startOffset + ",endOffset=" + endOffset);
    }
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /** Payload of the current token, or null. */
  public final BytesRef payload() {
    return payload;
  }

  protected final void setPayload(BytesRef payload) {
    this.payload = payload;
  }

  /**
   * Called by the consumer after the last token was consumed; the end
   * offset is set to the final offset of the stream.
   */
  public void end() throws IOException {
    // do nothing by default
  }

  /** Resets this stream to a clean state. */
  public void reset() throws IOException {}

  /** Releases resources associated with this stream. */
  public void close() throws IOException {}
}
