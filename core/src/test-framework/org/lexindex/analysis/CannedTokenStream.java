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

/**
 * TokenStream from a canned list of Tokens.
 */
public final class CannedTokenStream extends TokenStream {
  private final Token[] tokens;
  private int upto = 0;
  private final int finalOffset;

  public CannedTokenStream(Token... tokens) {
    this(0, tokens);
  }

  /** @param finalOffset offset reported by {@link #end()} */
  public CannedTokenStream(int finalOffset, Token... tokens) {
    this.tokens = tokens;
    this.finalOffset = finalOffset;
  }

  @Override
  public boolean incrementToken() {
    if (upto < tokens.length) {
      final Token token = tokens[upto++];
      clearToken();
      termBuffer.append(token.term);
      setPositionIncrement(token.positionIncrement);
      setOffset(token.startOffset, token.endOffset);
      setPayload(token.payload);
      return true;
    } else {
      return false;
    }
  }

  @Override
  public void end() {
    setOffset(finalOffset, finalOffset);
  }

  @Override
  public void reset() {
    upto = 0;
  }
}
