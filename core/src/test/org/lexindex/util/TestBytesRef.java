package org.lexindex.util;

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

import java.util.Arrays;
import java.util.Comparator;

public class TestBytesRef extends LexTestCase {

  public void testFromChars() {
    for (int i = 0; i < 100; i++) {
      String s = _TestUtil.randomUnicodeString(random);
      String s2 = new BytesRef(s).utf8ToString();
      assertEquals(s, s2);
    }

    // only for the empty string
    assertEquals("", new BytesRef("").utf8ToString());
  }

  public void testUnsignedByteOrder() {
    final Comparator<BytesRef> comp = BytesRef.getUTF8SortedAsUnicodeComparator();
    assertTrue(comp.compare(new BytesRef(new byte[] {(byte) 0x7f}), new BytesRef(new byte[] {(byte) 0x80})) < 0);
    assertTrue(comp.compare(new BytesRef("ab"), new BytesRef("abc")) < 0);
    assertEquals(0, comp.compare(new BytesRef("abc"), new BytesRef("abc")));
    // a supplementary character sorts after U+FFFD in UTF-8 byte order
    assertTrue(new BytesRef("�").compareTo(new BytesRef("𐐀")) < 0);
  }

  public void testRandomSortMatchesCodePointOrder() {
    final int num = atLeast(100);
    String[] strings = new String[num];
    BytesRef[] refs = new BytesRef[num];
    for(int i=0;i<num;i++) {
      strings[i] = _TestUtil.randomUnicodeString(random);
      refs[i] = new BytesRef(strings[i]);
    }
    Arrays.sort(refs);
    for(int i=1;i<num;i++) {
      final String prev = refs[i-1].utf8ToString();
      final String cur = refs[i].utf8ToString();
      assertTrue(compareCodePoints(prev, cur) <= 0);
    }
  }

  private static int compareCodePoints(String a, String b) {
    int i = 0, j = 0;
    while (i < a.length() && j < b.length()) {
      final int ca = a.codePointAt(i);
      final int cb = b.codePointAt(j);
      if (ca != cb) {
        return ca - cb;
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return (a.length() - i) - (b.length() - j);
  }

  public void testDeepCopy() {
    BytesRef ref = new BytesRef(new byte[] {1, 2, 3, 4, 5}, 1, 3);
    BytesRef copy = BytesRef.deepCopyOf(ref);
    assertEquals(0, copy.offset);
    assertEquals(3, copy.length);
    assertEquals(ref, copy);
    ref.bytes[1] = 9;
    assertFalse(ref.equals(copy));
  }
}
