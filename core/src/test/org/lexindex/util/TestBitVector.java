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

import java.io.IOException;

import org.lexindex.store.Directory;
import org.lexindex.store.IndexInput;
import org.lexindex.store.IndexOutput;
import org.lexindex.store.RAMDirectory;

/**
 * <code>TestBitVector</code> tests the <code>BitVector</code>, obviously.
 */
public class TestBitVector extends LexTestCase {

  public void testConstructSize() throws Exception {
    doTestConstructOfSize(8);
    doTestConstructOfSize(20);
    doTestConstructOfSize(100);
    doTestConstructOfSize(1000);
  }

  private void doTestConstructOfSize(int n) {
    BitVector bv = new BitVector(n);
    assertEquals(n,bv.size());
    assertEquals(0, bv.count());
  }

  public void testGetSetClear() throws Exception {
    final int n = atLeast(300);
    BitVector bv = new BitVector(n);
    for(int i=0;i<n;i++) {
      assertFalse(bv.get(i));
      bv.set(i);
      assertTrue(bv.get(i));
      assertEquals(i+1, bv.count());
    }
    for(int i=0;i<n;i++) {
      bv.clear(i);
      assertFalse(bv.get(i));
      assertEquals(n-i-1, bv.count());
    }
  }

  public void testGetAndClear() throws Exception {
    BitVector bv = new BitVector(17);
    bv.setAll();
    assertEquals(17, bv.count());
    assertFalse(bv.getAndClear(3));
    assertTrue(bv.getAndClear(3));
    assertEquals(16, bv.count());
    assertEquals(bv.getRecomputedCount(), bv.count());
  }

  public void testSetAllClearsTrailingBits() throws Exception {
    for(int size=1;size<40;size++) {
      BitVector bv = new BitVector(size);
      bv.setAll();
      assertEquals(size, bv.count());
      assertEquals(size, bv.getRecomputedCount());
    }
  }

  public void testOutOfBounds() throws Exception {
    BitVector bv = new BitVector(10);
    try {
      bv.set(10);
      fail("did not hit expected exception");
    } catch (ArrayIndexOutOfBoundsException e) {
      // expected
    }
  }

  public void testWriteRead() throws IOException {
    final int size = atLeast(1000);
    BitVector bv = new BitVector(size);
    for(int i=0;i<size;i++) {
      if (random.nextInt(3) == 1) {
        bv.set(i);
      }
    }
    Directory d = new RAMDirectory();
    IndexOutput out = d.createOutput("bv");
    bv.writeBits(out);
    out.close();

    IndexInput in = d.openInput("bv");
    BitVector read = new BitVector(in, size);
    in.close();
    assertEquals(bv.count(), read.count());
    for(int i=0;i<size;i++) {
      assertEquals(bv.get(i), read.get(i));
    }

    BitVector clone = read.clone();
    clone.clear(0);
    clone.set(size-1);
    assertEquals(bv.get(0), read.get(0));
    d.close();
  }
}
