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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Random;

import org.lexindex.index.CheckIndex;
import org.lexindex.store.Directory;

/** Static helpers shared by the tests. */
public class _TestUtil {

  /** A fresh path under the test temp dir whose name contains
   *  <code>desc</code>; nothing exists there yet. */
  public static File getTempDir(String desc) {
    final File dir = new File(LexTestCase.TEMP_DIR, desc + "." + Long.toHexString(LexTestCase.random.nextLong() & Long.MAX_VALUE));
    if (dir.exists()) {
      // name clash with a leftover, try another
      return getTempDir(desc);
    }
    return dir;
  }

  /** Recursively deletes <code>dir</code>, if it exists. */
  public static void rmDir(File dir) throws IOException {
    if (!dir.exists()) {
      return;
    }
    final File[] children = dir.listFiles();
    if (children != null) {
      for (File child : children) {
        rmDir(child);
      }
    }
    if (!dir.delete()) {
      throw new IOException("could not delete " + dir);
    }
  }

  /**
   * Runs {@link CheckIndex} on <code>dir</code> and returns its status,
   * or throws RuntimeException, printing the report, if the index is
   * not clean.
   */
  public static CheckIndex.Status checkIndex(Directory dir) throws IOException {
    final ByteArrayOutputStream report = new ByteArrayOutputStream(1024);
    final CheckIndex checker = new CheckIndex(dir);
    checker.setInfoStream(new PrintStream(report, false, "UTF-8"));
    final CheckIndex.Status status = checker.checkIndex();
    if (status == null || !status.clean) {
      System.out.println("CheckIndex failed");
      System.out.println(report.toString("UTF-8"));
      throw new RuntimeException("CheckIndex failed");
    }
    if (LexTestCase.VERBOSE) {
      System.out.println(report.toString("UTF-8"));
    }
    return status;
  }

  /** Uniform in <code>[start, end]</code>, both inclusive. */
  public static int nextInt(Random r, int start, int end) {
    return start + r.nextInt(end - start + 1);
  }

  /** 0 to 9 chars from a..f. */
  public static String randomSimpleString(Random r) {
    final int length = r.nextInt(10);
    final StringBuilder b = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      b.append((char) nextInt(r, 'a', 'f'));
    }
    return b.toString();
  }

  /** Valid UTF-16 of fewer than 20 chars. */
  public static String randomUnicodeString(Random r) {
    return randomUnicodeString(r, 20);
  }

  /**
   * Valid UTF-16 of fewer than <code>maxLength</code> chars, mixing ASCII,
   * the 2 and 3 byte UTF-8 ranges and supplementary characters, never a
   * lone surrogate.
   */
  public static String randomUnicodeString(Random r, int maxLength) {
    final int length = r.nextInt(maxLength);
    final StringBuilder b = new StringBuilder(length);
    while (b.length() < length) {
      int codePoint;
      switch (r.nextInt(5)) {
      case 0:
        if (length - b.length() >= 2) {
          codePoint = nextInt(r, 0x10000, Character.MAX_CODE_POINT);
          break;
        }
        // no room for a surrogate pair
      case 1:
        codePoint = r.nextInt(0x80);
        break;
      case 2:
        codePoint = nextInt(r, 0x80, 0x7ff);
        break;
      case 3:
        codePoint = nextInt(r, 0x800, 0xd7ff);
        break;
      default:
        codePoint = nextInt(r, 0xe000, 0xffff);
      }
      b.appendCodePoint(codePoint);
    }
    return b.toString();
  }
}
