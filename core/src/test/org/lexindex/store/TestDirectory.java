package org.lexindex.store;

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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.lexindex.util.LexTestCase;
import org.lexindex.util._TestUtil;

public class TestDirectory extends LexTestCase {

  private File tempDir;

  @Override
  public void setUp() throws Exception {
    super.setUp();
    tempDir = _TestUtil.getTempDir("testDirectory");
  }

  @Override
  public void tearDown() throws Exception {
    _TestUtil.rmDir(tempDir);
    super.tearDown();
  }

  private Directory[] newDirectories() throws IOException {
    return new Directory[] {
        new RAMDirectory(),
        FSDirectory.open(tempDir)
    };
  }

  public void testWriteReadRoundTrip() throws Exception {
    for (Directory dir : newDirectories()) {
      IndexOutput out = dir.createOutput("foo");
      out.writeByte((byte) 42);
      out.writeInt(-7);
      out.writeVInt(Integer.MAX_VALUE);
      out.writeVLong(Long.MAX_VALUE);
      out.writeLong(Long.MIN_VALUE);
      out.writeString("héllo 𐐀");
      Map<String,String> map = new HashMap<String,String>();
      map.put("k", "v");
      out.writeStringStringMap(map);
      out.writeStringSet(new HashSet<String>(Arrays.asList("a", "b")));
      final long length = out.getFilePointer();
      out.close();

      assertTrue(dir.fileExists("foo"));
      assertEquals(length, dir.fileLength("foo"));

      IndexInput in = dir.openInput("foo");
      assertEquals(length, in.length());
      assertEquals(42, in.readByte());
      assertEquals(-7, in.readInt());
      assertEquals(Integer.MAX_VALUE, in.readVInt());
      assertEquals(Long.MAX_VALUE, in.readVLong());
      assertEquals(Long.MIN_VALUE, in.readLong());
      assertEquals("héllo 𐐀", in.readString());
      assertEquals(map, in.readStringStringMap());
      assertEquals(new HashSet<String>(Arrays.asList("a", "b")), in.readStringSet());
      assertEquals(length, in.getFilePointer());

      // clones read independently
      in.seek(1);
      IndexInput clone = in.clone();
      assertEquals(-7, clone.readInt());
      assertEquals(1, in.getFilePointer());
      clone.close();
      in.close();
      dir.close();
    }
  }

  public void testListRenameDelete() throws Exception {
    for (Directory dir : newDirectories()) {
      IndexOutput out = dir.createOutput("a");
      out.writeVInt(17);
      out.close();
      dir.sync(Collections.singleton("a"));

      assertTrue(Arrays.asList(dir.listAll()).contains("a"));
      dir.renameFile("a", "b");
      assertFalse(dir.fileExists("a"));
      assertTrue(dir.fileExists("b"));
      IndexInput in = dir.openInput("b");
      assertEquals(17, in.readVInt());
      in.close();

      dir.deleteFile("b");
      assertFalse(dir.fileExists("b"));
      try {
        dir.openInput("b");
        fail("did not hit expected exception");
      } catch (FileNotFoundException fnfe) {
        // expected
      }
      try {
        dir.fileLength("b");
        fail("did not hit expected exception");
      } catch (FileNotFoundException fnfe) {
        // expected
      }
      dir.close();
    }
  }

  public void testCopy() throws Exception {
    Directory source = new RAMDirectory();
    IndexOutput out = source.createOutput("src");
    final byte[] bytes = new byte[atLeast(5000)];
    random.nextBytes(bytes);
    out.writeBytes(bytes, bytes.length);
    out.close();

    Directory dest = new RAMDirectory();
    source.copy(dest, "src", "dst");
    IndexInput in = dest.openInput("dst");
    final byte[] read = new byte[bytes.length];
    in.readBytes(read, 0, read.length);
    in.close();
    assertTrue(Arrays.equals(bytes, read));
    source.close();
    dest.close();
  }

  public void testDetectClose() throws Exception {
    for (Directory dir : newDirectories()) {
      dir.close();
      try {
        dir.createOutput("test");
        fail("did not hit expected exception");
      } catch (AlreadyClosedException ace) {
        // expected
      }
      try {
        dir.listAll();
        fail("did not hit expected exception");
      } catch (AlreadyClosedException ace) {
        // expected
      }
    }
  }

  public void testReadPastEOF() throws Exception {
    for (Directory dir : newDirectories()) {
      IndexOutput out = dir.createOutput("short");
      out.writeInt(3);
      out.close();
      IndexInput in = dir.openInput("short");
      in.readInt();
      try {
        in.readByte();
        fail("did not hit expected exception");
      } catch (IOException e) {
        // expected
      }
      in.close();
      dir.close();
    }
  }

  public void testTrackingDirectoryWrapper() throws Exception {
    Directory dir = new RAMDirectory();
    TrackingDirectoryWrapper tracking = new TrackingDirectoryWrapper(dir);
    tracking.createOutput("x").close();
    tracking.createOutput("y").close();
    tracking.renameFile("y", "z");
    tracking.deleteFile("x");
    Set<String> expected = new HashSet<String>(Collections.singleton("z"));
    assertEquals(expected, tracking.getCreatedFiles());
    assertTrue(dir.fileExists("z"));
    dir.close();
  }

  public void testChecksum() throws Exception {
    Directory dir = new RAMDirectory();
    IndexOutput out = dir.createOutput("c");
    out.writeString("checksummed");
    final long expected = out.getChecksum();
    out.close();

    ChecksumIndexInput in = new ChecksumIndexInput(dir.openInput("c"));
    assertEquals("checksummed", in.readString());
    assertEquals(expected, in.getChecksum());
    in.close();
    dir.close();
  }
}
