package org.lexindex.codecs;

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

import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.IndexFormatTooNewException;
import org.lexindex.index.IndexFormatTooOldException;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.Directory;
import org.lexindex.store.IndexInput;
import org.lexindex.store.IndexOutput;
import org.lexindex.store.RAMDirectory;
import org.lexindex.util.LexTestCase;

public class TestCodecUtil extends LexTestCase {

  private Directory writeFile(String codec, int version) throws Exception {
    Directory dir = new RAMDirectory();
    IndexOutput out = dir.createOutput("f");
    CodecUtil.writeHeader(out, codec, version);
    out.writeVInt(1234);
    CodecUtil.writeFooter(out);
    out.close();
    return dir;
  }

  public void testHeaderAndFooter() throws Exception {
    Directory dir = writeFile("FooCodec", 3);
    assertEquals(CodecUtil.headerLength("FooCodec") + 2 + CodecUtil.footerLength(), dir.fileLength("f"));

    ChecksumIndexInput in = new ChecksumIndexInput(dir.openInput("f"));
    assertEquals(3, CodecUtil.checkHeader(in, "FooCodec", 1, 3));
    assertEquals(1234, in.readVInt());
    final long checksum = CodecUtil.checkFooter(in);
    in.close();

    IndexInput raw = dir.openInput("f");
    assertEquals(checksum, CodecUtil.retrieveChecksum(raw));
    assertEquals(checksum, CodecUtil.checksumEntireFile(raw));
    raw.close();
    dir.close();
  }

  public void testWrongCodecName() throws Exception {
    Directory dir = writeFile("FooCodec", 0);
    IndexInput in = dir.openInput("f");
    try {
      CodecUtil.checkHeader(in, "BarCodec", 0, 0);
      fail("did not hit expected exception");
    } catch (CorruptIndexException cie) {
      // expected
    }
    in.close();
    dir.close();
  }

  public void testVersionOutOfRange() throws Exception {
    Directory dir = writeFile("FooCodec", 5);
    IndexInput in = dir.openInput("f");
    try {
      CodecUtil.checkHeader(in, "FooCodec", 6, 7);
      fail("did not hit expected exception");
    } catch (IndexFormatTooOldException e) {
      // expected
    }
    in.seek(0);
    try {
      CodecUtil.checkHeader(in, "FooCodec", 1, 4);
      fail("did not hit expected exception");
    } catch (IndexFormatTooNewException e) {
      // expected
    }
    in.close();
    dir.close();
  }

  public void testBadMagic() throws Exception {
    Directory dir = new RAMDirectory();
    IndexOutput out = dir.createOutput("f");
    out.writeInt(17);
    out.close();
    IndexInput in = dir.openInput("f");
    try {
      CodecUtil.checkHeader(in, "FooCodec", 0, 0);
      fail("did not hit expected exception");
    } catch (CorruptIndexException cie) {
      // expected
    }
    in.close();
    dir.close();
  }

  public void testCorruptedBodyFailsChecksum() throws Exception {
    Directory dir = writeFile("FooCodec", 0);
    // copy the file flipping one byte in the body
    IndexInput in = dir.openInput("f");
    final byte[] bytes = new byte[(int) in.length()];
    in.readBytes(bytes, 0, bytes.length);
    in.close();
    bytes[CodecUtil.headerLength("FooCodec")] ^= 0x01;
    IndexOutput out = dir.createOutput("g");
    out.writeBytes(bytes, bytes.length);
    out.close();

    IndexInput corrupt = dir.openInput("g");
    try {
      CodecUtil.checksumEntireFile(corrupt);
      fail("did not hit expected exception");
    } catch (CorruptIndexException cie) {
      // expected
    }
    corrupt.close();
    dir.close();
  }

  public void testNonAsciiCodecName() throws Exception {
    Directory dir = new RAMDirectory();
    IndexOutput out = dir.createOutput("f");
    try {
      CodecUtil.writeHeader(out, "cödec", 0);
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
    out.close();
    dir.close();
  }

  public void testCodecLookup() {
    assertEquals("Lex10", Codec.getDefault().getName());
    assertSame(Codec.forName("Lex10").getClass(), Codec.getDefault().getClass());
    assertTrue(Codec.availableCodecs().contains("Lex10"));
    try {
      Codec.forName("NoSuchCodec");
      fail("did not hit expected exception");
    } catch (IllegalArgumentException iae) {
      // expected
    }
  }
}
