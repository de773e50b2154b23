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

import java.io.IOException;

import org.lexindex.index.CorruptIndexException;
import org.lexindex.index.IndexFormatTooNewException;
import org.lexindex.index.IndexFormatTooOldException;
import org.lexindex.store.ChecksumIndexInput;
import org.lexindex.store.DataInput;
import org.lexindex.store.DataOutput;
import org.lexindex.store.IndexInput;
import org.lexindex.store.IndexOutput;

/**
 * Frames every index file: a header naming the file's codec and
 * format version, and a footer carrying the CRC32 of all bytes before
 * the checksum itself.
 * <pre>
 *   Header --&gt; Magic (Int32 {@value #CODEC_MAGIC}), CodecName (String), Version (Int32)
 *   Footer --&gt; Magic (Int32 {@value #FOOTER_MAGIC}), AlgorithmID (Int32, always 0), Checksum (Int64)
 * </pre>
 */
public final class CodecUtil {
  private CodecUtil() {}

  /** First int of every header. */
  public final static int CODEC_MAGIC = 0x3fd76c17;

  /** First int of every footer. */
  public final static int FOOTER_MAGIC = ~CODEC_MAGIC;

  private final static int CRC32_ALGORITHM = 0;

  /**
   * Writes a header for <code>codec</code>, which must be ASCII and
   * shorter than 128 characters so that its length fits one byte.
   */
  public static void writeHeader(DataOutput out, String codec, int version) throws IOException {
    if (codec.length() >= 128) {
      throw new IllegalArgumentException("codec name must be shorter than 128 characters: " + codec);
    }
    for (int i = 0; i < codec.length(); i++) {
      if (codec.charAt(i) > 0x7f) {
        throw new IllegalArgumentException("codec name must be ASCII: " + codec);
      }
    }
    out.writeInt(CODEC_MAGIC);
    out.writeString(codec);
    out.writeInt(version);
  }

  /** Bytes taken by the header {@link #writeHeader} writes for <code>codec</code>. */
  public static int headerLength(String codec) {
    // magic, one length byte, name, version
    return 4 + 1 + codec.length() + 4;
  }

  /**
   * Reads a header and returns its version.
   *
   * @throws CorruptIndexException if the magic or the codec name does not match
   * @throws IndexFormatTooOldException if the version is below <code>minVersion</code>
   * @throws IndexFormatTooNewException if the version is above <code>maxVersion</code>
   */
  public static int checkHeader(DataInput in, String codec, int minVersion, int maxVersion) throws IOException {
    final int magic = in.readInt();
    if (magic != CODEC_MAGIC) {
      throw new CorruptIndexException("codec header mismatch: actual header=" + magic + " vs expected header=" + CODEC_MAGIC + " (resource: " + in + ")");
    }
    final String actualCodec = in.readString();
    if (!actualCodec.equals(codec)) {
      throw new CorruptIndexException("codec mismatch: actual codec=" + actualCodec + " vs expected codec=" + codec + " (resource: " + in + ")");
    }
    final int version = in.readInt();
    if (version < minVersion) {
      throw new IndexFormatTooOldException(in, version, minVersion, maxVersion);
    }
    if (version > maxVersion) {
      throw new IndexFormatTooNewException(in, version, minVersion, maxVersion);
    }
    return version;
  }

  /** Writes the footer; must be the last thing written to <code>out</code>. */
  public static void writeFooter(IndexOutput out) throws IOException {
    out.writeInt(FOOTER_MAGIC);
    out.writeInt(CRC32_ALGORITHM);
    out.writeLong(out.getChecksum());
  }

  /** Bytes taken by the footer. */
  public static int footerLength() {
    return 16;
  }

  /**
   * Reads the footer at the current position, which must be the start of
   * the footer, and verifies the stored checksum against the one computed
   * while reading.  Returns the checksum.
   *
   * @throws CorruptIndexException on a bad footer, a checksum mismatch,
   *         or bytes left after the footer
   */
  public static long checkFooter(ChecksumIndexInput in) throws IOException {
    readFooterMagic(in);
    final long computed = in.getChecksum();
    final long stored = in.readLong();
    if (stored != computed) {
      throw new CorruptIndexException("checksum failed (hardware problem?) : expected=" + Long.toHexString(stored) +
                                      " actual=" + Long.toHexString(computed) + " (resource=" + in + ")");
    }
    if (in.getFilePointer() != in.length()) {
      throw new CorruptIndexException("did not read all bytes from file: read " + in.getFilePointer() + " vs size " + in.length() + " (resource: " + in + ")");
    }
    return computed;
  }

  /** Returns the checksum stored in the footer of <code>in</code> without verifying it. */
  public static long retrieveChecksum(IndexInput in) throws IOException {
    seekToFooter(in, in);
    readFooterMagic(in);
    return in.readLong();
  }

  /**
   * Reads all of <code>input</code> through a clone and verifies its
   * footer; the position of <code>input</code> is left alone.
   */
  public static long checksumEntireFile(IndexInput input) throws IOException {
    final IndexInput clone = input.clone();
    clone.seek(0);
    final ChecksumIndexInput in = new ChecksumIndexInput(clone);
    seekToFooter(in, input);
    return checkFooter(in);
  }

  private static void seekToFooter(IndexInput in, IndexInput resource) throws IOException {
    if (in.length() < footerLength()) {
      throw new CorruptIndexException("file is too short to contain a footer: length=" + in.length() + " (resource: " + resource + ")");
    }
    in.seek(in.length() - footerLength());
  }

  private static void readFooterMagic(IndexInput in) throws IOException {
    final int magic = in.readInt();
    if (magic != FOOTER_MAGIC) {
      throw new CorruptIndexException("codec footer mismatch: actual footer=" + magic + " vs expected footer=" + FOOTER_MAGIC + " (resource: " + in + ")");
    }
    final int algorithm = in.readInt();
    if (algorithm != CRC32_ALGORITHM) {
      throw new CorruptIndexException("codec footer mismatch: unknown algorithmID: " + algorithm + " (resource: " + in + ")");
    }
  }
}
