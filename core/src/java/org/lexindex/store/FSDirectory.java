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
import java.io.FilenameFilter;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.CRC32;

import org.lexindex.util.IOUtils;
import org.lexindex.util.ThreadInterruptedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directory implementation that stores index files in the file system,
 * using {@link RandomAccessFile} for reads and writes.
 *
 * <p>Files written through this directory are remembered as "stale"
 * until they are {@link #sync synced}; only stale files are fsync'd.
 * {@link #renameFile} uses an atomic file system move and then fsyncs
 * the directory itself so the new name survives a crash.
 *
 * <p>Locking is implemented by default by the {@link NativeFSLockFactory}.
 */
public class FSDirectory extends Directory {

  private static final Logger log = LoggerFactory.getLogger(FSDirectory.class);

  /** The underlying filesystem directory */
  protected final File directory;

  /** Files written, but not yet sync'ed */
  private final Set<String> staleFiles = Collections.synchronizedSet(new HashSet<String>());

  /** Create a new FSDirectory for the named location.
   * @param path the path of the directory
   * @param lockFactory the lock factory to use, or null for the default
   * ({@link NativeFSLockFactory});
   */
  protected FSDirectory(File path, LockFactory lockFactory) throws IOException {
    // new ctors use always NativeFSLockFactory as default:
    if (lockFactory == null) {
      lockFactory = new NativeFSLockFactory();
    }
    directory = path.getCanonicalFile();

    if (directory.exists() && !directory.isDirectory())
      throw new NoSuchDirectoryException("file '" + directory + "' exists but is not a directory");

    setLockFactory(lockFactory);

    // for filesystem based LockFactory, delete the lockPrefix, if the locks are placed
    // in index dir. If no index dir is given, set ourselves
    if (lockFactory instanceof FSLockFactory) {
      final FSLockFactory lf = (FSLockFactory) lockFactory;
      final File dir = lf.getLockDir();
      // if the lock factory has no lockDir set, use the this directory as lockDir
      if (dir == null) {
        lf.setLockDir(directory);
        lf.setLockPrefix(null);
      } else if (dir.getCanonicalPath().equals(directory.getCanonicalPath())) {
        lf.setLockPrefix(null);
      }
    }
  }

  /** Creates an FSDirectory instance using the
   *  {@link NativeFSLockFactory}. */
  public static FSDirectory open(File path) throws IOException {
    return open(path, null);
  }

  /** Just like {@link #open(File)}, but allows you to
   *  also specify a custom {@link LockFactory}. */
  public static FSDirectory open(File path, LockFactory lockFactory) throws IOException {
    return new FSDirectory(path, lockFactory);
  }

  /** Lists all files (not subdirectories) in the
   *  directory.  This method never returns null (throws
   *  {@link IOException} instead).
   *
   *  @throws NoSuchDirectoryException if the directory
   *   does not exist, or does exist but is not a
   *   directory.
   *  @throws IOException if list() returns null */
  public static String[] listAll(File dir) throws IOException {
    if (!dir.exists())
      throw new NoSuchDirectoryException("directory '" + dir + "' does not exist");
    else if (!dir.isDirectory())
      throw new NoSuchDirectoryException("file '" + dir + "' exists but is not a directory");

    // Exclude subdirs
    String[] result = dir.list(new FilenameFilter() {
        public boolean accept(File dir, String file) {
          return !new File(dir, file).isDirectory();
        }
      });

    if (result == null)
      throw new IOException("directory '" + dir + "' exists and is a directory, but cannot be listed: list() returned null");

    return result;
  }

  @Override
  public String[] listAll() throws IOException {
    ensureOpen();
    return listAll(directory);
  }

  @Override
  public boolean fileExists(String name) {
    ensureOpen();
    File file = new File(directory, name);
    return file.exists();
  }

  @Override
  public long fileLength(String name) throws IOException {
    ensureOpen();
    File file = new File(directory, name);
    final long len = file.length();
    if (len == 0 && !file.exists()) {
      throw new FileNotFoundException(name);
    } else {
      return len;
    }
  }

  @Override
  public void deleteFile(String name) throws IOException {
    ensureOpen();
    File file = new File(directory, name);
    if (!file.delete())
      throw new IOException("Cannot delete " + file);
    staleFiles.remove(name);
  }

  @Override
  public IndexOutput createOutput(String name) throws IOException {
    ensureOpen();
    ensureCanWrite(name);
    return new FSIndexOutput(this, name);
  }

  protected void ensureCanWrite(String name) throws IOException {
    if (!directory.exists())
      if (!directory.mkdirs())
        throw new IOException("Cannot create directory: " + directory);

    File file = new File(directory, name);
    if (file.exists() && !file.delete())          // delete existing, if any
      throw new IOException("Cannot overwrite: " + file);
  }

  protected void onIndexOutputClosed(FSIndexOutput io) {
    staleFiles.add(io.name);
  }

  @Override
  public void sync(Collection<String> names) throws IOException {
    ensureOpen();
    Set<String> toSync = new HashSet<String>(names);
    toSync.retainAll(staleFiles);

    for (String name : toSync) {
      fsync(name);
    }

    staleFiles.removeAll(toSync);
  }

  @Override
  public void renameFile(String source, String dest) throws IOException {
    ensureOpen();
    try {
      Files.move(new File(directory, source).toPath(), new File(directory, dest).toPath(), StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      throw new IOException("file system does not support atomic rename: " + directory, e);
    }
    staleFiles.remove(source);
    syncMetaData();
  }

  /** Ensures the directory entry itself is durable after renames. */
  private void syncMetaData() throws IOException {
    FileChannel dirChannel = null;
    try {
      dirChannel = FileChannel.open(directory.toPath(), StandardOpenOption.READ);
      dirChannel.force(true);
    } catch (IOException ioe) {
      // not all platforms can open a directory for fsync (eg Windows)
      log.debug("could not fsync directory {}: {}", directory, ioe.toString());
    } finally {
      if (dirChannel != null) {
        dirChannel.close();
      }
    }
  }

  @Override
  public IndexInput openInput(String name) throws IOException {
    ensureOpen();
    return new FSIndexInput(new File(directory, name));
  }

  @Override
  public String getLockID() {
    ensureOpen();
    String dirName;                               // name to be hashed
    try {
      dirName = directory.getCanonicalPath();
    } catch (IOException e) {
      throw new RuntimeException(e.toString(), e);
    }

    int digest = 0;
    for(int charIDX=0;charIDX<dirName.length();charIDX++) {
      final char ch = dirName.charAt(charIDX);
      digest = 31 * digest + ch;
    }
    return "lexindex-" + Integer.toHexString(digest);
  }

  /** Closes the store to future operations. */
  @Override
  public synchronized void close() {
    isOpen = false;
  }

  /** @return the underlying filesystem directory */
  public File getDirectory() {
    ensureOpen();
    return directory;
  }

  /** For debug output. */
  @Override
  public String toString() {
    return this.getClass().getName() + "@" + directory + " lockFactory=" + getLockFactory();
  }

  protected void fsync(String name) throws IOException {
    File fullFile = new File(directory, name);
    boolean success = false;
    int retryCount = 0;
    IOException exc = null;
    while (!success && retryCount < 5) {
      retryCount++;
      RandomAccessFile file = null;
      try {
        try {
          file = new RandomAccessFile(fullFile, "rw");
          file.getFD().sync();
          success = true;
        } finally {
          if (file != null)
            file.close();
        }
      } catch (IOException ioe) {
        if (exc == null)
          exc = ioe;
        try {
          // Pause 5 msec
          Thread.sleep(5);
        } catch (InterruptedException ie) {
          throw new ThreadInterruptedException(ie);
        }
      }
    }
    if (!success)
      // Throw original exception
      throw exc;
  }

  /** Reads a file through a {@link RandomAccessFile}; clones share the file
   *  and position it before every read. */
  protected static class FSIndexInput extends BufferedIndexInput {

    protected static class Descriptor extends RandomAccessFile {
      // remember if the file is open, so that we don't try to close it
      // more than once
      protected volatile boolean isOpen;
      long position;
      final long length;

      public Descriptor(File file, String mode) throws IOException {
        super(file, mode);
        isOpen=true;
        length=length();
      }

      @Override
      public void close() throws IOException {
        if (isOpen) {
          isOpen=false;
          super.close();
        }
      }
    }

    protected final Descriptor file;
    boolean isClone;

    public FSIndexInput(File path) throws IOException {
      super("FSIndexInput(path=\"" + path + "\")");
      this.file = new Descriptor(path, "r");
    }

    @Override
    protected void readInternal(byte[] b, int offset, int len)
         throws IOException {
      synchronized (file) {
        long position = getFilePointer();
        if (position != file.position) {
          file.seek(position);
          file.position = position;
        }
        int total = 0;

        do {
          final int i = file.read(b, offset + total, len - total);
          if (i == -1) {
            throw new IOException("read past EOF: " + this);
          }
          file.position += i;
          total += i;
        } while (total < len);
      }
    }

    @Override
    public void close() throws IOException {
      // only close the file if this is not a clone
      if (!isClone) file.close();
    }

    @Override
    protected void seekInternal(long position) {
    }

    @Override
    public long length() {
      return file.length;
    }

    @Override
    public FSIndexInput clone() {
      FSIndexInput clone = (FSIndexInput)super.clone();
      clone.isClone = true;
      return clone;
    }
  }

  /** Writes a file through a {@link RandomAccessFile} with an in-memory
   *  buffer, keeping a running CRC32. */
  protected static class FSIndexOutput extends IndexOutput {
    private static final int BUFFER_SIZE = 16384;

    private final FSDirectory parent;
    private final String name;
    private final RandomAccessFile file;
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private final CRC32 crc = new CRC32();
    private int bufferPosition;
    private long bufferStart;
    private volatile boolean isOpen; // remember if the file is open, so that we don't try to close it more than once

    public FSIndexOutput(FSDirectory parent, String name) throws IOException {
      this.parent = parent;
      this.name = name;
      file = new RandomAccessFile(new File(parent.directory, name), "rw");
      isOpen = true;
    }

    @Override
    public void writeByte(byte b) throws IOException {
      if (bufferPosition >= BUFFER_SIZE) {
        flushBuffer();
      }
      crc.update(b);
      buffer[bufferPosition++] = b;
    }

    @Override
    public void writeBytes(byte[] b, int offset, int length) throws IOException {
      crc.update(b, offset, length);
      int bytesLeft = BUFFER_SIZE - bufferPosition;
      if (bytesLeft >= length) {
        // we add the data to the end of the buffer
        System.arraycopy(b, offset, buffer, bufferPosition, length);
        bufferPosition += length;
      } else {
        flushBuffer();
        if (length > BUFFER_SIZE) {
          // write directly, it does not fit the buffer
          file.write(b, offset, length);
          bufferStart += length;
        } else {
          System.arraycopy(b, offset, buffer, 0, length);
          bufferPosition = length;
        }
      }
    }

    private void flushBuffer() throws IOException {
      if (bufferPosition > 0) {
        file.write(buffer, 0, bufferPosition);
        bufferStart += bufferPosition;
        bufferPosition = 0;
      }
    }

    @Override
    public long getFilePointer() {
      return bufferStart + bufferPosition;
    }

    @Override
    public long getChecksum() {
      return crc.getValue();
    }

    @Override
    public void close() throws IOException {
      if (isOpen) {
        parent.onIndexOutputClosed(this);
        boolean success = false;
        try {
          flushBuffer();
          success = true;
        } finally {
          isOpen = false;
          if (!success) {
            IOUtils.closeWhileHandlingException(file);
          } else {
            file.close();
          }
        }
      }
    }
  }
}
