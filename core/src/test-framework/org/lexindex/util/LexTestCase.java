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

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.After;
import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.junit.runner.RunWith;
import org.junit.runners.BlockJUnit4ClassRunner;
import org.junit.runners.model.FrameworkMethod;
import org.junit.runners.model.InitializationError;
import org.lexindex.analysis.Analyzer;
import org.lexindex.index.AtomicReaderContext;
import org.lexindex.index.ConcurrentMergeScheduler;
import org.lexindex.index.IndexReader;
import org.lexindex.index.IndexWriterConfig;
import org.lexindex.index.LogDocMergePolicy;
import org.lexindex.index.LogMergePolicy;
import org.lexindex.index.SegmentReader;
import org.lexindex.index.SerialMergeScheduler;
import org.lexindex.index.TieredMergePolicy;
import org.lexindex.store.Directory;
import org.lexindex.store.FSDirectory;
import org.lexindex.store.MockDirectoryWrapper;
import org.lexindex.store.RAMDirectory;

/**
 * Base class for all lexindex unit tests.
 * <p>
 * Each test method runs with its own seed, derived from the class seed.
 * Both are printed when a test fails; pass <code>-Dtests.seed=XXXX:YYYY</code>
 * to reproduce a failure.
 * <p>
 * Directories obtained from {@link #newDirectory()} are tracked and the test
 * class fails if one of them is left open.
 */
@RunWith(LexTestCase.LexTestCaseRunner.class)
public abstract class LexTestCase extends Assert {

  /**
   * true iff tests are run in verbose mode. Note: if it is false, tests are not
   * expected to print any messages.
   */
  public static final boolean VERBOSE = Boolean.getBoolean("tests.verbose");

  /** Seed of the form <code>classSeed:methodSeed</code> (hex), or "random". */
  public static final String TEST_SEED;
  static {
    String seed = System.getProperty("tests.seed", "").trim();
    TEST_SEED = seed.length() == 0 ? "random" : seed;
  }

  /** If set, the only test method that runs. */
  static final String TEST_METHOD;
  static {
    String method = System.getProperty("tests.method", "").trim();
    TEST_METHOD = method.length() == 0 ? null : method;
  }

  /** Multiplies the number of iterations of randomized tests. */
  public static final int RANDOM_MULTIPLIER = Integer.parseInt(System.getProperty("tests.multiplier", "1"));

  /** Create indexes in this directory, optimally use a subdir, named after the test */
  public static final File TEMP_DIR;
  static {
    String s = System.getProperty("tempDir", System.getProperty("java.io.tmpdir"));
    if (s == null)
      throw new RuntimeException("To run tests, you need to define system property 'tempDir' or 'java.io.tmpdir'.");
    TEMP_DIR = new File(s);
    TEMP_DIR.mkdirs();
  }

  private static final Random seedRand = new Random();

  /** Random source for the current test; reseeded before each test method. */
  protected static final Random random = new Random(0);

  private static long staticSeed;
  private long seed;
  private String name = "<unknown>";

  /** set of directories we created, in afterclass we check they were closed */
  private static Map<MockDirectoryWrapper,StackTraceElement[]> stores;

  private static boolean testsFailed;

  @BeforeClass
  public static void beforeClassLexTestCase() {
    staticSeed = "random".equals(TEST_SEED) ? seedRand.nextLong() : parseSeed(TEST_SEED, 0);
    random.setSeed(staticSeed);
    stores = Collections.synchronizedMap(new IdentityHashMap<MockDirectoryWrapper,StackTraceElement[]>());
    testsFailed = false;
  }

  @AfterClass
  public static void afterClassLexTestCase() {
    if (!testsFailed) {
      for (MockDirectoryWrapper d : stores.keySet()) {
        if (d.isOpen()) {
          StackTraceElement elements[] = stores.get(d);
          // first frame outside of this class is the test that requested it
          StackTraceElement element = null;
          for (int i = 2; i < elements.length; i++) {
            StackTraceElement ste = elements[i];
            if (ste.getClassName().indexOf("LexTestCase") == -1) {
              element = ste;
              break;
            }
          }
          fail("directory of test was not closed, opened from: " + element);
        }
      }
    }
    stores = null;
  }

  @Rule
  public final TestWatcher intercept = new TestWatcher() {
    @Override
    protected void failed(Throwable e, Description description) {
      if (!(e instanceof org.junit.AssumptionViolatedException)) {
        testsFailed = true;
        reportAdditionalFailureInfo();
      }
    }

    @Override
    protected void starting(Description description) {
      name = description.getMethodName();
    }
  };

  @Before
  public void setUp() throws Exception {
    seed = "random".equals(TEST_SEED) ? seedRand.nextLong() : parseSeed(TEST_SEED, 1);
    random.setSeed(seed);
  }

  @After
  public void tearDown() throws Exception {
  }

  /** Name of the currently running test method. */
  public String getName() {
    return name;
  }

  private void reportAdditionalFailureInfo() {
    System.err.println("NOTE: reproduce with: mvn test -Dtest=" + getClass().getSimpleName()
        + " -Dtests.method=" + getName() + " -Dtests.seed="
        + Long.toString(staticSeed, 16) + ":" + Long.toString(seed, 16));
  }

  private static long parseSeed(String s, int which) {
    final int i = s.indexOf(':');
    if (i == -1) {
      throw new IllegalArgumentException("tests.seed must be of the form classSeed:methodSeed; got: " + s);
    }
    return Long.parseLong(which == 0 ? s.substring(0, i) : s.substring(i+1), 16);
  }

  /**
   * Returns a number of at least <code>i</code>
   * <p>
   * The actual number returned will be influenced by {@link #RANDOM_MULTIPLIER},
   * but also with some random fudge.
   */
  public static int atLeast(Random random, int i) {
    int min = i * RANDOM_MULTIPLIER;
    int max = min+(min/2);
    return _TestUtil.nextInt(random, min, max);
  }

  public static int atLeast(int i) {
    return atLeast(random, i);
  }

  /** Returns true if something should happen rarely. */
  public static boolean rarely(Random random) {
    int p = 5;
    p += (p * Math.log(RANDOM_MULTIPLIER));
    int min = 100 - Math.min(p, 90); // never more than 90
    return random.nextInt(100) >= min;
  }

  public static boolean rarely() {
    return rarely(random);
  }

  public static boolean usually(Random random) {
    return !rarely(random);
  }

  public static boolean usually() {
    return usually(random);
  }

  /** create a new index writer config with random defaults */
  public static IndexWriterConfig newIndexWriterConfig(Analyzer a) {
    return newIndexWriterConfig(random, a);
  }

  /** create a new index writer config with random defaults using the specified random */
  public static IndexWriterConfig newIndexWriterConfig(Random r, Analyzer a) {
    IndexWriterConfig c = new IndexWriterConfig(a);
    if (r.nextBoolean()) {
      c.setMergeScheduler(new SerialMergeScheduler());
    } else {
      ConcurrentMergeScheduler cms = new ConcurrentMergeScheduler();
      cms.setMaxMergeCount(3);
      cms.setMaxThreadCount(_TestUtil.nextInt(r, 1, 2));
      c.setMergeScheduler(cms);
    }
    if (r.nextBoolean()) {
      if (rarely(r)) {
        // crazy value
        c.setMaxBufferedDocs(_TestUtil.nextInt(r, 2, 7));
      } else {
        // reasonable value
        c.setMaxBufferedDocs(_TestUtil.nextInt(r, 8, 1000));
      }
    }
    if (r.nextBoolean()) {
      c.setMaxThreadStates(_TestUtil.nextInt(r, 1, 20));
    }
    c.setMergePolicy(newLogMergePolicy(r));
    c.setReaderPooling(r.nextBoolean());
    return c;
  }

  public static LogMergePolicy newLogMergePolicy() {
    return newLogMergePolicy(random);
  }

  public static LogMergePolicy newLogMergePolicy(Random r) {
    LogDocMergePolicy logmp = new LogDocMergePolicy();
    logmp.setCalibrateSizeByDeletes(r.nextBoolean());
    if (rarely(r)) {
      logmp.setMergeFactor(_TestUtil.nextInt(r, 2, 4));
    } else {
      logmp.setMergeFactor(_TestUtil.nextInt(r, 5, 50));
    }
    return logmp;
  }

  public static TieredMergePolicy newTieredMergePolicy() {
    return newTieredMergePolicy(random);
  }

  public static TieredMergePolicy newTieredMergePolicy(Random r) {
    TieredMergePolicy tmp = new TieredMergePolicy();
    if (rarely(r)) {
      tmp.setMaxMergeAtOnce(_TestUtil.nextInt(r, 2, 9));
      tmp.setMaxMergeAtOnceExplicit(_TestUtil.nextInt(r, 2, 9));
    } else {
      tmp.setMaxMergeAtOnce(_TestUtil.nextInt(r, 10, 50));
      tmp.setMaxMergeAtOnceExplicit(_TestUtil.nextInt(r, 10, 50));
    }
    if (rarely(r)) {
      tmp.setMaxMergedSegmentMB(0.2 + r.nextDouble() * 2.0);
    } else {
      tmp.setMaxMergedSegmentMB(r.nextDouble() * 100);
    }
    tmp.setFloorSegmentMB(0.2 + r.nextDouble() * 2.0);
    tmp.setForceMergeDeletesPctAllowed(0.0 + r.nextDouble() * 30.0);
    if (rarely(r)) {
      tmp.setSegmentsPerTier(_TestUtil.nextInt(r, 2, 20));
    } else {
      tmp.setSegmentsPerTier(_TestUtil.nextInt(r, 10, 50));
    }
    tmp.setReclaimDeletesWeight(r.nextDouble() * 4);
    return tmp;
  }

  public static LogMergePolicy newLogMergePolicy(int mergeFactor) {
    LogMergePolicy logmp = newLogMergePolicy();
    logmp.setMergeFactor(mergeFactor);
    return logmp;
  }

  /**
   * Returns a new Directory instance. Use this when the test does not
   * care about the specific Directory implementation (most tests).
   * <p>
   * The Directory is wrapped with {@link MockDirectoryWrapper}.
   * By default this means it will be picky, such as ensuring that you
   * properly close it and all open files in your test. It will emulate
   * some features of Windows, such as not allowing open files to be
   * overwritten.
   */
  public static MockDirectoryWrapper newDirectory() throws IOException {
    return newDirectory(random);
  }

  public static MockDirectoryWrapper newDirectory(Random r) throws IOException {
    return track(new MockDirectoryWrapper(r, new RAMDirectory()));
  }

  /**
   * Returns a new Directory instance, with contents copied from the
   * provided directory.
   */
  public static MockDirectoryWrapper newDirectory(Directory d) throws IOException {
    Directory impl = new RAMDirectory();
    for (String file : d.listAll()) {
      d.copy(impl, file, file);
    }
    return track(new MockDirectoryWrapper(random, impl));
  }

  /** Returns a new FSDirectory instance over the given file, which must be a folder. */
  public static MockDirectoryWrapper newFSDirectory(File f) throws IOException {
    return track(new MockDirectoryWrapper(random, FSDirectory.open(f)));
  }

  private static MockDirectoryWrapper track(MockDirectoryWrapper dir) {
    stores.put(dir, Thread.currentThread().getStackTrace());
    return dir;
  }

  /**
   * Some tests expect the directory to contain a single segment, and want to do tests on that segment's reader.
   * This is an utility method to help them.
   */
  public static SegmentReader getOnlySegmentReader(IndexReader reader) {
    if (reader instanceof SegmentReader)
      return (SegmentReader) reader;

    if (reader.leaves().size() != 1)
      throw new IllegalArgumentException(reader + " has " + reader.leaves().size() + " segments instead of exactly one");

    final AtomicReaderContext leaf = reader.leaves().get(0);
    return (SegmentReader) leaf.reader();
  }

  /** Runs every public no-arg <code>test*</code> method, optionally filtered by <code>tests.method</code>. */
  public static class LexTestCaseRunner extends BlockJUnit4ClassRunner {
    private List<FrameworkMethod> testMethods;

    public LexTestCaseRunner(Class<?> clazz) throws InitializationError {
      super(clazz);
    }

    @Override
    protected List<FrameworkMethod> computeTestMethods() {
      if (testMethods != null)
        return testMethods;
      testMethods = new ArrayList<FrameworkMethod>();
      for (Method m : getTestClass().getJavaClass().getMethods()) {
        final int mod = m.getModifiers();
        if (m.getAnnotation(Test.class) != null ||
            (m.getName().startsWith("test") &&
            !Modifier.isAbstract(mod) &&
            m.getParameterTypes().length == 0 &&
            m.getReturnType() == Void.TYPE))
        {
          if (Modifier.isStatic(mod))
            throw new RuntimeException("Test methods must not be static.");
          if (TEST_METHOD == null || TEST_METHOD.equals(m.getName())) {
            testMethods.add(new FrameworkMethod(m));
          }
        }
      }
      if (testMethods.isEmpty()) {
        throw new RuntimeException("No runnable methods!");
      }
      return testMethods;
    }
  }
}
