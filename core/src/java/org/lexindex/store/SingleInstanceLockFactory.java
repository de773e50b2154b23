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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Locks held in memory by this factory alone.  Two writers only exclude
 * each other if their directories share the factory instance, so this
 * is only safe when every process touching the index goes through the
 * same {@link Directory}; {@link RAMDirectory} uses it.  The lock prefix
 * is ignored.
 */
public class SingleInstanceLockFactory extends LockFactory {

  // guarded by itself
  private final Set<String> held = new HashSet<String>();

  @Override
  public Lock makeLock(String lockName) {
    return new InstanceLock(lockName);
  }

  @Override
  public void clearLock(String lockName) throws IOException {
    synchronized(held) {
      held.remove(lockName);
    }
  }

  private final class InstanceLock extends Lock {
    private final String name;

    InstanceLock(String name) {
      this.name = name;
    }

    @Override
    public boolean obtain() {
      synchronized(held) {
        return held.add(name);
      }
    }

    @Override
    public void release() {
      synchronized(held) {
        held.remove(name);
      }
    }

    @Override
    public boolean isLocked() {
      synchronized(held) {
        return held.contains(name);
      }
    }

    @Override
    public String toString() {
      return "InstanceLock(" + name + ")";
    }
  }
}
