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

/**
 * Something that commits in two steps, so that several of them can be
 * made durable together: prepare all, then commit all, or roll every
 * one of them back if any preparation fails.
 */
public interface TwoPhaseCommit {

  /**
   * Does all the work of a commit, making the changes durable without
   * making them visible.  May be followed by either {@link #commit()}
   * or {@link #rollback()}.
   */
  public void prepareCommit() throws IOException;

  /**
   * Makes the changes visible, running {@link #prepareCommit()} first
   * if it was not called.
   */
  public void commit() throws IOException;

  /**
   * Discards every change since the last commit, including a prepared
   * but not yet committed one.
   */
  public void rollback() throws IOException;
}
