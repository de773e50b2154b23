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

import org.lexindex.index.FieldInfos;
import org.lexindex.store.Directory;

/**
 * Encodes/decodes {@link FieldInfos}
 */
public abstract class FieldInfosFormat {
  /** Sole constructor. (For invocation by subclass 
   *  constructors, typically implicit.) */
  protected FieldInfosFormat() {
  }

  /** Read the {@link FieldInfos} previously written with
   *  {@link #write}. */
  public abstract FieldInfos read(Directory directory, String segmentName) throws IOException;

  /** Writes the provided {@link FieldInfos} to the
   *  directory. */
  public abstract void write(Directory directory, String segmentName, FieldInfos infos) throws IOException;
}
