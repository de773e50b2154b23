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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * InfoStream that forwards messages to SLF4J.  Every component gets
 * its own logger named <code>org.lexindex.&lt;component&gt;</code>, and
 * messages are logged at DEBUG level.
 */
public class LoggingInfoStream extends InfoStream {

  private final String prefix;
  private final ConcurrentMap<String,Logger> loggers = new ConcurrentHashMap<String,Logger>();

  public LoggingInfoStream() {
    this("org.lexindex");
  }

  /** @param prefix logger name prefix the component is appended to */
  public LoggingInfoStream(String prefix) {
    this.prefix = prefix;
  }

  private Logger logger(String component) {
    Logger log = loggers.get(component);
    if (log == null) {
      log = LoggerFactory.getLogger(prefix + "." + component);
      final Logger prev = loggers.putIfAbsent(component, log);
      if (prev != null) {
        log = prev;
      }
    }
    return log;
  }

  @Override
  public void message(String component, String message) {
    logger(component).debug("[{}] {}", Thread.currentThread().getName(), message);
  }

  @Override
  public boolean isEnabled(String component) {
    return logger(component).isDebugEnabled();
  }
}
