/*
 * Copyright 2013-2024 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package netscope.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 */
public final class Platform {
  static final Platform PLATFORM = new Platform();
  static final Logger LOG = Logger.getLogger("netscope");

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)} */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * Returns an executor that runs one task at a time, in submission order, on a single daemon
   * thread named after the input.
   */
  public ExecutorService newSerialExecutor(String threadName) {
    if (threadName == null) throw new NullPointerException("threadName == null");
    return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
      new LinkedBlockingQueue<Runnable>(), new DaemonThreadFactory(threadName));
  }

  static final class DaemonThreadFactory implements ThreadFactory {
    final String threadName;
    final AtomicInteger count = new AtomicInteger();

    DaemonThreadFactory(String threadName) {
      this.threadName = threadName;
    }

    @Override public Thread newThread(Runnable runnable) {
      // a replacement thread is created if a task ever kills the current one
      Thread thread = new Thread(runnable, threadName + "-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }

  Platform() {
  }
}
