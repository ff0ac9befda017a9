/*
 * Copyright Affinity Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package net.affinity.common.parallel;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and stops the thread pools that training uses.
 *
 * @since 1.0
 */
public final class ExecutorUtils {

  private static final Logger log = LoggerFactory.getLogger(ExecutorUtils.class);

  private static final long SHUTDOWN_WAIT_SECONDS = 5L;

  private ExecutorUtils() {
  }

  /**
   * @param name prefix of thread names, which are numbered like {@code name-0}
   * @param threads fixed number of threads; must be positive
   * @return pool of daemon threads, so that an unfinished training run never keeps the JVM alive
   */
  public static ExecutorService newDaemonPool(String name, int threads) {
    Preconditions.checkArgument(threads > 0, "threads must be positive: %s", threads);
    return Executors.newFixedThreadPool(
        threads, new ThreadFactoryBuilder().setDaemon(true).setNameFormat(name + "-%d").build());
  }

  /**
   * Interrupts running tasks, drops queued ones, and waits up to 5 seconds for the pool to terminate.
   *
   * @return true if the pool terminated in time
   */
  public static boolean shutdownNowAndAwait(ExecutorService executor) {
    if (executor.isTerminated()) {
      return true;
    }
    int dropped = executor.shutdownNow().size();
    if (dropped > 0) {
      log.info("Dropped {} queued tasks on shutdown", dropped);
    }
    try {
      if (executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        return true;
      }
      log.warn("Executor did not terminate within {}s", SHUTDOWN_WAIT_SECONDS);
    } catch (InterruptedException ie) {
      log.warn("Interrupted while shutting down executor");
      Thread.currentThread().interrupt();
    }
    return false;
  }

}
