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

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class ExecutorUtilsTest extends AffinityTest {

  @Test
  public void testDaemonThreadsNamed() throws Exception {
    ExecutorService executor = ExecutorUtils.newDaemonPool("TestPool", 2);
    try {
      Future<Thread> future = executor.submit(new Callable<Thread>() {
        @Override
        public Thread call() {
          return Thread.currentThread();
        }
      });
      Thread worker = future.get();
      assertTrue(worker.isDaemon());
      assertTrue(worker.getName(), worker.getName().startsWith("TestPool-"));
    } finally {
      assertTrue(ExecutorUtils.shutdownNowAndAwait(executor));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoThreads() {
    ExecutorUtils.newDaemonPool("TestPool", 0);
  }

  @Test
  public void testShutdownInterruptsRunningTask() throws Exception {
    ExecutorService executor = ExecutorUtils.newDaemonPool("TestPool", 1);
    final CountDownLatch started = new CountDownLatch(1);
    executor.submit(new Callable<Void>() {
      @Override
      public Void call() throws InterruptedException {
        started.countDown();
        Thread.sleep(60000L);
        return null;
      }
    });
    started.await();
    assertTrue(ExecutorUtils.shutdownNowAndAwait(executor));
    assertTrue(executor.isTerminated());
    assertTrue(ExecutorUtils.shutdownNowAndAwait(executor));
  }

}
