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

import java.util.Collection;
import java.util.Iterator;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Applies a {@link Processor} to every value from an {@link Iterator}, using a fixed number of
 * worker threads that pull values from the shared iterator until it is exhausted.</p>
 *
 * <p>The first failing value stops the run: remaining workers are cancelled and the failure is
 * rethrown from {@link #runInParallel()}.</p>
 *
 * @param <T> type of value to operate on
 */
public final class Paralleler<T> {

  private static final Logger log = LoggerFactory.getLogger(Paralleler.class);

  private final String name;
  private final Iterator<T> values;
  private final Processor<T> processor;

  /**
   * @param values values to be processed with {@code processor}
   * @param processor {@link Processor} to apply to each value
   * @param name thread name prefix
   */
  public Paralleler(Iterator<T> values, Processor<T> processor, String name) {
    Preconditions.checkNotNull(values);
    Preconditions.checkNotNull(processor);
    Preconditions.checkNotNull(name);
    this.values = values;
    this.processor = processor;
    this.name = name;
  }

  /**
   * Runs in as many threads as there are available cores.
   */
  public void runInParallel() throws InterruptedException, ExecutionException {
    runInParallel(Runtime.getRuntime().availableProcessors());
  }

  /**
   * @param parallelism number of worker threads to use
   */
  public void runInParallel(int parallelism) throws InterruptedException, ExecutionException {
    Preconditions.checkArgument(parallelism > 0, "parallelism must be positive: %s", parallelism);
    ExecutorService executor = ExecutorUtils.newDaemonPool(name, parallelism);
    AtomicLong count = new AtomicLong();
    Collection<Future<?>> futures = Lists.newArrayListWithCapacity(parallelism);
    boolean done = false;
    try {
      for (int i = 0; i < parallelism; i++) {
        futures.add(executor.submit(new Worker(count)));
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException ee) {
          log.warn("Exception from worker {}", name, ee.getCause());
          throw ee;
        }
      }
      done = true;
    } finally {
      if (!done) {
        for (Future<?> future : futures) {
          future.cancel(true);
        }
      }
      ExecutorUtils.shutdownNowAndAwait(executor);
    }
  }

  private final class Worker implements Callable<Void> {

    private final AtomicLong count;

    private Worker(AtomicLong count) {
      this.count = count;
    }

    @Override
    public Void call() throws ExecutionException {
      while (true) {
        T value;
        synchronized (values) {
          if (!values.hasNext()) {
            return null;
          }
          value = values.next();
        }
        processor.process(value, count.incrementAndGet());
      }
    }

  }

}
