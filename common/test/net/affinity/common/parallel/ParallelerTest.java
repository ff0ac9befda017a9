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

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.Lists;
import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class ParallelerTest extends AffinityTest {

  @Test
  public void testProcessesAll() throws Exception {
    final AtomicLong sum = new AtomicLong();
    final AtomicLong maxCount = new AtomicLong();
    new Paralleler<Integer>(range(100), new Processor<Integer>() {
      @Override
      public void process(Integer value, long count) {
        sum.addAndGet(value);
        synchronized (maxCount) {
          maxCount.set(Math.max(maxCount.get(), count));
        }
      }
    }, "test").runInParallel(4);
    assertEquals(4950L, sum.get());
    assertEquals(100L, maxCount.get());
  }

  @Test
  public void testFailureStopsRun() throws Exception {
    try {
      new Paralleler<Integer>(range(50), new Processor<Integer>() {
        @Override
        public void process(Integer value, long count) throws ExecutionException {
          if (value == 10) {
            throw new ExecutionException(new IllegalStateException("bad value"));
          }
        }
      }, "test").runInParallel(2);
      fail();
    } catch (ExecutionException ee) {
      // good
    }
  }

  private static Iterator<Integer> range(int n) {
    List<Integer> values = Lists.newArrayListWithCapacity(n);
    for (int i = 0; i < n; i++) {
      values.add(i);
    }
    return values.iterator();
  }

}
