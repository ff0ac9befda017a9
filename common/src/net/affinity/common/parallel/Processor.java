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

import java.util.concurrent.ExecutionException;

/**
 * Work applied to each value handed out by a {@link Paralleler}.
 *
 * @param <T> type of value to operate on
 */
public interface Processor<T> {

  /**
   * @param t value to process
   * @param count 1-based count of values handed out so far, across all threads
   * @throws ExecutionException if processing fails; this stops the whole run
   */
  void process(T t, long count) throws ExecutionException;

}
