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


package net.affinity.web.common.stats;

import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.SynchronizedSummaryStatistics;

/**
 * Request timings and error counts for one servlet.
 */
public final class ServletStats {

  private static final double NANOS_PER_MILLI = 1000000.0;

  private final SummaryStatistics allTimeMillis;
  private final AtomicInteger numClientErrors;
  private final AtomicInteger numServerErrors;

  public ServletStats() {
    allTimeMillis = new SynchronizedSummaryStatistics();
    numClientErrors = new AtomicInteger();
    numServerErrors = new AtomicInteger();
  }

  /**
   * @param nanos time taken to serve one request, in nanoseconds
   */
  public void addTiming(long nanos) {
    allTimeMillis.addValue(nanos / NANOS_PER_MILLI);
  }

  public long getCount() {
    return allTimeMillis.getN();
  }

  /**
   * @return mean request time in milliseconds, or {@link Double#NaN} before any request
   */
  public double getMeanMillis() {
    return allTimeMillis.getMean();
  }

  public double getMaxMillis() {
    return allTimeMillis.getMax();
  }

  public int getNumClientErrors() {
    return numClientErrors.get();
  }

  public void incrementClientErrors() {
    numClientErrors.incrementAndGet();
  }

  public int getNumServerErrors() {
    return numServerErrors.get();
  }

  public void incrementServerErrors() {
    numServerErrors.incrementAndGet();
  }

}
