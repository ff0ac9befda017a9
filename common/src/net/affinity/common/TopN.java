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

package net.affinity.common;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Queue;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

/**
 * Utility methods for finding the top N things from a stream. "Top" is defined by an ordering that
 * sorts the best candidates first, so callers decide how ties are broken.
 */
public final class TopN {

  private TopN() {
  }

  /**
   * @param n how many top values to choose
   * @param ordering sorts the best candidates first
   * @return Initialized {@link Queue} suitable for use in this class; its head is the worst retained candidate
   */
  public static Queue<ReusableScoredProduct> initialQueue(int n, Comparator<RecommendedItem> ordering) {
    return new PriorityQueue<ReusableScoredProduct>(n + 2, Collections.reverseOrder(ordering));
  }

  /**
   * Computes top N values for a stream and puts them into a {@link Queue}. Values may be reused by the
   * stream between calls to {@link Iterator#next()}; they are copied, not retained.
   *
   * @param topN {@link Queue} to add to
   * @param values stream of values from which to choose; {@code null} elements are skipped
   * @param n how many top values to choose
   * @param ordering sorts the best candidates first
   */
  public static void selectTopNIntoQueue(Queue<ReusableScoredProduct> topN,
                                         Iterator<? extends RecommendedItem> values,
                                         int n,
                                         Comparator<RecommendedItem> ordering) {
    while (values.hasNext()) {
      RecommendedItem value = values.next();
      if (value != null) {
        if (topN.size() >= n) {
          if (ordering.compare(value, topN.peek()) < 0) {
            ReusableScoredProduct recycled = topN.poll();
            recycled.setFrom(value);
            topN.add(recycled);
          }
        } else {
          topN.add(new ReusableScoredProduct(value.getItemID(), value.getValue()));
        }
      }
    }
  }

  /**
   * @param topN {@link Queue} of items from which to take top n
   * @param n how many top values to choose
   * @param ordering sorts the best candidates first
   * @return ordered list of top results, best first
   */
  public static List<RecommendedItem> selectTopNFromQueue(Queue<ReusableScoredProduct> topN,
                                                          int n,
                                                          Comparator<RecommendedItem> ordering) {
    if (topN.isEmpty()) {
      return Collections.emptyList();
    }
    while (topN.size() > n) {
      topN.poll();
    }
    List<RecommendedItem> result = Lists.newArrayListWithCapacity(topN.size());
    for (ReusableScoredProduct item : topN) {
      result.add(item.freeze());
    }
    Collections.sort(result, ordering);
    return result;
  }

  /**
   * @param values stream of values from which to choose
   * @param n how many top values to choose; must be positive
   * @param ordering sorts the best candidates first
   * @return the top N values (at most), best first
   */
  public static List<RecommendedItem> selectTopN(Iterator<? extends RecommendedItem> values,
                                                 int n,
                                                 Comparator<RecommendedItem> ordering) {
    Preconditions.checkArgument(n > 0, "n must be positive: %s", n);
    Queue<ReusableScoredProduct> topN = initialQueue(n, ordering);
    selectTopNIntoQueue(topN, values, n, ordering);
    return selectTopNFromQueue(topN, n, ordering);
  }

}
