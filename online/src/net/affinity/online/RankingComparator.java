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

package net.affinity.online;

import java.io.Serializable;
import java.util.Comparator;

import com.google.common.base.Preconditions;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

/**
 * Orders recommended products best first: by score descending, then by the product's rating
 * descending, then by product ID ascending. Every ranked list the engine serves uses this order,
 * so results are fully deterministic.
 */
public final class RankingComparator implements Comparator<RecommendedItem>, Serializable {

  private final FastByIDMap<Float> ratings;

  /**
   * @param ratings product ratings; a product with no rating sorts as if rated 0
   */
  public RankingComparator(FastByIDMap<Float> ratings) {
    Preconditions.checkNotNull(ratings);
    this.ratings = ratings;
  }

  @Override
  public int compare(RecommendedItem a, RecommendedItem b) {
    int byValue = Float.compare(b.getValue(), a.getValue());
    if (byValue != 0) {
      return byValue;
    }
    long aID = a.getItemID();
    long bID = b.getItemID();
    int byRating = Float.compare(ratingOf(bID), ratingOf(aID));
    if (byRating != 0) {
      return byRating;
    }
    return aID < bID ? -1 : aID > bID ? 1 : 0;
  }

  private float ratingOf(long productID) {
    Float rating = ratings.get(productID);
    return rating == null ? 0.0f : rating;
  }

}
