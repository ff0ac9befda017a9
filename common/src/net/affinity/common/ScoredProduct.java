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

import java.io.Serializable;

import com.google.common.primitives.Floats;
import com.google.common.primitives.Longs;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

/**
 * One entry in a query result: a product ID and its similarity or co-purchase strength. Immutable.
 *
 * @since 1.0
 */
public final class ScoredProduct implements RecommendedItem, Serializable {

  private final long productID;
  private final float score;

  public ScoredProduct(long productID, float score) {
    this.productID = productID;
    this.score = score;
  }

  public long getProductID() {
    return productID;
  }

  public float getScore() {
    return score;
  }

  @Override
  public long getItemID() {
    return productID;
  }

  @Override
  public float getValue() {
    return score;
  }

  @Override
  public int hashCode() {
    return 31 * Longs.hashCode(productID) + Floats.hashCode(score);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ScoredProduct)) {
      return false;
    }
    ScoredProduct other = (ScoredProduct) o;
    return other.productID == productID && Float.compare(other.score, score) == 0;
  }

  @Override
  public String toString() {
    return productID + "=" + score;
  }

}
