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

import org.apache.mahout.cf.taste.recommender.RecommendedItem;

/**
 * A {@link RecommendedItem} whose product and score can be overwritten, so that scans over every
 * product and top-N queues can recycle one instance instead of allocating per candidate. Never
 * escapes into a query result; see {@link #freeze()}.
 */
public final class ReusableScoredProduct implements RecommendedItem {

  private long productID;
  private float score;

  public ReusableScoredProduct() {
    this(Long.MIN_VALUE, Float.NaN);
  }

  public ReusableScoredProduct(long productID, float score) {
    this.productID = productID;
    this.score = score;
  }

  public void set(long productID, float score) {
    this.productID = productID;
    this.score = score;
  }

  public void setFrom(RecommendedItem other) {
    set(other.getItemID(), other.getValue());
  }

  /**
   * @return an immutable copy of the current state
   */
  public ScoredProduct freeze() {
    return new ScoredProduct(productID, score);
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
  public String toString() {
    return productID + "=" + score + " (reusable)";
  }

}
