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

/**
 * Describes one model generation: what a successful training run reports, and what status
 * queries show about the live model.
 */
public final class GenerationSummary {

  private final long generationID;
  private final long createdAt;
  private final int productCount;
  private final int basketCount;
  private final int featureDimension;
  private final long coPurchasePairs;

  public GenerationSummary(long generationID,
                           long createdAt,
                           int productCount,
                           int basketCount,
                           int featureDimension,
                           long coPurchasePairs) {
    this.generationID = generationID;
    this.createdAt = createdAt;
    this.productCount = productCount;
    this.basketCount = basketCount;
    this.featureDimension = featureDimension;
    this.coPurchasePairs = coPurchasePairs;
  }

  public long getGenerationID() {
    return generationID;
  }

  /**
   * @return creation time, in milliseconds since the epoch
   */
  public long getCreatedAt() {
    return createdAt;
  }

  public int getProductCount() {
    return productCount;
  }

  public int getBasketCount() {
    return basketCount;
  }

  public int getFeatureDimension() {
    return featureDimension;
  }

  /**
   * @return number of directed (anchor, companion) pairs with a co-purchase strength
   */
  public long getCoPurchasePairs() {
    return coPurchasePairs;
  }

  @Override
  public String toString() {
    return "Generation " + generationID + " [products=" + productCount + ", baskets=" + basketCount +
        ", dimension=" + featureDimension + ", coPurchasePairs=" + coPurchasePairs + ']';
  }

}
