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

package net.affinity.online.copurchase;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

import net.affinity.common.ScoredProduct;

/**
 * <p>Which products are bought together. For an anchor product p and a companion q,
 * the strength of the association is the fraction of p's baskets that also contain q:</p>
 *
 * <p>{@code strength(p,q) = baskets containing p and q / baskets containing p}</p>
 *
 * <p>so strength is in (0,1], and {@code strength(p,q)} generally differs from
 * {@code strength(q,p)}. Each anchor's companions are held already ranked.</p>
 *
 * <p>Instances are immutable, and safe to share across threads.</p>
 *
 * @see CoPurchaseMiner
 */
public final class CoPurchaseModel {

  private final FastByIDMap<Companions> companionsByAnchor;
  private final long pairCount;

  /**
   * @param companionsByAnchor companions of each purchased product, ranked best first
   */
  public CoPurchaseModel(FastByIDMap<Companions> companionsByAnchor) {
    Preconditions.checkNotNull(companionsByAnchor);
    this.companionsByAnchor = companionsByAnchor;
    long pairs = 0;
    for (Companions companions : companionsByAnchor.values()) {
      pairs += companions.size();
    }
    this.pairCount = pairs;
  }

  /**
   * @param productID anchor product
   * @param howMany maximum number of results
   * @return up to {@code howMany} companions, strongest first. Empty if the product was never
   *  purchased or is unknown
   */
  public List<RecommendedItem> getCoPurchased(long productID, int howMany) {
    Preconditions.checkArgument(howMany > 0, "howMany must be positive: %s", howMany);
    Companions companions = companionsByAnchor.get(productID);
    if (companions == null) {
      return Collections.emptyList();
    }
    int count = Math.min(howMany, companions.size());
    List<RecommendedItem> result = Lists.newArrayListWithCapacity(count);
    for (int i = 0; i < count; i++) {
      result.add(new ScoredProduct(companions.productIDs[i], companions.strengths[i]));
    }
    return result;
  }

  /**
   * @return strength of the association from {@code anchorID} to {@code companionID}, or 0 if they were
   *  never bought together
   */
  public float strength(long anchorID, long companionID) {
    Companions companions = companionsByAnchor.get(anchorID);
    if (companions == null) {
      return 0.0f;
    }
    for (int i = 0; i < companions.productIDs.length; i++) {
      if (companions.productIDs[i] == companionID) {
        return companions.strengths[i];
      }
    }
    return 0.0f;
  }

  /**
   * @return number of baskets the product was bought in
   */
  public int getSupport(long productID) {
    Companions companions = companionsByAnchor.get(productID);
    return companions == null ? 0 : companions.support;
  }

  /**
   * @return companions by anchor product ID; not to be modified
   */
  public FastByIDMap<Companions> getCompanionsByAnchor() {
    return companionsByAnchor;
  }

  /**
   * @return number of (anchor, companion) pairs with a nonzero strength
   */
  public long getPairCount() {
    return pairCount;
  }

  /**
   * One anchor product's support and its ranked companions.
   */
  public static final class Companions {

    private final int support;
    private final long[] productIDs;
    private final float[] strengths;

    /**
     * @param support number of baskets containing the anchor product
     * @param productIDs companion product IDs, best first
     * @param strengths strength of each companion, parallel to {@code productIDs}
     */
    public Companions(int support, long[] productIDs, float[] strengths) {
      Preconditions.checkArgument(support > 0, "support must be positive: %s", support);
      Preconditions.checkArgument(productIDs.length == strengths.length, "Mismatched companion arrays");
      this.support = support;
      this.productIDs = productIDs;
      this.strengths = strengths;
    }

    public int getSupport() {
      return support;
    }

    public long[] getProductIDs() {
      return productIDs;
    }

    public float[] getStrengths() {
      return strengths;
    }

    public int size() {
      return productIDs.length;
    }

    @Override
    public String toString() {
      return "Companions[support=" + support + ", " + Arrays.toString(productIDs) + ']';
    }

  }

}
