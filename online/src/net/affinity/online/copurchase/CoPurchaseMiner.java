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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.impl.common.FastIDSet;
import org.apache.mahout.cf.taste.impl.common.LongPrimitiveIterator;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.ScoredProduct;
import net.affinity.online.RankingComparator;
import net.affinity.online.snapshot.OrderBasket;

/**
 * Mines order baskets into a {@link CoPurchaseModel}. Every basket counts toward the support of
 * each product in it; baskets of two or more products also count once for every pair of products
 * in them. Products not in the catalog are ignored.
 */
public final class CoPurchaseMiner {

  private static final Logger log = LoggerFactory.getLogger(CoPurchaseMiner.class);

  private CoPurchaseMiner() {
  }

  /**
   * @param baskets all order baskets in the snapshot
   * @param ratings rating of every product in the catalog; also defines which products are in it
   * @return association model over the catalog's products
   * @throws EmptyBasketSetException if there are no baskets
   */
  public static CoPurchaseModel mine(Collection<OrderBasket> baskets,
                                     FastByIDMap<Float> ratings) throws EmptyBasketSetException {
    Preconditions.checkNotNull(baskets);
    Preconditions.checkNotNull(ratings);
    if (baskets.isEmpty()) {
      throw new EmptyBasketSetException();
    }

    FastByIDMap<int[]> supports = new FastByIDMap<int[]>();
    FastByIDMap<FastByIDMap<int[]>> coCounts = new FastByIDMap<FastByIDMap<int[]>>();
    FastIDSet unknownProductIDs = new FastIDSet();
    int multiProductBaskets = 0;

    for (OrderBasket basket : baskets) {
      long[] productIDs = inCatalog(basket.getProductIDs(), ratings, unknownProductIDs);
      for (long productID : productIDs) {
        increment(supports, productID);
      }
      if (productIDs.length >= 2) {
        multiProductBaskets++;
        for (int i = 0; i < productIDs.length; i++) {
          for (int j = i + 1; j < productIDs.length; j++) {
            incrementPair(coCounts, productIDs[i], productIDs[j]);
            incrementPair(coCounts, productIDs[j], productIDs[i]);
          }
        }
      }
    }

    if (!unknownProductIDs.isEmpty()) {
      log.warn("Ignored {} products in baskets that are not in the catalog", unknownProductIDs.size());
    }
    log.info("Mined {} baskets ({} with 2+ products) over {} purchased products",
             baskets.size(), multiProductBaskets, supports.size());

    RankingComparator ordering = new RankingComparator(ratings);
    FastByIDMap<CoPurchaseModel.Companions> companionsByAnchor =
        new FastByIDMap<CoPurchaseModel.Companions>(supports.size());
    for (Map.Entry<Long,int[]> entry : supports.entrySet()) {
      long anchorID = entry.getKey();
      int support = entry.getValue()[0];
      companionsByAnchor.put(anchorID, rank(support, coCounts.get(anchorID), ordering));
    }
    return new CoPurchaseModel(companionsByAnchor);
  }

  private static long[] inCatalog(FastIDSet productIDs, FastByIDMap<Float> ratings, FastIDSet unknownProductIDs) {
    long[] kept = new long[productIDs.size()];
    int count = 0;
    LongPrimitiveIterator it = productIDs.iterator();
    while (it.hasNext()) {
      long productID = it.nextLong();
      if (ratings.containsKey(productID)) {
        kept[count++] = productID;
      } else {
        unknownProductIDs.add(productID);
      }
    }
    long[] result = Arrays.copyOf(kept, count);
    Arrays.sort(result);
    return result;
  }

  private static void increment(FastByIDMap<int[]> counts, long id) {
    int[] count = counts.get(id);
    if (count == null) {
      counts.put(id, new int[] {1});
    } else {
      count[0]++;
    }
  }

  private static void incrementPair(FastByIDMap<FastByIDMap<int[]>> coCounts, long anchorID, long companionID) {
    FastByIDMap<int[]> counts = coCounts.get(anchorID);
    if (counts == null) {
      counts = new FastByIDMap<int[]>();
      coCounts.put(anchorID, counts);
    }
    increment(counts, companionID);
  }

  private static CoPurchaseModel.Companions rank(int support, FastByIDMap<int[]> counts, RankingComparator ordering) {
    if (counts == null) {
      return new CoPurchaseModel.Companions(support, new long[0], new float[0]);
    }
    List<RecommendedItem> companions = Lists.newArrayListWithCapacity(counts.size());
    for (Map.Entry<Long,int[]> entry : counts.entrySet()) {
      companions.add(new ScoredProduct(entry.getKey(), (float) entry.getValue()[0] / support));
    }
    Collections.sort(companions, ordering);
    long[] productIDs = new long[companions.size()];
    float[] strengths = new float[companions.size()];
    for (int i = 0; i < productIDs.length; i++) {
      RecommendedItem companion = companions.get(i);
      productIDs[i] = companion.getItemID();
      strengths[i] = companion.getValue();
    }
    return new CoPurchaseModel.Companions(support, productIDs, strengths);
  }

}
