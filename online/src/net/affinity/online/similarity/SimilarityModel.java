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

package net.affinity.online.similarity;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Preconditions;
import org.apache.mahout.cf.taste.common.NoSuchItemException;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.TopN;
import net.affinity.common.math.SimpleVectorMath;
import net.affinity.common.parallel.Paralleler;
import net.affinity.common.parallel.Processor;
import net.affinity.online.RankingComparator;

/**
 * <p>Content similarity between products, as the cosine of the angle between their feature vectors.
 * A product whose vector is all zero is dissimilar (0) to everything.</p>
 *
 * <p>"Similar to" queries are answered by scoring every other product. Optionally the top K neighbors
 * of every product are computed up front, and queries for at most K results are then answered
 * from those lists.</p>
 *
 * <p>Instances are immutable once built, and safe to share across threads.</p>
 */
public final class SimilarityModel {

  private static final Logger log = LoggerFactory.getLogger(SimilarityModel.class);

  private final FastByIDMap<float[]> vectors;
  private final FastByIDMap<Double> norms;
  private final FastByIDMap<Float> ratings;
  private final RankingComparator ordering;
  private final int cacheTopK;
  private final FastByIDMap<List<RecommendedItem>> topKCache;

  /**
   * Creates a model without precomputed neighbors.
   *
   * @param vectors feature vector per product; all the same length
   * @param ratings rating per product, used to break ties
   */
  public SimilarityModel(FastByIDMap<float[]> vectors, FastByIDMap<Float> ratings) {
    Preconditions.checkNotNull(vectors);
    Preconditions.checkNotNull(ratings);
    this.vectors = vectors;
    this.ratings = ratings;
    this.ordering = new RankingComparator(ratings);
    this.norms = new FastByIDMap<Double>(vectors.size());
    int dimension = -1;
    for (Map.Entry<Long,float[]> entry : vectors.entrySet()) {
      float[] vector = entry.getValue();
      if (dimension < 0) {
        dimension = vector.length;
      } else {
        Preconditions.checkArgument(vector.length == dimension,
                                    "Vector for %s has length %s, not %s", entry.getKey(), vector.length, dimension);
      }
      norms.put(entry.getKey(), SimpleVectorMath.norm(vector));
    }
    this.cacheTopK = 0;
    this.topKCache = null;
  }

  private SimilarityModel(SimilarityModel model, int cacheTopK, FastByIDMap<List<RecommendedItem>> topKCache) {
    this.vectors = model.vectors;
    this.norms = model.norms;
    this.ratings = model.ratings;
    this.ordering = model.ordering;
    this.cacheTopK = cacheTopK;
    this.topKCache = topKCache;
  }

  /**
   * @param vectors feature vector per product
   * @param ratings rating per product
   * @param cacheTopK number of neighbors to precompute per product, or 0 to precompute nothing
   * @return new model
   * @throws ExecutionException if computing neighbors fails
   * @throws InterruptedException if interrupted while computing neighbors
   */
  public static SimilarityModel build(FastByIDMap<float[]> vectors,
                                      FastByIDMap<Float> ratings,
                                      int cacheTopK) throws ExecutionException, InterruptedException {
    Preconditions.checkArgument(cacheTopK >= 0, "cacheTopK must not be negative: %s", cacheTopK);
    SimilarityModel model = new SimilarityModel(vectors, ratings);
    return cacheTopK == 0 ? model : model.withTopKCache(cacheTopK);
  }

  /**
   * @param k number of neighbors to precompute per product
   * @return a model over the same data that answers queries for up to {@code k} results from
   *  precomputed neighbor lists
   */
  public SimilarityModel withTopKCache(final int k) throws ExecutionException, InterruptedException {
    Preconditions.checkArgument(k > 0, "k must be positive: %s", k);
    long start = System.currentTimeMillis();
    final FastByIDMap<List<RecommendedItem>> cache = new FastByIDMap<List<RecommendedItem>>(vectors.size());
    new Paralleler<Long>(vectors.keySetIterator(), new Processor<Long>() {
      @Override
      public void process(Long productID, long count) {
        List<RecommendedItem> neighbors = Collections.unmodifiableList(scan(productID, k));
        synchronized (cache) {
          cache.put(productID, neighbors);
        }
        if (count % 10000 == 0) {
          log.info("Computed neighbors of {} products", count);
        }
      }
    }, "SimilarityCache").runInParallel();
    log.info("Computed top {} neighbors of {} products in {}ms", k, cache.size(), System.currentTimeMillis() - start);
    return new SimilarityModel(this, k, cache);
  }

  /**
   * @param productID product to find similar products for
   * @param howMany maximum number of results
   * @return up to {@code howMany} other products, most similar first, ties broken by
   *  {@link RankingComparator}
   * @throws NoSuchItemException if the product is unknown
   */
  public List<RecommendedItem> mostSimilar(long productID, int howMany) throws NoSuchItemException {
    Preconditions.checkArgument(howMany > 0, "howMany must be positive: %s", howMany);
    if (topKCache != null && howMany <= cacheTopK) {
      List<RecommendedItem> neighbors = topKCache.get(productID);
      if (neighbors == null) {
        throw new NoSuchItemException(productID);
      }
      return neighbors.size() <= howMany ? neighbors : neighbors.subList(0, howMany);
    }
    if (!vectors.containsKey(productID)) {
      throw new NoSuchItemException(productID);
    }
    return scan(productID, howMany);
  }

  private List<RecommendedItem> scan(long productID, int howMany) {
    return TopN.selectTopN(new MostSimilarProductIterator(vectors.entrySet().iterator(),
                                                          norms,
                                                          productID,
                                                          vectors.get(productID)),
                           howMany,
                           ordering);
  }

  /**
   * @return cosine similarity of the two products, in [-1,1]; 0 if either vector is all zero
   * @throws NoSuchItemException if either product is unknown
   */
  public float similarity(long productID1, long productID2) throws NoSuchItemException {
    float[] vector1 = vectors.get(productID1);
    if (vector1 == null) {
      throw new NoSuchItemException(productID1);
    }
    float[] vector2 = vectors.get(productID2);
    if (vector2 == null) {
      throw new NoSuchItemException(productID2);
    }
    return (float) SimpleVectorMath.cosineSimilarity(vector1, norms.get(productID1), vector2, norms.get(productID2));
  }

  public boolean contains(long productID) {
    return vectors.containsKey(productID);
  }

  /**
   * @return number of products in the model
   */
  public int size() {
    return vectors.size();
  }

  /**
   * @return vectors by product ID; not to be modified
   */
  public FastByIDMap<float[]> getVectors() {
    return vectors;
  }

  /**
   * @return ratings by product ID; not to be modified
   */
  public FastByIDMap<Float> getRatings() {
    return ratings;
  }

  /**
   * @return number of precomputed neighbors per product, or 0 if none are
   */
  public int getCacheTopK() {
    return cacheTopK;
  }

  public RankingComparator getOrdering() {
    return ordering;
  }

}
