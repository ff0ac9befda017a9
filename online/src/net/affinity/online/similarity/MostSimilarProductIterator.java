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

import java.util.Iterator;
import java.util.Map;

import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

import net.affinity.common.ReusableScoredProduct;
import net.affinity.common.math.SimpleVectorMath;

/**
 * An {@link Iterator} over every candidate product in a "similar to" query, scored by cosine
 * similarity to the query product. The query product itself comes back as {@code null}.
 * The returned item is reused between calls to {@link #next()}.
 *
 * @see net.affinity.common.TopN
 */
final class MostSimilarProductIterator implements Iterator<RecommendedItem> {

  private final ReusableScoredProduct delegate;
  private final Iterator<Map.Entry<Long,float[]>> candidates;
  private final FastByIDMap<Double> norms;
  private final long toProductID;
  private final float[] toFeatures;
  private final double toFeaturesNorm;

  MostSimilarProductIterator(Iterator<Map.Entry<Long,float[]>> candidates,
                             FastByIDMap<Double> norms,
                             long toProductID,
                             float[] toFeatures) {
    delegate = new ReusableScoredProduct();
    this.candidates = candidates;
    this.norms = norms;
    this.toProductID = toProductID;
    this.toFeatures = toFeatures;
    this.toFeaturesNorm = norms.get(toProductID);
  }

  @Override
  public boolean hasNext() {
    return candidates.hasNext();
  }

  @Override
  public RecommendedItem next() {
    Map.Entry<Long,float[]> entry = candidates.next();
    long productID = entry.getKey();
    if (productID == toProductID) {
      return null;
    }
    double similarity =
        SimpleVectorMath.cosineSimilarity(entry.getValue(), norms.get(productID), toFeatures, toFeaturesNorm);
    delegate.set(productID, (float) similarity);
    return delegate;
  }

  /**
   * @throws UnsupportedOperationException
   */
  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

}
