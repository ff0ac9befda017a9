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

package net.affinity.online.vectorizer;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

import net.affinity.common.LangUtils;
import net.affinity.online.snapshot.ProductRecord;

/**
 * <p>How products are turned into feature vectors in one generation. A vector is laid out as:</p>
 *
 * <ul>
 *   <li>a one-hot block over the category vocabulary</li>
 *   <li>a one-hot block over the brand vocabulary</li>
 *   <li>price, min-max scaled into [0,1]</li>
 *   <li>rating, min-max scaled into [0,1]</li>
 * </ul>
 *
 * <p>Vocabularies are sorted, so the same catalog always produces the same layout. A numeric field
 * whose observed range is empty scales to 0.</p>
 */
public final class FeatureEncoding {

  private final List<String> categories;
  private final List<String> brands;
  private final double minPrice;
  private final double maxPrice;
  private final double minRating;
  private final double maxRating;

  public FeatureEncoding(List<String> categories,
                         List<String> brands,
                         double minPrice,
                         double maxPrice,
                         double minRating,
                         double maxRating) {
    Preconditions.checkNotNull(categories);
    Preconditions.checkNotNull(brands);
    Preconditions.checkArgument(LangUtils.isFinite(minPrice) && LangUtils.isFinite(maxPrice) && minPrice <= maxPrice,
                                "Bad price range: %s - %s", minPrice, maxPrice);
    Preconditions.checkArgument(LangUtils.isFinite(minRating) && LangUtils.isFinite(maxRating) && minRating <= maxRating,
                                "Bad rating range: %s - %s", minRating, maxRating);
    this.categories = Collections.unmodifiableList(categories);
    this.brands = Collections.unmodifiableList(brands);
    this.minPrice = minPrice;
    this.maxPrice = maxPrice;
    this.minRating = minRating;
    this.maxRating = maxRating;
  }

  public List<String> getCategories() {
    return categories;
  }

  public List<String> getBrands() {
    return brands;
  }

  public double getMinPrice() {
    return minPrice;
  }

  public double getMaxPrice() {
    return maxPrice;
  }

  public double getMinRating() {
    return minRating;
  }

  public double getMaxRating() {
    return maxRating;
  }

  /**
   * @return length of every vector this encoding produces
   */
  public int getDimension() {
    return categories.size() + brands.size() + 2;
  }

  /**
   * Encodes a product. A category or brand outside the vocabulary leaves its block all zero, and a
   * price or rating outside the observed range is clamped.
   *
   * @param product product to encode
   * @return new feature vector of length {@link #getDimension()}
   */
  public float[] encode(ProductRecord product) {
    float[] vector = new float[getDimension()];
    int offset = 0;
    setOneHot(vector, offset, categories, product.getCategory());
    offset += categories.size();
    setOneHot(vector, offset, brands, product.getBrand());
    offset += brands.size();
    vector[offset] = scale(product.getPrice(), minPrice, maxPrice);
    vector[offset + 1] = scale(product.getRating(), minRating, maxRating);
    return vector;
  }

  private static void setOneHot(float[] vector, int offset, List<String> vocabulary, String value) {
    if (value != null) {
      int index = Collections.binarySearch(vocabulary, value);
      if (index >= 0) {
        vector[offset + index] = 1.0f;
      }
    }
  }

  static float scale(double value, double min, double max) {
    if (max <= min) {
      return 0.0f;
    }
    double scaled = (value - min) / (max - min);
    return (float) FastMath.max(0.0, FastMath.min(1.0, scaled));
  }

  @Override
  public String toString() {
    return "FeatureEncoding[categories=" + categories.size() + ", brands=" + brands.size() +
        ", price=" + minPrice + '-' + maxPrice + ", rating=" + minRating + '-' + maxRating + ']';
  }

}
