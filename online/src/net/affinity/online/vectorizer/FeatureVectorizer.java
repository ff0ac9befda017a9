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

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.online.snapshot.ProductRecord;

/**
 * Turns a catalog into feature vectors. The {@link FeatureEncoding} is derived from the catalog
 * itself each time, so vocabularies and numeric ranges never carry over from an earlier run.
 */
public final class FeatureVectorizer {

  private static final Logger log = LoggerFactory.getLogger(FeatureVectorizer.class);

  private FeatureVectorizer() {
  }

  /**
   * @param products entire catalog
   * @return the encoding derived from the catalog
   * @throws EmptyCatalogException if there are no products
   */
  public static FeatureEncoding deriveEncoding(Collection<ProductRecord> products) throws EmptyCatalogException {
    if (products.isEmpty()) {
      throw new EmptyCatalogException();
    }
    SortedSet<String> categories = Sets.newTreeSet();
    SortedSet<String> brands = Sets.newTreeSet();
    Min minPrice = new Min();
    Max maxPrice = new Max();
    Min minRating = new Min();
    Max maxRating = new Max();
    for (ProductRecord product : products) {
      if (product.getCategory() != null) {
        categories.add(product.getCategory());
      }
      if (product.getBrand() != null) {
        brands.add(product.getBrand());
      }
      minPrice.increment(product.getPrice());
      maxPrice.increment(product.getPrice());
      minRating.increment(product.getRating());
      maxRating.increment(product.getRating());
    }
    List<String> categoryList = Lists.newArrayList(categories);
    List<String> brandList = Lists.newArrayList(brands);
    return new FeatureEncoding(categoryList,
                               brandList,
                               minPrice.getResult(),
                               maxPrice.getResult(),
                               minRating.getResult(),
                               maxRating.getResult());
  }

  /**
   * @param products entire catalog. If an ID occurs more than once, the last record wins
   * @return a vector and rating for every product
   * @throws EmptyCatalogException if there are no products
   */
  public static FeatureVectors vectorize(Collection<ProductRecord> products) throws EmptyCatalogException {
    FeatureEncoding encoding = deriveEncoding(products);
    log.info("Encoding {} products with {}", products.size(), encoding);
    FastByIDMap<float[]> vectors = new FastByIDMap<float[]>(products.size());
    FastByIDMap<Float> ratings = new FastByIDMap<Float>(products.size());
    for (ProductRecord product : products) {
      if (vectors.put(product.getID(), encoding.encode(product)) != null) {
        log.warn("Duplicate product {}; keeping the last record", product.getID());
      }
      ratings.put(product.getID(), product.getRating());
    }
    return new FeatureVectors(encoding, vectors, ratings);
  }

}
