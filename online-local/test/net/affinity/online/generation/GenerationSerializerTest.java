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

package net.affinity.online.generation;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import org.apache.mahout.cf.taste.impl.common.FastIDSet;
import org.junit.Test;

import net.affinity.common.AffinityTest;
import net.affinity.online.copurchase.CoPurchaseMiner;
import net.affinity.online.copurchase.CoPurchaseModel;
import net.affinity.online.similarity.SimilarityModel;
import net.affinity.online.snapshot.OrderBasket;
import net.affinity.online.snapshot.ProductRecord;
import net.affinity.online.vectorizer.FeatureEncoding;
import net.affinity.online.vectorizer.FeatureVectorizer;
import net.affinity.online.vectorizer.FeatureVectors;

public final class GenerationSerializerTest extends AffinityTest {

  @Test
  public void testWriteRead() throws Exception {
    Generation generation = buildGeneration();
    File modelFile = new File(getTestTempDir(), "model.bin.gz");
    GenerationSerializer.writeGeneration(generation, modelFile);
    Generation read = GenerationSerializer.readGeneration(modelFile, 0);

    assertEquals(generation.getGenerationID(), read.getGenerationID());
    assertEquals(generation.getCreatedAt(), read.getCreatedAt());
    assertEquals(generation.getBasketCount(), read.getBasketCount());
    assertEquals(generation.getProductCount(), read.getProductCount());

    FeatureEncoding encoding = generation.getEncoding();
    FeatureEncoding readEncoding = read.getEncoding();
    assertEquals(encoding.getCategories(), readEncoding.getCategories());
    assertEquals(encoding.getBrands(), readEncoding.getBrands());
    assertEquals(encoding.getMinPrice(), readEncoding.getMinPrice());
    assertEquals(encoding.getMaxPrice(), readEncoding.getMaxPrice());
    assertEquals(encoding.getMinRating(), readEncoding.getMinRating());
    assertEquals(encoding.getMaxRating(), readEncoding.getMaxRating());

    SimilarityModel similarity = generation.getSimilarityModel();
    SimilarityModel readSimilarity = read.getSimilarityModel();
    for (Map.Entry<Long,float[]> entry : similarity.getVectors().entrySet()) {
      long id = entry.getKey();
      assertTrue(Arrays.equals(entry.getValue(), readSimilarity.getVectors().get(id)));
      assertEquals(similarity.getRatings().get(id), readSimilarity.getRatings().get(id));
      assertEquals(similarity.mostSimilar(id, 3), readSimilarity.mostSimilar(id, 3));
    }

    CoPurchaseModel coPurchase = generation.getCoPurchaseModel();
    CoPurchaseModel readCoPurchase = read.getCoPurchaseModel();
    assertEquals(coPurchase.getPairCount(), readCoPurchase.getPairCount());
    for (Map.Entry<Long,CoPurchaseModel.Companions> entry : coPurchase.getCompanionsByAnchor().entrySet()) {
      CoPurchaseModel.Companions readCompanions = readCoPurchase.getCompanionsByAnchor().get(entry.getKey());
      assertEquals(entry.getValue().getSupport(), readCompanions.getSupport());
      assertTrue(Arrays.equals(entry.getValue().getProductIDs(), readCompanions.getProductIDs()));
      assertTrue(Arrays.equals(entry.getValue().getStrengths(), readCompanions.getStrengths()));
    }
  }

  @Test
  public void testRebuildsNeighborCache() throws Exception {
    Generation generation = buildGeneration();
    File modelFile = new File(getTestTempDir(), "model.bin.gz");
    GenerationSerializer.writeGeneration(generation, modelFile);
    Generation read = GenerationSerializer.readGeneration(modelFile, 2);
    assertEquals(2, read.getSimilarityModel().getCacheTopK());
    assertEquals(generation.getSimilarityModel().mostSimilar(1L, 2), read.getSimilarityModel().mostSimilar(1L, 2));
  }

  @Test(expected = IOException.class)
  public void testNotAModel() throws Exception {
    File modelFile = new File(getTestTempDir(), "model.bin");
    Files.write("not a model", modelFile, Charsets.UTF_8);
    GenerationSerializer.readGeneration(modelFile, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRequiresGZ() throws Exception {
    GenerationSerializer.writeGeneration(buildGeneration(), new File(getTestTempDir(), "model.bin"));
  }

  static Generation buildGeneration() throws Exception {
    List<ProductRecord> products = Arrays.asList(
        new ProductRecord(1L, "X", "1", 100.0, 4.5f, 1),
        new ProductRecord(2L, "X", "1", 110.0, 4.0f, 1),
        new ProductRecord(3L, "Y", "2", 500.0, 3.0f, 1),
        new ProductRecord(4L, null, "2", null, null, 0));
    FeatureVectors vectors = FeatureVectorizer.vectorize(products);
    List<OrderBasket> baskets = Arrays.asList(
        new OrderBasket(1L, new FastIDSet(new long[] {1L, 2L})),
        new OrderBasket(2L, new FastIDSet(new long[] {1L, 2L})),
        new OrderBasket(3L, new FastIDSet(new long[] {1L, 3L})),
        new OrderBasket(4L, new FastIDSet(new long[] {4L})));
    return new Generation(7L,
                          123456789L,
                          baskets.size(),
                          vectors.getEncoding(),
                          new SimilarityModel(vectors.getVectors(), vectors.getRatings()),
                          CoPurchaseMiner.mine(baskets, vectors.getRatings()));
  }

}
