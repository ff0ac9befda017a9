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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.affinity.common.AffinityTest;
import net.affinity.common.TrainingState;
import net.affinity.online.snapshot.ProductRecord;

public final class FeatureVectorizerTest extends AffinityTest {

  private static final List<ProductRecord> CATALOG = Arrays.asList(
      new ProductRecord(1L, "shoes", "acme", 100.0, 4.5f, 3),
      new ProductRecord(2L, "hats", "acme", 300.0, 3.5f, 0),
      new ProductRecord(3L, "shoes", "zenith", 200.0, 2.5f, 7),
      new ProductRecord(4L, null, null, null, null, 1));

  @Test
  public void testEncoding() throws Exception {
    FeatureEncoding encoding = FeatureVectorizer.deriveEncoding(CATALOG);
    assertEquals(Arrays.asList("hats", "shoes"), encoding.getCategories());
    assertEquals(Arrays.asList("acme", "zenith"), encoding.getBrands());
    assertEquals(6, encoding.getDimension());
    // missing price reads as 0
    assertEquals(0.0, encoding.getMinPrice());
    assertEquals(300.0, encoding.getMaxPrice());
    assertEquals(2.5, encoding.getMinRating());
    assertEquals(4.5, encoding.getMaxRating());
  }

  @Test
  public void testVectors() throws Exception {
    FeatureVectors vectors = FeatureVectorizer.vectorize(CATALOG);
    assertEquals(4, vectors.size());
    assertArrayEquals(new float[] {0.0f, 1.0f, 1.0f, 0.0f, 1.0f / 3.0f, 1.0f},
                      vectors.getVectors().get(1L));
    assertArrayEquals(new float[] {1.0f, 0.0f, 1.0f, 0.0f, 1.0f, 0.5f},
                      vectors.getVectors().get(2L));
    assertArrayEquals(new float[] {0.0f, 1.0f, 0.0f, 1.0f, 2.0f / 3.0f, 0.0f},
                      vectors.getVectors().get(3L));
    assertArrayEquals(new float[] {0.0f, 0.0f, 0.0f, 0.0f, 0.0f, 0.25f},
                      vectors.getVectors().get(4L));
    assertEquals(ProductRecord.DEFAULT_RATING, vectors.getRatings().get(4L).floatValue());
  }

  @Test
  public void testSameDimensionEverywhere() throws Exception {
    FeatureVectors vectors = FeatureVectorizer.vectorize(CATALOG);
    int dimension = vectors.getEncoding().getDimension();
    for (ProductRecord product : CATALOG) {
      assertEquals(dimension, vectors.getVectors().get(product.getID()).length);
    }
  }

  @Test
  public void testDegenerateRange() throws Exception {
    List<ProductRecord> catalog = Arrays.asList(
        new ProductRecord(1L, "a", "b", 50.0, 4.0f, 1),
        new ProductRecord(2L, "a", "b", 50.0, 4.0f, 1));
    FeatureVectors vectors = FeatureVectorizer.vectorize(catalog);
    assertArrayEquals(new float[] {1.0f, 1.0f, 0.0f, 0.0f}, vectors.getVectors().get(1L));
    assertArrayEquals(vectors.getVectors().get(1L), vectors.getVectors().get(2L));
  }

  @Test
  public void testReencodeUnknownValues() throws Exception {
    FeatureEncoding encoding = FeatureVectorizer.deriveEncoding(CATALOG);
    float[] vector = encoding.encode(new ProductRecord(9L, "gloves", "acme", 900.0, 1.0f, 0));
    assertArrayEquals(new float[] {0.0f, 0.0f, 1.0f, 0.0f, 1.0f, 0.0f}, vector);
  }

  @Test
  public void testEmptyCatalog() {
    try {
      FeatureVectorizer.vectorize(Collections.<ProductRecord>emptyList());
      fail();
    } catch (EmptyCatalogException ece) {
      assertEquals(TrainingState.VECTORIZING, ece.getFailedIn());
    }
  }

  @Test
  public void testDeterministic() throws Exception {
    FeatureVectors first = FeatureVectorizer.vectorize(CATALOG);
    List<ProductRecord> reversed = Arrays.asList(CATALOG.get(3), CATALOG.get(2), CATALOG.get(1), CATALOG.get(0));
    FeatureVectors second = FeatureVectorizer.vectorize(reversed);
    for (ProductRecord product : CATALOG) {
      assertArrayEquals(first.getVectors().get(product.getID()), second.getVectors().get(product.getID()));
    }
  }

}
