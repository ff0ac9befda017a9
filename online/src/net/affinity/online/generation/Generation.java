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

import com.google.common.base.Preconditions;

import net.affinity.common.GenerationSummary;
import net.affinity.online.copurchase.CoPurchaseModel;
import net.affinity.online.similarity.SimilarityModel;
import net.affinity.online.vectorizer.FeatureEncoding;

/**
 * <p>One generation of the recommendation model, the complete output of one training run:</p>
 *
 * <ul>
 *   <li>the feature encoding derived from the catalog</li>
 *   <li>the content similarity model over the catalog's products</li>
 *   <li>the co-purchase model mined from order baskets</li>
 * </ul>
 *
 * <p>A generation is never modified after it is built. A newer one replaces it as a whole.</p>
 *
 * @see GenerationManager
 */
public final class Generation {

  private final long generationID;
  private final long createdAt;
  private final int basketCount;
  private final FeatureEncoding encoding;
  private final SimilarityModel similarityModel;
  private final CoPurchaseModel coPurchaseModel;

  public Generation(long generationID,
                    long createdAt,
                    int basketCount,
                    FeatureEncoding encoding,
                    SimilarityModel similarityModel,
                    CoPurchaseModel coPurchaseModel) {
    Preconditions.checkArgument(generationID > 0, "generationID must be positive: %s", generationID);
    Preconditions.checkArgument(basketCount >= 0, "basketCount must not be negative: %s", basketCount);
    Preconditions.checkNotNull(encoding);
    Preconditions.checkNotNull(similarityModel);
    Preconditions.checkNotNull(coPurchaseModel);
    this.generationID = generationID;
    this.createdAt = createdAt;
    this.basketCount = basketCount;
    this.encoding = encoding;
    this.similarityModel = similarityModel;
    this.coPurchaseModel = coPurchaseModel;
  }

  public long getGenerationID() {
    return generationID;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public int getBasketCount() {
    return basketCount;
  }

  public FeatureEncoding getEncoding() {
    return encoding;
  }

  public SimilarityModel getSimilarityModel() {
    return similarityModel;
  }

  public CoPurchaseModel getCoPurchaseModel() {
    return coPurchaseModel;
  }

  public int getProductCount() {
    return similarityModel.size();
  }

  public GenerationSummary getSummary() {
    return new GenerationSummary(generationID,
                                 createdAt,
                                 getProductCount(),
                                 basketCount,
                                 encoding.getDimension(),
                                 coPurchaseModel.getPairCount());
  }

  @Override
  public String toString() {
    return getSummary().toString();
  }

}
