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

import com.google.common.base.Preconditions;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;

/**
 * Output of {@link FeatureVectorizer}: one vector and one rating per product, and the encoding that
 * produced the vectors.
 */
public final class FeatureVectors {

  private final FeatureEncoding encoding;
  private final FastByIDMap<float[]> vectors;
  private final FastByIDMap<Float> ratings;

  public FeatureVectors(FeatureEncoding encoding, FastByIDMap<float[]> vectors, FastByIDMap<Float> ratings) {
    Preconditions.checkNotNull(encoding);
    Preconditions.checkNotNull(vectors);
    Preconditions.checkNotNull(ratings);
    this.encoding = encoding;
    this.vectors = vectors;
    this.ratings = ratings;
  }

  public FeatureEncoding getEncoding() {
    return encoding;
  }

  public FastByIDMap<float[]> getVectors() {
    return vectors;
  }

  public FastByIDMap<Float> getRatings() {
    return ratings;
  }

  public int size() {
    return vectors.size();
  }

}
