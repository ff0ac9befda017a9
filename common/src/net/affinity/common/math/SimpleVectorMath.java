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

package net.affinity.common.math;

import org.apache.commons.math3.util.FastMath;

/**
 * Simple utility methods related to vectors represented as simple {@code float[]}s.
 *
 * @since 1.0
 */
public final class SimpleVectorMath {

  private SimpleVectorMath() {}

  /**
   * @return dot product of the two given arrays
   */
  public static double dot(float[] x, float[] y) {
    int length = x.length;
    double dot = 0.0;
    for (int i = 0; i < length; i++) {
      dot += x[i] * y[i];
    }
    return dot;
  }

  /**
   * @return the L2 norm of vector x
   */
  public static double norm(float[] x) {
    double total = 0.0;
    for (float f : x) {
      total += f * f;
    }
    return FastMath.sqrt(total);
  }

  /**
   * @return cosine of the angle between x and y, or 0 if either has zero length
   */
  public static double cosineSimilarity(float[] x, float[] y) {
    return cosineSimilarity(x, norm(x), y, norm(y));
  }

  /**
   * Like {@link #cosineSimilarity(float[], float[])} but with norms already computed by the caller.
   */
  public static double cosineSimilarity(float[] x, double xNorm, float[] y, double yNorm) {
    if (xNorm == 0.0 || yNorm == 0.0) {
      return 0.0;
    }
    return dot(x, y) / (xNorm * yNorm);
  }

}
