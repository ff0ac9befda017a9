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

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.impl.common.LongPrimitiveIterator;

import net.affinity.common.io.IOUtils;
import net.affinity.online.copurchase.CoPurchaseModel;
import net.affinity.online.similarity.SimilarityModel;
import net.affinity.online.vectorizer.FeatureEncoding;

/**
 * <p>Writes a {@link Generation} to a gzipped binary file and reads it back, exactly. The layout, in
 * {@link DataOutputStream} encoding, is:</p>
 *
 * <ol>
 *   <li>magic {@code AFFM}, then the format version</li>
 *   <li>generation ID, creation time, product count, basket count</li>
 *   <li>the feature encoding: category and brand vocabularies, price and rating ranges</li>
 *   <li>feature dimension, then per product: ID, rating, vector</li>
 *   <li>per purchased product: ID, support, companion count, then companion ID and strength pairs</li>
 * </ol>
 *
 * <p>Precomputed similarity neighbors are not stored; they are rebuilt on reading if wanted.</p>
 */
public final class GenerationSerializer {

  private static final int MAGIC = ('A' << 24) | ('F' << 16) | ('F' << 8) | 'M';
  private static final int FORMAT_VERSION = 1;

  private GenerationSerializer() {
  }

  /**
   * @param generation {@link Generation} to serialize
   * @param f file to write; must end in .gz
   */
  public static void writeGeneration(Generation generation, File f) throws IOException {
    Preconditions.checkArgument(f.getName().endsWith(".gz"), "File should end in .gz: %s", f);
    DataOutputStream out = new DataOutputStream(IOUtils.buildGZIPOutputStream(f));
    try {
      out.writeInt(MAGIC);
      out.writeInt(FORMAT_VERSION);
      out.writeLong(generation.getGenerationID());
      out.writeLong(generation.getCreatedAt());
      out.writeInt(generation.getProductCount());
      out.writeInt(generation.getBasketCount());
      writeEncoding(generation.getEncoding(), out);
      writeProducts(generation.getSimilarityModel(), generation.getEncoding().getDimension(), out);
      writeCoPurchases(generation.getCoPurchaseModel(), out);
    } finally {
      out.close();
    }
  }

  /**
   * @param f file to read
   * @param cacheTopK number of similarity neighbors to precompute per product, or 0 for none
   * @return {@link Generation} it holds
   * @throws IOException if the file can't be read or isn't a valid model file
   */
  public static Generation readGeneration(File f, int cacheTopK) throws IOException {
    DataInputStream in = new DataInputStream(IOUtils.openMaybeDecompressing(f));
    try {
      if (in.readInt() != MAGIC) {
        throw new IOException("Not a model file: " + f);
      }
      int version = in.readInt();
      if (version != FORMAT_VERSION) {
        throw new IOException("Unsupported model format version " + version + " in " + f);
      }
      long generationID = in.readLong();
      long createdAt = in.readLong();
      int productCount = in.readInt();
      int basketCount = in.readInt();
      FeatureEncoding encoding = readEncoding(in);
      int dimension = in.readInt();
      if (dimension != encoding.getDimension()) {
        throw new IOException("Dimension " + dimension + " doesn't match encoding " + encoding);
      }
      FastByIDMap<float[]> vectors = new FastByIDMap<float[]>(productCount);
      FastByIDMap<Float> ratings = new FastByIDMap<Float>(productCount);
      for (int i = 0; i < productCount; i++) {
        long id = in.readLong();
        ratings.put(id, in.readFloat());
        float[] vector = new float[dimension];
        for (int j = 0; j < dimension; j++) {
          vector[j] = in.readFloat();
        }
        vectors.put(id, vector);
      }
      CoPurchaseModel coPurchaseModel = readCoPurchases(in);
      SimilarityModel similarityModel;
      try {
        similarityModel = SimilarityModel.build(vectors, ratings, cacheTopK);
      } catch (ExecutionException ee) {
        throw new IOException("Could not rebuild similarity neighbors", ee.getCause());
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while rebuilding similarity neighbors");
      }
      return new Generation(generationID, createdAt, basketCount, encoding, similarityModel, coPurchaseModel);
    } finally {
      in.close();
    }
  }

  private static void writeEncoding(FeatureEncoding encoding, DataOutputStream out) throws IOException {
    writeStrings(encoding.getCategories(), out);
    writeStrings(encoding.getBrands(), out);
    out.writeDouble(encoding.getMinPrice());
    out.writeDouble(encoding.getMaxPrice());
    out.writeDouble(encoding.getMinRating());
    out.writeDouble(encoding.getMaxRating());
  }

  private static FeatureEncoding readEncoding(DataInputStream in) throws IOException {
    List<String> categories = readStrings(in);
    List<String> brands = readStrings(in);
    double minPrice = in.readDouble();
    double maxPrice = in.readDouble();
    double minRating = in.readDouble();
    double maxRating = in.readDouble();
    try {
      return new FeatureEncoding(categories, brands, minPrice, maxPrice, minRating, maxRating);
    } catch (IllegalArgumentException iae) {
      throw new IOException("Invalid encoding", iae);
    }
  }

  private static void writeStrings(List<String> values, DataOutputStream out) throws IOException {
    out.writeInt(values.size());
    for (String value : values) {
      out.writeUTF(value);
    }
  }

  private static List<String> readStrings(DataInputStream in) throws IOException {
    int count = in.readInt();
    List<String> values = Lists.newArrayListWithCapacity(count);
    for (int i = 0; i < count; i++) {
      values.add(in.readUTF());
    }
    return values;
  }

  private static void writeProducts(SimilarityModel model, int dimension, DataOutputStream out) throws IOException {
    out.writeInt(dimension);
    FastByIDMap<float[]> vectors = model.getVectors();
    FastByIDMap<Float> ratings = model.getRatings();
    LongPrimitiveIterator it = vectors.keySetIterator();
    while (it.hasNext()) {
      long id = it.nextLong();
      out.writeLong(id);
      out.writeFloat(ratings.get(id));
      for (float f : vectors.get(id)) {
        out.writeFloat(f);
      }
    }
  }

  private static void writeCoPurchases(CoPurchaseModel model, DataOutputStream out) throws IOException {
    FastByIDMap<CoPurchaseModel.Companions> companionsByAnchor = model.getCompanionsByAnchor();
    out.writeInt(companionsByAnchor.size());
    for (Map.Entry<Long,CoPurchaseModel.Companions> entry : companionsByAnchor.entrySet()) {
      CoPurchaseModel.Companions companions = entry.getValue();
      out.writeLong(entry.getKey());
      out.writeInt(companions.getSupport());
      long[] productIDs = companions.getProductIDs();
      float[] strengths = companions.getStrengths();
      out.writeInt(productIDs.length);
      for (int i = 0; i < productIDs.length; i++) {
        out.writeLong(productIDs[i]);
        out.writeFloat(strengths[i]);
      }
    }
  }

  private static CoPurchaseModel readCoPurchases(DataInputStream in) throws IOException {
    int anchorCount = in.readInt();
    FastByIDMap<CoPurchaseModel.Companions> companionsByAnchor =
        new FastByIDMap<CoPurchaseModel.Companions>(anchorCount);
    for (int i = 0; i < anchorCount; i++) {
      long anchorID = in.readLong();
      int support = in.readInt();
      int count = in.readInt();
      long[] productIDs = new long[count];
      float[] strengths = new float[count];
      for (int j = 0; j < count; j++) {
        productIDs[j] = in.readLong();
        strengths[j] = in.readFloat();
      }
      companionsByAnchor.put(anchorID, new CoPurchaseModel.Companions(support, productIDs, strengths));
    }
    return new CoPurchaseModel(companionsByAnchor);
  }

}
