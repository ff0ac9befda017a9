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

package net.affinity.common;

import java.io.IOException;
import java.util.List;

import org.apache.mahout.cf.taste.common.NoSuchItemException;
import org.apache.mahout.cf.taste.common.Refreshable;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;

/**
 * <p>The operations of the recommendation engine: "similar to" and "bought with" lookups against the
 * live model generation, plus the triggers that refresh the analytical snapshot and train a new
 * generation.</p>
 *
 * <p>{@link #refresh(java.util.Collection)} starts a training run in the background and returns
 * immediately; {@link #train()} runs one and blocks until it completes.</p>
 */
public interface AffinityRecommender extends Refreshable {

  /**
   * @param productID product to find similar products for
   * @param howMany maximum number of results; clamped to a server-side maximum
   * @return products most similar in content to the given product, most similar first, never
   *  including the product itself
   * @throws NoSuchItemException if the product is not in the live generation
   * @throws NotReadyException if no generation has been trained yet
   * @throws IllegalArgumentException if {@code howMany} is not positive
   */
  List<RecommendedItem> getSimilar(long productID, int howMany) throws NoSuchItemException, NotReadyException;

  /**
   * @param productID product to find companions for
   * @param howMany maximum number of results; clamped to a server-side maximum
   * @return products most often bought together with the given product, strongest first. Empty if the
   *  product was never purchased
   * @throws NotReadyException if no generation has been trained yet
   * @throws IllegalArgumentException if {@code howMany} is not positive
   */
  List<RecommendedItem> getCoPurchased(long productID, int howMany) throws NotReadyException;

  /**
   * Runs a training run from the current analytical snapshot and blocks until it finishes.
   *
   * @return summary of the new live generation
   * @throws TrainingException if the run fails, or another is already in progress
   */
  GenerationSummary train() throws TrainingException;

  /**
   * Refreshes the analytical snapshot from the transactional store.
   *
   * @return counts of what was copied
   * @throws IOException if the transactional store can't be read or the snapshot can't be written
   * @throws IllegalStateException if no transactional store is configured
   */
  SyncSummary syncSnapshot() throws IOException;

  /**
   * @return true if a generation is live and queries can be answered
   */
  boolean isReady();

  /**
   * @return summary of the live generation, or {@code null} if there is none
   */
  GenerationSummary getGenerationSummary();

  /**
   * @return current state of the training state machine
   */
  TrainingStatus getTrainingStatus();

}
