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

package net.affinity.online;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Preconditions;
import org.apache.mahout.cf.taste.common.NoSuchItemException;
import org.apache.mahout.cf.taste.common.Refreshable;
import org.apache.mahout.cf.taste.recommender.RecommendedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.AffinityRecommender;
import net.affinity.common.ClassUtils;
import net.affinity.common.GenerationSummary;
import net.affinity.common.LangUtils;
import net.affinity.common.NotReadyException;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingException;
import net.affinity.common.TrainingStatus;
import net.affinity.online.generation.Generation;
import net.affinity.online.generation.GenerationManager;
import net.affinity.online.snapshot.TransactionalStore;

/**
 * <p>The core implementation of {@link AffinityRecommender} that lies inside the Serving Layer.</p>
 *
 * <p>Each query reads the live {@link Generation} once, up front, and answers entirely from it, so a
 * generation swapped in mid-query never mixes into the result. Queries never block on training.</p>
 */
public final class ServerRecommender implements AffinityRecommender, Closeable {

  private static final Logger log = LoggerFactory.getLogger(ServerRecommender.class);

  private static final String GENERATION_MANAGER_CLASS = "net.affinity.online.generation.DelegateGenerationManager";

  private final GenerationManager generationManager;
  private final int maxHowMany;

  /**
   * @param localInputDir local snapshot and model file directory
   * @param transactionalStore store to sync snapshots from; may be {@code null}, in which case
   *  training only works from a snapshot already in {@code localInputDir}
   */
  public ServerRecommender(File localInputDir, TransactionalStore transactionalStore) {
    this(ClassUtils.loadInstanceOf(GENERATION_MANAGER_CLASS,
                                   GenerationManager.class,
                                   new Class<?>[] { File.class, TransactionalStore.class },
                                   new Object[] { checkDir(localInputDir), transactionalStore }));
  }

  public ServerRecommender(GenerationManager generationManager) {
    Preconditions.checkNotNull(generationManager);
    this.generationManager = generationManager;
    this.maxHowMany = LangUtils.getIntProperty("serving.maxHowMany", 50);
    Preconditions.checkArgument(maxHowMany > 0, "serving.maxHowMany must be positive: %s", maxHowMany);
    log.info("Serving at most {} results per query", maxHowMany);
  }

  private static File checkDir(File localInputDir) {
    Preconditions.checkNotNull(localInputDir, "No local dir");
    log.info("Creating ServerRecommender with local input dir {}", localInputDir);
    return localInputDir;
  }

  public GenerationManager getGenerationManager() {
    return generationManager;
  }

  /**
   * @return largest number of results any query returns
   */
  public int getMaxHowMany() {
    return maxHowMany;
  }

  /**
   * Starts a training run in the background, if one isn't already running.
   */
  @Override
  public void refresh(Collection<Refreshable> alreadyRefreshed) {
    generationManager.refresh(alreadyRefreshed);
  }

  @Override
  public void close() throws IOException {
    generationManager.close();
  }

  /**
   * @throws NotReadyException if {@link GenerationManager#getCurrentGeneration()} returns null
   */
  private Generation getCurrentGeneration() throws NotReadyException {
    Generation generation = generationManager.getCurrentGeneration();
    if (generation == null) {
      throw new NotReadyException("No model generation has been trained yet");
    }
    return generation;
  }

  private int clampHowMany(int howMany) {
    Preconditions.checkArgument(howMany > 0, "howMany must be positive: %s", howMany);
    return Math.min(howMany, maxHowMany);
  }

  @Override
  public List<RecommendedItem> getSimilar(long productID, int howMany)
      throws NoSuchItemException, NotReadyException {
    int clamped = clampHowMany(howMany);
    Generation generation = getCurrentGeneration();
    return generation.getSimilarityModel().mostSimilar(productID, clamped);
  }

  @Override
  public List<RecommendedItem> getCoPurchased(long productID, int howMany) throws NotReadyException {
    int clamped = clampHowMany(howMany);
    Generation generation = getCurrentGeneration();
    return generation.getCoPurchaseModel().getCoPurchased(productID, clamped);
  }

  @Override
  public GenerationSummary train() throws TrainingException {
    return generationManager.train();
  }

  @Override
  public SyncSummary syncSnapshot() throws IOException {
    return generationManager.syncSnapshot();
  }

  @Override
  public boolean isReady() {
    return generationManager.getCurrentGeneration() != null;
  }

  @Override
  public GenerationSummary getGenerationSummary() {
    Generation generation = generationManager.getCurrentGeneration();
    return generation == null ? null : generation.getSummary();
  }

  @Override
  public TrainingStatus getTrainingStatus() {
    return generationManager.getTrainingStatus();
  }

}
