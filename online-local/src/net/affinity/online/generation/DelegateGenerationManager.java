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
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import org.apache.mahout.cf.taste.common.Refreshable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.GenerationSummary;
import net.affinity.common.LangUtils;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingException;
import net.affinity.common.TrainingState;
import net.affinity.common.TrainingStatus;
import net.affinity.common.parallel.ExecutorUtils;
import net.affinity.online.copurchase.CoPurchaseMiner;
import net.affinity.online.copurchase.CoPurchaseModel;
import net.affinity.online.similarity.SimilarityModel;
import net.affinity.online.snapshot.LocalSnapshotStore;
import net.affinity.online.snapshot.Snapshot;
import net.affinity.online.snapshot.SnapshotStore;
import net.affinity.online.snapshot.TransactionalStore;
import net.affinity.online.vectorizer.FeatureVectorizer;
import net.affinity.online.vectorizer.FeatureVectors;

/**
 * <p>Manages generations of the recommendation model on the local machine. The analytical snapshot
 * and the model file {@code model.bin.gz} both live in the local working directory.</p>
 *
 * <p>A training run steps through {@link TrainingState#SYNCING}, {@link TrainingState#VECTORIZING},
 * {@link TrainingState#COMPUTING_SIMILARITY}, {@link TrainingState#COMPUTING_COPURCHASE} and
 * {@link TrainingState#PERSISTING}, and only then swaps the new generation in. A run that fails at
 * any step leaves the live generation alone. At most one run happens at a time.</p>
 *
 * <p>On startup the last persisted generation, if any, is loaded and served right away.</p>
 *
 * @since 1.0
 */
public final class DelegateGenerationManager implements GenerationManager {

  private static final Logger log = LoggerFactory.getLogger(DelegateGenerationManager.class);

  static final String MODEL_FILE = "model.bin.gz";

  private final File modelFile;
  private final SnapshotStore snapshotStore;
  private final int cacheTopK;
  private final AtomicReference<Generation> currentGeneration;
  private final ExecutorService refreshExecutor;
  private final Semaphore trainingSemaphore;
  private volatile TrainingStatus status;

  /**
   * @param localInputDir local working directory holding the analytical snapshot and the model file
   * @param transactionalStore store to sync snapshots from; may be {@code null}
   */
  public DelegateGenerationManager(File localInputDir, TransactionalStore transactionalStore) throws IOException {
    this(localInputDir, new LocalSnapshotStore(localInputDir, transactionalStore));
  }

  public DelegateGenerationManager(File localInputDir, SnapshotStore snapshotStore) throws IOException {
    Preconditions.checkNotNull(snapshotStore);
    log.info("Using local computation, and data in {}", localInputDir);
    if (!localInputDir.exists() || !localInputDir.isDirectory()) {
      throw new FileNotFoundException(localInputDir.toString());
    }
    this.modelFile = new File(localInputDir, MODEL_FILE);
    this.snapshotStore = snapshotStore;
    this.cacheTopK = LangUtils.getIntProperty("model.similarity.cacheTopK", 0);
    Preconditions.checkArgument(cacheTopK >= 0, "Bad model.similarity.cacheTopK: %s", cacheTopK);
    this.currentGeneration = new AtomicReference<Generation>();
    this.refreshExecutor = ExecutorUtils.newDaemonPool("DelegateGenerationManager", 1);
    this.trainingSemaphore = new Semaphore(1);

    Generation loaded = modelFile.exists() ? readModel() : null;
    currentGeneration.set(loaded);
    status = new TrainingStatus(loaded == null ? TrainingState.IDLE : TrainingState.READY,
                                null,
                                null,
                                System.currentTimeMillis());
  }

  @Override
  public Generation getCurrentGeneration() {
    return currentGeneration.get();
  }

  @Override
  public TrainingStatus getTrainingStatus() {
    return status;
  }

  @Override
  public SyncSummary syncSnapshot() throws IOException {
    return snapshotStore.sync();
  }

  @Override
  public GenerationSummary train() throws TrainingException {
    if (!trainingSemaphore.tryAcquire()) {
      throw new TrainingInProgressException(status.getState());
    }
    try {
      return doTrain();
    } finally {
      trainingSemaphore.release();
    }
  }

  /**
   * Starts a training run in the background, unless one is already running.
   */
  @Override
  public void refresh(Collection<Refreshable> alreadyRefreshed) {
    if (trainingSemaphore.tryAcquire()) {
      try {
        refreshExecutor.submit(new TrainCallable());
      } catch (RuntimeException re) {
        trainingSemaphore.release();
        throw re;
      }
    } else {
      log.info("Training already in progress");
    }
  }

  @Override
  public void close() {
    ExecutorUtils.shutdownNowAndAwait(refreshExecutor);
  }

  private GenerationSummary doTrain() throws TrainingException {
    long start = System.currentTimeMillis();
    try {

      transition(TrainingState.SYNCING);
      Snapshot snapshot = snapshotStore.load();

      transition(TrainingState.VECTORIZING);
      FeatureVectors vectors = FeatureVectorizer.vectorize(snapshot.getProducts());

      transition(TrainingState.COMPUTING_SIMILARITY);
      SimilarityModel similarityModel = buildSimilarityModel(vectors);

      transition(TrainingState.COMPUTING_COPURCHASE);
      CoPurchaseModel coPurchaseModel = CoPurchaseMiner.mine(snapshot.getBaskets(), vectors.getRatings());

      Generation previous = currentGeneration.get();
      long generationID = previous == null ? 1L : previous.getGenerationID() + 1;
      Generation generation = new Generation(generationID,
                                             System.currentTimeMillis(),
                                             snapshot.getBaskets().size(),
                                             vectors.getEncoding(),
                                             similarityModel,
                                             coPurchaseModel);

      transition(TrainingState.PERSISTING);
      try {
        saveModel(generation, modelFile);
      } catch (IOException ioe) {
        throw new TrainingException(TrainingState.PERSISTING, "Could not persist model", ioe);
      }

      currentGeneration.set(generation);
      transition(TrainingState.READY);
      log.info("{} is live, trained in {}ms", generation, System.currentTimeMillis() - start);
      return generation.getSummary();

    } catch (TrainingException te) {
      recordFailure(te.getFailedIn(), te);
      throw te;
    } catch (RuntimeException re) {
      TrainingState failedIn = status.getState();
      recordFailure(failedIn, re);
      throw new TrainingException(failedIn, "Unexpected failure while " + failedIn, re);
    }
  }

  private SimilarityModel buildSimilarityModel(FeatureVectors vectors) throws TrainingException {
    try {
      return SimilarityModel.build(vectors.getVectors(), vectors.getRatings(), cacheTopK);
    } catch (ExecutionException ee) {
      throw new TrainingException(TrainingState.COMPUTING_SIMILARITY,
                                  "Could not compute similarity neighbors",
                                  ee.getCause());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new TrainingException(TrainingState.COMPUTING_SIMILARITY, "Interrupted", ie);
    }
  }

  private void transition(TrainingState state) {
    TrainingStatus previous = status;
    status = new TrainingStatus(state, previous.getFailedIn(), previous.getLastFailure(), System.currentTimeMillis());
    log.info("Training: {}", state);
  }

  private void recordFailure(TrainingState failedIn, Exception e) {
    status = new TrainingStatus(TrainingState.FAILED, failedIn, e.getMessage(), System.currentTimeMillis());
    log.warn("Training failed while {}; live generation unchanged", failedIn, e);
  }

  /**
   * Reads the persisted model, or returns null if it can't be read.
   *
   * @see #saveModel(Generation, File)
   */
  private Generation readModel() {
    log.info("Reading model from {}", modelFile);
    try {
      Generation generation = GenerationSerializer.readGeneration(modelFile, cacheTopK);
      log.info("Loaded {}", generation);
      return generation;
    } catch (IOException ioe) {
      log.warn("Model file was not readable; ignoring it", ioe);
    } catch (RuntimeException re) {
      log.warn("Model file was not valid; ignoring it", re);
    }
    return null;
  }

  /**
   * Saves a model (as a {@link Generation}) to a temporary file, then moves it into place.
   *
   * @see #readModel()
   */
  private static void saveModel(Generation generation, File modelFile) throws IOException {

    File newModelFile = new File(modelFile.getParentFile(), "." + modelFile.getName() + ".tmp.gz");
    log.info("Writing model to {}", newModelFile);

    try {
      GenerationSerializer.writeGeneration(generation, newModelFile);
    } catch (IOException ioe) {
      if (newModelFile.exists() && !newModelFile.delete()) {
        log.warn("Could not delete {}", newModelFile);
      }
      throw ioe;
    }

    log.info("Done, moving into place at {}", modelFile);
    if (modelFile.exists() && !modelFile.delete()) {
      log.warn("Could not delete old {}", modelFile);
    }
    Files.move(newModelFile, modelFile);
  }

  private final class TrainCallable implements Callable<Void> {
    @Override
    public Void call() {
      try {
        doTrain();
      } catch (TrainingException te) {
        // Already recorded in status
        log.info("Background training run did not complete: {}", te.getMessage());
      } catch (Throwable t) {
        log.warn("Unexpected error while training", t);
      } finally {
        trainingSemaphore.release();
      }
      return null;
    }
  }

}
