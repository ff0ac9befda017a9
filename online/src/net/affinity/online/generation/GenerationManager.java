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

import java.io.Closeable;
import java.io.IOException;

import org.apache.mahout.cf.taste.common.Refreshable;

import net.affinity.common.GenerationSummary;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingException;
import net.affinity.common.TrainingStatus;

/**
 * An implementation of {@link GenerationManager} owns the live {@link Generation} and the training
 * runs that replace it. {@link #refresh(java.util.Collection)} starts a run in the background;
 * {@link #train()} runs one in the caller's thread.
 */
public interface GenerationManager extends Closeable, Refreshable {

  /**
   * @return the live {@link Generation}, or {@code null} if none has been built or loaded yet
   */
  Generation getCurrentGeneration();

  /**
   * Runs one training run to completion and makes its result live.
   *
   * @return summary of the new live generation
   * @throws TrainingException if the run fails, leaving the live generation as it was, or if another
   *  run is already in progress
   */
  GenerationSummary train() throws TrainingException;

  /**
   * Refreshes the analytical snapshot that training reads.
   *
   * @return counts of what was copied
   * @throws IOException if the transactional store can't be read or the snapshot can't be written
   * @throws IllegalStateException if no transactional store is configured
   */
  SyncSummary syncSnapshot() throws IOException;

  /**
   * @return current state of the training state machine
   */
  TrainingStatus getTrainingStatus();

}
