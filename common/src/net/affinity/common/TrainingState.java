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

/**
 * Steps of a training run. A run moves forward through these in declaration order from
 * {@link #IDLE} to {@link #READY}; {@link #FAILED} may follow any step.
 */
public enum TrainingState {

  IDLE,
  /** Loading the analytical snapshot. */
  SYNCING,
  VECTORIZING,
  COMPUTING_SIMILARITY,
  COMPUTING_COPURCHASE,
  PERSISTING,
  READY,
  FAILED;

  /**
   * @return true if a run in this state is still in progress
   */
  public boolean isRunning() {
    return this != IDLE && this != READY && this != FAILED;
  }

}
