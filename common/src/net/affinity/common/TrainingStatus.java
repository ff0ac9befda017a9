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

import com.google.common.base.Preconditions;

/**
 * Point-in-time view of the training state machine.
 */
public final class TrainingStatus {

  private final TrainingState state;
  private final TrainingState failedIn;
  private final String lastFailure;
  private final long since;

  public TrainingStatus(TrainingState state, TrainingState failedIn, String lastFailure, long since) {
    Preconditions.checkNotNull(state);
    this.state = state;
    this.failedIn = failedIn;
    this.lastFailure = lastFailure;
    this.since = since;
  }

  /**
   * @return current state
   */
  public TrainingState getState() {
    return state;
  }

  /**
   * @return the step in which the most recent failed run failed, or {@code null} if none has failed
   */
  public TrainingState getFailedIn() {
    return failedIn;
  }

  /**
   * @return message of the most recent failure, or {@code null} if none has failed
   */
  public String getLastFailure() {
    return lastFailure;
  }

  /**
   * @return time of the last state transition, in milliseconds since the epoch
   */
  public long getSince() {
    return since;
  }

  @Override
  public String toString() {
    return state + (failedIn == null ? "" : " (last failure in " + failedIn + ": " + lastFailure + ')');
  }

}
