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

package net.affinity.online.snapshot;

import net.affinity.common.TrainingException;
import net.affinity.common.TrainingState;

/**
 * Thrown when the analytical snapshot is missing or can't be read.
 */
public final class SnapshotUnavailableException extends TrainingException {

  public SnapshotUnavailableException(String message) {
    super(TrainingState.SYNCING, message);
  }

  public SnapshotUnavailableException(String message, Throwable cause) {
    super(TrainingState.SYNCING, message, cause);
  }

}
