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

import org.apache.mahout.cf.taste.common.TasteException;

/**
 * Superclass of failures that abort a training run. The live generation, if any, is never affected
 * by one of these.
 */
public class TrainingException extends TasteException {

  private final TrainingState failedIn;

  public TrainingException(TrainingState failedIn, String message) {
    super(message);
    this.failedIn = failedIn;
  }

  public TrainingException(TrainingState failedIn, String message, Throwable cause) {
    super(message, cause);
    this.failedIn = failedIn;
  }

  /**
   * @return the step that was running when the failure happened
   */
  public final TrainingState getFailedIn() {
    return failedIn;
  }

}
