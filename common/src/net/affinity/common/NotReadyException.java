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
 * Thrown when a request arrives before any model generation has finished training, and so nothing
 * can be served yet.
 */
public final class NotReadyException extends TasteException {

  public NotReadyException() {
  }

  public NotReadyException(String message) {
    super(message);
  }

}
