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

import java.io.IOException;

import net.affinity.common.SyncSummary;

/**
 * Holds the analytical snapshot that training reads. The snapshot is refreshed from a
 * {@link TransactionalStore} by {@link #sync()} and read by {@link #load()}; the two never
 * interleave, so a load always sees a complete snapshot.
 */
public interface SnapshotStore {

  /**
   * Copies the catalog and order history from the transactional store into a new snapshot,
   * replacing the previous one only once the new one is complete.
   *
   * @return counts of what was copied
   * @throws IOException if the store can't be read, or the snapshot can't be written
   * @throws IllegalStateException if no transactional store is configured
   */
  SyncSummary sync() throws IOException;

  /**
   * @return the current snapshot
   * @throws SnapshotUnavailableException if there is no snapshot, or it can't be read
   */
  Snapshot load() throws SnapshotUnavailableException;

}
