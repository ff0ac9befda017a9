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

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import org.apache.mahout.cf.taste.impl.common.FastIDSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.SyncSummary;
import net.affinity.common.io.IOUtils;

/**
 * <p>Keeps the analytical snapshot as two compressed files in a {@code snapshot/} directory under the
 * local working directory:</p>
 *
 * <ul>
 *   <li>{@code products.tsv.gz}: one product per line</li>
 *   <li>{@code orderitems.tsv.gz}: one order line per line</li>
 * </ul>
 *
 * <p>A sync writes a complete new directory next to the current one and then moves it into place,
 * so the two files always come from the same sync. Syncs and loads exclude each other.</p>
 *
 * @since 1.0
 */
public final class LocalSnapshotStore implements SnapshotStore {

  private static final Logger log = LoggerFactory.getLogger(LocalSnapshotStore.class);

  static final String SNAPSHOT_DIR = "snapshot";
  static final String PRODUCTS_FILE = "products.tsv.gz";
  static final String ORDER_ITEMS_FILE = "orderitems.tsv.gz";

  private final File localDir;
  private final File snapshotDir;
  private final TransactionalStore transactionalStore;
  private final ReadWriteLock lock;

  /**
   * @param localDir local working directory
   * @param transactionalStore store to sync from; may be {@code null} if snapshots are only ever
   *  placed in {@code localDir} by other means
   */
  public LocalSnapshotStore(File localDir, TransactionalStore transactionalStore) {
    Preconditions.checkNotNull(localDir);
    this.localDir = localDir;
    this.snapshotDir = new File(localDir, SNAPSHOT_DIR);
    this.transactionalStore = transactionalStore;
    this.lock = new ReentrantReadWriteLock();
  }

  public File getSnapshotDir() {
    return snapshotDir;
  }

  @Override
  public synchronized SyncSummary sync() throws IOException {
    Preconditions.checkState(transactionalStore != null, "No transactional store configured");

    log.info("Syncing snapshot from transactional store");
    List<ProductRecord> products = transactionalStore.readProducts();
    List<OrderItem> items = transactionalStore.readOrderItems();
    FastIDSet orderIDs = new FastIDSet();
    for (OrderItem item : items) {
      orderIDs.add(item.getOrderID());
    }

    File stagingDir = new File(localDir, SNAPSHOT_DIR + ".staging-" + System.currentTimeMillis());
    if (!stagingDir.mkdirs()) {
      throw new IOException("Could not create " + stagingDir);
    }
    try {
      SnapshotFilesReader.writeProducts(products, new File(stagingDir, PRODUCTS_FILE));
      SnapshotFilesReader.writeOrderItems(items, new File(stagingDir, ORDER_ITEMS_FILE));
      swapIn(stagingDir);
    } finally {
      if (stagingDir.exists() && !IOUtils.deleteRecursively(stagingDir)) {
        log.warn("Could not delete {}", stagingDir);
      }
    }

    SyncSummary summary = new SyncSummary(products.size(), orderIDs.size(), items.size(), System.currentTimeMillis());
    log.info("Snapshot synced: {}", summary);
    return summary;
  }

  private void swapIn(File stagingDir) throws IOException {
    Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      File oldDir = null;
      if (snapshotDir.exists()) {
        oldDir = new File(localDir, SNAPSHOT_DIR + ".old-" + System.currentTimeMillis());
        Files.move(snapshotDir, oldDir);
      }
      try {
        Files.move(stagingDir, snapshotDir);
      } catch (IOException ioe) {
        if (oldDir != null) {
          Files.move(oldDir, snapshotDir);
        }
        throw ioe;
      }
      if (oldDir != null && !IOUtils.deleteRecursively(oldDir)) {
        log.warn("Could not delete old snapshot {}", oldDir);
      }
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public Snapshot load() throws SnapshotUnavailableException {
    Lock readLock = lock.readLock();
    readLock.lock();
    try {
      File productsFile = new File(snapshotDir, PRODUCTS_FILE);
      File orderItemsFile = new File(snapshotDir, ORDER_ITEMS_FILE);
      if (!productsFile.isFile() || !orderItemsFile.isFile()) {
        throw new SnapshotUnavailableException("No complete snapshot in " + snapshotDir);
      }
      log.info("Loading snapshot from {}", snapshotDir);
      List<ProductRecord> products;
      List<OrderItem> items;
      try {
        products = SnapshotFilesReader.readProducts(productsFile);
        items = SnapshotFilesReader.readOrderItems(orderItemsFile);
      } catch (IOException ioe) {
        throw new SnapshotUnavailableException("Could not read snapshot in " + snapshotDir, ioe);
      }
      if (products.isEmpty() && items.isEmpty()) {
        throw new SnapshotUnavailableException("Snapshot in " + snapshotDir + " is empty");
      }
      List<OrderBasket> baskets = OrderBasket.groupByOrder(items);
      log.info("Loaded snapshot of {} products and {} baskets", products.size(), baskets.size());
      return new Snapshot(products, baskets, productsFile.lastModified());
    } finally {
      readLock.unlock();
    }
  }

}
