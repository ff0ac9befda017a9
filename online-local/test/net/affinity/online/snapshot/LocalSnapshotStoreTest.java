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
import java.io.Writer;
import java.util.List;

import org.junit.Test;

import net.affinity.common.AffinityTest;
import net.affinity.common.SyncSummary;
import net.affinity.common.TrainingState;
import net.affinity.common.io.IOUtils;

public final class LocalSnapshotStoreTest extends AffinityTest {

  @Test
  public void testSyncThenLoad() throws Exception {
    MemoryTransactionalStore store = new MemoryTransactionalStore()
        .addProduct(1L, "shoes", "acme", 99.5, 4.5f)
        .addProduct(2L, "tab\there", null, 10.0, 3.0f)
        .addOrder(100L, 1L, 2L)
        .addOrder(101L, 1L);
    LocalSnapshotStore snapshotStore = new LocalSnapshotStore(getTestTempDir(), store);
    SyncSummary summary = snapshotStore.sync();
    assertEquals(2, summary.getProducts());
    assertEquals(2, summary.getOrders());
    assertEquals(3, summary.getOrderItems());

    Snapshot snapshot = snapshotStore.load();
    List<ProductRecord> products = snapshot.getProducts();
    assertEquals(2, products.size());
    assertEquals(1L, products.get(0).getID());
    assertEquals("shoes", products.get(0).getCategory());
    assertEquals(99.5, products.get(0).getPrice());
    assertEquals(4.5f, products.get(0).getRating());
    assertEquals("tab here", products.get(1).getCategory());
    assertNull(products.get(1).getBrand());
    assertEquals(2, snapshot.getBaskets().size());
    assertEquals(2, snapshot.getBaskets().get(0).size());

    // no staging or old directories left behind
    String[] names = getTestTempDir().list();
    assertEquals(1, names.length);
    assertEquals(LocalSnapshotStore.SNAPSHOT_DIR, names[0]);
  }

  @Test
  public void testResyncReplaces() throws Exception {
    MemoryTransactionalStore store = new MemoryTransactionalStore()
        .addProduct(1L, "shoes", "acme", 99.5, 4.5f)
        .addOrder(100L, 1L);
    LocalSnapshotStore snapshotStore = new LocalSnapshotStore(getTestTempDir(), store);
    snapshotStore.sync();
    store.addProduct(2L, "hats", "acme", 20.0, 4.0f);
    snapshotStore.sync();
    assertEquals(2, snapshotStore.load().getProducts().size());
  }

  @Test
  public void testFailedSyncKeepsPrevious() throws Exception {
    MemoryTransactionalStore store = new MemoryTransactionalStore()
        .addProduct(1L, "shoes", "acme", 99.5, 4.5f)
        .addOrder(100L, 1L);
    LocalSnapshotStore snapshotStore = new LocalSnapshotStore(getTestTempDir(), store);
    snapshotStore.sync();
    store.setFailing(true);
    try {
      snapshotStore.sync();
      fail();
    } catch (IOException ioe) {
      // good
    }
    assertEquals(1, snapshotStore.load().getProducts().size());
  }

  @Test
  public void testNoSnapshot() {
    LocalSnapshotStore snapshotStore = new LocalSnapshotStore(getTestTempDir(), null);
    try {
      snapshotStore.load();
      fail();
    } catch (SnapshotUnavailableException sue) {
      assertEquals(TrainingState.SYNCING, sue.getFailedIn());
    }
  }

  @Test
  public void testEmptySnapshotUnavailable() throws Exception {
    LocalSnapshotStore snapshotStore = new LocalSnapshotStore(getTestTempDir(), new MemoryTransactionalStore());
    SyncSummary summary = snapshotStore.sync();
    assertEquals(0, summary.getProducts());
    try {
      snapshotStore.load();
      fail();
    } catch (SnapshotUnavailableException sue) {
      assertEquals(TrainingState.SYNCING, sue.getFailedIn());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testNoTransactionalStore() throws Exception {
    new LocalSnapshotStore(getTestTempDir(), null).sync();
  }

  @Test
  public void testBadLinesSkipped() throws Exception {
    File snapshotDir = new File(getTestTempDir(), LocalSnapshotStore.SNAPSHOT_DIR);
    assertTrue(snapshotDir.mkdirs());
    write(new File(snapshotDir, LocalSnapshotStore.PRODUCTS_FILE),
          "id\tcategory\tbrand\tprice\trating\tstock\n" +
          "1\tshoes\tacme\t10.0\t4.0\t1\n" +
          "x\tbroken\n" +
          "# comment\n" +
          "\n" +
          "2\thats\t\t\t\t\n" +
          "3\tsocks\tacme\tNaN\t4.0\t1\n");
    write(new File(snapshotDir, LocalSnapshotStore.ORDER_ITEMS_FILE), "1\t1\t1\n1\t2\n2\n");
    Snapshot snapshot = new LocalSnapshotStore(getTestTempDir(), null).load();
    assertEquals(2, snapshot.getProducts().size());
    ProductRecord hats = snapshot.getProducts().get(1);
    assertEquals(0.0, hats.getPrice());
    assertEquals(ProductRecord.DEFAULT_RATING, hats.getRating());
    assertEquals(1, snapshot.getBaskets().size());
    assertEquals(2, snapshot.getBaskets().get(0).size());
  }

  @Test
  public void testTooManyBadLines() throws Exception {
    File snapshotDir = new File(getTestTempDir(), LocalSnapshotStore.SNAPSHOT_DIR);
    assertTrue(snapshotDir.mkdirs());
    StringBuilder products = new StringBuilder();
    for (int i = 0; i < 200; i++) {
      products.append(i).append("\tshoes\n");
    }
    write(new File(snapshotDir, LocalSnapshotStore.PRODUCTS_FILE), products.toString());
    write(new File(snapshotDir, LocalSnapshotStore.ORDER_ITEMS_FILE), "1\t1\t1\n");
    try {
      new LocalSnapshotStore(getTestTempDir(), null).load();
      fail();
    } catch (SnapshotUnavailableException sue) {
      assertTrue(sue.getCause() instanceof IOException);
    }
  }

  private static void write(File file, String content) throws IOException {
    Writer out = IOUtils.buildGZIPWriter(file);
    try {
      out.write(content);
    } finally {
      out.close();
    }
  }

}
