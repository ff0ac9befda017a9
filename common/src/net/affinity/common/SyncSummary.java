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
 * Counts of what one snapshot sync copied from the transactional store.
 */
public final class SyncSummary {

  private final int products;
  private final int orders;
  private final int orderItems;
  private final long syncedAt;

  public SyncSummary(int products, int orders, int orderItems, long syncedAt) {
    this.products = products;
    this.orders = orders;
    this.orderItems = orderItems;
    this.syncedAt = syncedAt;
  }

  public int getProducts() {
    return products;
  }

  public int getOrders() {
    return orders;
  }

  public int getOrderItems() {
    return orderItems;
  }

  /**
   * @return time the sync completed, in milliseconds since the epoch
   */
  public long getSyncedAt() {
    return syncedAt;
  }

  @Override
  public String toString() {
    return "Sync [products=" + products + ", orders=" + orders + ", orderItems=" + orderItems + ']';
  }

}
