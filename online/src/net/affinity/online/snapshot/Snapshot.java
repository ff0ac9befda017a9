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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A consistent catalog and order history, read from one analytical snapshot, that a training run
 * works from.
 */
public final class Snapshot {

  private final List<ProductRecord> products;
  private final List<OrderBasket> baskets;
  private final long createdAt;

  public Snapshot(List<ProductRecord> products, List<OrderBasket> baskets, long createdAt) {
    Preconditions.checkNotNull(products);
    Preconditions.checkNotNull(baskets);
    this.products = Collections.unmodifiableList(products);
    this.baskets = Collections.unmodifiableList(baskets);
    this.createdAt = createdAt;
  }

  public List<ProductRecord> getProducts() {
    return products;
  }

  public List<OrderBasket> getBaskets() {
    return baskets;
  }

  /**
   * @return time the snapshot was written, in milliseconds since the epoch
   */
  public long getCreatedAt() {
    return createdAt;
  }

}
