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

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.mahout.cf.taste.impl.common.FastByIDMap;
import org.apache.mahout.cf.taste.impl.common.FastIDSet;
import org.apache.mahout.cf.taste.impl.common.LongPrimitiveIterator;

/**
 * The distinct products bought together in one order. Quantities don't matter here: a product bought
 * twice in one order appears once.
 */
public final class OrderBasket {

  private final long orderID;
  private final FastIDSet productIDs;

  public OrderBasket(long orderID, FastIDSet productIDs) {
    Preconditions.checkNotNull(productIDs);
    this.orderID = orderID;
    this.productIDs = productIDs;
  }

  public long getOrderID() {
    return orderID;
  }

  /**
   * @return distinct IDs of products in the order; not to be modified
   */
  public FastIDSet getProductIDs() {
    return productIDs;
  }

  public int size() {
    return productIDs.size();
  }

  /**
   * Groups order lines into baskets, one per order ID.
   *
   * @param items order lines, in any order
   * @return baskets, ordered by order ID
   */
  public static List<OrderBasket> groupByOrder(Iterable<OrderItem> items) {
    FastByIDMap<FastIDSet> byOrder = new FastByIDMap<FastIDSet>();
    for (OrderItem item : items) {
      FastIDSet products = byOrder.get(item.getOrderID());
      if (products == null) {
        products = new FastIDSet();
        byOrder.put(item.getOrderID(), products);
      }
      products.add(item.getProductID());
    }
    long[] orderIDs = new long[byOrder.size()];
    int i = 0;
    LongPrimitiveIterator it = byOrder.keySetIterator();
    while (it.hasNext()) {
      orderIDs[i++] = it.nextLong();
    }
    Arrays.sort(orderIDs);
    List<OrderBasket> baskets = Lists.newArrayListWithCapacity(orderIDs.length);
    for (long orderID : orderIDs) {
      baskets.add(new OrderBasket(orderID, byOrder.get(orderID)));
    }
    return baskets;
  }

  @Override
  public String toString() {
    return "OrderBasket[" + orderID + ':' + productIDs + ']';
  }

}
