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

/**
 * One line of an order: a product and the quantity bought.
 */
public final class OrderItem {

  private final long orderID;
  private final long productID;
  private final int quantity;

  public OrderItem(long orderID, long productID, int quantity) {
    this.orderID = orderID;
    this.productID = productID;
    this.quantity = quantity;
  }

  public long getOrderID() {
    return orderID;
  }

  public long getProductID() {
    return productID;
  }

  public int getQuantity() {
    return quantity;
  }

  @Override
  public String toString() {
    return orderID + ":" + productID + 'x' + quantity;
  }

}
