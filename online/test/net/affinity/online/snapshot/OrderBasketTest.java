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

import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class OrderBasketTest extends AffinityTest {

  @Test
  public void testGroupByOrder() {
    List<OrderBasket> baskets = OrderBasket.groupByOrder(Arrays.asList(
        new OrderItem(20L, 1L, 1),
        new OrderItem(10L, 2L, 3),
        new OrderItem(20L, 3L, 2),
        new OrderItem(10L, 2L, 1),
        new OrderItem(30L, 4L, 1)));
    assertEquals(3, baskets.size());
    assertEquals(10L, baskets.get(0).getOrderID());
    assertEquals(1, baskets.get(0).size());
    assertTrue(baskets.get(0).getProductIDs().contains(2L));
    assertEquals(20L, baskets.get(1).getOrderID());
    assertEquals(2, baskets.get(1).size());
    assertTrue(baskets.get(1).getProductIDs().contains(1L));
    assertTrue(baskets.get(1).getProductIDs().contains(3L));
    assertEquals(30L, baskets.get(2).getOrderID());
  }

  @Test
  public void testEmpty() {
    assertTrue(OrderBasket.groupByOrder(Arrays.<OrderItem>asList()).isEmpty());
  }

  @Test
  public void testProductDefaults() {
    ProductRecord product = new ProductRecord(5L, "  ", " shoes ", null, null, 0);
    assertNull(product.getCategory());
    assertEquals("shoes", product.getBrand());
    assertEquals(0.0, product.getPrice());
    assertEquals(ProductRecord.DEFAULT_RATING, product.getRating());
  }

}
