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
import java.util.List;

/**
 * Read-only access to the transactional store that owns the catalog and order history.
 */
public interface TransactionalStore {

  /**
   * @return every product in the catalog
   * @throws IOException if the store can't be read
   */
  List<ProductRecord> readProducts() throws IOException;

  /**
   * @return every order line
   * @throws IOException if the store can't be read
   */
  List<OrderItem> readOrderItems() throws IOException;

  /**
   * Checks that the store answers at all, without reading any data.
   *
   * @throws IOException if the store can't be reached, with a message describing why
   */
  void checkReachable() throws IOException;

}
