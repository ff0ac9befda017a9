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
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import javax.sql.DataSource;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TransactionalStore} that reads the {@code products} and {@code orderitem} tables of a
 * relational database through a {@link DataSource}. Nothing is ever written.
 *
 * @since 1.0
 */
public final class JdbcTransactionalStore implements TransactionalStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcTransactionalStore.class);

  static final String PRODUCTS_QUERY = "SELECT id, category, brand, price, rating, stock FROM products";
  static final String ORDER_ITEMS_QUERY = "SELECT order_id, product_id, quantity FROM orderitem";
  static final int REACHABILITY_TIMEOUT_SEC = 5;

  private final DataSource dataSource;

  public JdbcTransactionalStore(DataSource dataSource) {
    Preconditions.checkNotNull(dataSource);
    this.dataSource = dataSource;
  }

  @Override
  public List<ProductRecord> readProducts() throws IOException {
    List<ProductRecord> products = Lists.newArrayList();
    try {
      Connection connection = dataSource.getConnection();
      try {
        Statement statement = connection.createStatement();
        try {
          ResultSet rs = statement.executeQuery(PRODUCTS_QUERY);
          try {
            while (rs.next()) {
              long id = rs.getLong(1);
              String category = rs.getString(2);
              String brand = rs.getString(3);
              double price = rs.getDouble(4);
              Double maybePrice = rs.wasNull() ? null : price;
              float rating = rs.getFloat(5);
              Float maybeRating = rs.wasNull() ? null : rating;
              int stock = rs.getInt(6);
              products.add(new ProductRecord(id, category, brand, maybePrice, maybeRating, stock));
            }
          } finally {
            rs.close();
          }
        } finally {
          statement.close();
        }
      } finally {
        connection.close();
      }
    } catch (SQLException sqle) {
      throw new IOException("Could not read products", sqle);
    }
    log.info("Read {} products", products.size());
    return products;
  }

  @Override
  public List<OrderItem> readOrderItems() throws IOException {
    List<OrderItem> items = Lists.newArrayList();
    try {
      Connection connection = dataSource.getConnection();
      try {
        Statement statement = connection.createStatement();
        try {
          ResultSet rs = statement.executeQuery(ORDER_ITEMS_QUERY);
          try {
            while (rs.next()) {
              long orderID = rs.getLong(1);
              boolean noOrder = rs.wasNull();
              long productID = rs.getLong(2);
              if (noOrder || rs.wasNull()) {
                continue;
              }
              items.add(new OrderItem(orderID, productID, rs.getInt(3)));
            }
          } finally {
            rs.close();
          }
        } finally {
          statement.close();
        }
      } finally {
        connection.close();
      }
    } catch (SQLException sqle) {
      throw new IOException("Could not read order items", sqle);
    }
    log.info("Read {} order items", items.size());
    return items;
  }

  @Override
  public void checkReachable() throws IOException {
    try {
      Connection connection = dataSource.getConnection();
      try {
        if (!connection.isValid(REACHABILITY_TIMEOUT_SEC)) {
          throw new IOException("No answer within " + REACHABILITY_TIMEOUT_SEC + "s");
        }
      } finally {
        connection.close();
      }
    } catch (SQLException sqle) {
      log.warn("Database unreachable: {}", sqle.toString());
      throw new IOException(sqle.getMessage(), sqle);
    }
  }

}
