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
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.affinity.common.AffinityTest;

public final class JdbcTransactionalStoreTest extends AffinityTest {

  private JdbcDataSource dataSource;
  private Connection keepAlive;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + JdbcTransactionalStoreTest.class.getSimpleName() + System.nanoTime());
    // in-memory database lives as long as one connection is open
    keepAlive = dataSource.getConnection();
    Statement statement = keepAlive.createStatement();
    try {
      statement.execute("CREATE TABLE products (id INT PRIMARY KEY, name VARCHAR(255), price DECIMAL(10,2), " +
                        "brand VARCHAR(255), category VARCHAR(255), rating DECIMAL(3,2), stock INT)");
      statement.execute("CREATE TABLE orderitem (id INT PRIMARY KEY, order_id INT, product_id INT, quantity INT)");
      statement.execute("INSERT INTO products VALUES (1, 'Runner', 99.50, 'acme', 'shoes', 4.50, 10)");
      statement.execute("INSERT INTO products VALUES (2, 'Cap', NULL, NULL, 'hats', NULL, 0)");
      statement.execute("INSERT INTO orderitem VALUES (1, 100, 1, 2)");
      statement.execute("INSERT INTO orderitem VALUES (2, 100, 2, 1)");
      statement.execute("INSERT INTO orderitem VALUES (3, 101, 1, 1)");
      statement.execute("INSERT INTO orderitem VALUES (4, NULL, 2, 1)");
    } finally {
      statement.close();
    }
  }

  @Override
  @After
  public void tearDown() throws Exception {
    keepAlive.close();
    super.tearDown();
  }

  @Test
  public void testReadProducts() throws IOException {
    List<ProductRecord> products = new JdbcTransactionalStore(dataSource).readProducts();
    assertEquals(2, products.size());
    ProductRecord first = products.get(0).getID() == 1L ? products.get(0) : products.get(1);
    ProductRecord second = first == products.get(0) ? products.get(1) : products.get(0);
    assertEquals("shoes", first.getCategory());
    assertEquals("acme", first.getBrand());
    assertEquals(99.5, first.getPrice());
    assertEquals(4.5f, first.getRating());
    assertEquals(10, first.getStock());
    assertEquals("hats", second.getCategory());
    assertNull(second.getBrand());
    assertEquals(0.0, second.getPrice());
    assertEquals(ProductRecord.DEFAULT_RATING, second.getRating());
  }

  @Test
  public void testReadOrderItems() throws IOException {
    List<OrderItem> items = new JdbcTransactionalStore(dataSource).readOrderItems();
    // the line with no order is skipped
    assertEquals(3, items.size());
    List<OrderBasket> baskets = OrderBasket.groupByOrder(items);
    assertEquals(2, baskets.size());
    assertEquals(2, baskets.get(0).size());
  }

  @Test(expected = IOException.class)
  public void testMissingTable() throws Exception {
    Statement statement = keepAlive.createStatement();
    try {
      statement.execute("DROP TABLE orderitem");
    } catch (SQLException sqle) {
      fail(sqle.getMessage());
    } finally {
      statement.close();
    }
    new JdbcTransactionalStore(dataSource).readOrderItems();
  }

  @Test
  public void testReachable() throws IOException {
    new JdbcTransactionalStore(dataSource).checkReachable();
  }

  @Test
  public void testUnreachable() {
    DataSource refusing = (DataSource) Proxy.newProxyInstance(
        JdbcTransactionalStoreTest.class.getClassLoader(),
        new Class<?>[] { DataSource.class },
        new InvocationHandler() {
          @Override
          public Object invoke(Object proxy, Method method, Object[] args) throws SQLException {
            throw new SQLException("Connection refused");
          }
        });
    try {
      new JdbcTransactionalStore(refusing).checkReachable();
      fail();
    } catch (IOException ioe) {
      assertEquals("Connection refused", ioe.getMessage());
      assertTrue(ioe.getCause() instanceof SQLException);
    }
  }

}
