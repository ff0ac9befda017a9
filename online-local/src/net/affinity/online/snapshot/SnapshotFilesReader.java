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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.affinity.common.LangUtils;
import net.affinity.common.io.IOUtils;

/**
 * Reads and writes the tab-separated files of an analytical snapshot. Empty fields stand for
 * missing values. Blank lines, lines starting with {@code #}, and a header line are skipped;
 * any other line that doesn't parse is logged and skipped, up to a limit.
 */
final class SnapshotFilesReader {

  private static final Logger log = LoggerFactory.getLogger(SnapshotFilesReader.class);

  private static final char DELIMITER = '\t';
  private static final Splitter TAB = Splitter.on(DELIMITER).trimResults();
  private static final CharMatcher UNSAFE = CharMatcher.anyOf("\t\r\n");
  private static final int MAX_BAD_LINES = 100;

  static final String PRODUCTS_HEADER = "id\tcategory\tbrand\tprice\trating\tstock";
  static final String ORDER_ITEMS_HEADER = "order_id\tproduct_id\tquantity";

  private SnapshotFilesReader() {
  }

  static List<ProductRecord> readProducts(File file) throws IOException {
    List<ProductRecord> products = Lists.newArrayList();
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      LineCounter counter = new LineCounter(file);
      String line;
      while ((line = reader.readLine()) != null) {
        if (counter.skip(line)) {
          continue;
        }
        try {
          Iterator<String> it = TAB.split(line).iterator();
          long id = Long.parseLong(it.next());
          String category = it.next();
          String brand = it.next();
          String priceString = it.next();
          Double price = priceString.isEmpty() ? null : LangUtils.parseDouble(priceString);
          String ratingString = it.next();
          Float rating = ratingString.isEmpty() ? null : LangUtils.parseFloat(ratingString);
          String stockString = it.next();
          int stock = stockString.isEmpty() ? 0 : Integer.parseInt(stockString);
          products.add(new ProductRecord(id, category, brand, price, rating, stock));
        } catch (NoSuchElementException nsee) {
          counter.bad(line, nsee);
        } catch (IllegalArgumentException iae) {
          counter.bad(line, iae);
        }
      }
      log.info("Read {} products from {}", products.size(), file);
    } finally {
      reader.close();
    }
    return products;
  }

  static List<OrderItem> readOrderItems(File file) throws IOException {
    List<OrderItem> items = Lists.newArrayList();
    BufferedReader reader = IOUtils.buffer(IOUtils.openReaderMaybeDecompressing(file));
    try {
      LineCounter counter = new LineCounter(file);
      String line;
      while ((line = reader.readLine()) != null) {
        if (counter.skip(line)) {
          continue;
        }
        try {
          Iterator<String> it = TAB.split(line).iterator();
          long orderID = Long.parseLong(it.next());
          long productID = Long.parseLong(it.next());
          int quantity = it.hasNext() ? Integer.parseInt(it.next()) : 1;
          items.add(new OrderItem(orderID, productID, quantity));
        } catch (NoSuchElementException nsee) {
          counter.bad(line, nsee);
        } catch (IllegalArgumentException iae) {
          counter.bad(line, iae);
        }
      }
      log.info("Read {} order items from {}", items.size(), file);
    } finally {
      reader.close();
    }
    return items;
  }

  static void writeProducts(List<ProductRecord> products, File file) throws IOException {
    Writer out = IOUtils.buildGZIPWriter(file);
    try {
      out.write(PRODUCTS_HEADER);
      out.write('\n');
      StringBuilder line = new StringBuilder(64);
      for (ProductRecord product : products) {
        line.setLength(0);
        line.append(product.getID()).append(DELIMITER)
            .append(clean(product.getCategory())).append(DELIMITER)
            .append(clean(product.getBrand())).append(DELIMITER)
            .append(product.getPrice()).append(DELIMITER)
            .append(product.getRating()).append(DELIMITER)
            .append(product.getStock()).append('\n');
        out.append(line);
      }
    } finally {
      out.close();
    }
  }

  static void writeOrderItems(List<OrderItem> items, File file) throws IOException {
    Writer out = IOUtils.buildGZIPWriter(file);
    try {
      out.write(ORDER_ITEMS_HEADER);
      out.write('\n');
      StringBuilder line = new StringBuilder(32);
      for (OrderItem item : items) {
        line.setLength(0);
        line.append(item.getOrderID()).append(DELIMITER)
            .append(item.getProductID()).append(DELIMITER)
            .append(item.getQuantity()).append('\n');
        out.append(line);
      }
    } finally {
      out.close();
    }
  }

  private static String clean(String value) {
    return value == null ? "" : UNSAFE.replaceFrom(value, ' ');
  }

  private static final class LineCounter {

    private final File file;
    private int lines;
    private int badLines;

    private LineCounter(File file) {
      this.file = file;
    }

    boolean skip(String line) {
      lines++;
      if (line.isEmpty() || line.charAt(0) == '#') {
        return true;
      }
      // header
      return lines == 1 && !Character.isDigit(line.charAt(0)) && line.charAt(0) != '-';
    }

    void bad(String line, Exception e) throws IOException {
      badLines++;
      if (badLines > MAX_BAD_LINES) {
        throw new IOException("Too many bad lines in " + file + "; aborting");
      }
      log.warn("Skipping bad line {} of {}: {} ({})", lines, file, line, e.toString());
    }

  }

}
