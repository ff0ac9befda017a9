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

import java.io.Serializable;

/**
 * One product of the catalog, as copied into the analytical snapshot. Category and brand may be
 * {@code null}; a missing price reads as 0 and a missing rating as {@link #DEFAULT_RATING}.
 *
 * @since 1.0
 */
public final class ProductRecord implements Serializable {

  public static final float DEFAULT_RATING = 3.0f;

  private final long id;
  private final String category;
  private final String brand;
  private final double price;
  private final float rating;
  private final int stock;

  public ProductRecord(long id, String category, String brand, Double price, Float rating, int stock) {
    this.id = id;
    this.category = emptyToNull(category);
    this.brand = emptyToNull(brand);
    this.price = price == null ? 0.0 : price;
    this.rating = rating == null ? DEFAULT_RATING : rating;
    this.stock = stock;
  }

  private static String emptyToNull(String s) {
    if (s == null) {
      return null;
    }
    String trimmed = s.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  public long getID() {
    return id;
  }

  public String getCategory() {
    return category;
  }

  public String getBrand() {
    return brand;
  }

  public double getPrice() {
    return price;
  }

  public float getRating() {
    return rating;
  }

  public int getStock() {
    return stock;
  }

  @Override
  public String toString() {
    return "ProductRecord[" + id + ':' + category + ':' + brand + ':' + price + ':' + rating + ']';
  }

}
