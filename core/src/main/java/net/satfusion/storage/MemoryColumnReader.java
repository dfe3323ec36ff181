// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.storage;

import java.io.IOException;
import java.util.Map;

import com.google.common.collect.Maps;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;

/**
 * Serves product columns from datasets held in memory, keyed by product
 * identifier. Variables registered as constant are stored with a single 
 * row and reported as not record varying.
 * 
 * @since 1.0
 */
public class MemoryColumnReader implements ColumnReader {
  
  /** The record varying data by product identifier. */
  private final Map<String, Dataset> data = Maps.newConcurrentMap();
  
  /** Single row columns by product identifier. */
  private final Map<String, Map<String, Column>> constants = 
      Maps.newConcurrentMap();
  
  /**
   * Stores the data of a product, dropping its constants.
   * @param product The non-null product identifier.
   * @param dataset The non-null, record varying data.
   * @return The reader for chaining.
   */
  public MemoryColumnReader put(final String product, final Dataset dataset) {
    if (product == null) {
      throw new IllegalArgumentException("Product cannot be null.");
    }
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    data.put(product, dataset);
    constants.remove(product);
    return this;
  }
  
  /**
   * Stores a variable that is constant over the product.
   * @param product The non-null product identifier, stored first with
   * {@link #put(String, Dataset)}.
   * @param variable The non-null variable name.
   * @param value A single row column.
   * @return The reader for chaining.
   */
  public MemoryColumnReader putConstant(final String product, 
                                        final String variable, 
                                        final Column value) {
    if (variable == null) {
      throw new IllegalArgumentException("Variable cannot be null.");
    }
    if (value == null || value.rows() != 1) {
      throw new IllegalArgumentException("Constant must have a single row.");
    }
    if (!data.containsKey(product)) {
      throw new IllegalArgumentException("No data for product " + product);
    }
    Map<String, Column> values = constants.get(product);
    if (values == null) {
      values = Maps.newConcurrentMap();
      constants.put(product, values);
    }
    values.put(variable, value);
    return this;
  }
  
  @Override
  public int rowCount(final Product product) throws IOException {
    return dataset(product).length();
  }
  
  @Override
  public boolean contains(final Product product, final String variable) 
      throws IOException {
    return dataset(product).contains(variable) 
        || constant(product, variable) != null;
  }
  
  @Override
  public boolean isRecordVarying(final Product product, 
                                 final String variable) throws IOException {
    return constant(product, variable) == null;
  }
  
  @Override
  public Column read(final Product product, 
                     final String variable, 
                     final int from, 
                     final int to) throws IOException {
    Column column = constant(product, variable);
    if (column == null) {
      column = dataset(product).get(variable);
    }
    if (column == null) {
      throw new IOException("Variable " + variable + " not found in " 
          + product.getIdentifier());
    }
    if (from < 0 || to > column.rows() || from > to) {
      throw new IOException("Invalid range [" + from + ", " + to 
          + ") of " + variable + " in " + product.getIdentifier());
    }
    return column.slice(from, to);
  }
  
  private Column constant(final Product product, final String variable) {
    final Map<String, Column> values = constants.get(
        product.getIdentifier());
    return values == null ? null : values.get(variable);
  }
  
  private Dataset dataset(final Product product) throws IOException {
    final Dataset dataset = data.get(product.getIdentifier());
    if (dataset == null) {
      throw new IOException("No data for product " 
          + product.getIdentifier());
    }
    return dataset;
  }
}
