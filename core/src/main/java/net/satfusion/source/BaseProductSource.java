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
package net.satfusion.source;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import net.satfusion.data.Record;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Shared code of the product sources. The repository lists products with an
 * inclusive end time which is converted to an exclusive record end by adding
 * the {@link #TIME_PRECISION}.
 * 
 * @since 1.0
 */
public abstract class BaseProductSource implements ProductSource {

  /** The time precision of the product end times in milliseconds. */
  public static final long TIME_PRECISION = 1;
  
  /** The repository. */
  protected final RecordRepository repository;
  
  /** The collections in priority order. */
  protected final List<String> collections;
  
  /** The product type parameters. */
  protected final ProductTypeParameters parameters;
  
  /** The identifier. */
  protected final String identifier;
  
  /**
   * Default ctor.
   * @param repository A non-null repository.
   * @param collections A non-null and non-empty list of collections.
   * @param parameters Optional parameters, the defaults when null.
   */
  protected BaseProductSource(final RecordRepository repository, 
                              final List<String> collections,
                              final ProductTypeParameters parameters) {
    if (repository == null) {
      throw new IllegalArgumentException("Repository cannot be null.");
    }
    if (collections == null || collections.isEmpty()) {
      throw new IllegalArgumentException("Collections cannot be null or "
          + "empty.");
    }
    for (final String collection : collections) {
      if (collection == null || collection.isEmpty()) {
        throw new IllegalArgumentException("Collection identifiers cannot "
            + "be null or empty.");
      }
    }
    this.repository = repository;
    this.collections = ImmutableList.copyOf(collections);
    this.parameters = parameters == null 
        ? ProductTypeParameters.DEFAULT : parameters;
    identifier = Joiner.on('+').join(collections);
  }
  
  @Override
  public String identifier() {
    return identifier;
  }
  
  @Override
  public List<String> collections() {
    return collections;
  }
  
  @Override
  public ProductTypeParameters parameters() {
    return parameters;
  }
  
  @Override
  public int countRecords(final long start, 
                          final long end, 
                          final long tolerance) {
    final Iterator<Record<Product>> iterator = 
        iterRecords(start, end, tolerance);
    int count = 0;
    while (iterator.hasNext()) {
      iterator.next();
      count++;
    }
    return count;
  }
  
  @Override
  public Product sampleRecord() {
    for (final String collection : collections) {
      final Product product = repository.sampleOne(collection);
      if (product != null) {
        return product;
      }
    }
    return null;
  }
  
  /**
   * @param index The priority index.
   * @param product A non-null product.
   * @return The half-open record spanning the product.
   */
  protected static Record<Product> toRecord(final int index, 
                                            final Product product) {
    return new Record<Product>(index, product.getBegin(), 
        product.getEnd() + TIME_PRECISION, product);
  }
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + identifier + "}";
  }
}
