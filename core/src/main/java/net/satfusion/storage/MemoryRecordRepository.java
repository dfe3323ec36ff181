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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A simple thread safe repository holding the products in memory. It's 
 * meant for testing pipelines and for small deployments.
 * 
 * @since 1.0
 */
public class MemoryRecordRepository implements RecordRepository {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryRecordRepository.class);
  
  /** Orders by begin time, then identifier. */
  private static final Comparator<Product> BY_BEGIN = 
      new Comparator<Product>() {
    @Override
    public int compare(final Product a, final Product b) {
      final int cmp = Long.compare(a.getBegin(), b.getBegin());
      return cmp != 0 ? cmp : a.getIdentifier().compareTo(b.getIdentifier());
    }
  };
  
  /** The products by collection, each list ordered by begin time. */
  private final Map<String, List<Product>> collections = 
      Maps.newConcurrentMap();
  
  /**
   * Registers a product, replacing one with the same identifier.
   * @param product The non-null product.
   * @return The repository for chaining.
   */
  public MemoryRecordRepository add(final Product product) {
    if (product == null) {
      throw new IllegalArgumentException("Product cannot be null.");
    }
    synchronized (collections) {
      List<Product> products = collections.get(product.getCollection());
      if (products == null) {
        products = Lists.newArrayList();
        collections.put(product.getCollection(), products);
      }
      for (int i = 0; i < products.size(); i++) {
        if (products.get(i).getIdentifier().equals(
            product.getIdentifier())) {
          products.remove(i);
          break;
        }
      }
      products.add(product);
      Collections.sort(products, BY_BEGIN);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Added product " + product);
    }
    return this;
  }
  
  /**
   * Removes a product.
   * @param collection The collection.
   * @param identifier The product identifier.
   * @return True if the product was found and removed.
   */
  public boolean remove(final String collection, final String identifier) {
    synchronized (collections) {
      final List<Product> products = collections.get(collection);
      if (products == null) {
        return false;
      }
      for (int i = 0; i < products.size(); i++) {
        if (products.get(i).getIdentifier().equals(identifier)) {
          products.remove(i);
          return true;
        }
      }
      return false;
    }
  }
  
  @Override
  public List<Product> list(final String collection, 
                            final long start, 
                            final long end, 
                            final long tolerance) {
    if (tolerance < 0) {
      throw new IllegalArgumentException("Tolerance cannot be negative.");
    }
    final List<Product> matches = Lists.newArrayList();
    for (final Product product : listAll(collection)) {
      if (product.getBegin() < end + tolerance 
          && product.getEnd() >= start - tolerance) {
        matches.add(product);
      }
    }
    return matches;
  }
  
  @Override
  public List<Product> listAll(final String collection) {
    if (collection == null) {
      throw new IllegalArgumentException("Collection cannot be null.");
    }
    synchronized (collections) {
      final List<Product> products = collections.get(collection);
      return products == null 
          ? ImmutableList.<Product>of() : ImmutableList.copyOf(products);
    }
  }
  
  @Override
  public Product sampleOne(final String collection) {
    final List<Product> products = listAll(collection);
    return products.isEmpty() ? null : products.get(0);
  }
}
